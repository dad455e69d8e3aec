package com.example.storyboard_matcher.repository;

import com.example.storyboard_matcher.model.StoryboardSessionRecord;
import org.springframework.data.jpa.repository.JpaRepository;

public interface StoryboardSessionRepository extends JpaRepository<StoryboardSessionRecord, String> {
}
