package com.example.storyboard_matcher.repository;

import com.example.storyboard_matcher.model.StoryboardEvent;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.UUID;

public interface StoryboardEventRepository extends JpaRepository<StoryboardEvent, UUID> {
    List<StoryboardEvent> findBySessionIdOrderByCreatedAtAsc(String sessionId);
}
