package com.example.storyboard_matcher.service;

import com.example.storyboard_matcher.exception.MatcherException;
import com.example.storyboard_matcher.exception.NotFoundException;
import com.example.storyboard_matcher.model.Scene;
import com.example.storyboard_matcher.model.StoryboardSessionRecord;
import com.example.storyboard_matcher.repository.StoryboardSessionRepository;
import com.example.storyboard_matcher.service.Interfaces.StoryboardStore;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

@Service
public class JpaStoryboardStore implements StoryboardStore {
    private static final Logger LOGGER = LoggerFactory.getLogger(JpaStoryboardStore.class);
    private static final TypeReference<List<Scene>> SCENES = new TypeReference<>() {};

    private final StoryboardSessionRepository sessionRepo;
    private final CandidateSelectionService selectionService;
    private final ObjectMapper objectMapper;

    public JpaStoryboardStore(StoryboardSessionRepository sessionRepo,
                              CandidateSelectionService selectionService,
                              ObjectMapper objectMapper) {
        this.sessionRepo = sessionRepo;
        this.selectionService = selectionService;
        this.objectMapper = objectMapper;
    }

    @Override
    @Transactional(readOnly = true)
    public List<Scene> load(String sessionId) {
        StoryboardSessionRecord record = find(sessionId);
        List<Scene> scenes = read(sessionId, record.getScenesJson());
        scenes.forEach(selectionService::enforceInvariants);
        return scenes;
    }

    @Override
    @Transactional
    public void save(String sessionId, List<Scene> scenes) {
        StoryboardSessionRecord record = find(sessionId);
        record.setScenesJson(write(sessionId, scenes));
        sessionRepo.save(record);
        LOGGER.debug("Storyboard saved session={} scenes={} version={}", sessionId, scenes.size(), record.getVersion());
    }

    @Override
    @Transactional
    public void create(String sessionId, String tenantId, List<Scene> scenes) {
        if (sessionRepo.existsById(sessionId)) {
            throw new IllegalArgumentException("Storyboard session already exists: " + sessionId);
        }
        sessionRepo.save(new StoryboardSessionRecord(sessionId, tenantId, write(sessionId, scenes)));
        LOGGER.info("Storyboard created session={} tenant={} scenes={}", sessionId, tenantId, scenes.size());
    }

    @Override
    @Transactional(readOnly = true)
    public String tenantOf(String sessionId) {
        return find(sessionId).getTenantId();
    }

    private StoryboardSessionRecord find(String sessionId) {
        return sessionRepo.findById(sessionId)
                .orElseThrow(() -> new NotFoundException("Storyboard session not found: " + sessionId));
    }

    private List<Scene> read(String sessionId, String json) {
        try {
            return objectMapper.readValue(json, SCENES);
        } catch (JsonProcessingException e) {
            throw new MatcherException("Stored scenes of session " + sessionId + " are unreadable", e);
        }
    }

    private String write(String sessionId, List<Scene> scenes) {
        try {
            return objectMapper.writeValueAsString(scenes);
        } catch (JsonProcessingException e) {
            throw new MatcherException("Scenes of session " + sessionId + " could not be serialized", e);
        }
    }
}
