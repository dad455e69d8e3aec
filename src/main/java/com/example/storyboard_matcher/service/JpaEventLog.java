package com.example.storyboard_matcher.service;

import com.example.storyboard_matcher.exception.MatcherException;
import com.example.storyboard_matcher.model.StoryboardEvent;
import com.example.storyboard_matcher.repository.StoryboardEventRepository;
import com.example.storyboard_matcher.service.Interfaces.EventLog;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Map;

@Service
public class JpaEventLog implements EventLog {
    private static final Logger LOGGER = LoggerFactory.getLogger(JpaEventLog.class);

    private final StoryboardEventRepository eventRepo;
    private final ObjectMapper objectMapper;

    public JpaEventLog(StoryboardEventRepository eventRepo, ObjectMapper objectMapper) {
        this.eventRepo = eventRepo;
        this.objectMapper = objectMapper;
    }

    @Override
    @Transactional
    public void append(String sessionId, String type, Map<String, Object> payload) {
        String json;
        try {
            json = payload == null ? null : objectMapper.writeValueAsString(payload);
        } catch (JsonProcessingException e) {
            throw new MatcherException("Event payload could not be serialized: " + type, e);
        }
        eventRepo.save(new StoryboardEvent(sessionId, type, json));
        LOGGER.debug("Event appended session={} type={}", sessionId, type);
    }

    @Override
    @Transactional(readOnly = true)
    public List<StoryboardEvent> list(String sessionId) {
        return eventRepo.findBySessionIdOrderByCreatedAtAsc(sessionId);
    }
}
