package com.example.storyboard_matcher.service;

import com.example.storyboard_matcher.config.MatcherProperties;
import com.example.storyboard_matcher.exception.NotFoundException;
import com.example.storyboard_matcher.model.ChangeSource;
import com.example.storyboard_matcher.model.MatchedScene;
import com.example.storyboard_matcher.model.Scene;
import com.example.storyboard_matcher.model.SceneCandidate;
import com.example.storyboard_matcher.model.StoryboardEvent;
import com.example.storyboard_matcher.model.VoiceOver;
import com.example.storyboard_matcher.service.Interfaces.EventLog;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Import;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DataJpaTest
@Import({JpaStoryboardStore.class, JpaEventLog.class, CandidateSelectionService.class, JpaStoryboardStoreTest.StoreTestConfig.class})
class JpaStoryboardStoreTest {

    @TestConfiguration
    static class StoreTestConfig {
        @Bean
        ObjectMapper objectMapper() {
            return new ObjectMapper()
                    .registerModule(new JavaTimeModule())
                    .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        }

        @Bean
        MatcherProperties matcherProperties() {
            return new MatcherProperties();
        }

        @Bean
        Clock clock() {
            return Clock.fixed(Instant.parse("2026-01-05T10:00:00Z"), ZoneOffset.UTC);
        }
    }

    @Autowired
    private JpaStoryboardStore store;

    @Autowired
    private JpaEventLog eventLog;

    @Autowired
    private CandidateSelectionService selectionService;

    @Test
    void savedSelectionStateSurvivesReload() {
        Scene scene = new Scene("scene_1", "Intro", "Hook", "Meet the dashboard", true);
        scene.setVoiceOver(new VoiceOver("Meet the dashboard", 7.5));
        store.create("sess_1", "tenant_a", List.of(scene));

        List<Scene> loaded = store.load("sess_1");
        Scene working = loaded.get(0);
        selectionService.replaceCandidates(working, new ArrayList<>(List.of(
                new SceneCandidate("c1", "vid_a", 1, 9, 1),
                new SceneCandidate("c2", "vid_b", 4, 11, 2))), true);
        selectionService.select(working, "c2", ChangeSource.USER, "closer framing");
        store.save("sess_1", loaded);

        Scene reloaded = store.load("sess_1").get(0);
        assertThat(store.tenantOf("sess_1")).isEqualTo("tenant_a");
        assertThat(reloaded.getVoiceOverDuration()).contains(7.5);
        assertThat(reloaded.getSelectedCandidateId()).isEqualTo("c2");
        assertThat(reloaded.getMatchedScene()).isEqualTo(new MatchedScene("vid_b", 4, 11, "", false));
        assertThat(reloaded.getSelectionHistory()).singleElement().satisfies(entry -> {
            assertThat(entry.candidateId()).isEqualTo("c1");
            assertThat(entry.changedBy()).isEqualTo(ChangeSource.USER);
            assertThat(entry.changedAt()).isEqualTo(Instant.parse("2026-01-05T10:00:00Z"));
        });
    }

    @Test
    void loadRepairsStaleProjection() {
        Scene scene = new Scene("scene_1", "Intro", "", "", true);
        SceneCandidate candidate = new SceneCandidate("c1", "vid_a", 1, 9, 1);
        scene.setCandidates(List.of(candidate));
        scene.setSelectedCandidateId("c1");
        scene.setMatchedScene(new MatchedScene("vid_old", 0, 3, "", false));
        store.create("sess_2", "tenant_a", List.of(scene));

        assertThat(store.load("sess_2").get(0).getMatchedScene().sourceVideoId()).isEqualTo("vid_a");
    }

    @Test
    void unknownAndDuplicateSessions() {
        store.create("sess_3", null, List.of());

        assertThatThrownBy(() -> store.load("missing"))
                .isInstanceOf(NotFoundException.class)
                .hasMessage("Storyboard session not found: missing");
        assertThatThrownBy(() -> store.create("sess_3", null, List.of()))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void eventsAreListedPerSession() {
        eventLog.append("sess_4", EventLog.SELECTION_CHANGED, Map.of("scene_id", "scene_1", "candidate_id", "c2"));
        eventLog.append("sess_4", EventLog.MATCHING_COMPLETE, Map.of("version", "v1"));
        eventLog.append("sess_other", EventLog.MATCHING_COMPLETE, Map.of("version", "v2"));

        List<StoryboardEvent> events = eventLog.list("sess_4");

        assertThat(events).extracting(StoryboardEvent::getType)
                .containsExactlyInAnyOrder(EventLog.SELECTION_CHANGED, EventLog.MATCHING_COMPLETE);
        assertThat(events).filteredOn(e -> e.getType().equals(EventLog.SELECTION_CHANGED))
                .singleElement()
                .satisfies(e -> assertThat(e.getPayload()).contains("\"candidate_id\":\"c2\""));
    }
}
