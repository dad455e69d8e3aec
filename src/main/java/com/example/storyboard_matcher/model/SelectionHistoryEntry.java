package com.example.storyboard_matcher.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.time.Instant;

/**
 * A candidate that used to be the active selection of a scene.
 *
 * @param entryId     history entry id ({@code hist_xxxxxxxx}).
 * @param candidateId candidate that was replaced.
 * @param changedAt   when the replacement happened.
 * @param changedBy   who replaced it.
 * @param reason      free text supplied with the change.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record SelectionHistoryEntry(String entryId,
                                    String candidateId,
                                    Instant changedAt,
                                    ChangeSource changedBy,
                                    String reason) {
}
