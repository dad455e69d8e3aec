package com.example.storyboard_matcher.matcher;

import com.example.storyboard_matcher.dto.MatchError;

import java.util.List;
import java.util.Map;

/**
 * Output of request validation: the jobs to run plus per-request failures and warnings.
 *
 * @param jobs       flat scene x video job list, in request order.
 * @param errors     request-scoped failures.
 * @param warnings   soft issues keyed by scene id.
 * @param sceneOrder scene ids in request order, duplicates removed.
 */
public record JobPlan(List<MatchJob> jobs,
                      List<MatchError> errors,
                      Map<String, List<String>> warnings,
                      List<String> sceneOrder) {
}
