package com.example.storyboard_matcher.service;

/**
 * What a wholesale candidate replacement did to the scene's selection.
 *
 * @param candidateCount      size of the new candidate list.
 * @param selectedCandidateId active selection after the replacement, may be {@code null}.
 * @param autoSelected        true when the best candidate was selected because nothing was selected before.
 * @param danglingSelectionId previous selection id that no longer names a candidate, or {@code null}.
 */
public record ReplaceOutcome(int candidateCount,
                             String selectedCandidateId,
                             boolean autoSelected,
                             String danglingSelectionId) {

    public boolean isDangling() {
        return danglingSelectionId != null;
    }
}
