package com.example.storyboard_matcher.engine.Interfaces;

import com.example.storyboard_matcher.exception.AnalysisServiceException;
import com.example.storyboard_matcher.model.AnalysisWindow;

import java.util.Map;

/**
 * Multimodal model that inspects footage and answers with JSON shaped by a response schema.
 */
public interface VisualAnalysisClient {

    /**
     * @throws AnalysisServiceException when the call fails, times out or returns no text.
     */
    Reply propose(Request request);

    enum Stage {
        /** Single-stage matching against a whole video or a caller window. */
        SINGLE,
        /** Text-only shortlist over the scene index. */
        SHORTLIST,
        /** Deep analysis of one shortlisted window. */
        DEEP
    }

    /**
     * @param stage          pipeline stage, selects the model.
     * @param label          correlation label for logs, e.g. {@code scene_1:vid_a}.
     * @param media          prepared video, {@code null} for text-only requests.
     * @param window         optional sub-span of the video to look at.
     * @param brief          natural-language instructions.
     * @param responseSchema JSON schema the reply must follow.
     */
    record Request(Stage stage,
                   String label,
                   MediaResourcePreparer.MediaHandle media,
                   AnalysisWindow window,
                   String brief,
                   Map<String, Object> responseSchema) {}

    /**
     * @param text         raw JSON text produced by the model.
     * @param promptTokens input token count, if reported.
     * @param outputTokens output token count, if reported.
     */
    record Reply(String text, Integer promptTokens, Integer outputTokens) {}
}
