package com.example.storyboard_matcher.util;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;

/**
 * Small helpers for user-facing messages and brief text.
 */
public final class MessageText {

    private MessageText() {
    }

    /**
     * Removes blank and repeated messages, keeping first-seen order.
     */
    public static List<String> dedupe(Collection<String> messages) {
        LinkedHashSet<String> seen = new LinkedHashSet<>();
        for (String message : messages) {
            if (message == null) continue;
            String trimmed = message.trim();
            if (!trimmed.isEmpty()) seen.add(trimmed);
        }
        return new ArrayList<>(seen);
    }

    /**
     * Collapses whitespace runs to single spaces and truncates to {@code maxChars} with a trailing ellipsis.
     */
    public static String clean(Object value, int maxChars) {
        if (value == null) return "";
        String text = String.valueOf(value).trim().replaceAll("\\s+", " ");
        if (text.isEmpty()) return "";
        if (text.length() <= maxChars) return text;
        if (maxChars <= 3) return text.substring(0, maxChars);
        return text.substring(0, maxChars - 3).stripTrailing() + "...";
    }

    public static String truncate(String body, int max) {
        if (body == null) return "";
        if (body.length() <= max) return body;
        return body.substring(0, max) + "...";
    }
}
