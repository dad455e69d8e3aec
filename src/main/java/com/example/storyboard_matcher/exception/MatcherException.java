package com.example.storyboard_matcher.exception;

/**
 * Base type for failures raised by the matching engine and the candidate state machine.
 */
public class MatcherException extends RuntimeException {
    public MatcherException(String message) {
        super(message);
    }

    public MatcherException(String message, Throwable cause) {
        super(message, cause);
    }
}
