package com.example.storyboard_matcher.exception;

/**
 * A media resource could not be made available to the analysis service.
 */
public class PreparationException extends MatcherException {
    public PreparationException(String message) {
        super(message);
    }

    public PreparationException(String message, Throwable cause) {
        super(message, cause);
    }
}
