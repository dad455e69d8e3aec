package com.example.storyboard_matcher.exception;

/**
 * Thrown when a scene is not in a state that allows the requested operation,
 * for example trimming without an active selection.
 */
public class InvalidStateException extends MatcherException {
    public InvalidStateException(String message) {
        super(message);
    }
}
