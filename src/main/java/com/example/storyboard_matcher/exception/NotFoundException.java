package com.example.storyboard_matcher.exception;

public class NotFoundException extends MatcherException {
    public NotFoundException(String message) {
        super(message);
    }
}
