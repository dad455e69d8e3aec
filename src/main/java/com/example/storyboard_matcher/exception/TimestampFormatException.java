package com.example.storyboard_matcher.exception;

public class TimestampFormatException extends IllegalArgumentException {
    public TimestampFormatException(String message) {
        super(message);
    }
}
