package com.example.storyboard_matcher.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum ChangeSource {
    USER,
    AGENT;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static ChangeSource fromWire(String value) {
        return ChangeSource.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
