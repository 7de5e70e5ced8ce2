package com.planforge.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.io.Serializable;
import java.nio.file.Path;

/**
 * Location of a reviewer feedback document.
 */
public record FeedbackPath(String value) implements Serializable {

    public FeedbackPath {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("FeedbackPath must not be blank");
        }
    }

    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public static FeedbackPath of(String value) {
        return new FeedbackPath(value);
    }

    public Path asPath() {
        return Path.of(value);
    }

    @JsonValue
    @Override
    public String toString() {
        return value;
    }
}
