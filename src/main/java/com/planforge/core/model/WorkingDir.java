package com.planforge.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.io.Serializable;
import java.nio.file.Path;

/**
 * Directory the agents operate in.
 */
public record WorkingDir(String value) implements Serializable {

    public WorkingDir {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("WorkingDir must not be blank");
        }
    }

    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public static WorkingDir of(String value) {
        return new WorkingDir(value);
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
