package com.planforge.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.io.Serializable;
import java.nio.file.Path;

/**
 * Location of the plan document produced by the planning agent.
 */
public record PlanPath(String value) implements Serializable {

    public PlanPath {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("PlanPath must not be blank");
        }
    }

    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public static PlanPath of(String value) {
        return new PlanPath(value);
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
