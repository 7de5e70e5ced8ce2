package com.planforge.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.io.Serializable;

/**
 * Free-form description of what the session should achieve.
 */
public record Objective(String value) implements Serializable {

    public Objective {
        value = value == null ? "" : value.trim();
    }

    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public static Objective of(String value) {
        return new Objective(value);
    }

    @JsonValue
    @Override
    public String toString() {
        return value;
    }
}
