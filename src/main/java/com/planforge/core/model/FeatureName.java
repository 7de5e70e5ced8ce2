package com.planforge.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.io.Serializable;

/**
 * Name of the feature being planned, also used for plan file naming.
 */
public record FeatureName(String value) implements Serializable {

    public FeatureName {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("FeatureName must not be blank");
        }
    }

    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public static FeatureName of(String value) {
        return new FeatureName(value);
    }

    @JsonValue
    @Override
    public String toString() {
        return value;
    }
}
