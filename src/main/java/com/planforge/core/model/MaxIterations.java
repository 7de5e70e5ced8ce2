package com.planforge.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.io.Serializable;

/**
 * Upper bound on rounds. Only ever raised, through an explicit extension event.
 *
 * @param value the bound, at least 1
 */
public record MaxIterations(int value) implements Serializable {

    public static final MaxIterations DEFAULT = new MaxIterations(3);

    public MaxIterations {
        if (value < 1) {
            throw new IllegalArgumentException("MaxIterations must be at least 1, got " + value);
        }
    }

    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public static MaxIterations of(int value) {
        return new MaxIterations(value);
    }

    public MaxIterations extendBy(int additional) {
        if (additional < 1) {
            throw new IllegalArgumentException("Extension must be positive, got " + additional);
        }
        return new MaxIterations(Math.addExact(value, additional));
    }

    @JsonValue
    public int asInt() {
        return value;
    }

    @Override
    public String toString() {
        return String.valueOf(value);
    }
}
