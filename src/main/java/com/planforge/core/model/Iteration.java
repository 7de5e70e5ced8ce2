package com.planforge.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.io.Serializable;

/**
 * One-based counter of planning or implementation rounds.
 *
 * @param value the round number, never below 1
 */
public record Iteration(int value) implements Serializable, Comparable<Iteration> {

    public Iteration {
        if (value < 1) {
            throw new IllegalArgumentException("Iteration starts at 1, got " + value);
        }
    }

    public static Iteration first() {
        return new Iteration(1);
    }

    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public static Iteration of(int value) {
        return new Iteration(value);
    }

    public Iteration next() {
        return new Iteration(value + 1);
    }

    public boolean reached(MaxIterations max) {
        return value >= max.value();
    }

    @JsonValue
    public int asInt() {
        return value;
    }

    @Override
    public int compareTo(Iteration other) {
        return Integer.compare(value, other.value);
    }

    @Override
    public String toString() {
        return String.valueOf(value);
    }
}
