package com.planforge.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.io.Serializable;

/**
 * Name of an agent, for example a reviewer.
 */
public record AgentId(String value) implements Serializable {

    public AgentId {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("AgentId must not be blank");
        }
    }

    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public static AgentId of(String value) {
        return new AgentId(value);
    }

    @JsonValue
    @Override
    public String toString() {
        return value;
    }
}
