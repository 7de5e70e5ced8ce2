package com.planforge.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.io.Serializable;
import java.util.Objects;
import java.util.UUID;

/**
 * Identifies one workflow session. Primary key for the aggregate, its event log
 * and its daemon registry entry.
 *
 * @param value the underlying UUID
 */
public record WorkflowId(UUID value) implements Serializable {

    public WorkflowId {
        Objects.requireNonNull(value, "value");
    }

    public static WorkflowId newId() {
        return new WorkflowId(UUID.randomUUID());
    }

    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public static WorkflowId parse(String text) {
        return new WorkflowId(UUID.fromString(text.trim()));
    }

    @JsonValue
    @Override
    public String toString() {
        return value.toString();
    }
}
