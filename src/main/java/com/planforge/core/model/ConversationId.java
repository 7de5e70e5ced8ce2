package com.planforge.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.io.Serializable;

/**
 * Provider-side conversation handle used to resume an agent.
 * <p>
 * Only meaningful together with {@link ResumeStrategy#CONVERSATION_RESUME}.
 */
public record ConversationId(String value) implements Serializable {

    public ConversationId {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("ConversationId must not be blank");
        }
    }

    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public static ConversationId of(String value) {
        return new ConversationId(value);
    }

    @JsonValue
    @Override
    public String toString() {
        return value;
    }
}
