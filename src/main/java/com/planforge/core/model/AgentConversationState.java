package com.planforge.core.model;

import java.io.Serializable;
import java.time.Instant;

/**
 * Last known conversation of one agent. Replaced, not appended, on each record.
 *
 * @param resumeStrategy how the agent was last invoked
 * @param conversationId provider conversation id, null for stateless agents
 * @param lastUsedAt     when the conversation was recorded
 */
public record AgentConversationState(
        ResumeStrategy resumeStrategy,
        ConversationId conversationId,
        Instant lastUsedAt
) implements Serializable {
}
