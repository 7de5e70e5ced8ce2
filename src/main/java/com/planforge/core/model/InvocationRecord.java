package com.planforge.core.model;

import java.io.Serializable;
import java.time.Instant;

/**
 * One agent invocation, kept for diagnostics and resume decisions.
 *
 * @param agent          the invoked agent
 * @param phase          workflow phase the invocation ran in
 * @param timestamp      when it ran
 * @param conversationId conversation used, if any
 * @param resumeStrategy how it was invoked
 */
public record InvocationRecord(
        AgentId agent,
        PhaseLabel phase,
        Instant timestamp,
        ConversationId conversationId,
        ResumeStrategy resumeStrategy
) implements Serializable {
}
