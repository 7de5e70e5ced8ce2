package com.planforge.core.model;

/**
 * The closed set of agent providers a workflow can drive.
 * Provider-specific behaviour is selected by exhaustive switches over this enum.
 */
public enum AgentKind {
    CLAUDE,
    CODEX,
    GEMINI;

    /** Executable name of the provider's command line tool. */
    public String binary() {
        return switch (this) {
            case CLAUDE -> "claude";
            case CODEX -> "codex";
            case GEMINI -> "gemini";
        };
    }

    /**
     * Strategy used when re-invoking an agent that already has a conversation on record.
     */
    public ResumeStrategy resumeStrategy(ConversationId knownConversation) {
        return switch (this) {
            case CLAUDE -> knownConversation != null ? ResumeStrategy.CONVERSATION_RESUME : ResumeStrategy.STATELESS;
            case CODEX -> knownConversation != null ? ResumeStrategy.RESUME_LATEST : ResumeStrategy.STATELESS;
            case GEMINI -> ResumeStrategy.STATELESS;
        };
    }

    /**
     * Resolves an agent id like {@code "claude-reviewer"} to its provider by prefix.
     */
    public static AgentKind forAgent(AgentId agentId) {
        String name = agentId.value().toLowerCase();
        for (AgentKind kind : values()) {
            if (name.startsWith(kind.binary())) {
                return kind;
            }
        }
        throw new IllegalArgumentException("Unknown agent provider for " + agentId);
    }
}
