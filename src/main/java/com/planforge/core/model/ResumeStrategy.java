package com.planforge.core.model;

/**
 * How an agent invocation relates to earlier invocations of the same agent.
 */
public enum ResumeStrategy {
    /** Fresh invocation, no prior context. */
    STATELESS,
    /** Resume a specific provider conversation by id. */
    CONVERSATION_RESUME,
    /** Resume whatever conversation the provider considers most recent. */
    RESUME_LATEST
}
