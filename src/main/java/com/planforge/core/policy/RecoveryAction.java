package com.planforge.core.policy;

/**
 * What the orchestration layer should do about a recorded failure.
 */
public enum RecoveryAction {
    RETRY,
    ESCALATE_TO_USER,
    ABORT,
    CONTINUE_WITHOUT_REVIEW
}
