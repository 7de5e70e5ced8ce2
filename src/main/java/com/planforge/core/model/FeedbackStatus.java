package com.planforge.core.model;

/**
 * Outcome of the most recent plan review cycle.
 */
public enum FeedbackStatus {
    APPROVED,
    NEEDS_REVISION
}
