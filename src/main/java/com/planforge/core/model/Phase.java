package com.planforge.core.model;

/**
 * Phase of the planning half of a workflow.
 */
public enum Phase {
    PLANNING,
    REVIEWING,
    REVISING,
    AWAITING_PLANNING_DECISION,
    COMPLETE
}
