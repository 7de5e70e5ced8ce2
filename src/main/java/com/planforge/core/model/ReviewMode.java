package com.planforge.core.model;

/**
 * How reviewers are run within one review cycle.
 */
public enum ReviewMode {
    /** All reviewers run concurrently; votes may arrive in any order. */
    PARALLEL,
    /** Reviewers run one at a time in the configured order. */
    SEQUENTIAL
}
