package com.planforge.core.policy;

/**
 * Policy for a review cycle in which no reviewer produced a usable result.
 */
public enum OnAllReviewersFailed {
    ABORT,
    SAVE_STATE,
    CONTINUE_WITHOUT_REVIEW
}
