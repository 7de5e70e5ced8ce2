package com.planforge.core.view;

import com.planforge.core.model.FeedbackPath;

/**
 * One reviewer's vote in the current review cycle.
 *
 * @param reviewer     reviewer name
 * @param approved     whether the reviewer approved the plan
 * @param feedbackPath feedback document for a rejection, null otherwise
 */
public record ReviewerResult(String reviewer, boolean approved, FeedbackPath feedbackPath) {
}
