package com.planforge.core.policy;

import com.planforge.core.model.AgentId;

import java.util.List;
import java.util.Map;

/**
 * Computes the verdict of a review cycle from individual reviewer votes.
 * Callers pass the result to the aggregate; the aggregate itself never re-derives it.
 */
public final class ReviewPolicy {

    private ReviewPolicy() {}

    /**
     * A cycle is approved only when every configured reviewer voted and all votes approve.
     *
     * @param reviewers the reviewers configured for the cycle
     * @param votes     reviewer name to approval, for reviewers that have voted
     */
    public static boolean cycleApproved(List<AgentId> reviewers, Map<String, Boolean> votes) {
        if (reviewers.isEmpty()) {
            return false;
        }
        for (AgentId reviewer : reviewers) {
            if (!Boolean.TRUE.equals(votes.get(reviewer.value()))) {
                return false;
            }
        }
        return true;
    }

    /** Whether every configured reviewer has cast a vote. */
    public static boolean allVoted(List<AgentId> reviewers, Map<String, Boolean> votes) {
        return reviewers.stream().allMatch(r -> votes.containsKey(r.value()));
    }
}
