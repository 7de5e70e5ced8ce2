package com.planforge.core.policy;

import com.planforge.core.model.AgentId;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Round-robin bookkeeping for one sequential review cycle.
 * <p>
 * Reviewers run in list order. The index moves only after the current reviewer
 * completes (approves or rejects), so every reviewer runs exactly once per cycle.
 * Mutable and only touched from the owning aggregate.
 */
public class SequentialReviewState {

    private List<AgentId> order = new ArrayList<>();
    private int currentIndex;
    private Map<String, Integer> invocationCounts = new LinkedHashMap<>();

    public SequentialReviewState() {
    }

    public static SequentialReviewState start(List<AgentId> reviewers) {
        if (reviewers == null || reviewers.isEmpty()) {
            throw new IllegalArgumentException("A review cycle needs at least one reviewer");
        }
        var state = new SequentialReviewState();
        state.order = new ArrayList<>(reviewers);
        for (AgentId reviewer : reviewers) {
            state.invocationCounts.put(reviewer.value(), 0);
        }
        return state;
    }

    /** The reviewer whose turn it is, empty once everyone has reviewed. */
    public Optional<AgentId> currentReviewer() {
        return currentIndex < order.size() ? Optional.of(order.get(currentIndex)) : Optional.empty();
    }

    public boolean isTurnOf(AgentId reviewer) {
        return currentReviewer().map(reviewer::equals).orElse(false);
    }

    /**
     * Marks the current reviewer as done and advances the queue.
     *
     * @throws IllegalStateException if it is not this reviewer's turn
     */
    public void recordCompleted(AgentId reviewer) {
        if (!isTurnOf(reviewer)) {
            throw new IllegalStateException("Not " + reviewer + "'s turn, expected "
                    + currentReviewer().map(AgentId::value).orElse("nobody"));
        }
        invocationCounts.merge(reviewer.value(), 1, Integer::sum);
        currentIndex++;
    }

    public boolean allReviewed() {
        return currentIndex >= order.size();
    }

    public int invocationCount(AgentId reviewer) {
        return invocationCounts.getOrDefault(reviewer.value(), 0);
    }

    public List<AgentId> getOrder() {
        return order;
    }

    public void setOrder(List<AgentId> order) {
        this.order = order;
    }

    public int getCurrentIndex() {
        return currentIndex;
    }

    public void setCurrentIndex(int currentIndex) {
        this.currentIndex = currentIndex;
    }

    public Map<String, Integer> getInvocationCounts() {
        return invocationCounts;
    }

    public void setInvocationCounts(Map<String, Integer> invocationCounts) {
        this.invocationCounts = invocationCounts;
    }
}
