package com.planforge.core.view;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.planforge.core.model.AgentConversationState;
import com.planforge.core.model.FeatureName;
import com.planforge.core.model.FeedbackPath;
import com.planforge.core.model.FeedbackStatus;
import com.planforge.core.model.ImplementationPhaseState;
import com.planforge.core.model.Iteration;
import com.planforge.core.model.MaxIterations;
import com.planforge.core.model.Objective;
import com.planforge.core.model.PhaseLabel;
import com.planforge.core.model.PlanPath;
import com.planforge.core.model.ReviewMode;
import com.planforge.core.model.WorkflowId;
import com.planforge.core.model.WorkingDir;
import com.planforge.core.model.WorktreeState;
import com.planforge.core.policy.FailureContext;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Immutable read model of one workflow, as published after every persisted event.
 * Every field is null (or empty) until the workflow is created.
 *
 * @param workflowId          workflow id
 * @param featureName         feature being planned
 * @param objective           session objective
 * @param workingDir          agent working directory
 * @param phase               combined lifecycle position
 * @param iteration           current planning round
 * @param maxIterations       current planning round limit
 * @param planPath            plan document
 * @param feedbackPath        latest feedback document
 * @param lastFeedbackStatus  outcome of the last review cycle
 * @param reviewMode          mode of the running review cycle, null when none runs
 * @param currentCycleReviews votes of the running or most recent cycle, in arrival order
 * @param reviewerRunCounts   reviews performed per reviewer over the whole session
 * @param approvalOverridden  whether the user approved past a rejection
 * @param userFeedbackHistory feedback the user gave when declining, oldest first
 * @param implementationState implementation loop progress, null before implementation
 * @param agentConversations  last conversation per agent
 * @param invocationCount     number of recorded agent invocations
 * @param lastFailure         most recent failure, null if none
 * @param failureHistory      bounded failure history, oldest first
 * @param worktree            attached worktree, null if none
 * @param cancelReason        reason given on cancellation
 * @param lastEventSequence   sequence of the last event folded in, 0 when none
 * @param updatedAt           timestamp of the last event folded in
 */
public record WorkflowView(
        WorkflowId workflowId,
        FeatureName featureName,
        Objective objective,
        WorkingDir workingDir,
        PhaseLabel phase,
        Iteration iteration,
        MaxIterations maxIterations,
        PlanPath planPath,
        FeedbackPath feedbackPath,
        FeedbackStatus lastFeedbackStatus,
        ReviewMode reviewMode,
        List<ReviewerResult> currentCycleReviews,
        Map<String, Integer> reviewerRunCounts,
        boolean approvalOverridden,
        List<String> userFeedbackHistory,
        ImplementationPhaseState implementationState,
        Map<String, AgentConversationState> agentConversations,
        int invocationCount,
        FailureContext lastFailure,
        List<FailureContext> failureHistory,
        WorktreeState worktree,
        String cancelReason,
        long lastEventSequence,
        Instant updatedAt
) {

    public static WorkflowView empty(WorkflowId workflowId) {
        return new WorkflowView(workflowId, null, null, null, null, null, null, null, null, null, null,
                List.of(), Map.of(), false, List.of(), null, Map.of(), 0, null, List.of(), null, null, 0, null);
    }

    @JsonIgnore
    public boolean isInitialized() {
        return featureName != null;
    }

    public int failureCount() {
        return failureHistory.size();
    }

    public boolean hasFailure() {
        return lastFailure != null;
    }

    /**
     * Whether the workflow can make progress without a user decision.
     */
    public boolean shouldContinue() {
        if (phase == null || phase.isTerminal()) {
            return false;
        }
        return phase != PhaseLabel.AWAITING_PLANNING_DECISION && phase != PhaseLabel.AWAITING_IMPLEMENTATION_DECISION;
    }

    /** Status line for registries and listings, e.g. {@code "Reviewing #2"}. */
    public String statusLine() {
        if (phase == null) {
            return "Uninitialized";
        }
        Iteration round = implementationState != null ? implementationState.iteration() : iteration;
        return phase.withIteration(round);
    }
}
