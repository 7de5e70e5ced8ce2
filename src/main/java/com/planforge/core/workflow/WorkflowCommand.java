package com.planforge.core.workflow;

import com.planforge.core.model.AgentId;
import com.planforge.core.model.ConversationId;
import com.planforge.core.model.FeatureName;
import com.planforge.core.model.FeedbackPath;
import com.planforge.core.model.ImplementationVerdict;
import com.planforge.core.model.Iteration;
import com.planforge.core.model.MaxIterations;
import com.planforge.core.model.Objective;
import com.planforge.core.model.PhaseLabel;
import com.planforge.core.model.PlanPath;
import com.planforge.core.model.ResumeStrategy;
import com.planforge.core.model.ReviewMode;
import com.planforge.core.model.WorkingDir;
import com.planforge.core.model.WorktreeState;
import com.planforge.core.policy.FailureContext;

import java.util.List;

/**
 * Intent sent to a workflow. Validated by {@link WorkflowAggregate#handle} and turned into
 * zero or more {@link WorkflowEvent}s.
 */
public interface WorkflowCommand {

    default String commandName() {
        return getClass().getSimpleName();
    }

    // -- Planning ------------------------------------------------------------

    record CreateWorkflow(FeatureName featureName, Objective objective, WorkingDir workingDir,
                          MaxIterations maxIterations, PlanPath planPath, FeedbackPath feedbackPath)
            implements WorkflowCommand {
    }

    record StartPlanning() implements WorkflowCommand {
    }

    record PlanningCompleted(PlanPath planPath) implements WorkflowCommand {
    }

    record ReviewCycleStarted(ReviewMode mode, List<AgentId> reviewers) implements WorkflowCommand {
    }

    record ReviewerApproved(AgentId reviewerId) implements WorkflowCommand {
    }

    record ReviewerRejected(AgentId reviewerId, FeedbackPath feedbackPath) implements WorkflowCommand {
    }

    /**
     * Closes the current review cycle. {@code approved} is taken as given and not
     * checked against the recorded reviewer votes.
     */
    record ReviewCycleCompleted(boolean approved) implements WorkflowCommand {
    }

    /**
     * @param additionalIterations when non-null, raises the iteration limit first; only valid
     *                             while awaiting the user's planning decision
     */
    record RevisingStarted(String feedbackSummary, Integer additionalIterations) implements WorkflowCommand {

        public RevisingStarted(String feedbackSummary) {
            this(feedbackSummary, null);
        }
    }

    record RevisionCompleted(PlanPath planPath) implements WorkflowCommand {
    }

    record PlanningMaxIterationsReached() implements WorkflowCommand {
    }

    // -- User decisions ------------------------------------------------------

    record UserApproved() implements WorkflowCommand {
    }

    record UserRequestedImplementation() implements WorkflowCommand {
    }

    record UserDeclined(String feedback) implements WorkflowCommand {
    }

    record UserAborted(String reason) implements WorkflowCommand {
    }

    record UserOverrideApproval(String overrideReason) implements WorkflowCommand {
    }

    // -- Implementation ------------------------------------------------------

    /**
     * Never accepted directly. The event of the same name is emitted when the user requests implementation.
     */
    record ImplementationStarted(MaxIterations maxIterations) implements WorkflowCommand {
    }

    record ImplementationRoundStarted(Iteration iteration) implements WorkflowCommand {
    }

    record ImplementationRoundCompleted(Iteration iteration, String fingerprint) implements WorkflowCommand {
    }

    record ImplementationReviewCompleted(Iteration iteration, ImplementationVerdict verdict, String feedback)
            implements WorkflowCommand {
    }

    record ImplementationMaxIterationsReached() implements WorkflowCommand {
    }

    record ImplementationAccepted() implements WorkflowCommand {
    }

    record ImplementationDeclined(String reason) implements WorkflowCommand {
    }

    record ImplementationCancelled(String reason) implements WorkflowCommand {
    }

    // -- Bookkeeping, valid in any initialized state -------------------------

    record RecordAgentConversation(AgentId agentId, ResumeStrategy resumeStrategy, ConversationId conversationId)
            implements WorkflowCommand {
    }

    record RecordInvocation(AgentId agentId, PhaseLabel phase, ConversationId conversationId,
                            ResumeStrategy resumeStrategy) implements WorkflowCommand {
    }

    record RecordFailure(FailureContext failure) implements WorkflowCommand {
    }

    /**
     * @param replace must be true to swap out a worktree that is already attached
     */
    record AttachWorktree(WorktreeState worktreeState, boolean replace) implements WorkflowCommand {

        public AttachWorktree(WorktreeState worktreeState) {
            this(worktreeState, false);
        }
    }
}
