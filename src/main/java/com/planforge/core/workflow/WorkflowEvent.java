package com.planforge.core.workflow;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
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

import java.io.Serializable;
import java.time.Instant;
import java.util.List;

/**
 * A fact recorded in a workflow's event log.
 * <p>
 * Events are applied by {@link WorkflowAggregate#apply} both live and on replay, so
 * applying one must never fail. The JSON form carries a {@code type} discriminator equal
 * to {@link #eventType()}.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "type")
@JsonSubTypes({
        @JsonSubTypes.Type(value = WorkflowEvent.WorkflowCreated.class, name = "WorkflowCreated"),
        @JsonSubTypes.Type(value = WorkflowEvent.PlanningStarted.class, name = "PlanningStarted"),
        @JsonSubTypes.Type(value = WorkflowEvent.PlanningCompleted.class, name = "PlanningCompleted"),
        @JsonSubTypes.Type(value = WorkflowEvent.ReviewCycleStarted.class, name = "ReviewCycleStarted"),
        @JsonSubTypes.Type(value = WorkflowEvent.ReviewerApproved.class, name = "ReviewerApproved"),
        @JsonSubTypes.Type(value = WorkflowEvent.ReviewerRejected.class, name = "ReviewerRejected"),
        @JsonSubTypes.Type(value = WorkflowEvent.ReviewCycleCompleted.class, name = "ReviewCycleCompleted"),
        @JsonSubTypes.Type(value = WorkflowEvent.MaxIterationsExtended.class, name = "MaxIterationsExtended"),
        @JsonSubTypes.Type(value = WorkflowEvent.RevisingStarted.class, name = "RevisingStarted"),
        @JsonSubTypes.Type(value = WorkflowEvent.RevisionCompleted.class, name = "RevisionCompleted"),
        @JsonSubTypes.Type(value = WorkflowEvent.PlanningMaxIterationsReached.class, name = "PlanningMaxIterationsReached"),
        @JsonSubTypes.Type(value = WorkflowEvent.UserApproved.class, name = "UserApproved"),
        @JsonSubTypes.Type(value = WorkflowEvent.UserRequestedImplementation.class, name = "UserRequestedImplementation"),
        @JsonSubTypes.Type(value = WorkflowEvent.UserDeclined.class, name = "UserDeclined"),
        @JsonSubTypes.Type(value = WorkflowEvent.UserAborted.class, name = "UserAborted"),
        @JsonSubTypes.Type(value = WorkflowEvent.UserOverrideApproval.class, name = "UserOverrideApproval"),
        @JsonSubTypes.Type(value = WorkflowEvent.ImplementationStarted.class, name = "ImplementationStarted"),
        @JsonSubTypes.Type(value = WorkflowEvent.ImplementationRoundStarted.class, name = "ImplementationRoundStarted"),
        @JsonSubTypes.Type(value = WorkflowEvent.ImplementationRoundCompleted.class, name = "ImplementationRoundCompleted"),
        @JsonSubTypes.Type(value = WorkflowEvent.ImplementationReviewCompleted.class, name = "ImplementationReviewCompleted"),
        @JsonSubTypes.Type(value = WorkflowEvent.ImplementationMaxIterationsReached.class, name = "ImplementationMaxIterationsReached"),
        @JsonSubTypes.Type(value = WorkflowEvent.ImplementationAccepted.class, name = "ImplementationAccepted"),
        @JsonSubTypes.Type(value = WorkflowEvent.ImplementationDeclined.class, name = "ImplementationDeclined"),
        @JsonSubTypes.Type(value = WorkflowEvent.ImplementationCancelled.class, name = "ImplementationCancelled"),
        @JsonSubTypes.Type(value = WorkflowEvent.AgentConversationRecorded.class, name = "AgentConversationRecorded"),
        @JsonSubTypes.Type(value = WorkflowEvent.InvocationRecorded.class, name = "InvocationRecorded"),
        @JsonSubTypes.Type(value = WorkflowEvent.FailureRecorded.class, name = "FailureRecorded"),
        @JsonSubTypes.Type(value = WorkflowEvent.WorktreeAttached.class, name = "WorktreeAttached")
})
public interface WorkflowEvent extends Serializable {

    String EVENT_VERSION = "1";

    Instant timestamp();

    default String eventType() {
        return getClass().getSimpleName();
    }

    default String eventVersion() {
        return EVENT_VERSION;
    }

    // -- Planning -----------------------------------------------------------

    record WorkflowCreated(FeatureName featureName, Objective objective, WorkingDir workingDir,
                           MaxIterations maxIterations, PlanPath planPath, FeedbackPath feedbackPath,
                           Instant timestamp) implements WorkflowEvent {
    }

    record PlanningStarted(Instant timestamp) implements WorkflowEvent {
    }

    record PlanningCompleted(PlanPath planPath, Instant timestamp) implements WorkflowEvent {
    }

    record ReviewCycleStarted(ReviewMode mode, List<AgentId> reviewers, Instant timestamp) implements WorkflowEvent {
    }

    record ReviewerApproved(AgentId reviewerId, Instant timestamp) implements WorkflowEvent {
    }

    record ReviewerRejected(AgentId reviewerId, FeedbackPath feedbackPath, Instant timestamp) implements WorkflowEvent {
    }

    record ReviewCycleCompleted(boolean approved, Instant timestamp) implements WorkflowEvent {
    }

    /**
     * Raises the iteration limit. Always precedes the event that starts the extra round.
     */
    record MaxIterationsExtended(MaxIterations newMax, Instant timestamp) implements WorkflowEvent {
    }

    record RevisingStarted(String feedbackSummary, Instant timestamp) implements WorkflowEvent {
    }

    record RevisionCompleted(PlanPath planPath, Instant timestamp) implements WorkflowEvent {
    }

    record PlanningMaxIterationsReached(Instant timestamp) implements WorkflowEvent {
    }

    // -- User decisions -----------------------------------------------------

    record UserApproved(Instant timestamp) implements WorkflowEvent {
    }

    record UserRequestedImplementation(Instant timestamp) implements WorkflowEvent {
    }

    record UserDeclined(String feedback, Instant timestamp) implements WorkflowEvent {
    }

    record UserAborted(String reason, Instant timestamp) implements WorkflowEvent {
    }

    record UserOverrideApproval(String overrideReason, Instant timestamp) implements WorkflowEvent {
    }

    // -- Implementation -----------------------------------------------------

    /**
     * Emitted together with {@link UserRequestedImplementation}; never accepted as a command.
     */
    record ImplementationStarted(MaxIterations maxIterations, Instant timestamp) implements WorkflowEvent {
    }

    record ImplementationRoundStarted(Iteration iteration, Instant timestamp) implements WorkflowEvent {
    }

    record ImplementationRoundCompleted(Iteration iteration, String fingerprint, Instant timestamp)
            implements WorkflowEvent {
    }

    record ImplementationReviewCompleted(Iteration iteration, ImplementationVerdict verdict, String feedback,
                                         Instant timestamp) implements WorkflowEvent {
    }

    record ImplementationMaxIterationsReached(Instant timestamp) implements WorkflowEvent {
    }

    record ImplementationAccepted(Instant timestamp) implements WorkflowEvent {
    }

    /**
     * The user sent the implementation back for another round, raising its limit by one.
     */
    record ImplementationDeclined(String reason, Instant timestamp) implements WorkflowEvent {
    }

    record ImplementationCancelled(String reason, Instant timestamp) implements WorkflowEvent {
    }

    // -- Bookkeeping --------------------------------------------------------

    record AgentConversationRecorded(AgentId agentId, ResumeStrategy resumeStrategy, ConversationId conversationId,
                                     Instant timestamp) implements WorkflowEvent {
    }

    record InvocationRecorded(AgentId agentId, PhaseLabel phase, ConversationId conversationId,
                              ResumeStrategy resumeStrategy, Instant timestamp) implements WorkflowEvent {
    }

    record FailureRecorded(FailureContext failure, Instant timestamp) implements WorkflowEvent {
    }

    record WorktreeAttached(WorktreeState worktreeState, Instant timestamp) implements WorkflowEvent {
    }
}
