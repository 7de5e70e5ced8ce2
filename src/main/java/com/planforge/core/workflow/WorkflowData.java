package com.planforge.core.workflow;

import com.fasterxml.jackson.annotation.JsonAutoDetect;
import com.fasterxml.jackson.annotation.JsonAutoDetect.Visibility;
import com.planforge.core.model.AgentConversationState;
import com.planforge.core.model.AgentId;
import com.planforge.core.model.FeatureName;
import com.planforge.core.model.FeedbackPath;
import com.planforge.core.model.FeedbackStatus;
import com.planforge.core.model.ImplementationPhaseState;
import com.planforge.core.model.InvocationRecord;
import com.planforge.core.model.Iteration;
import com.planforge.core.model.MaxIterations;
import com.planforge.core.model.Objective;
import com.planforge.core.model.Phase;
import com.planforge.core.model.PhaseLabel;
import com.planforge.core.model.PlanPath;
import com.planforge.core.model.ReviewMode;
import com.planforge.core.model.WorkingDir;
import com.planforge.core.model.WorktreeState;
import com.planforge.core.policy.FailureContext;
import com.planforge.core.policy.SequentialReviewState;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * State of an initialized workflow. Owned by {@link WorkflowAggregate}, which is the only writer;
 * everything else sees it through the read accessors.
 * <p>
 * Serialized field by field into snapshots.
 */
@JsonAutoDetect(fieldVisibility = Visibility.ANY, getterVisibility = Visibility.NONE,
        isGetterVisibility = Visibility.NONE, setterVisibility = Visibility.NONE)
public class WorkflowData {

    FeatureName featureName;
    Objective objective;
    WorkingDir workingDir;
    Instant createdAt;

    Phase planningPhase = Phase.PLANNING;
    boolean planningStarted;
    Iteration iteration = Iteration.first();
    MaxIterations maxIterations = MaxIterations.DEFAULT;
    PlanPath planPath;
    FeedbackPath feedbackPath;
    FeedbackStatus lastFeedbackStatus;
    String feedbackSummary;

    /** Null when no review cycle is running. */
    ReviewMode reviewMode;
    List<AgentId> cycleReviewers = new ArrayList<>();
    Map<String, Boolean> cycleVotes = new LinkedHashMap<>();
    SequentialReviewState sequentialReview;
    Map<String, Integer> reviewerRunCounts = new LinkedHashMap<>();
    String lastRejectingReviewer;

    boolean approvalOverridden;
    String overrideReason;
    List<String> userFeedback = new ArrayList<>();

    ImplementationPhaseState implementationState;
    String lastFingerprint;

    boolean cancelled;
    String cancelReason;

    Map<String, AgentConversationState> agentConversations = new LinkedHashMap<>();
    List<InvocationRecord> invocations = new ArrayList<>();
    FailureContext lastFailure;
    List<FailureContext> failureHistory = new ArrayList<>();
    WorktreeState worktree;

    WorkflowData() {
    }

    /** Combined lifecycle position. */
    public PhaseLabel phaseLabel() {
        if (cancelled) {
            return PhaseLabel.CANCELLED;
        }
        return PhaseLabel.of(planningPhase, implementationState != null ? implementationState.phase() : null);
    }

    public boolean reviewCycleActive() {
        return reviewMode != null;
    }

    public FeatureName featureName() {
        return featureName;
    }

    public Objective objective() {
        return objective;
    }

    public WorkingDir workingDir() {
        return workingDir;
    }

    public Instant createdAt() {
        return createdAt;
    }

    public Phase planningPhase() {
        return planningPhase;
    }

    public boolean planningStarted() {
        return planningStarted;
    }

    public Iteration iteration() {
        return iteration;
    }

    public MaxIterations maxIterations() {
        return maxIterations;
    }

    public PlanPath planPath() {
        return planPath;
    }

    public FeedbackPath feedbackPath() {
        return feedbackPath;
    }

    public FeedbackStatus lastFeedbackStatus() {
        return lastFeedbackStatus;
    }

    public String feedbackSummary() {
        return feedbackSummary;
    }

    public ReviewMode reviewMode() {
        return reviewMode;
    }

    public List<AgentId> cycleReviewers() {
        return Collections.unmodifiableList(cycleReviewers);
    }

    public Map<String, Boolean> cycleVotes() {
        return Collections.unmodifiableMap(cycleVotes);
    }

    public SequentialReviewState sequentialReview() {
        return sequentialReview;
    }

    public Map<String, Integer> reviewerRunCounts() {
        return Collections.unmodifiableMap(reviewerRunCounts);
    }

    public String lastRejectingReviewer() {
        return lastRejectingReviewer;
    }

    public boolean approvalOverridden() {
        return approvalOverridden;
    }

    public String overrideReason() {
        return overrideReason;
    }

    public List<String> userFeedback() {
        return Collections.unmodifiableList(userFeedback);
    }

    public ImplementationPhaseState implementationState() {
        return implementationState;
    }

    public String lastFingerprint() {
        return lastFingerprint;
    }

    public boolean cancelled() {
        return cancelled;
    }

    public String cancelReason() {
        return cancelReason;
    }

    public Map<String, AgentConversationState> agentConversations() {
        return Collections.unmodifiableMap(agentConversations);
    }

    public List<InvocationRecord> invocations() {
        return Collections.unmodifiableList(invocations);
    }

    public FailureContext lastFailure() {
        return lastFailure;
    }

    public List<FailureContext> failureHistory() {
        return Collections.unmodifiableList(failureHistory);
    }

    public WorktreeState worktree() {
        return worktree;
    }
}
