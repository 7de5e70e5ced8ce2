package com.planforge.core.workflow;

import com.planforge.core.model.AgentConversationState;
import com.planforge.core.model.AgentId;
import com.planforge.core.model.FeedbackStatus;
import com.planforge.core.model.ImplementationPhase;
import com.planforge.core.model.ImplementationPhaseState;
import com.planforge.core.model.ImplementationVerdict;
import com.planforge.core.model.InvocationRecord;
import com.planforge.core.model.Iteration;
import com.planforge.core.model.MaxIterations;
import com.planforge.core.model.Phase;
import com.planforge.core.model.ReviewMode;
import com.planforge.core.policy.FailurePolicy;
import com.planforge.core.policy.ReviewPolicy;
import com.planforge.core.policy.SequentialReviewState;
import com.planforge.core.workflow.WorkflowCommand.AttachWorktree;
import com.planforge.core.workflow.WorkflowCommand.CreateWorkflow;
import com.planforge.core.workflow.WorkflowCommand.RecordAgentConversation;
import com.planforge.core.workflow.WorkflowCommand.RecordFailure;
import com.planforge.core.workflow.WorkflowCommand.RecordInvocation;
import com.planforge.core.workflow.WorkflowEvent.AgentConversationRecorded;
import com.planforge.core.workflow.WorkflowEvent.FailureRecorded;
import com.planforge.core.workflow.WorkflowEvent.ImplementationAccepted;
import com.planforge.core.workflow.WorkflowEvent.ImplementationCancelled;
import com.planforge.core.workflow.WorkflowEvent.ImplementationDeclined;
import com.planforge.core.workflow.WorkflowEvent.ImplementationMaxIterationsReached;
import com.planforge.core.workflow.WorkflowEvent.ImplementationReviewCompleted;
import com.planforge.core.workflow.WorkflowEvent.ImplementationRoundCompleted;
import com.planforge.core.workflow.WorkflowEvent.ImplementationRoundStarted;
import com.planforge.core.workflow.WorkflowEvent.ImplementationStarted;
import com.planforge.core.workflow.WorkflowEvent.InvocationRecorded;
import com.planforge.core.workflow.WorkflowEvent.MaxIterationsExtended;
import com.planforge.core.workflow.WorkflowEvent.PlanningCompleted;
import com.planforge.core.workflow.WorkflowEvent.PlanningMaxIterationsReached;
import com.planforge.core.workflow.WorkflowEvent.PlanningStarted;
import com.planforge.core.workflow.WorkflowEvent.ReviewCycleCompleted;
import com.planforge.core.workflow.WorkflowEvent.ReviewCycleStarted;
import com.planforge.core.workflow.WorkflowEvent.ReviewerApproved;
import com.planforge.core.workflow.WorkflowEvent.ReviewerRejected;
import com.planforge.core.workflow.WorkflowEvent.RevisingStarted;
import com.planforge.core.workflow.WorkflowEvent.RevisionCompleted;
import com.planforge.core.workflow.WorkflowEvent.UserAborted;
import com.planforge.core.workflow.WorkflowEvent.UserApproved;
import com.planforge.core.workflow.WorkflowEvent.UserDeclined;
import com.planforge.core.workflow.WorkflowEvent.UserOverrideApproval;
import com.planforge.core.workflow.WorkflowEvent.UserRequestedImplementation;
import com.planforge.core.workflow.WorkflowEvent.WorkflowCreated;
import com.planforge.core.workflow.WorkflowEvent.WorktreeAttached;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.function.UnaryOperator;

/**
 * Event-sourced state machine for one workflow session.
 * <p>
 * {@link #handle} validates a command against the current state and returns the events it
 * produces without touching state. {@link #apply} folds one event into the state and never
 * fails, so the same code path serves live operation and replay from the event log.
 * <p>
 * Not thread-safe. Each aggregate is owned by a single {@code WorkflowActor}.
 */
public class WorkflowAggregate {

    private static final Logger log = LoggerFactory.getLogger(WorkflowAggregate.class);

    public static final int MAX_FAILURE_HISTORY = FailurePolicy.MAX_FAILURE_HISTORY;

    /** Null until the workflow is created. */
    private WorkflowData data;

    public WorkflowAggregate() {
    }

    private WorkflowAggregate(WorkflowData data) {
        this.data = data;
    }

    /**
     * Restores an aggregate from snapshot state. A null state yields an uninitialized aggregate.
     */
    public static WorkflowAggregate fromSnapshot(WorkflowData state) {
        return new WorkflowAggregate(state);
    }

    public static WorkflowAggregate replay(Iterable<? extends WorkflowEvent> events) {
        var aggregate = new WorkflowAggregate();
        for (WorkflowEvent event : events) {
            aggregate.apply(event);
        }
        return aggregate;
    }

    public boolean isInitialized() {
        return data != null;
    }

    /**
     * Current state, or null when uninitialized. Callers must not hold on to it across commands.
     */
    public WorkflowData data() {
        return data;
    }

    // -- Command handling ----------------------------------------------------

    /**
     * Validates a command and returns the resulting events, in the order they must be applied.
     * An empty list means the command was accepted but changes nothing.
     *
     * @throws WorkflowException with {@link WorkflowError#NOT_INITIALIZED} or
     *                           {@link WorkflowError#INVALID_TRANSITION}; state is untouched
     */
    public List<WorkflowEvent> handle(WorkflowCommand command, Instant now) {
        if (command instanceof CreateWorkflow c) {
            if (data != null) {
                throw WorkflowException.invalidTransition("workflow " + data.featureName() + " already created");
            }
            return List.of(new WorkflowCreated(c.featureName(), c.objective(), c.workingDir(),
                    c.maxIterations(), c.planPath(), c.feedbackPath(), now));
        }
        if (data == null) {
            throw WorkflowException.notInitialized();
        }
        if (command instanceof WorkflowCommand.ImplementationStarted) {
            throw WorkflowException.invalidTransition(
                    "ImplementationStarted is emitted when implementation is requested and cannot be submitted");
        }

        List<WorkflowEvent> bookkeeping = handleBookkeeping(command, now);
        if (bookkeeping != null) {
            return bookkeeping;
        }
        if (data.cancelled()) {
            throw rejected(command);
        }
        if (command instanceof WorkflowCommand.UserAborted c) {
            if (data.implementationState() != null
                    && data.implementationState().phase() == ImplementationPhase.COMPLETE) {
                throw rejected(command);
            }
            return List.of(new UserAborted(c.reason(), now));
        }
        if (data.implementationState() != null) {
            return handleImplementation(command, data.implementationState(), now);
        }
        return handlePlanning(command, now);
    }

    private List<WorkflowEvent> handleBookkeeping(WorkflowCommand command, Instant now) {
        if (command instanceof RecordAgentConversation c) {
            require(c.agentId() != null, "RecordAgentConversation requires an agent id");
            require(c.resumeStrategy() != null, "RecordAgentConversation requires a resume strategy");
            return List.of(new AgentConversationRecorded(c.agentId(), c.resumeStrategy(), c.conversationId(), now));
        }
        if (command instanceof RecordInvocation c) {
            require(c.agentId() != null, "RecordInvocation requires an agent id");
            require(c.phase() != null, "RecordInvocation requires a phase");
            require(c.resumeStrategy() != null, "RecordInvocation requires a resume strategy");
            return List.of(new InvocationRecorded(c.agentId(), c.phase(), c.conversationId(), c.resumeStrategy(), now));
        }
        if (command instanceof RecordFailure c) {
            if (c.failure() == null) {
                throw WorkflowException.invalidTransition("RecordFailure requires a failure");
            }
            return List.of(new FailureRecorded(c.failure(), now));
        }
        if (command instanceof AttachWorktree c) {
            require(c.worktreeState() != null, "AttachWorktree requires a worktree state");
            if (data.worktree() != null && !c.replace()) {
                throw WorkflowException.invalidTransition(
                        "worktree already attached at " + data.worktree().worktreePath());
            }
            return List.of(new WorktreeAttached(c.worktreeState(), now));
        }
        return null;
    }

    private List<WorkflowEvent> handlePlanning(WorkflowCommand command, Instant now) {
        Phase phase = data.planningPhase();

        if (command instanceof WorkflowCommand.StartPlanning && phase == Phase.PLANNING) {
            return data.planningStarted() ? List.of() : List.of(new PlanningStarted(now));
        }
        if (command instanceof WorkflowCommand.PlanningCompleted c && phase == Phase.PLANNING) {
            return List.of(new PlanningCompleted(c.planPath(), now));
        }
        if (command instanceof WorkflowCommand.ReviewCycleStarted c && phase == Phase.REVIEWING) {
            validateCycleStart(c);
            return List.of(new ReviewCycleStarted(c.mode(), List.copyOf(c.reviewers()), now));
        }
        if (command instanceof WorkflowCommand.ReviewerApproved c && phase == Phase.REVIEWING) {
            validateVote(c.reviewerId());
            return List.of(new ReviewerApproved(c.reviewerId(), now));
        }
        if (command instanceof WorkflowCommand.ReviewerRejected c && phase == Phase.REVIEWING) {
            validateVote(c.reviewerId());
            return List.of(new ReviewerRejected(c.reviewerId(), c.feedbackPath(), now));
        }
        if (command instanceof WorkflowCommand.ReviewCycleCompleted c && phase == Phase.REVIEWING) {
            return completeCycle(c.approved(), now);
        }
        if (command instanceof WorkflowCommand.RevisingStarted c) {
            return startRevising(c, phase, now);
        }
        if (command instanceof WorkflowCommand.RevisionCompleted c && phase == Phase.REVISING) {
            if (data.iteration().reached(data.maxIterations())) {
                throw WorkflowException.invalidTransition("iteration limit " + data.maxIterations()
                        + " reached; the limit must be extended before another revision");
            }
            return List.of(new RevisionCompleted(c.planPath(), now));
        }
        if (command instanceof WorkflowCommand.PlanningMaxIterationsReached
                && (phase == Phase.REVIEWING || phase == Phase.REVISING)) {
            return List.of(new PlanningMaxIterationsReached(now));
        }
        if (phase == Phase.AWAITING_PLANNING_DECISION) {
            if (command instanceof WorkflowCommand.UserApproved) {
                return List.of(new UserApproved(now));
            }
            if (command instanceof WorkflowCommand.UserDeclined c) {
                return List.of(
                        new MaxIterationsExtended(extendedMax(1), now),
                        new UserDeclined(c.feedback(), now));
            }
            if (command instanceof WorkflowCommand.UserOverrideApproval c) {
                return List.of(new UserOverrideApproval(c.overrideReason(), now));
            }
        }
        if (command instanceof WorkflowCommand.UserRequestedImplementation
                && (phase == Phase.COMPLETE || phase == Phase.AWAITING_PLANNING_DECISION)) {
            return List.of(
                    new UserRequestedImplementation(now),
                    new ImplementationStarted(data.maxIterations(), now));
        }
        throw rejected(command);
    }

    private void validateCycleStart(WorkflowCommand.ReviewCycleStarted c) {
        if (data.reviewCycleActive()) {
            throw WorkflowException.invalidTransition("a review cycle is already in progress");
        }
        if (c.mode() == null) {
            throw WorkflowException.invalidTransition("review mode is required");
        }
        if (c.reviewers() == null || c.reviewers().isEmpty()) {
            throw WorkflowException.invalidTransition("a review cycle needs at least one reviewer");
        }
        require(c.reviewers().stream().noneMatch(Objects::isNull), "reviewer ids must not be null");
        if (new HashSet<>(c.reviewers()).size() != c.reviewers().size()) {
            throw WorkflowException.invalidTransition("duplicate reviewers in " + c.reviewers());
        }
    }

    private void validateVote(AgentId reviewer) {
        if (!data.reviewCycleActive()) {
            throw WorkflowException.invalidTransition("no review cycle in progress");
        }
        if (!data.cycleReviewers().contains(reviewer)) {
            throw WorkflowException.invalidTransition(reviewer + " is not a reviewer in this cycle");
        }
        if (data.cycleVotes().containsKey(reviewer.value())) {
            throw WorkflowException.invalidTransition(reviewer + " already reviewed in this cycle");
        }
        SequentialReviewState sequential = data.sequentialReview();
        if (data.reviewMode() == ReviewMode.SEQUENTIAL && sequential != null && !sequential.isTurnOf(reviewer)) {
            throw WorkflowException.invalidTransition("out of turn: expected "
                    + sequential.currentReviewer().map(AgentId::value).orElse("no reviewer") + ", got " + reviewer);
        }
    }

    private List<WorkflowEvent> completeCycle(boolean approved, Instant now) {
        if (!data.reviewCycleActive()) {
            throw WorkflowException.invalidTransition("no review cycle in progress");
        }
        // The caller's verdict is authoritative; disagreement with the votes is only reported.
        if (ReviewPolicy.allVoted(data.cycleReviewers(), data.cycleVotes())
                && ReviewPolicy.cycleApproved(data.cycleReviewers(), data.cycleVotes()) != approved) {
            log.warn("Review cycle for {} completed with approved={} although reviewer votes were {}",
                    data.featureName(), approved, data.cycleVotes());
        }
        if (!approved && data.iteration().reached(data.maxIterations())) {
            return List.of(new ReviewCycleCompleted(false, now), new PlanningMaxIterationsReached(now));
        }
        return List.of(new ReviewCycleCompleted(approved, now));
    }

    private List<WorkflowEvent> startRevising(WorkflowCommand.RevisingStarted c, Phase phase, Instant now) {
        Integer additional = c.additionalIterations();
        if (additional != null) {
            if (phase != Phase.AWAITING_PLANNING_DECISION) {
                throw WorkflowException.invalidTransition(
                        "additional iterations can only be granted while awaiting a planning decision");
            }
            if (additional < 1) {
                throw WorkflowException.invalidTransition("additional iterations must be positive, got " + additional);
            }
            return List.of(
                    new MaxIterationsExtended(extendedMax(additional), now),
                    new RevisingStarted(c.feedbackSummary(), now));
        }
        if (phase != Phase.REVISING) {
            throw rejected(c);
        }
        return List.of(new RevisingStarted(c.feedbackSummary(), now));
    }

    private List<WorkflowEvent> handleImplementation(WorkflowCommand command, ImplementationPhaseState impl,
                                                     Instant now) {
        ImplementationPhase phase = impl.phase();

        if (command instanceof WorkflowCommand.ImplementationRoundStarted c
                && phase == ImplementationPhase.IMPLEMENTING) {
            requireRound(c.iteration(), impl);
            return List.of(new ImplementationRoundStarted(c.iteration(), now));
        }
        if (command instanceof WorkflowCommand.ImplementationRoundCompleted c
                && phase == ImplementationPhase.IMPLEMENTING) {
            requireRound(c.iteration(), impl);
            return List.of(new ImplementationRoundCompleted(c.iteration(), c.fingerprint(), now));
        }
        if (command instanceof WorkflowCommand.ImplementationReviewCompleted c
                && phase == ImplementationPhase.IMPLEMENTATION_REVIEW) {
            requireRound(c.iteration(), impl);
            if (c.verdict() == null) {
                throw WorkflowException.invalidTransition("implementation review needs a verdict");
            }
            var reviewed = new ImplementationReviewCompleted(c.iteration(), c.verdict(), c.feedback(), now);
            if (c.verdict() == ImplementationVerdict.NEEDS_CHANGES && impl.iteration().reached(impl.maxIterations())) {
                return List.of(reviewed, new ImplementationMaxIterationsReached(now));
            }
            return List.of(reviewed);
        }
        if (command instanceof WorkflowCommand.ImplementationMaxIterationsReached
                && (phase == ImplementationPhase.IMPLEMENTING || phase == ImplementationPhase.IMPLEMENTATION_REVIEW)) {
            return List.of(new ImplementationMaxIterationsReached(now));
        }
        if (phase == ImplementationPhase.AWAITING_DECISION) {
            if (command instanceof WorkflowCommand.ImplementationAccepted) {
                return List.of(new ImplementationAccepted(now));
            }
            if (command instanceof WorkflowCommand.ImplementationDeclined c) {
                return List.of(new ImplementationDeclined(c.reason(), now));
            }
        }
        if (command instanceof WorkflowCommand.ImplementationCancelled c && phase != ImplementationPhase.COMPLETE) {
            return List.of(new ImplementationCancelled(c.reason(), now));
        }
        throw rejected(command);
    }

    private static void requireRound(Iteration requested, ImplementationPhaseState impl) {
        if (requested == null || !requested.equals(impl.iteration())) {
            throw WorkflowException.invalidTransition(
                    "implementation round " + requested + " does not match current round " + impl.iteration());
        }
    }

    private MaxIterations extendedMax(int additional) {
        if (additional > Integer.MAX_VALUE - data.maxIterations().value()) {
            throw WorkflowException.invalidTransition("cannot extend " + data.maxIterations()
                    + " iterations by " + additional);
        }
        return data.maxIterations().extendBy(additional);
    }

    private static void require(boolean condition, String message) {
        if (!condition) {
            throw WorkflowException.invalidTransition(message);
        }
    }

    private WorkflowException rejected(WorkflowCommand command) {
        return WorkflowException.invalidTransition("command '" + command.commandName()
                + "' not valid in phase '" + data.phaseLabel().fullLabel() + "'");
    }

    // -- Event application ---------------------------------------------------

    /**
     * Folds one event into the state. Never throws; events that make no sense for the
     * current state are logged and skipped.
     */
    public void apply(WorkflowEvent event) {
        try {
            applyEvent(event);
        } catch (RuntimeException e) {
            log.warn("Skipping {} that does not fit the current state: {}", event.eventType(), e.toString());
        }
    }

    private void applyEvent(WorkflowEvent event) {
        if (event instanceof WorkflowCreated e) {
            var created = new WorkflowData();
            created.featureName = e.featureName();
            created.objective = e.objective();
            created.workingDir = e.workingDir();
            created.maxIterations = e.maxIterations() != null ? e.maxIterations() : created.maxIterations;
            created.planPath = e.planPath();
            created.feedbackPath = e.feedbackPath();
            created.createdAt = e.timestamp();
            data = created;
            return;
        }
        if (data == null) {
            log.warn("Skipping {} applied before the workflow was created", event.eventType());
            return;
        }

        if (event instanceof PlanningStarted) {
            data.planningStarted = true;
        } else if (event instanceof PlanningCompleted e) {
            data.planPath = e.planPath() != null ? e.planPath() : data.planPath;
            data.planningPhase = Phase.REVIEWING;
        } else if (event instanceof ReviewCycleStarted e) {
            data.reviewMode = e.mode();
            data.cycleReviewers = new ArrayList<>(e.reviewers());
            data.cycleVotes.clear();
            data.sequentialReview = e.mode() == ReviewMode.SEQUENTIAL ? SequentialReviewState.start(e.reviewers()) : null;
        } else if (event instanceof ReviewerApproved e) {
            recordVote(e.reviewerId(), true);
        } else if (event instanceof ReviewerRejected e) {
            recordVote(e.reviewerId(), false);
            data.lastRejectingReviewer = e.reviewerId().value();
            if (e.feedbackPath() != null) {
                data.feedbackPath = e.feedbackPath();
            }
        } else if (event instanceof ReviewCycleCompleted e) {
            data.lastFeedbackStatus = e.approved() ? FeedbackStatus.APPROVED : FeedbackStatus.NEEDS_REVISION;
            endReviewCycle();
            data.planningPhase = e.approved() ? Phase.COMPLETE : Phase.REVISING;
        } else if (event instanceof PlanningMaxIterationsReached) {
            endReviewCycle();
            data.planningPhase = Phase.AWAITING_PLANNING_DECISION;
        } else if (event instanceof MaxIterationsExtended e) {
            if (e.newMax().value() > data.maxIterations.value()) {
                data.maxIterations = e.newMax();
            }
        } else if (event instanceof RevisingStarted e) {
            data.feedbackSummary = e.feedbackSummary();
            data.planningPhase = Phase.REVISING;
        } else if (event instanceof RevisionCompleted e) {
            data.iteration = data.iteration.next();
            data.planPath = e.planPath() != null ? e.planPath() : data.planPath;
            data.planningPhase = Phase.REVIEWING;
        } else if (event instanceof UserApproved || event instanceof UserRequestedImplementation) {
            data.planningPhase = Phase.COMPLETE;
        } else if (event instanceof UserDeclined e) {
            data.userFeedback.add(e.feedback());
            data.feedbackSummary = e.feedback();
            data.planningPhase = Phase.REVISING;
        } else if (event instanceof UserOverrideApproval e) {
            data.approvalOverridden = true;
            data.overrideReason = e.overrideReason();
            data.planningPhase = Phase.COMPLETE;
        } else if (event instanceof UserAborted e) {
            cancel(e.reason());
        } else if (event instanceof ImplementationStarted e) {
            data.implementationState = ImplementationPhaseState.start(e.maxIterations());
        } else if (event instanceof ImplementationRoundStarted) {
            updateImplementation(event, impl -> impl.withPhase(ImplementationPhase.IMPLEMENTING));
        } else if (event instanceof ImplementationRoundCompleted e) {
            data.lastFingerprint = e.fingerprint();
            updateImplementation(event, impl -> impl.withPhase(ImplementationPhase.IMPLEMENTATION_REVIEW));
        } else if (event instanceof ImplementationReviewCompleted e) {
            updateImplementation(event, impl -> {
                var reviewed = impl.withReview(e.verdict(), e.feedback());
                if (e.verdict() == ImplementationVerdict.APPROVED) {
                    return reviewed.withPhase(ImplementationPhase.COMPLETE);
                }
                return reviewed.iteration().reached(reviewed.maxIterations()) ? reviewed : reviewed.nextRound();
            });
        } else if (event instanceof ImplementationMaxIterationsReached) {
            updateImplementation(event, impl -> impl.withPhase(ImplementationPhase.AWAITING_DECISION));
        } else if (event instanceof ImplementationAccepted) {
            updateImplementation(event, impl -> impl.withPhase(ImplementationPhase.COMPLETE));
        } else if (event instanceof ImplementationDeclined e) {
            if (e.reason() != null) {
                data.userFeedback.add(e.reason());
            }
            updateImplementation(event, impl -> impl.extended(1, e.reason()));
        } else if (event instanceof ImplementationCancelled e) {
            cancel(e.reason());
        } else if (event instanceof AgentConversationRecorded e) {
            if (e.agentId() == null) {
                log.warn("Skipping {} without an agent id", event.eventType());
                return;
            }
            data.agentConversations.put(e.agentId().value(),
                    new AgentConversationState(e.resumeStrategy(), e.conversationId(), e.timestamp()));
        } else if (event instanceof InvocationRecorded e) {
            data.invocations.add(new InvocationRecord(e.agentId(), e.phase(), e.timestamp(),
                    e.conversationId(), e.resumeStrategy()));
        } else if (event instanceof FailureRecorded e) {
            data.lastFailure = e.failure();
            data.failureHistory.add(e.failure());
            while (data.failureHistory.size() > MAX_FAILURE_HISTORY) {
                data.failureHistory.remove(0);
            }
        } else if (event instanceof WorktreeAttached e) {
            data.worktree = e.worktreeState();
        } else {
            log.warn("Skipping unknown event type {}", event.eventType());
        }
    }

    private void recordVote(AgentId reviewer, boolean approved) {
        data.cycleVotes.put(reviewer.value(), approved);
        data.reviewerRunCounts.merge(reviewer.value(), 1, Integer::sum);
        SequentialReviewState sequential = data.sequentialReview;
        if (sequential != null && sequential.isTurnOf(reviewer)) {
            sequential.recordCompleted(reviewer);
        }
    }

    private void endReviewCycle() {
        data.reviewMode = null;
        data.sequentialReview = null;
    }

    private void cancel(String reason) {
        data.cancelled = true;
        data.cancelReason = reason;
    }

    private void updateImplementation(WorkflowEvent event, UnaryOperator<ImplementationPhaseState> change) {
        if (data.implementationState == null) {
            log.warn("Skipping {} without an implementation in progress", event.eventType());
            return;
        }
        data.implementationState = change.apply(data.implementationState);
    }
}
