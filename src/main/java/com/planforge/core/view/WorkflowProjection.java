package com.planforge.core.view;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.planforge.core.model.WorkflowId;
import com.planforge.core.persistence.JsonSupport;
import com.planforge.core.persistence.StoredEvent;
import com.planforge.core.workflow.WorkflowAggregate;
import com.planforge.core.workflow.WorkflowData;
import com.planforge.core.workflow.WorkflowEvent;
import com.planforge.core.workflow.WorkflowEvent.ReviewCycleStarted;
import com.planforge.core.workflow.WorkflowEvent.ReviewerApproved;
import com.planforge.core.workflow.WorkflowEvent.ReviewerRejected;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;

/**
 * Folds persisted events into {@link WorkflowView} snapshots.
 * <p>
 * The projection keeps a private aggregate fed with the same events, so phase and counter
 * semantics are never re-implemented here. Owned by one actor; not thread-safe. The views it
 * hands out are immutable.
 */
public class WorkflowProjection {

    private static final Logger log = LoggerFactory.getLogger(WorkflowProjection.class);

    private final WorkflowId workflowId;
    private final WorkflowAggregate state = new WorkflowAggregate();
    private final List<ReviewerResult> currentCycleReviews = new ArrayList<>();
    private long lastEventSequence;
    private Instant updatedAt;

    public WorkflowProjection(WorkflowId workflowId) {
        this.workflowId = workflowId;
    }

    /**
     * Rebuilds a view from an event log, skipping lines that cannot be parsed and events
     * of other workflows.
     */
    public static WorkflowView bootstrapViewFromEvents(Path logPath, WorkflowId workflowId) {
        return bootstrapViewFromEvents(logPath, workflowId, JsonSupport.newObjectMapper());
    }

    public static WorkflowView bootstrapViewFromEvents(Path logPath, WorkflowId workflowId, ObjectMapper objectMapper) {
        var projection = new WorkflowProjection(workflowId);
        String id = workflowId.toString();
        try (BufferedReader reader = Files.newBufferedReader(logPath, StandardCharsets.UTF_8)) {
            String line;
            int lineNumber = 0;
            while ((line = reader.readLine()) != null) {
                lineNumber++;
                if (line.isBlank()) {
                    continue;
                }
                StoredEvent stored;
                try {
                    stored = objectMapper.readValue(line, StoredEvent.class);
                } catch (IOException e) {
                    log.warn("Skipping unparseable event at {} line {}: {}", logPath, lineNumber, e.getMessage());
                    continue;
                }
                if (id.equals(stored.aggregateId()) && stored.payload() != null) {
                    projection.applyEvent(stored.payload(), stored.sequence());
                }
            }
        } catch (NoSuchFileException e) {
            log.debug("No event log at {}, starting from an empty view", logPath);
        } catch (IOException e) {
            log.warn("Failed to read event log {}: {}", logPath, e.getMessage(), e);
        }
        return projection.view();
    }

    /**
     * Folds in one persisted event. Events at or below the last applied sequence are ignored,
     * which makes re-delivery harmless.
     */
    public void applyEvent(WorkflowEvent event, long sequence) {
        if (sequence <= lastEventSequence) {
            log.debug("Ignoring already applied event {} at sequence {}", event.eventType(), sequence);
            return;
        }
        state.apply(event);
        if (event instanceof ReviewCycleStarted) {
            currentCycleReviews.clear();
        } else if (event instanceof ReviewerApproved e && e.reviewerId() != null) {
            currentCycleReviews.add(new ReviewerResult(e.reviewerId().value(), true, null));
        } else if (event instanceof ReviewerRejected e && e.reviewerId() != null) {
            currentCycleReviews.add(new ReviewerResult(e.reviewerId().value(), false, e.feedbackPath()));
        }
        lastEventSequence = sequence;
        updatedAt = event.timestamp();
    }

    public long lastEventSequence() {
        return lastEventSequence;
    }

    /** Immutable snapshot of the current state. */
    public WorkflowView view() {
        WorkflowData d = state.data();
        if (d == null) {
            WorkflowView empty = WorkflowView.empty(workflowId);
            return lastEventSequence == 0 ? empty : withSequence(empty);
        }
        return new WorkflowView(
                workflowId,
                d.featureName(),
                d.objective(),
                d.workingDir(),
                d.phaseLabel(),
                d.iteration(),
                d.maxIterations(),
                d.planPath(),
                d.feedbackPath(),
                d.lastFeedbackStatus(),
                d.reviewMode(),
                List.copyOf(currentCycleReviews),
                Collections.unmodifiableMap(new LinkedHashMap<>(d.reviewerRunCounts())),
                d.approvalOverridden(),
                Collections.unmodifiableList(new ArrayList<>(d.userFeedback())),
                d.implementationState(),
                Collections.unmodifiableMap(new LinkedHashMap<>(d.agentConversations())),
                d.invocations().size(),
                d.lastFailure(),
                List.copyOf(d.failureHistory()),
                d.worktree(),
                d.cancelReason(),
                lastEventSequence,
                updatedAt);
    }

    private WorkflowView withSequence(WorkflowView empty) {
        return new WorkflowView(empty.workflowId(), null, null, null, null, null, null, null, null, null, null,
                List.of(), empty.reviewerRunCounts(), false, List.of(), null, empty.agentConversations(), 0, null,
                List.of(), null, null, lastEventSequence, updatedAt);
    }
}
