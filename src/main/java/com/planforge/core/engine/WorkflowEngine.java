package com.planforge.core.engine;

import com.planforge.core.actor.ActorArgs;
import com.planforge.core.actor.WorkflowSupervisor;
import com.planforge.core.config.PlanforgeProperties;
import com.planforge.core.logging.MdcContext;
import com.planforge.core.metrics.PlanforgeMetrics;
import com.planforge.core.model.PhaseLabel;
import com.planforge.core.model.WorkflowId;
import com.planforge.core.policy.FailureContext;
import com.planforge.core.policy.FailureKind;
import com.planforge.core.policy.FailurePolicy;
import com.planforge.core.policy.RecoveryAction;
import com.planforge.core.view.WorkflowView;
import com.planforge.core.workflow.WorkflowCommand;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.time.Clock;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Entry point for running workflows inside one process.
 * <p>
 * Every workflow gets its own supervised actor, so sessions run in parallel while each
 * session's commands are applied strictly in submission order. State lives under
 * {@code <home>/state/<workflow-id>/}.
 */
@Service
public class WorkflowEngine {

    private static final Logger log = LoggerFactory.getLogger(WorkflowEngine.class);

    private final PlanforgeProperties properties;
    private final PlanforgeMetrics metrics;
    private final FailurePolicy failurePolicy;
    private final Clock clock;

    private final ConcurrentHashMap<WorkflowId, WorkflowSupervisor> workflows = new ConcurrentHashMap<>();

    public WorkflowEngine(PlanforgeProperties properties, PlanforgeMetrics metrics, FailurePolicy failurePolicy,
                          Clock clock) {
        this.properties = properties;
        this.metrics = metrics;
        this.failurePolicy = failurePolicy;
        this.clock = clock;
    }

    /**
     * Creates a new workflow and returns its view after creation.
     */
    public WorkflowView create(WorkflowCommand.CreateWorkflow command) {
        WorkflowId id = WorkflowId.newId();
        MdcContext.setSession(id.toString());
        try {
            log.info("Creating workflow {} for feature {}", id, command.featureName());
            return open(id).execute(command);
        } finally {
            MdcContext.clear();
        }
    }

    /**
     * Returns the running supervisor for a workflow, starting one from its event log if needed.
     */
    public WorkflowSupervisor open(WorkflowId id) {
        return workflows.compute(id, (key, existing) -> {
            if (existing != null && existing.isRunning()) {
                return existing;
            }
            var workflow = properties.getWorkflow();
            var args = new ActorArgs(key, logPath(key), stateDir(key).resolve("snapshot.json"),
                    workflow.getSnapshotEvery(), clock);
            return WorkflowSupervisor.start(args, metrics, workflow.getMaxRestarts(), workflow.getBroadcastCapacity());
        });
    }

    public WorkflowView execute(WorkflowId id, WorkflowCommand command) {
        return open(id).execute(command);
    }

    /**
     * Records a failure and decides how to recover from it, taking the workflow's failure
     * history into account.
     */
    public RecoveryAction recordFailure(WorkflowId id, String agentName, String errorMessage, int retryCount) {
        WorkflowSupervisor supervisor = open(id);
        WorkflowView view = supervisor.currentView();
        PhaseLabel phase = view.phase() != null ? view.phase() : PhaseLabel.PLANNING;
        FailureContext failure = FailureContext.of(FailureKind.classify(errorMessage), errorMessage, phase,
                agentName, failurePolicy.maxRetries(), clock.instant());
        for (int i = 0; i < retryCount; i++) {
            failure = failure.incrementRetry();
        }
        RecoveryAction action = failurePolicy.decide(failure, view.failureHistory());
        supervisor.execute(new WorkflowCommand.RecordFailure(failure.withRecoveryAction(action)));
        log.info("Workflow {}: {} failure from {} -> {}", id, failure.kind().category(), agentName, action);
        return action;
    }

    public Path stateDir(WorkflowId id) {
        return properties.homePath().resolve("state").resolve(id.toString());
    }

    public Path logPath(WorkflowId id) {
        return stateDir(id).resolve("events.jsonl");
    }

    public Set<WorkflowId> openWorkflows() {
        return Set.copyOf(workflows.keySet());
    }

    public void close(WorkflowId id) {
        WorkflowSupervisor supervisor = workflows.remove(id);
        if (supervisor != null) {
            supervisor.stop();
        }
    }

    @PreDestroy
    public void stopAll() {
        for (Map.Entry<WorkflowId, WorkflowSupervisor> entry : workflows.entrySet()) {
            entry.getValue().stop();
        }
        workflows.clear();
        log.info("Workflow engine stopped");
    }
}
