package com.planforge.dispatch.cli;

import com.planforge.core.engine.WorkflowEngine;
import com.planforge.core.model.WorkflowId;
import com.planforge.core.view.WorkflowView;
import com.planforge.core.workflow.WorkflowException;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

import java.nio.file.Files;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * CLI command: planforge status &lt;workflow-id&gt;
 * <p>
 * Replays a workflow's event log and prints where it stands.
 */
@Command(name = "status", mixinStandardHelpOptions = true, description = "Show the state of a workflow")
@Component
public class StatusCommand implements Runnable {

    @Parameters(index = "0", description = "Workflow ID")
    private String workflowId;

    private final WorkflowEngine engine;

    public StatusCommand(WorkflowEngine engine) {
        this.engine = engine;
    }

    @Override
    public void run() {
        WorkflowId id;
        try {
            id = WorkflowId.parse(workflowId);
        } catch (IllegalArgumentException e) {
            ConsoleOutput.error("Not a workflow ID: " + workflowId);
            return;
        }
        if (!Files.exists(engine.logPath(id))) {
            ConsoleOutput.error("Workflow not found: " + id);
            return;
        }

        try {
            WorkflowView view = engine.open(id).queryView().get(10, TimeUnit.SECONDS);
            print(view);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            ConsoleOutput.error("Interrupted");
        } catch (ExecutionException | TimeoutException | WorkflowException e) {
            ConsoleOutput.error("Could not load workflow " + id + ": " + e.getMessage());
        } finally {
            engine.close(id);
        }
    }

    private static void print(WorkflowView view) {
        ConsoleOutput.info("Workflow " + view.workflowId());
        System.out.println("  Feature:    " + (view.featureName() != null ? view.featureName().value() : "-"));
        System.out.println("  Objective:  " + (view.objective() != null ? view.objective().value() : "-"));
        System.out.println("  Status:     " + view.statusLine());
        if (view.maxIterations() != null) {
            System.out.println("  Max rounds: " + view.maxIterations().value());
        }
        System.out.println("  Events:     " + view.lastEventSequence());
        if (view.hasFailure()) {
            ConsoleOutput.error("Last failure: " + view.lastFailure().kind().category() + " - "
                    + view.lastFailure().message());
        }
        if (view.cancelReason() != null) {
            ConsoleOutput.error("Cancelled: " + view.cancelReason());
        }
    }
}
