package com.planforge.dispatch.cli;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.planforge.core.config.PlanforgeProperties;
import com.planforge.core.engine.WorkflowEngine;
import com.planforge.core.model.FeatureName;
import com.planforge.core.model.FeedbackPath;
import com.planforge.core.model.MaxIterations;
import com.planforge.core.model.Objective;
import com.planforge.core.model.PlanPath;
import com.planforge.core.model.WorkingDir;
import com.planforge.core.view.WorkflowView;
import com.planforge.core.workflow.WorkflowCommand;
import com.planforge.core.workflow.WorkflowException;
import com.planforge.daemon.SessionTracker;
import com.planforge.daemon.rpc.DaemonClient;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;

/**
 * CLI command: planforge create &lt;feature&gt; --objective "..."
 * <p>
 * Creates a workflow and starts its planning phase. With {@code --track} the session is
 * registered with the daemon and heartbeated until the command is interrupted.
 */
@Command(name = "create", mixinStandardHelpOptions = true, description = "Create a workflow and start planning")
@Component
public class CreateCommand implements Callable<Integer> {

    @Parameters(index = "0", description = "Feature name")
    private String feature;

    @Option(names = {"--objective", "-o"}, required = true, description = "What the feature should achieve")
    private String objective;

    @Option(names = {"--working-dir", "-d"}, description = "Project directory (default: current directory)")
    private String workingDir;

    @Option(names = {"--max-iterations"}, description = "Review rounds before asking the user (default: ${DEFAULT-VALUE})",
            defaultValue = "3")
    private int maxIterations;

    @Option(names = {"--track"}, description = "Report the session to the daemon until interrupted")
    private boolean track;

    private final WorkflowEngine engine;
    private final PlanforgeProperties properties;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public CreateCommand(WorkflowEngine engine, PlanforgeProperties properties, ObjectMapper objectMapper,
                         Clock clock) {
        this.engine = engine;
        this.properties = properties;
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    @Override
    public Integer call() throws Exception {
        ConsoleOutput.printBanner();
        Path dir = Path.of(workingDir != null ? workingDir : System.getProperty("user.dir")).toAbsolutePath();
        Path sessionDir = properties.homePath().resolve("sessions");

        WorkflowView view;
        try {
            var create = new WorkflowCommand.CreateWorkflow(FeatureName.of(feature), Objective.of(objective),
                    WorkingDir.of(dir.toString()), MaxIterations.of(maxIterations),
                    PlanPath.of(sessionDir.resolve(feature + "-plan.md").toString()),
                    FeedbackPath.of(sessionDir.resolve(feature + "-feedback.md").toString()));
            view = engine.create(create);
            view = engine.execute(view.workflowId(), new WorkflowCommand.StartPlanning());
        } catch (IllegalArgumentException | WorkflowException e) {
            ConsoleOutput.error(e.getMessage());
            return 1;
        }
        ConsoleOutput.success("Workflow " + view.workflowId() + " created: " + view.statusLine());

        if (!track) {
            engine.close(view.workflowId());
            return 0;
        }

        var home = properties.homePath();
        var supervisor = engine.open(view.workflowId());
        var done = new CountDownLatch(1);
        try (var tracker = new SessionTracker(() -> DaemonClient.connect(home, Duration.ofSeconds(2), objectMapper),
                clock, SessionTracker.DEFAULT_HEARTBEAT_INTERVAL)) {
            tracker.track(supervisor);
            Thread hook = new Thread(done::countDown, "planforge-create-shutdown");
            Runtime.getRuntime().addShutdownHook(hook);
            ConsoleOutput.info("Tracking session with the daemon. Press Ctrl+C to stop.");
            done.await();
        } finally {
            engine.close(view.workflowId());
        }
        return 0;
    }
}
