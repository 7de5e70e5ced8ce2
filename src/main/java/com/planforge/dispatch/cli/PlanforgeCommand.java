package com.planforge.dispatch.cli;

import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.Command;

/**
 * Top-level CLI command for PlanForge.
 */
@Command(
        name = "planforge",
        mixinStandardHelpOptions = true,
        version = "PlanForge 0.1.0",
        description = "Plan, review and implement features with AI agents",
        subcommands = {
                DaemonCommand.class,
                SessionsCommand.class,
                StopCommand.class,
                FilesCommand.class,
                StatusCommand.class,
                CreateCommand.class,
                UpgradeCommand.class,
                VersionCommand.class,
                CommandLine.HelpCommand.class
        }
)
@Component
public class PlanforgeCommand implements Runnable {

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        new CommandLine(this).usage(System.out);
    }
}
