package com.coursegen.dispatch.cli;

import com.coursegen.core.engine.GenerationEngine;
import com.coursegen.core.model.ContentEntry;
import com.coursegen.core.model.RunState;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.util.concurrent.Callable;

/**
 * CLI command: coursegen status &lt;run-id&gt;
 * <p>
 * Reads the stored run state and prints its progress.
 */
@Command(name = "status", mixinStandardHelpOptions = true, description = "Show the stored state of a run")
@Component
public class StatusCommand implements Callable<Integer> {

    @Parameters(index = "0", description = "Run ID")
    private String runId;

    @Option(names = {"--entries", "-e"}, description = "List every generated entry")
    private boolean entries;

    private final GenerationEngine engine;

    public StatusCommand(GenerationEngine engine) {
        this.engine = engine;
    }

    @Override
    public Integer call() {
        ConsoleOutput.printBanner();

        var stateOpt = engine.status(runId);
        if (stateOpt.isEmpty()) {
            ConsoleOutput.error("Run not found: " + runId);
            return CliSupport.EXIT_FAILED;
        }
        RunState state = stateOpt.get();

        System.out.println();
        System.out.println("RUN " + state.runId() + " (" + state.scope() + ")");
        if (state.context() != null) {
            System.out.println("  Outline: " + state.context().outlineRef());
            System.out.println("  Folder: " + state.context().projectFolder());
        }
        ConsoleOutput.runState(state);

        if (entries && !state.accumulatedContent().isEmpty()) {
            System.out.println();
            System.out.printf("  %-10s %-8s %-7s %s%n", "REF", "KIND", "IMAGES", "TITLE");
            System.out.println("  " + "-".repeat(60));
            for (ContentEntry e : state.accumulatedContent().values()) {
                System.out.printf("  %-10s %-8s %-7d %s%n",
                        e.targetRef(), e.kind(), e.imageIds().size(), truncate(e.title(), 36));
            }
        }
        if (!state.pendingUnits().isEmpty()) {
            System.out.println();
            ConsoleOutput.info("Continue with: coursegen resume " + state.runId());
        }

        System.out.println();
        if (state.isComplete()) {
            ConsoleOutput.success("Status: " + state.completionStatus());
        } else {
            ConsoleOutput.warn("Status: " + state.completionStatus());
        }
        return CliSupport.EXIT_OK;
    }

    private static String truncate(String s, int max) {
        if (s == null || s.isEmpty()) return "-";
        return s.length() <= max ? s : s.substring(0, max - 3) + "...";
    }
}
