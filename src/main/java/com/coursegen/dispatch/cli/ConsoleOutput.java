package com.coursegen.dispatch.cli;

import com.coursegen.core.events.GenerationEvent;
import com.coursegen.core.model.RunResult;
import com.coursegen.core.model.RunState;
import com.coursegen.core.model.RunStatus;
import com.coursegen.core.model.UnitFailure;
import picocli.CommandLine;

import java.util.List;

/**
 * ANSI-colored terminal output utilities for the coursegen CLI.
 */
public class ConsoleOutput {

    private ConsoleOutput() {
        // utility class
    }

    public static void printBanner() {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|bold,fg(yellow) COURSEGEN v0.1.0|@"));
        System.out.println("──────────────────────────────────");
    }

    public static void info(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(cyan) [COURSEGEN]|@ " + message));
    }

    public static void success(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(green) +|@ " + message));
    }

    public static void warn(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(yellow) !|@ " + message));
    }

    public static void error(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(red) x|@ " + message));
    }

    /**
     * Prints one line per unit-level event as the run progresses.
     */
    public static void event(GenerationEvent event) {
        if (event.unitId() == null) {
            return;
        }
        String color = switch (event.eventType()) {
            case "unit.completed" -> "fg(green)";
            case "unit.failed" -> "fg(red)";
            case "unit.partial", "unit.deferred" -> "fg(yellow)";
            default -> "fg(blue)";
        };
        String label = event.eventType().substring(event.eventType().indexOf('.') + 1).toUpperCase();
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "  @|" + color + " [" + label + "]|@ " + event.unitId()));
    }

    public static void runResult(RunResult result) {
        System.out.println();
        System.out.println("RUN " + result.runId() + " (" + result.scope() + ")");
        if (result.artifact() != null) {
            runState(result.artifact());
        }
        for (String warning : result.warnings()) {
            warn(warning);
        }
        failures(result.failures());
        if (result.assembly() != null && result.assembly().documentKey() != null) {
            success("Document: " + result.assembly().documentKey());
        }
        if (result.continuation() != null) {
            info("Pending units: " + String.join(", ", result.continuation().unitIds()));
            info("Continue with: coursegen resume " + result.runId());
        }

        System.out.println();
        if (result.status() == RunStatus.COMPLETED) {
            success("Run complete.");
        } else if (result.status() == RunStatus.PARTIALLY_COMPLETED) {
            warn("Run partially completed.");
        } else {
            error("Run " + result.status().name().toLowerCase() + ".");
        }
    }

    public static void runState(RunState state) {
        System.out.println("  Revision: " + state.revision());
        System.out.println("  Units: " + state.unitsCompleted() + "/" + state.unitsTotal()
                + " (" + state.completionStatus() + ")");
        System.out.println("  Entries: " + state.accumulatedContent().size()
                + " | Images: " + state.imageBindings().size());
        if (!state.pendingUnits().isEmpty()) {
            System.out.println("  Pending: " + state.pendingUnits().size() + " unit(s)");
        }
    }

    private static void failures(List<UnitFailure> failures) {
        if (failures.isEmpty()) {
            return;
        }
        System.out.println();
        error("Failed units (" + failures.size() + "):");
        for (var f : failures) {
            error(String.format("  %s %s at %s [%s] %s", f.unitId(), f.targetRefs(),
                    f.stage() != null ? f.stage() : "merge", f.errorClass(), f.message()));
        }
    }
}
