package com.coursegen.dispatch.cli;

import com.coursegen.core.engine.GenerationEngine;
import com.coursegen.core.events.EventBus;
import com.coursegen.core.model.RunResult;
import com.coursegen.core.outline.StructuralValidationException;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

import java.util.concurrent.Callable;

/**
 * CLI command: coursegen resume &lt;run-id&gt;
 * <p>
 * Dispatches the units a partially completed run left pending.
 */
@Command(name = "resume", mixinStandardHelpOptions = true, description = "Continue a partially completed run")
@Component
public class ResumeCommand implements Callable<Integer> {

    @Parameters(index = "0", description = "Run ID")
    private String runId;

    private final GenerationEngine engine;
    private final EventBus eventBus;

    public ResumeCommand(GenerationEngine engine, EventBus eventBus) {
        this.engine = engine;
        this.eventBus = eventBus;
    }

    @Override
    public Integer call() {
        ConsoleOutput.printBanner();
        ConsoleOutput.info("Resuming run " + runId + "...");

        var subscription = eventBus.subscribe(runId, ConsoleOutput::event);
        RunResult result;
        try {
            result = engine.resume(runId);
        } catch (StructuralValidationException e) {
            ConsoleOutput.error("Rejected: " + String.join("; ", e.problems()));
            return CliSupport.EXIT_REJECTED;
        } catch (Exception e) {
            ConsoleOutput.error("Resume failed: " + CliSupport.rootCauseMessage(e));
            return CliSupport.EXIT_FAILED;
        } finally {
            subscription.unsubscribe();
        }

        ConsoleOutput.runResult(result);
        return CliSupport.exitCode(result);
    }
}
