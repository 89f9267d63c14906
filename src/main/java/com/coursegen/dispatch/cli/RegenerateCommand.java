package com.coursegen.dispatch.cli;

import com.coursegen.core.engine.GenerationEngine;
import com.coursegen.core.events.EventBus;
import com.coursegen.core.model.RunResult;
import com.coursegen.core.outline.StructuralValidationException;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.util.List;
import java.util.concurrent.Callable;

/**
 * CLI command: coursegen regenerate &lt;run-id&gt; --target 01-02 [--target 01-03-01]
 * <p>
 * Replaces the targeted lessons or labs of a completed run, leaving every other entry untouched.
 */
@Command(name = "regenerate", mixinStandardHelpOptions = true,
        description = "Regenerate selected lessons or labs of a completed run")
@Component
public class RegenerateCommand implements Callable<Integer> {

    @Parameters(index = "0", description = "Run ID to regenerate into")
    private String runId;

    @Option(names = {"--target", "-t"}, required = true, split = ",",
            description = "Lesson refs (MM-LL) or lab ids (MM-LL-NN) to regenerate")
    private List<String> targets;

    @Option(names = {"--outline", "-o"}, description = "Outline storage key (default: the run's outline)")
    private String outlineRef;

    private final GenerationEngine engine;
    private final EventBus eventBus;

    public RegenerateCommand(GenerationEngine engine, EventBus eventBus) {
        this.engine = engine;
        this.eventBus = eventBus;
    }

    @Override
    public Integer call() {
        ConsoleOutput.printBanner();
        ConsoleOutput.info("Regenerating " + String.join(", ", targets) + " in run " + runId + "...");

        var subscription = eventBus.subscribe(runId, ConsoleOutput::event);
        RunResult result;
        try {
            result = engine.regenerate(runId, outlineRef, targets);
        } catch (StructuralValidationException e) {
            ConsoleOutput.error("Rejected: " + String.join("; ", e.problems()));
            return CliSupport.EXIT_REJECTED;
        } catch (Exception e) {
            ConsoleOutput.error("Regeneration failed: " + CliSupport.rootCauseMessage(e));
            return CliSupport.EXIT_FAILED;
        } finally {
            subscription.unsubscribe();
        }

        ConsoleOutput.runResult(result);
        return CliSupport.exitCode(result);
    }
}
