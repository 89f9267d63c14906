package com.coursegen.dispatch.cli;

import com.coursegen.core.engine.GenerationEngine;
import com.coursegen.core.events.EventBus;
import com.coursegen.core.model.ContentScope;
import com.coursegen.core.model.GenerationMode;
import com.coursegen.core.model.GenerationRequest;
import com.coursegen.core.model.RunResult;
import com.coursegen.core.outline.StructuralValidationException;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;

/**
 * CLI command: coursegen generate &lt;outline&gt;
 * <p>
 * Runs a full generation of the outline, or of the selected modules and content kinds.
 */
@Command(name = "generate", mixinStandardHelpOptions = true, description = "Generate course content from an outline")
@Component
public class GenerateCommand implements Callable<Integer> {

    @Parameters(index = "0", description = "Storage key of the outline YAML")
    private String outlineRef;

    @Option(names = {"--modules", "-m"}, split = ",", description = "1-based module numbers to generate (default: all)")
    private List<Integer> modules = new ArrayList<>();

    @Option(names = {"--content", "-c"}, description = "ALL, LESSONS or LABS (default: ${DEFAULT-VALUE})",
            defaultValue = "ALL")
    private ContentScope content;

    @Option(names = "--provider", description = "Generation provider (default: configured)")
    private String provider;

    @Option(names = "--folder", description = "Project folder for generated artifacts")
    private String folder;

    @Option(names = "--run-id", description = "Explicit id for the new run")
    private String runId;

    @Option(names = "--override", description = "Prompt override as key=value (e.g. style=concise)")
    private Map<String, String> overrides = new LinkedHashMap<>();

    private final GenerationEngine engine;
    private final EventBus eventBus;

    public GenerateCommand(GenerationEngine engine, EventBus eventBus) {
        this.engine = engine;
        this.eventBus = eventBus;
    }

    @Override
    public Integer call() {
        ConsoleOutput.printBanner();
        ConsoleOutput.info("Generating from " + outlineRef + "...");

        var request = new GenerationRequest(runId, outlineRef, GenerationMode.NEW, List.of(), content,
                modules, provider, folder, overrides);
        var subscription = eventBus.subscribeAll(ConsoleOutput::event);
        RunResult result;
        try {
            result = engine.generate(request);
        } catch (StructuralValidationException e) {
            ConsoleOutput.error("Rejected: " + String.join("; ", e.problems()));
            return CliSupport.EXIT_REJECTED;
        } catch (Exception e) {
            ConsoleOutput.error("Generation failed: " + CliSupport.rootCauseMessage(e));
            return CliSupport.EXIT_FAILED;
        } finally {
            subscription.unsubscribe();
        }

        ConsoleOutput.runResult(result);
        return CliSupport.exitCode(result);
    }
}
