package com.coursegen.dispatch.cli;

import com.coursegen.core.engine.GenerationEngine;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.IFactory;

/**
 * Bridges picocli with Spring Boot lifecycle.
 * Parses CLI arguments, delegates to the appropriate command and reports its exit code.
 * When the application is stopped mid-run (Ctrl-C), runs still executing are cancelled so
 * their queued units are deferred to a later {@code resume}.
 */
@Component
public class CliRunner implements CommandLineRunner, ExitCodeGenerator {

    private static final Logger log = LoggerFactory.getLogger(CliRunner.class);

    private final CoursegenCommand coursegenCommand;
    private final IFactory factory;
    private final GenerationEngine engine;
    private int exitCode;

    public CliRunner(CoursegenCommand coursegenCommand, IFactory factory, GenerationEngine engine) {
        this.coursegenCommand = coursegenCommand;
        this.factory = factory;
        this.engine = engine;
    }

    @Override
    public void run(String... args) {
        exitCode = new CommandLine(coursegenCommand, factory)
                .setCaseInsensitiveEnumValuesAllowed(true)
                .execute(args);
        log.debug("coursegen {} exited with {}", String.join(" ", args), exitCode);
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }

    @PreDestroy
    void cancelActiveRuns() {
        var cancelled = engine.cancelAll();
        if (!cancelled.isEmpty()) {
            log.warn("Shutting down with run(s) {} still executing; cancelled, resume them to finish", cancelled);
        }
    }
}
