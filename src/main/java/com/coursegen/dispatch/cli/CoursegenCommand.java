package com.coursegen.dispatch.cli;

import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Spec;

/**
 * Top-level CLI command for coursegen.
 * Routes to subcommands: generate, regenerate, resume, status.
 */
@Command(
        name = "coursegen",
        mixinStandardHelpOptions = true,
        version = "coursegen 0.1.0",
        description = "Batch generation of course lessons, labs and images from an outline",
        subcommands = {
                GenerateCommand.class,
                RegenerateCommand.class,
                ResumeCommand.class,
                StatusCommand.class,
                CommandLine.HelpCommand.class
        }
)
@Component
public class CoursegenCommand implements Runnable {

    @Spec
    private CommandSpec spec;

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        spec.commandLine().usage(System.out);
    }
}
