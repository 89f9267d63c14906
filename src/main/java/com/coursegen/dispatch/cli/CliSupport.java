package com.coursegen.dispatch.cli;

import com.coursegen.core.model.RunResult;
import com.coursegen.core.model.RunStatus;

/**
 * Exit codes shared by the run commands.
 */
final class CliSupport {

    static final int EXIT_OK = 0;
    static final int EXIT_FAILED = 1;
    static final int EXIT_PARTIAL = 2;
    static final int EXIT_REJECTED = 3;

    private CliSupport() {
    }

    static int exitCode(RunResult result) {
        if (result.status() == RunStatus.COMPLETED) {
            return EXIT_OK;
        }
        return result.status() == RunStatus.PARTIALLY_COMPLETED ? EXIT_PARTIAL : EXIT_FAILED;
    }

    static String rootCauseMessage(Throwable t) {
        Throwable cause = t;
        while (cause.getCause() != null) {
            cause = cause.getCause();
        }
        return cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
    }
}
