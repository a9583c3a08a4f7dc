package com.whereq.launcher.exception;

/**
 * Coarse grouping of launch failures, each mapped to a distinct process exit code so that
 * calling scripts can tell configuration problems from dispatch problems.
 */
public enum ErrorCategory {
    /**
     * Malformed command line
     */
    USAGE(64),

    /**
     * Config file, environment or endpoint problems
     */
    CONFIGURATION(2),

    /**
     * Artifacts that cannot be shipped with the job
     */
    DEPENDENCY(3),

    /**
     * Memory or CPU values outside the runtime grammar
     */
    RESOURCE(4),

    /**
     * Failures of the single dispatch attempt
     */
    DISPATCH(5);

    private final int exitCode;

    ErrorCategory(int exitCode) {
        this.exitCode = exitCode;
    }

    public int getExitCode() {
        return exitCode;
    }
}
