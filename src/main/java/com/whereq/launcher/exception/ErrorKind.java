package com.whereq.launcher.exception;

/**
 * Every way a launch can fail.
 * Kinds in every category but {@link ErrorCategory#DISPATCH} are raised before anything is
 * sent to the cluster.
 */
public enum ErrorKind {
    INVALID_ARGUMENTS(ErrorCategory.USAGE),

    CONFIG_NOT_FOUND(ErrorCategory.CONFIGURATION),
    CONFIG_UNREADABLE(ErrorCategory.CONFIGURATION),
    MISSING_CONFIG_KEY(ErrorCategory.CONFIGURATION),
    UNKNOWN_ENVIRONMENT(ErrorCategory.CONFIGURATION),
    INVALID_ENDPOINT(ErrorCategory.CONFIGURATION),

    DEPENDENCY_NOT_FOUND(ErrorCategory.DEPENDENCY),
    DUPLICATE_DEPENDENCY(ErrorCategory.DEPENDENCY),
    INVALID_PACKAGE_COORDINATE(ErrorCategory.DEPENDENCY),
    INVALID_DEPENDENCY_PATH(ErrorCategory.DEPENDENCY),

    INVALID_RESOURCE_SPEC(ErrorCategory.RESOURCE),

    DISPATCH_TIMEOUT(ErrorCategory.DISPATCH),
    DISPATCH_REJECTED(ErrorCategory.DISPATCH),
    MASTER_UNREACHABLE(ErrorCategory.DISPATCH),
    DISPATCHER_UNAVAILABLE(ErrorCategory.DISPATCH);

    private final ErrorCategory category;

    ErrorKind(ErrorCategory category) {
        this.category = category;
    }

    public ErrorCategory getCategory() {
        return category;
    }

    public int getExitCode() {
        return category.getExitCode();
    }
}
