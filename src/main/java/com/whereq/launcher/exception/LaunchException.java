package com.whereq.launcher.exception;

import com.whereq.launcher.model.LaunchError;

/**
 * Exception thrown when a launch cannot proceed.
 * Carries a structured {@link LaunchError} so callers can branch on the kind instead of
 * parsing the message.
 */
public class LaunchException extends RuntimeException {

    private final LaunchError error;

    public LaunchException(ErrorKind kind, String detail) {
        this(kind, detail, null);
    }

    public LaunchException(ErrorKind kind, String detail, String offendingValue) {
        this(new LaunchError(kind, detail, offendingValue), null);
    }

    public LaunchException(ErrorKind kind, String detail, String offendingValue, Throwable cause) {
        this(new LaunchError(kind, detail, offendingValue), cause);
    }

    private LaunchException(LaunchError error, Throwable cause) {
        super(error.describe(), cause);
        this.error = error;
    }

    public LaunchError getError() {
        return error;
    }

    public ErrorKind getKind() {
        return error.getKind();
    }
}
