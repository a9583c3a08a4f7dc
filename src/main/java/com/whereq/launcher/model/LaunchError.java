package com.whereq.launcher.model;

import com.whereq.launcher.exception.ErrorKind;
import lombok.Value;

/**
 * Structured description of a launch failure
 */
@Value
public class LaunchError {
    /**
     * What went wrong
     */
    ErrorKind kind;

    /**
     * Human-readable explanation
     */
    String detail;

    /**
     * The input that caused the failure, when there is one
     */
    String offendingValue;

    public String describe() {
        return offendingValue == null
                ? kind + ": " + detail
                : kind + ": " + detail + " [" + offendingValue + "]";
    }
}
