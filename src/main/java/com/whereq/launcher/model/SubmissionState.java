package com.whereq.launcher.model;

/**
 * Submission lifecycle states
 *
 * State transitions:
 * UNSUBMITTED → VALIDATING → DISPATCHING → {SUBMITTED, FAILED}
 * VALIDATING → FAILED
 */
public enum SubmissionState {
    /**
     * Request received, nothing checked yet
     */
    UNSUBMITTED,

    /**
     * Resolving configuration, dependencies and resources
     */
    VALIDATING,

    /**
     * The single dispatch attempt is in flight
     */
    DISPATCHING,

    /**
     * The cluster accepted the job
     */
    SUBMITTED,

    /**
     * Validation or dispatch failed
     */
    FAILED;

    /**
     * Check if this is a terminal state
     */
    public boolean isTerminal() {
        return this == SUBMITTED || this == FAILED;
    }

    /**
     * Check if moving to {@code next} is a legal transition
     */
    public boolean canTransitionTo(SubmissionState next) {
        switch (this) {
            case UNSUBMITTED:
                return next == VALIDATING;
            case VALIDATING:
                return next == DISPATCHING || next == FAILED;
            case DISPATCHING:
                return next == SUBMITTED || next == FAILED;
            default:
                return false;
        }
    }

    /**
     * Move to {@code next}
     *
     * @return next
     * @throws IllegalStateException if the transition is not allowed
     */
    public SubmissionState transitionTo(SubmissionState next) {
        if (!canTransitionTo(next)) {
            throw new IllegalStateException("Illegal submission state transition: " + this + " -> " + next);
        }
        return next;
    }
}
