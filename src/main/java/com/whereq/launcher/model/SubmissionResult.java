package com.whereq.launcher.model;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.List;

/**
 * Outcome of a launch: the cluster's submission id on success, a structured error otherwise.
 */
@Value
@Builder
public class SubmissionResult {
    /**
     * Terminal state, SUBMITTED or FAILED
     */
    SubmissionState state;

    /**
     * Identifier reported by the cluster runtime, if it reported one
     */
    String submissionId;

    /**
     * Why the launch failed, null on success
     */
    LaunchError error;

    /**
     * The spark-submit arguments that were dispatched, empty if validation failed first
     */
    @Builder.Default
    List<String> command = List.of();

    Instant completedAt;

    public static SubmissionResult submitted(String submissionId, List<String> command) {
        return SubmissionResult.builder()
                .state(SubmissionState.SUBMITTED)
                .submissionId(submissionId)
                .command(List.copyOf(command))
                .completedAt(Instant.now())
                .build();
    }

    public static SubmissionResult failed(LaunchError error, List<String> command) {
        return SubmissionResult.builder()
                .state(SubmissionState.FAILED)
                .error(error)
                .command(List.copyOf(command))
                .completedAt(Instant.now())
                .build();
    }

    public boolean isSuccess() {
        return state == SubmissionState.SUBMITTED;
    }

    /**
     * Process exit code for script-based callers
     */
    public int getExitCode() {
        return isSuccess() ? 0 : error.getKind().getExitCode();
    }
}
