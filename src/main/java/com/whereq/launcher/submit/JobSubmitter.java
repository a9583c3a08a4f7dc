package com.whereq.launcher.submit;

import com.whereq.launcher.config.LauncherProperties;
import com.whereq.launcher.dispatch.JobDispatcher;
import com.whereq.launcher.exception.ErrorKind;
import com.whereq.launcher.exception.LaunchException;
import com.whereq.launcher.model.JobDescriptor;
import com.whereq.launcher.model.LaunchError;
import com.whereq.launcher.model.SubmissionResult;
import com.whereq.launcher.model.SubmissionState;
import com.whereq.launcher.model.SubmitInvocation;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.TimeoutException;

/**
 * Issues a job to the cluster through the {@link JobDispatcher}.
 * <p>
 * Every call makes exactly one dispatch attempt. Failures are reported, never retried.
 * Identical descriptors submitted twice become two independent cluster jobs.
 *
 * @author WhereQ Inc.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class JobSubmitter {

    static final String SUBMISSIONS_METRIC = "launcher.submissions";

    private final JobDispatcher dispatcher;
    private final SparkSubmitCommandSerializer serializer;
    private final LauncherProperties properties;
    private final MeterRegistry meterRegistry;

    /**
     * Submit with the configured dispatch timeout.
     *
     * @param descriptor the job
     * @return SUBMITTED with the cluster's submission id, or FAILED with the dispatch error
     */
    public SubmissionResult submit(JobDescriptor descriptor) {
        return submit(descriptor, null);
    }

    /**
     * Submit and block until the cluster acknowledges the job or the timeout elapses.
     *
     * @param descriptor the job
     * @param timeout    how long to wait for acknowledgement, null for the configured default
     * @return SUBMITTED with the cluster's submission id, or FAILED with the dispatch error
     */
    public SubmissionResult submit(JobDescriptor descriptor, Duration timeout) {
        return submitReactive(descriptor, timeout).block();
    }

    /**
     * Submit reactively.
     * On timeout the result is FAILED with DISPATCH_TIMEOUT; nothing is done to cancel the
     * job on the cluster side, whose state is then unknown.
     *
     * @param descriptor the job
     * @param timeout    how long to wait for acknowledgement, null for the configured default
     * @return Mono emitting exactly one terminal result
     */
    public Mono<SubmissionResult> submitReactive(JobDescriptor descriptor, Duration timeout) {
        Duration effectiveTimeout = timeout != null ? timeout : properties.getDispatch().getTimeout();
        List<String> command = serializer.render(descriptor);
        SubmitInvocation invocation = new SubmitInvocation(descriptor, command);
        String master = descriptor.getMasterEndpoint().toMasterUrl();

        return Mono.fromCallable(() -> {
                    log.info("Job state {}: spark-submit {}", SubmissionState.DISPATCHING,
                            serializer.toShellString(command));
                    return dispatcher.dispatch(invocation);
                })
                .subscribeOn(Schedulers.boundedElastic())
                .timeout(effectiveTimeout)
                .map(receipt -> SubmissionResult.submitted(receipt.getSubmissionId(), command))
                .onErrorResume(e -> Mono.just(SubmissionResult.failed(toError(e, effectiveTimeout, master), command)))
                .doOnNext(this::record);
    }

    private LaunchError toError(Throwable error, Duration timeout, String master) {
        if (error instanceof LaunchException) {
            return ((LaunchException) error).getError();
        }
        if (error instanceof TimeoutException) {
            return new LaunchError(ErrorKind.DISPATCH_TIMEOUT,
                    "No acknowledgement from the cluster within " + timeout + ", job state on the cluster is unknown",
                    master);
        }
        log.error("Unexpected dispatch failure", error);
        return new LaunchError(ErrorKind.DISPATCH_REJECTED, "Dispatch failed: " + error, master);
    }

    private void record(SubmissionResult result) {
        if (result.isSuccess()) {
            log.info("Job state {}: submission id {}", result.getState(), result.getSubmissionId());
            meterRegistry.counter(SUBMISSIONS_METRIC, "outcome", "submitted", "kind", "none").increment();
        } else {
            log.error("Job state {}: {}", result.getState(), result.getError().describe());
            meterRegistry.counter(SUBMISSIONS_METRIC, "outcome", "failed",
                    "kind", result.getError().getKind().name()).increment();
        }
    }
}
