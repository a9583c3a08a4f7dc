package com.whereq.launcher.dispatch;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Strings;
import com.google.common.collect.EvictingQueue;
import com.whereq.launcher.config.LauncherProperties;
import com.whereq.launcher.exception.ErrorKind;
import com.whereq.launcher.exception.LaunchException;
import com.whereq.launcher.model.DispatchReceipt;
import com.whereq.launcher.model.SubmitInvocation;
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import reactor.core.scheduler.Schedulers;

import java.io.BufferedReader;
import java.io.File;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Queue;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Dispatches jobs by running the spark-submit executable.
 * <p>
 * The first submission id in the output counts as the cluster's acknowledgement and the
 * dispatch returns at that point; the remaining output is logged in the background. Without
 * an id, exit code 0 means the cluster accepted the job.
 *
 * @author WhereQ Inc.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class SparkSubmitProcessDispatcher implements JobDispatcher {

    static final int OUTPUT_TAIL_LINES = 50;

    private static final List<Pattern> SUBMISSION_ID_PATTERNS = List.of(
            // standalone, cluster deploy mode
            Pattern.compile("Driver successfully submitted as (driver-[\\w-]+)"),
            // standalone, client deploy mode
            Pattern.compile("Connected to Spark cluster with app ID (app-[\\w-]+)"),
            // YARN
            Pattern.compile("Submitted application (application_\\d+_\\d+)"));

    private static final List<String> UNREACHABLE_MARKERS = List.of(
            "All masters are unresponsive",
            "Failed to connect to master",
            "Connection refused",
            "java.net.UnknownHostException",
            "java.net.NoRouteToHostException");

    private final LauncherProperties properties;

    private final Map<Process, String> detached = new ConcurrentHashMap<>();

    @Override
    public DispatchReceipt dispatch(SubmitInvocation invocation) {
        List<String> command = new ArrayList<>();
        command.add(findSparkSubmit());
        command.addAll(invocation.getArguments());

        ProcessBuilder processBuilder = new ProcessBuilder(command);
        processBuilder.redirectErrorStream(true);

        Process process;
        try {
            process = processBuilder.start();
        } catch (IOException e) {
            throw new LaunchException(ErrorKind.DISPATCHER_UNAVAILABLE,
                    "Failed to start spark-submit: " + e.getMessage(), command.get(0), e);
        }

        // Capture output until the cluster reports an id or the process ends
        Queue<String> tail = EvictingQueue.create(OUTPUT_TAIL_LINES);
        BufferedReader reader = new BufferedReader(
                new InputStreamReader(process.getInputStream(), StandardCharsets.UTF_8));
        String submissionId = null;
        try {
            String line;
            while (submissionId == null && (line = reader.readLine()) != null) {
                tail.add(line);
                log.debug("spark-submit: {}", line);
                submissionId = extractSubmissionId(line);
            }
        } catch (IOException e) {
            process.destroy();
            throw new LaunchException(ErrorKind.DISPATCH_REJECTED,
                    "Failed to read spark-submit output: " + e.getMessage(), null, e);
        }

        if (submissionId != null) {
            // In client mode spark-submit hosts the driver and only exits when the job does
            log.info("Cluster acknowledged job, submission id {}", submissionId);
            detach(submissionId, process, reader);
            return new DispatchReceipt(submissionId, String.join("\n", tail));
        }

        int exitCode;
        try (reader) {
            exitCode = process.waitFor();
        } catch (IOException e) {
            throw new LaunchException(ErrorKind.DISPATCH_REJECTED,
                    "Failed to close spark-submit output: " + e.getMessage(), null, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new LaunchException(ErrorKind.DISPATCH_TIMEOUT,
                    "Interrupted while waiting for spark-submit", null, e);
        }

        String output = String.join("\n", tail);
        if (exitCode != 0) {
            ErrorKind kind = isMasterUnreachable(tail) ? ErrorKind.MASTER_UNREACHABLE : ErrorKind.DISPATCH_REJECTED;
            throw new LaunchException(kind, "spark-submit exited with code " + exitCode + "\n" + output,
                    invocation.getDescriptor().getMasterEndpoint().toMasterUrl());
        }

        log.info("spark-submit accepted job without reporting a submission id");
        return new DispatchReceipt(null, output);
    }

    /**
     * Keep logging the output of an acknowledged submission until spark-submit exits.
     */
    private void detach(String submissionId, Process process, BufferedReader reader) {
        detached.put(process, submissionId);
        Schedulers.boundedElastic().schedule(() -> {
            try (reader) {
                String line;
                while ((line = reader.readLine()) != null) {
                    log.debug("spark-submit [{}]: {}", submissionId, line);
                }
                int exitCode = process.waitFor();
                if (exitCode == 0) {
                    log.info("spark-submit for {} finished", submissionId);
                } else {
                    log.warn("spark-submit for {} exited with code {}", submissionId, exitCode);
                }
            } catch (IOException e) {
                log.warn("Lost spark-submit output for {}: {}", submissionId, e.getMessage());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.warn("Stopped following spark-submit for {}", submissionId);
            } finally {
                detached.remove(process);
            }
        });
    }

    /**
     * Wait for acknowledged client-mode submissions, whose drivers live in the spark-submit
     * process and would lose their output pipe if the launcher exited first.
     */
    @PreDestroy
    public void awaitDetachedSubmissions() {
        for (Map.Entry<Process, String> entry : detached.entrySet()) {
            log.info("Waiting for spark-submit of {} to finish", entry.getValue());
            try {
                entry.getKey().waitFor();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.warn("Interrupted while waiting for spark-submit of {}", entry.getValue());
                return;
            }
        }
    }

    @VisibleForTesting
    int detachedCount() {
        return detached.size();
    }

    @VisibleForTesting
    static String extractSubmissionId(String line) {
        for (Pattern pattern : SUBMISSION_ID_PATTERNS) {
            Matcher matcher = pattern.matcher(line);
            if (matcher.find()) {
                return matcher.group(1);
            }
        }
        return null;
    }

    @VisibleForTesting
    static boolean isMasterUnreachable(Iterable<String> output) {
        for (String line : output) {
            for (String marker : UNREACHABLE_MARKERS) {
                if (line.contains(marker)) {
                    return true;
                }
            }
        }
        return false;
    }

    /**
     * Find spark-submit executable.
     */
    @VisibleForTesting
    String findSparkSubmit() {
        LauncherProperties.DispatchConfig dispatch = properties.getDispatch();
        if (!Strings.isNullOrEmpty(dispatch.getSparkSubmit())) {
            return dispatch.getSparkSubmit();
        }

        if (!Strings.isNullOrEmpty(dispatch.getSparkHome())) {
            File sparkSubmit = new File(dispatch.getSparkHome(), "bin/spark-submit");
            if (sparkSubmit.exists()) {
                return sparkSubmit.getAbsolutePath();
            }
            log.warn("No spark-submit under spark home {}, searching PATH", dispatch.getSparkHome());
        }

        String path = System.getenv("PATH");
        if (path != null) {
            for (String dir : path.split(File.pathSeparator)) {
                File sparkSubmit = new File(dir, "spark-submit");
                if (sparkSubmit.exists() && sparkSubmit.canExecute()) {
                    return sparkSubmit.getAbsolutePath();
                }
            }
        }

        // Let the process launch report it if this is not on the PATH either
        log.warn("Could not find spark-submit in spark home or PATH, using 'spark-submit'");
        return "spark-submit";
    }
}
