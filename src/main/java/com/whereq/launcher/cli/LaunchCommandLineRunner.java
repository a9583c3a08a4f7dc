package com.whereq.launcher.cli;

import com.whereq.launcher.LauncherApplication;
import com.whereq.launcher.dto.LaunchRequest;
import com.whereq.launcher.exception.ErrorKind;
import com.whereq.launcher.exception.LaunchException;
import com.whereq.launcher.model.JobDescriptor;
import com.whereq.launcher.model.SubmissionResult;
import com.whereq.launcher.service.LaunchService;
import com.whereq.launcher.submit.SparkSubmitCommandSerializer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.boot.convert.DurationStyle;
import org.springframework.context.annotation.Profile;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Command line entry point: launches one job from the program arguments and records the
 * process exit code.
 * <p>
 * Options use the {@code --name=value} form. List options may be repeated or comma separated,
 * empty entries are skipped, and a list option given without a value ships nothing for that list.
 *
 * @author WhereQ Inc.
 */
@Slf4j
@Component
@Profile("!" + LauncherApplication.SERVER_PROFILE)
@RequiredArgsConstructor
public class LaunchCommandLineRunner implements ApplicationRunner, ExitCodeGenerator {

    static final String USAGE = "Usage: whereq-launcher <config-file> <environment>"
            + " [--data-file=PATH]... [--code-file=PATH]... [--package=GROUP:ARTIFACT:VERSION]..."
            + " [--driver-memory=SIZE] [--executor-memory=SIZE] [--driver-cores=N] [--executor-cores=N]"
            + " [--num-executors=N] [--master=HOST:PORT] [--entry-point=PATH] [--timeout=DURATION] [--dry-run]";

    private final LaunchService launchService;
    private final SparkSubmitCommandSerializer serializer;

    private int exitCode;

    @Override
    public void run(ApplicationArguments args) {
        try {
            LaunchRequest request = toRequest(args);

            if (args.containsOption("dry-run")) {
                JobDescriptor descriptor = launchService.prepare(request);
                log.info("Dry run, nothing dispatched: spark-submit {}",
                        serializer.toShellString(serializer.render(descriptor)));
                exitCode = 0;
                return;
            }

            SubmissionResult result = launchService.launch(request);
            exitCode = result.getExitCode();
            if (result.isSuccess()) {
                log.info("Job accepted by the cluster, submission id {}", result.getSubmissionId());
            } else {
                log.error("Job launch failed: {}", result.getError().describe());
            }
        } catch (LaunchException e) {
            log.error("Job launch failed: {}", e.getMessage());
            if (e.getKind() == ErrorKind.INVALID_ARGUMENTS) {
                log.error(USAGE);
            }
            exitCode = e.getKind().getExitCode();
        }
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }

    LaunchRequest toRequest(ApplicationArguments args) {
        List<String> positional = args.getNonOptionArgs();
        if (positional.size() != 2) {
            throw new LaunchException(ErrorKind.INVALID_ARGUMENTS,
                    "Expected <config-file> <environment>, got " + positional.size() + " positional arguments");
        }

        return LaunchRequest.builder()
                .configFile(positional.get(0))
                .environment(positional.get(1))
                .dataFiles(list(args, "data-file"))
                .codeFiles(list(args, "code-file"))
                .packages(list(args, "package"))
                .driverMemory(single(args, "driver-memory"))
                .executorMemory(single(args, "executor-memory"))
                .driverCores(integer(args, "driver-cores"))
                .executorCores(integer(args, "executor-cores"))
                .numExecutors(integer(args, "num-executors"))
                .master(single(args, "master"))
                .entryPoint(single(args, "entry-point"))
                .timeout(duration(args, "timeout"))
                .build();
    }

    private static List<String> list(ApplicationArguments args, String option) {
        List<String> values = args.getOptionValues(option);
        if (values == null) {
            return null;
        }
        List<String> split = new ArrayList<>();
        for (String value : values) {
            for (String part : value.split(",")) {
                if (!part.isBlank()) {
                    split.add(part.strip());
                }
            }
        }
        return split;
    }

    private static String single(ApplicationArguments args, String option) {
        List<String> values = args.getOptionValues(option);
        if (values == null) {
            return null;
        }
        if (values.size() != 1) {
            throw new LaunchException(ErrorKind.INVALID_ARGUMENTS,
                    "Option --" + option + " takes exactly one value", String.join(",", values));
        }
        return values.get(0);
    }

    private static Integer integer(ApplicationArguments args, String option) {
        String value = single(args, option);
        if (value == null) {
            return null;
        }
        try {
            return Integer.valueOf(value);
        } catch (NumberFormatException e) {
            throw new LaunchException(ErrorKind.INVALID_RESOURCE_SPEC,
                    "Option --" + option + " expects a positive integer", value, e);
        }
    }

    private static Duration duration(ApplicationArguments args, String option) {
        String value = single(args, option);
        if (value == null) {
            return null;
        }
        try {
            Duration duration = DurationStyle.detectAndParse(value);
            if (duration.isNegative() || duration.isZero()) {
                throw new LaunchException(ErrorKind.INVALID_ARGUMENTS,
                        "Option --" + option + " must be a positive duration", value);
            }
            return duration;
        } catch (IllegalArgumentException e) {
            throw new LaunchException(ErrorKind.INVALID_ARGUMENTS,
                    "Option --" + option + " expects a duration such as 30s, 10m or PT10M", value, e);
        }
    }
}
