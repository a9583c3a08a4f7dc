package com.whereq.launcher.cli;

import com.whereq.launcher.dto.LaunchRequest;
import com.whereq.launcher.exception.ErrorKind;
import com.whereq.launcher.exception.LaunchException;
import com.whereq.launcher.model.ClusterEndpoint;
import com.whereq.launcher.model.DependencySet;
import com.whereq.launcher.model.JobDescriptor;
import com.whereq.launcher.model.LaunchError;
import com.whereq.launcher.model.ResourceRequest;
import com.whereq.launcher.model.SubmissionResult;
import com.whereq.launcher.service.LaunchService;
import com.whereq.launcher.submit.SparkSubmitCommandSerializer;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.boot.DefaultApplicationArguments;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

import static com.whereq.launcher.LaunchErrors.errorOf;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class LaunchCommandLineRunnerTest {

    @Mock
    private LaunchService launchService;

    private LaunchCommandLineRunner runner;

    @BeforeEach
    void setUp() {
        runner = new LaunchCommandLineRunner(launchService, new SparkSubmitCommandSerializer());
    }

    @Test
    void parsesPositionalArgumentsAndOptions() {
        LaunchRequest request = runner.toRequest(new DefaultApplicationArguments(
                "config/application.properties", "prod",
                "--data-file=data/taxi_zone_lookup.csv,data/borough.geojson",
                "--code-file=src/main/util.py",
                "--package=com.datastax.spark:spark-cassandra-connector_2.11:2.3.2",
                "--package=org.apache.commons:commons-csv:1.10.0",
                "--driver-memory=4G", "--executor-memory=4G",
                "--executor-cores=2", "--num-executors=5",
                "--master=spark-standby:7077", "--timeout=90s"));

        assertThat(request.getConfigFile()).isEqualTo("config/application.properties");
        assertThat(request.getEnvironment()).isEqualTo("prod");
        assertThat(request.getDataFiles()).containsExactly("data/taxi_zone_lookup.csv", "data/borough.geojson");
        assertThat(request.getCodeFiles()).containsExactly("src/main/util.py");
        assertThat(request.getPackages()).containsExactly(
                "com.datastax.spark:spark-cassandra-connector_2.11:2.3.2", "org.apache.commons:commons-csv:1.10.0");
        assertThat(request.getDriverMemory()).isEqualTo("4G");
        assertThat(request.getExecutorCores()).isEqualTo(2);
        assertThat(request.getNumExecutors()).isEqualTo(5);
        assertThat(request.getDriverCores()).isNull();
        assertThat(request.getMaster()).isEqualTo("spark-standby:7077");
        assertThat(request.getTimeout()).isEqualTo(Duration.ofSeconds(90));
    }

    @Test
    void absentListOptionDefersToConfiguredDefaultsButEmptyOneShipsNothing() {
        LaunchRequest request = runner.toRequest(new DefaultApplicationArguments(
                "config/application.properties", "prod", "--data-file"));

        assertThat(request.getDataFiles()).isEmpty();
        assertThat(request.getCodeFiles()).isNull();
        assertThat(request.getPackages()).isNull();
    }

    @Test
    void emptyListEntriesAreSkipped() {
        LaunchRequest request = runner.toRequest(new DefaultApplicationArguments(
                "config/application.properties", "prod",
                "--data-file=data/taxi_zone_lookup.csv,", "--code-file=", "--package=,"));

        assertThat(request.getDataFiles()).containsExactly("data/taxi_zone_lookup.csv");
        assertThat(request.getCodeFiles()).isEmpty();
        assertThat(request.getPackages()).isEmpty();
    }

    @Test
    void wrongPositionalCountIsUsageError() {
        assertThat(errorOf(() -> runner.toRequest(new DefaultApplicationArguments("config/application.properties")))
                .getKind()).isEqualTo(ErrorKind.INVALID_ARGUMENTS);

        runner.run(new DefaultApplicationArguments("a", "b", "c"));

        assertThat(runner.getExitCode()).isEqualTo(64);
        verifyNoInteractions(launchService);
    }

    @Test
    void repeatedSingleValueOptionIsUsageError() {
        LaunchError error = errorOf(() -> runner.toRequest(new DefaultApplicationArguments(
                "config/application.properties", "prod", "--driver-memory=2g", "--driver-memory=4g")));

        assertThat(error.getKind()).isEqualTo(ErrorKind.INVALID_ARGUMENTS);
        assertThat(error.getOffendingValue()).isEqualTo("2g,4g");
    }

    @Test
    void nonNumericCoreCountIsResourceError() {
        runner.run(new DefaultApplicationArguments("config/application.properties", "prod", "--executor-cores=two"));

        assertThat(runner.getExitCode()).isEqualTo(4);
        verifyNoInteractions(launchService);
    }

    @Test
    void nonPositiveTimeoutIsUsageError() {
        assertThat(errorOf(() -> runner.toRequest(new DefaultApplicationArguments(
                "config/application.properties", "prod", "--timeout=0s"))).getKind())
                .isEqualTo(ErrorKind.INVALID_ARGUMENTS);
        assertThat(errorOf(() -> runner.toRequest(new DefaultApplicationArguments(
                "config/application.properties", "prod", "--timeout=soon"))).getKind())
                .isEqualTo(ErrorKind.INVALID_ARGUMENTS);
    }

    @Test
    void successfulLaunchExitsZero() {
        when(launchService.launch(any())).thenReturn(SubmissionResult.submitted("driver-20261019071500-0001", List.of()));

        runner.run(new DefaultApplicationArguments("config/application.properties", "prod"));

        assertThat(runner.getExitCode()).isZero();
    }

    @Test
    void failedLaunchExitsWithCategoryCode() {
        when(launchService.launch(any())).thenReturn(SubmissionResult.failed(
                new LaunchError(ErrorKind.UNKNOWN_ENVIRONMENT, "Unknown environment", "staging"), List.of()));

        runner.run(new DefaultApplicationArguments("config/application.properties", "staging"));

        assertThat(runner.getExitCode()).isEqualTo(2);
    }

    @Test
    void dryRunPreparesWithoutLaunching() {
        when(launchService.prepare(any())).thenReturn(JobDescriptor.builder()
                .masterEndpoint(ClusterEndpoint.parse("spark-master:7077"))
                .dependencies(DependencySet.EMPTY)
                .resources(ResourceRequest.builder().driverMemory("1g").executorMemory("1g").build())
                .entryPoint(Path.of("/app/batch_process_trip.py"))
                .build());

        runner.run(new DefaultApplicationArguments("config/application.properties", "prod", "--dry-run"));

        assertThat(runner.getExitCode()).isZero();
        verify(launchService, never()).launch(any());
    }

    @Test
    void dryRunReportsValidationFailure() {
        when(launchService.prepare(any())).thenThrow(
                new LaunchException(ErrorKind.DEPENDENCY_NOT_FOUND, "Dependency not found", "data/missing.csv"));

        runner.run(new DefaultApplicationArguments("config/application.properties", "prod", "--dry-run"));

        assertThat(runner.getExitCode()).isEqualTo(3);
    }
}
