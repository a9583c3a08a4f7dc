package com.whereq.launcher.service;

import com.whereq.launcher.config.LauncherProperties;
import com.whereq.launcher.dto.LaunchRequest;
import com.whereq.launcher.exception.ErrorKind;
import com.whereq.launcher.exception.LaunchException;
import com.whereq.launcher.model.ClusterEndpoint;
import com.whereq.launcher.model.ConfigFile;
import com.whereq.launcher.model.DependencySet;
import com.whereq.launcher.model.EnvironmentProfile;
import com.whereq.launcher.model.JobConfig;
import com.whereq.launcher.model.JobDescriptor;
import com.whereq.launcher.model.ResourceRequest;
import com.whereq.launcher.model.ResourceSpec;
import com.whereq.launcher.model.SubmissionResult;
import com.whereq.launcher.model.SubmissionState;
import com.whereq.launcher.resource.ResourceAllocator;
import com.whereq.launcher.submit.JobSubmitter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Service for launching jobs: turns a {@link LaunchRequest} into a validated
 * {@link JobDescriptor} and submits it.
 * <p>
 * Every validation step runs before the dispatcher is touched, so a request that fails
 * validation never produces a cluster job, partial or otherwise.
 *
 * @author WhereQ Inc.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class LaunchService {

    private final LauncherProperties properties;
    private final ConfigResolver configResolver;
    private final EnvironmentProfileSelector environmentSelector;
    private final DependencyPackager dependencyPackager;
    private final ResourceAllocator resourceAllocator;
    private final JobSubmitter jobSubmitter;

    /**
     * Validate a request and build its descriptor without dispatching anything.
     *
     * @param request the launch request
     * @return the descriptor that {@link #launch(LaunchRequest)} would submit
     * @throws LaunchException on the first validation failure
     */
    public JobDescriptor prepare(LaunchRequest request) {
        if (request.getTimeout() != null && (request.getTimeout().isNegative() || request.getTimeout().isZero())) {
            throw new LaunchException(ErrorKind.INVALID_ARGUMENTS, "Dispatch timeout must be positive",
                    request.getTimeout().toString());
        }

        ConfigFile configFile = configResolver.resolve(request.getConfigFile());
        EnvironmentProfile environment = environmentSelector.select(request.getEnvironment());
        JobConfig jobConfig = configResolver.bind(configFile, environment);

        LauncherProperties.JobDefaults job = properties.getJob();
        DependencySet dependencies = dependencyPackager.packageDependencies(
                orDefault(request.getDataFiles(), job.getDataFiles()),
                orDefault(request.getCodeFiles(), job.getCodeFiles()),
                orDefault(request.getPackages(), job.getPackages()));

        ResourceRequest resources = resourceAllocator.allocate(ResourceSpec.builder()
                .driverMemory(request.getDriverMemory())
                .executorMemory(request.getExecutorMemory())
                .driverCores(request.getDriverCores())
                .executorCores(request.getExecutorCores())
                .numExecutors(request.getNumExecutors())
                .build(), environment.getResourceDefaults());

        ClusterEndpoint master = request.getMaster() != null
                ? ClusterEndpoint.parse(request.getMaster())
                : environment.getClusterEndpoint();

        String entryPoint = request.getEntryPoint() != null ? request.getEntryPoint() : job.getEntryPoint();

        return JobDescriptor.builder()
                .name(job.getName())
                .entryPoint(dependencyPackager.resolveEntryPoint(entryPoint))
                .argument(jobConfig.getConfigFilePath().toString())
                .argument(environment.getName())
                .dependencies(dependencies)
                .resources(resources)
                .masterEndpoint(master)
                .deployMode(job.getDeployMode())
                .sparkConf(job.getSparkConf())
                .build();
    }

    /**
     * Validate and submit a job.
     *
     * @param request the launch request
     * @return SUBMITTED, or FAILED with the validation or dispatch error
     */
    public SubmissionResult launch(LaunchRequest request) {
        SubmissionState state = SubmissionState.UNSUBMITTED;
        log.info("Launching job for environment {} with config {}", request.getEnvironment(), request.getConfigFile());

        state = state.transitionTo(SubmissionState.VALIDATING);
        JobDescriptor descriptor;
        try {
            descriptor = prepare(request);
        } catch (LaunchException e) {
            state = state.transitionTo(SubmissionState.FAILED);
            log.error("Job state {}: validation failed, nothing dispatched: {}", state, e.getMessage());
            return SubmissionResult.failed(e.getError(), List.of());
        }

        state = state.transitionTo(SubmissionState.DISPATCHING);
        log.debug("Job state {}: master {}", state, descriptor.getMasterEndpoint());
        return jobSubmitter.submit(descriptor, request.getTimeout());
    }

    private static List<String> orDefault(List<String> requested, List<String> configured) {
        return requested != null ? requested : configured;
    }
}
