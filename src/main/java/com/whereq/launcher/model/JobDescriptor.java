package com.whereq.launcher.model;

import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;

/**
 * Everything needed to submit one job.
 * Built fresh for every launch and never modified afterwards.
 */
@Value
@Builder
public class JobDescriptor {

    /**
     * Application name, optional
     */
    String name;

    /**
     * Driver program the cluster runs
     */
    @NonNull
    Path entryPoint;

    /**
     * Positional arguments for the entry point: config file path, then environment name
     */
    @Singular
    List<String> arguments;

    @NonNull
    DependencySet dependencies;

    @NonNull
    ResourceRequest resources;

    @NonNull
    ClusterEndpoint masterEndpoint;

    /**
     * Optional; spark-submit defaults to client mode
     */
    DeployMode deployMode;

    /**
     * Extra runtime configuration entries
     */
    @Singular("sparkConfEntry")
    Map<String, String> sparkConf;
}
