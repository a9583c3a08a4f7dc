package com.whereq.launcher.model;

import lombok.Builder;
import lombok.Value;

/**
 * Resources a job asks the cluster for.
 * Memory values are kept exactly as supplied, in the runtime's memory-string grammar.
 */
@Value
@Builder
public class ResourceRequest {
    /**
     * Driver memory, e.g. "4G"
     */
    String driverMemory;

    /**
     * Memory per executor, e.g. "4G"
     */
    String executorMemory;

    /**
     * Driver cores, or null to leave it to the cluster
     */
    Integer driverCores;

    /**
     * Cores per executor, or null to leave it to the cluster
     */
    Integer executorCores;

    /**
     * Number of executors, or null to leave it to the cluster
     */
    Integer numExecutors;
}
