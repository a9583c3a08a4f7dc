package com.whereq.launcher.model;

import lombok.Builder;
import lombok.Value;

/**
 * Requested resource values, any of which may be absent.
 * Used for explicit requests as well as per-environment and global defaults.
 */
@Value
@Builder
public class ResourceSpec {

    public static final ResourceSpec EMPTY = ResourceSpec.builder().build();

    String driverMemory;
    String executorMemory;
    Integer driverCores;
    Integer executorCores;
    Integer numExecutors;
}
