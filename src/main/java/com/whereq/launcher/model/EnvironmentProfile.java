package com.whereq.launcher.model;

import lombok.Builder;
import lombok.Value;

/**
 * A deployment target: the cluster a job goes to and the resource defaults that apply there.
 */
@Value
@Builder
public class EnvironmentProfile {

    String name;

    ClusterEndpoint clusterEndpoint;

    @Builder.Default
    ResourceSpec resourceDefaults = ResourceSpec.EMPTY;
}
