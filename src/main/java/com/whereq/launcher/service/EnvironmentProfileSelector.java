package com.whereq.launcher.service;

import com.whereq.launcher.config.LauncherProperties;
import com.whereq.launcher.exception.ErrorKind;
import com.whereq.launcher.exception.LaunchException;
import com.whereq.launcher.model.ClusterEndpoint;
import com.whereq.launcher.model.EnvironmentProfile;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Map;

/**
 * Maps a symbolic environment name ("prod", "dev", ...) to the cluster it deploys to.
 * Names are case-sensitive and unknown names are rejected; there is no default environment.
 *
 * @author WhereQ Inc.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class EnvironmentProfileSelector {

    private final LauncherProperties properties;

    /**
     * Select the profile for an environment name.
     *
     * @param name environment name
     * @return the profile with a validated cluster endpoint
     * @throws LaunchException UNKNOWN_ENVIRONMENT if the name is not configured,
     *                         INVALID_ENDPOINT if its master address is malformed
     */
    public EnvironmentProfile select(String name) {
        if (name == null || name.isEmpty()) {
            throw new LaunchException(ErrorKind.UNKNOWN_ENVIRONMENT, "Environment name is required");
        }

        Map<String, LauncherProperties.EnvironmentConfig> environments = properties.getEnvironments();
        LauncherProperties.EnvironmentConfig config = environments.get(name);
        if (config == null) {
            throw new LaunchException(ErrorKind.UNKNOWN_ENVIRONMENT,
                    "Unknown environment, known environments are " + environments.keySet(), name);
        }

        ClusterEndpoint endpoint = ClusterEndpoint.parse(config.getMaster());

        log.debug("Selected environment {} with master {}", name, endpoint);

        return EnvironmentProfile.builder()
                .name(name)
                .clusterEndpoint(endpoint)
                .resourceDefaults(config.toSpec())
                .build();
    }
}
