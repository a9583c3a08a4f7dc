package com.whereq.launcher.model;

import lombok.Value;

import java.nio.file.Path;
import java.util.Map;

/**
 * The resolved, validated configuration of one run
 */
@Value
public class JobConfig {

    Path configFilePath;

    EnvironmentProfile environment;

    /**
     * Properties the worker will see for this environment
     */
    Map<String, String> properties;
}
