package com.whereq.launcher.model;

import java.util.Locale;

/**
 * Where the driver program runs
 */
public enum DeployMode {
    /**
     * Driver runs in the spark-submit process
     */
    CLIENT,

    /**
     * Driver runs on a worker; spark-submit returns once the master accepts it
     */
    CLUSTER;

    public String getValue() {
        return name().toLowerCase(Locale.ROOT);
    }
}
