package com.whereq.launcher.config;

import com.whereq.launcher.model.DeployMode;
import com.whereq.launcher.model.ResourceSpec;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Configuration properties for WhereQ Launcher.
 *
 * @author WhereQ Inc.
 */
@Configuration
@ConfigurationProperties(prefix = "launcher")
@Data
public class LauncherProperties {

    /**
     * Directory relative paths (config file, entry point, dependencies) are resolved against.
     */
    private String baseDir = System.getProperty("user.dir");

    /**
     * Keys the job's effective configuration must define.
     * Their meaning belongs to the worker; the launcher only checks presence.
     */
    private List<String> requiredKeys = new ArrayList<>();

    /**
     * Resource values applied when neither the request nor the environment sets one.
     */
    private ResourceDefaults defaults = new ResourceDefaults();

    /**
     * Known deployment targets, keyed by the case-sensitive environment name.
     */
    private Map<String, EnvironmentConfig> environments = new LinkedHashMap<>();

    /**
     * The job launched when a request does not override it.
     */
    private JobDefaults job = new JobDefaults();

    private DispatchConfig dispatch = new DispatchConfig();

    /**
     * Resolve a path against the base directory and normalize it.
     *
     * @throws java.nio.file.InvalidPathException if the path string is not a valid path
     */
    public Path resolvePath(String path) {
        Path candidate = Paths.get(path);
        if (!candidate.isAbsolute()) {
            candidate = Paths.get(baseDir).resolve(candidate);
        }
        return candidate.toAbsolutePath().normalize();
    }

    @Data
    public static class ResourceDefaults {
        private String driverMemory = "1g";
        private String executorMemory = "1g";
        private Integer driverCores;
        private Integer executorCores;
        private Integer numExecutors;

        public ResourceSpec toSpec() {
            return ResourceSpec.builder()
                    .driverMemory(driverMemory)
                    .executorMemory(executorMemory)
                    .driverCores(driverCores)
                    .executorCores(executorCores)
                    .numExecutors(numExecutors)
                    .build();
        }
    }

    @Data
    public static class EnvironmentConfig {
        /**
         * Cluster master address, either host:port or spark://host:port.
         */
        private String master;

        private String driverMemory;
        private String executorMemory;
        private Integer driverCores;
        private Integer executorCores;
        private Integer numExecutors;

        public ResourceSpec toSpec() {
            return ResourceSpec.builder()
                    .driverMemory(driverMemory)
                    .executorMemory(executorMemory)
                    .driverCores(driverCores)
                    .executorCores(executorCores)
                    .numExecutors(numExecutors)
                    .build();
        }
    }

    @Data
    public static class JobDefaults {
        /**
         * Application name shown by the cluster UI.
         */
        private String name;

        /**
         * Driver program run by the cluster.
         */
        private String entryPoint;

        /**
         * Unset lets spark-submit apply its own default (client).
         */
        private DeployMode deployMode;

        /**
         * Files shipped verbatim to every worker, such as lookup tables.
         */
        private List<String> dataFiles = new ArrayList<>();

        /**
         * Auxiliary code modules shipped to every worker.
         */
        private List<String> codeFiles = new ArrayList<>();

        /**
         * group:artifact:version coordinates resolved by the cluster runtime.
         */
        private List<String> packages = new ArrayList<>();

        /**
         * Additional --conf entries passed to the cluster runtime.
         */
        private Map<String, String> sparkConf = new LinkedHashMap<>();
    }

    @Data
    public static class DispatchConfig {
        /**
         * Explicit spark-submit executable. Takes precedence over sparkHome.
         */
        private String sparkSubmit;

        private String sparkHome;

        /**
         * Upper bound on how long a dispatch may block before it is reported as timed out.
         */
        private Duration timeout = Duration.ofMinutes(10);
    }
}
