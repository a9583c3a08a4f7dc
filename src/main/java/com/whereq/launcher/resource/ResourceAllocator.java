package com.whereq.launcher.resource;

import com.whereq.launcher.config.LauncherProperties;
import com.whereq.launcher.exception.ErrorKind;
import com.whereq.launcher.exception.LaunchException;
import com.whereq.launcher.model.ResourceRequest;
import com.whereq.launcher.model.ResourceSpec;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Determine driver and executor resource requests.
 * <p>
 * Each value comes from the explicit request if given, else from the environment's defaults,
 * else from the global defaults. No upper bound is enforced here; the cluster's admission
 * control has the final say.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ResourceAllocator {

    /**
     * Integer magnitude followed by a unit letter, optionally "b" (e.g. "4G", "512m", "2gb")
     */
    private static final Pattern MEMORY_PATTERN = Pattern.compile("(\\d+)([kmgtp])b?", Pattern.CASE_INSENSITIVE);

    private static final String UNITS = "kmgtp";

    private final LauncherProperties properties;

    /**
     * Allocate memory with no environment-specific defaults.
     *
     * @param driverMemory   driver memory, or null for the default
     * @param executorMemory executor memory, or null for the default
     * @return the resource request
     */
    public ResourceRequest allocate(String driverMemory, String executorMemory) {
        return allocate(ResourceSpec.builder()
                .driverMemory(driverMemory)
                .executorMemory(executorMemory)
                .build(), ResourceSpec.EMPTY);
    }

    /**
     * Allocate resources for a job.
     *
     * @param requested           explicitly requested values
     * @param environmentDefaults defaults of the target environment
     * @return the resource request, memory values verbatim
     * @throws LaunchException INVALID_RESOURCE_SPEC if a chosen value is malformed
     */
    public ResourceRequest allocate(ResourceSpec requested, ResourceSpec environmentDefaults) {
        ResourceSpec global = properties.getDefaults().toSpec();

        ResourceRequest request = ResourceRequest.builder()
                .driverMemory(memory("driver memory", firstNonNull(
                        requested.getDriverMemory(), environmentDefaults.getDriverMemory(), global.getDriverMemory())))
                .executorMemory(memory("executor memory", firstNonNull(
                        requested.getExecutorMemory(), environmentDefaults.getExecutorMemory(), global.getExecutorMemory())))
                .driverCores(count("driver cores", firstNonNull(
                        requested.getDriverCores(), environmentDefaults.getDriverCores(), global.getDriverCores())))
                .executorCores(count("executor cores", firstNonNull(
                        requested.getExecutorCores(), environmentDefaults.getExecutorCores(), global.getExecutorCores())))
                .numExecutors(count("number of executors", firstNonNull(
                        requested.getNumExecutors(), environmentDefaults.getNumExecutors(), global.getNumExecutors())))
                .build();

        log.debug("Allocated resources: driver {} / {} cores, executor {} / {} cores, {} executors",
                request.getDriverMemory(), request.getDriverCores(),
                request.getExecutorMemory(), request.getExecutorCores(), request.getNumExecutors());

        return request;
    }

    /**
     * Check whether a string follows the runtime's memory grammar
     */
    private static boolean isValidMemory(String memory) {
        if (memory == null) {
            return false;
        }
        Matcher matcher = MEMORY_PATTERN.matcher(memory);
        return matcher.matches() && fitsInBytes(matcher.group(1), matcher.group(2));
    }

    private String memory(String field, String value) {
        if (value == null) {
            return null;
        }
        if (!isValidMemory(value)) {
            throw new LaunchException(ErrorKind.INVALID_RESOURCE_SPEC,
                    "Invalid " + field + ", expected a positive integer followed by k, m, g, t or p", value);
        }
        return value;
    }

    private Integer count(String field, Integer value) {
        if (value != null && value < 1) {
            throw new LaunchException(ErrorKind.INVALID_RESOURCE_SPEC,
                    "Invalid " + field + ", expected a positive integer", String.valueOf(value));
        }
        return value;
    }

    /**
     * The runtime converts sizes to a byte count held in a long
     */
    private static boolean fitsInBytes(String digits, String unit) {
        long magnitude;
        try {
            magnitude = Long.parseLong(digits);
        } catch (NumberFormatException e) {
            return false;
        }
        int shift = 10 * (UNITS.indexOf(unit.toLowerCase(Locale.ROOT)) + 1);
        return magnitude > 0 && magnitude <= (Long.MAX_VALUE >> shift);
    }

    private static <T> T firstNonNull(T requested, T environmentDefault, T globalDefault) {
        if (requested != null) {
            return requested;
        }
        return environmentDefault != null ? environmentDefault : globalDefault;
    }
}
