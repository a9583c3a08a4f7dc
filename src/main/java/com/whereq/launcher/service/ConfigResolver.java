package com.whereq.launcher.service;

import com.whereq.launcher.config.LauncherProperties;
import com.whereq.launcher.exception.ErrorKind;
import com.whereq.launcher.exception.LaunchException;
import com.whereq.launcher.model.ConfigFile;
import com.whereq.launcher.model.EnvironmentProfile;
import com.whereq.launcher.model.JobConfig;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Loads and validates the key-value configuration file handed to the job.
 * <p>
 * The launcher does not interpret individual keys, that is the worker's business. It only
 * makes sure the file exists, can be read, and is syntactically a property file:
 * <ul>
 *   <li>blank lines and lines starting with {@code #}, {@code !} or {@code ;} are ignored</li>
 *   <li>{@code [name]} starts a section, keys before the first header are defaults</li>
 *   <li>every other line holds a non-empty key, a {@code =} or {@code :} separator, and a value</li>
 * </ul>
 *
 * @author WhereQ Inc.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ConfigResolver {

    private final LauncherProperties properties;

    /**
     * Resolve and parse a configuration file.
     *
     * @param path file path, absolute or relative to the launcher base directory
     * @return the parsed file
     * @throws LaunchException CONFIG_NOT_FOUND if the path is empty or no regular file exists
     *                         there, CONFIG_UNREADABLE if it cannot be read or parsed
     */
    public ConfigFile resolve(String path) {
        if (path == null || path.isBlank()) {
            throw new LaunchException(ErrorKind.CONFIG_NOT_FOUND, "Config file path is required");
        }

        Path file = toAbsolutePath(path);
        if (!Files.isRegularFile(file)) {
            throw new LaunchException(ErrorKind.CONFIG_NOT_FOUND, "Config file not found", path);
        }
        if (!Files.isReadable(file)) {
            throw new LaunchException(ErrorKind.CONFIG_UNREADABLE, "Config file is not readable", path);
        }

        List<String> lines;
        try {
            lines = Files.readAllLines(file, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new LaunchException(ErrorKind.CONFIG_UNREADABLE,
                    "Failed to read config file: " + e.getMessage(), path, e);
        }

        ConfigFile configFile = new ConfigFile(file, parse(lines, path));
        log.debug("Resolved config file {} with sections {}", file, configFile.getSections().keySet());
        return configFile;
    }

    /**
     * Bind a parsed file to the environment it will run in, checking that every required key
     * is present in the effective properties.
     *
     * @param configFile  the parsed file
     * @param environment the selected environment
     * @return the run's configuration
     * @throws LaunchException MISSING_CONFIG_KEY naming the first absent key
     */
    public JobConfig bind(ConfigFile configFile, EnvironmentProfile environment) {
        if (!configFile.hasSection(environment.getName())) {
            log.warn("Config file {} has no [{}] section, using its default entries only",
                    configFile.getPath(), environment.getName());
        }
        Map<String, String> effective = configFile.effectiveProperties(environment.getName());

        for (String key : properties.getRequiredKeys()) {
            String value = effective.get(key);
            if (value == null || value.isBlank()) {
                throw new LaunchException(ErrorKind.MISSING_CONFIG_KEY,
                        "Config file " + configFile.getPath() + " does not define required key for environment '"
                                + environment.getName() + "'", key);
            }
        }

        return new JobConfig(configFile.getPath(), environment, Collections.unmodifiableMap(effective));
    }

    private Map<String, Map<String, String>> parse(List<String> lines, String path) {
        Map<String, Map<String, String>> sections = new LinkedHashMap<>();
        String section = ConfigFile.DEFAULT_SECTION;

        for (int i = 0; i < lines.size(); i++) {
            String line = lines.get(i).strip();
            int lineNumber = i + 1;

            if (line.isEmpty() || line.startsWith("#") || line.startsWith("!") || line.startsWith(";")) {
                continue;
            }

            if (line.startsWith("[")) {
                if (!line.endsWith("]") || line.length() < 3) {
                    throw unreadable("Malformed section header at line " + lineNumber, path);
                }
                section = line.substring(1, line.length() - 1).strip();
                if (section.isEmpty()) {
                    throw unreadable("Empty section name at line " + lineNumber, path);
                }
                sections.computeIfAbsent(section, name -> new LinkedHashMap<>());
                continue;
            }

            int separator = separatorIndex(line);
            if (separator < 0) {
                throw unreadable("Missing key/value separator at line " + lineNumber, path);
            }
            String key = line.substring(0, separator).strip();
            if (key.isEmpty()) {
                throw unreadable("Missing key at line " + lineNumber, path);
            }
            String value = line.substring(separator + 1).strip();

            sections.computeIfAbsent(section, name -> new LinkedHashMap<>()).put(key, value);
        }

        Map<String, Map<String, String>> frozen = new LinkedHashMap<>();
        sections.forEach((name, entries) -> frozen.put(name, Collections.unmodifiableMap(entries)));
        return Collections.unmodifiableMap(frozen);
    }

    private int separatorIndex(String line) {
        int equals = line.indexOf('=');
        int colon = line.indexOf(':');
        if (equals < 0) {
            return colon;
        }
        if (colon < 0) {
            return equals;
        }
        return Math.min(equals, colon);
    }

    private LaunchException unreadable(String detail, String path) {
        return new LaunchException(ErrorKind.CONFIG_UNREADABLE, detail, path);
    }

    private Path toAbsolutePath(String path) {
        try {
            return properties.resolvePath(path);
        } catch (InvalidPathException e) {
            throw new LaunchException(ErrorKind.CONFIG_NOT_FOUND, "Invalid config file path: " + e.getReason(), path, e);
        }
    }
}
