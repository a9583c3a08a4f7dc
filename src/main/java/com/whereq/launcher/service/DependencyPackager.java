package com.whereq.launcher.service;

import com.whereq.launcher.config.LauncherProperties;
import com.whereq.launcher.exception.ErrorKind;
import com.whereq.launcher.exception.LaunchException;
import com.whereq.launcher.model.DependencySet;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Collects the artifacts that travel with a job to every worker.
 * <p>
 * Local data and code files must exist before anything is submitted. Remote packages are
 * only checked for shape, the cluster runtime resolves them at job start. Validation runs
 * over data files, then code files, then packages, in order, and stops at the first failure.
 *
 * @author WhereQ Inc.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class DependencyPackager {

    /**
     * group:artifact:version, three non-empty segments without whitespace
     */
    private static final Pattern COORDINATE_PATTERN = Pattern.compile("[^:\\s]+:[^:\\s]+:[^:\\s]+");

    private final LauncherProperties properties;

    /**
     * Validate and collect job dependencies.
     *
     * @param dataFiles      files shipped verbatim to every worker
     * @param codeFiles      code modules shipped to every worker
     * @param remotePackages coordinates resolved by the cluster runtime
     * @return the validated dependency set, local paths made absolute
     * @throws LaunchException DEPENDENCY_NOT_FOUND, DUPLICATE_DEPENDENCY,
     *                         INVALID_DEPENDENCY_PATH or INVALID_PACKAGE_COORDINATE
     */
    public DependencySet packageDependencies(List<String> dataFiles, List<String> codeFiles, List<String> remotePackages) {
        DependencySet dependencies = DependencySet.builder()
                .dataFiles(resolveLocalFiles(dataFiles, "data file"))
                .codeFiles(resolveLocalFiles(codeFiles, "code file"))
                .remotePackages(validateCoordinates(remotePackages))
                .build();

        log.debug("Packaged {} data files, {} code files, {} remote packages",
                dependencies.getDataFiles().size(), dependencies.getCodeFiles().size(),
                dependencies.getRemotePackages().size());

        return dependencies;
    }

    /**
     * Resolve the driver program, which must exist like any other shipped file.
     *
     * @param entryPoint path to the driver program
     * @return its absolute path
     */
    public Path resolveEntryPoint(String entryPoint) {
        if (entryPoint == null || entryPoint.isBlank()) {
            throw new LaunchException(ErrorKind.DEPENDENCY_NOT_FOUND, "Entry point is required");
        }
        return requireFile(entryPoint, "Entry point");
    }

    private List<Path> resolveLocalFiles(List<String> paths, String role) {
        List<Path> resolved = new ArrayList<>();
        if (paths == null) {
            return resolved;
        }

        Set<Path> seen = new HashSet<>();
        for (String path : paths) {
            if (path == null || path.isBlank()) {
                throw new LaunchException(ErrorKind.INVALID_DEPENDENCY_PATH, "Empty " + role + " path", path);
            }
            // spark-submit splits file lists on commas
            if (path.indexOf(',') >= 0) {
                throw new LaunchException(ErrorKind.INVALID_DEPENDENCY_PATH,
                        "A " + role + " path must not contain a comma", path);
            }

            Path file = toAbsolutePath(path, role);
            if (!seen.add(file)) {
                throw new LaunchException(ErrorKind.DUPLICATE_DEPENDENCY, "Duplicate " + role, path);
            }
            if (!Files.isRegularFile(file)) {
                throw new LaunchException(ErrorKind.DEPENDENCY_NOT_FOUND, "Missing " + role, path);
            }
            resolved.add(file);
        }
        return resolved;
    }

    private List<String> validateCoordinates(List<String> coordinates) {
        List<String> validated = new ArrayList<>();
        if (coordinates == null) {
            return validated;
        }

        Set<String> seen = new HashSet<>();
        for (String coordinate : coordinates) {
            if (coordinate == null || !COORDINATE_PATTERN.matcher(coordinate).matches()) {
                throw new LaunchException(ErrorKind.INVALID_PACKAGE_COORDINATE,
                        "Package coordinate must have the form group:artifact:version", coordinate);
            }
            if (!seen.add(coordinate)) {
                throw new LaunchException(ErrorKind.DUPLICATE_DEPENDENCY, "Duplicate remote package", coordinate);
            }
            validated.add(coordinate);
        }
        return validated;
    }

    private Path requireFile(String path, String role) {
        Path file = toAbsolutePath(path, role);
        if (!Files.isRegularFile(file)) {
            throw new LaunchException(ErrorKind.DEPENDENCY_NOT_FOUND, role + " not found", path);
        }
        return file;
    }

    private Path toAbsolutePath(String path, String role) {
        try {
            return properties.resolvePath(path);
        } catch (InvalidPathException e) {
            throw new LaunchException(ErrorKind.INVALID_DEPENDENCY_PATH,
                    "Invalid " + role + " path: " + e.getReason(), path, e);
        }
    }
}
