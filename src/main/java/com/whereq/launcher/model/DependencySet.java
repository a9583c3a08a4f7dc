package com.whereq.launcher.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.nio.file.Path;
import java.util.List;

/**
 * Artifacts shipped alongside a job.
 * Each list keeps the caller's order and holds no duplicates.
 */
@Value
@Builder
public class DependencySet {

    public static final DependencySet EMPTY = DependencySet.builder().build();

    /**
     * Files copied verbatim to every worker (lookup tables and the like)
     */
    @Singular
    List<Path> dataFiles;

    /**
     * Code modules copied to every worker
     */
    @Singular
    List<Path> codeFiles;

    /**
     * group:artifact:version coordinates the cluster runtime resolves itself
     */
    @Singular
    List<String> remotePackages;
}
