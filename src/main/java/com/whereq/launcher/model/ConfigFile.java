package com.whereq.launcher.model;

import lombok.Value;

import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A parsed key-value configuration file.
 * Keys that appear before any {@code [section]} header live in the default section.
 */
@Value
public class ConfigFile {

    public static final String DEFAULT_SECTION = "";

    Path path;

    /**
     * Section name to its key-value pairs, in file order
     */
    Map<String, Map<String, String>> sections;

    public boolean hasSection(String name) {
        return sections.containsKey(name);
    }

    /**
     * The default section overlaid with the named section.
     *
     * @param section section name; an absent section contributes nothing
     * @return the merged key-value pairs
     */
    public Map<String, String> effectiveProperties(String section) {
        Map<String, String> merged = new LinkedHashMap<>(sections.getOrDefault(DEFAULT_SECTION, Map.of()));
        merged.putAll(sections.getOrDefault(section, Map.of()));
        return merged;
    }
}
