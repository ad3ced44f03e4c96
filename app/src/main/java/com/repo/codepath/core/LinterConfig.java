package com.repo.codepath.core;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.*;

/**
 * Configuration of a lint run.
 * Loaded from codepath.yaml in the project root or uses defaults.
 */
public class LinterConfig {

    public static final String FILE_NAME = "codepath.yaml";

    private static final Logger LOG = LoggerFactory.getLogger(LinterConfig.class);

    // Rules
    private boolean complexityEnabled = true;
    private int complexityMax = 20;
    private boolean noUnreachableEnabled = true;

    // Debug output
    private boolean dumpDot = false;
    private String graphsDir = "graphs";

    private Set<String> exclusions = Set.of("**/node_modules/**");

    /**
     * Load configuration from YAML file or return defaults.
     */
    public static LinterConfig load(Path projectRoot) {
        LinterConfig config = new LinterConfig();
        Path configFile = projectRoot.resolve(FILE_NAME);

        if (Files.exists(configFile)) {
            try (InputStream is = Files.newInputStream(configFile)) {
                Yaml yaml = new Yaml();
                Object data = yaml.load(is);
                if (data instanceof Map<?, ?> map) {
                    config.parseYaml(map);
                }
                LOG.info("Loaded configuration from: {}", configFile);
            } catch (IOException | YAMLException e) {
                LOG.warn("Could not read config file, using defaults: {}", e.getMessage());
            }
        }
        return config;
    }

    public static LinterConfig defaults() {
        return new LinterConfig();
    }

    private void parseYaml(Map<?, ?> data) {
        Map<?, ?> rules = section(data, "rules");
        Map<?, ?> complexity = section(rules, "complexity");
        complexityEnabled = getBool(complexity, "enabled", complexityEnabled);
        int max = getInt(complexity, "max", complexityMax);
        if (max >= 0) {
            complexityMax = max;
        }
        noUnreachableEnabled = getBool(section(rules, "no_unreachable"), "enabled", noUnreachableEnabled);

        Map<?, ?> debug = section(data, "debug");
        dumpDot = getBool(debug, "dump_dot", dumpDot);
        if (debug.get("graphs_dir") instanceof String dir && !dir.isBlank()) {
            graphsDir = dir;
        }

        if (data.get("exclusions") instanceof List<?> list) {
            Set<String> patterns = new LinkedHashSet<>();
            for (Object item : list) {
                if (item instanceof String pattern) {
                    patterns.add(pattern);
                }
            }
            exclusions = patterns;
        }
    }

    private static Map<?, ?> section(Map<?, ?> map, String key) {
        return map.get(key) instanceof Map<?, ?> section ? section : Map.of();
    }

    private static int getInt(Map<?, ?> map, String key, int defaultVal) {
        Object val = map.get(key);
        if (val instanceof Number)
            return ((Number) val).intValue();
        return defaultVal;
    }

    private static boolean getBool(Map<?, ?> map, String key, boolean defaultVal) {
        Object val = map.get(key);
        if (val instanceof Boolean)
            return (Boolean) val;
        return defaultVal;
    }

    // === Getters ===

    public boolean isComplexityEnabled() {
        return complexityEnabled;
    }

    public int getComplexityMax() {
        return complexityMax;
    }

    public boolean isNoUnreachableEnabled() {
        return noUnreachableEnabled;
    }

    public boolean isDumpDot() {
        return dumpDot;
    }

    public String getGraphsDir() {
        return graphsDir;
    }

    public Set<String> getExclusions() {
        return Collections.unmodifiableSet(exclusions);
    }

    public boolean shouldExclude(Path path) {
        String pathStr = path.toString().replace('\\', '/');
        for (String pattern : exclusions) {
            if (matchesGlob(pathStr, pattern)) {
                return true;
            }
        }
        return false;
    }

    private static boolean matchesGlob(String path, String glob) {
        String regex = glob
                .replace(".", "\\.")
                .replace("**", "<<<DOUBLESTAR>>>")
                .replace("*", "[^/]*")
                .replace("<<<DOUBLESTAR>>>", ".*");
        return path.matches(".*" + regex + ".*");
    }
}
