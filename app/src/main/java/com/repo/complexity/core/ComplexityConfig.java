package com.repo.complexity.core;

import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

/**
 * Options for a complexity analysis.
 * Loaded from complexity.yaml in the given directory or uses sensible defaults.
 *
 * Only {@code newmi} is read by the engine; the other flags are consumed by syntax tables.
 */
public class ComplexityConfig {

    public static final String CONFIG_FILE = "complexity.yaml";

    // Syntax table flags
    private boolean logicalOr = true;
    private boolean switchCase = true;
    private boolean forIn = false;
    private boolean tryCatch = false;

    // Engine flag: rescale maintainability to 0..100
    private boolean newMi = false;

    /**
     * Load configuration from YAML file or return defaults.
     */
    public static ComplexityConfig load(Path directory) {
        ComplexityConfig config = new ComplexityConfig();
        Path configFile = directory.resolve(CONFIG_FILE);

        if (Files.exists(configFile)) {
            try (InputStream is = Files.newInputStream(configFile)) {
                Yaml yaml = new Yaml();
                Object data = yaml.load(is);
                if (data instanceof Map) {
                    @SuppressWarnings("unchecked")
                    Map<String, Object> options = (Map<String, Object>) data;
                    config.parseYaml(options);
                } else if (data != null) {
                    System.err.println("Warning: " + configFile + " is not a mapping, using defaults");
                    return config;
                }
                System.out.println("Loaded configuration from: " + configFile);
            } catch (IOException | YAMLException e) {
                System.err.println("Warning: Could not read config file, using defaults: " + e.getMessage());
            }
        }
        return config;
    }

    /**
     * Default configuration.
     */
    public static ComplexityConfig defaults() {
        return new ComplexityConfig();
    }

    private void parseYaml(Map<String, Object> data) {
        logicalOr = getBool(data, "logicalor", logicalOr);
        switchCase = getBool(data, "switchcase", switchCase);
        forIn = getBool(data, "forin", forIn);
        tryCatch = getBool(data, "trycatch", tryCatch);
        newMi = getBool(data, "newmi", newMi);
    }

    private boolean getBool(Map<String, Object> map, String key, boolean defaultVal) {
        Object val = map.get(key);
        if (val instanceof Boolean)
            return (Boolean) val;
        return defaultVal;
    }

    // === Getters ===

    public boolean isLogicalOr() {
        return logicalOr;
    }

    public boolean isSwitchCase() {
        return switchCase;
    }

    public boolean isForIn() {
        return forIn;
    }

    public boolean isTryCatch() {
        return tryCatch;
    }

    public boolean isNewMi() {
        return newMi;
    }

    // === Fluent setters ===

    public ComplexityConfig withLogicalOr(boolean value) {
        this.logicalOr = value;
        return this;
    }

    public ComplexityConfig withSwitchCase(boolean value) {
        this.switchCase = value;
        return this;
    }

    public ComplexityConfig withForIn(boolean value) {
        this.forIn = value;
        return this;
    }

    public ComplexityConfig withTryCatch(boolean value) {
        this.tryCatch = value;
        return this;
    }

    public ComplexityConfig withNewMi(boolean value) {
        this.newMi = value;
        return this;
    }
}
