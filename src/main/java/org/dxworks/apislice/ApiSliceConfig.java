package org.dxworks.apislice;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;

public class ApiSliceConfig {

    private static final String CONFIG_FILE_NAME = "apislice-config.yml";
    private static final int MAX_WORKERS_LIMIT = 5;
    private static final int DEFAULT_MAX_WORKERS = 5;
    private static final int DEFAULT_MAX_FILE_LINES = 20000;
    private static final String DEFAULT_HOST = "https://api.example.com";
    private static final String DEFAULT_VERSION = "1.0.0";
    private static final List<String> DEFAULT_IGNORED_DIRS = List.of(
            "node_modules", "dist", "build", "coverage", ".git", ".next", "vendor");

    private final List<String> ignoredDirs;
    private final int maxWorkers;
    private final int maxFileLines;
    private final String host;
    private final String title;
    private final String version;

    private ApiSliceConfig(List<String> ignoredDirs, int maxWorkers, int maxFileLines,
                           String host, String title, String version) {
        this.ignoredDirs = List.copyOf(ignoredDirs);
        this.maxWorkers = maxWorkers;
        this.maxFileLines = maxFileLines;
        this.host = host;
        this.title = title;
        this.version = version;
    }

    public List<String> getIgnoredDirs() {
        return ignoredDirs;
    }

    public int getMaxWorkers() {
        return maxWorkers;
    }

    public int getMaxFileLines() {
        return maxFileLines;
    }

    public String getHost() {
        return host;
    }

    /** Document title, or {@code null} to use the repository name. */
    public String getTitle() {
        return title;
    }

    public String getVersion() {
        return version;
    }

    public static ApiSliceConfig defaults() {
        return new ApiSliceConfig(DEFAULT_IGNORED_DIRS, DEFAULT_MAX_WORKERS, DEFAULT_MAX_FILE_LINES,
                DEFAULT_HOST, null, DEFAULT_VERSION);
    }

    public static ApiSliceConfig load() {
        return load(Paths.get(CONFIG_FILE_NAME));
    }

    public static ApiSliceConfig load(Path configPath) {
        if (!Files.exists(configPath)) {
            return defaults();
        }

        try {
            ObjectMapper yamlMapper = new ObjectMapper(new YAMLFactory());
            YamlConfig yamlConfig = yamlMapper.readValue(configPath.toFile(), YamlConfig.class);
            if (yamlConfig != null) {
                List<String> ignoredDirs = yamlConfig.ignoredDirs != null
                        ? yamlConfig.ignoredDirs
                        : DEFAULT_IGNORED_DIRS;
                int maxWorkers = yamlConfig.maxWorkers != null
                        ? yamlConfig.maxWorkers
                        : DEFAULT_MAX_WORKERS;
                int maxFileLines = (yamlConfig.maxFileLines != null && yamlConfig.maxFileLines > 0)
                        ? yamlConfig.maxFileLines
                        : DEFAULT_MAX_FILE_LINES;
                String host = isBlank(yamlConfig.host) ? DEFAULT_HOST : yamlConfig.host.trim();
                String title = isBlank(yamlConfig.title) ? null : yamlConfig.title.trim();
                String version = isBlank(yamlConfig.version) ? DEFAULT_VERSION : yamlConfig.version.trim();

                return with(ignoredDirs, maxWorkers, maxFileLines, host, title, version);
            }
        } catch (IOException e) {
            System.err.println("Could not read " + configPath + ", using defaults: " + e.getMessage());
        }

        return defaults();
    }

    public static ApiSliceConfig with(List<String> ignoredDirs, int maxWorkers, int maxFileLines,
                                      String host, String title, String version) {
        int effectiveMaxWorkers = Math.max(1, Math.min(MAX_WORKERS_LIMIT, maxWorkers));
        int effectiveMaxFileLines = maxFileLines > 0 ? maxFileLines : DEFAULT_MAX_FILE_LINES;
        return new ApiSliceConfig(
                ignoredDirs != null ? ignoredDirs : DEFAULT_IGNORED_DIRS,
                effectiveMaxWorkers,
                effectiveMaxFileLines,
                host != null ? host : DEFAULT_HOST,
                title,
                version != null ? version : DEFAULT_VERSION);
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    private static class YamlConfig {
        public List<String> ignoredDirs;
        public Integer maxWorkers;
        public Integer maxFileLines;
        public String host;
        public String title;
        public String version;
    }
}
