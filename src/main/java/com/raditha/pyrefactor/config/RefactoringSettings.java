package com.raditha.pyrefactor.config;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

/**
 * Loads refactoring configuration from {@code pyrefactor.yml} with CLI overrides.
 *
 * Configuration priority: CLI arguments > pyrefactor.yml > defaults
 * <p>
 * The file keeps its settings under a top level {@code refactoring} key:
 * <pre>
 * refactoring:
 *   indent_unit: "    "
 *   reject_private_names: true
 *   history_file: .pyrefactor/history.json
 *   extraction_candidate_min_lines: 50
 *   extra_builtins: [settings]
 *   diff_context_lines: 3
 * </pre>
 */
public class RefactoringSettings {

    private static final Logger logger = LoggerFactory.getLogger(RefactoringSettings.class);

    public static final String DEFAULT_FILE_NAME = "pyrefactor.yml";
    private static final String CONFIG_KEY = "refactoring";

    private static final ObjectMapper YAML = new ObjectMapper(new YAMLFactory());

    private RefactoringSettings() {
    }

    /**
     * Values given on the command line; {@code null} means not given.
     */
    public record Overrides(
            @Nullable String indentUnit,
            @Nullable Boolean rejectPrivateNames,
            @Nullable Path historyFile,
            @Nullable Integer extractionCandidateMinLines) {

        public static Overrides none() {
            return new Overrides(null, null, null, null);
        }
    }

    /**
     * Load configuration from an explicit file, else {@code pyrefactor.yml} in
     * the working directory, else the defaults.
     *
     * @param configFile file named on the command line, may be null
     * @param overrides  CLI values that win over the file
     * @throws IllegalArgumentException when an explicit file is missing or any file is malformed
     */
    public static RefactoringConfig loadConfig(@Nullable Path configFile, Overrides overrides) {
        Path file = configFile;
        if (file != null && !Files.isRegularFile(file)) {
            throw new IllegalArgumentException("Configuration file not found: " + file);
        }
        if (file == null) {
            Path candidate = Path.of(DEFAULT_FILE_NAME);
            file = Files.isRegularFile(candidate) ? candidate : null;
        }
        Map<String, Object> config = file == null ? Map.of() : readSection(file);
        return build(config, overrides);
    }

    public static RefactoringConfig loadConfig(@Nullable Path configFile) {
        return loadConfig(configFile, Overrides.none());
    }

    static RefactoringConfig build(Map<String, Object> config, Overrides overrides) {
        RefactoringConfig defaults = RefactoringConfig.defaults();

        String indentUnit = overrides.indentUnit() != null ? overrides.indentUnit()
                : getString(config, "indent_unit", defaults.indentUnit());
        boolean rejectPrivate = overrides.rejectPrivateNames() != null ? overrides.rejectPrivateNames()
                : getBoolean(config, "reject_private_names", defaults.rejectPrivateNames());
        String historyFromYaml = getString(config, "history_file", null);
        Path historyFile = overrides.historyFile() != null ? overrides.historyFile()
                : historyFromYaml == null ? defaults.historyFile() : Path.of(historyFromYaml);
        int minLines = overrides.extractionCandidateMinLines() != null ? overrides.extractionCandidateMinLines()
                : getInt(config, "extraction_candidate_min_lines", defaults.extractionCandidateMinLines());

        return new RefactoringConfig(
                indentUnit,
                rejectPrivate,
                historyFile,
                minLines,
                getListString(config, "extra_builtins"),
                getInt(config, "diff_context_lines", defaults.diffContextLines()));
    }

    private static Map<String, Object> readSection(Path file) {
        Map<String, Object> root;
        try {
            root = YAML.readValue(file.toFile(), new TypeReference<Map<String, Object>>() {
            });
        } catch (IOException e) {
            throw new IllegalArgumentException("Cannot read configuration file " + file + ": " + e.getMessage(), e);
        }
        if (root == null) {
            return Map.of();
        }
        Object section = root.get(CONFIG_KEY);
        if (!(section instanceof Map)) {
            logger.debug("No '{}' section in {}, using defaults", CONFIG_KEY, file);
            return Map.of();
        }
        logger.debug("Loaded configuration from {}", file);
        @SuppressWarnings("unchecked")
        Map<String, Object> config = (Map<String, Object>) section;
        return config;
    }

    private static int getInt(Map<String, Object> map, String key, int defaultValue) {
        Object value = map.get(key);
        if (value instanceof Number) {
            return ((Number) value).intValue();
        }
        return defaultValue;
    }

    private static boolean getBoolean(Map<String, Object> map, String key, boolean defaultValue) {
        Object value = map.get(key);
        if (value instanceof Boolean) {
            return (Boolean) value;
        }
        return defaultValue;
    }

    private static @Nullable String getString(Map<String, Object> map, String key, @Nullable String defaultValue) {
        Object value = map.get(key);
        if (value != null) {
            return value.toString();
        }
        return defaultValue;
    }

    private static List<String> getListString(Map<String, Object> map, String key) {
        Object value = map.get(key);
        if (value instanceof List<?> list) {
            return list.stream().map(String::valueOf).toList();
        }
        return List.of();
    }
}
