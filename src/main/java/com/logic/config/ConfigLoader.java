package com.logic.config;

import com.logic.exception.ConfigurationException;
import com.logic.parser.TokenizerMode;
import com.logic.simplifier.NonConvergencePolicy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.ClassPathResource;
import org.springframework.core.io.FileSystemResource;
import org.springframework.core.io.Resource;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.IOException;
import java.io.InputStream;
import java.math.BigDecimal;
import java.util.Map;

/**
 * Loads simplifier configuration from YAML files.
 * <p>
 * Expected layout (every key optional):
 * <pre>
 * simplifier:
 *   name: default
 *   max-iterations: 10
 *   tokenizer-mode: LEGACY
 *   on-non-convergence: WARN
 * </pre>
 */
public class ConfigLoader {

    private static final Logger log = LoggerFactory.getLogger(ConfigLoader.class);

    private ConfigLoader() {
    }

    /**
     * Load configuration from a path.
     * Supports classpath: prefix for classpath resources.
     *
     * @param path Path to the configuration file
     * @return Loaded configuration
     */
    public static SimplifierConfig load(String path) {
        log.info("Loading simplifier configuration from: {}", path);

        try {
            Resource resource = getResource(path);
            try (InputStream inputStream = resource.getInputStream()) {
                return parseYaml(inputStream);
            }
        } catch (IOException e) {
            throw new ConfigurationException("Failed to load configuration from: " + path, e);
        }
    }

    /**
     * Load configuration from an open stream. The stream is not closed.
     */
    public static SimplifierConfig load(InputStream inputStream) {
        return parseYaml(inputStream);
    }

    private static Resource getResource(String path) {
        if (path.startsWith("classpath:")) {
            String resourcePath = path.substring("classpath:".length());
            return new ClassPathResource(resourcePath);
        }
        return new FileSystemResource(path);
    }

    @SuppressWarnings("unchecked")
    private static SimplifierConfig parseYaml(InputStream inputStream) {
        Object loaded;
        try {
            loaded = new Yaml().load(inputStream);
        } catch (YAMLException e) {
            throw new ConfigurationException("Configuration file is not valid YAML", e);
        }

        if (loaded == null) {
            throw new ConfigurationException("Configuration file is empty");
        }
        if (!(loaded instanceof Map<?, ?>)) {
            throw new ConfigurationException("Configuration root must be a mapping");
        }
        Map<String, Object> root = (Map<String, Object>) loaded;

        // Settings may sit at the root or under 'simplifier'
        Object section = root.getOrDefault("simplifier", root);
        if (!(section instanceof Map<?, ?>)) {
            throw new ConfigurationException("'simplifier' section must be a mapping");
        }
        Map<String, Object> simplifierConfig = (Map<String, Object>) section;

        SimplifierConfig defaults = SimplifierConfig.defaults();
        String name = getString(simplifierConfig, "name", defaults.name());
        int maxIterations = getInt(simplifierConfig, "max-iterations", defaults.maxIterations());
        TokenizerMode tokenizerMode = getEnum(simplifierConfig, "tokenizer-mode",
                TokenizerMode.class, defaults.tokenizerMode());
        NonConvergencePolicy policy = getEnum(simplifierConfig, "on-non-convergence",
                NonConvergencePolicy.class, defaults.nonConvergencePolicy());

        if (maxIterations < 1) {
            throw new ConfigurationException("max-iterations must be at least 1, got " + maxIterations);
        }

        SimplifierConfig config = new SimplifierConfig(name, maxIterations, tokenizerMode, policy);
        log.info("Loaded simplifier configuration '{}': max-iterations={}, tokenizer-mode={}, on-non-convergence={}",
                name, maxIterations, tokenizerMode, policy);
        return config;
    }

    // Helper methods

    private static String getString(Map<String, Object> map, String key, String defaultValue) {
        Object value = map.get(key);
        return value != null ? value.toString() : defaultValue;
    }

    private static int getInt(Map<String, Object> map, String key, int defaultValue) {
        Object value = map.get(key);
        if (value == null) return defaultValue;
        if (value instanceof Integer) return (Integer) value;
        try {
            // fractions and values outside the int range are rejected
            return new BigDecimal(value.toString().trim()).intValueExact();
        } catch (NumberFormatException | ArithmeticException e) {
            throw new ConfigurationException("'" + key + "' must be an integer, got '" + value + "'", e);
        }
    }

    private static <E extends Enum<E>> E getEnum(Map<String, Object> map, String key,
                                                 Class<E> type, E defaultValue) {
        String value = getString(map, key, null);
        if (value == null || value.isBlank()) {
            return defaultValue;
        }
        try {
            return Enum.valueOf(type, value.trim().toUpperCase().replace("-", "_"));
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException("Unknown " + key + " '" + value + "'", e);
        }
    }
}
