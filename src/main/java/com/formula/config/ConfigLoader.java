package com.formula.config;

import com.formula.exception.ConfigurationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.ClassPathResource;
import org.springframework.core.io.FileSystemResource;
import org.springframework.core.io.Resource;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.IOException;
import java.io.InputStream;
import java.util.Map;
import java.util.Set;

/**
 * Loads formula engine configuration from YAML files.
 * <pre>
 * formula:
 *   name: analytics
 *   max-formula-length: 2048
 *   trace-tokens: false
 * </pre>
 * The {@code formula} section may also be written at the root of the file.
 */
public class ConfigLoader {

    private static final Logger log = LoggerFactory.getLogger(ConfigLoader.class);

    private static final Set<String> KNOWN_KEYS = Set.of("name", "max-formula-length", "trace-tokens");

    private ConfigLoader() {
    }

    /**
     * Load configuration from a path.
     * Supports classpath: prefix for classpath resources.
     *
     * @param path Path to the configuration file
     * @return Loaded configuration
     * @throws ConfigurationException when the file is missing, empty or invalid
     */
    public static FormulaConfig load(String path) {
        log.info("Loading formula configuration from: {}", path);

        try {
            Resource resource = getResource(path);
            try (InputStream inputStream = resource.getInputStream()) {
                return parseYaml(inputStream);
            }
        } catch (IOException e) {
            throw new ConfigurationException("Failed to load configuration from: " + path, e);
        }
    }

    private static Resource getResource(String path) {
        if (path.startsWith("classpath:")) {
            String resourcePath = path.substring("classpath:".length());
            return new ClassPathResource(resourcePath);
        }
        return new FileSystemResource(path);
    }

    @SuppressWarnings("unchecked")
    static FormulaConfig parseYaml(InputStream inputStream) {
        Map<String, Object> root;
        try {
            root = new Yaml().load(inputStream);
        } catch (YAMLException | ClassCastException e) {
            throw new ConfigurationException("Configuration file is not a YAML mapping", e);
        }

        if (root == null) {
            throw new ConfigurationException("Configuration file is empty");
        }

        Object section = root.getOrDefault("formula", root);
        if (!(section instanceof Map)) {
            throw new ConfigurationException("'formula' section must be a mapping");
        }
        Map<String, Object> formulaConfig = (Map<String, Object>) section;
        for (Object key : formulaConfig.keySet()) {
            if (!KNOWN_KEYS.contains(key)) {
                log.warn("Ignoring unknown formula configuration key: {}", key);
            }
        }

        FormulaConfig config;
        try {
            config = new FormulaConfig(
                    getString(formulaConfig, "name", FormulaConfig.DEFAULT_NAME),
                    getInt(formulaConfig, "max-formula-length", FormulaConfig.DEFAULT_MAX_FORMULA_LENGTH),
                    getBoolean(formulaConfig, "trace-tokens", false));
        } catch (NumberFormatException e) {
            throw new ConfigurationException("max-formula-length must be an integer", e);
        }

        log.info("Loaded formula configuration: {} (max length {}, trace tokens {})",
                config.name(), config.maxFormulaLength(), config.traceTokens());
        return config;
    }

    private static String getString(Map<String, Object> map, String key, String defaultValue) {
        Object value = map.get(key);
        return value != null ? value.toString() : defaultValue;
    }

    private static int getInt(Map<String, Object> map, String key, int defaultValue) {
        Object value = map.get(key);
        if (value == null) return defaultValue;
        if (value instanceof Number) return ((Number) value).intValue();
        return Integer.parseInt(value.toString());
    }

    private static boolean getBoolean(Map<String, Object> map, String key, boolean defaultValue) {
        Object value = map.get(key);
        if (value == null) return defaultValue;
        if (value instanceof Boolean) return (Boolean) value;
        return Boolean.parseBoolean(value.toString());
    }
}
