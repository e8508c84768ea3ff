package com.plogic.config;

import com.plogic.exception.ConfigurationException;
import com.plogic.format.FormatStyle;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.ClassPathResource;
import org.springframework.core.io.FileSystemResource;
import org.springframework.core.io.Resource;
import org.yaml.snakeyaml.Yaml;

import java.io.IOException;
import java.io.InputStream;
import java.util.Locale;
import java.util.Map;

/**
 * Loads plogic configuration from YAML files.
 * <pre>
 * plogic:
 *   parser:
 *     max-depth: 512
 *   formatter:
 *     style: canonical
 * </pre>
 */
public class ConfigLoader {

    private static final Logger log = LoggerFactory.getLogger(ConfigLoader.class);

    /**
     * Load configuration from a path.
     * Supports classpath: prefix for classpath resources.
     *
     * @param path Path to the configuration file
     * @return Loaded configuration
     */
    public static LogicConfig load(String path) {
        log.info("Loading plogic configuration from: {}", path);

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
    static LogicConfig parseYaml(InputStream inputStream) {
        Yaml yaml = new Yaml();
        Object loaded = yaml.load(inputStream);

        if (loaded == null) {
            throw new ConfigurationException("Configuration file is empty");
        }
        if (!(loaded instanceof Map)) {
            throw new ConfigurationException("Configuration root must be a mapping");
        }

        Map<String, Object> root = (Map<String, Object>) loaded;

        // The plogic section could be at root or under 'plogic' key
        Map<String, Object> logicConfig = root.containsKey("plogic")
                ? getSection(root, "plogic")
                : root;

        LogicConfig defaults = LogicConfig.defaults();
        int maxDepth = getInt(getSection(logicConfig, "parser"), "max-depth", defaults.maxDepth());
        FormatStyle style = parseStyle(getSection(logicConfig, "formatter"), defaults.defaultStyle());

        LogicConfig config = new LogicConfig(maxDepth, style);
        log.info("Loaded plogic configuration: max-depth {}, style {}", config.maxDepth(), config.defaultStyle());
        return config;
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> getSection(Map<String, Object> map, String key) {
        Object value = map.get(key);
        if (value == null) {
            return Map.of();
        }
        if (!(value instanceof Map)) {
            throw new ConfigurationException("'" + key + "' must be a mapping");
        }
        return (Map<String, Object>) value;
    }

    private static int getInt(Map<String, Object> map, String key, int defaultValue) {
        Object value = map.get(key);
        if (value == null) {
            return defaultValue;
        }
        if (value instanceof Integer i) {
            return i;
        }
        throw new ConfigurationException("'" + key + "' must be an integer, got '" + value + "'");
    }

    private static FormatStyle parseStyle(Map<String, Object> map, FormatStyle defaultValue) {
        Object value = map.get("style");
        if (value == null) {
            return defaultValue;
        }
        try {
            return FormatStyle.valueOf(value.toString().trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException("Unknown formatter style '" + value
                    + "'. Expected one of: formal, canonical", e);
        }
    }
}
