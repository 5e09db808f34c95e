package com.calc.config;

import com.calc.config.expression.FunctionNameTable;
import com.calc.exception.ConfigurationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.ClassPathResource;
import org.springframework.core.io.FileSystemResource;
import org.springframework.core.io.Resource;
import org.yaml.snakeyaml.Yaml;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Loads Calc configuration from YAML files.
 * <p>
 * Example:
 * <pre>
 * calc:
 *   name: scientific
 *   functions:
 *     include-defaults: true
 *     additional: [erf, gamma]
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
    public static CalcConfig load(String path) {
        log.info("Loading Calc configuration from: {}", path);

        Resource resource = getResource(path);
        if (!resource.exists()) {
            throw new ConfigurationException("Configuration file not found: " + path);
        }

        try (InputStream inputStream = resource.getInputStream()) {
            return parseYaml(inputStream);
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
    static CalcConfig parseYaml(InputStream inputStream) {
        Yaml yaml = new Yaml();
        Object document = yaml.load(inputStream);

        if (document == null) {
            throw new ConfigurationException("Configuration file is empty");
        }
        if (!(document instanceof Map<?, ?>)) {
            throw new ConfigurationException("Configuration root must be a mapping");
        }

        Map<String, Object> root = (Map<String, Object>) document;

        // The calc section may be at root or under 'calc' key
        Map<String, Object> calcConfig = root.containsKey("calc")
                ? getMap(root, "calc")
                : root;
        if (calcConfig == null) {
            throw new ConfigurationException("Configuration section 'calc' is empty");
        }

        String name = getString(calcConfig, "name", "default-calculator");
        FunctionNameTable functions = parseFunctions(getMap(calcConfig, "functions"));

        log.info("Loaded Calc configuration: {} with {} functions", name, functions.size());
        return new CalcConfig(name, functions);
    }

    private static FunctionNameTable parseFunctions(Map<String, Object> functionsMap) {
        if (functionsMap == null) {
            return FunctionNameTable.defaults();
        }

        boolean includeDefaults = getBoolean(functionsMap, "include-defaults", true);
        List<String> additional = getStringList(functionsMap, "additional");

        if (!includeDefaults && additional.isEmpty()) {
            throw new ConfigurationException(
                    "functions.include-defaults is false but no additional functions are listed");
        }

        log.debug("Parsed functions: includeDefaults={}, additional={}", includeDefaults, additional);
        return includeDefaults
                ? FunctionNameTable.withDefaults(additional)
                : FunctionNameTable.of(additional);
    }

    // Helper methods

    @SuppressWarnings("unchecked")
    private static Map<String, Object> getMap(Map<String, Object> map, String key) {
        Object value = map.get(key);
        if (value == null) {
            return null;
        }
        if (!(value instanceof Map<?, ?>)) {
            throw new ConfigurationException("'" + key + "' must be a mapping");
        }
        return (Map<String, Object>) value;
    }

    private static List<String> getStringList(Map<String, Object> map, String key) {
        Object value = map.get(key);
        if (value == null) {
            return List.of();
        }
        if (!(value instanceof List<?> list)) {
            throw new ConfigurationException("'" + key + "' must be a list");
        }
        List<String> strings = new ArrayList<>();
        for (Object item : list) {
            strings.add(item == null ? null : item.toString());
        }
        return strings;
    }

    private static String getString(Map<String, Object> map, String key, String defaultValue) {
        Object value = map.get(key);
        return value != null ? value.toString() : defaultValue;
    }

    private static boolean getBoolean(Map<String, Object> map, String key, boolean defaultValue) {
        Object value = map.get(key);
        if (value == null) return defaultValue;
        if (value instanceof Boolean) return (Boolean) value;
        return Boolean.parseBoolean(value.toString());
    }
}
