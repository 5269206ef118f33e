package com.testplatform.config;

import com.testplatform.core.RunnerOptions;
import com.testplatform.exception.SettingsException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.ClassPathResource;
import org.springframework.core.io.FileSystemResource;
import org.springframework.core.io.Resource;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.IOException;
import java.io.InputStream;
import java.time.Duration;
import java.time.format.DateTimeParseException;
import java.util.Map;

/**
 * Loads runner options from YAML files.
 * <pre>
 * testplatform:
 *   design-mode: false
 *   test-case-filter: "Category!=Slow"
 *   telemetry-opted-in: true
 *   run-request-wait-timeout: 5s
 * </pre>
 */
public class OptionsLoader {

    private static final Logger log = LoggerFactory.getLogger(OptionsLoader.class);

    private static final String ROOT_KEY = "testplatform";

    /**
     * Load options from a path.
     * Supports classpath: prefix for classpath resources.
     *
     * @param path Path to the options file
     * @return Loaded options
     */
    public static RunnerOptions load(String path) {
        log.info("Loading runner options from: {}", path);

        try {
            Resource resource = getResource(path);
            try (InputStream inputStream = resource.getInputStream()) {
                return parseYaml(inputStream);
            }
        } catch (IOException e) {
            throw new SettingsException("Failed to load runner options from: " + path, e);
        } catch (YAMLException e) {
            throw new SettingsException("Invalid YAML in runner options: " + path, e);
        }
    }

    /**
     * Load options if the file exists, defaults otherwise.
     */
    public static RunnerOptions loadOrDefault(String path) {
        if (path == null || path.isBlank() || !getResource(path).exists()) {
            log.info("No runner options at '{}', using defaults", path);
            return new RunnerOptions();
        }
        return load(path);
    }

    private static Resource getResource(String path) {
        if (path.startsWith("classpath:")) {
            String resourcePath = path.substring("classpath:".length());
            return new ClassPathResource(resourcePath);
        }
        return new FileSystemResource(path);
    }

    @SuppressWarnings("unchecked")
    private static RunnerOptions parseYaml(InputStream inputStream) {
        Yaml yaml = new Yaml();
        Object loaded = yaml.load(inputStream);

        RunnerOptions options = new RunnerOptions();
        if (loaded == null) {
            return options;
        }
        if (!(loaded instanceof Map)) {
            throw new SettingsException("Runner options must be a YAML mapping");
        }

        Map<String, Object> root = (Map<String, Object>) loaded;
        // Options could be at root or under 'testplatform' key
        Object section = root.getOrDefault(ROOT_KEY, root);
        if (!(section instanceof Map)) {
            throw new SettingsException("'" + ROOT_KEY + "' must be a YAML mapping");
        }
        Map<String, Object> values = (Map<String, Object>) section;

        options.setDesignMode(getBoolean(values, "design-mode", false));
        options.setTestCaseFilterValue(getString(values, "test-case-filter", null));
        options.setTelemetryOptedIn(getBoolean(values, "telemetry-opted-in", false));
        options.setRunRequestWaitTimeout(getDuration(values, "run-request-wait-timeout",
                RunnerOptions.DEFAULT_RUN_REQUEST_WAIT_TIMEOUT));

        log.debug("Loaded {}", options);
        return options;
    }

    private static String getString(Map<String, Object> map, String key, String defaultValue) {
        Object value = map.get(key);
        return value != null ? value.toString() : defaultValue;
    }

    private static boolean getBoolean(Map<String, Object> map, String key, boolean defaultValue) {
        Object value = map.get(key);
        if (value == null) {
            return defaultValue;
        }
        if (value instanceof Boolean b) {
            return b;
        }
        String text = value.toString().trim();
        if ("true".equalsIgnoreCase(text) || "false".equalsIgnoreCase(text)) {
            return Boolean.parseBoolean(text);
        }
        throw new SettingsException("Invalid boolean for '" + key + "': " + value);
    }

    /**
     * Accepts milliseconds as a number, a simple suffix form (500ms, 5s, 1m) or ISO-8601 (PT5S).
     */
    private static Duration getDuration(Map<String, Object> map, String key, Duration defaultValue) {
        Object value = map.get(key);
        if (value == null) {
            return defaultValue;
        }
        if (value instanceof Number n) {
            return checkNotNegative(key, Duration.ofMillis(n.longValue()));
        }

        String text = value.toString().trim().toLowerCase();
        try {
            if (text.startsWith("p")) {
                return checkNotNegative(key, Duration.parse(value.toString().trim()));
            }
            if (text.endsWith("ms")) {
                return checkNotNegative(key, Duration.ofMillis(Long.parseLong(text.substring(0, text.length() - 2))));
            }
            if (text.endsWith("s")) {
                return checkNotNegative(key, Duration.ofSeconds(Long.parseLong(text.substring(0, text.length() - 1))));
            }
            if (text.endsWith("m")) {
                return checkNotNegative(key, Duration.ofMinutes(Long.parseLong(text.substring(0, text.length() - 1))));
            }
            return checkNotNegative(key, Duration.ofMillis(Long.parseLong(text)));
        } catch (NumberFormatException | DateTimeParseException e) {
            throw new SettingsException("Invalid duration for '" + key + "': " + value, e);
        }
    }

    private static Duration checkNotNegative(String key, Duration duration) {
        if (duration.isNegative()) {
            throw new SettingsException("'" + key + "' must not be negative: " + duration);
        }
        return duration;
    }
}
