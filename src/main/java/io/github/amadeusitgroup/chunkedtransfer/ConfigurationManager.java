package io.github.amadeusitgroup.chunkedtransfer;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.FileInputStream;
import java.io.FileNotFoundException;
import java.io.FileOutputStream;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Properties;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.regex.Pattern;

/**
 * ConfigurationManager resolves engine settings from system properties, loaded configuration
 * (properties or JSON files, programmatic values), environment variables and built-in defaults,
 * in that order of priority.
 */
public class ConfigurationManager {

    private static final Logger logger = LoggerFactory.getLogger(ConfigurationManager.class);

    public static final String ENV_PREFIX = "CHUNKTRANSFER_";
    public static final String SYSTEM_PROPERTY_PREFIX = "chunktransfer.";

    private static final Pattern POSITIVE_INTEGER = Pattern.compile("^[1-9]\\d*$");
    private static final Pattern NON_NEGATIVE_INTEGER = Pattern.compile("^\\d+$");
    private static final Pattern BOOLEAN = Pattern.compile("^(?i)(true|false)$");
    private static final Pattern NETWORK_QUALITY = Pattern.compile("^(?i)(fast|medium|slow)$");

    // Configuration storage
    private final Map<String, String> configuration = new ConcurrentHashMap<>();
    private final Map<String, String> environmentOverrides = new ConcurrentHashMap<>();
    private final Map<String, List<ChangeListener>> changeListeners = new ConcurrentHashMap<>();

    private final Map<String, String> defaults = new LinkedHashMap<>();
    private final Map<String, Pattern> validationPatterns = new HashMap<>();
    private final ObjectMapper objectMapper = new ObjectMapper();

    public ConfigurationManager() {
        this(System.getenv());
    }

    /**
     * @param environment environment variables to read {@code CHUNKTRANSFER_*} overrides from
     */
    public ConfigurationManager(Map<String, String> environment) {
        initializeDefaults();
        initializeValidationPatterns();
        loadEnvironmentOverrides(environment);
    }

    private void initializeDefaults() {
        defaults.put("chunk.size", "262144");
        defaults.put("chunk.min", "32768");
        defaults.put("chunk.max", "2097152");
        defaults.put("transfer.maxConcurrency", "4");
        defaults.put("transfer.maxRetries", "3");
        defaults.put("transfer.timeoutMs", "30000");
        defaults.put("transfer.checksum.enabled", "true");
        defaults.put("transfer.adaptive.enabled", "true");
        defaults.put("transfer.rangeRequests.enabled", "true");
        defaults.put("transfer.networkQuality", "medium");
        defaults.put("retry.baseDelayMs", "1000");
        defaults.put("retry.maxDelayMs", "10000");
        defaults.put("retry.maxAttempts", "3");
        defaults.put("pool.maxSockets", "8");
        defaults.put("pool.idleTtlMs", "300000");
        defaults.put("pool.sweepIntervalMs", "60000");
        defaults.put("pool.connectTimeoutMs", "30000");
        defaults.put("capability.cacheTtlMs", "300000");
        defaults.put("capability.maxAttempts", "3");
        defaults.put("monitor.windowSize", "1000");
        defaults.put("monitor.analysisIntervalMs", "30000");
        defaults.put("health.tickMs", "5000");
        defaults.put("health.minScore", "50");
        defaults.put("health.stallThresholdMs", "30000");
    }

    private void initializeValidationPatterns() {
        for (String key : new String[] {"chunk.size", "chunk.min", "chunk.max", "transfer.maxConcurrency",
                "transfer.timeoutMs", "retry.baseDelayMs", "retry.maxDelayMs", "retry.maxAttempts",
                "pool.maxSockets", "pool.idleTtlMs", "pool.connectTimeoutMs", "capability.cacheTtlMs",
                "capability.maxAttempts", "monitor.windowSize", "health.tickMs", "health.stallThresholdMs"}) {
            validationPatterns.put(key, POSITIVE_INTEGER);
        }
        for (String key : new String[] {"transfer.maxRetries", "pool.sweepIntervalMs",
                "monitor.analysisIntervalMs", "health.minScore"}) {
            validationPatterns.put(key, NON_NEGATIVE_INTEGER);
        }
        for (String key : new String[] {"transfer.checksum.enabled", "transfer.adaptive.enabled",
                "transfer.rangeRequests.enabled"}) {
            validationPatterns.put(key, BOOLEAN);
        }
        validationPatterns.put("transfer.networkQuality", NETWORK_QUALITY);
    }

    private void loadEnvironmentOverrides(Map<String, String> environment) {
        environment.forEach((key, value) -> {
            if (key.startsWith(ENV_PREFIX)) {
                environmentOverrides.put(toConfigKey(key), value);
            }
        });
    }

    /**
     * {@code CHUNKTRANSFER_CHUNK_SIZE} becomes {@code chunk.size}; a known key that differs only in
     * case, such as {@code transfer.maxConcurrency}, is matched to its defined spelling.
     */
    private String toConfigKey(String envVarName) {
        String dotted = envVarName.substring(ENV_PREFIX.length()).toLowerCase(Locale.ROOT).replace("_", ".");
        for (String known : defaults.keySet()) {
            if (known.toLowerCase(Locale.ROOT).equals(dotted)) {
                return known;
            }
        }
        return dotted;
    }

    // Configuration loading methods
    public void loadConfiguration(File configFile) throws IOException {
        if (!configFile.exists()) {
            throw new FileNotFoundException("Configuration file not found: " + configFile.getAbsolutePath());
        }

        Properties props = new Properties();
        try (FileInputStream fis = new FileInputStream(configFile)) {
            props.load(fis);
        }
        props.forEach((key, value) -> setString(key.toString(), value.toString()));
        logger.debug("Loaded {} settings from {}", props.size(), configFile);
    }

    public void loadJsonConfiguration(File jsonFile) throws IOException {
        if (!jsonFile.exists()) {
            throw new FileNotFoundException("JSON configuration file not found: " + jsonFile.getAbsolutePath());
        }

        JsonNode rootNode = objectMapper.readTree(jsonFile);
        loadJsonNode("", rootNode);
    }

    private void loadJsonNode(String prefix, JsonNode node) {
        if (node.isObject()) {
            node.fields().forEachRemaining(entry -> {
                String key = prefix.isEmpty() ? entry.getKey() : prefix + "." + entry.getKey();
                loadJsonNode(key, entry.getValue());
            });
        } else if (node.isValueNode()) {
            setString(prefix, node.asText());
        }
    }

    public void loadProfile(String profile, File configDir) throws IOException {
        File profileFile = new File(configDir, "chunktransfer-" + profile + ".properties");
        if (profileFile.exists()) {
            loadConfiguration(profileFile);
        } else {
            logger.debug("No configuration profile {} in {}", profile, configDir);
        }
    }

    // Configuration retrieval methods
    public String getString(String key) {
        return getString(key, null);
    }

    public String getString(String key, String defaultValue) {
        // Priority: System Properties > Configuration > Environment > Defaults
        String systemProperty = System.getProperty(SYSTEM_PROPERTY_PREFIX + key);
        if (systemProperty != null) {
            return systemProperty;
        }

        String configValue = configuration.get(key);
        if (configValue != null) {
            return configValue;
        }

        String envValue = environmentOverrides.get(key);
        if (envValue != null) {
            return envValue;
        }

        String defaultVal = defaults.get(key);
        if (defaultVal != null) {
            return defaultVal;
        }

        return defaultValue;
    }

    public int getInt(String key, int defaultValue) {
        String value = getString(key);
        if (value == null) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            logger.warn("Invalid integer for {}: '{}', using {}", key, value, defaultValue);
            return defaultValue;
        }
    }

    public long getLong(String key, long defaultValue) {
        String value = getString(key);
        if (value == null) {
            return defaultValue;
        }
        try {
            return Long.parseLong(value.trim());
        } catch (NumberFormatException e) {
            logger.warn("Invalid long for {}: '{}', using {}", key, value, defaultValue);
            return defaultValue;
        }
    }

    public double getDouble(String key, double defaultValue) {
        String value = getString(key);
        if (value == null) {
            return defaultValue;
        }
        try {
            return Double.parseDouble(value.trim());
        } catch (NumberFormatException e) {
            logger.warn("Invalid number for {}: '{}', using {}", key, value, defaultValue);
            return defaultValue;
        }
    }

    public boolean getBoolean(String key, boolean defaultValue) {
        String value = getString(key);
        if (value == null) {
            return defaultValue;
        }
        return Boolean.parseBoolean(value.trim());
    }

    /**
     * Whether a key was given by a system property, loaded configuration or the environment,
     * as opposed to resolving to its built-in default.
     */
    public boolean isExplicitlySet(String key) {
        return System.getProperty(SYSTEM_PROPERTY_PREFIX + key) != null
            || configuration.containsKey(key)
            || environmentOverrides.containsKey(key);
    }

    public Map<String, String> getDefaults() {
        return Collections.unmodifiableMap(defaults);
    }

    // Configuration setting methods
    public void setString(String key, String value) {
        String oldValue = configuration.put(key, value);
        notifyChangeListeners(key, oldValue, value);
    }

    public void setInt(String key, int value) {
        setString(key, String.valueOf(value));
    }

    public void setLong(String key, long value) {
        setString(key, String.valueOf(value));
    }

    public void setBoolean(String key, boolean value) {
        setString(key, String.valueOf(value));
    }

    public void remove(String key) {
        String oldValue = configuration.remove(key);
        if (oldValue != null) {
            notifyChangeListeners(key, oldValue, getString(key));
        }
    }

    // Environment variable methods
    public void setEnvironmentOverride(String envVarName, String value) {
        if (!envVarName.startsWith(ENV_PREFIX)) {
            throw new IllegalArgumentException("Environment override must start with " + ENV_PREFIX + ": " + envVarName);
        }
        String configKey = toConfigKey(envVarName);
        String oldValue = environmentOverrides.put(configKey, value);
        notifyChangeListeners(configKey, oldValue, value);
    }

    public String getEnvironmentVariableName(String configKey) {
        return ENV_PREFIX + configKey.toUpperCase(Locale.ROOT).replace(".", "_");
    }

    // Validation

    /**
     * Validate every effective value against its expected shape.
     *
     * @return human readable errors, empty when the configuration is usable
     */
    public List<String> validate() {
        List<String> errors = new ArrayList<>();
        for (String key : validationPatterns.keySet()) {
            validateValue(key, getString(key), errors);
        }
        int min = getInt("chunk.min", TransferPlanner.MIN_CHUNK_SIZE);
        int max = getInt("chunk.max", TransferPlanner.MAX_CHUNK_SIZE);
        int size = getInt("chunk.size", TransferPlanner.DEFAULT_CHUNK_SIZE);
        if (min > max) {
            errors.add("Invalid chunk.min: " + min + " (greater than chunk.max " + max + ")");
        } else if (size < min || size > max) {
            errors.add("Invalid chunk.size: " + size + " (must be within [" + min + ", " + max + "])");
        }
        if (getInt("health.minScore", 50) > 100) {
            errors.add("Invalid health.minScore: " + getString("health.minScore") + " (must be at most 100)");
        }
        return errors;
    }

    /**
     * Validate the values of a properties file without loading it.
     */
    public List<String> validateConfiguration(File configFile) throws IOException {
        Properties props = new Properties();
        try (FileInputStream fis = new FileInputStream(configFile)) {
            props.load(fis);
        }

        List<String> errors = new ArrayList<>();
        props.forEach((key, value) -> validateValue(key.toString(), value.toString(), errors));
        return errors;
    }

    private void validateValue(String key, String value, List<String> errors) {
        Pattern pattern = validationPatterns.get(key);
        if (pattern == null || value == null || pattern.matcher(value.trim()).matches()) {
            return;
        }
        if (pattern == POSITIVE_INTEGER) {
            errors.add("Invalid " + key + ": " + value + " (must be a positive integer)");
        } else if (pattern == NON_NEGATIVE_INTEGER) {
            errors.add("Invalid " + key + ": " + value + " (cannot be negative)");
        } else if (pattern == BOOLEAN) {
            errors.add("Invalid " + key + ": " + value + " (must be true or false)");
        } else {
            errors.add("Invalid " + key + ": " + value + " (must be fast, medium or slow)");
        }
    }

    // Export functionality
    public void exportAsProperties(File outputFile) throws IOException {
        Properties props = new Properties();
        configuration.forEach(props::setProperty);

        try (FileOutputStream fos = new FileOutputStream(outputFile)) {
            props.store(fos, "Exported chunked transfer configuration");
        }
    }

    public void exportAsJson(File outputFile) throws IOException {
        ObjectNode rootNode = objectMapper.createObjectNode();
        configuration.forEach((key, value) -> {
            if ("true".equalsIgnoreCase(value) || "false".equalsIgnoreCase(value)) {
                rootNode.put(key, Boolean.parseBoolean(value));
            } else if (value.matches("^-?\\d{1,18}$")) {
                rootNode.put(key, Long.parseLong(value));
            } else {
                rootNode.put(key, value);
            }
        });

        objectMapper.writerWithDefaultPrettyPrinter().writeValue(outputFile, rootNode);
    }

    // Change listeners
    public void addChangeListener(String keyPattern, ChangeListener listener) {
        changeListeners.computeIfAbsent(keyPattern, k -> new CopyOnWriteArrayList<>()).add(listener);
    }

    public void removeChangeListener(String keyPattern, ChangeListener listener) {
        List<ChangeListener> listeners = changeListeners.get(keyPattern);
        if (listeners != null) {
            listeners.remove(listener);
        }
    }

    private void notifyChangeListeners(String key, String oldValue, String newValue) {
        changeListeners.forEach((pattern, listeners) -> {
            if (key.equals(pattern) || key.matches(Pattern.quote(pattern).replace("*", "\\E.*\\Q"))) {
                for (ChangeListener listener : listeners) {
                    try {
                        listener.onConfigurationChanged(key, oldValue, newValue);
                    } catch (RuntimeException e) {
                        logger.warn("Configuration listener failed for {}: {}", key, e.getMessage(), e);
                    }
                }
            }
        });
    }

    @FunctionalInterface
    public interface ChangeListener {
        void onConfigurationChanged(String key, String oldValue, String newValue);
    }
}
