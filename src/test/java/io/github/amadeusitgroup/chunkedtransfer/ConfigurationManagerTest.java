package io.github.amadeusitgroup.chunkedtransfer;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.File;
import java.io.FileOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Properties;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for ConfigurationManager.
 */
public class ConfigurationManagerTest {

    private ConfigurationManager configManager;

    @TempDir
    Path testConfigDir;

    @BeforeEach
    public void setUp() {
        configManager = new ConfigurationManager(Collections.<String, String>emptyMap());
    }

    @AfterEach
    public void tearDown() {
        System.clearProperty("chunktransfer.transfer.maxConcurrency");
    }

    @Test
    public void testDefaultConfiguration() {
        assertEquals(262144, configManager.getInt("chunk.size", 0), "Default chunk size is 256 KiB");
        assertEquals(4, configManager.getInt("transfer.maxConcurrency", 0), "Default concurrency");
        assertEquals(3, configManager.getInt("transfer.maxRetries", 0), "Default retries");
        assertEquals(30000, configManager.getLong("transfer.timeoutMs", 0), "Default timeout");
        assertTrue(configManager.getBoolean("transfer.checksum.enabled", false), "Checksums are on by default");
        assertEquals("medium", configManager.getString("transfer.networkQuality"), "Default network quality");
        assertEquals(42, configManager.getInt("unknown.key", 42), "Unknown keys use the caller default");
        assertFalse(configManager.isExplicitlySet("chunk.size"), "Defaults are not explicit");
    }

    @Test
    public void testEnvironmentVariables() {
        Map<String, String> env = new HashMap<>();
        env.put("CHUNKTRANSFER_CHUNK_SIZE", "524288");
        env.put("CHUNKTRANSFER_TRANSFER_MAXCONCURRENCY", "8");
        env.put("PATH", "/usr/bin");
        ConfigurationManager fromEnv = new ConfigurationManager(env);

        assertEquals(524288, fromEnv.getInt("chunk.size", 0), "Environment should override the default");
        assertEquals(8, fromEnv.getInt("transfer.maxConcurrency", 0),
            "Environment key should match the defined spelling");
        assertTrue(fromEnv.isExplicitlySet("chunk.size"), "Environment values are explicit");
        assertEquals("CHUNKTRANSFER_TRANSFER_TIMEOUTMS", fromEnv.getEnvironmentVariableName("transfer.timeoutMs"),
            "Should convert property name to environment variable format");
    }

    @Test
    public void testEnvironmentOverrideRequiresPrefix() {
        assertThrows(IllegalArgumentException.class, () -> configManager.setEnvironmentOverride("CHUNK_SIZE", "1"),
            "Overrides without the prefix are rejected");
    }

    @Test
    public void testConfigurationPrecedence() throws IOException {
        configManager.setEnvironmentOverride("CHUNKTRANSFER_TRANSFER_MAXCONCURRENCY", "6");
        assertEquals(6, configManager.getInt("transfer.maxConcurrency", 0), "Environment beats defaults");

        File configFile = testConfigDir.resolve("engine.properties").toFile();
        Properties props = new Properties();
        props.setProperty("transfer.maxConcurrency", "10");
        try (FileOutputStream fos = new FileOutputStream(configFile)) {
            props.store(fos, "Test");
        }
        configManager.loadConfiguration(configFile);
        assertEquals(10, configManager.getInt("transfer.maxConcurrency", 0), "Loaded configuration beats environment");

        System.setProperty("chunktransfer.transfer.maxConcurrency", "12");
        assertEquals(12, configManager.getInt("transfer.maxConcurrency", 0), "System property beats everything");

        System.clearProperty("chunktransfer.transfer.maxConcurrency");
        configManager.remove("transfer.maxConcurrency");
        assertEquals(6, configManager.getInt("transfer.maxConcurrency", 0), "Removing falls back to environment");
    }

    @Test
    public void testJsonConfiguration() throws IOException {
        File jsonFile = testConfigDir.resolve("engine.json").toFile();
        String json = "{\n"
            + "  \"chunk\": { \"size\": 1048576, \"max\": 4194304 },\n"
            + "  \"transfer\": { \"adaptive\": { \"enabled\": false }, \"networkQuality\": \"fast\" },\n"
            + "  \"retry\": { \"baseDelayMs\": 250 }\n"
            + "}";
        Files.write(jsonFile.toPath(), json.getBytes(StandardCharsets.UTF_8));

        configManager.loadJsonConfiguration(jsonFile);

        assertEquals(1048576, configManager.getInt("chunk.size", 0), "Nested chunk size");
        assertEquals(4194304, configManager.getInt("chunk.max", 0), "Nested chunk max");
        assertFalse(configManager.getBoolean("transfer.adaptive.enabled", true), "Nested boolean");
        assertEquals("fast", configManager.getString("transfer.networkQuality"), "Nested string");
        assertEquals(250, configManager.getLong("retry.baseDelayMs", 0), "Nested long");
    }

    @Test
    public void testMissingFilesAreReported() {
        assertThrows(IOException.class,
            () -> configManager.loadConfiguration(testConfigDir.resolve("missing.properties").toFile()),
            "Missing properties file");
        assertThrows(IOException.class,
            () -> configManager.loadJsonConfiguration(testConfigDir.resolve("missing.json").toFile()),
            "Missing JSON file");
    }

    @Test
    public void testLoadProfile() throws IOException {
        Files.write(testConfigDir.resolve("chunktransfer-ci.properties"),
            "transfer.maxRetries=5\n".getBytes(StandardCharsets.UTF_8));

        configManager.loadProfile("ci", testConfigDir.toFile());
        configManager.loadProfile("absent", testConfigDir.toFile());

        assertEquals(5, configManager.getInt("transfer.maxRetries", 0), "Profile should be loaded");
    }

    @Test
    public void testInvalidNumbersFallBack() {
        configManager.setString("transfer.timeoutMs", "soon");

        assertEquals(1234, configManager.getLong("transfer.timeoutMs", 1234), "Invalid long uses the default");
        assertEquals(7, configManager.getInt("transfer.timeoutMs", 7), "Invalid int uses the default");
    }

    @Test
    public void testValidDefaults() {
        assertTrue(configManager.validate().isEmpty(), "Built-in defaults must validate");
    }

    @Test
    public void testValidationErrors() {
        configManager.setString("transfer.maxConcurrency", "0");
        configManager.setString("transfer.maxRetries", "-1");
        configManager.setString("transfer.checksum.enabled", "yes");
        configManager.setString("transfer.networkQuality", "warp");
        configManager.setString("health.minScore", "101");

        List<String> errors = configManager.validate();

        assertEquals(5, errors.size(), "Every invalid value should be reported: " + errors);
        assertTrue(errors.contains("Invalid transfer.maxConcurrency: 0 (must be a positive integer)"),
            "Positive integer message");
        assertTrue(errors.contains("Invalid transfer.maxRetries: -1 (cannot be negative)"), "Negative message");
        assertTrue(errors.contains("Invalid transfer.checksum.enabled: yes (must be true or false)"),
            "Boolean message");
        assertTrue(errors.contains("Invalid transfer.networkQuality: warp (must be fast, medium or slow)"),
            "Quality message");
    }

    @Test
    public void testChunkBoundsValidation() {
        configManager.setInt("chunk.size", 16384);
        assertEquals(Collections.singletonList("Invalid chunk.size: 16384 (must be within [32768, 2097152])"),
            configManager.validate(), "Chunk size below the minimum");

        configManager.setInt("chunk.min", 4194304);
        assertTrue(configManager.validate().get(0).startsWith("Invalid chunk.min"), "Min above max");
    }

    @Test
    public void testValidateConfigurationFile() throws IOException {
        File configFile = testConfigDir.resolve("bad.properties").toFile();
        Files.write(configFile.toPath(), "pool.maxSockets=abc\nchunk.size=65536\n".getBytes(StandardCharsets.UTF_8));

        List<String> errors = configManager.validateConfiguration(configFile);

        assertEquals(1, errors.size(), "Only the bad value is reported");
        assertEquals(8, configManager.getInt("pool.maxSockets", 0), "Validation must not load values");
    }

    @Test
    public void testChangeListeners() {
        List<String> changes = new ArrayList<>();
        ConfigurationManager.ChangeListener listener =
            (key, oldValue, newValue) -> changes.add(key + ":" + oldValue + "->" + newValue);
        configManager.addChangeListener("retry.*", listener);
        configManager.addChangeListener("chunk.size", (key, oldValue, newValue) -> {
            throw new IllegalStateException("listener failure");
        });

        configManager.setLong("retry.baseDelayMs", 500);
        configManager.setInt("chunk.size", 65536);
        configManager.setLong("retry.baseDelayMs", 700);
        configManager.removeChangeListener("retry.*", listener);
        configManager.setLong("retry.maxDelayMs", 900);

        assertEquals(2, changes.size(), "Only matching keys while registered: " + changes);
        assertEquals("retry.baseDelayMs:null->500", changes.get(0), "First change");
        assertEquals("retry.baseDelayMs:500->700", changes.get(1), "Second change");
    }

    @Test
    public void testExportAsJson() throws IOException {
        configManager.setInt("chunk.size", 65536);
        configManager.setBoolean("transfer.adaptive.enabled", false);
        configManager.setString("transfer.networkQuality", "slow");
        File out = testConfigDir.resolve("export.json").toFile();

        configManager.exportAsJson(out);
        ConfigurationManager reloaded = new ConfigurationManager(Collections.<String, String>emptyMap());
        reloaded.loadJsonConfiguration(out);

        String exported = new String(Files.readAllBytes(out.toPath()), StandardCharsets.UTF_8);
        assertTrue(exported.contains("\"chunk.size\" : 65536"), "Numbers are exported as numbers: " + exported);
        assertEquals(65536, reloaded.getInt("chunk.size", 0), "Exported number should load back");
        assertFalse(reloaded.getBoolean("transfer.adaptive.enabled", true), "Exported boolean should load back");
    }

    @Test
    public void testExportAsProperties() throws IOException {
        configManager.setInt("transfer.maxRetries", 6);
        File out = testConfigDir.resolve("export.properties").toFile();

        configManager.exportAsProperties(out);
        ConfigurationManager reloaded = new ConfigurationManager(Collections.<String, String>emptyMap());
        reloaded.loadConfiguration(out);

        assertEquals(6, reloaded.getInt("transfer.maxRetries", 0), "Exported value should load back");
    }

    @Test
    public void testTransferOptionsUseChunkBounds() {
        configManager.setInt("chunk.min", 65536);
        configManager.setInt("chunk.max", 524288);

        TransferOptions options = TransferOptions.fromConfiguration(configManager);

        assertEquals(65536, options.getMinChunkSize(), "chunk.min should bound the planner");
        assertEquals(524288, options.getMaxChunkSize(), "chunk.max should bound the planner");
        assertNull(options.getChunkSize(), "Defaulted chunk.size is not an explicit request");
    }
}
