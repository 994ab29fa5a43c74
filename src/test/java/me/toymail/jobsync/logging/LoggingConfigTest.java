package me.toymail.jobsync.logging;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class LoggingConfigTest {

    @TempDir
    Path tempDir;

    private String savedDir;
    private String savedLevel;

    @BeforeEach
    void clearProperties() {
        savedDir = System.clearProperty(LoggingConfig.LOG_DIR_PROPERTY);
        savedLevel = System.clearProperty(LoggingConfig.LOG_LEVEL_PROPERTY);
    }

    @AfterEach
    void restoreProperties() {
        restore(LoggingConfig.LOG_DIR_PROPERTY, savedDir);
        restore(LoggingConfig.LOG_LEVEL_PROPERTY, savedLevel);
    }

    private static void restore(String key, String value) {
        if (value == null) System.clearProperty(key);
        else System.setProperty(key, value);
    }

    @Test
    public void testDefaultsUnderDataHome() {
        Path dir = LoggingConfig.init(Map.of(), tempDir);

        assertEquals(tempDir.resolve(".jobsync").resolve("logs"), dir);
        assertTrue(Files.isDirectory(dir));
        assertEquals(dir.toString(), System.getProperty(LoggingConfig.LOG_DIR_PROPERTY));
        assertEquals("DEBUG", System.getProperty(LoggingConfig.LOG_LEVEL_PROPERTY));
    }

    @Test
    public void testEnvironmentOverrides() {
        Path custom = tempDir.resolve("custom-logs");

        Path dir = LoggingConfig.init(Map.of("JOBSYNC_LOG_DIR", custom.toString(), "JOBSYNC_LOG_LEVEL", "warn"), tempDir);

        assertEquals(custom, dir);
        assertEquals("WARN", System.getProperty(LoggingConfig.LOG_LEVEL_PROPERTY));
    }

    @Test
    public void testSystemPropertyWinsOverEnvironment() {
        Path fromProperty = tempDir.resolve("prop-logs");
        System.setProperty(LoggingConfig.LOG_DIR_PROPERTY, fromProperty.toString());

        Path dir = LoggingConfig.init(Map.of("JOBSYNC_LOG_DIR", tempDir.resolve("env-logs").toString()), tempDir);

        assertEquals(fromProperty, dir);
    }

    @Test
    public void testUnknownLevelFallsBack() {
        assertEquals("DEBUG", LoggingConfig.level("loud"));
        assertEquals("ERROR", LoggingConfig.level(" error "));
        assertEquals("DEBUG", LoggingConfig.level(null));
    }
}
