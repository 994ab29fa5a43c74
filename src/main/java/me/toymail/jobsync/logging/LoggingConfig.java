package me.toymail.jobsync.logging;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Publishes the log directory and level as system properties read by logback.xml.
 * Must run before the first logger is created.
 */
public final class LoggingConfig {

    public static final String LOG_DIR_PROPERTY = "jobsync.log.dir";
    public static final String LOG_LEVEL_PROPERTY = "jobsync.log.level";

    static final String LOG_DIR_ENV = "JOBSYNC_LOG_DIR";
    static final String LOG_LEVEL_ENV = "JOBSYNC_LOG_LEVEL";
    private static final Set<String> LEVELS = Set.of("TRACE", "DEBUG", "INFO", "WARN", "ERROR", "OFF");

    private static boolean initialized = false;

    private LoggingConfig() {}

    public static synchronized void init() {
        if (initialized) return;
        init(System.getenv(), Path.of(System.getProperty("user.home")));
        initialized = true;
    }

    /**
     * Resolve the settings without touching logback. Properties already set on the command
     * line win over the environment.
     *
     * @return the log directory in use
     */
    static Path init(Map<String, String> env, Path home) {
        String configuredDir = System.getProperty(LOG_DIR_PROPERTY);
        Path logDir;
        if (configuredDir != null) {
            logDir = Path.of(configuredDir);
        } else if (env.get(LOG_DIR_ENV) != null && !env.get(LOG_DIR_ENV).isBlank()) {
            logDir = Path.of(env.get(LOG_DIR_ENV).trim());
        } else {
            logDir = home.resolve(".jobsync").resolve("logs");
        }
        try {
            Files.createDirectories(logDir);
        } catch (IOException e) {
            // no logger exists yet
            System.err.println("Warning: Could not create log directory " + logDir + ": " + e.getMessage());
        }
        System.setProperty(LOG_DIR_PROPERTY, logDir.toString());

        if (System.getProperty(LOG_LEVEL_PROPERTY) == null) {
            System.setProperty(LOG_LEVEL_PROPERTY, level(env.get(LOG_LEVEL_ENV)));
        }
        return logDir;
    }

    static String level(String raw) {
        if (raw == null) return "DEBUG";
        String upper = raw.trim().toUpperCase(Locale.ROOT);
        return LEVELS.contains(upper) ? upper : "DEBUG";
    }
}
