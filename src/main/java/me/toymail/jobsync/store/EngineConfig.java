package me.toymail.jobsync.store;

import com.fasterxml.jackson.annotation.JsonIgnore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;

/**
 * Engine settings, read from config.json in the data home. Every section has working defaults,
 * and the environment can override the values operators usually tune.
 */
public final class EngineConfig {
    private static final Logger log = LoggerFactory.getLogger(EngineConfig.class);

    public static final String FILE_NAME = "config.json";

    public Imap imap = new Imap();
    public Enrichment enrichment = new Enrichment();
    public Dedup dedup = new Dedup();
    public Jobs jobs = new Jobs();

    // never written to disk; comes from JOBSYNC_SECRET_KEY
    @JsonIgnore
    public String secretKey;

    public static final class Imap {
        public String host = "imap.gmail.com";
        public int port = 993;
        public boolean useTLS = true;
        public int searchTimeframeDays = 90;
        public List<String> searchFolders = new ArrayList<>(List.of("INBOX"));
        public int fetchBatchSize = 25;
        public int connectionTimeoutMs = 60_000;
        public int readTimeoutMs = 120_000;
        public int writeTimeoutMs = 60_000;
    }

    public static final class Enrichment {
        public int requestsPerMinute = 5;
        public int maxConsecutiveFailures = 3;
        public long standardDelayMs = 12_000;
        public long backoffDelayMs = 60_000;
        public int requestTimeoutMs = 15_000;
        public int maxRedirects = 5;
        public int maxAttemptsPerItem = 3;
        public String userAgent = "Mozilla/5.0 (Windows NT 10.0; Win64; x64) AppleWebKit/537.36 "
                + "(KHTML, like Gecko) Chrome/124.0 Safari/537.36";

        public Duration standardDelay() { return Duration.ofMillis(standardDelayMs); }
        public Duration backoffDelay() { return Duration.ofMillis(backoffDelayMs); }
        public Duration requestTimeout() { return Duration.ofMillis(requestTimeoutMs); }
    }

    public static final class Dedup {
        public int windowDays = 3;

        public Duration window() { return Duration.ofDays(windowDays); }
    }

    public static final class Jobs {
        public int activeWindowMinutes = 5;
        public int retentionMinutes = 60;
        public int sweepIntervalSeconds = 60;
        public int pollIntervalMs = 2_000;

        public Duration activeWindow() { return Duration.ofMinutes(activeWindowMinutes); }
        public Duration retention() { return Duration.ofMinutes(retentionMinutes); }
    }

    /**
     * Read config.json (defaults when missing), then apply environment overrides.
     */
    public static EngineConfig load(JsonStore store, Map<String, String> env) throws IOException {
        EngineConfig cfg = store.readJson(FILE_NAME, EngineConfig.class);
        if (cfg == null) cfg = new EngineConfig();
        cfg.applyEnvironment(env);
        return cfg;
    }

    public EngineConfig applyEnvironment(Map<String, String> env) {
        enrichment.requestsPerMinute = intEnv(env, "LINKEDIN_REQUESTS_PER_MINUTE", enrichment.requestsPerMinute);
        enrichment.maxConsecutiveFailures = intEnv(env, "LINKEDIN_MAX_CONSECUTIVE_FAILURES", enrichment.maxConsecutiveFailures);
        enrichment.standardDelayMs = intEnv(env, "LINKEDIN_STANDARD_DELAY", (int) enrichment.standardDelayMs);
        enrichment.backoffDelayMs = intEnv(env, "LINKEDIN_BACKOFF_DELAY", (int) enrichment.backoffDelayMs);
        enrichment.requestTimeoutMs = intEnv(env, "LINKEDIN_REQUEST_TIMEOUT", enrichment.requestTimeoutMs);
        enrichment.maxRedirects = intEnv(env, "LINKEDIN_MAX_REDIRECTS", enrichment.maxRedirects);
        imap.searchTimeframeDays = intEnv(env, "DEFAULT_SEARCH_TIMEFRAME_DAYS", imap.searchTimeframeDays);
        imap.fetchBatchSize = intEnv(env, "EMAIL_IMPORT_BATCH_SIZE", imap.fetchBatchSize);

        String folders = env.get("DEFAULT_SEARCH_FOLDERS");
        if (folders != null && !folders.isBlank()) {
            imap.searchFolders = new ArrayList<>(Arrays.stream(folders.split(","))
                    .map(String::trim)
                    .filter(s -> !s.isEmpty())
                    .toList());
        }

        String key = env.get("JOBSYNC_SECRET_KEY");
        if (key != null && !key.isBlank()) secretKey = key;
        return this;
    }

    private static int intEnv(Map<String, String> env, String name, int fallback) {
        String raw = env.get(name);
        if (raw == null || raw.isBlank()) return fallback;
        try {
            return Integer.parseInt(raw.trim());
        } catch (NumberFormatException e) {
            log.warn("Ignoring {}={}: not a number", name, raw);
            return fallback;
        }
    }
}
