package me.toymail.jobsync.store;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class EngineConfigTest {

    @TempDir
    Path tempDir;

    @Test
    public void testDefaultsWhenFileMissing() throws Exception {
        EngineConfig cfg = EngineConfig.load(new JsonStore(tempDir), Map.of());

        assertEquals(5, cfg.enrichment.requestsPerMinute);
        assertEquals(3, cfg.enrichment.maxConsecutiveFailures);
        assertEquals(Duration.ofSeconds(12), cfg.enrichment.standardDelay());
        assertEquals(Duration.ofSeconds(60), cfg.enrichment.backoffDelay());
        assertEquals(90, cfg.imap.searchTimeframeDays);
        assertEquals(List.of("INBOX"), cfg.imap.searchFolders);
        assertEquals(Duration.ofDays(3), cfg.dedup.window());
        assertNull(cfg.secretKey);
    }

    @Test
    public void testReadsFileAndIgnoresUnknownKeys() throws Exception {
        Files.writeString(tempDir.resolve("config.json"),
                "{\"enrichment\":{\"requestsPerMinute\":2},\"dedup\":{\"windowDays\":7},\"legacy\":true}");

        EngineConfig cfg = EngineConfig.load(new JsonStore(tempDir), Map.of());

        assertEquals(2, cfg.enrichment.requestsPerMinute);
        assertEquals(7, cfg.dedup.windowDays);
        assertEquals(3, cfg.enrichment.maxConsecutiveFailures);
    }

    @Test
    public void testEnvironmentOverrides() throws Exception {
        EngineConfig cfg = EngineConfig.load(new JsonStore(tempDir), Map.of(
                "LINKEDIN_REQUESTS_PER_MINUTE", "10",
                "LINKEDIN_BACKOFF_DELAY", "5000",
                "DEFAULT_SEARCH_FOLDERS", "INBOX, Jobs ,",
                "JOBSYNC_SECRET_KEY", "k"));

        assertEquals(10, cfg.enrichment.requestsPerMinute);
        assertEquals(Duration.ofSeconds(5), cfg.enrichment.backoffDelay());
        assertEquals(List.of("INBOX", "Jobs"), cfg.imap.searchFolders);
        assertEquals("k", cfg.secretKey);
    }

    @Test
    public void testInvalidNumberKeepsDefault() {
        EngineConfig cfg = new EngineConfig().applyEnvironment(Map.of("LINKEDIN_MAX_CONSECUTIVE_FAILURES", "lots"));

        assertEquals(3, cfg.enrichment.maxConsecutiveFailures);
    }
}
