package me.toymail.jobsync.service;

import me.toymail.jobsync.classify.CandidateItem;
import me.toymail.jobsync.enrich.EnrichmentWorker;
import me.toymail.jobsync.enrich.JobPageParser;
import me.toymail.jobsync.jobs.JobContext;
import me.toymail.jobsync.jobs.JobType;
import me.toymail.jobsync.store.EngineConfig;
import me.toymail.jobsync.store.JobRecord;
import me.toymail.jobsync.store.JobRecordStore;
import me.toymail.jobsync.store.JsonStore;
import me.toymail.jobsync.store.ResponseStatus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

public class ImportServiceTest {

    private static final Instant APPLIED = Instant.parse("2024-03-01T10:00:00Z");
    private static final String POSTING = "https://www.linkedin.com/jobs/view/3912345678/";

    @TempDir
    Path tempDir;

    private JobRecordStore records;
    private EnrichmentWorker worker;
    private ImportService service;

    @BeforeEach
    void setUp() {
        records = new JobRecordStore(new JsonStore(tempDir));
        // never started: queued items stay queued
        worker = new EnrichmentWorker(records, url -> {
            throw new AssertionError("no fetch expected");
        }, new JobPageParser(), new EngineConfig.Enrichment());
        service = new ImportService(records, new CandidateMatcher(Duration.ofDays(3)), worker);
    }

    private static JobContext ctx() {
        return JobContext.detached(JobType.EMAIL_IMPORT);
    }

    private static CandidateItem application(String title, String company, String website) {
        return CandidateItem.application(title, company, "Berlin", APPLIED, null, website, "<a@x>", "INBOX");
    }

    private static CandidateItem rejection(Instant at) {
        return CandidateItem.response("Backend Engineer", "Acme Corp", at, ResponseStatus.REJECTED,
                null, null, "<r@x>", "INBOX");
    }

    @Test
    public void testImportCreatesRecordsFromApplications() throws Exception {
        ImportService.ImportResult result = service.importCandidates(
                List.of(application("Backend Engineer", "Acme Corp", null)), ctx());

        assertEquals(1, result.stats().applications.added);
        assertEquals(1, result.createdRecordIds().size());
        JobRecord r = records.get(result.createdRecordIds().get(0)).orElseThrow();
        assertEquals("Backend Engineer", r.jobTitle);
        assertEquals("Acme Corp", r.company);
        assertEquals("Berlin", r.companyLocation);
        assertEquals(APPLIED, r.appliedAt);
        assertEquals(ResponseStatus.NO_RESPONSE, r.response);
        assertEquals("Email", r.source);
        assertFalse(r.enrichmentPending);
    }

    @Test
    public void testReimportIsIdempotent() throws Exception {
        List<CandidateItem> items = List.of(
                application("Backend Engineer", "Acme Corp", null),
                rejection(APPLIED.plus(Duration.ofDays(7))));

        service.importCandidates(items, ctx());
        ImportStats second = service.importCandidates(items, ctx()).stats();

        assertEquals(0, second.applications.added);
        assertEquals(1, second.applications.existing);
        assertEquals(0, second.responses.processed);
        assertEquals(1, second.responses.skipped);
        assertEquals(1, records.list().size());
        assertEquals(1, records.list().get(0).statusChecks.size());
    }

    @Test
    public void testResponseInSameBatchAppliesToNewRecord() throws Exception {
        ImportStats stats = service.importCandidates(List.of(
                rejection(APPLIED.plus(Duration.ofDays(7))),
                application("Backend Engineer", "Acme Corp", null)), ctx()).stats();

        assertEquals(1, stats.responses.processed);
        JobRecord r = records.list().get(0);
        assertEquals(ResponseStatus.REJECTED, r.response);
        assertEquals(APPLIED.plus(Duration.ofDays(7)), r.respondedAt);
        assertEquals("Response: Rejected", r.statusChecks.get(0).notes);
    }

    @Test
    public void testOlderResponseDoesNotOverwriteNewer() throws Exception {
        Instant later = APPLIED.plus(Duration.ofDays(10));
        service.importCandidates(List.of(application("Backend Engineer", "Acme Corp", null),
                CandidateItem.response("Backend Engineer", "Acme Corp", later, ResponseStatus.INTERVIEW,
                        null, null, "<i@x>", "INBOX")), ctx());

        ImportStats stats = service.importCandidates(List.of(rejection(APPLIED.plus(Duration.ofDays(5)))), ctx()).stats();

        assertEquals(1, stats.responses.skipped);
        JobRecord r = records.list().get(0);
        assertEquals(ResponseStatus.INTERVIEW, r.response);
        assertEquals(later, r.respondedAt);
    }

    @Test
    public void testDuplicateStatusUpdateIsSkipped() throws Exception {
        CandidateItem viewed = CandidateItem.statusUpdate("Backend Engineer", "Acme Corp",
                APPLIED.plus(Duration.ofDays(2)), "viewed", null, null, "<v@x>", "INBOX");
        service.importCandidates(List.of(application("Backend Engineer", "Acme Corp", null), viewed), ctx());

        ImportStats stats = service.importCandidates(List.of(viewed), ctx()).stats();

        assertEquals(0, stats.statusUpdates.processed);
        assertEquals(1, stats.statusUpdates.skipped);
        JobRecord r = records.list().get(0);
        assertEquals(1, r.statusChecks.size());
        assertEquals("Application viewed by Acme Corp", r.statusChecks.get(0).notes);
    }

    @Test
    public void testStatusUpdatesKeepMailboxOrder() throws Exception {
        CandidateItem viewed = CandidateItem.statusUpdate("Backend Engineer", "Acme Corp",
                APPLIED.plus(Duration.ofDays(2)), "viewed", null, null, "<v@x>", "Archive");
        CandidateItem downloaded = CandidateItem.statusUpdate("Backend Engineer", "Acme Corp",
                APPLIED.plus(Duration.ofDays(1)), "downloaded", null, null, "<d@x>", "INBOX");

        service.importCandidates(List.of(application("Backend Engineer", "Acme Corp", null), viewed, downloaded), ctx());

        JobRecord r = records.list().get(0);
        assertEquals(2, r.statusChecks.size());
        assertEquals("Application viewed by Acme Corp", r.statusChecks.get(0).notes);
        assertEquals("Application downloaded by Acme Corp", r.statusChecks.get(1).notes);
    }

    @Test
    public void testConcurrentImportsCreateOneRecordPerApplication() throws Exception {
        List<CandidateItem> items = new ArrayList<>();
        for (int i = 0; i < 20; i++) {
            items.add(application("Engineer " + i, "Company " + i, null));
        }
        int threads = 8;
        CountDownLatch go = new CountDownLatch(1);
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        List<Future<ImportService.ImportResult>> results = new ArrayList<>();
        try {
            for (int t = 0; t < threads; t++) {
                results.add(pool.submit(() -> {
                    go.await();
                    return service.importCandidates(items, ctx());
                }));
            }
            go.countDown();
            int added = 0;
            for (Future<ImportService.ImportResult> f : results) {
                added += f.get(10, TimeUnit.SECONDS).stats().applications.added;
            }
            assertEquals(20, added);
        } finally {
            pool.shutdownNow();
        }

        assertEquals(20, records.list().size());
        assertEquals(20, records.list().stream().map(r -> r.company).distinct().count());
    }

    @Test
    public void testUnmatchedEventIsSkipped() throws Exception {
        ImportStats stats = service.importCandidates(List.of(rejection(APPLIED)), ctx()).stats();

        assertEquals(1, stats.responses.skipped);
        assertTrue(records.list().isEmpty());
    }

    @Test
    public void testInvalidItemIsRecordedAndBatchContinues() throws Exception {
        ImportStats stats = service.importCandidates(List.of(
                application("Backend Engineer", "", null),
                application("Data Engineer", "Globex", null)), ctx()).stats();

        assertEquals(1, stats.applications.added);
        assertEquals(1, stats.applications.errors);
        assertEquals(1, stats.failures.size());
        assertEquals("company is required", stats.failures.get(0).error());
        assertEquals("Globex", records.list().get(0).company);
    }

    @Test
    public void testNewRecordWithWebsiteIsQueuedForEnrichment() throws Exception {
        ImportService.ImportResult result = service.importCandidates(
                List.of(application("Data Engineer", "Globex", POSTING)), ctx());

        assertEquals(1, result.stats().enrichments.queued);
        String id = result.createdRecordIds().get(0);
        assertTrue(records.get(id).orElseThrow().enrichmentPending);
        assertEquals(1, worker.pendingCount(List.of(id)));
        assertEquals(1, worker.status().queueSize());
    }

    @Test
    public void testResolveFlagsExistingCandidates() throws Exception {
        service.importCandidates(List.of(application("Backend Engineer", "Acme Corp", null)), ctx());

        List<CandidateItem> resolved = service.resolve(List.of(
                application("Backend Engineer", "Acme Corp", null),
                application("Data Engineer", "Globex", null)));

        assertTrue(resolved.get(0).exists());
        assertEquals(records.list().get(0).id, resolved.get(0).matchedRecordId());
        assertFalse(resolved.get(1).exists());
        assertNull(resolved.get(1).matchedRecordId());
    }
}
