package me.toymail.jobsync.service;

import me.toymail.jobsync.ImapClient;
import me.toymail.jobsync.MailboxConnectionException;
import me.toymail.jobsync.enrich.EnrichmentWorker;
import me.toymail.jobsync.jobs.JobContext;
import me.toymail.jobsync.store.JobRecord;
import me.toymail.jobsync.store.StoreContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Search, import and enrichment hand-off for one mailbox in a single run.
 */
public class SyncService {
    private static final Logger log = LoggerFactory.getLogger(SyncService.class);

    private final StoreContext context;
    private final MailboxSearchService searchService;
    private final ImportService importService;
    private final EnrichmentWorker worker;
    private final Clock clock;

    public SyncService(StoreContext context, MailboxSearchService searchService, ImportService importService,
                       EnrichmentWorker worker, Clock clock) {
        this.context = context;
        this.searchService = searchService;
        this.importService = importService;
        this.worker = worker;
        this.clock = clock;
    }

    /**
     * @param pendingEnrichments records handed to the worker that were still queued or in flight
     *                           when the sync finished
     */
    public record SyncResult(MailboxSearchService.SearchSummary search, ImportStats stats, int pendingEnrichments) {}

    public SyncResult sync(String credentialId, boolean ignorePreviousImport, JobContext ctx)
            throws IOException, MailboxConnectionException {
        Instant started = clock.instant();

        MailboxSearchService.SearchResult found = searchService.search(credentialId, ignorePreviousImport, ctx);

        ctx.checkpoint();
        ctx.updateProgress(90, "Importing " + found.all().size() + " items");
        ImportService.ImportResult imported = importService.importCandidates(found.all(), ctx);
        ctx.updateProgress(95, "Queueing enrichment");

        List<String> handedOver = handOverEnrichment();
        int pending = worker.pendingCount(handedOver);

        List<ImapClient.FolderFetchError> failedFolders = found.summary().folders().skipped();
        if (failedFolders.isEmpty()) {
            context.credentials().markImported(credentialId, started);
        } else {
            // the next sync reads the failed folders again from the old start date
            log.warn("Not advancing last import of {}: {} folder(s) could not be read",
                    credentialId, failedFolders.size());
        }
        log.info("Sync of {} finished: {} added, {} pending enrichments",
                credentialId, imported.stats().applications.added, pending);
        return new SyncResult(found.summary(), imported.stats(), pending);
    }

    /**
     * Flag and queue every record that has a website but was never enriched.
     */
    private List<String> handOverEnrichment() throws IOException {
        List<JobRecord> targets = context.jobs().find(JobRecord::needsEnrichment);
        List<String> ids = new ArrayList<>();
        for (JobRecord r : targets) {
            if (!r.enrichmentPending) {
                context.jobs().update(r.id, rec -> rec.enrichmentPending = true);
            }
            worker.enqueueRecord(r.id, r.website);
            ids.add(r.id);
        }
        return ids;
    }
}
