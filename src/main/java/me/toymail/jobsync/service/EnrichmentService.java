package me.toymail.jobsync.service;

import me.toymail.jobsync.enrich.EnrichmentStatus;
import me.toymail.jobsync.enrich.EnrichmentWorker;
import me.toymail.jobsync.jobs.JobContext;
import me.toymail.jobsync.store.JobRecord;
import me.toymail.jobsync.store.JobRecordStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Drives the enrichment worker on behalf of callers.
 */
public class EnrichmentService {
    private static final Logger log = LoggerFactory.getLogger(EnrichmentService.class);

    private final JobRecordStore records;
    private final EnrichmentWorker worker;
    private final Duration pollInterval;

    public EnrichmentService(JobRecordStore records, EnrichmentWorker worker, Duration pollInterval) {
        this.records = records;
        this.worker = worker;
        this.pollInterval = pollInterval;
    }

    public record EnrichmentRunResult(int total, int enriched, int notEnriched) {}

    public boolean enqueueUrl(String url) {
        return worker.enqueueUrl(url);
    }

    public EnrichmentStatus status() {
        return worker.status();
    }

    /**
     * Queue every record that still needs enrichment and wait until the worker is done with them.
     */
    public EnrichmentRunResult runPending(JobContext ctx) throws IOException, InterruptedException {
        List<JobRecord> targets = records.find(r -> r.enrichmentPending || r.needsEnrichment());
        List<String> ids = new ArrayList<>();
        for (JobRecord r : targets) {
            if (r.website == null || r.website.isBlank()) continue;
            if (!r.enrichmentPending) records.update(r.id, rec -> rec.enrichmentPending = true);
            worker.enqueueRecord(r.id, r.website);
            ids.add(r.id);
        }
        log.info("Enrichment run: {} records to enrich", ids.size());
        if (ids.isEmpty()) {
            return new EnrichmentRunResult(0, 0, 0);
        }

        while (true) {
            int remaining = worker.pendingCount(ids);
            int done = ids.size() - remaining;
            ctx.updateProgress(done * 100 / ids.size(), done + " of " + ids.size() + " records enriched or dropped");
            if (remaining == 0) break;
            ctx.checkpoint();
            Thread.sleep(pollInterval.toMillis());
        }

        int enriched = 0;
        for (String id : ids) {
            if (records.get(id).map(r -> r.enrichedAt != null).orElse(false)) enriched++;
        }
        return new EnrichmentRunResult(ids.size(), enriched, ids.size() - enriched);
    }
}
