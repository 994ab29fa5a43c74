package me.toymail.jobsync.service;

import me.toymail.jobsync.classify.CandidateItem;
import me.toymail.jobsync.classify.CandidateType;
import me.toymail.jobsync.enrich.EnrichmentWorker;
import me.toymail.jobsync.jobs.JobContext;
import me.toymail.jobsync.store.ImportWriteException;
import me.toymail.jobsync.store.JobRecord;
import me.toymail.jobsync.store.JobRecordStore;
import me.toymail.jobsync.store.ResponseStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Instant;
import java.util.*;

/**
 * Matches candidates against stored records and writes the new ones.
 */
public class ImportService {
    private static final Logger log = LoggerFactory.getLogger(ImportService.class);

    static final String SOURCE_EMAIL = "Email";

    private final JobRecordStore records;
    private final CandidateMatcher matcher;
    private final EnrichmentWorker worker;

    public ImportService(JobRecordStore records, CandidateMatcher matcher, EnrichmentWorker worker) {
        this.records = records;
        this.matcher = matcher;
        this.worker = worker;
    }

    public record ImportResult(ImportStats stats, List<String> createdRecordIds) {}

    /**
     * Set {@code exists} and {@code matchedRecordId} on every candidate.
     */
    public List<CandidateItem> resolve(List<CandidateItem> candidates) throws IOException {
        List<JobRecord> snapshot = records.list();
        List<CandidateItem> out = new ArrayList<>(candidates.size());
        for (CandidateItem c : candidates) {
            out.add(c.withMatch(matcher.match(c, snapshot).map(r -> r.id).orElse(null)));
        }
        return out;
    }

    /**
     * Apply candidates in one batch: applications first, then status updates and responses in
     * the order the mailbox returned them. Candidates are matched again inside the batch, so
     * earlier {@code exists} flags are only advisory. A candidate that cannot be written is
     * recorded and skipped.
     */
    public ImportResult importCandidates(List<CandidateItem> candidates, JobContext ctx) throws IOException {
        List<CandidateItem> applications = new ArrayList<>();
        List<CandidateItem> events = new ArrayList<>();
        for (CandidateItem c : candidates) {
            if (c.type() == CandidateType.APPLICATION) applications.add(c);
            else events.add(c);
        }

        ctx.checkpoint();
        ctx.message("Importing " + candidates.size() + " items");

        ImportStats stats = new ImportStats();
        List<JobRecord> created = records.batch(batch -> {
            List<JobRecord> added = new ArrayList<>();
            for (CandidateItem c : applications) {
                try {
                    Optional<JobRecord> existing = matcher.match(c, batch.records());
                    if (existing.isPresent()) {
                        stats.applications.existing++;
                        continue;
                    }
                    added.add(batch.insert(newRecord(c)));
                    stats.applications.added++;
                } catch (ImportWriteException e) {
                    stats.applications.errors++;
                    stats.failures.add(failure(c, e));
                }
            }
            for (CandidateItem c : events) {
                ImportStats.Updates counter = c.type() == CandidateType.RESPONSE ? stats.responses : stats.statusUpdates;
                try {
                    Optional<JobRecord> target = matcher.match(c, batch.records());
                    if (target.isEmpty()) {
                        log.debug("No record for {} from {} ({})", c.jobTitle(), c.company(), c.type().wireName());
                        counter.skipped++;
                        continue;
                    }
                    boolean changed = c.type() == CandidateType.RESPONSE
                            ? applyResponse(batch, target.get(), c)
                            : applyStatusUpdate(batch, target.get(), c);
                    if (changed) counter.processed++;
                    else counter.skipped++;
                } catch (ImportWriteException e) {
                    counter.errors++;
                    stats.failures.add(failure(c, e));
                }
            }
            return added;
        });

        List<String> ids = new ArrayList<>();
        for (JobRecord r : created) {
            ids.add(r.id);
            if (r.enrichmentPending && worker.enqueueRecord(r.id, r.website)) {
                stats.enrichments.queued++;
            }
        }
        log.info("Import finished: {} added, {} existing, {} status updates, {} responses, {} failures",
                stats.applications.added, stats.applications.existing, stats.statusUpdates.processed,
                stats.responses.processed, stats.failures.size());
        ctx.message("Import finished");
        return new ImportResult(stats, ids);
    }

    private static JobRecord newRecord(CandidateItem c) {
        JobRecord r = new JobRecord();
        r.jobTitle = c.jobTitle();
        r.company = c.company();
        r.companyLocation = c.companyLocation();
        r.appliedAt = c.eventAt();
        r.response = ResponseStatus.NO_RESPONSE;
        r.externalJobId = c.externalId();
        r.website = c.website();
        r.source = SOURCE_EMAIL;
        r.enrichmentPending = c.website() != null && !c.website().isBlank();
        return r;
    }

    private static boolean applyStatusUpdate(JobRecordStore.Batch batch, JobRecord target, CandidateItem c) {
        JobRecord.StatusCheck check = new JobRecord.StatusCheck(c.eventAt(),
                "Application " + (c.statusNote() != null ? c.statusNote() : "updated") + " by " + c.company());
        if (target.statusChecks.contains(check)) return false;
        batch.modify(target.id, r -> r.statusChecks.add(check));
        return true;
    }

    /**
     * The response and its date move forward only; an older response is ignored.
     */
    private static boolean applyResponse(JobRecordStore.Batch batch, JobRecord target, CandidateItem c) {
        if (c.responseValue() == null) throw new ImportWriteException("response without a value");
        Instant at = c.eventAt();
        boolean newer = target.respondedAt == null || (at != null && !at.isBefore(target.respondedAt));
        if (!newer) return false;
        JobRecord.StatusCheck check = new JobRecord.StatusCheck(at, "Response: " + c.responseValue().label());
        boolean sameResponse = c.responseValue() == target.response && Objects.equals(at, target.respondedAt);
        boolean hasCheck = target.statusChecks.contains(check);
        if (sameResponse && hasCheck) return false;
        batch.modify(target.id, r -> {
            r.response = c.responseValue();
            r.respondedAt = at;
            if (!hasCheck) r.statusChecks.add(check);
        });
        return true;
    }

    private static ImportStats.Failure failure(CandidateItem c, RuntimeException e) {
        return new ImportStats.Failure(c.type().wireName(), c.company(), c.jobTitle(), e.getMessage());
    }
}
