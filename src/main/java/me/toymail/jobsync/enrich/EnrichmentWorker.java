package me.toymail.jobsync.enrich;

import me.toymail.jobsync.store.EngineConfig;
import me.toymail.jobsync.store.JobRecord;
import me.toymail.jobsync.store.JobRecordStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.*;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Single consumer that enriches job records from their posting pages.
 *
 * <p>Before each request the worker waits until any backoff has ended, the standard delay has
 * passed since the previous request started, and the sliding one-minute window has room. A
 * failed item goes back to the tail of the queue until it has used its attempts. After
 * {@code maxConsecutiveFailures} failures in a row nothing is consumed for {@code backoffDelay},
 * then the failure counter starts again from zero.
 *
 * <p>The queue lives in memory only. {@link #start()} refills it from records still flagged
 * {@code enrichmentPending}.
 */
public final class EnrichmentWorker implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(EnrichmentWorker.class);

    private final JobRecordStore records;
    private final PageFetcher fetcher;
    private final JobPageParser parser;
    private final EngineConfig.Enrichment cfg;
    private final Clock clock;
    private final SlidingWindowRateLimiter limiter;

    private final ReentrantLock lock = new ReentrantLock();
    private final Condition changed = lock.newCondition();
    private final Deque<EnrichmentQueueItem> queue = new ArrayDeque<>();
    // queued or in flight
    private final Set<String> pendingKeys = new HashSet<>();

    private Instant lastRequestStart;
    private Instant backoffUntil;
    private int consecutiveFailures;
    private long processed;
    private long failed;
    private long dropped;
    private EnrichmentQueueItem inFlight;
    private boolean running;
    private Thread thread;

    public EnrichmentWorker(JobRecordStore records, PageFetcher fetcher, JobPageParser parser,
                            EngineConfig.Enrichment cfg) {
        this(records, fetcher, parser, cfg, Clock.systemUTC());
    }

    public EnrichmentWorker(JobRecordStore records, PageFetcher fetcher, JobPageParser parser,
                            EngineConfig.Enrichment cfg, Clock clock) {
        this.records = records;
        this.fetcher = fetcher;
        this.parser = parser;
        this.cfg = cfg;
        this.clock = clock;
        this.limiter = new SlidingWindowRateLimiter(Math.max(1, cfg.requestsPerMinute), Duration.ofMinutes(1));
    }

    /**
     * Queue pending records left over from a previous run and start the consumer thread.
     */
    public void start() throws IOException {
        lock.lock();
        try {
            if (running) return;
            running = true;
        } finally {
            lock.unlock();
        }
        int restored = 0;
        for (JobRecord r : records.findPendingEnrichment()) {
            if (enqueueRecord(r.id, r.website)) restored++;
        }
        if (restored > 0) log.info("Re-queued {} pending enrichments", restored);
        thread = new Thread(this::loop, "jobsync-enrichment");
        thread.setDaemon(true);
        thread.start();
    }

    @Override
    public void close() {
        lock.lock();
        try {
            running = false;
            changed.signalAll();
        } finally {
            lock.unlock();
        }
        if (thread != null) {
            thread.interrupt();
            try {
                thread.join(TimeUnit.SECONDS.toMillis(5));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
    }

    /**
     * @return false if the record is already queued or in flight, or has no URL
     */
    public boolean enqueueRecord(String recordId, String url) {
        if (recordId == null || url == null || url.isBlank()) return false;
        return offer(new EnrichmentQueueItem(recordId, url.trim(), clock.instant(), 0));
    }

    /**
     * Queue a URL that is not tied to a record yet. On success it is matched to a record by
     * website or LinkedIn job id.
     */
    public boolean enqueueUrl(String url) {
        if (url == null || url.isBlank()) return false;
        return offer(new EnrichmentQueueItem(null, url.trim(), clock.instant(), 0));
    }

    /**
     * How many of {@code recordIds} are still queued or in flight.
     */
    public int pendingCount(Collection<String> recordIds) {
        lock.lock();
        try {
            int n = 0;
            for (String id : recordIds) {
                if (pendingKeys.contains(id)) n++;
            }
            return n;
        } finally {
            lock.unlock();
        }
    }

    public EnrichmentStatus status() {
        lock.lock();
        try {
            Instant now = clock.instant();
            maybeEndBackoff(now);
            return new EnrichmentStatus(inFlight != null, queue.size(), processed, failed, dropped,
                    consecutiveFailures, backoffUntil != null);
        } finally {
            lock.unlock();
        }
    }

    private boolean offer(EnrichmentQueueItem item) {
        lock.lock();
        try {
            if (!pendingKeys.add(item.key())) return false;
            queue.addLast(item);
            changed.signalAll();
            log.debug("Queued {} for enrichment (queue size {})", item.url(), queue.size());
            return true;
        } finally {
            lock.unlock();
        }
    }

    private void loop() {
        log.debug("Enrichment worker started");
        try {
            while (true) {
                EnrichmentQueueItem item = take();
                if (item == null) break;
                Outcome outcome = process(item);
                finish(item, outcome);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        log.debug("Enrichment worker stopped");
    }

    /**
     * Block until pacing allows the next request, then pop the head of the queue.
     */
    private EnrichmentQueueItem take() throws InterruptedException {
        lock.lock();
        try {
            while (running) {
                Instant now = clock.instant();
                maybeEndBackoff(now);
                if (queue.isEmpty()) {
                    changed.await();
                    continue;
                }
                long wait = waitMillis(now);
                if (wait > 0) {
                    changed.await(wait, TimeUnit.MILLISECONDS);
                    continue;
                }
                EnrichmentQueueItem item = queue.pollFirst();
                inFlight = item;
                lastRequestStart = now;
                limiter.record(now);
                return item;
            }
            return null;
        } finally {
            lock.unlock();
        }
    }

    private long waitMillis(Instant now) {
        long wait = 0;
        if (backoffUntil != null) {
            wait = Math.max(wait, millisUntil(now, backoffUntil));
        }
        if (lastRequestStart != null) {
            wait = Math.max(wait, millisUntil(now, lastRequestStart.plus(cfg.standardDelay())));
        }
        return Math.max(wait, limiter.delayUntilPermit(now));
    }

    // rounded up, so a wait never ends before the deadline
    private static long millisUntil(Instant now, Instant deadline) {
        if (!now.isBefore(deadline)) return 0;
        Duration d = Duration.between(now, deadline);
        return d.toMillis() + (d.toNanosPart() % 1_000_000 > 0 ? 1 : 0);
    }

    private void maybeEndBackoff(Instant now) {
        if (backoffUntil != null && !now.isBefore(backoffUntil)) {
            backoffUntil = null;
            consecutiveFailures = 0;
            log.info("Enrichment backoff over, resuming");
        }
    }

    private enum Outcome { SUCCESS, FETCH_FAILED, WRITE_FAILED }

    private Outcome process(EnrichmentQueueItem item) {
        EnrichmentData data;
        try {
            PageFetcher.FetchedPage page = fetcher.fetch(item.url());
            data = parser.parse(item.url(), page.body());
        } catch (EnrichmentFetchException e) {
            log.warn("Enrichment of {} failed (attempt {}): {}", item.url(), item.attempts() + 1, e.getMessage());
            return Outcome.FETCH_FAILED;
        } catch (RuntimeException e) {
            log.warn("Enrichment of {} failed (attempt {}): {}", item.url(), item.attempts() + 1, e.toString());
            return Outcome.FETCH_FAILED;
        }
        try {
            Optional<String> recordId = item.jobRecordId() != null
                    ? Optional.of(item.jobRecordId())
                    : matchRecord(item.url(), data);
            if (recordId.isEmpty()) {
                log.info("Fetched {} but no job record matches it", item.url());
                return Outcome.SUCCESS;
            }
            Instant now = clock.instant();
            Optional<JobRecord> updated = records.update(recordId.get(), r -> apply(r, data, now));
            if (updated.isEmpty()) {
                log.info("Job record {} disappeared before enrichment finished", recordId.get());
            } else {
                log.info("Enriched {} at {}", updated.get().jobTitle, updated.get().company);
            }
            return Outcome.SUCCESS;
        } catch (IOException e) {
            log.error("Cannot save enrichment for {}: {}", item.url(), e.getMessage());
            return Outcome.WRITE_FAILED;
        }
    }

    private void finish(EnrichmentQueueItem item, Outcome outcome) {
        boolean drop = false;
        lock.lock();
        try {
            inFlight = null;
            switch (outcome) {
                case SUCCESS -> {
                    processed++;
                    consecutiveFailures = 0;
                    pendingKeys.remove(item.key());
                }
                case WRITE_FAILED -> {
                    failed++;
                    dropped++;
                    pendingKeys.remove(item.key());
                }
                case FETCH_FAILED -> {
                    failed++;
                    consecutiveFailures++;
                    EnrichmentQueueItem next = item.nextAttempt();
                    if (next.attempts() < cfg.maxAttemptsPerItem) {
                        queue.addLast(next);
                    } else {
                        dropped++;
                        drop = true;
                        pendingKeys.remove(item.key());
                        log.warn("Dropping {} after {} attempts", item.url(), next.attempts());
                    }
                    if (consecutiveFailures >= cfg.maxConsecutiveFailures && backoffUntil == null) {
                        backoffUntil = clock.instant().plus(cfg.backoffDelay());
                        log.warn("{} consecutive enrichment failures, backing off for {} s",
                                consecutiveFailures, cfg.backoffDelay().toSeconds());
                    }
                }
            }
            changed.signalAll();
        } finally {
            lock.unlock();
        }
        if (drop && item.jobRecordId() != null) clearPending(item.jobRecordId());
    }

    private void clearPending(String recordId) {
        try {
            records.update(recordId, r -> r.enrichmentPending = false);
        } catch (IOException e) {
            log.warn("Cannot clear pending flag on {}: {}", recordId, e.getMessage());
        }
    }

    private Optional<String> matchRecord(String url, EnrichmentData data) throws IOException {
        String jobId = data.externalJobId() != null ? data.externalJobId() : LinkedInUrls.jobId(url).orElse(null);
        for (JobRecord r : records.list()) {
            if (url.equalsIgnoreCase(r.website)) return Optional.of(r.id);
            if (jobId != null && jobId.equals(r.externalJobId)) return Optional.of(r.id);
        }
        return Optional.empty();
    }

    static void apply(JobRecord r, EnrichmentData data, Instant now) {
        if (data.description() != null) r.description = data.description();
        if (data.employmentType() != null) r.employmentType = data.employmentType();
        if (data.locationType() != null) r.locationType = data.locationType();
        if (data.wagesMin() != null) {
            r.wagesMin = data.wagesMin();
            r.wagesMax = data.wagesMax();
            r.wageType = data.wageType();
        }
        if (r.externalJobId == null && data.externalJobId() != null) r.externalJobId = data.externalJobId();
        if (r.companyLocation == null && data.location() != null) r.companyLocation = data.location();
        r.enrichmentPending = false;
        r.enrichedAt = now;
    }
}
