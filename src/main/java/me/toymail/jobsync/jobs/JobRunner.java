package me.toymail.jobsync.jobs;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.*;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs tasks in the background and keeps their state for polling. Terminal jobs are dropped
 * by a periodic sweep once the retention window has passed.
 */
public final class JobRunner implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(JobRunner.class);

    private final Map<String, JobState> jobs = new ConcurrentHashMap<>();
    private final ExecutorService executor;
    private final ScheduledExecutorService sweeper;
    private final Clock clock;
    private final Duration activeWindow;
    private final Duration retention;

    public JobRunner(Duration activeWindow, Duration retention, Duration sweepInterval) {
        this(Clock.systemUTC(), activeWindow, retention, sweepInterval);
    }

    public JobRunner(Clock clock, Duration activeWindow, Duration retention, Duration sweepInterval) {
        this.clock = clock;
        this.activeWindow = activeWindow;
        this.retention = retention;
        AtomicInteger n = new AtomicInteger();
        this.executor = Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "jobsync-job-" + n.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
        this.sweeper = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "jobsync-job-sweeper");
            t.setDaemon(true);
            return t;
        });
        long every = Math.max(1, sweepInterval.toMillis());
        sweeper.scheduleAtFixedRate(this::sweep, every, every, TimeUnit.MILLISECONDS);
    }

    /**
     * Queue {@code task} and return its id immediately.
     *
     * @throws RejectedExecutionException after {@link #close()}; no job is recorded
     */
    public String submit(JobType type, JobTask task) {
        JobState state = new JobState(UUID.randomUUID().toString(), type, clock.instant());
        jobs.put(state.id, state);
        log.debug("Queued {} job {}", type.wireName(), state.id);
        try {
            executor.execute(() -> execute(state, task));
        } catch (RejectedExecutionException e) {
            jobs.remove(state.id);
            throw e;
        }
        return state.id;
    }

    public Optional<BackgroundJob> getStatus(String jobId) {
        if (jobId == null) return Optional.empty();
        JobState state = jobs.get(jobId);
        return state == null ? Optional.empty() : Optional.of(state.snapshot());
    }

    public BackgroundJob require(String jobId) {
        return getStatus(jobId).orElseThrow(() -> new JobNotFoundException(jobId));
    }

    /**
     * Queued and running jobs, plus jobs that finished within the active window.
     */
    public List<BackgroundJob> listActive() {
        Instant cutoff = clock.instant().minus(activeWindow);
        List<BackgroundJob> out = new ArrayList<>();
        for (JobState state : jobs.values()) {
            BackgroundJob snap = state.snapshot();
            if (!snap.status().isTerminal() || (snap.endedAt() != null && !snap.endedAt().isBefore(cutoff))) {
                out.add(snap);
            }
        }
        out.sort(Comparator.comparing(BackgroundJob::createdAt));
        return out;
    }

    /**
     * A queued job fails right away; a running one fails at its next checkpoint.
     *
     * @return false when the job has already finished
     */
    public boolean cancel(String jobId) {
        JobState state = jobs.get(jobId);
        if (state == null) throw new JobNotFoundException(jobId);
        return state.requestCancel(clock.instant());
    }

    /**
     * Drop terminal jobs whose retention has expired.
     */
    void sweep() {
        Instant cutoff = clock.instant().minus(retention);
        int before = jobs.size();
        jobs.values().removeIf(s -> s.expiredBefore(cutoff));
        int removed = before - jobs.size();
        if (removed > 0) log.debug("Removed {} expired jobs", removed);
    }

    @Override
    public void close() {
        sweeper.shutdownNow();
        executor.shutdownNow();
    }

    private void execute(JobState state, JobTask task) {
        if (!state.start(clock.instant())) return;
        log.info("Started {} job {}", state.type.wireName(), state.id);
        try {
            Object result = task.run(new JobContext(state));
            state.complete(result, clock.instant());
            log.info("Completed {} job {}", state.type.wireName(), state.id);
        } catch (JobCancelledException e) {
            state.fail(e.getMessage(), clock.instant());
            log.info("Cancelled {} job {}", state.type.wireName(), state.id);
        } catch (Exception e) {
            String msg = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
            state.fail(msg, clock.instant());
            log.warn("{} job {} failed: {}", state.type.wireName(), state.id, msg);
            log.debug("Job failure", e);
        } catch (Error e) {
            state.fail("Internal error: " + e, clock.instant());
            throw e;
        }
    }

    static final class JobState {
        final String id;
        final JobType type;
        final Instant createdAt;
        private JobStatus status = JobStatus.QUEUED;
        private int progress;
        private String message = "Queued";
        private Object result;
        private String error;
        private Instant startedAt;
        private Instant endedAt;
        private volatile boolean cancelRequested;

        JobState(String id, JobType type, Instant createdAt) {
            this.id = id;
            this.type = type;
            this.createdAt = createdAt;
        }

        synchronized BackgroundJob snapshot() {
            return new BackgroundJob(id, type, status, progress, message, result, error,
                    createdAt, startedAt, endedAt, cancelRequested);
        }

        boolean cancelRequested() {
            return cancelRequested;
        }

        synchronized boolean start(Instant now) {
            if (status != JobStatus.QUEUED) return false;
            status = JobStatus.PROCESSING;
            startedAt = now;
            message = "Started";
            return true;
        }

        synchronized void progress(int percent, String msg) {
            if (status != JobStatus.PROCESSING) return;
            if (percent >= 0) progress = Math.max(progress, Math.min(100, percent));
            if (msg != null) message = msg;
        }

        synchronized void complete(Object value, Instant now) {
            if (status.isTerminal()) return;
            status = JobStatus.COMPLETED;
            progress = 100;
            message = "Completed";
            result = value;
            endedAt = now;
        }

        synchronized void fail(String err, Instant now) {
            if (status.isTerminal()) return;
            status = JobStatus.FAILED;
            message = "Failed";
            error = err;
            endedAt = now;
        }

        synchronized boolean requestCancel(Instant now) {
            if (status.isTerminal()) return false;
            cancelRequested = true;
            if (status == JobStatus.QUEUED) fail(JobCancelledException.MESSAGE, now);
            return true;
        }

        synchronized boolean expiredBefore(Instant cutoff) {
            return status.isTerminal() && endedAt != null && endedAt.isBefore(cutoff);
        }
    }
}
