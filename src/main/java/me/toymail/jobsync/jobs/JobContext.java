package me.toymail.jobsync.jobs;

import java.time.Instant;

/**
 * Handle a running task uses to report progress and observe cancellation.
 */
public final class JobContext {
    private final JobRunner.JobState state;

    JobContext(JobRunner.JobState state) {
        this.state = state;
    }

    /**
     * A context for work that runs on the caller's thread instead of the runner. Progress is
     * kept but nobody can cancel it.
     */
    public static JobContext detached(JobType type) {
        JobRunner.JobState state = new JobRunner.JobState("inline-" + type.wireName(), type, Instant.now());
        state.start(state.createdAt);
        return new JobContext(state);
    }

    public BackgroundJob snapshot() {
        return state.snapshot();
    }

    public String jobId() {
        return state.id;
    }

    /**
     * Progress never moves backwards; lower values only update the message.
     */
    public void updateProgress(int percent, String message) {
        state.progress(percent, message);
    }

    public void message(String message) {
        state.progress(-1, message);
    }

    public boolean isCancelRequested() {
        return state.cancelRequested();
    }

    public void checkpoint() {
        if (state.cancelRequested()) throw new JobCancelledException();
    }
}
