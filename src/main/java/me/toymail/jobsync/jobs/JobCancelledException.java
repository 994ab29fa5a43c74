package me.toymail.jobsync.jobs;

/**
 * Thrown from a checkpoint once cancellation was requested.
 */
public class JobCancelledException extends RuntimeException {
    public static final String MESSAGE = "Cancelled by user";

    public JobCancelledException() {
        super(MESSAGE);
    }
}
