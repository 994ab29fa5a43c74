package me.toymail.jobsync.jobs;

import java.time.Instant;

/**
 * Point-in-time view of a background job. {@code error} is set iff the job failed.
 */
public record BackgroundJob(
        String id,
        JobType type,
        JobStatus status,
        int progress,
        String message,
        Object result,
        String error,
        Instant createdAt,
        Instant startedAt,
        Instant endedAt,
        boolean cancelRequested
) {}
