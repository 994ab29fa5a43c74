package me.toymail.jobsync.commands;

import me.toymail.jobsync.jobs.BackgroundJob;
import me.toymail.jobsync.service.EmailProcessingService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Polls a background job until it reaches a terminal state, logging each progress change.
 */
final class JobPoller {
    private static final Logger log = LoggerFactory.getLogger(JobPoller.class);

    private final EmailProcessingService service;
    private final long pollIntervalMs;

    JobPoller(EmailProcessingService service, long pollIntervalMs) {
        this.service = service;
        this.pollIntervalMs = pollIntervalMs;
    }

    BackgroundJob await(String jobId) throws InterruptedException {
        int lastProgress = -1;
        String lastMessage = null;
        while (true) {
            BackgroundJob job = service.getJob(jobId);
            if (job.progress() != lastProgress || !Objects.equals(job.message(), lastMessage)) {
                log.info("[{}%] {}", job.progress(), job.message());
                lastProgress = job.progress();
                lastMessage = job.message();
            }
            if (job.status().isTerminal()) return job;
            Thread.sleep(pollIntervalMs);
        }
    }
}
