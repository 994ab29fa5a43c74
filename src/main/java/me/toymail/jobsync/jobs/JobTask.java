package me.toymail.jobsync.jobs;

/**
 * Body of a background job. The returned value becomes the job result.
 */
@FunctionalInterface
public interface JobTask {
    Object run(JobContext ctx) throws Exception;
}
