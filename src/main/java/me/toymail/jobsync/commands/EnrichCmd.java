package me.toymail.jobsync.commands;

import me.toymail.jobsync.enrich.EnrichmentStatus;
import me.toymail.jobsync.jobs.BackgroundJob;
import me.toymail.jobsync.jobs.JobStatus;
import me.toymail.jobsync.service.EmailProcessingService;
import me.toymail.jobsync.service.EnrichmentService.EnrichmentRunResult;
import me.toymail.jobsync.service.ServiceContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;

@Command(name = "enrich", description = "Fetch job postings and fill in description, salary and job type",
        subcommands = {EnrichCmd.Run.class, EnrichCmd.Url.class, EnrichCmd.Status.class},
        footer = {
            "",
            "Commands:",
            "  jobsync enrich run            Enrich every imported application that has a link",
            "  jobsync enrich url <url>      Enrich the application with this posting URL",
            "  jobsync enrich status         Show the enrichment queue",
            "",
            "Requests are paced (LINKEDIN_REQUESTS_PER_MINUTE, LINKEDIN_STANDARD_DELAY) and pause",
            "after repeated failures (LINKEDIN_MAX_CONSECUTIVE_FAILURES, LINKEDIN_BACKOFF_DELAY)."
        })
public class EnrichCmd implements Runnable {
    private static final Logger log = LoggerFactory.getLogger(EnrichCmd.class);
    private final ServiceContext context;

    public EnrichCmd(ServiceContext context) {
        this.context = context;
    }

    ServiceContext context() {
        return context;
    }

    @Override
    public void run() {
        CommandLine.usage(this, System.out);
    }

    static void print(EnrichmentStatus s) {
        log.info("processing={} | queue={} | processed={} | failed={} | dropped={} | consecutiveFailures={} | backingOff={}",
                s.isProcessing(), s.queueSize(), s.processed(), s.failed(), s.dropped(),
                s.consecutiveFailures(), s.backingOff());
    }

    @Command(name = "run", description = "Enrich every application that has a link and no details yet")
    public static class Run implements Runnable {
        @ParentCommand
        private EnrichCmd parent;

        @Override
        public void run() {
            try {
                ServiceContext context = parent.context();
                JobPoller poller = new JobPoller(context.processing(), context.storeContext().config().jobs.pollIntervalMs);
                BackgroundJob job = poller.await(context.processing().runEnrichment().jobId());
                if (job.status() == JobStatus.FAILED) {
                    log.error("enrichment failed: {}", job.error());
                    return;
                }
                EnrichmentRunResult result = (EnrichmentRunResult) job.result();
                log.info("{} record(s): {} enriched, {} not enriched", result.total(), result.enriched(), result.notEnriched());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.error("enrichment interrupted");
            } catch (Exception e) {
                log.error("enrichment failed: {}", e.getMessage());
            }
        }
    }

    @Command(name = "url", description = "Queue one posting URL",
            footer = {
                "",
                "Example:",
                "  jobsync enrich url https://www.linkedin.com/jobs/view/3912345678/",
                "",
                "The fetched posting is matched to an application by its link or LinkedIn job id."
            })
    public static class Url implements Runnable {
        @ParentCommand
        private EnrichCmd parent;

        @Parameters(index = "0", paramLabel = "<url>", description = "Job posting URL")
        String url;

        @Option(names = "--no-wait", description = "Return right after queueing")
        boolean noWait;

        @Override
        public void run() {
            try {
                EmailProcessingService service = parent.context().processing();
                if (!service.enrichUrl(url).queued()) {
                    log.info("Already queued: {}", url);
                } else {
                    log.info("Queued {}", url);
                }
                if (noWait) return;
                long poll = parent.context().storeContext().config().jobs.pollIntervalMs;
                EnrichmentStatus s = service.enrichmentStatus();
                while (s.isProcessing() || s.queueSize() > 0) {
                    Thread.sleep(poll);
                    s = service.enrichmentStatus();
                }
                print(s);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.error("enrichment interrupted");
            } catch (Exception e) {
                log.error("enrichment failed: {}", e.getMessage());
            }
        }
    }

    @Command(name = "status", description = "Show the enrichment queue")
    public static class Status implements Runnable {
        @ParentCommand
        private EnrichCmd parent;

        @Override
        public void run() {
            print(parent.context().processing().enrichmentStatus());
        }
    }
}
