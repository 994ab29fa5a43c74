package me.toymail.jobsync.commands;

import me.toymail.jobsync.jobs.BackgroundJob;
import me.toymail.jobsync.jobs.JobStatus;
import me.toymail.jobsync.service.EmailProcessingService;
import me.toymail.jobsync.service.EmailProcessingService.SearchRequest;
import me.toymail.jobsync.service.ImportStats;
import me.toymail.jobsync.service.ServiceContext;
import me.toymail.jobsync.service.SyncService.SyncResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

@Command(name = "sync", description = "Scan a mailbox and import new applications, status updates and responses",
        footer = {
            "",
            "Examples:",
            "  jobsync sync <credential-id>                      Import since the last sync",
            "  jobsync sync <credential-id> --full               Rescan the whole timeframe",
            "  jobsync sync <credential-id> --wait-enrichment    Stay until job postings are fetched",
            "",
            "Importing the same messages twice does not create duplicates."
        })
public final class SyncCmd implements Runnable {
    private static final Logger log = LoggerFactory.getLogger(SyncCmd.class);
    private final ServiceContext context;

    public SyncCmd(ServiceContext context) {
        this.context = context;
    }

    @Parameters(index = "0", paramLabel = "<credential-id>", description = "Mailbox to sync")
    String credentialId;

    @Option(names = "--full", description = "Ignore the last import and scan the whole timeframe")
    boolean full;

    @Option(names = "--wait-enrichment", description = "Wait until queued job postings have been fetched")
    boolean waitEnrichment;

    @Override
    public void run() {
        try {
            EmailProcessingService service = context.processing();
            JobPoller poller = new JobPoller(service, context.storeContext().config().jobs.pollIntervalMs);

            BackgroundJob job = poller.await(service.sync(new SearchRequest(credentialId, full)).jobId());
            if (job.status() == JobStatus.FAILED) {
                log.error("sync failed: {}", job.error());
                return;
            }
            SyncResult result = (SyncResult) job.result();
            ImportStats stats = result.stats();
            log.info("Scanned {} messages since {}", result.search().messagesScanned(), result.search().since());
            result.search().folders().skipped().forEach(f -> log.warn("Skipped folder {}: {}", f.folder(), f.error()));
            log.info("Applications: {} added, {} already tracked, {} failed",
                    stats.applications.added, stats.applications.existing, stats.applications.errors);
            log.info("Status updates: {} applied, {} skipped; responses: {} applied, {} skipped",
                    stats.statusUpdates.processed, stats.statusUpdates.skipped,
                    stats.responses.processed, stats.responses.skipped);
            stats.failures.forEach(f -> log.warn("Could not import {} {} at {}: {}",
                    f.type(), f.jobTitle(), f.company(), f.error()));
            log.info("{} job posting(s) waiting for enrichment", result.pendingEnrichments());

            if (waitEnrichment && result.pendingEnrichments() > 0) {
                BackgroundJob enrich = poller.await(service.runEnrichment().jobId());
                if (enrich.status() == JobStatus.FAILED) {
                    log.error("enrichment failed: {}", enrich.error());
                } else {
                    log.info("Enrichment finished: {}", enrich.result());
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.error("sync interrupted");
        } catch (Exception e) {
            log.error("sync failed: {} - {}", e.getClass().getSimpleName(), e.getMessage());
        }
    }
}
