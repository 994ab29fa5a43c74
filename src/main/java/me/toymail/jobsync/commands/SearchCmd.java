package me.toymail.jobsync.commands;

import me.toymail.jobsync.classify.CandidateItem;
import me.toymail.jobsync.jobs.BackgroundJob;
import me.toymail.jobsync.jobs.JobStatus;
import me.toymail.jobsync.service.EmailProcessingService;
import me.toymail.jobsync.service.EmailProcessingService.ImportRequest;
import me.toymail.jobsync.service.EmailProcessingService.SearchRequest;
import me.toymail.jobsync.service.ImportStats;
import me.toymail.jobsync.service.MailboxSearchService.SearchResult;
import me.toymail.jobsync.service.ServiceContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.util.List;

@Command(name = "search", description = "Scan a mailbox for applications and responses without importing",
        footer = {
            "",
            "Examples:",
            "  jobsync search <credential-id>            Scan since the last import",
            "  jobsync search <credential-id> --full     Scan the whole timeframe",
            "  jobsync search <credential-id> --import   Scan, then import what is not tracked yet",
            "",
            "Output format:",
            "  [new|exists] <type> | <date> | <company> | <title> | <detail>"
        })
public final class SearchCmd implements Runnable {
    private static final Logger log = LoggerFactory.getLogger(SearchCmd.class);
    private final ServiceContext context;

    public SearchCmd(ServiceContext context) {
        this.context = context;
    }

    @Parameters(index = "0", paramLabel = "<credential-id>", description = "Mailbox to scan")
    String credentialId;

    @Option(names = "--full", description = "Ignore the last import and scan the whole timeframe")
    boolean full;

    @Option(names = "--import", description = "Import the found items that are not tracked yet")
    boolean importNew;

    @Override
    public void run() {
        try {
            EmailProcessingService service = context.processing();
            JobPoller poller = new JobPoller(service, context.storeContext().config().jobs.pollIntervalMs);

            String jobId = service.search(new SearchRequest(credentialId, full)).jobId();
            BackgroundJob job = poller.await(jobId);
            if (job.status() == JobStatus.FAILED) {
                log.error("search failed: {}", job.error());
                return;
            }
            SearchResult result = (SearchResult) job.result();
            var summary = result.summary();
            log.info("Scanned {} messages since {} ({} not job related, {} unreadable)",
                    summary.messagesScanned(), summary.since(), summary.messagesDiscarded(), summary.messagesUnreadable());
            log.info("Folders searched: {}", summary.folders().processed());
            summary.folders().skipped().forEach(f -> log.warn("Skipped folder {}: {}", f.folder(), f.error()));
            log.info("Applications: {} ({} new, {} existing), status updates: {}, responses: {}",
                    summary.applications().total(), summary.applications().fresh(), summary.applications().existing(),
                    summary.statusUpdates(), summary.responses());
            result.all().forEach(SearchCmd::print);

            if (importNew) {
                List<CandidateItem> fresh = result.applications().stream().filter(c -> !c.exists()).toList();
                String importId = service.importItems(
                        new ImportRequest(fresh, result.statusUpdates(), result.responses())).jobId();
                BackgroundJob imported = poller.await(importId);
                if (imported.status() == JobStatus.FAILED) {
                    log.error("import failed: {}", imported.error());
                    return;
                }
                ImportStats stats = (ImportStats) imported.result();
                log.info("Imported {} applications, {} status updates, {} responses, {} queued for enrichment",
                        stats.applications.added, stats.statusUpdates.processed, stats.responses.processed,
                        stats.enrichments.queued);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.error("search interrupted");
        } catch (Exception e) {
            log.error("search failed: {} - {}", e.getClass().getSimpleName(), e.getMessage());
        }
    }

    static void print(CandidateItem c) {
        String detail = switch (c.type()) {
            case APPLICATION -> c.companyLocation() != null ? c.companyLocation() : "";
            case STATUS_UPDATE -> c.statusNote() != null ? c.statusNote() : "";
            case RESPONSE -> c.responseValue() != null ? c.responseValue().label() : "";
        };
        log.info("[{}] {} | {} | {} | {} | {}", c.exists() ? "exists" : "new", c.type().wireName(), c.eventAt(),
                c.company(), c.jobTitle(), detail);
    }
}
