package me.toymail.jobsync.service;

import me.toymail.jobsync.MailboxConnectionException;
import me.toymail.jobsync.classify.CandidateItem;
import me.toymail.jobsync.enrich.EnrichmentStatus;
import me.toymail.jobsync.jobs.BackgroundJob;
import me.toymail.jobsync.jobs.JobRunner;
import me.toymail.jobsync.jobs.JobType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * Entry point for callers: credential management, and the long running operations as
 * background jobs that are polled by id.
 */
public class EmailProcessingService {
    private static final Logger log = LoggerFactory.getLogger(EmailProcessingService.class);

    private final CredentialService credentials;
    private final MailboxSearchService searchService;
    private final ImportService importService;
    private final SyncService syncService;
    private final EnrichmentService enrichmentService;
    private final JobRunner runner;

    public EmailProcessingService(CredentialService credentials, MailboxSearchService searchService,
                                  ImportService importService, SyncService syncService,
                                  EnrichmentService enrichmentService, JobRunner runner) {
        this.credentials = credentials;
        this.searchService = searchService;
        this.importService = importService;
        this.syncService = syncService;
        this.enrichmentService = enrichmentService;
        this.runner = runner;
    }

    public record SearchRequest(String credentialId, boolean ignorePreviousImport) {}

    public record ImportRequest(List<CandidateItem> applications, List<CandidateItem> statusUpdates,
                                List<CandidateItem> responses) {
        List<CandidateItem> all() {
            List<CandidateItem> out = new ArrayList<>();
            if (applications != null) out.addAll(applications);
            if (statusUpdates != null) out.addAll(statusUpdates);
            if (responses != null) out.addAll(responses);
            return out;
        }
    }

    public record JobStarted(String jobId) {}

    public record CancelResult(boolean cancelled) {}

    public record EnqueueResult(boolean queued) {}

    public record FoldersResult(List<String> folders) {}

    // credentials

    public CredentialService.CredentialView createCredential(CredentialRequest request) throws IOException {
        return credentials.create(request);
    }

    public List<CredentialService.CredentialView> listCredentials() throws IOException {
        return credentials.list();
    }

    public CredentialService.CredentialView updateCredential(String id, CredentialRequest request) throws IOException {
        return credentials.update(id, request);
    }

    public boolean deleteCredential(String id) throws IOException {
        return credentials.delete(id);
    }

    public FoldersResult getFolders(String credentialId) throws IOException, MailboxConnectionException {
        return new FoldersResult(credentials.folders(credentialId));
    }

    // jobs

    /**
     * Scan the mailbox and report what would be imported. Nothing is written.
     */
    public JobStarted search(SearchRequest request) throws IOException {
        searchService.requireCredential(request.credentialId());
        String id = runner.submit(JobType.EMAIL_SEARCH,
                ctx -> searchService.search(request.credentialId(), request.ignorePreviousImport(), ctx));
        log.info("Started search job {} for credential {}", id, request.credentialId());
        return new JobStarted(id);
    }

    public JobStarted sync(SearchRequest request) throws IOException {
        searchService.requireCredential(request.credentialId());
        String id = runner.submit(JobType.EMAIL_SYNC,
                ctx -> syncService.sync(request.credentialId(), request.ignorePreviousImport(), ctx));
        log.info("Started sync job {} for credential {}", id, request.credentialId());
        return new JobStarted(id);
    }

    /**
     * Import candidates picked from an earlier search result.
     */
    public JobStarted importItems(ImportRequest request) {
        List<CandidateItem> items = request.all();
        String id = runner.submit(JobType.EMAIL_IMPORT, ctx -> {
            ctx.updateProgress(5, "Importing " + items.size() + " items");
            return importService.importCandidates(items, ctx).stats();
        });
        log.info("Started import job {} for {} items", id, items.size());
        return new JobStarted(id);
    }

    public BackgroundJob getJob(String jobId) {
        return runner.require(jobId);
    }

    public List<BackgroundJob> activeJobs() {
        return runner.listActive();
    }

    public CancelResult cancelJob(String jobId) {
        return new CancelResult(runner.cancel(jobId));
    }

    // enrichment

    public JobStarted runEnrichment() {
        String id = runner.submit(JobType.JOB_ENRICHMENT, enrichmentService::runPending);
        log.info("Started enrichment job {}", id);
        return new JobStarted(id);
    }

    public EnqueueResult enrichUrl(String url) {
        if (url == null || url.isBlank()) throw new IllegalArgumentException("URL is required");
        return new EnqueueResult(enrichmentService.enqueueUrl(url));
    }

    public EnrichmentStatus enrichmentStatus() {
        return enrichmentService.status();
    }
}
