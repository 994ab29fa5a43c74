package me.toymail.jobsync.service;

import me.toymail.jobsync.ImapClient;
import me.toymail.jobsync.classify.HeuristicMessageClassifier;
import me.toymail.jobsync.classify.MessageClassifier;
import me.toymail.jobsync.enrich.EnrichmentWorker;
import me.toymail.jobsync.enrich.JobPageParser;
import me.toymail.jobsync.enrich.JsoupPageFetcher;
import me.toymail.jobsync.enrich.PageFetcher;
import me.toymail.jobsync.jobs.JobRunner;
import me.toymail.jobsync.store.EngineConfig;
import me.toymail.jobsync.store.StoreContext;

import java.io.IOException;
import java.time.Clock;
import java.time.Duration;

/**
 * Container for all service instances. Owns the job runner and the enrichment worker:
 * {@link #start()} starts the worker, {@link #close()} stops both.
 */
public final class ServiceContext implements AutoCloseable {
    private final StoreContext storeContext;
    private final JobRunner jobRunner;
    private final EnrichmentWorker enrichmentWorker;

    private final CredentialService credentialService;
    private final MailboxSearchService searchService;
    private final ImportService importService;
    private final SyncService syncService;
    private final EnrichmentService enrichmentService;
    private final EmailProcessingService processingService;

    private ServiceContext(StoreContext storeContext, MailboxConnector connector, PageFetcher fetcher,
                           MessageClassifier classifier, Clock clock) {
        this.storeContext = storeContext;
        EngineConfig cfg = storeContext.config();
        this.jobRunner = new JobRunner(clock, cfg.jobs.activeWindow(), cfg.jobs.retention(),
                Duration.ofSeconds(cfg.jobs.sweepIntervalSeconds));
        this.enrichmentWorker = new EnrichmentWorker(storeContext.jobs(), fetcher, new JobPageParser(),
                cfg.enrichment, clock);
        this.importService = new ImportService(storeContext.jobs(), new CandidateMatcher(cfg.dedup.window()),
                enrichmentWorker);
        this.searchService = new MailboxSearchService(storeContext, connector, classifier, importService, clock);
        this.syncService = new SyncService(storeContext, searchService, importService, enrichmentWorker, clock);
        this.enrichmentService = new EnrichmentService(storeContext.jobs(), enrichmentWorker,
                Duration.ofMillis(cfg.jobs.pollIntervalMs));
        this.credentialService = new CredentialService(storeContext, searchService);
        this.processingService = new EmailProcessingService(credentialService, searchService, importService,
                syncService, enrichmentService, jobRunner);
    }

    /**
     * Create a new ServiceContext over the default data home, talking to real mail servers
     * and job sites.
     */
    public static ServiceContext create() throws IOException {
        StoreContext storeContext = StoreContext.initialize();
        return new ServiceContext(storeContext, ImapClient::connect,
                new JsoupPageFetcher(storeContext.config().enrichment), new HeuristicMessageClassifier(),
                Clock.systemUTC());
    }

    /**
     * Create a ServiceContext with replaceable network edges.
     */
    public static ServiceContext create(StoreContext storeContext, MailboxConnector connector, PageFetcher fetcher,
                                        MessageClassifier classifier, Clock clock) {
        return new ServiceContext(storeContext, connector, fetcher, classifier, clock);
    }

    public ServiceContext start() throws IOException {
        enrichmentWorker.start();
        return this;
    }

    @Override
    public void close() {
        enrichmentWorker.close();
        jobRunner.close();
    }

    public StoreContext storeContext() {
        return storeContext;
    }

    public EmailProcessingService processing() {
        return processingService;
    }

    public CredentialService credentials() {
        return credentialService;
    }

    public MailboxSearchService search() {
        return searchService;
    }

    public ImportService imports() {
        return importService;
    }

    public SyncService sync() {
        return syncService;
    }

    public EnrichmentService enrichment() {
        return enrichmentService;
    }

    public JobRunner jobs() {
        return jobRunner;
    }

    public EnrichmentWorker enrichmentWorker() {
        return enrichmentWorker;
    }
}
