package me.toymail.jobsync.service;

import com.fasterxml.jackson.annotation.JsonProperty;
import me.toymail.jobsync.ImapClient;
import me.toymail.jobsync.ImapClient.FolderFetchError;
import me.toymail.jobsync.ImapClient.RawMessage;
import me.toymail.jobsync.MailboxConnectionException;
import me.toymail.jobsync.classify.CandidateItem;
import me.toymail.jobsync.classify.MessageClassifier;
import me.toymail.jobsync.jobs.JobContext;
import me.toymail.jobsync.store.EmailCredential;
import me.toymail.jobsync.store.EngineConfig;
import me.toymail.jobsync.store.StoreContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.*;
import java.util.stream.Stream;

/**
 * Scans a mailbox for job related messages and classifies them. Nothing is written.
 */
public class MailboxSearchService {
    private static final Logger log = LoggerFactory.getLogger(MailboxSearchService.class);

    private static final int CHECKPOINT_EVERY = 25;

    private final StoreContext context;
    private final MailboxConnector connector;
    private final MessageClassifier classifier;
    private final ImportService importService;
    private final Clock clock;

    public MailboxSearchService(StoreContext context, MailboxConnector connector, MessageClassifier classifier,
                                ImportService importService, Clock clock) {
        this.context = context;
        this.connector = connector;
        this.classifier = classifier;
        this.importService = importService;
        this.clock = clock;
    }

    public record ApplicationCounts(int total, @JsonProperty("new") int fresh, int existing) {}

    public record FolderSummary(List<String> processed, List<FolderFetchError> skipped) {}

    public record SearchSummary(Instant since, int messagesScanned, int messagesDiscarded, int messagesUnreadable,
                                FolderSummary folders, ApplicationCounts applications,
                                int statusUpdates, int responses) {}

    public record SearchResult(
            List<CandidateItem> applications,
            List<CandidateItem> statusUpdates,
            List<CandidateItem> responses,
            SearchSummary summary
    ) {
        public List<CandidateItem> all() {
            List<CandidateItem> out = new ArrayList<>(applications);
            out.addAll(statusUpdates);
            out.addAll(responses);
            return out;
        }
    }

    /**
     * Start of the scan: the timeframe start, or the last import if that is later and
     * {@code ignorePreviousImport} is false.
     */
    public static Instant since(EmailCredential c, boolean ignorePreviousImport, Instant now) {
        Instant windowStart = now.minus(Duration.ofDays(c.searchTimeframeDays));
        if (ignorePreviousImport || c.lastImportAt == null) return windowStart;
        return c.lastImportAt.isAfter(windowStart) ? c.lastImportAt : windowStart;
    }

    public EmailCredential requireCredential(String credentialId) throws IOException {
        return context.credentials().get(credentialId)
                .orElseThrow(() -> new IllegalArgumentException("Credential not found: " + credentialId));
    }

    /**
     * Open a session for the account, using the stored password.
     */
    public ImapClient open(EmailCredential c) throws MailboxConnectionException {
        String password = context.passwordResolver().resolve(null, c);
        EngineConfig.Imap imap = context.config().imap;
        return connector.connect(new ImapClient.ImapConfig(c.host, c.port, c.useTLS, c.rejectUnauthorized,
                c.address, password, imap.connectionTimeoutMs, imap.readTimeoutMs, imap.writeTimeoutMs,
                imap.fetchBatchSize));
    }

    public SearchResult search(String credentialId, boolean ignorePreviousImport, JobContext ctx)
            throws IOException, MailboxConnectionException {
        EmailCredential c = requireCredential(credentialId);
        Instant since = since(c, ignorePreviousImport, clock.instant());
        List<String> folders = c.searchFolders != null && !c.searchFolders.isEmpty()
                ? c.searchFolders : List.of("INBOX");

        ctx.updateProgress(1, "Connecting to " + c.host);
        List<CandidateItem> found = new ArrayList<>();
        List<String> processed = new ArrayList<>();
        List<FolderFetchError> skipped = new ArrayList<>();
        int[] counts = new int[3]; // scanned, discarded, unreadable

        ImapClient.SearchListener listener = new ImapClient.SearchListener() {
            @Override
            public void folderStarted(String folder, int index, int total) {
                ctx.checkpoint();
                ctx.updateProgress(5 + (70 * index) / Math.max(1, total),
                        "Searching " + folder + " (" + (index + 1) + "/" + total + ")");
            }

            @Override
            public void folderCompleted(String folder, int matched) {
                processed.add(folder);
            }

            @Override
            public void folderFailed(FolderFetchError error) {
                skipped.add(error);
            }

            @Override
            public void messageSkipped(String folder, String reason) {
                counts[2]++;
            }
        };

        log.info("Searching {} folder(s) of {} since {}", folders.size(), c.address, since);
        try (ImapClient imap = open(c);
             Stream<RawMessage> messages = imap.search(Date.from(since), folders, listener)) {
            Iterator<RawMessage> it = messages.iterator();
            while (it.hasNext()) {
                RawMessage m = it.next();
                counts[0]++;
                Optional<CandidateItem> item = classifier.classify(m);
                if (item.isPresent()) found.add(item.get());
                else counts[1]++;
                if (counts[0] % CHECKPOINT_EVERY == 0) ctx.checkpoint();
            }
        }

        ctx.checkpoint();
        ctx.updateProgress(80, "Matching " + found.size() + " items against existing records");
        List<CandidateItem> resolved = importService.resolve(found);

        List<CandidateItem> applications = new ArrayList<>();
        List<CandidateItem> statusUpdates = new ArrayList<>();
        List<CandidateItem> responses = new ArrayList<>();
        for (CandidateItem item : resolved) {
            switch (item.type()) {
                case APPLICATION -> applications.add(item);
                case STATUS_UPDATE -> statusUpdates.add(item);
                case RESPONSE -> responses.add(item);
            }
        }
        int existing = (int) applications.stream().filter(CandidateItem::exists).count();
        SearchSummary summary = new SearchSummary(since, counts[0], counts[1], counts[2],
                new FolderSummary(processed, skipped),
                new ApplicationCounts(applications.size(), applications.size() - existing, existing),
                statusUpdates.size(), responses.size());
        log.info("Search of {} done: {} messages, {} applications ({} new), {} status updates, {} responses",
                c.address, counts[0], applications.size(), applications.size() - existing,
                statusUpdates.size(), responses.size());
        ctx.updateProgress(90, "Search finished");
        return new SearchResult(applications, statusUpdates, responses, summary);
    }
}
