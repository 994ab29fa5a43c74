package me.toymail.jobsync.service;

import me.toymail.jobsync.ImapClient;
import me.toymail.jobsync.MailboxConnectionException;
import me.toymail.jobsync.store.EmailCredential;
import me.toymail.jobsync.store.EngineConfig;
import me.toymail.jobsync.store.StoreContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Mailbox accounts and their passwords.
 */
public final class CredentialService {
    private static final Logger log = LoggerFactory.getLogger(CredentialService.class);

    private final StoreContext context;
    private final MailboxSearchService searchService;

    public CredentialService(StoreContext context, MailboxSearchService searchService) {
        this.context = context;
        this.searchService = searchService;
    }

    /**
     * A credential as shown to callers: everything except the password.
     */
    public record CredentialView(String id, String address, String host, int port, boolean useTLS,
                                 boolean rejectUnauthorized, int searchTimeframeDays, List<String> searchFolders,
                                 Instant lastImportAt, boolean autoImport, Instant createdAt, Instant updatedAt,
                                 boolean hasPassword) {}

    /**
     * Check if passwords can be stored on this system.
     */
    public boolean isSecretStoreAvailable() {
        return context.secrets().isAvailable();
    }

    public CredentialView create(CredentialRequest req) throws IOException {
        if (req.address() == null || req.address().isBlank()) {
            throw new IllegalArgumentException("Email address is required");
        }
        if (req.password() == null || req.password().isBlank()) {
            throw new IllegalArgumentException("Password is required");
        }
        if (!context.secrets().isAvailable()) {
            throw new IllegalStateException("No secret store available: no system keychain and JOBSYNC_SECRET_KEY is not set");
        }
        EngineConfig.Imap defaults = context.config().imap;
        EmailCredential c = new EmailCredential();
        c.address = req.address().trim();
        c.host = defaults.host;
        c.port = defaults.port;
        c.useTLS = defaults.useTLS;
        c.searchTimeframeDays = defaults.searchTimeframeDays;
        c.searchFolders = new ArrayList<>(defaults.searchFolders);
        merge(c, req);

        EmailCredential saved = context.credentials().save(c);
        if (!context.secrets().setPassword(saved.id, req.password())) {
            context.credentials().delete(saved.id);
            throw new IllegalStateException("Could not store the password for " + saved.address);
        }
        log.info("Added credential {} for {}", saved.id, saved.address);
        return view(saved);
    }

    public List<CredentialView> list() throws IOException {
        List<CredentialView> out = new ArrayList<>();
        for (EmailCredential c : context.credentials().list()) out.add(view(c));
        return out;
    }

    public CredentialView get(String id) throws IOException {
        return view(searchService.requireCredential(id));
    }

    public CredentialView update(String id, CredentialRequest req) throws IOException {
        EmailCredential c = searchService.requireCredential(id);
        if (req.address() != null && !req.address().isBlank()) c.address = req.address().trim();
        merge(c, req);
        EmailCredential saved = context.credentials().save(c);
        if (req.password() != null && !req.password().isBlank()
                && !context.secrets().setPassword(saved.id, req.password())) {
            throw new IllegalStateException("Could not store the password for " + saved.address);
        }
        return view(saved);
    }

    /**
     * @return false if no such credential exists
     */
    public boolean delete(String id) throws IOException {
        boolean removed = context.credentials().delete(id);
        if (removed) {
            context.secrets().deletePassword(id);
            log.info("Deleted credential {}", id);
        }
        return removed;
    }

    /**
     * Every folder of the account, straight from the server.
     */
    public List<String> folders(String id) throws IOException, MailboxConnectionException {
        EmailCredential c = searchService.requireCredential(id);
        try (ImapClient imap = searchService.open(c)) {
            return imap.listFolders();
        }
    }

    private static void merge(EmailCredential c, CredentialRequest req) {
        if (req.host() != null && !req.host().isBlank()) c.host = req.host().trim();
        if (req.port() != null) c.port = req.port();
        if (req.useTLS() != null) c.useTLS = req.useTLS();
        if (req.rejectUnauthorized() != null) c.rejectUnauthorized = req.rejectUnauthorized();
        if (req.searchTimeframeDays() != null) c.searchTimeframeDays = req.searchTimeframeDays();
        if (req.searchFolders() != null) c.searchFolders = new ArrayList<>(req.searchFolders());
        if (req.autoImport() != null) c.autoImport = req.autoImport();
    }

    private CredentialView view(EmailCredential c) {
        return new CredentialView(c.id, c.address, c.host, c.port, c.useTLS, c.rejectUnauthorized,
                c.searchTimeframeDays, c.searchFolders, c.lastImportAt, c.autoImport, c.createdAt, c.updatedAt,
                context.secrets().getPassword(c.id).isPresent());
    }
}
