package me.toymail.jobsync.store;

import com.fasterxml.jackson.core.type.TypeReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Clock;
import java.time.Instant;
import java.util.*;

/**
 * Mailbox accounts, persisted in credentials.json.
 */
public class CredentialStore {
    private static final Logger log = LoggerFactory.getLogger(CredentialStore.class);
    private static final String FILE_NAME = "credentials.json";

    public static final int MIN_TIMEFRAME_DAYS = 1;
    public static final int MAX_TIMEFRAME_DAYS = 365;

    private final JsonStore store;
    private final Clock clock;
    private Map<String, EmailCredential> byId;

    public CredentialStore(JsonStore store) {
        this(store, Clock.systemUTC());
    }

    public CredentialStore(JsonStore store, Clock clock) {
        this.store = store;
        this.clock = clock;
    }

    public synchronized List<EmailCredential> list() throws IOException {
        List<EmailCredential> out = new ArrayList<>();
        for (EmailCredential c : load().values()) out.add(c.copy());
        return out;
    }

    public synchronized Optional<EmailCredential> get(String id) throws IOException {
        if (id == null) return Optional.empty();
        EmailCredential c = load().get(id);
        return c == null ? Optional.empty() : Optional.of(c.copy());
    }

    /**
     * Insert or replace a credential. Assigns an id to new records and normalizes the folder list.
     */
    public synchronized EmailCredential save(EmailCredential credential) throws IOException {
        validate(credential);
        Map<String, EmailCredential> all = load();
        EmailCredential c = credential.copy();
        Instant now = clock.instant();
        if (c.id == null || c.id.isBlank()) {
            c.id = UUID.randomUUID().toString();
        }
        EmailCredential previous = all.get(c.id);
        c.createdAt = previous != null && previous.createdAt != null ? previous.createdAt : now;
        c.updatedAt = now;
        c.searchFolders = normalizeFolders(c.searchFolders);

        for (EmailCredential other : all.values()) {
            if (!other.id.equals(c.id) && other.address.equalsIgnoreCase(c.address)) {
                throw new IllegalArgumentException("A credential for " + c.address + " already exists");
            }
        }

        all.put(c.id, c);
        persist(all);
        log.debug("Saved credential {} ({})", c.id, c.address);
        return c.copy();
    }

    public synchronized boolean delete(String id) throws IOException {
        Map<String, EmailCredential> all = load();
        if (all.remove(id) == null) return false;
        persist(all);
        log.debug("Deleted credential {}", id);
        return true;
    }

    public synchronized void markImported(String id, Instant at) throws IOException {
        Map<String, EmailCredential> all = load();
        EmailCredential c = all.get(id);
        if (c == null) {
            log.warn("Cannot record import time, credential {} no longer exists", id);
            return;
        }
        c.lastImportAt = at;
        c.updatedAt = clock.instant();
        persist(all);
    }

    static List<String> normalizeFolders(List<String> folders) {
        LinkedHashSet<String> out = new LinkedHashSet<>();
        if (folders != null) {
            for (String f : folders) {
                if (f != null && !f.isBlank()) out.add(f.trim());
            }
        }
        if (out.isEmpty()) out.add("INBOX");
        return new ArrayList<>(out);
    }

    private static void validate(EmailCredential c) {
        if (c.address == null || c.address.isBlank()) {
            throw new IllegalArgumentException("Email address is required");
        }
        if (c.host == null || c.host.isBlank()) {
            throw new IllegalArgumentException("IMAP host is required");
        }
        if (c.port <= 0 || c.port > 65535) {
            throw new IllegalArgumentException("Invalid IMAP port: " + c.port);
        }
        if (c.searchTimeframeDays < MIN_TIMEFRAME_DAYS || c.searchTimeframeDays > MAX_TIMEFRAME_DAYS) {
            throw new IllegalArgumentException("searchTimeframeDays must be between "
                    + MIN_TIMEFRAME_DAYS + " and " + MAX_TIMEFRAME_DAYS);
        }
    }

    private Map<String, EmailCredential> load() throws IOException {
        if (byId == null) {
            List<EmailCredential> stored = store.readJson(FILE_NAME, new TypeReference<List<EmailCredential>>() {});
            byId = new LinkedHashMap<>();
            if (stored != null) {
                for (EmailCredential c : stored) byId.put(c.id, c);
            }
        }
        return byId;
    }

    private void persist(Map<String, EmailCredential> all) throws IOException {
        store.writeJson(FILE_NAME, new ArrayList<>(all.values()));
    }
}
