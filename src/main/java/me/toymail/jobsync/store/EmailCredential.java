package me.toymail.jobsync.store;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * An IMAP account plus its search configuration. The password is kept in the
 * {@link SecretStore} under the credential id and never appears here.
 */
public final class EmailCredential {
    public String id;
    public String address;
    public String host;
    public int port = 993;
    public boolean useTLS = true;
    public boolean rejectUnauthorized = true;
    public boolean autoImport;
    public int searchTimeframeDays = 90;
    public List<String> searchFolders = new ArrayList<>(List.of("INBOX"));
    public Instant lastImportAt;
    public Instant createdAt;
    public Instant updatedAt;

    public EmailCredential() {}

    public EmailCredential copy() {
        EmailCredential c = new EmailCredential();
        c.id = id;
        c.address = address;
        c.host = host;
        c.port = port;
        c.useTLS = useTLS;
        c.rejectUnauthorized = rejectUnauthorized;
        c.autoImport = autoImport;
        c.searchTimeframeDays = searchTimeframeDays;
        c.searchFolders = searchFolders != null ? new ArrayList<>(searchFolders) : null;
        c.lastImportAt = lastImportAt;
        c.createdAt = createdAt;
        c.updatedAt = updatedAt;
        return c;
    }
}
