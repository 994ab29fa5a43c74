package me.toymail.jobsync.store;

import com.fasterxml.jackson.core.type.TypeReference;
import me.toymail.jobsync.crypto.SecretBox;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.security.GeneralSecurityException;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Fallback for hosts without a keychain: passwords sealed with AES-GCM in secrets.json.
 * Unavailable unless JOBSYNC_SECRET_KEY is configured.
 */
public final class EncryptedFileSecretStore implements SecretStore {
    private static final Logger log = LoggerFactory.getLogger(EncryptedFileSecretStore.class);
    static final String FILE_NAME = "secrets.json";

    private final JsonStore store;
    private final SecretBox box;

    public EncryptedFileSecretStore(JsonStore store, String secretKey) {
        this.store = store;
        this.box = secretKey == null || secretKey.isBlank() ? null : new SecretBox(secretKey);
    }

    @Override
    public boolean isAvailable() {
        return box != null;
    }

    @Override
    public synchronized Optional<String> getPassword(String credentialId) {
        if (box == null) return Optional.empty();
        try {
            SecretBox.Sealed sealed = load().get(credentialId);
            if (sealed == null) return Optional.empty();
            return Optional.of(box.open(credentialId, sealed));
        } catch (IOException e) {
            log.warn("Cannot read {}: {}", FILE_NAME, e.getMessage());
            return Optional.empty();
        } catch (GeneralSecurityException e) {
            log.warn("Cannot decrypt password for credential {} (wrong JOBSYNC_SECRET_KEY?)", credentialId);
            return Optional.empty();
        }
    }

    @Override
    public synchronized boolean setPassword(String credentialId, String password) {
        if (box == null) return false;
        try {
            Map<String, SecretBox.Sealed> all = load();
            all.put(credentialId, box.seal(credentialId, password));
            store.writeJson(FILE_NAME, all);
            return true;
        } catch (IOException | GeneralSecurityException e) {
            log.warn("Failed to save password for credential {}: {}", credentialId, e.getMessage());
            return false;
        }
    }

    @Override
    public synchronized boolean deletePassword(String credentialId) {
        if (box == null) return false;
        try {
            Map<String, SecretBox.Sealed> all = load();
            if (all.remove(credentialId) == null) return false;
            store.writeJson(FILE_NAME, all);
            return true;
        } catch (IOException e) {
            log.warn("Failed to delete password for credential {}: {}", credentialId, e.getMessage());
            return false;
        }
    }

    private Map<String, SecretBox.Sealed> load() throws IOException {
        Map<String, SecretBox.Sealed> m = store.readJson(FILE_NAME, new TypeReference<Map<String, SecretBox.Sealed>>() {});
        return m != null ? new LinkedHashMap<>(m) : new LinkedHashMap<>();
    }
}
