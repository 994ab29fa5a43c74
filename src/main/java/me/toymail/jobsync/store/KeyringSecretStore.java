package me.toymail.jobsync.store;

import com.github.javakeyring.BackendNotSupportedException;
import com.github.javakeyring.Keyring;
import com.github.javakeyring.PasswordAccessException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

/**
 * Mailbox passwords in the system keychain.
 * Uses macOS Keychain, Linux Secret Service (GNOME Keyring/KWallet), or Windows Credential Manager.
 */
public final class KeyringSecretStore implements SecretStore {
    private static final Logger log = LoggerFactory.getLogger(KeyringSecretStore.class);
    static final String SERVICE_NAME = "jobsync";

    private final Keyring keyring;
    private final boolean available;

    public KeyringSecretStore() {
        Keyring kr = null;
        boolean avail = false;
        try {
            kr = Keyring.create();
            avail = true;
            log.debug("System keyring initialized");
        } catch (BackendNotSupportedException e) {
            log.debug("System keyring not available: {}", e.getMessage());
        }
        this.keyring = kr;
        this.available = avail;
    }

    @Override
    public boolean isAvailable() {
        return available;
    }

    @Override
    public Optional<String> getPassword(String credentialId) {
        if (!available) return Optional.empty();
        try {
            return Optional.ofNullable(keyring.getPassword(SERVICE_NAME, credentialId));
        } catch (PasswordAccessException e) {
            log.debug("No keyring entry for credential {}: {}", credentialId, e.getMessage());
            return Optional.empty();
        }
    }

    @Override
    public boolean setPassword(String credentialId, String password) {
        if (!available) return false;
        try {
            keyring.setPassword(SERVICE_NAME, credentialId, password);
            log.debug("Saved password to keyring for credential {}", credentialId);
            return true;
        } catch (PasswordAccessException e) {
            log.warn("Failed to save password to keyring for credential {}: {}", credentialId, e.getMessage());
            return false;
        }
    }

    @Override
    public boolean deletePassword(String credentialId) {
        if (!available) return false;
        try {
            keyring.deletePassword(SERVICE_NAME, credentialId);
            return true;
        } catch (PasswordAccessException e) {
            log.debug("Failed to delete keyring entry for credential {}: {}", credentialId, e.getMessage());
            return false;
        }
    }
}
