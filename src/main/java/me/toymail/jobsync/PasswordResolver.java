package me.toymail.jobsync;

import me.toymail.jobsync.store.EmailCredential;
import me.toymail.jobsync.store.SecretStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

/**
 * Resolves mailbox passwords with fallback chain: explicit argument > secret store.
 */
public final class PasswordResolver {
    private static final Logger log = LoggerFactory.getLogger(PasswordResolver.class);

    private final SecretStore secretStore;

    public PasswordResolver(SecretStore secretStore) {
        this.secretStore = secretStore;
    }

    /**
     * @param explicitPassword password passed by the caller (may be null)
     * @param credential       the account to log in to
     * @return resolved password
     * @throws IllegalStateException if no password is available
     */
    public String resolve(String explicitPassword, EmailCredential credential) {
        if (explicitPassword != null && !explicitPassword.isBlank()) {
            log.debug("Using explicit password for {}", credential.address);
            return explicitPassword;
        }

        Optional<String> stored = secretStore.getPassword(credential.id);
        if (stored.isPresent()) {
            log.debug("Using stored password for {}", credential.address);
            return stored.get();
        }

        throw new IllegalStateException(
                "No password stored for " + credential.address + ". " +
                "Set one with 'jobsync credential update " + credential.id + " --password'."
        );
    }
}
