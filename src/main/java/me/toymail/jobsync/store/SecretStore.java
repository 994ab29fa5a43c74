package me.toymail.jobsync.store;

import java.util.Optional;

/**
 * Opaque password storage keyed by credential id.
 */
public interface SecretStore {
    boolean isAvailable();

    Optional<String> getPassword(String credentialId);

    boolean setPassword(String credentialId, String password);

    boolean deletePassword(String credentialId);
}
