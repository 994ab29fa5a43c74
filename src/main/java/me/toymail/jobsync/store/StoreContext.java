package me.toymail.jobsync.store;

import me.toymail.jobsync.PasswordResolver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.Map;

public final class StoreContext {
    private static final Logger log = LoggerFactory.getLogger(StoreContext.class);

    private final JsonStore jsonStore;
    private final EngineConfig config;
    private final CredentialStore credentialStore;
    private final SecretStore secretStore;
    private final JobRecordStore jobRecordStore;
    private final PasswordResolver passwordResolver;

    public StoreContext(JsonStore jsonStore, EngineConfig config, SecretStore secretStore) {
        this.jsonStore = jsonStore;
        this.config = config;
        this.secretStore = secretStore;
        this.credentialStore = new CredentialStore(jsonStore);
        this.jobRecordStore = new JobRecordStore(jsonStore);
        this.passwordResolver = new PasswordResolver(secretStore);
    }

    /**
     * Open the default data home. Passwords go to the system keychain when there is one,
     * otherwise to the encrypted secrets file.
     */
    public static StoreContext initialize() throws IOException {
        return initialize(new JsonStore(), System.getenv());
    }

    public static StoreContext initialize(JsonStore jsonStore, Map<String, String> env) throws IOException {
        EngineConfig config = EngineConfig.load(jsonStore, env);
        SecretStore secrets = new KeyringSecretStore();
        if (!secrets.isAvailable()) {
            secrets = new EncryptedFileSecretStore(jsonStore, config.secretKey);
            if (!secrets.isAvailable()) {
                log.warn("No system keychain and JOBSYNC_SECRET_KEY is not set; passwords cannot be stored");
            }
        }
        return new StoreContext(jsonStore, config, secrets);
    }

    public JsonStore jsonStore() {
        return jsonStore;
    }

    public EngineConfig config() {
        return config;
    }

    public CredentialStore credentials() {
        return credentialStore;
    }

    public SecretStore secrets() {
        return secretStore;
    }

    public JobRecordStore jobs() {
        return jobRecordStore;
    }

    public PasswordResolver passwordResolver() {
        return passwordResolver;
    }
}
