package me.toymail.jobsync.commands;

import me.toymail.jobsync.ImapClient;
import me.toymail.jobsync.ServiceAwareFactory;
import me.toymail.jobsync.classify.HeuristicMessageClassifier;
import me.toymail.jobsync.enrich.PageFetcher;
import me.toymail.jobsync.service.ServiceContext;
import me.toymail.jobsync.store.EncryptedFileSecretStore;
import me.toymail.jobsync.store.EngineConfig;
import me.toymail.jobsync.store.JsonStore;
import me.toymail.jobsync.store.StoreContext;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.file.Path;
import java.time.Clock;

import static org.mockito.Mockito.mock;

public class CommandTestBase {

    @TempDir
    protected Path tempDir;

    protected ServiceContext context;

    /** Every connect returns this mock. */
    protected ImapClient imap;

    /** Serves enrichment requests; tests replace it before the worker picks anything up. */
    protected PageFetcher fetcher = url -> {
        throw new AssertionError("no fetch expected for " + url);
    };

    private String originalUserHome;
    private PrintStream originalOut;
    private ByteArrayOutputStream out;

    @BeforeEach
    public void setUp() throws Exception {
        originalUserHome = System.getProperty("user.home");
        originalOut = System.out;
        System.setProperty("user.home", tempDir.toAbsolutePath().toString());

        JsonStore json = new JsonStore(tempDir.resolve(".jobsync"));
        EngineConfig config = new EngineConfig();
        config.jobs.pollIntervalMs = 10;
        config.enrichment.standardDelayMs = 0;
        config.enrichment.requestsPerMinute = 1000;
        StoreContext store = new StoreContext(json, config, new EncryptedFileSecretStore(json, "test-key"));
        imap = mock(ImapClient.class);
        context = ServiceContext.create(store, cfg -> imap, url -> fetcher.fetch(url),
                new HeuristicMessageClassifier(), Clock.systemUTC()).start();
    }

    @AfterEach
    public void tearDown() {
        context.close();
        System.setOut(originalOut);
        if (originalUserHome != null) {
            System.setProperty("user.home", originalUserHome);
        }
    }

    /**
     * Capture everything logged to the console from here on.
     */
    protected void captureOutput() {
        out = new ByteArrayOutputStream();
        System.setOut(new PrintStream(out));
    }

    protected String output() {
        return out.toString();
    }

    /**
     * Execute a command using picocli with the service context injected
     */
    protected int executeCommand(Object command, String... args) {
        CommandLine.IFactory factory = new ServiceAwareFactory(context);
        return new CommandLine(command, factory).execute(args);
    }
}
