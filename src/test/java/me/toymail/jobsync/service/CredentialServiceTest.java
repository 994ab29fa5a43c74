package me.toymail.jobsync.service;

import me.toymail.jobsync.ImapClient;
import me.toymail.jobsync.classify.HeuristicMessageClassifier;
import me.toymail.jobsync.store.EncryptedFileSecretStore;
import me.toymail.jobsync.store.EngineConfig;
import me.toymail.jobsync.store.JsonStore;
import me.toymail.jobsync.store.StoreContext;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

public class CredentialServiceTest {

    @TempDir
    Path tempDir;

    private ImapClient imap = mock(ImapClient.class);

    private StoreContext storeContext(String secretKey) {
        JsonStore json = new JsonStore(tempDir);
        EngineConfig config = new EngineConfig();
        config.imap.host = "imap.example.com";
        config.imap.searchFolders = List.of("INBOX", "Jobs");
        return new StoreContext(json, config, new EncryptedFileSecretStore(json, secretKey));
    }

    private CredentialService service(StoreContext context) {
        MailboxSearchService search = new MailboxSearchService(context, cfg -> imap,
                new HeuristicMessageClassifier(),
                new ImportService(context.jobs(), new CandidateMatcher(Duration.ofDays(3)), null),
                Clock.systemUTC());
        return new CredentialService(context, search);
    }

    private static CredentialRequest request(String address, String password) {
        return new CredentialRequest(address, password, null, null, null, null, null, null, null);
    }

    @Test
    public void testCreate_FillsDefaults() throws Exception {
        StoreContext context = storeContext("test-key");
        CredentialService service = service(context);

        CredentialService.CredentialView view = service.create(request("jane@example.com", "app-password"));

        assertNotNull(view.id());
        assertEquals("imap.example.com", view.host());
        assertEquals(993, view.port());
        assertTrue(view.useTLS());
        assertTrue(view.rejectUnauthorized());
        assertEquals(90, view.searchTimeframeDays());
        assertEquals(List.of("INBOX", "Jobs"), view.searchFolders());
        assertTrue(view.hasPassword());
        assertEquals("app-password", context.secrets().getPassword(view.id()).orElseThrow());
    }

    @Test
    public void testCreate_RequestOverridesDefaults() throws Exception {
        CredentialService service = service(storeContext("test-key"));

        CredentialService.CredentialView view = service.create(new CredentialRequest("jane@example.com", "pw",
                "imap.other.example", 143, false, false, 30, List.of("Applications"), true));

        assertEquals("imap.other.example", view.host());
        assertEquals(143, view.port());
        assertFalse(view.useTLS());
        assertFalse(view.rejectUnauthorized());
        assertEquals(30, view.searchTimeframeDays());
        assertEquals(List.of("Applications"), view.searchFolders());
        assertTrue(view.autoImport());
    }

    @Test
    public void testCreate_RequiresAddressAndPassword() {
        CredentialService service = service(storeContext("test-key"));

        assertThrows(IllegalArgumentException.class, () -> service.create(request(" ", "pw")));
        assertThrows(IllegalArgumentException.class, () -> service.create(request("jane@example.com", null)));
    }

    @Test
    public void testCreate_WithoutSecretStore() throws Exception {
        CredentialService service = service(storeContext(null));

        assertFalse(service.isSecretStoreAvailable());
        assertThrows(IllegalStateException.class, () -> service.create(request("jane@example.com", "pw")));
        assertTrue(service.list().isEmpty());
    }

    @Test
    public void testCreate_InvalidTimeframeIsRejected() throws Exception {
        CredentialService service = service(storeContext("test-key"));

        assertThrows(IllegalArgumentException.class, () -> service.create(new CredentialRequest(
                "jane@example.com", "pw", null, null, null, null, 400, null, null)));
        assertTrue(service.list().isEmpty());
    }

    @Test
    public void testUpdate_MergesAndReplacesPassword() throws Exception {
        StoreContext context = storeContext("test-key");
        CredentialService service = service(context);
        String id = service.create(request("jane@example.com", "old")).id();

        CredentialService.CredentialView view = service.update(id, new CredentialRequest(null, "new",
                null, null, null, null, 14, null, null));

        assertEquals("jane@example.com", view.address());
        assertEquals(14, view.searchTimeframeDays());
        assertEquals("imap.example.com", view.host());
        assertEquals("new", context.secrets().getPassword(id).orElseThrow());
    }

    @Test
    public void testUpdate_UnknownCredential() {
        CredentialService service = service(storeContext("test-key"));

        assertThrows(IllegalArgumentException.class, () -> service.update("missing", request(null, null)));
    }

    @Test
    public void testDelete_RemovesPassword() throws Exception {
        StoreContext context = storeContext("test-key");
        CredentialService service = service(context);
        String id = service.create(request("jane@example.com", "pw")).id();

        assertTrue(service.delete(id));
        assertFalse(service.delete(id));
        assertTrue(context.secrets().getPassword(id).isEmpty());
        assertTrue(service.list().isEmpty());
    }

    @Test
    public void testFolders_ListsFromServer() throws Exception {
        CredentialService service = service(storeContext("test-key"));
        String id = service.create(request("jane@example.com", "pw")).id();
        when(imap.listFolders()).thenReturn(List.of("INBOX", "[Gmail]/All Mail"));

        assertEquals(List.of("INBOX", "[Gmail]/All Mail"), service.folders(id));
        verify(imap).close();
    }
}
