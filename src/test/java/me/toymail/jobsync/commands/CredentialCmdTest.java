package me.toymail.jobsync.commands;

import me.toymail.jobsync.service.CredentialRequest;
import me.toymail.jobsync.service.CredentialService.CredentialView;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

public class CredentialCmdTest extends CommandTestBase {

    private String addCredential(String address) throws Exception {
        return context.credentials().create(new CredentialRequest(address, "pw", "imap.example.com",
                null, null, null, null, null, null)).id();
    }

    @Test
    public void testAdd_Success() throws Exception {
        captureOutput();

        executeCommand(new CredentialCmd(context), "add", "--email", "jane@example.com", "--password", "secret",
                "--host", "imap.example.com", "--days", "30", "--folder", "INBOX", "--folder", "Jobs");

        assertTrue(output().contains("Added mailbox jane@example.com"), output());
        List<CredentialView> all = context.credentials().list();
        assertEquals(1, all.size());
        assertEquals(30, all.get(0).searchTimeframeDays());
        assertEquals(List.of("INBOX", "Jobs"), all.get(0).searchFolders());
        assertEquals("secret", context.storeContext().secrets().getPassword(all.get(0).id()).orElseThrow());
    }

    @Test
    public void testAdd_NoTlsFlag() throws Exception {
        executeCommand(new CredentialCmd(context), "add", "--email", "jane@example.com", "--password", "secret",
                "--host", "imap.example.com", "--port", "143", "--no-tls");

        CredentialView c = context.credentials().list().get(0);
        assertFalse(c.useTLS());
        assertEquals(143, c.port());
    }

    @Test
    public void testAdd_DuplicateAddress() throws Exception {
        addCredential("jane@example.com");
        captureOutput();

        executeCommand(new CredentialCmd(context), "add", "--email", "JANE@example.com", "--password", "secret");

        assertTrue(output().contains("Failed to add credential"), output());
        assertTrue(output().contains("already exists"), output());
        assertEquals(1, context.credentials().list().size());
    }

    @Test
    public void testList_Empty() {
        captureOutput();

        executeCommand(new CredentialCmd(context), "list");

        assertTrue(output().contains("No mailbox accounts"), output());
    }

    @Test
    public void testList_ShowsAccounts() throws Exception {
        String id = addCredential("jane@example.com");
        captureOutput();

        executeCommand(new CredentialCmd(context), "list");

        assertTrue(output().contains(id), output());
        assertTrue(output().contains("imap.example.com:993"), output());
        assertTrue(output().contains("password=stored"), output());
        assertTrue(output().contains("lastImport=never"), output());
    }

    @Test
    public void testUpdate_ChangesTimeframe() throws Exception {
        String id = addCredential("jane@example.com");
        captureOutput();

        executeCommand(new CredentialCmd(context), "update", id, "--days", "14", "--no-verify-cert");

        assertTrue(output().contains("Updated mailbox jane@example.com"), output());
        CredentialView c = context.credentials().get(id);
        assertEquals(14, c.searchTimeframeDays());
        assertFalse(c.rejectUnauthorized());
    }

    @Test
    public void testUpdate_UnknownId() {
        captureOutput();

        executeCommand(new CredentialCmd(context), "update", "missing", "--days", "14");

        assertTrue(output().contains("Credential not found: missing"), output());
    }

    @Test
    public void testDelete_Success() throws Exception {
        String id = addCredential("jane@example.com");
        captureOutput();

        executeCommand(new CredentialCmd(context), "delete", id);

        assertTrue(output().contains("Deleted credential " + id), output());
        assertTrue(context.credentials().list().isEmpty());
        assertTrue(context.storeContext().secrets().getPassword(id).isEmpty());
    }

    @Test
    public void testDelete_NotFound() {
        captureOutput();

        executeCommand(new CredentialCmd(context), "delete", "missing");

        assertTrue(output().contains("Credential not found: missing"), output());
    }

    @Test
    public void testFolders_ListsServerFolders() throws Exception {
        String id = addCredential("jane@example.com");
        when(imap.listFolders()).thenReturn(List.of("INBOX", "Jobs", "[Gmail]/Sent Mail"));
        captureOutput();

        executeCommand(new CredentialCmd(context), "folders", id);

        assertTrue(output().contains("3 folder(s):"), output());
        assertTrue(output().contains("[Gmail]/Sent Mail"), output());
    }
}
