package me.toymail.jobsync.commands;

import me.toymail.jobsync.ServiceAwareFactory;
import me.toymail.jobsync.service.CredentialRequest;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class RootCmdTest extends CommandTestBase {

    @Test
    public void testOverview_NoMailboxes() {
        captureOutput();

        executeCommand(new RootCmd(context));

        assertTrue(output().contains("No mailbox accounts yet"), output());
        assertTrue(output().contains("Enrichment queue: 0 waiting"), output());
    }

    @Test
    public void testOverview_ListsMailboxes() throws Exception {
        String id = context.credentials().create(new CredentialRequest("jane@example.com", "pw",
                "imap.example.com", null, null, null, null, null, null)).id();
        captureOutput();

        executeCommand(new RootCmd(context));

        assertTrue(output().contains("1 mailbox account(s):"), output());
        assertTrue(output().contains(id + " jane@example.com (last import: never)"), output());
    }

    @Test
    public void testSubcommandsGetTheContext() throws Exception {
        captureOutput();

        int code = executeCommand(new RootCmd(context), "credential", "add", "--email", "jane@example.com",
                "--password", "pw", "--host", "imap.example.com");

        assertEquals(0, code);
        assertEquals(1, context.credentials().list().size());
    }

    @Test
    public void testFactoryFallsBackForPlainClasses() throws Exception {
        ServiceAwareFactory factory = new ServiceAwareFactory(context);

        assertNotNull(factory.create(StringBuilder.class));
        assertSame(context, factory.create(CredentialCmd.class).context());
    }
}
