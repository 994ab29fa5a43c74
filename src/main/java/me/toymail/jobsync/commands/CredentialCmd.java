package me.toymail.jobsync.commands;

import me.toymail.jobsync.service.CredentialRequest;
import me.toymail.jobsync.service.CredentialService.CredentialView;
import me.toymail.jobsync.service.ServiceContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.*;

import java.io.Console;
import java.util.List;

@Command(name = "credential", description = "Manage mailbox accounts",
         subcommands = {CredentialCmd.Add.class, CredentialCmd.ListCmd.class, CredentialCmd.Update.class,
                 CredentialCmd.Delete.class, CredentialCmd.Folders.class},
         footer = {
             "",
             "Commands:",
             "  jobsync credential add       Add a mailbox account",
             "  jobsync credential list      List mailbox accounts",
             "  jobsync credential update    Change settings or the password of an account",
             "  jobsync credential delete    Remove an account and its password",
             "  jobsync credential folders   List the folders on the mail server",
             "",
             "Passwords are kept in the system keychain (macOS Keychain, Windows Credential",
             "Manager, or Linux Secret Service). Without a keychain, set JOBSYNC_SECRET_KEY",
             "and they are stored encrypted in ~/.jobsync/secrets.json."
         })
public class CredentialCmd implements Runnable {
    private static final Logger log = LoggerFactory.getLogger(CredentialCmd.class);
    private final ServiceContext context;

    public CredentialCmd(ServiceContext context) {
        this.context = context;
    }

    ServiceContext context() {
        return context;
    }

    @Override
    public void run() {
        CommandLine.usage(this, System.out);
    }

    static class Settings {
        @Option(names = "--host", paramLabel = "<host>", description = "IMAP host")
        String host;

        @Option(names = "--port", paramLabel = "<port>", description = "IMAP port")
        Integer port;

        @Option(names = "--tls", negatable = true, description = "Use TLS (default: true)")
        Boolean useTLS;

        @Option(names = "--verify-cert", negatable = true,
                description = "Verify the server certificate (default: true)")
        Boolean rejectUnauthorized;

        @Option(names = "--days", paramLabel = "<n>", description = "How many days back to search")
        Integer timeframeDays;

        @Option(names = "--folder", paramLabel = "<folder>",
                description = "Folder to search; repeat for more than one")
        List<String> folders;

        @Option(names = "--auto-import", negatable = true, description = "Include in automatic imports")
        Boolean autoImport;

        CredentialRequest toRequest(String address, String password) {
            return new CredentialRequest(address, password, host, port, useTLS, rejectUnauthorized,
                    timeframeDays, folders, autoImport);
        }
    }

    static String promptPassword(String address) {
        Console console = System.console();
        if (console == null) return null;
        char[] pw = console.readPassword("App password for %s: ", address);
        return pw == null ? null : new String(pw);
    }

    static void print(CredentialView c) {
        log.info("{} | {} | {}:{} | tls={} | folders={} | days={} | lastImport={} | password={}",
                c.id(), c.address(), c.host(), c.port(), c.useTLS(), c.searchFolders(), c.searchTimeframeDays(),
                c.lastImportAt() != null ? c.lastImportAt() : "never", c.hasPassword() ? "stored" : "missing");
    }

    @Command(name = "add", description = "Add a mailbox account",
            footer = {
                "",
                "Examples:",
                "  jobsync credential add --email you@gmail.com",
                "  jobsync credential add --email you@outlook.com --host outlook.office365.com --folder INBOX --folder Jobs",
                "",
                "You will be prompted for the app password unless --password is given."
            })
    public static class Add implements Runnable {
        @ParentCommand
        private CredentialCmd parent;

        @Option(names = "--email", required = true, paramLabel = "<email>", description = "Mailbox address (IMAP login)")
        String email;

        @Option(names = "--password", paramLabel = "<password>", description = "App password (prompted if omitted)")
        String password;

        @Mixin
        Settings settings = new Settings();

        @Override
        public void run() {
            try {
                String pw = password != null ? password : promptPassword(email);
                if (pw == null || pw.isBlank()) {
                    log.error("No password given and no console to prompt on. Use --password.");
                    return;
                }
                CredentialView created = parent.context().processing().createCredential(settings.toRequest(email, pw));
                log.info("Added mailbox {}", created.address());
                print(created);
            } catch (Exception e) {
                log.error("Failed to add credential: {}", e.getMessage());
            }
        }
    }

    @Command(name = "list", description = "List mailbox accounts")
    public static class ListCmd implements Runnable {
        @ParentCommand
        private CredentialCmd parent;

        @Override
        public void run() {
            try {
                List<CredentialView> all = parent.context().processing().listCredentials();
                if (all.isEmpty()) {
                    log.info("No mailbox accounts. Add one with: jobsync credential add --email <email>");
                    return;
                }
                all.forEach(CredentialCmd::print);
            } catch (Exception e) {
                log.error("Failed to list credentials: {}", e.getMessage());
            }
        }
    }

    @Command(name = "update", description = "Change settings or the password of an account",
            footer = {
                "",
                "Examples:",
                "  jobsync credential update <id> --days 30",
                "  jobsync credential update <id> --password      Prompt for a new password"
            })
    public static class Update implements Runnable {
        @ParentCommand
        private CredentialCmd parent;

        @Parameters(index = "0", paramLabel = "<id>", description = "Credential id")
        String id;

        @Option(names = "--email", paramLabel = "<email>", description = "New mailbox address")
        String email;

        @Option(names = "--password", arity = "0..1", interactive = true, paramLabel = "<password>",
                description = "New app password (prompted if no value follows)")
        String password;

        @Mixin
        Settings settings = new Settings();

        @Override
        public void run() {
            try {
                CredentialView updated = parent.context().processing().updateCredential(id, settings.toRequest(email, password));
                log.info("Updated mailbox {}", updated.address());
                print(updated);
            } catch (Exception e) {
                log.error("Failed to update credential: {}", e.getMessage());
            }
        }
    }

    @Command(name = "delete", description = "Remove an account and its stored password")
    public static class Delete implements Runnable {
        @ParentCommand
        private CredentialCmd parent;

        @Parameters(index = "0", paramLabel = "<id>", description = "Credential id")
        String id;

        @Override
        public void run() {
            try {
                if (parent.context().processing().deleteCredential(id)) {
                    log.info("Deleted credential {}", id);
                } else {
                    log.error("Credential not found: {}", id);
                }
            } catch (Exception e) {
                log.error("Failed to delete credential: {}", e.getMessage());
            }
        }
    }

    @Command(name = "folders", description = "List the folders on the mail server",
            footer = {
                "",
                "Use the names shown here with 'credential update <id> --folder <name>'."
            })
    public static class Folders implements Runnable {
        @ParentCommand
        private CredentialCmd parent;

        @Parameters(index = "0", paramLabel = "<id>", description = "Credential id")
        String id;

        @Override
        public void run() {
            try {
                List<String> folders = parent.context().processing().getFolders(id).folders();
                log.info("{} folder(s):", folders.size());
                folders.forEach(f -> log.info("  {}", f));
            } catch (Exception e) {
                log.error("Failed to list folders: {}", e.getMessage());
            }
        }
    }
}
