package me.toymail.jobsync.commands;

import me.toymail.jobsync.enrich.EnrichmentStatus;
import me.toymail.jobsync.service.CredentialService.CredentialView;
import me.toymail.jobsync.service.ServiceContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;

import java.util.List;

@Command(
        name = "jobsync",
        mixinStandardHelpOptions = true,
        description = "Job application tracker - imports applications from your mailbox and enriches them from job postings",
        footer = {
                "",
                "Quick Start:",
                "  jobsync credential add --email you@gmail.com   Add a mailbox",
                "  jobsync credential list                        Show mailboxes and their ids",
                "  jobsync sync <credential-id>                   Import new applications and responses",
                "  jobsync enrich status                          Show the enrichment queue",
                "",
                "Common Commands:",
                "  credential  Manage mailbox accounts",
                "  search      Scan a mailbox without importing",
                "  sync        Scan a mailbox and import what was found",
                "  enrich      Fetch job postings for imported applications",
                "",
                "Use 'jobsync <command> --help' for more information on a command."
        },
        subcommands = {
                CredentialCmd.class,
                SearchCmd.class,
                SyncCmd.class,
                EnrichCmd.class
        }
)
public final class RootCmd implements Runnable {
    private static final Logger log = LoggerFactory.getLogger(RootCmd.class);
    private final ServiceContext context;

    public RootCmd(ServiceContext context) {
        this.context = context;
    }

    /**
     * Without a subcommand, show what is configured and what the enrichment worker is doing.
     */
    @Override public void run() {
        try {
            List<CredentialView> mailboxes = context.processing().listCredentials();
            if (mailboxes.isEmpty()) {
                log.info("No mailbox accounts yet. Start with: jobsync credential add --email <email>");
            } else {
                log.info("{} mailbox account(s):", mailboxes.size());
                mailboxes.forEach(c -> log.info("  {} {} (last import: {})", c.id(), c.address(),
                        c.lastImportAt() != null ? c.lastImportAt() : "never"));
            }
            EnrichmentStatus s = context.processing().enrichmentStatus();
            log.info("Enrichment queue: {} waiting, {} processed, {} dropped", s.queueSize(), s.processed(), s.dropped());
        } catch (Exception e) {
            log.error("Cannot read mailbox accounts: {}", e.getMessage());
        }
        log.info("Use --help. Example: jobsync credential add --help");
    }
}
