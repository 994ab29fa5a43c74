package me.toymail.jobsync.service;

import me.toymail.jobsync.ImapClient;
import me.toymail.jobsync.MailboxConnectionException;

/**
 * Opens mailbox sessions. Production code uses {@link ImapClient#connect}.
 */
@FunctionalInterface
public interface MailboxConnector {
    ImapClient connect(ImapClient.ImapConfig config) throws MailboxConnectionException;
}
