package me.toymail.jobsync;

/**
 * The mailbox could not be reached or refused the login.
 */
public class MailboxConnectionException extends Exception {
    public MailboxConnectionException(String message, Throwable cause) {
        super(message, cause);
    }
}
