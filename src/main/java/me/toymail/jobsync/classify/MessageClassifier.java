package me.toymail.jobsync.classify;

import me.toymail.jobsync.ImapClient.RawMessage;

import java.util.Optional;

/**
 * Turns a mailbox message into at most one job event. Implementations must be pure: no I/O,
 * same answer for the same message, and never throw for a message they do not understand.
 */
@FunctionalInterface
public interface MessageClassifier {
    Optional<CandidateItem> classify(RawMessage message);
}
