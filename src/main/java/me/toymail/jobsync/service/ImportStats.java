package me.toymail.jobsync.service;

import java.util.ArrayList;
import java.util.List;

/**
 * Counters for one import.
 */
public final class ImportStats {
    public Applications applications = new Applications();
    public Updates statusUpdates = new Updates();
    public Updates responses = new Updates();
    public Enrichments enrichments = new Enrichments();
    public List<Failure> failures = new ArrayList<>();

    public static final class Applications {
        public int added;
        public int existing;
        public int errors;
    }

    public static final class Updates {
        public int processed;
        public int skipped;
        public int errors;
    }

    public static final class Enrichments {
        public int queued;
    }

    public record Failure(String type, String company, String jobTitle, String error) {}
}
