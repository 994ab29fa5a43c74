package me.toymail.jobsync.enrich;

/**
 * A job page could not be fetched or parsed. Counts toward the worker's failure breaker.
 */
public class EnrichmentFetchException extends Exception {
    public EnrichmentFetchException(String message) {
        super(message);
    }

    public EnrichmentFetchException(String message, Throwable cause) {
        super(message, cause);
    }
}
