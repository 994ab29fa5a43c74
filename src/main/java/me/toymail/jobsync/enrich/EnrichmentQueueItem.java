package me.toymail.jobsync.enrich;

import java.time.Instant;

/**
 * A queued page. {@code jobRecordId} is null for a URL queued by hand.
 */
public record EnrichmentQueueItem(String jobRecordId, String url, Instant enqueuedAt, int attempts) {

    String key() {
        return jobRecordId != null ? jobRecordId : "url:" + url;
    }

    EnrichmentQueueItem nextAttempt() {
        return new EnrichmentQueueItem(jobRecordId, url, enqueuedAt, attempts + 1);
    }
}
