package me.toymail.jobsync.enrich;

/**
 * Retrieves job posting pages.
 */
public interface PageFetcher {
    record FetchedPage(String requestedUrl, String finalUrl, int status, String body) {}

    FetchedPage fetch(String url) throws EnrichmentFetchException;
}
