package me.toymail.jobsync.enrich;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Worker counters. {@code isProcessing} is true only while a request is in flight.
 */
public record EnrichmentStatus(
        @JsonProperty("isProcessing") boolean isProcessing,
        int queueSize,
        long processed,
        long failed,
        long dropped,
        int consecutiveFailures,
        boolean backingOff
) {}
