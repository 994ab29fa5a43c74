package me.toymail.jobsync.jobs;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum JobType {
    EMAIL_SEARCH,
    EMAIL_SYNC,
    EMAIL_IMPORT,
    JOB_ENRICHMENT;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
