package me.toymail.jobsync.classify;

import com.fasterxml.jackson.annotation.JsonValue;

public enum CandidateType {
    APPLICATION("application"),
    STATUS_UPDATE("statusUpdate"),
    RESPONSE("response");

    private final String wireName;

    CandidateType(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }
}
