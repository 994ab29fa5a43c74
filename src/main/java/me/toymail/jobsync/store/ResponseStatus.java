package me.toymail.jobsync.store;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Optional;

/**
 * Employer response vocabulary, serialized with its display label.
 */
public enum ResponseStatus {
    NO_RESPONSE("No Response"),
    REJECTED("Rejected"),
    PHONE_SCREEN("Phone Screen"),
    INTERVIEW("Interview"),
    OFFER("Offer"),
    HIRED("Hired"),
    OTHER("Other");

    private final String label;

    ResponseStatus(String label) {
        this.label = label;
    }

    @JsonValue
    public String label() {
        return label;
    }

    public static Optional<ResponseStatus> fromLabel(String label) {
        if (label == null) return Optional.empty();
        for (ResponseStatus s : values()) {
            if (s.label.equalsIgnoreCase(label.trim()) || s.name().equalsIgnoreCase(label.trim())) {
                return Optional.of(s);
            }
        }
        return Optional.empty();
    }

    @JsonCreator
    static ResponseStatus fromJson(String label) {
        return fromLabel(label).orElse(OTHER);
    }

    @Override
    public String toString() {
        return label;
    }
}
