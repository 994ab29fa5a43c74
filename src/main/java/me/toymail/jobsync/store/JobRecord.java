package me.toymail.jobsync.store;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * A tracked job application.
 */
public final class JobRecord {
    public String id;
    public String jobTitle;
    public String company;
    public String companyLocation;
    public Instant appliedAt;
    public Instant respondedAt;
    public ResponseStatus response = ResponseStatus.NO_RESPONSE;
    public String externalJobId;
    public String website;
    public String source;

    // filled by enrichment
    public String description;
    public Double wagesMin;
    public Double wagesMax;
    public String wageType;
    public String employmentType;
    public String locationType;
    public boolean enrichmentPending;
    public Instant enrichedAt;

    public List<StatusCheck> statusChecks = new ArrayList<>();
    public String notes;
    public Instant createdAt;
    public Instant updatedAt;

    public JobRecord() {}

    public static final class StatusCheck {
        public Instant date;
        public String notes;

        public StatusCheck() {}

        public StatusCheck(Instant date, String notes) {
            this.date = date;
            this.notes = notes;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (!(o instanceof StatusCheck other)) return false;
            return Objects.equals(date, other.date) && Objects.equals(notes, other.notes);
        }

        @Override
        public int hashCode() {
            return Objects.hash(date, notes);
        }
    }

    public JobRecord copy() {
        JobRecord r = new JobRecord();
        r.id = id;
        r.jobTitle = jobTitle;
        r.company = company;
        r.companyLocation = companyLocation;
        r.appliedAt = appliedAt;
        r.respondedAt = respondedAt;
        r.response = response;
        r.externalJobId = externalJobId;
        r.website = website;
        r.source = source;
        r.description = description;
        r.wagesMin = wagesMin;
        r.wagesMax = wagesMax;
        r.wageType = wageType;
        r.employmentType = employmentType;
        r.locationType = locationType;
        r.enrichmentPending = enrichmentPending;
        r.enrichedAt = enrichedAt;
        r.statusChecks = new ArrayList<>();
        if (statusChecks != null) {
            for (StatusCheck sc : statusChecks) r.statusChecks.add(new StatusCheck(sc.date, sc.notes));
        }
        r.notes = notes;
        r.createdAt = createdAt;
        r.updatedAt = updatedAt;
        return r;
    }

    public boolean needsEnrichment() {
        return website != null && !website.isBlank() && enrichedAt == null;
    }
}
