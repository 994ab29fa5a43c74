package me.toymail.jobsync.service;

import me.toymail.jobsync.classify.CandidateItem;
import me.toymail.jobsync.classify.CandidateType;
import me.toymail.jobsync.store.JobRecord;

import java.time.Duration;
import java.time.Instant;
import java.util.Collection;
import java.util.Locale;
import java.util.Optional;

/**
 * Decides which stored record a candidate refers to.
 *
 * <ol>
 *   <li>Same external job id.</li>
 *   <li>Same company and job title, ignoring case, with dates compatible within the window:
 *   an application must be within the window of the record's applied date; a status update or
 *   response may not precede the application by more than the window, and the most recently
 *   applied record wins.</li>
 * </ol>
 */
public final class CandidateMatcher {
    private final Duration window;

    public CandidateMatcher(Duration window) {
        this.window = window;
    }

    public Optional<JobRecord> match(CandidateItem c, Collection<JobRecord> records) {
        if (c.externalId() != null && !c.externalId().isBlank()) {
            for (JobRecord r : records) {
                if (c.externalId().equals(r.externalJobId)) return Optional.of(r);
            }
        }
        String company = key(c.company());
        String title = key(c.jobTitle());
        if (company == null || title == null) return Optional.empty();

        JobRecord best = null;
        for (JobRecord r : records) {
            if (!company.equals(key(r.company)) || !title.equals(key(r.jobTitle))) continue;
            if (c.type() == CandidateType.APPLICATION) {
                if (withinWindow(r.appliedAt, c.eventAt())) return Optional.of(r);
            } else if (appliedBefore(r.appliedAt, c.eventAt())) {
                if (best == null || isLater(r.appliedAt, best.appliedAt)) best = r;
            }
        }
        return Optional.ofNullable(best);
    }

    private boolean withinWindow(Instant applied, Instant event) {
        if (applied == null || event == null) return true;
        return Duration.between(applied, event).abs().compareTo(window) <= 0;
    }

    private boolean appliedBefore(Instant applied, Instant event) {
        if (applied == null || event == null) return true;
        return !applied.isAfter(event.plus(window));
    }

    private static boolean isLater(Instant a, Instant b) {
        if (a == null) return false;
        return b == null || a.isAfter(b);
    }

    private static String key(String s) {
        if (s == null || s.isBlank()) return null;
        return s.trim().replaceAll("\\s+", " ").toLowerCase(Locale.ROOT);
    }
}
