package me.toymail.jobsync.enrich;

import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

public final class LinkedInUrls {
    private static final Pattern VIEW = Pattern.compile("linkedin\\.com/(?:comm/)?jobs/view/(?:[^/?#]*-)?(\\d+)", Pattern.CASE_INSENSITIVE);
    private static final Pattern CURRENT_JOB = Pattern.compile("linkedin\\.com/.*[?&]currentJobId=(\\d+)", Pattern.CASE_INSENSITIVE);

    static final String GUEST_POSTING = "https://www.linkedin.com/jobs-guest/jobs/api/jobPosting/";

    private LinkedInUrls() {}

    public static boolean isLinkedIn(String url) {
        return url != null && url.toLowerCase(Locale.ROOT).contains("linkedin.com");
    }

    public static Optional<String> jobId(String url) {
        if (url == null) return Optional.empty();
        Matcher m = VIEW.matcher(url);
        if (m.find()) return Optional.of(m.group(1));
        m = CURRENT_JOB.matcher(url);
        if (m.find()) return Optional.of(m.group(1));
        return Optional.empty();
    }

    /**
     * The public guest endpoint for LinkedIn postings, the URL itself for everything else.
     */
    public static String fetchUrl(String url) {
        return jobId(url).map(id -> GUEST_POSTING + id).orElse(url);
    }
}
