package me.toymail.jobsync.classify;

import me.toymail.jobsync.ImapClient.RawMessage;
import me.toymail.jobsync.store.ResponseStatus;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Subject and body rules for LinkedIn notifications and common applicant tracking mail.
 *
 * <ul>
 *   <li>LinkedIn "your application was sent to ..." is an application, "was viewed by",
 *   "is in review at" and "is being considered at" are status updates, and "your application to
 *   T at C" is a response when the body carries a decision.</li>
 *   <li>Other senders: confirmation subjects are applications; update subjects whose body holds a
 *   decision phrase are responses.</li>
 * </ul>
 * Anything else, or anything without both a company and a job title, is discarded.
 */
public final class HeuristicMessageClassifier implements MessageClassifier {
    private static final Logger log = LoggerFactory.getLogger(HeuristicMessageClassifier.class);

    private static final int FLAGS = Pattern.CASE_INSENSITIVE;

    // LinkedIn subjects
    private static final Pattern LI_SENT_TITLE_AT = Pattern.compile("application was sent to (.+?) at (.+)$", FLAGS);
    private static final Pattern LI_SENT = Pattern.compile("application was sent to (.+)$", FLAGS);
    private static final Pattern LI_VIEWED = Pattern.compile("was viewed by (.+)$", FLAGS);
    private static final Pattern LI_IN_REVIEW = Pattern.compile("is in review at (.+)$", FLAGS);
    private static final Pattern LI_CONSIDERED = Pattern.compile("is being considered at (.+)$", FLAGS);
    private static final Pattern LI_RESPONSE_TITLE_AT = Pattern.compile("your application to (.+?) at (.+)$", FLAGS);
    private static final Pattern LI_RESPONSE = Pattern.compile(
            "your application to|update on your application|your update from|response to your application", FLAGS);
    private static final Pattern[] STATUS_PATTERNS = {LI_VIEWED, LI_IN_REVIEW, LI_CONSIDERED};
    private static final String[] STATUS_NOTES = {"viewed", "in review", "being considered"};
    private static final Pattern LI_JOB_ID = Pattern.compile("linkedin\\.com/(?:comm/)?jobs/view/(\\d+)", FLAGS);

    // Generic subjects
    private static final Pattern CONFIRMATION_SUBJECT = Pattern.compile(
            "application received|application (is )?complete|received your application"
                    + "|thank you for (your )?appl(y|ication|ying)|we have received your application"
                    + "|we received your application", FLAGS);
    private static final Pattern UPDATE_SUBJECT = Pattern.compile(
            "update|status|thank you for your interest|unfortunately|not moving forward|decision|interview|offer"
                    + "|your application", FLAGS);

    // Decisions, checked in this order
    private static final Pattern REJECTION = Pattern.compile(
            "unfortunately|not (a )?match|not (be )?moving forward|other candidates|regret to inform"
                    + "|decided not to proceed|no longer under consideration", FLAGS);
    private static final Pattern OFFER = Pattern.compile(
            "pleased to offer|offer letter|extend (you )?an offer|offer of employment", FLAGS);
    private static final Pattern PHONE_SCREEN = Pattern.compile(
            "phone screen|phone call|quick call|introductory call|recruiter call", FLAGS);
    private static final Pattern INTERVIEW = Pattern.compile(
            "invite you (to|for) an? interview|schedule an? interview|interview with|next round|would like to interview",
            FLAGS);
    private static final Pattern INTEREST_ONLY = Pattern.compile("thank you for your interest", FLAGS);

    // Titles
    private static final List<Pattern> TITLE_PATTERNS = List.of(
            Pattern.compile("application (?:received|complete)\\s*[:\\-]\\s*(.+)$", FLAGS),
            Pattern.compile("application for (?:the )?(.+?) (?:position|role|opening)", FLAGS),
            Pattern.compile("for the (.+?) (?:position|role|opening)", FLAGS),
            Pattern.compile("applying (?:for|to) (?:the )?(.+?) (?:position|role|opening)", FLAGS),
            Pattern.compile("(?:position|role) of (.+?)(?: at |[.,!\\n]|$)", FLAGS),
            Pattern.compile("application for (.+?)(?: at |[.,!\\n]|$)", FLAGS));

    // Companies
    private static final List<Pattern> COMPANY_PATTERNS = List.of(
            Pattern.compile("(?:position|role|opening|job|career) (?:at|with) ([A-Z][\\w&.'\\- ]{0,60}?)(?:[.,!:;\\n]| -|$)"),
            Pattern.compile("(?:interest in|applying to|joining) ([A-Z][\\w&.'\\- ]{0,60}?)(?:[.,!:;\\n]| -|$)"),
            Pattern.compile("(?:team|recruiting team) at ([A-Z][\\w&.'\\- ]{0,60}?)(?:[.,!:;\\n]| -|$)"));

    private static final Pattern DISPLAY_NAME = Pattern.compile("^\\s*\"?([^\"<]*?)\"?\\s*<([^>]+)>\\s*$");
    private static final Pattern SENDER_NOISE = Pattern.compile(
            "\\b(careers?|recruiting|recruitment|talent( acquisition)?|jobs|hiring|hr|team|no-?reply|do.not.reply"
                    + "|notifications?|via \\w+|people)\\b", FLAGS);

    private static final Set<String> FREE_MAIL = Set.of(
            "gmail", "googlemail", "hotmail", "outlook", "yahoo", "aol", "icloud", "protonmail", "live", "me");
    private static final Set<String> ATS_DOMAINS = Set.of(
            "linkedin", "greenhouse", "lever", "hire", "myworkday", "workday", "icims", "smartrecruiters",
            "clearcompany", "jobvite", "ashbyhq", "bamboohr", "workablemail", "workable");
    private static final Set<String> SECOND_LEVEL = Set.of("co", "com", "org", "net", "ac", "gov");

    @Override
    public Optional<CandidateItem> classify(RawMessage message) {
        try {
            return Optional.ofNullable(classifyOrNull(message));
        } catch (ClassificationException e) {
            log.debug("Discarding message {}: {}", message.messageId(), e.getMessage());
            return Optional.empty();
        }
    }

    private CandidateItem classifyOrNull(RawMessage m) throws ClassificationException {
        String subject = m.subject() != null ? m.subject().trim() : "";
        String from = m.from() != null ? m.from() : "";
        Document doc = m.htmlBody() != null ? Jsoup.parse(m.htmlBody()) : null;
        String body = bodyText(m, doc);

        if (from.toLowerCase(Locale.ROOT).contains("@linkedin.com")) {
            return classifyLinkedIn(m, subject, body, doc);
        }
        if (CONFIRMATION_SUBJECT.matcher(subject).find()) {
            Instant at = requireDate(m);
            String title = require(extractTitle(subject, body), "job title");
            String company = require(extractCompany(from, subject, body), "company");
            return CandidateItem.application(title, company, null, at, null, findWebsite(body, doc),
                    m.messageId(), m.folder());
        }
        if (UPDATE_SUBJECT.matcher(subject).find()) {
            Optional<ResponseStatus> decision = decision(body);
            if (decision.isEmpty()) return null;
            Instant at = requireDate(m);
            String title = require(extractTitle(subject, body), "job title");
            String company = require(extractCompany(from, subject, body), "company");
            return CandidateItem.response(title, company, at, decision.get(), null, null, m.messageId(), m.folder());
        }
        return null;
    }

    private CandidateItem classifyLinkedIn(RawMessage m, String subject, String body, Document doc)
            throws ClassificationException {
        String jobId = linkedInJobId(body, doc);
        String website = jobId != null ? "https://www.linkedin.com/jobs/view/" + jobId + "/" : null;

        Matcher sent = LI_SENT_TITLE_AT.matcher(subject);
        Matcher sentCompanyOnly = LI_SENT.matcher(subject);
        if (sent.find()) {
            return CandidateItem.application(clean(sent.group(1)), clean(sent.group(2)), null, requireDate(m),
                    jobId, website, m.messageId(), m.folder());
        }
        if (sentCompanyOnly.find()) {
            String company = clean(sentCompanyOnly.group(1));
            String title = require(linkedInTitle(doc, company), "job title");
            return CandidateItem.application(title, company, linkedInLocation(doc), requireDate(m),
                    jobId, website, m.messageId(), m.folder());
        }

        for (int i = 0; i < STATUS_PATTERNS.length; i++) {
            Matcher sm = STATUS_PATTERNS[i].matcher(subject);
            if (sm.find()) {
                String company = clean(sm.group(1));
                String title = require(linkedInTitle(doc, company), "job title");
                return CandidateItem.statusUpdate(title, company, requireDate(m), STATUS_NOTES[i],
                        jobId, website, m.messageId(), m.folder());
            }
        }

        if (LI_RESPONSE.matcher(subject).find()) {
            Optional<ResponseStatus> decision = decision(body);
            if (decision.isEmpty()) return null;
            String title;
            String company;
            Matcher rm = LI_RESPONSE_TITLE_AT.matcher(subject);
            if (rm.find()) {
                title = clean(rm.group(1));
                company = clean(rm.group(2));
            } else {
                company = require(extractCompany("", subject, body), "company");
                title = require(linkedInTitle(doc, company), "job title");
            }
            return CandidateItem.response(title, company, requireDate(m), decision.get(), jobId, website,
                    m.messageId(), m.folder());
        }
        return null;
    }

    static Optional<ResponseStatus> decision(String body) {
        if (body == null || body.isBlank()) return Optional.empty();
        if (OFFER.matcher(body).find()) return Optional.of(ResponseStatus.OFFER);
        if (REJECTION.matcher(body).find()) return Optional.of(ResponseStatus.REJECTED);
        if (PHONE_SCREEN.matcher(body).find()) return Optional.of(ResponseStatus.PHONE_SCREEN);
        if (INTERVIEW.matcher(body).find()) return Optional.of(ResponseStatus.INTERVIEW);
        if (INTEREST_ONLY.matcher(body).find()) return Optional.of(ResponseStatus.REJECTED);
        return Optional.empty();
    }

    static String extractTitle(String subject, String body) {
        for (String source : new String[]{subject, body}) {
            if (source == null) continue;
            for (Pattern p : TITLE_PATTERNS) {
                Matcher tm = p.matcher(source);
                if (tm.find()) {
                    String t = clean(tm.group(1));
                    if (t != null && t.length() >= 2 && t.length() <= 100) return t;
                }
            }
        }
        return null;
    }

    static String extractCompany(String from, String subject, String body) {
        for (String source : new String[]{subject, body}) {
            if (source == null) continue;
            for (Pattern p : COMPANY_PATTERNS) {
                Matcher cm = p.matcher(source);
                if (cm.find()) {
                    String c = clean(cm.group(1));
                    if (c != null && c.length() >= 2) return c;
                }
            }
        }
        Matcher dm = DISPLAY_NAME.matcher(from);
        String address = from;
        if (dm.matches()) {
            String name = clean(SENDER_NOISE.matcher(dm.group(1)).replaceAll(" "));
            if (name != null && name.length() >= 2) return name;
            address = dm.group(2);
        }
        return companyFromDomain(address);
    }

    static String companyFromDomain(String address) {
        int at = address.lastIndexOf('@');
        if (at < 0) return null;
        String[] labels = address.substring(at + 1).trim().toLowerCase(Locale.ROOT).split("\\.");
        if (labels.length < 2) return null;
        int idx = labels.length - 2;
        if (SECOND_LEVEL.contains(labels[idx]) && labels.length >= 3) idx--;
        String label = labels[idx];
        if (FREE_MAIL.contains(label) || ATS_DOMAINS.contains(label) || label.isBlank()) return null;
        return Character.toUpperCase(label.charAt(0)) + label.substring(1);
    }

    private static String linkedInJobId(String body, Document doc) {
        if (doc != null) {
            for (Element a : doc.select("a[href*=/jobs/view/]")) {
                Matcher jm = LI_JOB_ID.matcher(a.attr("href"));
                if (jm.find()) return jm.group(1);
            }
        }
        if (body != null) {
            Matcher jm = LI_JOB_ID.matcher(body);
            if (jm.find()) return jm.group(1);
        }
        return null;
    }

    private static String linkedInTitle(Document doc, String company) {
        if (doc == null) return null;
        for (Element a : doc.select("a[href*=/jobs/view/]")) {
            String t = stripCompany(a.text(), company);
            if (t != null && t.length() > 3) return t;
        }
        for (Element h : doc.select("h1, h2, h3, .job-title, .position-title")) {
            String text = h.text();
            if (text.length() > 5 && text.length() < 100 && !text.contains("LinkedIn") && !text.contains("Application")) {
                return stripCompany(text, company);
            }
        }
        return null;
    }

    private static String linkedInLocation(Document doc) {
        if (doc == null) return null;
        for (Element a : doc.select("a[href*=/jobs/view/]")) {
            String text = a.text();
            int dot = text.indexOf('·');
            if (dot >= 0) return clean(text.substring(dot + 1));
        }
        return null;
    }

    private static String stripCompany(String text, String company) {
        String t = text;
        if (company != null) {
            int idx = t.toLowerCase(Locale.ROOT).indexOf(company.toLowerCase(Locale.ROOT));
            if (idx > 0) t = t.substring(0, idx);
        }
        t = t.replaceAll("\\s*·.*$", "")
                .replaceAll("\\s*\\(\\s*Remote\\s*\\)\\s*$", "")
                .replaceAll("\\s+at\\s*$", "");
        return clean(t);
    }

    private static String findWebsite(String body, Document doc) {
        String jobId = linkedInJobId(body, doc);
        if (jobId != null) return "https://www.linkedin.com/jobs/view/" + jobId + "/";
        return null;
    }

    private static String bodyText(RawMessage m, Document doc) {
        if (m.textBody() != null && !m.textBody().isBlank()) return m.textBody();
        return doc != null ? doc.text() : "";
    }

    private static Instant requireDate(RawMessage m) throws ClassificationException {
        if (m.receivedAt() == null) throw new ClassificationException("message has no date");
        return m.receivedAt();
    }

    private static String require(String value, String what) throws ClassificationException {
        if (value == null || value.isBlank()) throw new ClassificationException("no " + what + " found");
        return value;
    }

    private static String clean(String s) {
        if (s == null) return null;
        String t = s.replaceAll("\\s+", " ").trim();
        t = t.replaceAll("^[\\s\"'“”:\\-]+|[\\s\"'“”.!,:\\-]+$", "");
        return t.isEmpty() ? null : t;
    }
}
