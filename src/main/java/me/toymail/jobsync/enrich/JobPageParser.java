package me.toymail.jobsync.enrich;

import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Extracts posting details with jsoup selectors. LinkedIn guest pages use the top card and
 * criteria list; other sites fall back to headings, description containers and text heuristics.
 */
public class JobPageParser {

    private static final Map<Pattern, String> EMPLOYMENT_TYPES = new LinkedHashMap<>();
    private static final Pattern ON_SITE = Pattern.compile("\\b(on-?site|in[- ]office)\\b");

    static {
        EMPLOYMENT_TYPES.put(Pattern.compile("\\bfull[- ]time\\b"), "Full-time");
        EMPLOYMENT_TYPES.put(Pattern.compile("\\bpart[- ]time\\b"), "Part-time");
        EMPLOYMENT_TYPES.put(Pattern.compile("\\b(contract|contractor|temporary)\\b"), "Contract");
        EMPLOYMENT_TYPES.put(Pattern.compile("\\b(internship|intern)\\b"), "Internship");
    }

    public EnrichmentData parse(String sourceUrl, String html) throws EnrichmentFetchException {
        if (html == null || html.isBlank()) throw new EnrichmentFetchException("Empty page from " + sourceUrl);
        Document doc = Jsoup.parse(html, sourceUrl);
        EnrichmentData data = LinkedInUrls.isLinkedIn(sourceUrl) ? parseLinkedIn(sourceUrl, doc) : parseGeneric(doc);
        if (data.description() == null && data.jobTitle() == null) {
            throw new EnrichmentFetchException("No job details found at " + sourceUrl);
        }
        return data;
    }

    EnrichmentData parseLinkedIn(String sourceUrl, Document doc) {
        String title = cleanTitle(first(doc, ".top-card-layout__title", ".topcard__title"));
        String company = first(doc, ".topcard__org-name-link", ".top-card-layout__entity-info a");
        String location = first(doc, ".topcard__flavor--bullet");
        String description = first(doc, ".description__text--rich", ".show-more-less-html__markup", ".description__text");

        String employmentType = null;
        String salaryText = null;
        for (Element item : doc.select(".description__job-criteria-item")) {
            String header = normalizeText(item.select(".description__job-criteria-subheader").text()).toLowerCase(Locale.ROOT);
            String value = normalizeText(item.select(".description__job-criteria-text").text());
            if (header.equals("employment type")) employmentType = value;
            if (header.contains("salary") || header.contains("compensation")) salaryText = value;
        }
        if (salaryText == null) {
            String range = first(doc, ".salary.compensation__salary", ".compensation__salary-range");
            if (range != null) salaryText = range;
        }
        if (salaryText == null) salaryText = SalaryParser.findInText(description).orElse(null);

        return build(title, company, location, description, employmentType, salaryText,
                LinkedInUrls.jobId(sourceUrl).orElse(null));
    }

    EnrichmentData parseGeneric(Document doc) {
        doc.select("script, style, nav, footer, aside").remove();
        String title = first(doc, "h1");
        if (title == null) {
            Element og = doc.selectFirst("meta[property=og:title]");
            if (og != null) title = normalizeText(og.attr("content"));
        }
        String description = first(doc, "#job-description", ".job-description", "[class*=description]",
                "[itemprop=description]", "article", "main");
        String body = doc.body() != null ? normalizeText(doc.body().text()) : "";
        String salaryText = SalaryParser.findInText(description != null ? description : body).orElse(null);
        return build(cleanTitle(title), null, null, description, employmentTypeIn(body), salaryText, null);
    }

    private static EnrichmentData build(String title, String company, String location, String description,
                                        String employmentType, String salaryText, String externalJobId) {
        Double min = null;
        Double max = null;
        String wageType = null;
        Optional<SalaryParser.Salary> salary = SalaryParser.parse(salaryText);
        if (salary.isPresent()) {
            min = salary.get().min();
            max = salary.get().max();
            wageType = salary.get().wageType();
        }
        String haystack = ((location != null ? location : "") + " " + (description != null ? description : ""));
        return new EnrichmentData(title, company, location, description,
                normalizeEmploymentType(employmentType != null ? employmentType : employmentTypeIn(description)),
                locationTypeIn(haystack), min, max, wageType, externalJobId);
    }

    static String normalizeEmploymentType(String raw) {
        if (raw == null || raw.isBlank()) return null;
        String known = employmentTypeIn(raw);
        return known != null ? known : raw.trim();
    }

    static String employmentTypeIn(String text) {
        if (text == null) return null;
        String t = text.toLowerCase(Locale.ROOT);
        for (Map.Entry<Pattern, String> e : EMPLOYMENT_TYPES.entrySet()) {
            if (e.getKey().matcher(t).find()) return e.getValue();
        }
        return null;
    }

    static String locationTypeIn(String text) {
        String t = text.toLowerCase(Locale.ROOT);
        if (t.contains("hybrid")) return "Hybrid";
        if (t.contains("remote")) return "Remote";
        if (ON_SITE.matcher(t).find()) return "On-site";
        return null;
    }

    static String cleanTitle(String title) {
        if (title == null) return null;
        String t = title;
        t = t.replaceAll("\\s*·\\s*.+$", "")
                .replaceAll("\\s*\\(\\s*Remote\\s*\\)\\s*$", "")
                .replaceAll("\\s*-\\s*Remote\\s*$", "")
                .replaceAll("\\s{2,}", " ")
                .trim();
        return t.isEmpty() ? null : t;
    }

    private static String first(Document doc, String... selectors) {
        for (String css : selectors) {
            Element el = doc.selectFirst(css);
            if (el != null) {
                String text = normalizeText(el.text());
                if (!text.isEmpty()) return text;
            }
        }
        return null;
    }

    private static String normalizeText(String text) {
        if (text == null || text.isBlank()) return "";
        return text.replaceAll("\\s+", " ").trim();
    }
}
