package me.toymail.jobsync.enrich;

import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reads pay ranges such as "$120,000.00/yr - $163,000.00/yr", "$120-130K", "$120K - $130K", "$130K" or
 * "$25 - $35 an hour".
 */
public final class SalaryParser {
    public record Salary(double min, double max, String wageType) {}

    private static final Pattern STRUCTURED = Pattern.compile("\\$([0-9][0-9,]*(?:\\.[0-9]+)?)(?:/\\w+)?\\s*[-–]\\s*\\$([0-9][0-9,]*(?:\\.[0-9]+)?)(?:/\\w+)?");
    private static final Pattern K_RANGE = Pattern.compile("\\$(\\d+(?:\\.\\d+)?)K?\\s*[-–]\\s*\\$?(\\d+(?:\\.\\d+)?)\\s*K", Pattern.CASE_INSENSITIVE);
    private static final Pattern SINGLE_K = Pattern.compile("\\$(\\d+(?:\\.\\d+)?)\\s*K", Pattern.CASE_INSENSITIVE);
    private static final Pattern SINGLE = Pattern.compile("\\$([0-9][0-9,]*(?:\\.[0-9]+)?)");

    private static final String AMOUNT =
            "\\d{1,3}(?:,\\d{3})*(?:\\.\\d{2})?K?(?:\\s*/\\s*(?:hour|year|month|week|yr|hr|mo|wk))?";
    static final Pattern IN_TEXT = Pattern.compile(
            "\\$" + AMOUNT + "(?:\\s*[-–]\\s*\\$?" + AMOUNT + ")?"
                    + "(?:\\s*(?:per|an?)\\s*(?:hour|year|month|week|yr|hr|mo|wk))?",
            Pattern.CASE_INSENSITIVE);

    private SalaryParser() {}

    public static Optional<Salary> parse(String text) {
        if (text == null || text.isBlank()) return Optional.empty();
        String type = wageType(text);

        Matcher m = STRUCTURED.matcher(text);
        if (m.find()) {
            return Optional.of(new Salary(num(m.group(1)), num(m.group(2)), type));
        }
        m = K_RANGE.matcher(text);
        if (m.find()) {
            return Optional.of(new Salary(num(m.group(1)) * 1000, num(m.group(2)) * 1000, type));
        }
        m = SINGLE_K.matcher(text);
        if (m.find()) {
            double v = num(m.group(1)) * 1000;
            return Optional.of(new Salary(v, v, type));
        }
        m = SINGLE.matcher(text);
        if (m.find()) {
            double v = num(m.group(1));
            return Optional.of(new Salary(v, v, type));
        }
        return Optional.empty();
    }

    /**
     * The longest salary-looking phrase in free text, if any.
     */
    public static Optional<String> findInText(String text) {
        if (text == null) return Optional.empty();
        Matcher m = IN_TEXT.matcher(text);
        String best = null;
        while (m.find()) {
            if (best == null || m.group().length() > best.length()) best = m.group();
        }
        return Optional.ofNullable(best);
    }

    static String wageType(String text) {
        String t = text.toLowerCase(Locale.ROOT);
        if (t.contains("hour") || t.contains("/hr")) return "Hourly";
        if (t.contains("month") || t.contains("/mo")) return "Monthly";
        if (t.contains("week") || t.contains("/wk")) return "Weekly";
        return "Yearly";
    }

    private static double num(String s) {
        return Double.parseDouble(s.replace(",", ""));
    }
}
