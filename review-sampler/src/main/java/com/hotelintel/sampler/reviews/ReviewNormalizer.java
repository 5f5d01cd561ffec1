package com.hotelintel.sampler.reviews;

import org.jsoup.Jsoup;

import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Text helpers for scraped review and listing fields.
 */
public final class ReviewNormalizer {

    private static final Pattern LEFTOVER_ENTITY = Pattern.compile("&[a-zA-Z]+;|&#\\d+;");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final Pattern HASH_TAG = Pattern.compile("#([^\\s#,，]+)");
    private static final Pattern PERCENT = Pattern.compile("(\\d+(?:\\.\\d+)?)%");
    private static final Pattern DATE = Pattern.compile("(\\d{4}-\\d{2}-\\d{2})\\s*(\\d{2}:\\d{2})?");
    private static final Pattern DIGITS = Pattern.compile("(\\d+)");
    private static final Pattern DECIMAL = Pattern.compile("(\\d+(?:\\.\\d+)?)");
    private static final DateTimeFormatter DATE_TIME = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm");

    /** Phrases the site renders as plain text rather than as #tags */
    static final List<String> COMMON_TAGS = List.of(
            "交通便利", "位置好", "服务热情", "干净卫生", "设施齐全",
            "早餐丰盛", "性价比高", "安静舒适", "停车方便", "环境优雅",
            "前台热情", "住宿舒适", "吃饭方便", "体验感强", "设施很好");

    private ReviewNormalizer() {
    }

    /**
     * Strips markup and entities, collapses whitespace and trims surrounding quotes.
     * Returns an empty string for null input.
     */
    public static String cleanText(String raw) {
        if (raw == null || raw.isBlank()) return "";
        String text = Jsoup.parse(raw).text();
        text = LEFTOVER_ENTITY.matcher(text).replaceAll("");
        text = WHITESPACE.matcher(text).replaceAll(" ").strip();
        return stripQuotes(text);
    }

    /** Hashtags plus known phrases, in first-seen order, without duplicates. */
    public static List<String> extractTags(String text) {
        if (text == null || text.isBlank()) return new ArrayList<>();
        Set<String> tags = new LinkedHashSet<>();
        Matcher m = HASH_TAG.matcher(text);
        while (m.find()) {
            tags.add(m.group(1));
        }
        for (String phrase : COMMON_TAGS) {
            if (text.contains(phrase)) tags.add(phrase);
        }
        return new ArrayList<>(tags);
    }

    /**
     * Star bar width to a 5-point score: "width:80%" → 4.0.
     *
     * @return null when the style carries no percentage
     */
    public static Double parseStarScore(String style) {
        if (style == null) return null;
        Matcher m = PERCENT.matcher(style);
        if (!m.find()) return null;
        double score = Double.parseDouble(m.group(1)) / 100 * 5;
        return round1(score);
    }

    /** "[2026-01-11 20:34]" → 2026-01-11T20:34; a missing time means midnight. */
    public static LocalDateTime parseDate(String text) {
        if (text == null) return null;
        Matcher m = DATE.matcher(text);
        if (!m.find()) return null;
        String time = m.group(2) != null ? m.group(2) : "00:00";
        try {
            return LocalDateTime.parse(m.group(1) + " " + time, DATE_TIME);
        } catch (DateTimeParseException e) {
            // Shaped like a date but out of range, e.g. month 13
            return null;
        }
    }

    /**
     * First run of digits, thousands separators ignored: "¥857起" → 857, "1,234条" → 1234.
     * Null when there are none or they overflow an int.
     */
    public static Integer extractInt(String text) {
        if (text == null) return null;
        Matcher m = DIGITS.matcher(text.replace(",", ""));
        if (!m.find()) return null;
        try {
            return Integer.valueOf(m.group(1));
        } catch (NumberFormatException e) {
            return null;
        }
    }

    public static Double extractDecimal(String text) {
        if (text == null) return null;
        Matcher m = DECIMAL.matcher(text);
        return m.find() ? Double.valueOf(m.group(1)) : null;
    }

    /** Mean of the non-null scores, one decimal; null when none are present. */
    public static Double mean(Double... scores) {
        double sum = 0;
        int n = 0;
        for (Double s : scores) {
            if (s != null) {
                sum += s;
                n++;
            }
        }
        return n == 0 ? null : round1(sum / n);
    }

    private static double round1(double value) {
        return Math.round(value * 10) / 10.0;
    }

    private static String stripQuotes(String text) {
        int start = 0;
        int end = text.length();
        while (start < end && isQuote(text.charAt(start))) start++;
        while (end > start && isQuote(text.charAt(end - 1))) end--;
        return text.substring(start, end);
    }

    private static boolean isQuote(char c) {
        return c == '"' || c == '“' || c == '”';
    }
}
