package com.spa.aggregator.product.parse;

import java.time.DateTimeException;
import java.time.LocalDate;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

public final class TextUtils {
    private static final int EXCERPT_MAX_LENGTH = 200;
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final Pattern FIRST_NUMBER = Pattern.compile("([0-9]+(?:\\.[0-9]+)?)");
    private static final Pattern SWISS_DATE = Pattern.compile("(\\d{1,2})\\.(\\d{1,2})\\.(\\d{4})");
    private static final Pattern ISIN = Pattern.compile("\\b[A-Z]{2}[A-Z0-9]{9}[0-9]\\b");

    private TextUtils() {
    }

    public static String normalizeWhitespace(String text) {
        if (text == null) {
            return null;
        }
        return WHITESPACE.matcher(text).replaceAll(" ").trim();
    }

    public static String truncateExcerpt(String text) {
        String normalized = normalizeWhitespace(text);
        if (normalized == null || normalized.length() <= EXCERPT_MAX_LENGTH) {
            return normalized;
        }
        return normalized.substring(0, EXCERPT_MAX_LENGTH - 3) + "...";
    }

    /**
     * Parses the first number in a Swiss-formatted text such as {@code 1'234.56} or {@code 7,5 %}.
     */
    public static Double parseSwissNumber(String text) {
        if (text == null || text.isBlank()) {
            return null;
        }
        String cleaned = text.replace("'", "").replace("’", "").replace(",", ".");
        Matcher matcher = FIRST_NUMBER.matcher(cleaned);
        if (!matcher.find()) {
            return null;
        }
        try {
            return Double.parseDouble(matcher.group(1));
        } catch (NumberFormatException e) {
            return null;
        }
    }

    /**
     * Converts the first {@code DD.MM.YYYY} date in the text to ISO-8601, or returns {@code null}.
     */
    public static String swissDateToIso(String text) {
        if (text == null) {
            return null;
        }
        Matcher matcher = SWISS_DATE.matcher(text);
        if (!matcher.find()) {
            return null;
        }
        try {
            return LocalDate.of(
                Integer.parseInt(matcher.group(3)),
                Integer.parseInt(matcher.group(2)),
                Integer.parseInt(matcher.group(1))
            ).toString();
        } catch (DateTimeException e) {
            return null;
        }
    }

    public static String findIsin(String text) {
        if (text == null) {
            return null;
        }
        Matcher matcher = ISIN.matcher(text.toUpperCase(Locale.ROOT));
        return matcher.find() ? matcher.group() : null;
    }
}
