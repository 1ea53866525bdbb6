package com.example.FundScout.util;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Locale;
import java.util.OptionalLong;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Extracts a numeric funding amount from free text such as
 * "Grant up to €120,000", "bis zu 50.000 EUR" or "€1.5M per project".
 * The last number found wins ("€50K - €600K" yields 600000).
 */
public final class AmountParser {

    private AmountParser() {
    }

    /**
     * Either a grouped integer with optional cents (120,000 / 120,000.00 / 1.000.000,00 / 50 000)
     * or a plain number with an optional decimal part, followed by an optional magnitude suffix.
     */
    private static final Pattern AMOUNT = Pattern.compile(
            "(\\d{1,3}(?:[.,\\u00A0 ]\\d{3})+(?:[.,]\\d{1,2})?(?!\\d)|\\d+(?:[.,]\\d+)?)"
                    + "(?:\\s*(mio|million(?:en)?|mrd|thousand|tsd|k|m)\\b)?",
            Pattern.CASE_INSENSITIVE
    );

    /** Splits a grouped match into its whole part and its cents. */
    private static final Pattern GROUPED = Pattern.compile(
            "(\\d{1,3}(?:[.,\\u00A0 ]\\d{3})+)(?:[.,](\\d{1,2}))?");

    public static OptionalLong parse(String text) {
        if (text == null || text.isBlank()) {
            return OptionalLong.empty();
        }
        Matcher matcher = AMOUNT.matcher(text);
        Long last = null;
        while (matcher.find()) {
            Long value = toValue(matcher.group(1), matcher.group(2));
            if (value != null) {
                last = value;
            }
        }
        return last == null ? OptionalLong.empty() : OptionalLong.of(last);
    }

    private static Long toValue(String number, String suffix) {
        BigDecimal base;
        try {
            base = new BigDecimal(normalizeNumber(number));
        } catch (NumberFormatException e) {
            return null;
        }
        try {
            return base.multiply(multiplier(suffix)).setScale(0, RoundingMode.DOWN).longValueExact();
        } catch (ArithmeticException e) {
            // beyond the range of long
            return null;
        }
    }

    private static String normalizeNumber(String number) {
        Matcher grouped = GROUPED.matcher(number);
        if (grouped.matches()) {
            // grouped thousands: drop every separator, keep the cents behind a '.'
            String whole = grouped.group(1).replaceAll("[.,\\u00A0 ]", "");
            return grouped.group(2) == null ? whole : whole + "." + grouped.group(2);
        }
        return number.replace(',', '.');
    }

    private static BigDecimal multiplier(String suffix) {
        if (suffix == null) {
            return BigDecimal.ONE;
        }
        String s = suffix.toLowerCase(Locale.ROOT).replace(".", "");
        switch (s) {
            case "k":
            case "thousand":
            case "tsd":
                return BigDecimal.valueOf(1_000L);
            case "m":
            case "mio":
            case "million":
            case "millionen":
                return BigDecimal.valueOf(1_000_000L);
            case "mrd":
                return BigDecimal.valueOf(1_000_000_000L);
            default:
                return BigDecimal.ONE;
        }
    }
}
