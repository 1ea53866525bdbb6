package com.example.FundScout.util;

import java.time.DateTimeException;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.OffsetDateTime;
import java.time.YearMonth;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses heterogeneous deadline strings ("31.12.2025", "15 March 2026",
 * "Einreichung bis 1. Juni 2026", "2026-01-31T12:00:00Z", "deadline: 03/04/26")
 * into UTC timestamps.
 *
 * <ul>
 *   <li>Numeric dates are read day-first unless the day-first reading is impossible.</li>
 *   <li>Date-only values resolve to the end of that day, month-only values to the end of the month.</li>
 *   <li>Noise around the date is tolerated; when several dates appear, the latest one is the deadline.</li>
 *   <li>Anything unparseable yields {@link Optional#empty()}, never an exception.</li>
 * </ul>
 */
public final class DeadlineParser {

    private DeadlineParser() {
    }

    private static final LocalTime END_OF_DAY = LocalTime.of(23, 59, 59);

    private static final List<DateTimeFormatter> ISO_FORMATS = List.of(
            DateTimeFormatter.ISO_OFFSET_DATE_TIME,
            DateTimeFormatter.ISO_ZONED_DATE_TIME,
            DateTimeFormatter.ISO_LOCAL_DATE_TIME,
            DateTimeFormatter.ISO_LOCAL_DATE
    );

    private static final Map<String, Integer> MONTHS = buildMonths();

    private static final String MONTH_NAMES = "(january|february|march|april|may|june|july|august|september|october|november|december"
            + "|januar|februar|märz|maerz|mai|juni|juli|oktober|dezember"
            + "|jan|feb|mar|mär|apr|jun|jul|aug|sep|sept|oct|okt|nov|dec|dez)\\.?";

    private static final Pattern ISO_DATE = Pattern.compile(
            "(?<!\\d)(\\d{4})-(\\d{1,2})-(\\d{1,2})(?:[T ](\\d{1,2}):(\\d{2}))?(?!\\d)");

    private static final Pattern YEAR_FIRST_SLASHED = Pattern.compile(
            "(?<!\\d)(\\d{4})[./](\\d{1,2})[./](\\d{1,2})(?!\\d)");

    private static final Pattern NUMERIC_DATE = Pattern.compile(
            "(?<!\\d)(\\d{1,2})[./-](\\d{1,2})[./-](\\d{4}|\\d{2})(?![\\d.]\\d)");

    private static final Pattern DAY_MONTH_NAME_YEAR = Pattern.compile(
            "(?<!\\d)(\\d{1,2})(?:st|nd|rd|th)?\\.?\\s*(?:of\\s+)?" + MONTH_NAMES + ",?\\s*(\\d{4})(?!\\d)",
            Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE);

    private static final Pattern MONTH_NAME_DAY_YEAR = Pattern.compile(
            "\\b" + MONTH_NAMES + "\\s+(\\d{1,2})(?:st|nd|rd|th)?,?\\s+(\\d{4})(?!\\d)",
            Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE);

    private static final Pattern MONTH_NAME_YEAR = Pattern.compile(
            "\\b" + MONTH_NAMES + "\\s+(\\d{4})(?!\\d)",
            Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE);

    public static Optional<OffsetDateTime> parse(String raw) {
        if (FieldPresence.isMissing(raw)) {
            return Optional.empty();
        }
        String text = raw.trim();

        Optional<OffsetDateTime> strict = parseIso(text);
        if (strict.isPresent()) {
            return strict;
        }

        List<OffsetDateTime> found = new ArrayList<>();
        String lower = text.toLowerCase(Locale.ROOT);
        collectIsoDates(lower, found);
        collectYearFirst(lower, found);
        collectNumeric(lower, found);
        collectDayMonthNameYear(lower, found);
        collectMonthNameDayYear(lower, found);
        if (found.isEmpty()) {
            collectMonthNameYear(lower, found);
        }

        return found.stream().max(OffsetDateTime::compareTo);
    }

    /**
     * Whole days from {@code now} until {@code deadline}, floored, so any deadline
     * strictly in the past is negative.
     */
    public static long daysLeft(OffsetDateTime deadline, Instant now) {
        long seconds = Duration.between(now, deadline.toInstant()).getSeconds();
        return Math.floorDiv(seconds, 86_400L);
    }

    private static Optional<OffsetDateTime> parseIso(String text) {
        for (DateTimeFormatter fmt : ISO_FORMATS) {
            try {
                if (fmt == DateTimeFormatter.ISO_OFFSET_DATE_TIME) {
                    return Optional.of(OffsetDateTime.parse(text, fmt).withOffsetSameInstant(ZoneOffset.UTC));
                }
                if (fmt == DateTimeFormatter.ISO_ZONED_DATE_TIME) {
                    return Optional.of(ZonedDateTime.parse(text, fmt).toOffsetDateTime().withOffsetSameInstant(ZoneOffset.UTC));
                }
                if (fmt == DateTimeFormatter.ISO_LOCAL_DATE_TIME) {
                    return Optional.of(LocalDateTime.parse(text, fmt).atOffset(ZoneOffset.UTC));
                }
                return Optional.of(endOfDay(LocalDate.parse(text, fmt)));
            } catch (DateTimeParseException ignored) {
                // try the next format
            }
        }
        return Optional.empty();
    }

    private static void collectIsoDates(String text, List<OffsetDateTime> out) {
        Matcher m = ISO_DATE.matcher(text);
        while (m.find()) {
            LocalDate date = safeDate(toInt(m.group(1)), toInt(m.group(2)), toInt(m.group(3)));
            if (date == null) {
                continue;
            }
            if (m.group(4) != null) {
                int hour = toInt(m.group(4));
                int minute = toInt(m.group(5));
                if (hour < 24 && minute < 60) {
                    out.add(date.atTime(hour, minute).atOffset(ZoneOffset.UTC));
                    continue;
                }
            }
            out.add(endOfDay(date));
        }
    }

    private static void collectYearFirst(String text, List<OffsetDateTime> out) {
        Matcher m = YEAR_FIRST_SLASHED.matcher(text);
        while (m.find()) {
            addIfValid(out, safeDate(toInt(m.group(1)), toInt(m.group(2)), toInt(m.group(3))));
        }
    }

    private static void collectNumeric(String text, List<OffsetDateTime> out) {
        Matcher m = NUMERIC_DATE.matcher(text);
        while (m.find()) {
            int first = toInt(m.group(1));
            int second = toInt(m.group(2));
            int year = expandYear(toInt(m.group(3)));
            // day-first unless that reading is impossible
            LocalDate date = safeDate(year, second, first);
            if (date == null) {
                date = safeDate(year, first, second);
            }
            addIfValid(out, date);
        }
    }

    private static void collectDayMonthNameYear(String text, List<OffsetDateTime> out) {
        Matcher m = DAY_MONTH_NAME_YEAR.matcher(text);
        while (m.find()) {
            Integer month = monthOf(m.group(2));
            if (month != null) {
                addIfValid(out, safeDate(toInt(m.group(3)), month, toInt(m.group(1))));
            }
        }
    }

    private static void collectMonthNameDayYear(String text, List<OffsetDateTime> out) {
        Matcher m = MONTH_NAME_DAY_YEAR.matcher(text);
        while (m.find()) {
            Integer month = monthOf(m.group(1));
            if (month != null) {
                addIfValid(out, safeDate(toInt(m.group(3)), month, toInt(m.group(2))));
            }
        }
    }

    private static void collectMonthNameYear(String text, List<OffsetDateTime> out) {
        Matcher m = MONTH_NAME_YEAR.matcher(text);
        while (m.find()) {
            Integer month = monthOf(m.group(1));
            if (month == null) {
                continue;
            }
            try {
                addIfValid(out, YearMonth.of(toInt(m.group(2)), month).atEndOfMonth());
            } catch (DateTimeException ignored) {
                // not a real month; skip
            }
        }
    }

    private static void addIfValid(List<OffsetDateTime> out, LocalDate date) {
        if (date != null) {
            out.add(endOfDay(date));
        }
    }

    private static OffsetDateTime endOfDay(LocalDate date) {
        return date.atTime(END_OF_DAY).atOffset(ZoneOffset.UTC);
    }

    private static LocalDate safeDate(int year, int month, int day) {
        if (year < 1900 || year > 2200) {
            return null;
        }
        try {
            return LocalDate.of(year, month, day);
        } catch (DateTimeException e) {
            return null;
        }
    }

    private static int expandYear(int year) {
        return year < 100 ? 2000 + year : year;
    }

    private static int toInt(String digits) {
        return Integer.parseInt(digits);
    }

    private static Integer monthOf(String name) {
        String key = name.toLowerCase(Locale.ROOT).replace(".", "");
        return MONTHS.get(key);
    }

    private static Map<String, Integer> buildMonths() {
        Map<String, Integer> months = new HashMap<>();
        String[][] names = {
                {"january", "januar", "jan"},
                {"february", "februar", "feb"},
                {"march", "märz", "maerz", "mar", "mär"},
                {"april", "apr"},
                {"may", "mai"},
                {"june", "juni", "jun"},
                {"july", "juli", "jul"},
                {"august", "aug"},
                {"september", "sep", "sept"},
                {"october", "oktober", "oct", "okt"},
                {"november", "nov"},
                {"december", "dezember", "dec", "dez"}
        };
        for (int i = 0; i < names.length; i++) {
            for (String n : names[i]) {
                months.put(n, i + 1);
            }
        }
        return Map.copyOf(months);
    }
}
