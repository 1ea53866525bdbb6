package com.example.FundScout.util;

import java.util.Locale;
import java.util.Optional;
import java.util.Set;

/**
 * Single definition of "this field carries no usable value".
 * Used by field backfill, keyword scoring and card rendering alike.
 */
public final class FieldPresence {

    private FieldPresence() {
    }

    /** Whole-value sentinels, compared after trim + lowercase. */
    private static final Set<String> MISSING_SENTINELS = Set.of(
            "n/a", "na", "null", "nan", "none", "not specified"
    );

    /**
     * Substrings that mark a value as missing even when prefixed with a field name,
     * e.g. "deadline information not found".
     */
    private static final String[] MISSING_SUBSTRINGS = {
            "information not found",
            "not available",
            "no information",
            "tbd",
            "to be determined",
            "unknown"
    };

    public static boolean isMissing(String value) {
        if (value == null) {
            return true;
        }
        String trimmed = value.trim();
        if (trimmed.isEmpty()) {
            return true;
        }
        String lower = trimmed.toLowerCase(Locale.ROOT);
        if (MISSING_SENTINELS.contains(lower)) {
            return true;
        }
        for (String marker : MISSING_SUBSTRINGS) {
            if (lower.contains(marker)) {
                return true;
            }
        }
        return false;
    }

    public static boolean isPresent(String value) {
        return !isMissing(value);
    }

    /**
     * Trimmed value when present, otherwise empty.
     */
    public static Optional<String> present(String value) {
        return isMissing(value) ? Optional.empty() : Optional.of(value.trim());
    }

    /**
     * First present value among the candidates.
     */
    public static Optional<String> firstPresent(String... values) {
        for (String value : values) {
            Optional<String> p = present(value);
            if (p.isPresent()) {
                return p;
            }
        }
        return Optional.empty();
    }

    public static String orDefault(String value, String fallback) {
        return present(value).orElse(fallback);
    }
}
