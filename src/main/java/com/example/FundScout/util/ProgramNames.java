package com.example.FundScout.util;

import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Program naming and identity helpers shared by merging, backfill and follow-up matching.
 */
public final class ProgramNames {

    private ProgramNames() {
    }

    /** Catalog/metadata keys that may carry a program name, in priority order. */
    public static final List<String> NAME_KEYS = List.of(
            "name", "title", "program", "call", "call_title", "funding_title", "display_name"
    );

    private static final List<String> ACRONYMS = List.of("AI", "R&D", "EU", "BMBF", "EFRE", "ERDF", "SME", "ML", "KI");

    private static final Pattern SLUG = Pattern.compile("[a-z0-9\\-._%]+");
    private static final Pattern PAGE_SUFFIX = Pattern.compile("\\.(html?|php)$", Pattern.CASE_INSENSITIVE);
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    /**
     * First present raw name from a metadata/catalog row, without slug clean-up.
     */
    public static Optional<String> fusedRawName(Map<String, String> row) {
        for (String key : NAME_KEYS) {
            Optional<String> value = FieldPresence.present(row.get(key));
            if (value.isPresent()) {
                return value;
            }
        }
        return Optional.empty();
    }

    /**
     * Human-readable program name: first present candidate, otherwise the URL slug,
     * otherwise "Unnamed". Slug-looking candidates are de-slugged and title-cased.
     */
    public static String displayName(String url, String... candidates) {
        for (String candidate : candidates) {
            Optional<String> value = FieldPresence.present(candidate);
            if (value.isPresent()) {
                return normalizeTitle(value.get());
            }
        }
        String trimmedUrl = url == null ? "" : url.trim();
        if (!trimmedUrl.isEmpty()) {
            String stripped = stripTrailingSlashes(trimmedUrl);
            String slug = stripped.substring(stripped.lastIndexOf('/') + 1);
            String title = normalizeTitle(slug);
            return title.isEmpty() ? "Unnamed" : title;
        }
        return "Unnamed";
    }

    /**
     * Turns slug-like strings ("ki-innovation_foerderung.html") into titles
     * ("KI Innovation Foerderung"); leaves ordinary titles untouched.
     */
    public static String normalizeTitle(String candidate) {
        String s = candidate == null ? "" : candidate.trim();
        if (s.isEmpty()) {
            return "";
        }
        String lower = s.toLowerCase(Locale.ROOT);
        boolean pageLike = lower.endsWith(".html") || lower.endsWith(".htm") || lower.endsWith(".php");
        if (!pageLike && !SLUG.matcher(lower).matches()) {
            return s;
        }
        s = PAGE_SUFFIX.matcher(s).replaceAll("");
        s = s.replace('-', ' ').replace('_', ' ');
        s = urlDecode(s);
        s = WHITESPACE.matcher(s).replaceAll(" ").trim();
        return fixAcronyms(titleCase(s));
    }

    /** Lowercased, whitespace-collapsed display name. */
    public static String normalizedName(String url, String... candidates) {
        return WHITESPACE.matcher(displayName(url, candidates).toLowerCase(Locale.ROOT)).replaceAll(" ").trim();
    }

    /** Trimmed, lowercased URL without trailing slashes; empty string when absent. */
    public static String normalizeUrl(String url) {
        if (FieldPresence.isMissing(url)) {
            return "";
        }
        return stripTrailingSlashes(url.trim()).toLowerCase(Locale.ROOT);
    }

    /**
     * Canonical identity of a program: normalized URL when present, otherwise
     * "name:" + normalized fused name.
     */
    public static String dedupeKey(String url, String... nameCandidates) {
        String normalizedUrl = normalizeUrl(url);
        if (!normalizedUrl.isEmpty()) {
            return normalizedUrl;
        }
        return "name:" + normalizedName(null, nameCandidates);
    }

    private static String urlDecode(String s) {
        try {
            return URLDecoder.decode(s.replace("+", "%2B"), StandardCharsets.UTF_8);
        } catch (IllegalArgumentException e) {
            return s;
        }
    }

    private static String stripTrailingSlashes(String value) {
        String s = value;
        while (s.endsWith("/")) {
            s = s.substring(0, s.length() - 1);
        }
        return s;
    }

    private static String titleCase(String s) {
        return Arrays.stream(s.split(" "))
                .filter(w -> !w.isEmpty())
                .map(w -> Character.toUpperCase(w.charAt(0)) + w.substring(1).toLowerCase(Locale.ROOT))
                .collect(Collectors.joining(" "));
    }

    private static String fixAcronyms(String s) {
        String out = s;
        for (String acronym : ACRONYMS) {
            String titled = acronym.charAt(0) + acronym.substring(1).toLowerCase(Locale.ROOT);
            out = out.replaceAll("\\b" + Pattern.quote(titled) + "\\b", Matcher.quoteReplacement(acronym));
        }
        return out;
    }
}
