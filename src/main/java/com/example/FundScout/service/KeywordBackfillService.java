package com.example.FundScout.service;

import com.example.FundScout.config.FundingProperties;
import com.example.FundScout.model.FundingProgram;
import com.example.FundScout.repository.FundingCatalog;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Literal token-overlap search over the canonical catalog. Recovers programs the
 * embedding space ranks poorly, e.g. exact acronyms.
 */
@Service
@RequiredArgsConstructor
public class KeywordBackfillService {

    private static final Logger log = LoggerFactory.getLogger(KeywordBackfillService.class);

    /** Columns concatenated into the searchable text of a row. */
    static final List<String> SEARCH_FIELDS = List.of(
            "name", "title", "program", "call", "description", "domain", "eligibility", "location"
    );

    static final int DOMAIN_BONUS = 2;

    private final FundingCatalog catalog;
    private final FundingProperties properties;

    /**
     * Catalog programs sharing at least one token with the query, best overlap first
     * (ties keep catalog order), at most {@code funding.keyword-top-n}.
     */
    public List<FundingProgram> candidates(String query, String domainPreference) {
        if (catalog.isEmpty() || query == null || query.isBlank()) {
            return List.of();
        }
        Set<String> queryTokens = new LinkedHashSet<>(RelevanceScorer.tokens(query));
        Set<String> domainTokens = new LinkedHashSet<>(RelevanceScorer.tokens(domainPreference));

        List<KeywordHit> hits = new ArrayList<>();
        for (Map<String, String> row : catalog.rows()) {
            int score = score(row, queryTokens, domainTokens);
            if (score > 0) {
                hits.add(new KeywordHit(row, score));
            }
        }
        hits.sort(Comparator.comparingInt(KeywordHit::score).reversed());

        List<FundingProgram> out = hits.stream()
                .limit(Math.max(0, properties.getKeywordTopN()))
                .map(hit -> FundingProgram.fromAttributes(hit.row()))
                .collect(Collectors.toList());
        log.debug("Keyword backfill: {} catalog hits, returning {}", hits.size(), out.size());
        return out;
    }

    static int score(Map<String, String> row, Set<String> queryTokens, Set<String> domainTokens) {
        String haystack = SEARCH_FIELDS.stream()
                .map(row::get)
                .map(v -> v == null ? "" : v.toLowerCase(Locale.ROOT))
                .collect(Collectors.joining(" "));
        int score = (int) queryTokens.stream().filter(haystack::contains).count();
        if (!domainTokens.isEmpty() && domainTokens.stream().anyMatch(haystack::contains)) {
            score += DOMAIN_BONUS;
        }
        return score;
    }

    private record KeywordHit(Map<String, String> row, int score) { }
}
