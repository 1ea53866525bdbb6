package com.example.FundScout.service;

import com.example.FundScout.model.FundingProgram;
import com.example.FundScout.model.SearchCriteria;
import com.example.FundScout.repository.FundingCatalog;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Keyword search restricted to catalog rows whose {@code source} column names this source.
 */
public class CatalogFundingSource implements FundingSource {

    private final String name;
    private final FundingCatalog catalog;

    public CatalogFundingSource(String name, FundingCatalog catalog) {
        this.name = name;
        this.catalog = catalog;
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public List<FundingProgram> search(SearchCriteria criteria, int limit) {
        String sourceKey = name.toLowerCase(Locale.ROOT);
        Set<String> queryTokens = new LinkedHashSet<>(RelevanceScorer.tokens(criteria.query()));
        Set<String> domainTokens = new LinkedHashSet<>(RelevanceScorer.tokens(criteria.targetDomain()));

        List<Map.Entry<Map<String, String>, Integer>> hits = new ArrayList<>();
        for (Map<String, String> row : catalog.rows()) {
            String source = row.get(FundingProgram.SOURCE);
            if (source == null || !source.toLowerCase(Locale.ROOT).contains(sourceKey)) {
                continue;
            }
            int score = KeywordBackfillService.score(row, queryTokens, domainTokens);
            if (score > 0) {
                hits.add(Map.entry(row, score));
            }
        }
        hits.sort(Map.Entry.<Map<String, String>, Integer>comparingByValue(Comparator.reverseOrder()));
        return hits.stream()
                .limit(Math.max(0, limit))
                .map(hit -> FundingProgram.fromAttributes(hit.getKey()))
                .collect(Collectors.toList());
    }
}
