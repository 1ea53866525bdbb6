package com.example.FundScout.repository;

import com.example.FundScout.model.FundingProgram;
import com.example.FundScout.util.ProgramNames;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Read-only canonical dataset of funding programs, keyed by the same column names
 * as the vector metadata. Indexed by normalized URL and normalized fused name.
 * Several rows may share one portal URL; such a URL only resolves together with the name.
 */
public class FundingCatalog {

    private final List<Map<String, String>> rows;
    private final Map<String, List<Map<String, String>>> byUrl;
    private final Map<String, Map<String, String>> byName;

    public FundingCatalog(List<Map<String, String>> rows) {
        List<Map<String, String>> copy = new ArrayList<>(rows.size());
        Map<String, List<Map<String, String>>> urlIndex = new HashMap<>();
        Map<String, Map<String, String>> nameIndex = new HashMap<>();

        for (Map<String, String> row : rows) {
            Map<String, String> frozen = Collections.unmodifiableMap(new LinkedHashMap<>(row));
            copy.add(frozen);

            String url = ProgramNames.normalizeUrl(frozen.get(FundingProgram.URL));
            if (!url.isEmpty()) {
                urlIndex.computeIfAbsent(url, k -> new ArrayList<>()).add(frozen);
            }
            ProgramNames.fusedRawName(frozen)
                    .map(raw -> ProgramNames.normalizedName(null, raw))
                    .ifPresent(name -> nameIndex.putIfAbsent(name, frozen));
        }
        this.rows = Collections.unmodifiableList(copy);
        this.byUrl = urlIndex;
        this.byName = nameIndex;
    }

    public static FundingCatalog empty() {
        return new FundingCatalog(List.of());
    }

    public List<Map<String, String>> rows() {
        return rows;
    }

    public boolean isEmpty() {
        return rows.isEmpty();
    }

    public int size() {
        return rows.size();
    }

    /**
     * Catalog row for a program: by normalized URL first, then by normalized fused name.
     * A URL shared by several rows picks the row whose name agrees, else defers to the name.
     */
    public Optional<Map<String, String>> findMatch(FundingProgram program) {
        Optional<String> name = ProgramNames.fusedRawName(program.attributes())
                .map(raw -> ProgramNames.normalizedName(null, raw));

        String url = ProgramNames.normalizeUrl(program.url());
        List<Map<String, String>> hits = url.isEmpty() ? null : byUrl.get(url);
        if (hits != null) {
            if (hits.size() == 1) {
                return Optional.of(hits.get(0));
            }
            if (name.isPresent()) {
                for (Map<String, String> hit : hits) {
                    if (name.get().equals(normalizedName(hit))) {
                        return Optional.of(hit);
                    }
                }
            }
        }
        return name.map(byName::get);
    }

    private static String normalizedName(Map<String, String> row) {
        return ProgramNames.fusedRawName(row)
                .map(raw -> ProgramNames.normalizedName(null, raw))
                .orElse(null);
    }
}
