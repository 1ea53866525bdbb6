package com.example.FundScout.model;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

/**
 * LLM pick over a shortlist.
 *
 * ids      - chosen 1-based shortlist ids, in pick order, unique
 * reasons  - id -> short justification (may be empty)
 * degraded - true when the positional fallback was used instead of a model answer
 */
public record SelectionResult(List<Integer> ids, Map<Integer, String> reasons, boolean degraded) {

    public SelectionResult {
        ids = ids == null ? List.of() : List.copyOf(ids);
        reasons = reasons == null ? Map.of() : Map.copyOf(reasons);
    }

    /**
     * Deterministic fallback: the first min(wanted, shortlistSize) ids, no reasons.
     */
    public static SelectionResult positional(int wanted, int shortlistSize) {
        List<Integer> ids = IntStream.rangeClosed(1, Math.min(wanted, shortlistSize))
                .boxed()
                .collect(Collectors.toList());
        return new SelectionResult(ids, new LinkedHashMap<>(), true);
    }

    public static SelectionResult empty() {
        return new SelectionResult(List.of(), Map.of(), false);
    }

    public int size() {
        return ids.size();
    }

    public String reasonFor(int id) {
        return reasons.getOrDefault(id, "");
    }
}
