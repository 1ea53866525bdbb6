package com.example.FundScout.model;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Grounded brief and next steps per selected shortlist id.
 */
public record Enrichment(Map<Integer, ProgramEnrichment> items, boolean degraded) {

    public Enrichment {
        items = items == null ? Map.of() : Map.copyOf(items);
    }

    /** Empty brief and steps for every requested id. */
    public static Enrichment blank(List<Integer> ids) {
        Map<Integer, ProgramEnrichment> blank = new LinkedHashMap<>();
        for (Integer id : ids) {
            blank.put(id, ProgramEnrichment.BLANK);
        }
        return new Enrichment(blank, true);
    }

    public static Enrichment empty() {
        return new Enrichment(Map.of(), false);
    }

    public ProgramEnrichment forId(int id) {
        return items.getOrDefault(id, ProgramEnrichment.BLANK);
    }

    public record ProgramEnrichment(String brief, List<String> nextSteps) {

        public static final ProgramEnrichment BLANK = new ProgramEnrichment("", List.of());

        public ProgramEnrichment {
            brief = brief == null ? "" : brief;
            nextSteps = nextSteps == null ? List.of() : List.copyOf(nextSteps);
        }
    }
}
