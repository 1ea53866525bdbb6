package com.example.FundScout.model;

import com.fasterxml.jackson.annotation.JsonIgnore;

/**
 * Conversation state carried between turns. Immutable: every completed new-query run
 * produces a fresh instance; follow-up turns read it without changing it.
 */
public record SessionContext(
        String lastQuery,
        Shortlist lastShortlist,
        SelectionResult lastSelection,
        Enrichment lastEnrichment
) {

    public static SessionContext empty() {
        return new SessionContext(null, null, null, null);
    }

    /** True when a prior shortlist and selection exist for follow-up resolution. */
    @JsonIgnore
    public boolean hasSelection() {
        return lastShortlist != null && !lastShortlist.isEmpty()
                && lastSelection != null && lastSelection.size() > 0;
    }
}
