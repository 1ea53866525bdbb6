package com.example.FundScout.model;

/**
 * Scoring inputs derived from a request. fundingNeed 0 and blank strings disable
 * the corresponding scoring factors.
 */
public record SearchCriteria(
        String query,
        long fundingNeed,
        String targetDomain,
        String userLocation
) {

    public static SearchCriteria ofQuery(String query) {
        return new SearchCriteria(query, 0L, "", "");
    }
}
