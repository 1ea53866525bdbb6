package com.example.FundScout.model;

/**
 * Request for the fan-out search across all configured funding sources.
 */
public record ComprehensiveSearchRequest(
        String query,
        Long fundingNeed,
        String targetDomain,
        String location,
        Integer maxResults
) {

    public int resolveMaxResults(int defaultValue) {
        return maxResults == null || maxResults <= 0 ? defaultValue : maxResults;
    }

    public SearchCriteria toCriteria() {
        return new FundingQueryRequest(query, null, fundingNeed, targetDomain, location, null, null, null)
                .toCriteria();
    }
}
