package com.example.FundScout.model;

/**
 * Request payload for one conversational turn.
 *
 * @param query        free-text company/project description or follow-up utterance
 * @param sessionId    conversation id; blank starts a temporary session
 * @param fundingNeed  optional requested amount (EUR) for amount scoring
 * @param targetDomain optional domain preference, e.g. "robotics"
 * @param location     optional region, e.g. "Rhineland-Palatinate"
 * @param topK         optional override for vector candidates
 * @param want         optional override for shortlist size
 * @param wanted       optional override for number of LLM picks
 */
public record FundingQueryRequest(
        String query,
        String sessionId,
        Long fundingNeed,
        String targetDomain,
        String location,
        Integer topK,
        Integer want,
        Integer wanted
) {

    public static FundingQueryRequest of(String query) {
        return new FundingQueryRequest(query, null, null, null, null, null, null, null);
    }

    public int resolveTopK(int defaultValue) {
        return topK == null || topK <= 0 ? defaultValue : topK;
    }

    public int resolveWant(int defaultValue) {
        return want == null || want <= 0 ? defaultValue : want;
    }

    public int resolveWanted(int defaultValue) {
        return wanted == null || wanted <= 0 ? defaultValue : wanted;
    }

    public SearchCriteria toCriteria() {
        if (query == null || query.isBlank()) {
            throw new IllegalArgumentException("query must not be blank");
        }
        return new SearchCriteria(
                query.trim(),
                fundingNeed == null || fundingNeed < 0 ? 0L : fundingNeed,
                targetDomain == null ? "" : targetDomain.trim(),
                location == null ? "" : location.trim()
        );
    }

    public ResolvedSession resolveSession() {
        boolean temporary = sessionId == null || sessionId.isBlank();
        String resolvedId = temporary ? "temp-" + java.util.UUID.randomUUID() : sessionId;
        return new ResolvedSession(resolvedId, temporary);
    }

    public record ResolvedSession(String id, boolean temporary) { }
}
