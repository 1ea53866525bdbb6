package com.example.FundScout.model;

/**
 * A single pipeline step event streamed to the client.
 *
 * stage   - pipeline stage name, e.g. "start", "retrieval", "selection", "final"
 * message - human-readable description of what this step means
 * payload - stage payload for the UI, e.g.:
 *           - List<Map<...>> for shortlist summaries
 *           - the final RecommendationResponse
 */
public record ThinkingEvent(
        String stage,
        String message,
        Object payload
) {
}
