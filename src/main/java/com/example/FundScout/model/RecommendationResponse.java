package com.example.FundScout.model;

import java.util.List;

/**
 * Result of one turn.
 *
 * degraded        - true when selection or enrichment fell back to the non-LLM path
 * requestedFields - for follow-ups, the fields the user asked about specifically
 */
public record RecommendationResponse(
        String sessionId,
        TurnType turnType,
        String message,
        boolean degraded,
        List<ProgramCard> programs,
        List<String> requestedFields
) {
}
