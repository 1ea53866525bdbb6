package com.example.FundScout.model;

import java.util.List;

/**
 * Rendering-ready view of one selected program. Absent fields are rendered as
 * "Not specified" so every card has the same shape.
 */
public record ProgramCard(
        int rank,
        int shortlistId,
        String name,
        String whyItFits,
        String brief,
        String domain,
        String eligibility,
        String amount,
        String deadline,
        Long daysLeft,
        String location,
        String contact,
        String source,
        String url,
        int relevanceScore,
        List<String> nextSteps
) {
}
