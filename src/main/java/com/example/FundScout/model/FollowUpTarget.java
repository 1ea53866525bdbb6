package com.example.FundScout.model;

import java.util.List;

/**
 * A follow-up utterance resolved against the previous selection.
 *
 * @param rank            1-based position within the previous selection
 * @param shortlistId     id of the program within the previous shortlist
 * @param program         the referenced program
 * @param matchKind       which detection pass matched
 * @param requestedFields specific fields the utterance asks about (may be empty)
 */
public record FollowUpTarget(
        int rank,
        int shortlistId,
        FundingProgram program,
        MatchKind matchKind,
        List<String> requestedFields
) {

    public enum MatchKind {
        ORDINAL,
        NAME,
        GENERIC
    }
}
