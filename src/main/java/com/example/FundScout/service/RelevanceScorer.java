package com.example.FundScout.service;

import com.example.FundScout.model.FundingProgram;
import com.example.FundScout.model.SearchCriteria;
import com.example.FundScout.util.AmountParser;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.OptionalLong;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Additive heuristic score in [0, 100]. Each factor adds its full weight or nothing:
 * <pre>
 *   domain preference found in program domain     +40
 *   parsed amount >= requested funding need       +30
 *   deadline parsed and not in the past           +20
 *   any query token found in the description      +10
 *   requested location found in program location  +10
 * </pre>
 * The sum is capped at 100.
 */
@Component
@RequiredArgsConstructor
public class RelevanceScorer {

    static final int DOMAIN_WEIGHT = 40;
    static final int AMOUNT_WEIGHT = 30;
    static final int DEADLINE_WEIGHT = 20;
    static final int DESCRIPTION_WEIGHT = 10;
    static final int LOCATION_WEIGHT = 10;
    static final int MAX_SCORE = 100;

    private static final Pattern WORD = Pattern.compile("\\w+", Pattern.UNICODE_CHARACTER_CLASS);

    private final DeadlineNormalizer deadlineNormalizer;

    public int score(FundingProgram program, SearchCriteria criteria) {
        int score = 0;
        if (domainMatches(program, criteria.targetDomain())) {
            score += DOMAIN_WEIGHT;
        }
        if (amountCovers(program, criteria.fundingNeed())) {
            score += AMOUNT_WEIGHT;
        }
        if (deadlineNormalizer.isUpcoming(program)) {
            score += DEADLINE_WEIGHT;
        }
        if (descriptionMentionsQuery(program, criteria.query())) {
            score += DESCRIPTION_WEIGHT;
        }
        if (locationMatches(program, criteria.userLocation())) {
            score += LOCATION_WEIGHT;
        }
        return Math.min(score, MAX_SCORE);
    }

    /** Score and attach to the program. */
    public FundingProgram scored(FundingProgram program, SearchCriteria criteria) {
        return program.toBuilder().relevanceScore(score(program, criteria)).build();
    }

    static List<String> tokens(String text) {
        if (text == null) {
            return List.of();
        }
        Matcher m = WORD.matcher(text.toLowerCase(Locale.ROOT));
        List<String> out = new ArrayList<>();
        while (m.find()) {
            out.add(m.group());
        }
        return out;
    }

    private boolean domainMatches(FundingProgram program, String targetDomain) {
        return containsIgnoreCase(program.domain(), targetDomain);
    }

    private boolean amountCovers(FundingProgram program, long fundingNeed) {
        if (fundingNeed <= 0) {
            return false;
        }
        OptionalLong amount = AmountParser.parse(program.amount());
        return amount.isPresent() && amount.getAsLong() >= fundingNeed;
    }

    private boolean descriptionMentionsQuery(FundingProgram program, String query) {
        if (program.description() == null) {
            return false;
        }
        String description = program.description().toLowerCase(Locale.ROOT);
        return tokens(query).stream().anyMatch(description::contains);
    }

    private boolean locationMatches(FundingProgram program, String userLocation) {
        return containsIgnoreCase(program.location(), userLocation);
    }

    private static boolean containsIgnoreCase(String haystack, String needle) {
        if (needle == null || needle.isBlank() || haystack == null) {
            return false;
        }
        return haystack.toLowerCase(Locale.ROOT).contains(needle.trim().toLowerCase(Locale.ROOT));
    }
}
