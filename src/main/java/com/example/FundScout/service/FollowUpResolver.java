package com.example.FundScout.service;

import com.example.FundScout.model.FollowUpTarget;
import com.example.FundScout.model.FollowUpTarget.MatchKind;
import com.example.FundScout.model.FundingProgram;
import com.example.FundScout.model.SelectionResult;
import com.example.FundScout.model.SessionContext;
import com.example.FundScout.model.Shortlist;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Decides whether an utterance refers to a program of the previous selection.
 * Passes, first match wins:
 * <ol>
 *   <li>ordinal ("the second one", "3rd") within the selection size</li>
 *   <li>a name token (longer than 3 chars) of a selected program</li>
 *   <li>a generic continuation ("tell me more", "details") meaning the first pick</li>
 * </ol>
 * No match means the utterance is a new query.
 */
@Component
public class FollowUpResolver {

    private static final Pattern ORDINAL = Pattern.compile(
            "\\b(first|1st|second|2nd|third|3rd|fourth|4th|fifth|5th)\\b");

    private static final Pattern CARDINAL = Pattern.compile(
            "\\b(one|two|three|four|five)\\b");

    private static final Map<String, Integer> RANKS = Map.ofEntries(
            Map.entry("first", 1), Map.entry("1st", 1), Map.entry("one", 1),
            Map.entry("second", 2), Map.entry("2nd", 2), Map.entry("two", 2),
            Map.entry("third", 3), Map.entry("3rd", 3), Map.entry("three", 3),
            Map.entry("fourth", 4), Map.entry("4th", 4), Map.entry("four", 4),
            Map.entry("fifth", 5), Map.entry("5th", 5), Map.entry("five", 5)
    );

    private static final Pattern GENERIC = Pattern.compile(
            "tell me more|details|more info|expand|elaborate");

    private static final Pattern NAME_TOKEN_SPLIT = Pattern.compile("[^\\p{L}\\p{N}&]+");

    /** Field key -> phrases that ask for it. */
    private static final Map<String, List<String>> FIELD_CUES = fieldCues();

    public Optional<FollowUpTarget> resolve(String utterance, SessionContext context) {
        if (utterance == null || utterance.isBlank() || context == null || !context.hasSelection()) {
            return Optional.empty();
        }
        String text = utterance.toLowerCase(Locale.ROOT);
        SelectionResult selection = context.lastSelection();
        Shortlist shortlist = context.lastShortlist();
        List<String> fields = requestedFields(text);

        Optional<Integer> rank = ordinalRank(text, selection.size());
        if (rank.isPresent()) {
            return target(rank.get(), selection, shortlist, MatchKind.ORDINAL, fields);
        }

        for (int i = 0; i < selection.size(); i++) {
            Optional<FundingProgram> program = shortlist.byId(selection.ids().get(i));
            if (program.isPresent() && mentionsName(text, program.get())) {
                return target(i + 1, selection, shortlist, MatchKind.NAME, fields);
            }
        }

        if (GENERIC.matcher(text).find()) {
            return target(1, selection, shortlist, MatchKind.GENERIC, fields);
        }
        return Optional.empty();
    }

    /**
     * Ordinal words win over cardinal words; among either kind the earliest occurrence
     * within 1..maxRank wins.
     */
    static Optional<Integer> ordinalRank(String lowerText, int maxRank) {
        Optional<Integer> ordinal = firstInRange(ORDINAL.matcher(lowerText), maxRank);
        return ordinal.isPresent() ? ordinal : firstInRange(CARDINAL.matcher(lowerText), maxRank);
    }

    private static Optional<Integer> firstInRange(Matcher matcher, int maxRank) {
        while (matcher.find()) {
            int rank = RANKS.get(matcher.group(1));
            if (rank <= maxRank) {
                return Optional.of(rank);
            }
        }
        return Optional.empty();
    }

    /**
     * Field keys the utterance asks about, in canonical order. Asking only for the
     * contact also brings the url.
     */
    static List<String> requestedFields(String lowerText) {
        List<String> out = new ArrayList<>();
        FIELD_CUES.forEach((field, cues) -> {
            if (cues.stream().anyMatch(lowerText::contains)) {
                out.add(field);
            }
        });
        if (out.size() == 1 && out.contains(FundingProgram.CONTACT)) {
            out.add(FundingProgram.URL);
        }
        return List.copyOf(out);
    }

    private static boolean mentionsName(String lowerText, FundingProgram program) {
        for (String token : NAME_TOKEN_SPLIT.split(program.normalizedName())) {
            if (token.length() > 3 && lowerText.contains(token)) {
                return true;
            }
        }
        return false;
    }

    private static Optional<FollowUpTarget> target(int rank, SelectionResult selection, Shortlist shortlist,
                                                   MatchKind kind, List<String> fields) {
        int shortlistId = selection.ids().get(rank - 1);
        return shortlist.byId(shortlistId)
                .map(program -> new FollowUpTarget(rank, shortlistId, program, kind, fields));
    }

    private static Map<String, List<String>> fieldCues() {
        Map<String, List<String>> cues = new LinkedHashMap<>();
        cues.put(FundingProgram.CONTACT, List.of("contact", "email", "e-mail", "phone", "reach out", "kontakt"));
        cues.put(FundingProgram.URL, List.of("url", "link", "website", "web page", "webpage"));
        cues.put(FundingProgram.DEADLINE, List.of("deadline", "due date", "closing date", "frist", "until when"));
        cues.put(FundingProgram.AMOUNT, List.of("amount", "how much", "budget", "funding rate", "fördersumme"));
        cues.put(FundingProgram.ELIGIBILITY, List.of("eligib", "qualify", "who can apply", "requirements"));
        cues.put(FundingProgram.PROCEDURE, List.of("procedure", "how to apply", "how do i apply", "application process"));
        cues.put(FundingProgram.LOCATION, List.of("location", "region", "where"));
        cues.put(FundingProgram.SOURCE, List.of("source"));
        return cues;
    }
}
