package com.example.FundScout.service;

import com.example.FundScout.model.Enrichment;
import com.example.FundScout.model.Enrichment.ProgramEnrichment;
import com.example.FundScout.model.FundingProgram;
import com.example.FundScout.model.ProgramCard;
import com.example.FundScout.model.SelectionResult;
import com.example.FundScout.model.Shortlist;
import com.example.FundScout.util.FieldPresence;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Turns selected programs plus their enrichment into uniform cards. Every absent
 * value reads "Not specified", and every card carries next steps even when the
 * chat model gave none.
 */
@Component
public class ProgramCardAssembler {

    static final String NOT_SPECIFIED = "Not specified";
    static final int MAX_STEPS = 3;

    static final String STEP_OFFICIAL_PAGE = "Review the official program page";
    static final String STEP_ELIGIBILITY = "Confirm your eligibility against the program criteria";
    static final String STEP_PROCEDURE = "Prepare the application following the published procedure";
    static final List<String> GENERIC_STEPS = List.of(
            "Outline your project goals and innovation",
            "Draft a budget and timeline for the project",
            "Contact the program office to confirm fit"
    );

    private static final Pattern SENTENCE_END = Pattern.compile("(?<=[.!?])\\s+");

    public List<ProgramCard> assemble(Shortlist shortlist, SelectionResult selection, Enrichment enrichment) {
        List<ProgramCard> cards = new ArrayList<>();
        int rank = 1;
        for (Integer id : selection.ids()) {
            Optional<FundingProgram> program = shortlist.byId(id);
            if (program.isPresent()) {
                cards.add(toCard(rank++, program.get(), selection.reasonFor(id), enrichment.forId(id)));
            }
        }
        return cards;
    }

    public ProgramCard toCard(int rank, FundingProgram program, String reason, ProgramEnrichment enrichment) {
        String brief = FieldPresence.present(enrichment.brief())
                .orElseGet(() -> FieldPresence.orDefault(firstSentences(program.description(), 2), NOT_SPECIFIED));
        return new ProgramCard(
                rank,
                program.id() == null ? 0 : program.id(),
                program.displayName(),
                reason == null ? "" : reason,
                brief,
                FieldPresence.orDefault(program.domain(), NOT_SPECIFIED),
                FieldPresence.orDefault(firstSentences(program.eligibility(), 2), NOT_SPECIFIED),
                FieldPresence.orDefault(program.amount(), NOT_SPECIFIED),
                FieldPresence.orDefault(program.deadline(), NOT_SPECIFIED),
                program.daysLeft(),
                FieldPresence.orDefault(program.location(), NOT_SPECIFIED),
                FieldPresence.orDefault(program.contact(), NOT_SPECIFIED),
                FieldPresence.orDefault(program.source(), NOT_SPECIFIED),
                FieldPresence.orDefault(program.url(), NOT_SPECIFIED),
                program.relevanceScore(),
                nextSteps(program, enrichment.nextSteps())
        );
    }

    /**
     * Chat model steps when there are any (with the official page first when a URL
     * exists and no step mentions it), otherwise steps derived from the program data.
     */
    List<String> nextSteps(FundingProgram program, List<String> modelSteps) {
        Set<String> steps = new LinkedHashSet<>();
        List<String> usable = modelSteps == null ? List.of() : modelSteps.stream()
                .filter(FieldPresence::isPresent)
                .map(String::trim)
                .collect(Collectors.toList());

        if (!usable.isEmpty()) {
            if (program.hasUrl() && usable.stream().noneMatch(ProgramCardAssembler::mentionsOfficialPage)) {
                steps.add(STEP_OFFICIAL_PAGE);
            }
            steps.addAll(usable);
            return steps.stream().limit(MAX_STEPS).collect(Collectors.toList());
        }

        if (program.hasUrl()) {
            steps.add(STEP_OFFICIAL_PAGE);
        }
        if (FieldPresence.isPresent(program.eligibility())) {
            steps.add(STEP_ELIGIBILITY);
        }
        if (FieldPresence.isPresent(program.procedure())) {
            steps.add(STEP_PROCEDURE);
        }
        if (program.daysLeft() != null) {
            steps.add("Submit before the deadline (" + program.daysLeft() + " days left)");
        }
        steps.addAll(GENERIC_STEPS);
        return steps.stream().limit(MAX_STEPS).collect(Collectors.toList());
    }

    static String firstSentences(String text, int count) {
        if (text == null || text.isBlank()) {
            return "";
        }
        return Arrays.stream(SENTENCE_END.split(text.trim()))
                .limit(count)
                .collect(Collectors.joining(" "));
    }

    private static boolean mentionsOfficialPage(String step) {
        String lower = step.toLowerCase(Locale.ROOT);
        return lower.contains("official") || lower.contains("website") || lower.contains("web page")
                || lower.contains("http");
    }
}
