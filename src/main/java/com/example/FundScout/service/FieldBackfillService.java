package com.example.FundScout.service;

import com.example.FundScout.model.FundingProgram;
import com.example.FundScout.repository.FundingCatalog;
import com.example.FundScout.util.FieldPresence;
import com.example.FundScout.util.ProgramNames;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Fills attributes a candidate lacks from its catalog row (matched by URL, then name).
 * Present values are never overwritten, so applying it twice changes nothing.
 */
@Service
@RequiredArgsConstructor
public class FieldBackfillService {

    static final List<String> FALLBACK_FIELDS = List.of(
            FundingProgram.DESCRIPTION, FundingProgram.ELIGIBILITY, FundingProgram.PROCEDURE,
            FundingProgram.CONTACT, FundingProgram.AMOUNT, FundingProgram.DEADLINE,
            FundingProgram.LOCATION, FundingProgram.SOURCE, FundingProgram.DOMAIN,
            FundingProgram.NAME, FundingProgram.TITLE, FundingProgram.URL
    );

    private final FundingCatalog catalog;
    private final DeadlineNormalizer deadlineNormalizer;

    public FundingProgram backfill(FundingProgram program) {
        Optional<Map<String, String>> match = catalog.findMatch(program);
        if (match.isEmpty()) {
            return program;
        }
        Map<String, String> row = match.get();
        Map<String, String> current = program.attributes();
        FundingProgram.FundingProgramBuilder builder = program.toBuilder();
        boolean changed = false;

        for (String field : FALLBACK_FIELDS) {
            if (FieldPresence.isPresent(current.get(field))) {
                continue;
            }
            String candidate = FundingProgram.NAME.equals(field)
                    ? ProgramNames.fusedRawName(row).orElse(null)
                    : row.get(field);
            if (FieldPresence.isPresent(candidate)) {
                set(builder, field, candidate.trim());
                changed = true;
            }
        }
        if (!changed) {
            return program;
        }
        FundingProgram filled = builder.build();
        if (!Objects.equals(filled.deadline(), program.deadline())) {
            filled = deadlineNormalizer.normalize(filled);
        }
        return filled;
    }

    public List<FundingProgram> backfillAll(List<FundingProgram> programs) {
        if (catalog.isEmpty()) {
            return programs;
        }
        return programs.stream().map(this::backfill).toList();
    }

    private static void set(FundingProgram.FundingProgramBuilder builder, String field, String value) {
        switch (field) {
            case FundingProgram.NAME -> builder.name(value);
            case FundingProgram.TITLE -> builder.title(value);
            case FundingProgram.DOMAIN -> builder.domain(value);
            case FundingProgram.DESCRIPTION -> builder.description(value);
            case FundingProgram.ELIGIBILITY -> builder.eligibility(value);
            case FundingProgram.AMOUNT -> builder.amount(value);
            case FundingProgram.DEADLINE -> builder.deadline(value);
            case FundingProgram.LOCATION -> builder.location(value);
            case FundingProgram.CONTACT -> builder.contact(value);
            case FundingProgram.PROCEDURE -> builder.procedure(value);
            case FundingProgram.URL -> builder.url(value);
            case FundingProgram.SOURCE -> builder.source(value);
            default -> throw new IllegalArgumentException("Unknown program field: " + field);
        }
    }
}
