package com.example.FundScout.service;

import com.example.FundScout.model.FundingProgram;
import com.example.FundScout.util.DeadlineParser;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.Optional;

/**
 * Attaches the parsed deadline and day count to a program and decides whether
 * it is still open. Unparseable deadlines count as open.
 */
@Component
@RequiredArgsConstructor
public class DeadlineNormalizer {

    private final Clock clock;

    public Optional<OffsetDateTime> parse(String raw) {
        return DeadlineParser.parse(raw);
    }

    public FundingProgram normalize(FundingProgram program) {
        Optional<OffsetDateTime> parsed = parse(program.deadline());
        if (parsed.isEmpty()) {
            return program.toBuilder().deadlineDate(null).daysLeft(null).build();
        }
        OffsetDateTime deadline = parsed.get();
        return program.toBuilder()
                .deadlineDate(deadline)
                .daysLeft(DeadlineParser.daysLeft(deadline, clock.instant()))
                .build();
    }

    /** Keep iff days_left is null or non-negative. */
    public boolean isOpen(FundingProgram program) {
        return program.daysLeft() == null || program.daysLeft() >= 0;
    }

    /** Parsed deadline present and not before now. */
    public boolean isUpcoming(FundingProgram program) {
        return program.deadlineDate() != null
                && !program.deadlineDate().toInstant().isBefore(clock.instant());
    }
}
