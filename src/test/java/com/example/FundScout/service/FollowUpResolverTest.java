package com.example.FundScout.service;

import com.example.FundScout.model.Enrichment;
import com.example.FundScout.model.FollowUpTarget;
import com.example.FundScout.model.FollowUpTarget.MatchKind;
import com.example.FundScout.model.SelectionResult;
import com.example.FundScout.model.SessionContext;
import com.example.FundScout.model.Shortlist;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Optional;

import static com.example.FundScout.service.TestPrograms.program;
import static org.assertj.core.api.Assertions.assertThat;

class FollowUpResolverTest {

    private final FollowUpResolver resolver = new FollowUpResolver();

    private final Shortlist shortlist = Shortlist.of("robotics", List.of(
            program("Robotics Pilot Fund", "https://a.example"),
            program("Digital Bonus", "https://b.example"),
            program("InnoTop Rheinland-Pfalz", "https://c.example"),
            program("Climate Start", "https://d.example"),
            program("EFRE Digitalisierung", "https://e.example")
    ));

    /** Selection order differs from shortlist order on purpose. */
    private final SessionContext context = new SessionContext(
            "robotics",
            shortlist,
            new SelectionResult(List.of(4, 1, 3), Map.of(), false),
            Enrichment.empty()
    );

    @Test
    void ordinalRefersToThePositionInTheSelection() {
        Optional<FollowUpTarget> target = resolver.resolve("tell me more about the second one", context);

        assertThat(target).isPresent();
        assertThat(target.get().rank()).isEqualTo(2);
        assertThat(target.get().shortlistId()).isEqualTo(1);
        assertThat(target.get().program().name()).isEqualTo("Robotics Pilot Fund");
        assertThat(target.get().matchKind()).isEqualTo(MatchKind.ORDINAL);
    }

    @Test
    void ordinalBeyondTheSelectionIsIgnored() {
        assertThat(resolver.resolve("what about the fifth", context)).isEmpty();
    }

    @Test
    void nameTokenMatchesASelectedProgram() {
        Optional<FollowUpTarget> target = resolver.resolve("Is InnoTop still accepting applications?", context);

        assertThat(target).isPresent();
        assertThat(target.get().rank()).isEqualTo(3);
        assertThat(target.get().shortlistId()).isEqualTo(3);
        assertThat(target.get().matchKind()).isEqualTo(MatchKind.NAME);
    }

    @Test
    void genericContinuationMeansTheFirstPick() {
        Optional<FollowUpTarget> target = resolver.resolve("Can you elaborate?", context);

        assertThat(target).isPresent();
        assertThat(target.get().rank()).isEqualTo(1);
        assertThat(target.get().shortlistId()).isEqualTo(4);
        assertThat(target.get().matchKind()).isEqualTo(MatchKind.GENERIC);
    }

    @Test
    void unrelatedUtteranceIsANewQuery() {
        assertThat(resolver.resolve("Find grants for biotech companies in Berlin", context)).isEmpty();
    }

    @Test
    void withoutAPreviousSelectionNothingResolves() {
        assertThat(resolver.resolve("tell me more about the first", SessionContext.empty())).isEmpty();
    }

    @Test
    void reportsRequestedFields() {
        assertThat(resolver.resolve("what is the contact for the first one?", context).orElseThrow().requestedFields())
                .containsExactly("contact", "url");
        assertThat(resolver.resolve("deadline and how much for the 3rd", context).orElseThrow().requestedFields())
                .containsExactly("deadline", "amount");
    }

    @Test
    void trueOrdinalsWinOverCardinals() {
        assertThat(FollowUpResolver.ordinalRank("the second one", 3)).contains(2);
        assertThat(FollowUpResolver.ordinalRank("number two please", 3)).contains(2);
        assertThat(FollowUpResolver.ordinalRank("no reference here", 3)).isEmpty();
    }

    @Test
    void firstOrdinalWithinTheSelectionWins() {
        assertThat(FollowUpResolver.ordinalRank("the fifth or the second", 3)).contains(2);
        assertThat(FollowUpResolver.ordinalRank("the fifth one", 3)).isEmpty();

        Optional<FollowUpTarget> target = resolver.resolve("what about the fifth or the second?", context);

        assertThat(target).isPresent();
        assertThat(target.get().rank()).isEqualTo(2);
        assertThat(target.get().shortlistId()).isEqualTo(1);
        assertThat(target.get().matchKind()).isEqualTo(MatchKind.ORDINAL);
    }
}
