package com.example.FundScout.service;

import com.example.FundScout.config.FundingProperties;
import com.example.FundScout.model.Enrichment;
import com.example.FundScout.model.Enrichment.ProgramEnrichment;
import com.example.FundScout.model.FundingQueryRequest;
import com.example.FundScout.model.ProgramCard;
import com.example.FundScout.model.RecommendationResponse;
import com.example.FundScout.model.SelectionResult;
import com.example.FundScout.model.SessionContext;
import com.example.FundScout.model.Shortlist;
import com.example.FundScout.model.ThinkingEvent;
import com.example.FundScout.model.TurnType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import reactor.test.StepVerifier;

import java.time.Duration;
import java.util.List;
import java.util.Map;

import static com.example.FundScout.service.TestPrograms.program;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class FundingRecommendationServiceTest {

    private FundingShortlistService shortlistService;
    private LlmSelector selector;
    private LlmEnricher enricher;
    private RedisSessionContextStore sessionStore;
    private QueryLogService queryLogService;
    private FundingRecommendationService service;

    private final Shortlist shortlist = Shortlist.of("robotics", List.of(
            program("Robotics Pilot Fund", "https://a.example"),
            program("InnoTop", "https://b.example"),
            program("Digital Bonus", "https://c.example")
    ));

    @BeforeEach
    void setUp() {
        shortlistService = mock(FundingShortlistService.class);
        selector = mock(LlmSelector.class);
        enricher = mock(LlmEnricher.class);
        sessionStore = mock(RedisSessionContextStore.class);
        queryLogService = mock(QueryLogService.class);

        service = new FundingRecommendationService(
                shortlistService,
                selector,
                enricher,
                new FollowUpResolver(),
                new ProgramCardAssembler(),
                sessionStore,
                queryLogService,
                new FundingProperties(),
                TestPrograms.CLOCK
        );
    }

    private void stubPipeline() {
        when(shortlistService.shortlist(any(FundingQueryRequest.class))).thenReturn(shortlist);
        when(selector.select(eq("robotics"), eq(shortlist), eq(3)))
                .thenReturn(new SelectionResult(List.of(2, 1), Map.of(2, "regional SME innovation"), false));
        when(enricher.enrich(List.of(2, 1), shortlist)).thenReturn(new Enrichment(
                Map.of(2, new ProgramEnrichment("Funds product development.", List.of("Apply online"))), false));
    }

    @Test
    void newQueryRunsTheWholePipeline() {
        stubPipeline();

        FundingRecommendationService.Outcome outcome =
                service.recommend(FundingQueryRequest.of("robotics"), "s-1", SessionContext.empty());

        RecommendationResponse response = outcome.response();
        assertThat(response.turnType()).isEqualTo(TurnType.NEW_QUERY);
        assertThat(response.degraded()).isFalse();
        assertThat(response.programs()).extracting(ProgramCard::shortlistId).containsExactly(2, 1);
        assertThat(response.programs().get(0).brief()).isEqualTo("Funds product development.");
        assertThat(outcome.context().lastShortlist()).isEqualTo(shortlist);
        assertThat(outcome.context().lastSelection().ids()).containsExactly(2, 1);
        verify(queryLogService).recordQuery(eq("s-1"), eq("openai"), eq("robotics"), eq(shortlist), any());
    }

    @Test
    void emptyShortlistIsAnExplicitNoMatchesTurn() {
        when(shortlistService.shortlist(any(FundingQueryRequest.class))).thenReturn(Shortlist.empty("biotech"));

        RecommendationResponse response = service
                .recommend(FundingQueryRequest.of("biotech"), "s-1", SessionContext.empty())
                .response();

        assertThat(response.turnType()).isEqualTo(TurnType.NO_MATCHES);
        assertThat(response.message()).isEqualTo(FundingRecommendationService.NO_MATCHES_MESSAGE);
        assertThat(response.programs()).isEmpty();
        verify(selector, never()).select(anyString(), any(), anyInt());
    }

    @Test
    void followUpUsesThePreviousSelectionWithoutRetrieval() {
        SessionContext previous = new SessionContext(
                "robotics",
                shortlist,
                new SelectionResult(List.of(3, 1, 2), Map.of(1, "robotics pilots"), false),
                Enrichment.empty()
        );

        FundingRecommendationService.Outcome outcome = service.recommend(
                FundingQueryRequest.of("tell me more about the second one"), "s-1", previous);

        assertThat(outcome.response().turnType()).isEqualTo(TurnType.FOLLOW_UP);
        assertThat(outcome.response().programs()).singleElement()
                .satisfies(card -> {
                    assertThat(card.shortlistId()).isEqualTo(1);
                    assertThat(card.whyItFits()).isEqualTo("robotics pilots");
                });
        assertThat(outcome.context()).isSameAs(previous);
        verify(shortlistService, never()).shortlist(any(FundingQueryRequest.class));
        verify(queryLogService, never()).recordQuery(any(), any(), any(), any(), any());
    }

    @Test
    void degradedStagesAreReported() {
        when(shortlistService.shortlist(any(FundingQueryRequest.class))).thenReturn(shortlist);
        when(selector.select(anyString(), any(), anyInt())).thenReturn(SelectionResult.positional(3, 3));
        when(enricher.enrich(anyList(), any())).thenReturn(Enrichment.blank(List.of(1, 2, 3)));

        RecommendationResponse response = service
                .recommend(FundingQueryRequest.of("robotics"), "s-1", SessionContext.empty())
                .response();

        assertThat(response.degraded()).isTrue();
        assertThat(response.programs()).hasSize(3);
        assertThat(response.programs()).allSatisfy(card -> assertThat(card.nextSteps()).isNotEmpty());
    }

    @Test
    void sessionAwareTurnLoadsAndStoresTheContext() {
        stubPipeline();
        when(sessionStore.load("s-9")).thenReturn(SessionContext.empty());
        FundingQueryRequest request = new FundingQueryRequest("robotics", "s-9", null, null, null, null, null, null);

        RecommendationResponse response = service.recommend(request);

        assertThat(response.sessionId()).isEqualTo("s-9");
        verify(sessionStore).save(eq("s-9"), any(SessionContext.class), eq(false));
    }

    @Test
    void blankQueryIsRejected() {
        assertThatThrownBy(() -> service.recommend(FundingQueryRequest.of(" "), "s-1", SessionContext.empty()))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void streamEmitsOneEventPerStage() {
        stubPipeline();
        when(sessionStore.load(anyString())).thenReturn(SessionContext.empty());

        StepVerifier.create(service.streamRecommendation(FundingQueryRequest.of("robotics")).map(ThinkingEvent::stage))
                .expectNext("start", "retrieval", "selection", "enrichment", "final")
                .expectComplete()
                .verify(Duration.ofSeconds(10));

        verify(sessionStore).save(anyString(), any(SessionContext.class), eq(true));
    }

    @Test
    void streamedFollowUpSkipsRetrieval() {
        SessionContext previous = new SessionContext(
                "robotics", shortlist, new SelectionResult(List.of(1, 2), Map.of(), false), Enrichment.empty());
        when(sessionStore.load("s-2")).thenReturn(previous);
        FundingQueryRequest request = new FundingQueryRequest("details please", "s-2", null, null, null, null, null, null);

        StepVerifier.create(service.streamRecommendation(request).map(ThinkingEvent::stage))
                .expectNext("start", "followup", "final")
                .expectComplete()
                .verify(Duration.ofSeconds(10));
    }

    @Test
    void streamOfAnEmptyShortlistGoesStraightToFinal() {
        when(shortlistService.shortlist(any(FundingQueryRequest.class))).thenReturn(Shortlist.empty("biotech"));
        when(sessionStore.load(anyString())).thenReturn(SessionContext.empty());

        StepVerifier.create(service.streamRecommendation(FundingQueryRequest.of("biotech")))
                .expectNextMatches(event -> event.stage().equals("start"))
                .expectNextMatches(event -> event.stage().equals("retrieval"))
                .expectNextMatches(event -> event.stage().equals("final")
                        && ((RecommendationResponse) event.payload()).turnType() == TurnType.NO_MATCHES)
                .expectComplete()
                .verify(Duration.ofSeconds(10));
    }
}
