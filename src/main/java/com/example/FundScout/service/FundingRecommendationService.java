package com.example.FundScout.service;

import com.example.FundScout.config.FundingProperties;
import com.example.FundScout.model.Enrichment;
import com.example.FundScout.model.FollowUpTarget;
import com.example.FundScout.model.FundingProgram;
import com.example.FundScout.model.FundingQueryRequest;
import com.example.FundScout.model.ProgramCard;
import com.example.FundScout.model.RecommendationResponse;
import com.example.FundScout.model.SelectionResult;
import com.example.FundScout.model.SessionContext;
import com.example.FundScout.model.Shortlist;
import com.example.FundScout.model.ThinkingEvent;
import com.example.FundScout.model.TurnType;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

/**
 * One conversational turn: either a follow-up about a previously selected program,
 * or a new query running shortlist, selection and enrichment.
 */
@Service
@RequiredArgsConstructor
public class FundingRecommendationService {

    private static final Logger log = LoggerFactory.getLogger(FundingRecommendationService.class);

    static final String NO_MATCHES_MESSAGE =
            "No open funding programs matched your query. Try broader terms, another domain or region.";

    private final FundingShortlistService shortlistService;
    private final LlmSelector selector;
    private final LlmEnricher enricher;
    private final FollowUpResolver followUpResolver;
    private final ProgramCardAssembler cardAssembler;
    private final RedisSessionContextStore sessionStore;
    private final QueryLogService queryLogService;
    private final FundingProperties properties;
    private final Clock clock;

    /**
     * Turn with session handling: loads the stored context, runs the turn and stores
     * the resulting context.
     */
    public RecommendationResponse recommend(FundingQueryRequest request) {
        FundingQueryRequest.ResolvedSession session = request.resolveSession();
        SessionContext context = sessionStore.load(session.id());
        Outcome outcome = recommend(request, session.id(), context);
        sessionStore.save(session.id(), outcome.context(), session.temporary());
        return outcome.response();
    }

    /**
     * Turn as a function of the request and the prior context. Follow-ups return the
     * context unchanged; new queries return a fresh one.
     *
     * @throws RetrievalException    when a new query cannot reach the embedding model or vector index
     * @throws IllegalArgumentException when the query is blank
     */
    public Outcome recommend(FundingQueryRequest request, String sessionId, SessionContext context) {
        if (request.query() == null || request.query().isBlank()) {
            throw new IllegalArgumentException("query must not be blank");
        }
        Optional<FollowUpTarget> target = followUpResolver.resolve(request.query(), context);
        if (target.isPresent()) {
            return new Outcome(followUp(sessionId, target.get(), context), context);
        }

        Shortlist shortlist = shortlistService.shortlist(request);
        if (shortlist.isEmpty()) {
            return completeNewQuery(request, sessionId, shortlist, SelectionResult.empty(), Enrichment.empty());
        }
        SelectionResult selection = selector.select(
                shortlist.query(), shortlist, request.resolveWanted(properties.getWanted()));
        Enrichment enrichment = enricher.enrich(selection.ids(), shortlist);
        return completeNewQuery(request, sessionId, shortlist, selection, enrichment);
    }

    /**
     * Streaming turn with one event per stage.
     *
     * Stages:
     *  - "start": request accepted
     *  - "followup": utterance resolved against the previous selection (then "final")
     *  - "retrieval": shortlist built
     *  - "selection": programs picked
     *  - "enrichment": briefs and next steps written
     *  - "final": the complete RecommendationResponse
     */
    public Flux<ThinkingEvent> streamRecommendation(FundingQueryRequest request) {
        if (request.query() == null || request.query().isBlank()) {
            return Flux.error(new IllegalArgumentException("query must not be blank"));
        }
        FundingQueryRequest.ResolvedSession session = request.resolveSession();

        Mono<SessionContext> contextMono =
                Mono.fromCallable(() -> sessionStore.load(session.id()))
                        .subscribeOn(Schedulers.boundedElastic())
                        .cache();

        Flux<ThinkingEvent> startStep = Flux.just(
                new ThinkingEvent(
                        "start",
                        "Request received. Looking for matching funding programs.",
                        Map.of("ts", clock.millis(), "sessionId", session.id())
                )
        );

        Flux<ThinkingEvent> turnSteps = contextMono.flatMapMany(context ->
                followUpResolver.resolve(request.query(), context)
                        .map(target -> followUpSteps(session, target, context))
                        .orElseGet(() -> newQuerySteps(request, session))
        );

        return Flux.concat(startStep, turnSteps);
    }

    public boolean resetSession(String sessionId) {
        return sessionStore.clear(sessionId);
    }

    private Flux<ThinkingEvent> followUpSteps(FundingQueryRequest.ResolvedSession session,
                                              FollowUpTarget target,
                                              SessionContext context) {
        RecommendationResponse response = followUp(session.id(), target, context);
        return Flux.just(
                new ThinkingEvent(
                        "followup",
                        "Answering about a program from your previous results.",
                        Map.of("rank", target.rank(),
                                "name", target.program().displayName(),
                                "match", target.matchKind().name(),
                                "requestedFields", target.requestedFields())
                ),
                new ThinkingEvent("final", response.message(), response)
        ).doOnComplete(() -> sessionStore.save(session.id(), context, session.temporary()));
    }

    private Flux<ThinkingEvent> newQuerySteps(FundingQueryRequest request, FundingQueryRequest.ResolvedSession session) {
        // Per-subscription results of the previous stages
        AtomicReference<Shortlist> shortlistRef = new AtomicReference<>();
        AtomicReference<SelectionResult> selectionRef = new AtomicReference<>(SelectionResult.empty());
        AtomicReference<Enrichment> enrichmentRef = new AtomicReference<>(Enrichment.empty());
        int wanted = request.resolveWanted(properties.getWanted());

        Flux<ThinkingEvent> retrievalStep =
                Mono.fromCallable(() -> shortlistService.shortlist(request))
                        .subscribeOn(Schedulers.boundedElastic())
                        .doOnNext(shortlistRef::set)
                        .map(shortlist -> new ThinkingEvent(
                                "retrieval",
                                "Searched the funding index and catalog.",
                                summarizeShortlist(shortlist)
                        ))
                        .flux();

        Flux<ThinkingEvent> selectionStep = Flux.defer(() -> {
            Shortlist shortlist = shortlistRef.get();
            if (shortlist == null || shortlist.isEmpty()) {
                return Flux.empty();
            }
            return Mono.fromCallable(() -> selector.select(shortlist.query(), shortlist, wanted))
                    .subscribeOn(Schedulers.boundedElastic())
                    .doOnNext(selectionRef::set)
                    .map(selection -> new ThinkingEvent(
                            "selection",
                            selection.degraded()
                                    ? "Selection model unavailable; taking the top ranked programs."
                                    : "Selected the best fitting programs.",
                            Map.of("ids", selection.ids(), "degraded", selection.degraded())
                    ))
                    .flux();
        });

        Flux<ThinkingEvent> enrichmentStep = Flux.defer(() -> {
            Shortlist shortlist = shortlistRef.get();
            SelectionResult selection = selectionRef.get();
            if (shortlist == null || selection.size() == 0) {
                return Flux.empty();
            }
            return Mono.fromCallable(() -> enricher.enrich(selection.ids(), shortlist))
                    .subscribeOn(Schedulers.boundedElastic())
                    .doOnNext(enrichmentRef::set)
                    .map(enrichment -> new ThinkingEvent(
                            "enrichment",
                            "Summarized the selected programs.",
                            Map.of("count", enrichment.items().size(), "degraded", enrichment.degraded())
                    ))
                    .flux();
        });

        Flux<ThinkingEvent> finalStep = Flux.defer(() ->
                Mono.fromCallable(() -> {
                            Outcome outcome = completeNewQuery(request, session.id(),
                                    shortlistRef.get(), selectionRef.get(), enrichmentRef.get());
                            sessionStore.save(session.id(), outcome.context(), session.temporary());
                            return outcome.response();
                        })
                        .subscribeOn(Schedulers.boundedElastic())
                        .map(response -> new ThinkingEvent("final", response.message(), response))
                        .flux()
        );

        // start → retrieval → selection → enrichment → final
        return Flux.concat(retrievalStep, selectionStep, enrichmentStep, finalStep);
    }

    private RecommendationResponse followUp(String sessionId, FollowUpTarget target, SessionContext context) {
        int id = target.shortlistId();
        Enrichment enrichment = context.lastEnrichment() == null ? Enrichment.empty() : context.lastEnrichment();
        ProgramCard card = cardAssembler.toCard(
                target.rank(), target.program(), context.lastSelection().reasonFor(id), enrichment.forId(id));
        log.debug("Follow-up resolved to rank {} (shortlist id {}) via {}", target.rank(), id, target.matchKind());

        return new RecommendationResponse(
                sessionId,
                TurnType.FOLLOW_UP,
                "More about " + card.name() + ".",
                context.lastSelection().degraded() || enrichment.degraded(),
                List.of(card),
                target.requestedFields()
        );
    }

    private Outcome completeNewQuery(FundingQueryRequest request,
                                     String sessionId,
                                     Shortlist shortlist,
                                     SelectionResult selection,
                                     Enrichment enrichment) {
        queryLogService.recordQuery(sessionId, properties.getSelectionModel(), request.query(), shortlist, selection);
        SessionContext next = new SessionContext(request.query(), shortlist, selection, enrichment);

        if (shortlist.isEmpty()) {
            log.debug("No matches for '{}'", request.query());
            return new Outcome(
                    new RecommendationResponse(sessionId, TurnType.NO_MATCHES, NO_MATCHES_MESSAGE,
                            false, List.of(), List.of()),
                    next
            );
        }

        List<ProgramCard> cards = cardAssembler.assemble(shortlist, selection, enrichment);
        boolean degraded = selection.degraded() || enrichment.degraded();
        String message = "Selected " + cards.size() + " of " + shortlist.size() + " matching programs."
                + (degraded ? " Some details could not be generated and were taken from the program data." : "");
        return new Outcome(
                new RecommendationResponse(sessionId, TurnType.NEW_QUERY, message, degraded, cards, List.of()),
                next
        );
    }

    /**
     * Shortlist summary for the UI: id, name, score and deadline of every candidate.
     */
    private List<Map<String, Object>> summarizeShortlist(Shortlist shortlist) {
        return shortlist.programs().stream()
                .map(this::summarizeProgram)
                .toList();
    }

    private Map<String, Object> summarizeProgram(FundingProgram program) {
        Map<String, Object> summary = new LinkedHashMap<>();
        summary.put("id", program.id());
        summary.put("name", program.displayName());
        summary.put("score", program.relevanceScore());
        summary.put("daysLeft", program.daysLeft());
        return summary;
    }

    /** Response of a turn plus the context to carry into the next one. */
    public record Outcome(RecommendationResponse response, SessionContext context) { }
}
