package com.example.FundScout.controller;

import com.example.FundScout.model.FundingQueryRequest;
import com.example.FundScout.model.RecommendationResponse;
import com.example.FundScout.model.ThinkingEvent;
import com.example.FundScout.service.FundingRecommendationService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;
import reactor.core.Disposable;
import reactor.core.publisher.Flux;

import java.io.IOException;

@RestController
@RequestMapping("/api/funding")
@RequiredArgsConstructor
public class FundingRecommendationController {

    private final FundingRecommendationService recommendationService;

    @PostMapping("/recommend")
    public RecommendationResponse recommend(@RequestBody FundingQueryRequest request) {
        return recommendationService.recommend(request);
    }

    @PostMapping(value = "/recommend/stream", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public SseEmitter streamRecommendation(@RequestBody FundingQueryRequest request) {
        // 0L means no timeout
        SseEmitter emitter = new SseEmitter(0L);

        // Stages: start / followup / retrieval / selection / enrichment / final
        Flux<ThinkingEvent> stream = recommendationService.streamRecommendation(request);

        Disposable subscription = stream.subscribe(
                event -> {
                    try {
                        // stage doubles as the SSE event name
                        emitter.send(
                                SseEmitter.event()
                                        .name(event.stage())
                                        .data(event)
                        );
                    } catch (IOException e) {
                        emitter.completeWithError(e);
                    }
                },
                emitter::completeWithError,
                emitter::complete
        );

        emitter.onCompletion(subscription::dispose);
        emitter.onTimeout(subscription::dispose);
        emitter.onError(t -> subscription.dispose());

        return emitter;
    }

    /**
     * Forget the conversation: the next turn is always a new query.
     */
    @DeleteMapping("/sessions/{sessionId}")
    public ResponseEntity<Void> resetSession(@PathVariable("sessionId") String sessionId) {
        boolean removed = recommendationService.resetSession(sessionId);
        return removed ? ResponseEntity.noContent().build() : ResponseEntity.notFound().build();
    }
}
