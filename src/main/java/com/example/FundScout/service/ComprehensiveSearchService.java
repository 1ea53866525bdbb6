package com.example.FundScout.service;

import com.example.FundScout.config.FundingProperties;
import com.example.FundScout.model.ComprehensiveSearchRequest;
import com.example.FundScout.model.FundingProgram;
import com.example.FundScout.model.SearchCriteria;
import com.example.FundScout.model.SourceSearchAggregate;
import com.example.FundScout.repository.FundingCatalog;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Searches every configured source at once with bounded concurrency. A source that
 * fails or times out is reported in the aggregate and never aborts the others.
 */
@Service
@RequiredArgsConstructor
public class ComprehensiveSearchService {

    private static final Logger log = LoggerFactory.getLogger(ComprehensiveSearchService.class);

    private final FundingCatalog catalog;
    private final EmbeddingClient embeddingClient;
    private final VectorRetriever vectorRetriever;
    private final DeadlineNormalizer deadlineNormalizer;
    private final RelevanceScorer relevanceScorer;
    private final FundingProperties properties;

    public SourceSearchAggregate search(ComprehensiveSearchRequest request) {
        return searchAsync(request).block();
    }

    public Mono<SourceSearchAggregate> searchAsync(ComprehensiveSearchRequest request) {
        return searchSources(request.toCriteria(),
                request.resolveMaxResults(properties.getComprehensive().getMaxResults()),
                sources());
    }

    /**
     * 1. one task per source, at most {@code concurrency} running, each under the source timeout
     * 2. failures recorded per source, results kept in source order
     * 3. dedupe, drop expired, score, stable sort, cap at {@code maxResults}
     */
    Mono<SourceSearchAggregate> searchSources(SearchCriteria criteria, int maxResults, List<FundingSource> sources) {
        FundingProperties.Comprehensive settings = properties.getComprehensive();
        Map<String, Integer> counts = new ConcurrentHashMap<>();
        Map<String, String> failures = new ConcurrentHashMap<>();

        return Flux.fromIterable(sources)
                .flatMapSequential(source ->
                                Mono.fromCallable(() -> source.search(criteria, maxResults))
                                        .subscribeOn(Schedulers.boundedElastic())
                                        .timeout(settings.getSourceTimeout())
                                        .doOnNext(found -> counts.put(source.name(), found.size()))
                                        .onErrorResume(e -> {
                                            log.warn("Funding source '{}' failed: {}", source.name(), e.toString());
                                            failures.put(source.name(), describe(e));
                                            return Mono.empty();
                                        }),
                        Math.max(1, settings.getConcurrency()))
                .collectList()
                .map(perSource -> {
                    List<FundingProgram> ranked = rank(perSource, criteria, maxResults);
                    log.debug("Comprehensive search: {} sources answered, {} failed, {} programs",
                            counts.size(), failures.size(), ranked.size());
                    return new SourceSearchAggregate(ranked, counts, failures);
                });
    }

    List<FundingSource> sources() {
        List<FundingSource> sources = new ArrayList<>();
        if (properties.getComprehensive().isIncludeVectorIndex()) {
            sources.add(new VectorIndexFundingSource(embeddingClient, vectorRetriever, properties.getNamespace()));
        }
        for (String name : properties.getComprehensive().getSources()) {
            sources.add(new CatalogFundingSource(name, catalog));
        }
        return sources;
    }

    private List<FundingProgram> rank(List<List<FundingProgram>> perSource, SearchCriteria criteria, int maxResults) {
        Set<String> seen = new HashSet<>();
        List<FundingProgram> out = new ArrayList<>();
        for (List<FundingProgram> found : perSource) {
            for (FundingProgram program : found) {
                if (!seen.add(program.dedupeKey())) {
                    continue;
                }
                FundingProgram normalized = deadlineNormalizer.normalize(program);
                if (deadlineNormalizer.isOpen(normalized)) {
                    out.add(relevanceScorer.scored(normalized, criteria));
                }
            }
        }
        out.sort(Comparator.comparingInt(FundingProgram::relevanceScore).reversed());
        return out.size() > maxResults ? new ArrayList<>(out.subList(0, maxResults)) : out;
    }

    private static String describe(Throwable e) {
        return e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage();
    }
}
