package com.example.FundScout.service;

import com.example.FundScout.config.FundingProperties;
import com.example.FundScout.model.FundingProgram;
import com.example.FundScout.model.FundingQueryRequest;
import com.example.FundScout.model.SearchCriteria;
import com.example.FundScout.model.Shortlist;
import com.example.FundScout.model.VectorMatch;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Retrieval-only half of a turn, no chat model involved:
 * 1. embed the query
 * 2. nearest programs from the vector index
 * 3. parse deadlines, drop expired programs
 * 4. score and rank, keep top-k
 * 5. merge in keyword hits from the catalog, truncate to want
 * 6. fill missing fields from the catalog
 * 7. number the result 1..n
 */
@Service
@RequiredArgsConstructor
public class FundingShortlistService {

    private static final Logger log = LoggerFactory.getLogger(FundingShortlistService.class);

    private final EmbeddingClient embeddingClient;
    private final VectorRetriever vectorRetriever;
    private final DeadlineNormalizer deadlineNormalizer;
    private final RelevanceScorer relevanceScorer;
    private final KeywordBackfillService keywordBackfillService;
    private final HybridMerger hybridMerger;
    private final FieldBackfillService fieldBackfillService;
    private final FundingProperties properties;

    public Shortlist shortlist(FundingQueryRequest request) {
        SearchCriteria criteria = request.toCriteria();
        return shortlist(criteria, request.resolveTopK(properties.getTopK()), request.resolveWant(properties.getWant()));
    }

    /**
     * @throws RetrievalException when embedding or the vector query fails after retries
     */
    public Shortlist shortlist(SearchCriteria criteria, int topK, int want) {
        float[] queryVector = embeddingClient.embed(criteria.query());
        List<VectorMatch> matches = vectorRetriever.search(queryVector, topK, properties.getNamespace());

        List<FundingProgram> vectorCandidates = rankVectorMatches(matches, criteria, topK);
        List<FundingProgram> keywordCandidates =
                keywordBackfillService.candidates(criteria.query(), criteria.targetDomain());

        List<FundingProgram> merged = hybridMerger.merge(vectorCandidates, keywordCandidates, criteria, want);

        // a backfilled deadline may reveal an expired program
        List<FundingProgram> filled = fieldBackfillService.backfillAll(merged).stream()
                .filter(deadlineNormalizer::isOpen)
                .collect(Collectors.toList());

        log.debug("Shortlist for '{}': {} vector matches, {} open vector candidates, {} keyword candidates -> {}",
                criteria.query(), matches.size(), vectorCandidates.size(), keywordCandidates.size(), filled.size());
        return Shortlist.of(criteria.query(), filled);
    }

    List<FundingProgram> rankVectorMatches(List<VectorMatch> matches, SearchCriteria criteria, int topK) {
        List<FundingProgram> candidates = new ArrayList<>(matches.size());
        for (VectorMatch match : matches) {
            FundingProgram program = deadlineNormalizer.normalize(FundingProgram.fromAttributes(match.metadata()));
            if (deadlineNormalizer.isOpen(program)) {
                candidates.add(relevanceScorer.scored(program, criteria));
            }
        }
        candidates.sort(Comparator.comparingInt(FundingProgram::relevanceScore).reversed());
        return candidates.size() > topK ? new ArrayList<>(candidates.subList(0, topK)) : candidates;
    }
}
