package com.example.FundScout.service;

import com.example.FundScout.model.FundingProgram;
import com.example.FundScout.model.SearchCriteria;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Merges scored vector candidates with keyword candidates into one ranked list.
 */
@Component
@RequiredArgsConstructor
public class HybridMerger {

    private static final Logger log = LoggerFactory.getLogger(HybridMerger.class);

    private final DeadlineNormalizer deadlineNormalizer;
    private final RelevanceScorer relevanceScorer;

    /**
     * 1. seen = dedupe keys of the vector candidates
     * 2. every unseen keyword candidate gets deadline + score; expired ones are skipped
     * 3. vector candidates + additions, stable-sorted by score descending
     * 4. truncated to {@code want}
     *
     * @param vectorCandidates already deadline-filtered and scored
     */
    public List<FundingProgram> merge(List<FundingProgram> vectorCandidates,
                                      List<FundingProgram> keywordCandidates,
                                      SearchCriteria criteria,
                                      int want) {
        Set<String> seen = new HashSet<>();
        for (FundingProgram candidate : vectorCandidates) {
            seen.add(candidate.dedupeKey());
        }

        List<FundingProgram> additions = new ArrayList<>();
        for (FundingProgram candidate : keywordCandidates) {
            String key = candidate.dedupeKey();
            if (seen.contains(key)) {
                continue;
            }
            FundingProgram normalized = deadlineNormalizer.normalize(candidate);
            if (!deadlineNormalizer.isOpen(normalized)) {
                continue;
            }
            seen.add(key);
            additions.add(relevanceScorer.scored(normalized, criteria));
        }

        List<FundingProgram> merged = new ArrayList<>(vectorCandidates.size() + additions.size());
        merged.addAll(vectorCandidates);
        merged.addAll(additions);
        // List.sort is stable: equal scores keep concatenation order
        merged.sort(Comparator.comparingInt(FundingProgram::relevanceScore).reversed());

        List<FundingProgram> result = merged.size() > want
                ? new ArrayList<>(merged.subList(0, Math.max(0, want)))
                : merged;
        log.debug("Hybrid merge: {} vector + {} keyword additions -> {} (want={})",
                vectorCandidates.size(), additions.size(), result.size(), want);
        return result;
    }
}
