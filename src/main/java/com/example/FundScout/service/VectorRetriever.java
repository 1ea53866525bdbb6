package com.example.FundScout.service;

import com.example.FundScout.model.VectorMatch;
import com.example.FundScout.repository.FundingVectorRepository;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Nearest-neighbour lookup of funding programs by embedding similarity.
 * An empty index or zero matches is an empty list, not an error.
 */
@Service
@RequiredArgsConstructor
public class VectorRetriever {

    private static final Logger log = LoggerFactory.getLogger(VectorRetriever.class);

    static final String CALL_NAME = "vector";

    private final FundingVectorRepository vectorRepository;
    private final ResilientCallExecutor callExecutor;

    public List<VectorMatch> search(float[] vector, int topK, String namespace) {
        if (topK <= 0) {
            return List.of();
        }
        List<VectorMatch> matches = callExecutor.call(
                CALL_NAME,
                () -> vectorRepository.findNearest(vector, topK, namespace),
                e -> new RetrievalException("Vector index query failed", e)
        );
        if (matches == null || matches.isEmpty()) {
            log.debug("Vector search: no matches in namespace '{}'", namespace);
            return List.of();
        }
        return matches;
    }
}
