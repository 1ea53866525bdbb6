package com.example.FundScout.service;

import com.example.FundScout.model.FundingProgram;
import com.example.FundScout.model.SearchCriteria;

import java.util.List;
import java.util.stream.Collectors;

/**
 * The vector index as one comprehensive-mode source.
 */
public class VectorIndexFundingSource implements FundingSource {

    static final String NAME = "vector-index";

    private final EmbeddingClient embeddingClient;
    private final VectorRetriever vectorRetriever;
    private final String namespace;

    public VectorIndexFundingSource(EmbeddingClient embeddingClient, VectorRetriever vectorRetriever, String namespace) {
        this.embeddingClient = embeddingClient;
        this.vectorRetriever = vectorRetriever;
        this.namespace = namespace;
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public List<FundingProgram> search(SearchCriteria criteria, int limit) {
        float[] vector = embeddingClient.embed(criteria.query());
        return vectorRetriever.search(vector, limit, namespace).stream()
                .map(match -> FundingProgram.fromAttributes(match.metadata()))
                .collect(Collectors.toList());
    }
}
