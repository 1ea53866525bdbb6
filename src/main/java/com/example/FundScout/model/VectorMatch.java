package com.example.FundScout.model;

import java.util.Map;

/**
 * One nearest-neighbour hit: flat program metadata plus cosine similarity.
 */
public record VectorMatch(Map<String, String> metadata, double score) {

    public VectorMatch {
        metadata = metadata == null ? Map.of() : metadata;
    }
}
