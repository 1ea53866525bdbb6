package com.example.FundScout.service;

import lombok.RequiredArgsConstructor;
import org.springframework.ai.embedding.EmbeddingModel;
import org.springframework.stereotype.Service;

/**
 * Turns query text into the fixed-dimension vector the funding index was built with.
 */
@Service
@RequiredArgsConstructor
public class EmbeddingClient {

    static final String CALL_NAME = "embedding";

    private final EmbeddingModel embeddingModel;
    private final ResilientCallExecutor callExecutor;

    public float[] embed(String text) {
        if (text == null || text.isBlank()) {
            throw new IllegalArgumentException("text to embed must not be blank");
        }
        return callExecutor.call(
                CALL_NAME,
                () -> embeddingModel.embed(text),
                e -> new RetrievalException("Embedding request failed", e)
        );
    }
}
