package com.example.FundScout.service;

/**
 * Embedding or vector index failure. No fallback search path exists, so this
 * propagates and the turn produces no shortlist.
 */
public class RetrievalException extends RuntimeException {

    public RetrievalException(String message, Throwable cause) {
        super(message, cause);
    }
}
