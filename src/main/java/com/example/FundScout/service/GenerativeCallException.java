package com.example.FundScout.service;

/**
 * Chat model call failed, timed out or answered with nothing usable.
 * Selection and enrichment translate it into their documented fallbacks.
 */
public class GenerativeCallException extends RuntimeException {

    public GenerativeCallException(String message) {
        super(message);
    }

    public GenerativeCallException(String message, Throwable cause) {
        super(message, cause);
    }
}
