package com.example.FundScout.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Pipeline settings bound from {@code funding.*} in application.yml:
 *
 * funding:
 *   namespace: openai-v3
 *   top-k: 8
 *   want: 8
 *   wanted: 3
 *   catalog-path: classpath:data/funding_catalog.csv
 *   resilience:
 *     timeout: 20s
 *     max-attempts: 3
 *   comprehensive:
 *     sources: [foerderdatenbank, isb, nrweuropa]
 */
@Data
@ConfigurationProperties(prefix = "funding")
public class FundingProperties {

    /** Vector index namespace. */
    private String namespace = "openai-v3";

    /** Vector candidates fetched per query. */
    private int topK = 8;

    /** Shortlist size after hybrid merge. */
    private int want = 8;

    /** Programs the LLM picks from the shortlist. */
    private int wanted = 3;

    /** Cap on keyword backfill candidates. */
    private int keywordTopN = 50;

    /** Spring resource location of the canonical CSV dataset. */
    private String catalogPath = "classpath:data/funding_catalog.csv";

    /** Chat client key used for selection ("openai" or "deepseek"). */
    private String selectionModel = "openai";

    /** Chat client key used for enrichment. */
    private String enrichmentModel = "openai";

    private Resilience resilience = new Resilience();

    private Comprehensive comprehensive = new Comprehensive();

    private Session session = new Session();

    @Data
    public static class Resilience {
        /** Per-attempt timeout of a network call. */
        private Duration timeout = Duration.ofSeconds(20);
        /** Total attempts including the first one. */
        private int maxAttempts = 3;
        /** Initial backoff, doubled after every failed attempt. */
        private Duration backoff = Duration.ofMillis(500);
        /** Connect timeout of the model HTTP client; its read timeout is {@code timeout}. */
        private Duration connectTimeout = Duration.ofSeconds(5);
    }

    @Data
    public static class Comprehensive {
        /** Sources searched at the same time. */
        private int concurrency = 4;
        private Duration sourceTimeout = Duration.ofSeconds(15);
        private int maxResults = 15;
        /** Catalog source names, one search task each. */
        private List<String> sources = new ArrayList<>();
        /** Also search the vector index as one of the sources. */
        private boolean includeVectorIndex = true;
    }

    @Data
    public static class Session {
        private Duration ttl = Duration.ofHours(2);
        private Duration temporaryTtl = Duration.ofMinutes(10);
    }
}
