package com.example.FundScout.service;

import com.example.FundScout.config.FundingProperties;
import com.example.FundScout.model.FundingProgram;
import com.example.FundScout.model.FundingQueryRequest;
import com.example.FundScout.model.Shortlist;
import com.example.FundScout.model.VectorMatch;
import com.example.FundScout.repository.FundingCatalog;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class FundingShortlistServiceTest {

    private EmbeddingClient embeddingClient;
    private VectorRetriever vectorRetriever;
    private FundingShortlistService service;

    @BeforeEach
    void setUp() {
        embeddingClient = mock(EmbeddingClient.class);
        vectorRetriever = mock(VectorRetriever.class);

        FundingCatalog catalog = new FundingCatalog(List.of(
                Map.of("name", "Robotics Pilot Fund", "url", "https://example.org/robotics-pilot",
                        "contact", "robotics@example.org", "domain", "Robotics",
                        "description", "Funds robotics pilot lines"),
                Map.of("name", "Robotics Archive Call", "url", "https://example.org/robotics-archive",
                        "description", "Robotics call from the past", "deadline", "01.01.2020")
        ));
        FundingProperties properties = new FundingProperties();
        DeadlineNormalizer normalizer = new DeadlineNormalizer(TestPrograms.CLOCK);
        RelevanceScorer scorer = new RelevanceScorer(normalizer);

        service = new FundingShortlistService(
                embeddingClient,
                vectorRetriever,
                normalizer,
                scorer,
                new KeywordBackfillService(catalog, properties),
                new HybridMerger(normalizer, scorer),
                new FieldBackfillService(catalog, normalizer),
                properties
        );
        when(embeddingClient.embed(anyString())).thenReturn(new float[]{0.1f, 0.2f});
    }

    @Test
    void mergesVectorAndKeywordCandidatesAndNumbersThem() {
        when(vectorRetriever.search(any(), eq(8), eq("openai-v3"))).thenReturn(List.of(
                new VectorMatch(Map.of("name", "InnoTop", "url", "https://isb.example/innotop",
                        "deadline", "30 June 2026"), 0.91),
                new VectorMatch(Map.of("name", "Closed Call", "url", "https://closed.example",
                        "deadline", "01.12.2025"), 0.88),
                new VectorMatch(Map.of("name", "Robotics Pilot Fund", "url", "https://example.org/robotics-pilot/",
                        "contact", "N/A"), 0.80)
        ));

        Shortlist shortlist = service.shortlist(FundingQueryRequest.of("robotics pilot"));

        assertThat(shortlist.programs()).extracting(FundingProgram::name)
                .containsExactly("InnoTop", "Robotics Pilot Fund");
        assertThat(shortlist.programs()).extracting(FundingProgram::id).containsExactly(1, 2);
        assertThat(shortlist.byId(2).orElseThrow().contact()).isEqualTo("robotics@example.org");
    }

    @Test
    void shortlistNeverExceedsWant() {
        when(vectorRetriever.search(any(), anyInt(), anyString())).thenReturn(List.of(
                new VectorMatch(Map.of("name", "A", "url", "https://a.example"), 0.9),
                new VectorMatch(Map.of("name", "B", "url", "https://b.example"), 0.8),
                new VectorMatch(Map.of("name", "C", "url", "https://c.example"), 0.7)
        ));
        FundingQueryRequest request = new FundingQueryRequest("robotics", null, null, null, null, null, 2, null);

        assertThat(service.shortlist(request).size()).isEqualTo(2);
    }

    @Test
    void retrievalFailurePropagates() {
        when(embeddingClient.embed(anyString())).thenThrow(new RetrievalException("down", new RuntimeException()));

        assertThatThrownBy(() -> service.shortlist(FundingQueryRequest.of("robotics")))
                .isInstanceOf(RetrievalException.class);
    }

    @Test
    void blankQueryIsRejectedBeforeAnyCall() {
        assertThatThrownBy(() -> service.shortlist(FundingQueryRequest.of("  ")))
                .isInstanceOf(IllegalArgumentException.class);
        verify(embeddingClient, never()).embed(anyString());
    }
}
