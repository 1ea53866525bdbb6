package com.example.FundScout.service;

import com.example.FundScout.model.FundingProgram;
import com.example.FundScout.model.SearchCriteria;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static com.example.FundScout.service.TestPrograms.program;
import static com.example.FundScout.service.TestPrograms.scored;
import static org.assertj.core.api.Assertions.assertThat;

class HybridMergerTest {

    private final DeadlineNormalizer normalizer = new DeadlineNormalizer(TestPrograms.CLOCK);
    private final HybridMerger merger = new HybridMerger(normalizer, new RelevanceScorer(normalizer));
    private final SearchCriteria criteria = new SearchCriteria("robotics", 0L, "robotics", "");

    @Test
    void truncatesToWantKeepingTopScoresAndTieOrder() {
        List<FundingProgram> vector = List.of(
                scored("A", "https://a.example", 40),
                scored("B", "https://b.example", 80),
                scored("C", "https://c.example", 40),
                scored("D", "https://d.example", 70),
                scored("E", "https://e.example", 30)
        );

        List<FundingProgram> merged = merger.merge(vector, List.of(), criteria, 3);

        assertThat(merged).extracting(FundingProgram::name).containsExactly("B", "D", "A");
    }

    @Test
    void keywordCandidateAlreadyFoundByVectorSearchIsNotAdded() {
        List<FundingProgram> vector = List.of(scored("Robotics Fund", "https://x.com/a", 50));
        List<FundingProgram> keyword = List.of(
                program("Robotics Fund (catalog)", "https://X.com/a/"),
                program("Pilot Lines", "https://x.com/b")
        );

        List<FundingProgram> merged = merger.merge(vector, keyword, criteria, 10);

        assertThat(merged).extracting(FundingProgram::url)
                .containsExactly("https://x.com/a", "https://x.com/b");
    }

    @Test
    void keywordDuplicatesAmongThemselvesAreAddedOnce() {
        List<FundingProgram> keyword = List.of(
                program("InnoTop", "https://isb.example/innotop"),
                program("InnoTop copy", "https://isb.example/innotop/")
        );

        assertThat(merger.merge(List.of(), keyword, criteria, 10)).hasSize(1);
    }

    @Test
    void expiredKeywordCandidatesAreSkipped() {
        FundingProgram expired = program("Old Call", "https://old.example").toBuilder().deadline("01.01.2020").build();
        FundingProgram open = program("New Call", "https://new.example").toBuilder().deadline("31.12.2026").build();

        List<FundingProgram> merged = merger.merge(List.of(), List.of(expired, open), criteria, 10);

        assertThat(merged).extracting(FundingProgram::name).containsExactly("New Call");
        assertThat(merged.get(0).daysLeft()).isNotNull();
        assertThat(merged.get(0).relevanceScore()).isEqualTo(20);
    }

    @Test
    void neverReturnsMoreThanWant() {
        List<FundingProgram> vector = new ArrayList<>();
        List<FundingProgram> keyword = new ArrayList<>();
        for (int i = 0; i < 30; i++) {
            vector.add(scored("V" + i, "https://v.example/" + i, i));
            keyword.add(program("K" + i, "https://k.example/" + i));
        }

        assertThat(merger.merge(vector, keyword, criteria, 5)).hasSize(5);
        assertThat(merger.merge(vector, keyword, criteria, 0)).isEmpty();
    }

    @Test
    void keywordAdditionsAreScoredAndRankedWithVectorCandidates() {
        List<FundingProgram> vector = List.of(scored("Generic Fund", "https://g.example", 10));
        FundingProgram robotics = FundingProgram.builder()
                .name("Robotics Pilot").url("https://r.example").domain("Robotics").build();

        List<FundingProgram> merged = merger.merge(vector, List.of(robotics), criteria, 10);

        assertThat(merged).extracting(FundingProgram::name).containsExactly("Robotics Pilot", "Generic Fund");
        assertThat(merged.get(0).relevanceScore()).isEqualTo(40);
    }
}
