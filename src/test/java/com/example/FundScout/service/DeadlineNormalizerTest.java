package com.example.FundScout.service;

import com.example.FundScout.model.FundingProgram;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class DeadlineNormalizerTest {

    private final DeadlineNormalizer normalizer = new DeadlineNormalizer(TestPrograms.CLOCK);

    @Test
    void deadlineDayItselfIsStillOpen() {
        FundingProgram program = normalizer.normalize(FundingProgram.builder().deadline("15.01.2026").build());

        assertThat(program.daysLeft()).isZero();
        assertThat(normalizer.isOpen(program)).isTrue();
        assertThat(normalizer.isUpcoming(program)).isTrue();
    }

    @Test
    void pastDeadlineIsClosed() {
        FundingProgram program = normalizer.normalize(FundingProgram.builder().deadline("14.01.2026").build());

        assertThat(program.daysLeft()).isEqualTo(-1);
        assertThat(normalizer.isOpen(program)).isFalse();
    }

    @Test
    void unparseableDeadlineIsKept() {
        FundingProgram program = normalizer.normalize(FundingProgram.builder().deadline("Information not found").build());

        assertThat(program.deadlineDate()).isNull();
        assertThat(program.daysLeft()).isNull();
        assertThat(normalizer.isOpen(program)).isTrue();
        assertThat(normalizer.isUpcoming(program)).isFalse();
    }
}
