package com.taskpilot.orchestrator.merge;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class MergeRiskTest {

    @Test
    void assess_smallSingleRepoChange_isLowRisk() {
        MergeRisk risk = MergeRisk.assess(1, 2, 3, List.of());

        assertThat(risk.score()).isZero();
        assertThat(risk.high()).isFalse();
    }

    @Test
    void assess_scoreOfOneWithoutOverlap_isNotHigh() {
        MergeRisk risk = MergeRisk.assess(2, 1, 1, List.of());

        assertThat(risk.score()).isEqualTo(1);
        assertThat(risk.high()).isFalse();
    }

    @Test
    void assess_manyCommitsAndFiles_isHigh() {
        MergeRisk risk = MergeRisk.assess(1, 6, 12, List.of());

        assertThat(risk.score()).isEqualTo(2);
        assertThat(risk.high()).isTrue();
    }

    @Test
    void assess_overlap_addsTwoAndIsHigh() {
        MergeRisk risk = MergeRisk.assess(1, 1, 1, List.of("api/src/Login.java"));

        assertThat(risk.score()).isEqualTo(2);
        assertThat(risk.high()).isTrue();
        assertThat(risk.overlapFiles()).containsExactly("api/src/Login.java");
    }

    @Test
    void assess_everyTerm_sumsToFive() {
        MergeRisk risk = MergeRisk.assess(3, 10, 40, List.of("a", "b"));

        assertThat(risk.score()).isEqualTo(5);
        assertThat(risk.commitCount()).isEqualTo(10);
        assertThat(risk.changedRepoCount()).isEqualTo(3);
        assertThat(risk.changedFileCount()).isEqualTo(40);
    }
}
