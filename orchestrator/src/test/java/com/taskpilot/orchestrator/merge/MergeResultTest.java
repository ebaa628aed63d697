package com.taskpilot.orchestrator.merge;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Locale;

import static org.assertj.core.api.Assertions.assertThat;

class MergeResultTest {

    Locale defaultLocale;

    @BeforeEach
    void setUp() {
        defaultLocale = Locale.getDefault();
        // Turkish lower-cases 'I' to a dotless 'ı'.
        Locale.setDefault(Locale.forLanguageTag("tr-TR"));
    }

    @AfterEach
    void tearDown() {
        Locale.setDefault(defaultLocale);
    }

    @Test
    void requiresRebase_upperCaseMessage_matchesInAnyLocale() {
        MergeResult result = MergeResult.failed("r1", "api", MergeStrategy.DIRECT, "REBASE REQUIRED: branch is behind main");

        assertThat(result.requiresRebase()).isTrue();
    }

    @Test
    void looksLikeConflict_upperCaseMessage_matchesInAnyLocale() {
        MergeResult result = MergeResult.failed("r1", "api", MergeStrategy.DIRECT, "MERGE CONFLICT IN src/App.java");

        assertThat(result.looksLikeConflict()).isTrue();
    }

    @Test
    void looksLikeConflict_conflictFilesWithoutMessage() {
        MergeResult result = new MergeResult("r1", "api", MergeStrategy.DIRECT, false, null,
                null, null, "merge", List.of("src/App.java"));

        assertThat(result.looksLikeConflict()).isTrue();
        assertThat(result.requiresRebase()).isFalse();
    }
}
