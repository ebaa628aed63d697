package com.taskpilot.orchestrator.security;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CapabilityProfileTest {

    @Test
    void allowedCalls_eachProfileStrictlyExtendsThePreviousOne() {
        CapabilityProfile[] profiles = CapabilityProfile.values();
        for (int i = 1; i < profiles.length; i++) {
            assertThat(profiles[i].allowedCalls())
                    .as("%s extends %s", profiles[i], profiles[i - 1])
                    .containsAll(profiles[i - 1].allowedCalls())
                    .hasSizeGreaterThan(profiles[i - 1].allowedCalls().size());
        }
    }

    @Test
    void allowedCalls_viewerCanReadOutputButNotRecoverIt() {
        assertThat(CapabilityProfile.VIEWER.allowedCalls())
                .contains(ProtocolCall.TASKS_OUTPUT)
                .doesNotContain(ProtocolCall.TASKS_RECOVER_OUTPUT);
        assertThat(CapabilityProfile.PAIR_WORKER.allowedCalls())
                .contains(ProtocolCall.TASKS_RECOVER_OUTPUT, ProtocolCall.JOBS_SUBMIT)
                .doesNotContain(ProtocolCall.TASKS_CREATE);
    }

    @Test
    void allowedCalls_isUnmodifiable() {
        assertThatThrownBy(() -> CapabilityProfile.VIEWER.allowedCalls().add(ProtocolCall.TASKS_DELETE))
                .isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    void isUnrestricted_onlyMaintainer() {
        assertThat(CapabilityProfile.MAINTAINER.isUnrestricted()).isTrue();
        assertThat(CapabilityProfile.OPERATOR.isUnrestricted()).isFalse();
    }

    @Test
    void parse_isCaseAndWhitespaceInsensitive() {
        assertThat(CapabilityProfile.parse(" Pair_Worker ")).isEqualTo(CapabilityProfile.PAIR_WORKER);
        assertThat(CapabilityProfile.parse("maintainer")).isEqualTo(CapabilityProfile.MAINTAINER);
    }

    @Test
    void parse_unknownName_listsValidProfiles() {
        assertThatThrownBy(() -> CapabilityProfile.parse("root"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("'root'")
                .hasMessageContaining("viewer, planner, pair_worker, operator, maintainer");
    }

    @Test
    void cappedAt_lowersOnlyProfilesAboveTheCeiling() {
        assertThat(CapabilityProfile.MAINTAINER.cappedAt(CapabilityProfile.PAIR_WORKER))
                .isEqualTo(CapabilityProfile.PAIR_WORKER);
        assertThat(CapabilityProfile.PLANNER.cappedAt(CapabilityProfile.PAIR_WORKER))
                .isEqualTo(CapabilityProfile.PLANNER);
    }
}
