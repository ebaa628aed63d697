package com.taskpilot.orchestrator.security;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class AuthorizationPolicyTest {

    @Test
    void check_viewerMayListButNotDelete() {
        AuthorizationPolicy policy = new AuthorizationPolicy(CapabilityProfile.VIEWER);

        assertThat(policy.check("tasks", "list")).isTrue();
        assertThat(policy.check("tasks", "delete")).isFalse();
    }

    @Test
    void check_unregisteredPair_onlyMaintainerAllowed() {
        assertThat(new AuthorizationPolicy(CapabilityProfile.MAINTAINER).check("plugins", "install")).isTrue();
        assertThat(new AuthorizationPolicy(CapabilityProfile.OPERATOR).check("plugins", "install")).isFalse();
        assertThat(new AuthorizationPolicy(CapabilityProfile.VIEWER).check("plugins", "install")).isFalse();
    }

    @Test
    void check_operatorMayApproveButNotMerge() {
        AuthorizationPolicy policy = new AuthorizationPolicy(CapabilityProfile.OPERATOR);

        assertThat(policy.check("review", "approve")).isTrue();
        assertThat(policy.check("review", "merge")).isFalse();
    }

    @Test
    void enforce_denied_throwsWithProfileAndCall() {
        AuthorizationPolicy policy = new AuthorizationPolicy(CapabilityProfile.VIEWER);

        assertThatThrownBy(() -> policy.enforce("tasks", "delete"))
                .isInstanceOfSatisfying(AuthorizationException.class, e -> {
                    assertThat(e.getCode()).isEqualTo("AUTHORIZATION_DENIED");
                    assertThat(e.getProfile()).isEqualTo(CapabilityProfile.VIEWER);
                    assertThat(e.getCapability()).isEqualTo("tasks");
                    assertThat(e.getMethod()).isEqualTo("delete");
                })
                .hasMessage("Profile 'viewer' is not authorized for tasks.delete");
    }

    @Test
    void enforce_allowed_doesNotThrow() {
        AuthorizationPolicy policy = new AuthorizationPolicy(CapabilityProfile.PAIR_WORKER);

        assertThatCode(() -> policy.enforce("jobs", "submit")).doesNotThrowAnyException();
    }
}
