package com.whereq.launcher.model;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SubmissionStateTest {

    @Test
    void followsSubmissionLifecycle() {
        SubmissionState state = SubmissionState.UNSUBMITTED
                .transitionTo(SubmissionState.VALIDATING)
                .transitionTo(SubmissionState.DISPATCHING)
                .transitionTo(SubmissionState.SUBMITTED);

        assertThat(state.isTerminal()).isTrue();
    }

    @Test
    void validationMayFailBeforeDispatch() {
        assertThat(SubmissionState.VALIDATING.canTransitionTo(SubmissionState.FAILED)).isTrue();
        assertThat(SubmissionState.UNSUBMITTED.canTransitionTo(SubmissionState.DISPATCHING)).isFalse();
    }

    @Test
    void terminalStatesHaveNoWayBack() {
        for (SubmissionState next : SubmissionState.values()) {
            assertThat(SubmissionState.SUBMITTED.canTransitionTo(next)).isFalse();
            assertThat(SubmissionState.FAILED.canTransitionTo(next)).isFalse();
        }
        assertThatThrownBy(() -> SubmissionState.FAILED.transitionTo(SubmissionState.UNSUBMITTED))
                .isInstanceOf(IllegalStateException.class);
    }
}
