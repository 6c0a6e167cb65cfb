package com.phillippitts.callrelay.domain;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import static org.assertj.core.api.Assertions.assertThat;

class CallStatusTest {

    @Test
    void forwardStepsAreLegal() {
        assertThat(CallStatus.RINGING.canTransitionTo(CallStatus.ANSWERED)).isTrue();
        assertThat(CallStatus.ANSWERED.canTransitionTo(CallStatus.IN_PROGRESS)).isTrue();
        assertThat(CallStatus.IN_PROGRESS.canTransitionTo(CallStatus.ENDED)).isTrue();
    }

    @ParameterizedTest
    @EnumSource(value = CallStatus.class, names = {"RINGING", "ANSWERED", "IN_PROGRESS"})
    void endingIsLegalFromEveryLiveStatus(CallStatus from) {
        assertThat(from.canTransitionTo(CallStatus.ENDED)).isTrue();
    }

    @Test
    void skippingAStepIsRejected() {
        assertThat(CallStatus.RINGING.canTransitionTo(CallStatus.IN_PROGRESS)).isFalse();
    }

    @Test
    void backwardsAndRepeatedStepsAreRejected() {
        assertThat(CallStatus.ANSWERED.canTransitionTo(CallStatus.RINGING)).isFalse();
        assertThat(CallStatus.IN_PROGRESS.canTransitionTo(CallStatus.ANSWERED)).isFalse();
        assertThat(CallStatus.ANSWERED.canTransitionTo(CallStatus.ANSWERED)).isFalse();
    }

    @ParameterizedTest
    @EnumSource(CallStatus.class)
    void endedIsTerminal(CallStatus next) {
        assertThat(CallStatus.ENDED.canTransitionTo(next)).isFalse();
    }

    @Test
    void nullTargetIsRejected() {
        assertThat(CallStatus.RINGING.canTransitionTo(null)).isFalse();
    }

    @Test
    void parsesWireNamesIgnoringCase() {
        assertThat(CallStatus.fromWire("in_progress")).contains(CallStatus.IN_PROGRESS);
        assertThat(CallStatus.fromWire(" Answered ")).contains(CallStatus.ANSWERED);
        assertThat(CallStatus.fromWire("on_hold")).isEmpty();
        assertThat(CallStatus.fromWire(null)).isEmpty();
    }
}
