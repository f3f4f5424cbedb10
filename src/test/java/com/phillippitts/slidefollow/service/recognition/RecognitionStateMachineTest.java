package com.phillippitts.slidefollow.service.recognition;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class RecognitionStateMachineTest {

    private final RecognitionStateMachine machine = new RecognitionStateMachine();

    @Test
    void startsIdle() {
        assertThat(machine.state()).isEqualTo(SessionState.IDLE);
    }

    @Test
    void connectingThenStreaming() {
        long gen = machine.beginConnecting();

        assertThat(gen).isPositive();
        assertThat(machine.state()).isEqualTo(SessionState.CONNECTING);
        assertThat(machine.markStreaming(gen)).isTrue();
        assertThat(machine.state()).isEqualTo(SessionState.STREAMING);
    }

    @Test
    void rejectsStartWhileActive() {
        machine.beginConnecting();

        assertThat(machine.beginConnecting()).isEqualTo(RecognitionStateMachine.REJECTED);
    }

    @Test
    void staleGenerationCannotTransition() {
        long first = machine.beginConnecting();
        machine.stop();
        long second = machine.beginConnecting();

        assertThat(machine.markStreaming(first)).isFalse();
        assertThat(machine.fail(first)).isFalse();
        assertThat(machine.isCurrent(first)).isFalse();
        assertThat(machine.isCurrent(second)).isTrue();
    }

    @Test
    void failOnlyOnce() {
        long gen = machine.beginConnecting();

        assertThat(machine.fail(gen)).isTrue();
        assertThat(machine.fail(gen)).isFalse();
        assertThat(machine.state()).isEqualTo(SessionState.FAILED);
    }

    @Test
    void stoppedSessionCannotBeResurrectedByLateHandshake() {
        long gen = machine.beginConnecting();

        assertThat(machine.stop()).isEqualTo(SessionState.CONNECTING);

        assertThat(machine.markStreaming(gen)).isFalse();
        assertThat(machine.state()).isEqualTo(SessionState.IDLE);
    }

    @Test
    void canRestartAfterFailure() {
        long gen = machine.beginConnecting();
        machine.fail(gen);

        assertThat(machine.beginConnecting()).isEqualTo(gen + 1);
    }
}
