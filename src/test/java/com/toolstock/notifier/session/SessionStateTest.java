package com.toolstock.notifier.session;

import org.junit.jupiter.api.Test;

import static com.toolstock.notifier.session.SessionState.*;
import static org.assertj.core.api.Assertions.*;

class SessionStateTest {

    @Test
    void forwardEdges_areAllowed() {
        assertThat(IDLE.canTransitionTo(CONNECTING)).isTrue();
        assertThat(CONNECTING.canTransitionTo(READY)).isTrue();
        assertThat(READY.canTransitionTo(STABLE)).isTrue();
        for (final SessionState open : new SessionState[] {CONNECTING, READY, STABLE}) {
            assertThat(open.canTransitionTo(DISCONNECTED)).isTrue();
            assertThat(open.canTransitionTo(AUTH_FAILED)).isTrue();
        }
    }

    @Test
    void terminalStates_haveNoExit() {
        for (final SessionState next : values()) {
            assertThat(DISCONNECTED.canTransitionTo(next)).isFalse();
            assertThat(AUTH_FAILED.canTransitionTo(next)).isFalse();
        }
    }

    @Test
    void backwardAndSkippingEdges_areRejected() {
        assertThat(IDLE.canTransitionTo(READY)).isFalse();
        assertThat(IDLE.canTransitionTo(DISCONNECTED)).isFalse();
        assertThat(CONNECTING.canTransitionTo(STABLE)).isFalse();
        assertThat(STABLE.canTransitionTo(READY)).isFalse();
        assertThat(READY.canTransitionTo(CONNECTING)).isFalse();
    }
}
