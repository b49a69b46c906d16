package com.toolstock.notifier.session;

import com.toolstock.notifier.error.TransientTransportException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class SessionHolderTest {

    @Mock private ChannelSession  first;
    @Mock private ChannelSession  second;
    @Mock private SessionListener listener;

    private final SessionHolder holder = new SessionHolder();

    @Test
    void get_withoutSession_throwsTransient() {
        assertThatThrownBy(holder::get).isInstanceOf(TransientTransportException.class);
        assertThat(holder.current()).isEmpty();
        assertThat(holder.getState()).isEqualTo(SessionState.IDLE);
    }

    @Test
    void install_returnsReplacedSession() {
        assertThat(holder.install(first)).isEmpty();
        assertThat(holder.install(second)).contains(first);

        assertThat(holder.get()).isSameAs(second);
        assertThat(holder.isCurrent(second)).isTrue();
        assertThat(holder.isCurrent(first)).isFalse();
        assertThat(holder.isCurrent(null)).isFalse();
    }

    @Test
    void listeners_followTheActiveSession() {
        holder.addListener(listener);
        holder.install(first);
        verify(first).addListener(listener);

        holder.install(second);
        verify(first).removeListener(listener);
        verify(second).addListener(listener);
    }

    @Test
    void addListener_attachesToAlreadyInstalledSession() {
        holder.install(first);

        holder.addListener(listener);

        verify(first).addListener(listener);
    }

    @Test
    void getState_delegatesToActiveSession() {
        when(first.getState()).thenReturn(SessionState.STABLE);
        holder.install(first);

        assertThat(holder.getState()).isEqualTo(SessionState.STABLE);
    }
}
