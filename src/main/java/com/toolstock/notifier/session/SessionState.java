package com.toolstock.notifier.session;

/**
 * Lifecycle of one {@link ChannelSession}. Transitions only move forward:
 *
 * <pre>
 *   IDLE → CONNECTING → READY → STABLE
 *              │          │       │
 *              └──────────┴───────┴──→ DISCONNECTED | AUTH_FAILED
 * </pre>
 *
 * {@code DISCONNECTED} and {@code AUTH_FAILED} are terminal for a session
 * object; recovery builds a new session.
 */
public enum SessionState {
    IDLE,
    CONNECTING,
    /** Connected, not yet probed. */
    READY,
    /** Connected and probed; operations are expected to succeed. */
    STABLE,
    DISCONNECTED,
    AUTH_FAILED;

    public boolean isTerminal() {
        return this == DISCONNECTED || this == AUTH_FAILED;
    }

    boolean isOpen() {
        return this == CONNECTING || this == READY || this == STABLE;
    }

    public boolean canTransitionTo(final SessionState next) {
        return switch (this) {
            case IDLE       -> next == CONNECTING;
            case CONNECTING -> next == READY || next.isTerminal();
            case READY      -> next == STABLE || next.isTerminal();
            case STABLE     -> next.isTerminal();
            default         -> false;
        };
    }
}
