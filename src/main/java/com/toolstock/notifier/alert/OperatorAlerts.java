package com.toolstock.notifier.alert;

import java.time.Duration;

/**
 * Operator-facing notifications about the chat session. Implementations must
 * not throw: an alert failing must never disturb reconnection.
 */
public interface OperatorAlerts {

    void disconnected(String reason);

    void reconnecting(int attempt, Duration delay);

    void reconnected(int attempts, Duration downtime);

    void reconnectFailed(int attempt, Throwable error);

    void reconnectExhausted(int attempts);

    /** Terminal: the linked device needs to be paired again by hand. */
    void authenticationFailed(String message);

    void healthDegraded(String reason);

    void startupFailed(Throwable error);
}
