package com.toolstock.notifier.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;

/**
 * Typed configuration for the Shipping Notifier, loaded from
 * {@code application.conf} via Typesafe Config.
 *
 * <p>Secrets (the bridge API key) are read from environment variables via
 * Typesafe Config substitution (e.g. {@code ${?BRIDGE_API_KEY}}). This class
 * never logs secret values; only their presence is checked.
 */
public class NotifierConfig {

    private final Config raw;

    NotifierConfig(final Config config) {
        this.raw = config;
    }

    public static NotifierConfig load() {
        return new NotifierConfig(ConfigFactory.load().resolve());
    }

    /** Overlay {@code overrides} on top of the packaged defaults. Used by tests and tooling. */
    public static NotifierConfig from(final Config overrides) {
        return new NotifierConfig(overrides.withFallback(ConfigFactory.load()).resolve());
    }

    // ── Bridge (chat transport) ───────────────────────────────────────────────

    public String getBridgeBaseUrl() {
        return raw.getString("bridge.base-url");
    }

    public String getBridgeSession() {
        return raw.getString("bridge.session");
    }

    /** Empty string when no key is configured. */
    public String getBridgeApiKey() {
        return raw.hasPath("bridge.api-key") ? raw.getString("bridge.api-key") : "";
    }

    public Duration getBridgeConnectTimeout() {
        return raw.getDuration("bridge.connect-timeout");
    }

    public Duration getBridgeReadTimeout() {
        return raw.getDuration("bridge.read-timeout");
    }

    // ── Session ───────────────────────────────────────────────────────────────

    public Duration getSessionReadyTimeout() {
        return raw.getDuration("session.ready-timeout");
    }

    public Duration getSessionSettleDelay() {
        return raw.getDuration("session.settle-delay");
    }

    public Duration getSessionProbeTimeout() {
        return raw.getDuration("session.probe-timeout");
    }

    public int getSessionStabilizeAttempts() {
        return raw.getInt("session.stabilize-attempts");
    }

    public Duration getSessionStabilizeRetryDelay() {
        return raw.getDuration("session.stabilize-retry-delay");
    }

    public int getSessionHistorySize() {
        return raw.getInt("session.history-size");
    }

    // ── Reconnection ──────────────────────────────────────────────────────────

    public int getReconnectMaxAttempts() {
        return raw.getInt("reconnect.max-attempts");
    }

    public Duration getReconnectBaseDelay() {
        return raw.getDuration("reconnect.base-delay");
    }

    public Duration getReconnectMaxDelay() {
        return raw.getDuration("reconnect.max-delay");
    }

    public Duration getReconnectSettleDelay() {
        return raw.getDuration("reconnect.settle-delay");
    }

    public Duration getReconnectFollowUpDelay() {
        return raw.getDuration("reconnect.follow-up-delay");
    }

    // ── Health check ──────────────────────────────────────────────────────────

    public Duration getHealthCheckInterval() {
        return raw.getDuration("health-check.interval");
    }

    public Duration getHealthCheckTimeout() {
        return raw.getDuration("health-check.timeout");
    }

    // ── Delivery ──────────────────────────────────────────────────────────────

    public Duration getMessageDelay() {
        return raw.getDuration("delivery.message-delay");
    }

    public Duration getDeliverySettleDelay() {
        return raw.getDuration("delivery.settle-delay");
    }

    public Duration getSendTimeout() {
        return raw.getDuration("delivery.send-timeout");
    }

    public Duration getChannelCheckTimeout() {
        return raw.getDuration("delivery.channel-check.timeout");
    }

    public Duration getVerificationGrace() {
        return raw.getDuration("delivery.verification.grace");
    }

    public Duration getVerificationTimeout() {
        return raw.getDuration("delivery.verification.timeout");
    }

    public Duration getVerificationTolerance() {
        return raw.getDuration("delivery.verification.tolerance");
    }

    public int getVerificationPrefixLength() {
        return raw.getInt("delivery.verification.prefix-length");
    }

    // ── Retry (channel existence checks) ─────────────────────────────────────

    public int getRetryMaxAttempts() {
        return raw.getInt("retry.max-attempts");
    }

    public long getRetryInitialDelayMs() {
        return raw.getDuration("retry.initial-delay").toMillis();
    }

    public double getRetryBackoffFactor() {
        return raw.getDouble("retry.backoff-factor");
    }

    public long getRetryMaxDelayMs() {
        return raw.getDuration("retry.max-delay").toMillis();
    }

    // ── Auto-reply ────────────────────────────────────────────────────────────

    public boolean isAutoReplyEnabled() {
        return raw.getBoolean("auto-reply.enabled");
    }

    public Duration getAutoReplyDelay() {
        return raw.getDuration("auto-reply.reply-delay");
    }

    public Duration getAutoReplyNaturalDelay() {
        return raw.getDuration("auto-reply.natural-delay");
    }

    public Duration getAutoReplySuppressionWindow() {
        return raw.getDuration("auto-reply.suppression-window");
    }

    public Duration getAutoReplyEchoWindow() {
        return raw.getDuration("auto-reply.echo-window");
    }

    public Duration getAutoReplySendTimeout() {
        return raw.getDuration("auto-reply.send-timeout");
    }

    // ── Business hours ────────────────────────────────────────────────────────

    public Path getBusinessHoursFile() {
        return Paths.get(raw.getString("business-hours.file"));
    }

    public Duration getBusinessHoursReloadInterval() {
        return raw.getDuration("business-hours.reload-interval");
    }

    // ── Kafka ─────────────────────────────────────────────────────────────────

    public String getBootstrapServers() {
        return raw.getString("kafka.bootstrap-servers");
    }

    public String getConsumerGroupId() {
        return raw.getString("kafka.consumer.group-id");
    }

    public String getAutoOffsetReset() {
        return raw.getString("kafka.consumer.auto-offset-reset");
    }

    public int getMaxPollRecords() {
        return raw.getInt("kafka.consumer.max-poll-records");
    }

    public int getMaxPollIntervalMs() {
        return raw.getInt("kafka.consumer.max-poll-interval-ms");
    }

    public int getSessionTimeoutMs() {
        return raw.getInt("kafka.consumer.session-timeout-ms");
    }

    public int getHeartbeatIntervalMs() {
        return raw.getInt("kafka.consumer.heartbeat-interval-ms");
    }

    public String getJobsTopic() {
        return raw.getString("kafka.jobs-topic");
    }

    public String getOutcomesTopic() {
        return raw.getString("kafka.outcomes-topic");
    }

    // ── Outcomes ──────────────────────────────────────────────────────────────

    /** {@code kafka} or {@code log}. */
    public String getOutcomeSinkType() {
        return raw.getString("outcomes.sink");
    }

    // ── Health ────────────────────────────────────────────────────────────────

    public int getHealthPort() {
        return raw.getInt("health.port");
    }
}
