package com.toolstock.notifier.config;

import com.toolstock.notifier.autoreply.AutoReplySettings;
import com.toolstock.notifier.delivery.DeliverySettings;
import com.toolstock.notifier.session.ReconnectSettings;
import com.toolstock.notifier.session.SessionSettings;
import com.typesafe.config.ConfigException;
import com.typesafe.config.ConfigFactory;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

class NotifierConfigTest {

    private final NotifierConfig config = NotifierConfig.load();

    @Test
    void packagedDefaults_describeReconnectionPolicy() {
        final var reconnect = ReconnectSettings.from(config);

        assertThat(reconnect.getMaxAttempts()).isEqualTo(5);
        assertThat(reconnect.getBaseDelay()).isEqualTo(Duration.ofSeconds(30));
        assertThat(reconnect.getMaxDelay()).isEqualTo(Duration.ofMinutes(5));
        assertThat(reconnect.getSettleDelay()).isEqualTo(Duration.ofSeconds(3));
        assertThat(reconnect.getFollowUpDelay()).isEqualTo(Duration.ofSeconds(5));
        assertThat(config.getHealthCheckInterval()).isEqualTo(Duration.ofSeconds(60));
        assertThat(config.getHealthCheckTimeout()).isEqualTo(Duration.ofSeconds(10));
    }

    @Test
    void packagedDefaults_describeSessionStabilization() {
        final var session = SessionSettings.from(config);

        assertThat(session.getReadyTimeout()).isEqualTo(Duration.ofSeconds(90));
        assertThat(session.getSettleDelay()).isEqualTo(Duration.ofSeconds(5));
        assertThat(session.getStabilizeAttempts()).isEqualTo(3);
        assertThat(session.getStabilizeRetryDelay()).isEqualTo(Duration.ofSeconds(3));
        assertThat(config.getSessionHistorySize()).isEqualTo(100);
    }

    @Test
    void packagedDefaults_describeDeliveryAndVerification() {
        final var delivery = DeliverySettings.from(config);

        assertThat(delivery.getSendTimeout()).isEqualTo(Duration.ofSeconds(20));
        assertThat(delivery.getChannelCheckTimeout()).isEqualTo(Duration.ofSeconds(15));
        assertThat(delivery.getVerificationTolerance()).isEqualTo(Duration.ofSeconds(5));
        assertThat(delivery.getVerificationPrefixLength()).isEqualTo(20);
        assertThat(config.getRetryMaxAttempts()).isEqualTo(3);
        assertThat(config.getRetryInitialDelayMs()).isEqualTo(2000L);
    }

    @Test
    void packagedDefaults_describeAutoReply() {
        final var autoReply = AutoReplySettings.from(config);

        assertThat(autoReply.getReplyDelay()).isEqualTo(Duration.ofSeconds(30));
        assertThat(autoReply.getNaturalDelay()).isEqualTo(Duration.ofSeconds(2));
        assertThat(autoReply.getSuppressionWindow()).isEqualTo(Duration.ofHours(1));
        assertThat(config.getBusinessHoursReloadInterval()).isEqualTo(Duration.ofHours(1));
    }

    @Test
    void overrides_takePrecedenceOverDefaults() {
        final var overridden = NotifierConfig.from(ConfigFactory.parseMap(Map.of(
                "delivery.message-delay", "5s",
                "reconnect.max-attempts", 2,
                "outcomes.sink", "kafka")));

        assertThat(overridden.getMessageDelay()).isEqualTo(Duration.ofSeconds(5));
        assertThat(overridden.getReconnectMaxAttempts()).isEqualTo(2);
        assertThat(overridden.getOutcomeSinkType()).isEqualTo("kafka");
        assertThat(overridden.getSendTimeout()).isEqualTo(Duration.ofSeconds(20));
    }

    @Test
    void malformedDuration_failsFast() {
        final var broken = NotifierConfig.from(ConfigFactory.parseMap(Map.of("delivery.send-timeout", "soon")));

        assertThatThrownBy(broken::getSendTimeout).isInstanceOf(ConfigException.class);
    }
}
