package com.toolstock.notifier;

import com.toolstock.notifier.alert.LoggingOperatorAlerts;
import com.toolstock.notifier.alert.OperatorAlerts;
import com.toolstock.notifier.autoreply.AutoReplyScheduler;
import com.toolstock.notifier.autoreply.AutoReplySettings;
import com.toolstock.notifier.config.NotifierConfig;
import com.toolstock.notifier.consumer.JobProcessor;
import com.toolstock.notifier.consumer.KafkaOutcomeSink;
import com.toolstock.notifier.consumer.LoggingOutcomeSink;
import com.toolstock.notifier.consumer.OutcomeSink;
import com.toolstock.notifier.consumer.SendJobConsumer;
import com.toolstock.notifier.delivery.DeliveryPipeline;
import com.toolstock.notifier.delivery.DeliverySettings;
import com.toolstock.notifier.delivery.RateLimiter;
import com.toolstock.notifier.delivery.RecipientNormalizer;
import com.toolstock.notifier.error.NotifierException;
import com.toolstock.notifier.health.HealthServer;
import com.toolstock.notifier.hours.BusinessHoursLoader;
import com.toolstock.notifier.hours.BusinessHoursProvider;
import com.toolstock.notifier.retry.RetryExecutor;
import com.toolstock.notifier.scheduling.ExecutorTaskScheduler;
import com.toolstock.notifier.scheduling.Sleeper;
import com.toolstock.notifier.session.ChannelSession;
import com.toolstock.notifier.session.ChannelSessionFactory;
import com.toolstock.notifier.session.ConnectionHistory;
import com.toolstock.notifier.session.DefaultChannelSessionFactory;
import com.toolstock.notifier.session.HealthMonitor;
import com.toolstock.notifier.session.ReconnectSettings;
import com.toolstock.notifier.session.ReconnectionController;
import com.toolstock.notifier.session.SessionDiagnostics;
import com.toolstock.notifier.session.SessionHolder;
import com.toolstock.notifier.session.SessionSettings;
import com.toolstock.notifier.transport.HttpBridgeTransportFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

/**
 * Toolstock Shipping Notifier, main entry point.
 *
 * <h2>Startup sequence</h2>
 * <ol>
 *   <li>Load configuration</li>
 *   <li>Check a chat bridge is configured (fail fast otherwise)</li>
 *   <li>Wire session management, business hours and auto-replies</li>
 *   <li>Bring the first chat session to STABLE (exit 1 if it cannot)</li>
 *   <li>Start the health monitor and the health check HTTP server</li>
 *   <li>Start the Kafka job consumer on a dedicated thread</li>
 *   <li>Register JVM shutdown hook for graceful drain</li>
 * </ol>
 */
public class ShippingNotifierApp {

    private static final Logger LOG = LoggerFactory.getLogger(ShippingNotifierApp.class);

    public static void main(final String[] args) throws Exception {
        LOG.info("=================================================");
        LOG.info("  Toolstock Shipping Notifier  v1.0.0");
        LOG.info("=================================================");

        // ── 1. Configuration ──────────────────────────────────────────────────
        final NotifierConfig config = NotifierConfig.load();
        final OperatorAlerts alerts = new LoggingOperatorAlerts();
        LOG.info("Configuration loaded. Bootstrap: {}, jobs topic: {}, outcome sink: {}",
                config.getBootstrapServers(), config.getJobsTopic(), config.getOutcomeSinkType());

        // ── 2. Transport ──────────────────────────────────────────────────────
        final HttpBridgeTransportFactory transports = new HttpBridgeTransportFactory(config);
        if (!transports.isConfigured()) {
            alerts.startupFailed(new IllegalStateException(
                    "No chat bridge configured. Set BRIDGE_BASE_URL and BRIDGE_SESSION."));
            System.exit(1);
        }

        // ── 3. Session management ─────────────────────────────────────────────
        final Clock clock = Clock.systemUTC();
        final ExecutorTaskScheduler scheduler = new ExecutorTaskScheduler("notifier-timer", 4);
        final ConnectionHistory history = new ConnectionHistory(config.getSessionHistorySize(), clock);
        final SessionHolder sessions = new SessionHolder();
        final ChannelSessionFactory sessionFactory = new DefaultChannelSessionFactory(
                transports, SessionSettings.from(config), scheduler, history);
        final ReconnectionController reconnection = new ReconnectionController(
                sessions, sessionFactory, ReconnectSettings.from(config),
                scheduler, Sleeper.SYSTEM, alerts, history, clock);
        sessions.addListener(reconnection);
        final HealthMonitor monitor = new HealthMonitor(
                sessions, reconnection, scheduler, alerts, history, clock,
                config.getHealthCheckInterval(), config.getHealthCheckTimeout());

        // ── 4. Business hours and auto-replies ────────────────────────────────
        final BusinessHoursProvider hours = new BusinessHoursProvider(
                config.getBusinessHoursFile(), new BusinessHoursLoader());
        hours.startReloading(scheduler, config.getBusinessHoursReloadInterval());

        final ExecutorService replyWorker = Executors.newSingleThreadExecutor(r -> {
            final Thread t = new Thread(r, "auto-reply");
            t.setDaemon(true);
            return t;
        });
        final AutoReplyScheduler autoReply = new AutoReplyScheduler(
                sessions, hours, scheduler, replyWorker, Sleeper.SYSTEM, clock, AutoReplySettings.from(config));
        if (config.isAutoReplyEnabled()) {
            sessions.addListener(autoReply);
            autoReply.start();
            LOG.info("Auto-replies enabled. {}", autoReply.stats());
        } else {
            LOG.info("Auto-replies disabled");
        }

        // ── 5. First session ──────────────────────────────────────────────────
        final ChannelSession first = sessionFactory.create();
        sessions.install(first);
        try {
            first.initialize();
        } catch (NotifierException e) {
            alerts.startupFailed(e);
            first.close();
            scheduler.close();
            System.exit(1);
        }
        monitor.start();

        // ── 6. Delivery ───────────────────────────────────────────────────────
        final RateLimiter rateLimiter = new RateLimiter(config.getMessageDelay(), clock, Sleeper.SYSTEM);
        final DeliveryPipeline pipeline = new DeliveryPipeline(
                sessions, new RecipientNormalizer(), new RetryExecutor(config, Sleeper.SYSTEM),
                DeliverySettings.from(config), Sleeper.SYSTEM, clock);
        final OutcomeSink sink = buildOutcomeSink(config);
        final JobProcessor processor = new JobProcessor(rateLimiter, pipeline, sink, clock);
        final SendJobConsumer consumer = new SendJobConsumer(config, processor);

        // ── 7. Health server ──────────────────────────────────────────────────
        final HealthServer health = new HealthServer(
                config.getHealthPort(),
                () -> sessions.current().map(ChannelSession::isStable).orElse(false),
                () -> SessionDiagnostics.capture(sessions, reconnection, monitor, history));
        health.start();

        // ── 8. Consumer thread ────────────────────────────────────────────────
        final ExecutorService executor = Executors.newSingleThreadExecutor(r -> {
            final Thread t = new Thread(r, "send-job-consumer");
            t.setDaemon(false);
            return t;
        });
        final CountDownLatch shutdownLatch = new CountDownLatch(1);

        executor.submit(() -> {
            try {
                health.markRunning();
                consumer.run();
            } finally {
                health.markStopped();
                shutdownLatch.countDown();
            }
        });

        // ── 9. Shutdown hook ──────────────────────────────────────────────────
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            LOG.info("Shutdown hook triggered, starting graceful shutdown...");
            health.markStopped();
            consumer.shutdown();
            executor.shutdown();
            try {
                if (!executor.awaitTermination(30, TimeUnit.SECONDS)) {
                    LOG.warn("Consumer thread did not terminate in 30s, forcing shutdown");
                    executor.shutdownNow();
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                executor.shutdownNow();
            }
            monitor.stop();
            reconnection.stop();
            autoReply.close();
            replyWorker.shutdownNow();
            hours.close();
            sessions.current().ifPresent(ChannelSession::close);
            sink.close();
            scheduler.close();
            health.stop();
            LOG.info("Shipping Notifier shut down cleanly.");
        }, "shutdown-hook"));

        LOG.info("Shipping Notifier is running. Press Ctrl+C to stop.");
        shutdownLatch.await();
    }

    private static OutcomeSink buildOutcomeSink(final NotifierConfig config) {
        final String type = config.getOutcomeSinkType();
        return switch (type.toLowerCase()) {
            case "kafka" -> {
                LOG.info("Publishing outcomes to Kafka topic {}", config.getOutcomesTopic());
                yield new KafkaOutcomeSink(config);
            }
            case "log" -> {
                LOG.info("Writing outcomes to the log");
                yield new LoggingOutcomeSink();
            }
            default -> throw new IllegalArgumentException("Unknown outcome sink type: " + type);
        };
    }
}
