package com.toolstock.notifier.health;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import com.toolstock.notifier.session.SessionDiagnostics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.BooleanSupplier;
import java.util.function.Supplier;

/**
 * Lightweight HTTP health check server.
 *
 * <p>Endpoints:
 * <ul>
 *   <li>{@code GET /health}: 200 while the notifier is running, 503 during startup and shutdown.</li>
 *   <li>{@code GET /health/live}: liveness probe (always 200 if the JVM is alive).</li>
 *   <li>{@code GET /health/ready}: 200 when the chat session is stable and the job consumer runs.</li>
 *   <li>{@code GET /health/session}: session state, reconnection status and recent connection events.</li>
 * </ul>
 */
public class HealthServer {

    private static final Logger LOG = LoggerFactory.getLogger(HealthServer.class);

    private final HttpServer                   server;
    private final BooleanSupplier              sessionStable;
    private final Supplier<SessionDiagnostics> diagnostics;
    private final AtomicBoolean                running = new AtomicBoolean(false);
    private final ObjectMapper                 mapper  = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);

    public HealthServer(
            final int port,
            final BooleanSupplier sessionStable,
            final Supplier<SessionDiagnostics> diagnostics) throws IOException {
        this.sessionStable = sessionStable;
        this.diagnostics   = diagnostics;

        server = HttpServer.create(new InetSocketAddress(port), 0);
        server.setExecutor(Executors.newSingleThreadExecutor(r -> {
            final Thread t = new Thread(r, "health-server");
            t.setDaemon(true);
            return t;
        }));

        server.createContext("/health",         this::handleHealth);
        server.createContext("/health/live",    this::handleLive);
        server.createContext("/health/ready",   this::handleReady);
        server.createContext("/health/session", this::handleSession);
    }

    public void start() {
        server.start();
        LOG.info("Health server started on port {}", getPort());
    }

    public int getPort() {
        return server.getAddress().getPort();
    }

    /** The job consumer is running. */
    public void markRunning() {
        running.set(true);
        LOG.info("Notifier marked as running");
    }

    /** E.g. during shutdown. */
    public void markStopped() {
        running.set(false);
    }

    public void stop() {
        markStopped();
        server.stop(1);
        LOG.info("Health server stopped");
    }

    private void handleHealth(final HttpExchange exchange) throws IOException {
        respond(exchange, running.get() ? 200 : 503,
                running.get() ? "{\"status\":\"UP\"}" : "{\"status\":\"DOWN\"}");
    }

    private void handleLive(final HttpExchange exchange) throws IOException {
        respond(exchange, 200, "{\"status\":\"ALIVE\"}");
    }

    private void handleReady(final HttpExchange exchange) throws IOException {
        final boolean ready = running.get() && sessionStable.getAsBoolean();
        respond(exchange, ready ? 200 : 503,
                ready ? "{\"status\":\"READY\"}" : "{\"status\":\"NOT_READY\"}");
    }

    private void handleSession(final HttpExchange exchange) throws IOException {
        final String body;
        try {
            body = mapper.writeValueAsString(diagnostics.get());
        } catch (RuntimeException | IOException e) {
            LOG.error("Failed to render session diagnostics", e);
            respond(exchange, 500, "{\"status\":\"ERROR\"}");
            return;
        }
        respond(exchange, 200, body);
    }

    private void respond(final HttpExchange exchange,
                         final int statusCode,
                         final String body) throws IOException {
        final byte[] bytes = body.getBytes(StandardCharsets.UTF_8);
        exchange.getResponseHeaders().set("Content-Type", "application/json");
        exchange.sendResponseHeaders(statusCode, bytes.length);
        try (OutputStream os = exchange.getResponseBody()) {
            os.write(bytes);
        }
    }
}
