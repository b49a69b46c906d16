package com.toolstock.notifier.transport;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.toolstock.notifier.error.AuthenticationException;
import com.toolstock.notifier.model.ChatEntry;
import com.toolstock.notifier.model.InboundMessage;
import okhttp3.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * {@link ChatTransport} backed by a WhatsApp HTTP bridge: a sidecar that runs the
 * linked-device client and exposes it over REST plus a WebSocket event stream.
 *
 * <h2>Endpoints used</h2>
 * <ul>
 *   <li>{@code POST /api/sessions/start} and {@code POST /api/sessions/stop}</li>
 *   <li>{@code GET  /api/sessions/{session}} → {@code {"status": "WORKING"}}</li>
 *   <li>{@code GET  /api/contacts/check-exists?phone=&session=} →
 *       {@code {"numberExists": true, "chatId": "346…@c.us"}}</li>
 *   <li>{@code POST /api/sendText} with {@code {session, chatId, text}}</li>
 *   <li>{@code GET  /api/{session}/chats/{chatId}/messages?limit=1}</li>
 *   <li>{@code POST /api/{session}/chats/{chatId}/unread}</li>
 *   <li>{@code GET  /ws?session=} WebSocket with {@code session.status} and
 *       {@code message} events</li>
 * </ul>
 *
 * <p>An {@code X-Api-Key} header is added when an API key is configured.
 * HTTP 401/403 is reported as {@link AuthenticationException}.
 */
public class HttpBridgeTransport implements ChatTransport {

    private static final Logger LOG = LoggerFactory.getLogger(HttpBridgeTransport.class);
    private static final MediaType JSON = MediaType.get("application/json; charset=utf-8");

    private final HttpUrl      baseUrl;
    private final String       sessionName;
    private final String       apiKey;
    private final OkHttpClient http;
    private final ObjectMapper mapper = new ObjectMapper();

    private final AtomicBoolean closed    = new AtomicBoolean(false);
    private final AtomicBoolean connected = new AtomicBoolean(false);
    private volatile TransportListener listener = TransportListener.NONE;
    private volatile WebSocket events;

    public HttpBridgeTransport(
            final String baseUrl,
            final String sessionName,
            final String apiKey,
            final Duration connectTimeout,
            final Duration readTimeout) {
        this.baseUrl     = HttpUrl.get(baseUrl);
        this.sessionName = sessionName;
        this.apiKey      = apiKey;
        this.http = new OkHttpClient.Builder()
                .connectTimeout(connectTimeout.toMillis(), TimeUnit.MILLISECONDS)
                .readTimeout(readTimeout.toMillis(), TimeUnit.MILLISECONDS)
                // the event stream is long-lived; keep it open with pings
                .pingInterval(30, TimeUnit.SECONDS)
                .build();
    }

    @Override
    public void setListener(final TransportListener listener) {
        this.listener = listener != null ? listener : TransportListener.NONE;
    }

    @Override
    public void connect() throws IOException {
        final ObjectNode body = mapper.createObjectNode().put("name", sessionName);
        final Request start = request(url("api", "sessions", "start"))
                .post(RequestBody.create(body.toString(), JSON))
                .build();

        try (Response response = http.newCall(start).execute()) {
            final int code = response.code();
            checkAuth(code);
            // 409: the bridge already runs this session, which is fine
            if (!response.isSuccessful() && code != 409) {
                throw new IOException("Bridge refused session start: HTTP " + code + ": " + bodyOf(response));
            }
        }

        openEventStream();

        // A session that was already running does not emit a fresh status event
        if (getState() == TransportState.CONNECTED && connected.compareAndSet(false, true)) {
            listener.onConnected();
        }
    }

    @Override
    public TransportState getState() throws IOException {
        final JsonNode node = getJson(url("api", "sessions", sessionName));
        return mapStatus(node.path("status").asText(""));
    }

    @Override
    public Optional<String> resolveChatId(final String number) throws IOException {
        final HttpUrl url = url("api", "contacts", "check-exists").newBuilder()
                .addQueryParameter("phone", number)
                .addQueryParameter("session", sessionName)
                .build();
        final JsonNode node = getJson(url);
        if (!node.path("numberExists").asBoolean(false)) {
            return Optional.empty();
        }
        final String chatId = node.path("chatId").asText("");
        return Optional.of(chatId.isEmpty() ? number + "@c.us" : chatId);
    }

    @Override
    public Optional<String> sendText(final String chatId, final String text) throws IOException {
        final ObjectNode payload = mapper.createObjectNode()
                .put("session", sessionName)
                .put("chatId", chatId)
                .put("text", text);
        final Request request = request(url("api", "sendText"))
                .post(RequestBody.create(payload.toString(), JSON))
                .build();

        try (Response response = http.newCall(request).execute()) {
            final int    code     = response.code();
            final String respBody = bodyOf(response);
            checkAuth(code);
            if (!response.isSuccessful()) {
                throw new IOException("Bridge rejected message: HTTP " + code + ": " + respBody);
            }
            return extractMessageId(respBody);
        }
    }

    @Override
    public Optional<ChatEntry> lastEntry(final String chatId) throws IOException {
        final HttpUrl url = url("api", sessionName, "chats", chatId, "messages").newBuilder()
                .addQueryParameter("limit", "1")
                .addQueryParameter("downloadMedia", "false")
                .build();
        final JsonNode node = getJson(url);
        if (!node.isArray() || node.size() == 0) {
            return Optional.empty();
        }
        final JsonNode last = node.get(0);
        return Optional.of(new ChatEntry(
                messageId(last.path("id")).orElse(null),
                last.path("body").asText(null),
                last.hasNonNull("timestamp") ? Instant.ofEpochSecond(last.path("timestamp").asLong()) : null));
    }

    @Override
    public void markUnread(final String chatId) throws IOException {
        final Request request = request(url("api", sessionName, "chats", chatId, "unread"))
                .post(RequestBody.create("{}", JSON))
                .build();
        try (Response response = http.newCall(request).execute()) {
            checkAuth(response.code());
            if (!response.isSuccessful()) {
                throw new IOException("Bridge refused mark-unread: HTTP " + response.code());
            }
        }
    }

    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        final WebSocket socket = events;
        if (socket != null) {
            socket.close(1000, "closing");
        }
        final ObjectNode body = mapper.createObjectNode()
                .put("name", sessionName)
                .put("logout", false);
        final Request stop = request(url("api", "sessions", "stop"))
                .post(RequestBody.create(body.toString(), JSON))
                .build();
        try (Response response = http.newCall(stop).execute()) {
            LOG.info("Bridge session '{}' stopped: http={}", sessionName, response.code());
        } catch (IOException e) {
            LOG.warn("Could not stop bridge session '{}': {}", sessionName, e.getMessage());
        } finally {
            http.dispatcher().executorService().shutdown();
            http.connectionPool().evictAll();
        }
    }

    // ── Event stream ──────────────────────────────────────────────────────────

    private void openEventStream() {
        final HttpUrl url = url("ws").newBuilder()
                .addQueryParameter("session", sessionName)
                .build();
        events = http.newWebSocket(request(url).build(), new EventStreamListener());
    }

    /** Package-private so tests can replay bridge events without a socket. */
    void handleEvent(final String text) {
        final JsonNode event;
        try {
            event = mapper.readTree(text);
        } catch (IOException e) {
            LOG.warn("Ignoring malformed bridge event: {}", e.getMessage());
            return;
        }

        final String   type    = event.path("event").asText("");
        final JsonNode payload = event.path("payload");

        switch (type) {
            case "session.status" -> handleStatus(payload.path("status").asText(""));
            case "message", "message.any" -> listener.onMessage(toInbound(payload));
            default -> LOG.debug("Ignoring bridge event type '{}'", type);
        }
    }

    private void handleStatus(final String status) {
        if ("UNAUTHORIZED".equals(status)) {
            connected.set(false);
            listener.onAuthFailure("Bridge session unauthorized");
            return;
        }
        switch (mapStatus(status)) {
            case CONNECTED -> {
                if (connected.compareAndSet(false, true)) {
                    listener.onConnected();
                }
            }
            case PAIRING_REQUIRED -> {
                if (connected.get()) {
                    listener.onAuthFailure("Linked device was logged out; QR scan required");
                } else {
                    LOG.warn("Bridge session '{}' is waiting for a QR scan", sessionName);
                }
            }
            case DISCONNECTED -> {
                connected.set(false);
                listener.onDisconnected("Bridge session status " + status);
            }
            default -> LOG.debug("Bridge session '{}' status {}", sessionName, status);
        }
    }

    private InboundMessage toInbound(final JsonNode payload) {
        final String from = payload.path("from").asText(null);
        return new InboundMessage(
                messageId(payload.path("id")).orElse(null),
                from,
                payload.path("to").asText(null),
                payload.path("body").asText(""),
                payload.path("fromMe").asBoolean(false),
                payload.path("isStatus").asBoolean(false) || "status@broadcast".equals(from),
                payload.hasNonNull("timestamp") ? Instant.ofEpochSecond(payload.path("timestamp").asLong()) : null);
    }

    private final class EventStreamListener extends WebSocketListener {

        @Override
        public void onOpen(final WebSocket webSocket, final Response response) {
            LOG.info("Bridge event stream open for session '{}'", sessionName);
        }

        @Override
        public void onMessage(final WebSocket webSocket, final String text) {
            handleEvent(text);
        }

        @Override
        public void onClosed(final WebSocket webSocket, final int code, final String reason) {
            if (!closed.get()) {
                connected.set(false);
                listener.onDisconnected("Event stream closed: " + code + " " + reason);
            }
        }

        @Override
        public void onFailure(final WebSocket webSocket, final Throwable t, final Response response) {
            if (!closed.get()) {
                connected.set(false);
                if (response != null && (response.code() == 401 || response.code() == 403)) {
                    listener.onAuthFailure("Bridge rejected event stream: HTTP " + response.code());
                } else {
                    listener.onDisconnected("Event stream failure: " + t.getMessage());
                }
            }
        }
    }

    // ── Helpers ───────────────────────────────────────────────────────────────

    static TransportState mapStatus(final String status) {
        return switch (status) {
            case "WORKING" -> TransportState.CONNECTED;
            case "STARTING" -> TransportState.CONNECTING;
            case "SCAN_QR_CODE" -> TransportState.PAIRING_REQUIRED;
            case "STOPPED", "FAILED" -> TransportState.DISCONNECTED;
            default -> TransportState.UNKNOWN;
        };
    }

    private JsonNode getJson(final HttpUrl url) throws IOException {
        try (Response response = http.newCall(request(url).get().build()).execute()) {
            final int    code     = response.code();
            final String respBody = bodyOf(response);
            checkAuth(code);
            if (!response.isSuccessful()) {
                throw new IOException("HTTP " + code + " from " + url.encodedPath() + ": " + respBody);
            }
            return respBody.isBlank() ? mapper.createObjectNode() : mapper.readTree(respBody);
        }
    }

    private Optional<String> extractMessageId(final String body) {
        if (body == null || body.isBlank()) {
            return Optional.empty();
        }
        try {
            return messageId(mapper.readTree(body).path("id"));
        } catch (IOException e) {
            LOG.debug("Unparseable send acknowledgment: {}", e.getMessage());
            return Optional.empty();
        }
    }

    /** Message ids come either as a plain string or as {@code {"_serialized": "..."}}. */
    private static Optional<String> messageId(final JsonNode id) {
        if (id.isTextual() && !id.asText().isEmpty()) {
            return Optional.of(id.asText());
        }
        final String serialized = id.path("_serialized").asText("");
        return serialized.isEmpty() ? Optional.empty() : Optional.of(serialized);
    }

    private HttpUrl url(final String... segments) {
        final HttpUrl.Builder builder = baseUrl.newBuilder();
        for (final String segment : segments) {
            builder.addPathSegment(segment);
        }
        return builder.build();
    }

    private Request.Builder request(final HttpUrl url) {
        final Request.Builder builder = new Request.Builder().url(url);
        if (apiKey != null && !apiKey.isBlank()) {
            builder.addHeader("X-Api-Key", apiKey);
        }
        return builder;
    }

    private void checkAuth(final int code) {
        if (code == 401 || code == 403) {
            throw new AuthenticationException("Bridge rejected credentials: HTTP " + code);
        }
    }

    private static String bodyOf(final Response response) throws IOException {
        final ResponseBody body = response.body();
        return body != null ? body.string() : "";
    }

    @Override
    public String toString() {
        return "HttpBridgeTransport{base=" + baseUrl + ", session=" + sessionName + "}";
    }
}
