package com.toolstock.notifier.transport;

import com.toolstock.notifier.error.AuthenticationException;
import com.toolstock.notifier.model.InboundMessage;
import okhttp3.WebSocketListener;
import okhttp3.mockwebserver.Dispatcher;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.IOException;
import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class HttpBridgeTransportTest {

    private static final String CHAT_ID = "34612345678@c.us";

    @Mock private TransportListener listener;

    private MockWebServer       server;
    private HttpBridgeTransport transport;

    @BeforeEach
    void setup() throws Exception {
        server = new MockWebServer();
        server.start();
        transport = new HttpBridgeTransport(server.url("/").toString(), "default", "secret-key",
                Duration.ofSeconds(2), Duration.ofSeconds(2));
        transport.setListener(listener);
    }

    @AfterEach
    void teardown() throws Exception {
        server.shutdown();
    }

    private static MockResponse json(final int code, final String body) {
        return new MockResponse().setResponseCode(code)
                .addHeader("Content-Type", "application/json")
                .setBody(body);
    }

    // ── REST calls ───────────────────────────────────────────────────────────

    @Test
    void getState_mapsBridgeStatus_andSendsApiKey() throws Exception {
        server.enqueue(json(200, "{\"name\":\"default\",\"status\":\"WORKING\"}"));

        assertThat(transport.getState()).isEqualTo(TransportState.CONNECTED);

        final RecordedRequest request = server.takeRequest();
        assertThat(request.getPath()).isEqualTo("/api/sessions/default");
        assertThat(request.getHeader("X-Api-Key")).isEqualTo("secret-key");
    }

    @Test
    void resolveChatId_returnsBridgeChatId() throws Exception {
        server.enqueue(json(200, "{\"numberExists\":true,\"chatId\":\"" + CHAT_ID + "\"}"));

        assertThat(transport.resolveChatId("34612345678")).contains(CHAT_ID);
        assertThat(server.takeRequest().getPath())
                .startsWith("/api/contacts/check-exists")
                .contains("phone=34612345678")
                .contains("session=default");
    }

    @Test
    void resolveChatId_isEmpty_whenNumberHasNoAccount() throws Exception {
        server.enqueue(json(200, "{\"numberExists\":false}"));

        assertThat(transport.resolveChatId("34612345678")).isEmpty();
    }

    @Test
    void unauthorizedResponse_raisesAuthenticationException() {
        server.enqueue(json(401, "{\"message\":\"Unauthorized\"}"));

        assertThatThrownBy(() -> transport.resolveChatId("34612345678"))
                .isInstanceOf(AuthenticationException.class)
                .hasMessageContaining("401");
    }

    @Test
    void sendText_postsJson_andReturnsSerializedId() throws Exception {
        server.enqueue(json(201, "{\"id\":{\"fromMe\":true,\"_serialized\":\"true_" + CHAT_ID + "_3EB0\"}}"));

        assertThat(transport.sendText(CHAT_ID, "Tu pedido ha salido")).contains("true_" + CHAT_ID + "_3EB0");

        final RecordedRequest request = server.takeRequest();
        assertThat(request.getMethod()).isEqualTo("POST");
        assertThat(request.getPath()).isEqualTo("/api/sendText");
        assertThat(request.getBody().readUtf8())
                .contains("\"chatId\":\"" + CHAT_ID + "\"")
                .contains("\"text\":\"Tu pedido ha salido\"")
                .contains("\"session\":\"default\"");
    }

    @Test
    void sendText_withEmptyAcknowledgment_returnsEmpty() throws Exception {
        server.enqueue(new MockResponse().setResponseCode(200));

        assertThat(transport.sendText(CHAT_ID, "hola")).isEmpty();
    }

    @Test
    void sendText_serverError_raisesIOException() {
        server.enqueue(json(500, "{\"error\":\"page crashed\"}"));

        assertThatThrownBy(() -> transport.sendText(CHAT_ID, "hola"))
                .isInstanceOf(IOException.class)
                .hasMessageContaining("500");
    }

    @Test
    void lastEntry_parsesNewestMessage() throws Exception {
        server.enqueue(json(200,
                "[{\"id\":\"true_" + CHAT_ID + "_AAA\",\"body\":\"Tu pedido ha salido\",\"timestamp\":1736935201}]"));

        final var entry = transport.lastEntry(CHAT_ID);

        assertThat(entry).isPresent();
        assertThat(entry.get().getId()).isEqualTo("true_" + CHAT_ID + "_AAA");
        assertThat(entry.get().getBody()).isEqualTo("Tu pedido ha salido");
        assertThat(entry.get().getTimestamp()).isEqualTo(Instant.ofEpochSecond(1736935201L));
        assertThat(server.takeRequest().getPath()).contains("/chats/").contains("limit=1");
    }

    @Test
    void lastEntry_ofEmptyConversation_isEmpty() throws Exception {
        server.enqueue(json(200, "[]"));

        assertThat(transport.lastEntry(CHAT_ID)).isEmpty();
    }

    @Test
    void markUnread_postsToChat() throws Exception {
        server.enqueue(json(200, "{}"));

        transport.markUnread(CHAT_ID);

        final RecordedRequest request = server.takeRequest();
        assertThat(request.getMethod()).isEqualTo("POST");
        assertThat(request.getPath()).startsWith("/api/default/chats/").endsWith("/unread");
    }

    // ── Connect and event stream ─────────────────────────────────────────────

    @Test
    void connect_startsSession_opensStream_andReportsRunningSession() throws Exception {
        server.setDispatcher(new Dispatcher() {
            @Override
            public MockResponse dispatch(final RecordedRequest request) {
                final String path = request.getPath();
                if (path.startsWith("/ws")) {
                    return new MockResponse().withWebSocketUpgrade(new WebSocketListener() { });
                }
                if (path.equals("/api/sessions/start")) {
                    return json(409, "{\"message\":\"already started\"}");
                }
                if (path.equals("/api/sessions/default")) {
                    return json(200, "{\"status\":\"WORKING\"}");
                }
                return json(200, "{}");
            }
        });

        transport.connect();

        verify(listener).onConnected();
        transport.close();
        transport.close();
    }

    @Test
    void connect_refused_raisesIOException() {
        server.enqueue(json(500, "{}"));

        assertThatThrownBy(transport::connect).isInstanceOf(IOException.class);
    }

    @Test
    void statusEvents_driveListener() {
        transport.handleEvent("{\"event\":\"session.status\",\"payload\":{\"status\":\"WORKING\"}}");
        transport.handleEvent("{\"event\":\"session.status\",\"payload\":{\"status\":\"WORKING\"}}");
        transport.handleEvent("{\"event\":\"session.status\",\"payload\":{\"status\":\"STOPPED\"}}");

        verify(listener, times(1)).onConnected();
        verify(listener).onDisconnected("Bridge session status STOPPED");
    }

    @Test
    void qrRequiredAfterConnected_isAuthenticationFailure() {
        transport.handleEvent("{\"event\":\"session.status\",\"payload\":{\"status\":\"WORKING\"}}");
        transport.handleEvent("{\"event\":\"session.status\",\"payload\":{\"status\":\"SCAN_QR_CODE\"}}");

        verify(listener).onAuthFailure(anyString());
    }

    @Test
    void qrRequiredBeforeConnecting_isOnlyLogged() {
        transport.handleEvent("{\"event\":\"session.status\",\"payload\":{\"status\":\"SCAN_QR_CODE\"}}");

        verifyNoInteractions(listener);
    }

    @Test
    void unauthorizedStatus_isAuthenticationFailure() {
        transport.handleEvent("{\"event\":\"session.status\",\"payload\":{\"status\":\"UNAUTHORIZED\"}}");

        verify(listener).onAuthFailure("Bridge session unauthorized");
    }

    @Test
    void messageEvent_isForwardedAsInbound() {
        transport.handleEvent("{\"event\":\"message\",\"payload\":{"
                + "\"id\":\"false_" + CHAT_ID + "_BBB\",\"from\":\"" + CHAT_ID + "\","
                + "\"to\":\"34911111111@c.us\",\"body\":\"¿Dónde está mi pedido?\","
                + "\"fromMe\":false,\"timestamp\":1736960400}}");

        final ArgumentCaptor<InboundMessage> captor = ArgumentCaptor.forClass(InboundMessage.class);
        verify(listener).onMessage(captor.capture());
        final InboundMessage message = captor.getValue();
        assertThat(message.getFrom()).isEqualTo(CHAT_ID);
        assertThat(message.getTo()).isEqualTo("34911111111@c.us");
        assertThat(message.getBody()).isEqualTo("¿Dónde está mi pedido?");
        assertThat(message.isFromMe()).isFalse();
        assertThat(message.isStatus()).isFalse();
        assertThat(message.getTimestamp()).isEqualTo(Instant.ofEpochSecond(1736960400L));
    }

    @Test
    void statusBroadcast_isFlaggedAsStatus() {
        transport.handleEvent("{\"event\":\"message\",\"payload\":{\"from\":\"status@broadcast\",\"body\":\"x\"}}");

        final ArgumentCaptor<InboundMessage> captor = ArgumentCaptor.forClass(InboundMessage.class);
        verify(listener).onMessage(captor.capture());
        assertThat(captor.getValue().isStatus()).isTrue();
    }

    @Test
    void malformedAndUnknownEvents_areIgnored() {
        transport.handleEvent("not json");
        transport.handleEvent("{\"event\":\"presence.update\",\"payload\":{}}");

        verifyNoInteractions(listener);
    }

    @Test
    void mapStatus_coversBridgeStatuses() {
        assertThat(HttpBridgeTransport.mapStatus("WORKING")).isEqualTo(TransportState.CONNECTED);
        assertThat(HttpBridgeTransport.mapStatus("STARTING")).isEqualTo(TransportState.CONNECTING);
        assertThat(HttpBridgeTransport.mapStatus("SCAN_QR_CODE")).isEqualTo(TransportState.PAIRING_REQUIRED);
        assertThat(HttpBridgeTransport.mapStatus("FAILED")).isEqualTo(TransportState.DISCONNECTED);
        assertThat(HttpBridgeTransport.mapStatus("")).isEqualTo(TransportState.UNKNOWN);
    }
}
