package com.inkboard.selectionservice.websocket;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.inkboard.selectionservice.config.SelectionProperties;
import com.inkboard.selectionservice.ownership.OwnershipRecord;
import com.inkboard.selectionservice.selection.SelectionRecord;
import com.inkboard.selectionservice.session.SelectionSession;
import com.inkboard.selectionservice.session.SelectionSessionManager;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;

import java.net.URI;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.concurrent.atomic.AtomicLong;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class SelectionWebSocketHandlerTest {

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final AtomicLong clock = new AtomicLong(1_000);
    private SelectionSessionManager sessionManager;
    private SelectionWebSocketHandler handler;

    @BeforeEach
    void setUp() {
        sessionManager = new SelectionSessionManager(new SelectionProperties(), clock::get);
        handler = new SelectionWebSocketHandler(sessionManager);
    }

    @AfterEach
    void tearDown() {
        sessionManager.shutdown();
    }

    @Test
    void shouldRejectConnectionWithoutWhiteboard() throws Exception {
        WebSocketSession socket = socket("s1", "/ws/selection?username=alice");

        handler.afterConnectionEstablished(socket);

        verify(socket).close(any(CloseStatus.class));
        assertThat(handler.getConnectedClientCount()).isZero();
    }

    @Test
    void shouldSendStateOnConnect() throws Exception {
        WebSocketSession alice = connect("s1", "alice", "board-1");

        JsonNode greeting = lastMessage(alice);
        assertThat(greeting.get("type").asText()).isEqualTo("selection-state");
        assertThat(greeting.get("data").get("whiteboardId").asText()).isEqualTo("board-1");
        assertThat(handler.isUserConnected("board-1", "alice")).isTrue();
    }

    @Test
    void shouldBroadcastSelectionStateToWholeWhiteboard() throws Exception {
        WebSocketSession alice = connect("s1", "alice", "board-1");
        WebSocketSession bob = connect("s2", "bob", "board-1");
        WebSocketSession carol = connect("s3", "carol", "board-2");
        clearInvocations(alice, bob, carol);

        send(alice, "{\"type\":\"selection-update\",\"data\":{\"elementIds\":[\"e1\"],\"priority\":5}}");

        JsonNode state = lastMessage(bob);
        assertThat(state.get("type").asText()).isEqualTo("selection-state");
        assertThat(state.get("data").get("selections").get(0).get("userId").asText()).isEqualTo("alice");
        verify(carol, never()).sendMessage(any());
    }

    @Test
    void shouldActForConnectedUserOnly() throws Exception {
        WebSocketSession alice = connect("s1", "alice", "board-1");

        send(alice, "{\"type\":\"selection-update\",\"data\":{\"userId\":\"mallory\",\"elementIds\":[\"e1\"]}}");

        SelectionSession session = sessionManager.find("board-1").orElseThrow();
        assertThat(session.selections(null)).extracting(SelectionRecord::userId).containsExactly("alice");
    }

    @Test
    void shouldResolveConflictOverSocket() throws Exception {
        WebSocketSession alice = connect("s1", "alice", "board-1");
        WebSocketSession bob = connect("s2", "bob", "board-1");
        send(alice, "{\"type\":\"selection-update\",\"data\":{\"elementIds\":[\"e1\"],\"priority\":100}}");
        send(bob, "{\"type\":\"selection-update\",\"data\":{\"elementIds\":[\"e1\"],\"priority\":90}}");

        send(bob, "{\"type\":\"conflict-resolution\",\"data\":{\"conflictId\":\"conflict:e1\",\"resolution\":\"ownership\"}}");

        SelectionSession session = sessionManager.find("board-1").orElseThrow();
        assertThat(session.ownership("e1")).map(OwnershipRecord::ownerId).contains("alice");
        assertThat(session.conflicts()).isEmpty();
    }

    @Test
    void shouldReplyToOwnershipRequestWithResult() throws Exception {
        WebSocketSession alice = connect("s1", "alice", "board-1");
        WebSocketSession bob = connect("s2", "bob", "board-1");
        send(alice, "{\"type\":\"ownership-request\",\"data\":{\"elementId\":\"e5\",\"ttlMs\":1000}}");

        send(bob, "{\"type\":\"ownership-request\",\"data\":{\"elementId\":\"e5\"}}");

        JsonNode result = messagesOfType(bob, "ownership-result").get(0);
        assertThat(result.get("data").get("granted").asBoolean()).isFalse();
        assertThat(result.get("data").get("record").get("ownerId").asText()).isEqualTo("alice");
    }

    @Test
    void shouldRefuseOwnershipTtlLongerThanADay() throws Exception {
        WebSocketSession alice = connect("s1", "alice", "board-1");

        send(alice, "{\"type\":\"ownership-request\",\"data\":{\"elementId\":\"e5\",\"ttlMs\":9223372036854775807}}");
        send(alice, "{\"type\":\"ownership-request\",\"data\":{\"elementId\":\"e6\",\"ttlMs\":1000}}");
        send(alice, "{\"type\":\"ownership-renew\",\"data\":{\"elementId\":\"e6\",\"ttlMs\":86400001}}");

        assertThat(messagesOfType(alice, "error")).hasSize(2);
        SelectionSession session = sessionManager.find("board-1").orElseThrow();
        assertThat(session.ownerships()).extracting(OwnershipRecord::elementId).containsExactly("e6");
        assertThat(session.ownership("e6")).map(OwnershipRecord::expiresAt).contains(clock.get() + 1_000);
    }

    @Test
    void shouldAnswerViewportQueryToSenderOnly() throws Exception {
        WebSocketSession alice = connect("s1", "alice", "board-1");
        WebSocketSession bob = connect("s2", "bob", "board-1");
        send(alice, "{\"type\":\"element-bounds\",\"data\":{\"e1\":{\"x\":10,\"y\":10,\"width\":5,\"height\":5}}}");
        send(alice, "{\"type\":\"selection-update\",\"data\":{\"elementIds\":[\"e1\"]}}");
        clearInvocations(bob);

        send(alice, "{\"type\":\"viewport-query\",\"data\":{\"viewport\":{\"x\":0,\"y\":0,\"width\":100,\"height\":100}}}");

        JsonNode visible = messagesOfType(alice, "visible-state").get(0);
        assertThat(visible.get("data").get("selections").get(0).get("userId").asText()).isEqualTo("alice");
        assertThat(visible.get("data").get("selections").get(0).get("hints").get("opacity").asDouble()).isEqualTo(0.4);
        verify(bob, never()).sendMessage(any());
    }

    @Test
    void shouldReportMalformedAndUnknownMessages() throws Exception {
        WebSocketSession alice = connect("s1", "alice", "board-1");

        send(alice, "not json");
        send(alice, "{\"type\":\"teleport\"}");
        send(alice, "{\"type\":\"selection-clear\",\"whiteboardId\":\"board-9\"}");

        assertThat(messagesOfType(alice, "error")).hasSize(3);
    }

    @Test
    void shouldDropSelectionAndOwnershipsOnDisconnect() throws Exception {
        WebSocketSession alice = connect("s1", "alice", "board-1");
        WebSocketSession bob = connect("s2", "bob", "board-1");
        send(alice, "{\"type\":\"selection-update\",\"data\":{\"elementIds\":[\"e1\"]}}");
        send(alice, "{\"type\":\"ownership-request\",\"data\":{\"elementId\":\"e2\"}}");
        clearInvocations(bob);

        handler.afterConnectionClosed(alice, CloseStatus.NORMAL);

        SelectionSession session = sessionManager.find("board-1").orElseThrow();
        assertThat(session.selections(null)).isEmpty();
        assertThat(session.ownerships()).isEmpty();
        assertThat(messagesOfType(bob, "selection-state")).hasSize(1);
        assertThat(handler.isUserConnected("board-1", "alice")).isFalse();
    }

    @Test
    void shouldBroadcastAfterMaintenanceExpiry() throws Exception {
        WebSocketSession alice = connect("s1", "alice", "board-1");
        WebSocketSession bob = connect("s2", "bob", "board-1");
        send(alice, "{\"type\":\"selection-update\",\"data\":{\"elementIds\":[\"e1\"]}}");
        clearInvocations(bob);

        clock.addAndGet(new SelectionProperties().getLivenessTimeoutMs() + 1);
        sessionManager.sweepAll();

        JsonNode state = messagesOfType(bob, "selection-state").get(0);
        assertThat(state.get("data").get("selections").size()).isZero();
    }

    @Test
    void shouldKeepSelectionAliveWithHeartbeats() throws Exception {
        WebSocketSession alice = connect("s1", "alice", "board-1");
        send(alice, "{\"type\":\"selection-update\",\"data\":{\"elementIds\":[\"e1\"]}}");

        clock.addAndGet(20_000);
        send(alice, "{\"type\":\"heartbeat\"}");
        clock.addAndGet(20_000);
        sessionManager.sweepAll();

        SelectionSession session = sessionManager.find("board-1").orElseThrow();
        assertThat(session.selections(null)).extracting(SelectionRecord::userId).containsExactly("alice");
    }

    private WebSocketSession connect(String id, String username, String whiteboardId) throws Exception {
        WebSocketSession socket = socket(id, "/ws/selection?username=" + username + "&whiteboardId=" + whiteboardId);
        handler.afterConnectionEstablished(socket);
        return socket;
    }

    private WebSocketSession socket(String id, String uri) {
        WebSocketSession socket = mock(WebSocketSession.class);
        when(socket.getId()).thenReturn(id);
        when(socket.getUri()).thenReturn(URI.create("ws://localhost:8080" + uri));
        when(socket.getAttributes()).thenReturn(new HashMap<>());
        when(socket.isOpen()).thenReturn(true);
        return socket;
    }

    private void send(WebSocketSession socket, String payload) throws Exception {
        handler.handleTextMessage(socket, new TextMessage(payload));
    }

    private List<JsonNode> sentMessages(WebSocketSession socket) throws Exception {
        ArgumentCaptor<TextMessage> captor = ArgumentCaptor.forClass(TextMessage.class);
        verify(socket, atLeastOnce()).sendMessage(captor.capture());
        List<JsonNode> messages = new ArrayList<>();
        for (TextMessage message : captor.getAllValues()) {
            messages.add(objectMapper.readTree(message.getPayload()));
        }
        return messages;
    }

    private JsonNode lastMessage(WebSocketSession socket) throws Exception {
        List<JsonNode> messages = sentMessages(socket);
        return messages.get(messages.size() - 1);
    }

    private List<JsonNode> messagesOfType(WebSocketSession socket, String type) throws Exception {
        return sentMessages(socket).stream()
                .filter(message -> type.equals(message.get("type").asText()))
                .toList();
    }
}
