package com.inkboard.selectionservice.websocket;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.inkboard.selectionservice.conflict.ConflictResolution;
import com.inkboard.selectionservice.geometry.Box;
import com.inkboard.selectionservice.ownership.AcquireResult;
import com.inkboard.selectionservice.session.SelectionSession;
import com.inkboard.selectionservice.session.SelectionSessionManager;
import com.inkboard.selectionservice.viewport.PerformanceMode;
import com.inkboard.selectionservice.viewport.Viewport;
import com.inkboard.selectionservice.web.dto.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.TextWebSocketHandler;

import java.io.IOException;
import java.net.URI;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Live selection channel.
 *
 * Each connection belongs to one user on one whiteboard, taken from the query string.
 * Every accepted mutation is followed by a {@code selection-state} broadcast to all
 * connections of that whiteboard, so clients never patch state themselves.
 *
 * Message types:
 * - selection-update, selection-clear, heartbeat (liveness only, no broadcast)
 * - element-bounds
 * - ownership-request, ownership-renew, ownership-release
 * - conflict-resolution
 * - viewport-query (answered with visible-state to the sender only)
 */
@Component
public class SelectionWebSocketHandler extends TextWebSocketHandler {
    private static final Logger log = LoggerFactory.getLogger(SelectionWebSocketHandler.class);

    private static final String USERNAME = "username";
    private static final String WHITEBOARD_ID = "whiteboardId";

    // whiteboardId -> username -> WebSocketSession
    private final ConcurrentHashMap<String, ConcurrentHashMap<String, WebSocketSession>> boardConnections =
            new ConcurrentHashMap<>();

    private final ObjectMapper objectMapper = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    private final SelectionSessionManager sessionManager;

    public SelectionWebSocketHandler(SelectionSessionManager sessionManager) {
        this.sessionManager = sessionManager;
        // expiries happen on the maintenance thread; clients still need to hear about them
        sessionManager.addSweepListener((whiteboardId, result) -> broadcastState(whiteboardId));
    }

    @Override
    public void afterConnectionEstablished(WebSocketSession session) throws Exception {
        String username = queryParam(session, USERNAME);
        String whiteboardId = queryParam(session, WHITEBOARD_ID);

        if (username == null || username.isBlank() || whiteboardId == null || whiteboardId.isBlank()) {
            log.warn("Selection socket rejected: username and whiteboardId are required");
            session.close(CloseStatus.POLICY_VIOLATION.withReason("username and whiteboardId required"));
            return;
        }

        WebSocketSession oldSession = boardConnections
                .computeIfAbsent(whiteboardId, id -> new ConcurrentHashMap<>())
                .put(username, session);
        if (oldSession != null && oldSession.isOpen()) {
            log.info("Replacing selection socket of {} on whiteboard {}", username, whiteboardId);
            try {
                oldSession.close(CloseStatus.NORMAL.withReason("New connection established"));
            } catch (IOException e) {
                log.warn("Error closing old session: {}", e.getMessage());
            }
        }

        session.getAttributes().put(USERNAME, username);
        session.getAttributes().put(WHITEBOARD_ID, whiteboardId);

        SelectionSession selectionSession = sessionManager.getOrCreate(whiteboardId);
        log.info("Selection socket connected: user={}, whiteboard={}, sessionId={}",
                username, whiteboardId, session.getId());

        sendMessage(session, new SelectionMessage(
                "selection-state", "system", whiteboardId,
                toMap(SelectionStateDto.fromSession(selectionSession)), null));
    }

    @Override
    public void afterConnectionClosed(WebSocketSession session, CloseStatus status) throws Exception {
        String username = (String) session.getAttributes().get(USERNAME);
        String whiteboardId = (String) session.getAttributes().get(WHITEBOARD_ID);
        if (username == null || whiteboardId == null) {
            return;
        }

        Map<String, WebSocketSession> connections = boardConnections.get(whiteboardId);
        // a replaced connection closing late must not take the new one with it
        if (connections == null || !connections.remove(username, session)) {
            return;
        }
        log.info("Selection socket disconnected: user={}, whiteboard={}, status={}", username, whiteboardId, status);

        sessionManager.find(whiteboardId).ifPresent(selectionSession -> {
            selectionSession.disconnect(username);
            broadcastState(whiteboardId);
        });
    }

    @Override
    protected void handleTextMessage(WebSocketSession session, TextMessage message) throws Exception {
        String username = (String) session.getAttributes().get(USERNAME);
        String whiteboardId = (String) session.getAttributes().get(WHITEBOARD_ID);

        if (username == null || whiteboardId == null) {
            log.warn("Received message from unregistered session: {}", session.getId());
            return;
        }

        try {
            SelectionMessage msg = objectMapper.readValue(message.getPayload(), SelectionMessage.class);
            if (msg.type() == null) {
                sendError(session, "Message type is required");
                return;
            }
            if (msg.whiteboardId() != null && !msg.whiteboardId().equals(whiteboardId)) {
                sendError(session, "Message addressed to whiteboard " + msg.whiteboardId()
                        + " on a connection for " + whiteboardId);
                return;
            }
            log.debug("Selection message from {} on {}: type={}", username, whiteboardId, msg.type());

            SelectionSession selectionSession = sessionManager.getOrCreate(whiteboardId);
            Map<String, Object> data = msg.data() != null ? msg.data() : Map.of();
            switch (msg.type()) {
                case "selection-update":
                    handleSelectionUpdate(selectionSession, username, data);
                    break;
                case "heartbeat":
                    selectionSession.heartbeat(username);
                    return;
                case "selection-clear":
                    selectionSession.clearSelection(username);
                    break;
                case "element-bounds":
                    handleElementBounds(selectionSession, data);
                    break;
                case "ownership-request":
                    handleOwnershipRequest(session, selectionSession, username, data);
                    break;
                case "ownership-renew":
                    handleOwnershipRenew(session, selectionSession, username, data);
                    break;
                case "ownership-release":
                    selectionSession.releaseOwnership((String) data.get("elementId"), username);
                    break;
                case "conflict-resolution":
                    if (!handleConflictResolution(session, selectionSession, data)) {
                        return;
                    }
                    break;
                case "viewport-query":
                    handleViewportQuery(session, selectionSession, username, data);
                    return;
                default:
                    log.warn("Unknown message type: {} from user: {}", msg.type(), username);
                    sendError(session, "Unknown message type: " + msg.type());
                    return;
            }
            broadcastState(whiteboardId);

        } catch (Exception e) {
            log.error("Error handling selection message from {}: {}", username, e.getMessage(), e);
            sendError(session, "Failed to process message: " + e.getMessage());
        }
    }

    /**
     * Selection events always act for the connected user, whatever userId they carry.
     */
    private void handleSelectionUpdate(SelectionSession selectionSession, String username, Map<String, Object> data) {
        Map<String, Object> payload = new HashMap<>(data);
        payload.put("userId", username);
        payload.putIfAbsent("elementIds", List.of());
        SelectionUpdateRequest request = objectMapper.convertValue(payload, SelectionUpdateRequest.class);
        selectionSession.applySelection(request.toUpdate(selectionSession.whiteboardId()));
    }

    private void handleElementBounds(SelectionSession selectionSession, Map<String, Object> data) {
        Map<String, Box> bounds = new HashMap<>();
        for (Map.Entry<String, Object> entry : data.entrySet()) {
            bounds.put(entry.getKey(), objectMapper.convertValue(entry.getValue(), Box.class));
        }
        selectionSession.updateElementBounds(bounds);
    }

    private void handleOwnershipRequest(WebSocketSession session, SelectionSession selectionSession,
                                        String username, Map<String, Object> data) {
        Map<String, Object> payload = new HashMap<>(data);
        payload.put("userId", username);
        OwnershipRequestDto request = objectMapper.convertValue(payload, OwnershipRequestDto.class);
        if (request.elementId() == null || request.elementId().isBlank()) {
            sendError(session, "elementId is required");
            return;
        }
        if (request.ttlMs() != null && request.ttlMs() > OwnershipRequestDto.MAX_TTL_MS) {
            sendError(session, "ttlMs must not exceed 24 hours");
            return;
        }
        AcquireResult result = selectionSession.requestOwnership(request.toRequest());
        sendMessage(session, new SelectionMessage(
                "ownership-result", "system", selectionSession.whiteboardId(),
                toMap(OwnershipResponse.fromResult(result)), null));
    }

    private void handleOwnershipRenew(WebSocketSession session, SelectionSession selectionSession,
                                      String username, Map<String, Object> data) {
        String elementId = (String) data.get("elementId");
        Object ttl = data.get("ttlMs");
        long ttlMs = ttl instanceof Number number ? number.longValue() : 0L;
        if (ttlMs > OwnershipRequestDto.MAX_TTL_MS) {
            sendError(session, "ttlMs must not exceed 24 hours");
            return;
        }
        boolean renewed = selectionSession.renewOwnership(elementId, username, ttlMs);
        if (!renewed) {
            sendError(session, "Ownership of " + elementId + " is not held by " + username);
        }
    }

    private boolean handleConflictResolution(WebSocketSession session, SelectionSession selectionSession,
                                             Map<String, Object> data) {
        String conflictId = (String) data.get("conflictId");
        ConflictResolution resolution = ConflictResolution.parse((String) data.get("resolution")).orElse(null);
        if (conflictId == null || resolution == null) {
            sendError(session, "conflictId and a resolution of ownership, shared or cancel are required");
            return false;
        }
        if (!selectionSession.resolveConflict(conflictId, resolution)) {
            sendError(session, "Conflict " + conflictId + " could not be resolved");
            return false;
        }
        return true;
    }

    private void handleViewportQuery(WebSocketSession session, SelectionSession selectionSession,
                                     String username, Map<String, Object> data) {
        ViewportQueryRequest request = objectMapper.convertValue(data, ViewportQueryRequest.class);
        if (request.getViewport() == null) {
            sendError(session, "viewport is required");
            return;
        }
        Viewport viewport = new Viewport(request.getViewport(), request.getTransform());
        String currentUserId = request.getCurrentUserId() != null ? request.getCurrentUserId() : username;
        var state = selectionSession.visibleState(viewport, currentUserId,
                PerformanceMode.parse(request.getPerformanceMode(), null), request.getMaxVisible());
        sendMessage(session, new SelectionMessage(
                "visible-state", "system", selectionSession.whiteboardId(), toMap(state), null));
    }

    /**
     * Pushes the whiteboard's full selection state to everyone connected to it.
     */
    public void broadcastState(String whiteboardId) {
        Map<String, WebSocketSession> connections = boardConnections.get(whiteboardId);
        if (connections == null || connections.isEmpty()) {
            return;
        }
        SelectionSession selectionSession = sessionManager.find(whiteboardId).orElse(null);
        if (selectionSession == null) {
            return;
        }
        SelectionMessage msg = new SelectionMessage(
                "selection-state", "system", whiteboardId,
                toMap(SelectionStateDto.fromSession(selectionSession)), null);
        for (WebSocketSession connection : connections.values()) {
            if (connection.isOpen()) {
                sendMessage(connection, msg);
            }
        }
    }

    private void sendMessage(WebSocketSession session, SelectionMessage msg) {
        try {
            String json = objectMapper.writeValueAsString(msg);
            // handler threads and the maintenance thread may both write to one socket
            synchronized (session) {
                session.sendMessage(new TextMessage(json));
            }
        } catch (IOException e) {
            log.error("Failed to send message to session {}: {}", session.getId(), e.getMessage());
        }
    }

    private void sendError(WebSocketSession session, String error) {
        sendMessage(session, new SelectionMessage(
                "error",
                "system",
                (String) session.getAttributes().get(WHITEBOARD_ID),
                null,
                error));
    }

    @SuppressWarnings("unchecked")
    private Map<String, Object> toMap(Object value) {
        return objectMapper.convertValue(value, Map.class);
    }

    private static String queryParam(WebSocketSession session, String name) {
        URI uri = session.getUri();
        String query = uri != null ? uri.getQuery() : null;
        if (query != null) {
            for (String param : query.split("&")) {
                String[] kv = param.split("=", 2);
                if (kv.length == 2 && name.equals(kv[0])) {
                    return kv[1];
                }
            }
        }
        return null;
    }

    public int getConnectedClientCount() {
        return boardConnections.values().stream().mapToInt(Map::size).sum();
    }

    public boolean isUserConnected(String whiteboardId, String username) {
        Map<String, WebSocketSession> connections = boardConnections.get(whiteboardId);
        WebSocketSession session = connections != null ? connections.get(username) : null;
        return session != null && session.isOpen();
    }

    /**
     * Selection channel message format.
     */
    public record SelectionMessage(
            String type,
            String from,
            String whiteboardId,
            Map<String, Object> data,
            String error) {
    }
}
