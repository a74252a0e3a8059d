package com.inkboard.selectionservice.web;

import com.inkboard.selectionservice.session.SelectionSessionManager;
import com.inkboard.selectionservice.websocket.SelectionWebSocketHandler;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

/**
 * Health check endpoint to verify the selection engine is running.
 */
@RestController
@RequestMapping("/api/health")
public class HealthController {
    private final SelectionSessionManager sessionManager;
    private final SelectionWebSocketHandler webSocketHandler;

    public HealthController(SelectionSessionManager sessionManager, SelectionWebSocketHandler webSocketHandler) {
        this.sessionManager = sessionManager;
        this.webSocketHandler = webSocketHandler;
    }

    @GetMapping
    public ResponseEntity<Map<String, Object>> health() {
        return ResponseEntity.ok(Map.of(
                "status", "UP",
                "activeWhiteboards", sessionManager.sessionCount(),
                "connectedClients", webSocketHandler.getConnectedClientCount(),
                "services", Map.of(
                        "selection-socket", "ws://localhost:8080/ws/selection")));
    }
}
