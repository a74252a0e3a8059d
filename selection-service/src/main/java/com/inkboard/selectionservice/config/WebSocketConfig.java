package com.inkboard.selectionservice.config;

import com.inkboard.selectionservice.websocket.SelectionWebSocketHandler;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.socket.config.annotation.EnableWebSocket;
import org.springframework.web.socket.config.annotation.WebSocketConfigurer;
import org.springframework.web.socket.config.annotation.WebSocketHandlerRegistry;

/**
 * WebSocket endpoint for live selection traffic.
 *
 * Clients connect with:
 * - ws://host:port/ws/selection?username=john&whiteboardId=board-1
 */
@Configuration
@EnableWebSocket
public class WebSocketConfig implements WebSocketConfigurer {

    private final SelectionWebSocketHandler selectionWebSocketHandler;
    private final CorsProperties corsProperties;

    public WebSocketConfig(SelectionWebSocketHandler selectionWebSocketHandler, CorsProperties corsProperties) {
        this.selectionWebSocketHandler = selectionWebSocketHandler;
        this.corsProperties = corsProperties;
    }

    @Override
    public void registerWebSocketHandlers(WebSocketHandlerRegistry registry) {
        registry.addHandler(selectionWebSocketHandler, "/ws/selection")
                .setAllowedOriginPatterns(corsProperties.getAllowedOrigins().toArray(String[]::new));
    }
}
