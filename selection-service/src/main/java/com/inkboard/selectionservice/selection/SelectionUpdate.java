package com.inkboard.selectionservice.selection;

import com.inkboard.selectionservice.geometry.Box;

import java.util.List;

/**
 * Inbound selection-update event as received from a client, before sanitizing.
 */
public record SelectionUpdate(
        String userId,
        String userName,
        String userColor,
        String whiteboardId,
        String sessionId,
        List<String> elementIds,
        Box selectionBounds,
        long timestamp,
        boolean multiSelect,
        int priority,
        boolean active,
        long lastSeen
) {
}
