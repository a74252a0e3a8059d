package com.inkboard.selectionservice.selection;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.inkboard.selectionservice.geometry.Box;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;

/**
 * The current selection of one user on one whiteboard.
 * Replaced wholesale on every selection update for that user.
 */
public record SelectionRecord(
        String userId,
        String displayName,
        String color,
        String whiteboardId,
        String sessionId,
        List<String> elementIds,
        Box explicitBounds,      // optional precomputed box supplied by the client
        long timestamp,          // selection event time, used for tie-breaking
        int priority,            // higher wins
        boolean multiSelect,
        boolean active,
        long lastSeen            // liveness
) {
    public SelectionRecord {
        Objects.requireNonNull(userId, "userId");
        elementIds = elementIds == null ? List.of() : List.copyOf(new LinkedHashSet<>(elementIds));
    }

    @JsonIgnore
    public boolean isEmpty() {
        return elementIds.isEmpty();
    }

    public boolean contains(String elementId) {
        return elementIds.contains(elementId);
    }

    public SelectionRecord withElementIds(List<String> newElementIds) {
        return new SelectionRecord(userId, displayName, color, whiteboardId, sessionId, newElementIds,
                explicitBounds, timestamp, priority, multiSelect, active, lastSeen);
    }

    public SelectionRecord withoutElement(String elementId) {
        return withElementIds(elementIds.stream().filter(id -> !id.equals(elementId)).toList())
                .dropExplicitBounds();
    }

    public SelectionRecord withLastSeen(long newLastSeen) {
        return new SelectionRecord(userId, displayName, color, whiteboardId, sessionId, elementIds,
                explicitBounds, timestamp, priority, multiSelect, active, newLastSeen);
    }

    // the client's box no longer describes the remaining elements
    private SelectionRecord dropExplicitBounds() {
        return new SelectionRecord(userId, displayName, color, whiteboardId, sessionId, elementIds,
                null, timestamp, priority, multiSelect, active, lastSeen);
    }
}
