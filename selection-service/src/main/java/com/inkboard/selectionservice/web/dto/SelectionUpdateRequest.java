package com.inkboard.selectionservice.web.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.inkboard.selectionservice.geometry.Box;
import com.inkboard.selectionservice.selection.SelectionUpdate;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

import java.util.List;

/**
 * Selection-update event as sent by a client. An empty {@code elementIds} list clears the selection.
 */
public record SelectionUpdateRequest(
        @NotBlank(message = "userId is required")
        String userId,
        String userName,
        String userColor,
        String whiteboardId,
        String sessionId,
        @NotNull(message = "elementIds is required")
        List<String> elementIds,
        Box selectionBounds,
        Long timestamp,
        @JsonProperty("isMultiSelect")
        Boolean isMultiSelect,
        Integer priority,
        @JsonProperty("isActive")
        Boolean isActive,
        Long lastSeen
) {
    /**
     * @param whiteboardId the board addressed by the request path or connection
     */
    public SelectionUpdate toUpdate(String whiteboardId) {
        return new SelectionUpdate(
                userId,
                userName,
                userColor,
                whiteboardId,
                sessionId,
                elementIds,
                selectionBounds,
                timestamp != null ? timestamp : 0L,
                Boolean.TRUE.equals(isMultiSelect),
                priority != null ? priority : 0,
                isActive == null || isActive,
                lastSeen != null ? lastSeen : 0L);
    }
}
