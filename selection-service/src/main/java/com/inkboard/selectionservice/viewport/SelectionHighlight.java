package com.inkboard.selectionservice.viewport;

import com.inkboard.selectionservice.geometry.Box;

import java.util.List;

/**
 * A selection as handed to the rendering layer.
 */
public record SelectionHighlight(
        String userId,
        String userName,
        String userColor,
        List<String> elementIds,
        Box bounds,
        long timestamp,
        HighlightHints hints
) {
}
