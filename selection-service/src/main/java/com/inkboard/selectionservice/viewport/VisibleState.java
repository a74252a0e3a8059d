package com.inkboard.selectionservice.viewport;

import com.inkboard.selectionservice.conflict.ConflictRecord;
import com.inkboard.selectionservice.ownership.OwnershipRecord;

import java.util.List;

/**
 * Everything the renderer needs for one frame, already culled to the viewport.
 */
public record VisibleState(
        List<SelectionHighlight> selections,
        List<ConflictRecord> conflicts,
        List<OwnershipRecord> ownerships,
        Stats stats
) {
    public record Stats(
            int totalSelections,
            int visibleSelections,
            int conflictCount,
            int ownershipCount,
            PerformanceMode performanceMode
    ) {
    }
}
