package com.inkboard.selectionservice.web.dto;

import com.inkboard.selectionservice.conflict.ConflictRecord;
import com.inkboard.selectionservice.ownership.OwnershipRecord;
import com.inkboard.selectionservice.selection.SelectionRecord;
import com.inkboard.selectionservice.session.SelectionSession;

import java.util.List;

/**
 * Unculled shared state of a whiteboard, as broadcast after every change.
 */
public record SelectionStateDto(
        String whiteboardId,
        List<SelectionRecord> selections,
        List<ConflictRecord> conflicts,
        List<OwnershipRecord> ownerships
) {
    public static SelectionStateDto fromSession(SelectionSession session) {
        return new SelectionStateDto(
                session.whiteboardId(),
                session.selections(null),
                session.conflicts(),
                session.ownerships());
    }
}
