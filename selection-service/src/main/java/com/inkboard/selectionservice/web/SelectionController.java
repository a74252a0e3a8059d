package com.inkboard.selectionservice.web;

import com.inkboard.selectionservice.conflict.ConflictResolution;
import com.inkboard.selectionservice.geometry.Box;
import com.inkboard.selectionservice.ownership.AcquireResult;
import com.inkboard.selectionservice.selection.SelectionRecord;
import com.inkboard.selectionservice.session.SelectionSession;
import com.inkboard.selectionservice.session.SelectionSessionManager;
import com.inkboard.selectionservice.viewport.PerformanceMode;
import com.inkboard.selectionservice.viewport.Viewport;
import com.inkboard.selectionservice.viewport.VisibleState;
import com.inkboard.selectionservice.web.dto.*;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * REST API endpoints for shared selection state.
 * Handles selection updates, conflict resolution, ownership locks and viewport queries.
 */
@RestController
@RequestMapping("/api/whiteboards/{whiteboardId}")
@Validated
public class SelectionController {
    private final SelectionSessionManager sessionManager;

    public SelectionController(SelectionSessionManager sessionManager) {
        this.sessionManager = sessionManager;
    }

    /**
     * Apply a selection-update event. An empty selection clears the user's selection.
     */
    @PostMapping("/selections")
    public ResponseEntity<?> updateSelection(@PathVariable String whiteboardId,
                                             @Valid @RequestBody SelectionUpdateRequest request) {
        if (request.whiteboardId() != null && !request.whiteboardId().equals(whiteboardId)) {
            return ResponseEntity.badRequest()
                    .body(Map.of("error", "whiteboardId does not match the request path"));
        }
        SelectionSession session = sessionManager.getOrCreate(whiteboardId);
        Optional<SelectionRecord> stored = session.applySelection(request.toUpdate(whiteboardId));

        return ResponseEntity.ok(Map.of(
                "selected", stored.isPresent(),
                "elementIds", stored.map(SelectionRecord::elementIds).orElse(List.of()),
                "conflicts", session.conflicts()
        ));
    }

    /**
     * Clear a user's selection.
     */
    @DeleteMapping("/selections/{userId}")
    public ResponseEntity<?> clearSelection(@PathVariable String whiteboardId, @PathVariable String userId) {
        Optional<SelectionSession> session = sessionManager.find(whiteboardId);
        if (session.isEmpty() || !session.get().clearSelection(userId)) {
            return ResponseEntity.notFound().build();
        }
        return ResponseEntity.ok(Map.of("success", true));
    }

    /**
     * Active selections, highest priority first; the current user's first of all.
     */
    @GetMapping("/selections")
    public ResponseEntity<List<SelectionRecord>> getSelections(@PathVariable String whiteboardId,
                                                               @RequestParam(required = false) String currentUserId) {
        return ResponseEntity.ok(sessionManager.find(whiteboardId)
                .map(session -> session.selections(currentUserId))
                .orElse(List.of()));
    }

    @GetMapping("/conflicts")
    public ResponseEntity<?> getConflicts(@PathVariable String whiteboardId) {
        return ResponseEntity.ok(sessionManager.find(whiteboardId)
                .map(SelectionSession::conflicts)
                .orElse(List.of()));
    }

    /**
     * Resolution counts of the whiteboard, manual and automatic.
     */
    @GetMapping("/conflicts/stats")
    public ResponseEntity<SelectionSession.ConflictStats> getConflictStats(@PathVariable String whiteboardId) {
        return ResponseEntity.ok(sessionManager.find(whiteboardId)
                .map(SelectionSession::conflictStats)
                .orElse(new SelectionSession.ConflictStats(0, 0, 0, 0)));
    }

    /**
     * Resolve a conflict with ownership, shared or cancel.
     */
    @PostMapping("/conflicts/{conflictId}/resolve")
    public ResponseEntity<?> resolveConflict(@PathVariable String whiteboardId,
                                             @PathVariable String conflictId,
                                             @Valid @RequestBody ConflictResolutionRequest request) {
        Optional<ConflictResolution> resolution = ConflictResolution.parse(request.resolution());
        if (resolution.isEmpty()) {
            return ResponseEntity.badRequest()
                    .body(Map.of("error", "Unknown resolution: " + request.resolution()));
        }
        Optional<SelectionSession> session = sessionManager.find(whiteboardId);
        if (session.isEmpty() || session.get().conflicts().stream()
                .noneMatch(conflict -> conflict.conflictId().equals(conflictId))) {
            return ResponseEntity.notFound().build();
        }
        if (!session.get().resolveConflict(conflictId, resolution.get())) {
            return ResponseEntity.status(HttpStatus.CONFLICT)
                    .body(Map.of("error", "Conflict " + conflictId + " could not be resolved"));
        }
        return ResponseEntity.ok(SelectionStateDto.fromSession(session.get()));
    }

    @GetMapping("/ownerships")
    public ResponseEntity<?> getOwnerships(@PathVariable String whiteboardId) {
        return ResponseEntity.ok(sessionManager.find(whiteboardId)
                .map(SelectionSession::ownerships)
                .orElse(List.of()));
    }

    /**
     * Request ownership of an element. A rejection is a normal answer, not an error.
     */
    @PostMapping("/ownerships")
    public ResponseEntity<OwnershipResponse> requestOwnership(@PathVariable String whiteboardId,
                                                              @Valid @RequestBody OwnershipRequestDto request) {
        AcquireResult result = sessionManager.getOrCreate(whiteboardId).requestOwnership(request.toRequest());
        return ResponseEntity.ok(OwnershipResponse.fromResult(result));
    }

    @PostMapping("/ownerships/{elementId}/renew")
    public ResponseEntity<?> renewOwnership(@PathVariable String whiteboardId,
                                            @PathVariable String elementId,
                                            @Valid @RequestBody OwnershipActionRequest request) {
        boolean renewed = sessionManager.find(whiteboardId)
                .map(session -> session.renewOwnership(elementId, request.userId(), request.ttlOrDefault()))
                .orElse(false);
        return ResponseEntity.ok(Map.of("success", renewed));
    }

    @PostMapping("/ownerships/{elementId}/release")
    public ResponseEntity<?> releaseOwnership(@PathVariable String whiteboardId,
                                              @PathVariable String elementId,
                                              @Valid @RequestBody OwnershipActionRequest request) {
        boolean released = sessionManager.find(whiteboardId)
                .map(session -> session.releaseOwnership(elementId, request.userId()))
                .orElse(false);
        return ResponseEntity.ok(Map.of("success", released));
    }

    /**
     * Report element geometry, keyed by element id.
     */
    @PutMapping("/elements/bounds")
    public ResponseEntity<?> updateElementBounds(@PathVariable String whiteboardId,
                                                 @RequestBody Map<String, Box> bounds) {
        int changed = sessionManager.getOrCreate(whiteboardId).updateElementBounds(bounds);
        return ResponseEntity.ok(Map.of("changed", changed));
    }

    @DeleteMapping("/elements/{elementId}")
    public ResponseEntity<?> removeElement(@PathVariable String whiteboardId, @PathVariable String elementId) {
        boolean removed = sessionManager.find(whiteboardId)
                .map(session -> session.removeElement(elementId))
                .orElse(false);
        return removed ? ResponseEntity.ok(Map.of("success", true)) : ResponseEntity.notFound().build();
    }

    /**
     * Everything visible in a viewport, for one render tick.
     */
    @PostMapping("/viewport")
    public ResponseEntity<VisibleState> queryViewport(@PathVariable String whiteboardId,
                                                      @Valid @RequestBody ViewportQueryRequest request) {
        SelectionSession session = sessionManager.getOrCreate(whiteboardId);
        Viewport viewport = new Viewport(request.getViewport(), request.getTransform());
        PerformanceMode mode = PerformanceMode.parse(request.getPerformanceMode(), null);
        return ResponseEntity.ok(session.visibleState(
                viewport, request.getCurrentUserId(), mode, request.getMaxVisible()));
    }
}
