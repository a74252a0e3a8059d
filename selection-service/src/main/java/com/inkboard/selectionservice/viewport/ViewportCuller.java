package com.inkboard.selectionservice.viewport;

import com.inkboard.selectionservice.conflict.ConflictRecord;
import com.inkboard.selectionservice.geometry.BoundsCache;
import com.inkboard.selectionservice.geometry.BoundsResolver;
import com.inkboard.selectionservice.geometry.Box;
import com.inkboard.selectionservice.geometry.SpatialIndex;
import com.inkboard.selectionservice.ownership.OwnershipRecord;
import com.inkboard.selectionservice.selection.SelectionRecord;

import java.util.*;
import java.util.function.Predicate;

/**
 * Picks the selections, conflicts and ownerships worth rendering for a viewport.
 *
 * <p>Selections are indexed by user id under their combined bounds, elements by
 * element id under their own bounds, each in its own grid. Inputs are expected in
 * render order; filtering and truncation keep that order. Anything whose bounds
 * cannot be resolved is left out.
 */
public class ViewportCuller {
    private final BoundsCache boundsCache;
    private final BoundsResolver resolver;
    private final SpatialIndex selectionIndex;
    private final SpatialIndex elementIndex;
    private final double padding;

    public ViewportCuller(BoundsCache boundsCache, BoundsResolver resolver, double gridCellSize, double padding) {
        if (padding < 0) {
            throw new IllegalArgumentException("padding must not be negative");
        }
        this.boundsCache = Objects.requireNonNull(boundsCache, "boundsCache");
        this.resolver = Objects.requireNonNull(resolver, "resolver");
        this.selectionIndex = new SpatialIndex(gridCellSize);
        this.elementIndex = new SpatialIndex(gridCellSize);
        this.padding = padding;
    }

    public void trackSelection(SelectionRecord selection) {
        selectionIndex.insert(selection.userId(), boundsOf(selection).orElse(null));
    }

    public void untrackSelection(String userId) {
        selectionIndex.remove(userId);
    }

    public void trackElement(String elementId) {
        elementIndex.insert(elementId, boundsCache.get(elementId, resolver).orElse(null));
    }

    public void untrackElement(String elementId) {
        elementIndex.remove(elementId);
    }

    public void clear() {
        selectionIndex.clear();
        elementIndex.clear();
    }

    /**
     * Client-supplied bounds win; otherwise the union of the selected elements.
     */
    public Optional<Box> boundsOf(SelectionRecord selection) {
        if (selection.explicitBounds() != null) {
            return Optional.of(selection.explicitBounds());
        }
        return boundsCache.getCombined(selection.elementIds(), resolver, false);
    }

    public List<SelectionRecord> visibleSelections(List<SelectionRecord> selections, Viewport viewport, int maxVisible) {
        Box region = viewport.canvasRegion(padding);
        Set<String> hits = new HashSet<>(selectionIndex.queryRegion(region));
        return cull(selections, maxVisible, selection -> selectionIndex.contains(selection.userId())
                ? hits.contains(selection.userId())
                : boundsOf(selection).map(box -> box.intersects(region)).orElse(false));
    }

    public List<ConflictRecord> visibleConflicts(List<ConflictRecord> conflicts, Viewport viewport, int maxVisible) {
        Box region = viewport.canvasRegion(padding);
        Set<String> hits = new HashSet<>(elementIndex.queryRegion(region));
        return cull(conflicts, maxVisible, conflict -> elementVisible(conflict.elementId(), region, hits));
    }

    public List<OwnershipRecord> visibleOwnerships(List<OwnershipRecord> ownerships, Viewport viewport, int maxVisible) {
        Box region = viewport.canvasRegion(padding);
        Set<String> hits = new HashSet<>(elementIndex.queryRegion(region));
        return cull(ownerships, maxVisible, ownership -> elementVisible(ownership.elementId(), region, hits));
    }

    /**
     * Builds the full frame state for one client.
     *
     * @param selections already in render order, current user first
     */
    public VisibleState render(List<SelectionRecord> selections,
                               List<ConflictRecord> conflicts,
                               List<OwnershipRecord> ownerships,
                               Viewport viewport,
                               String currentUserId,
                               PerformanceMode mode,
                               int maxVisible) {
        List<SelectionRecord> visible = visibleSelections(selections, viewport, mode.maxVisible(maxVisible));
        Set<String> contested = new HashSet<>();
        for (ConflictRecord conflict : conflicts) {
            contested.add(conflict.elementId());
        }

        List<SelectionHighlight> highlights = new ArrayList<>(visible.size());
        for (SelectionRecord selection : visible) {
            boolean conflicted = selection.elementIds().stream().anyMatch(contested::contains);
            highlights.add(new SelectionHighlight(
                    selection.userId(),
                    selection.displayName(),
                    selection.color(),
                    selection.elementIds(),
                    boundsOf(selection).orElse(Box.EMPTY),
                    selection.timestamp(),
                    HighlightHints.forSelection(selection.userId().equals(currentUserId), conflicted, mode)));
        }

        List<ConflictRecord> visibleConflicts = visibleConflicts(conflicts, viewport, maxVisible);
        List<OwnershipRecord> visibleOwnerships = visibleOwnerships(ownerships, viewport, maxVisible);
        return new VisibleState(
                highlights,
                visibleConflicts,
                visibleOwnerships,
                new VisibleState.Stats(selections.size(), highlights.size(),
                        visibleConflicts.size(), visibleOwnerships.size(), mode));
    }

    public SpatialIndex.IndexStats selectionIndexStats() {
        return selectionIndex.stats();
    }

    public SpatialIndex.IndexStats elementIndexStats() {
        return elementIndex.stats();
    }

    public double padding() {
        return padding;
    }

    private boolean elementVisible(String elementId, Box region, Set<String> hits) {
        if (elementIndex.contains(elementId)) {
            return hits.contains(elementId);
        }
        return boundsCache.get(elementId, resolver).map(box -> box.intersects(region)).orElse(false);
    }

    private static <T> List<T> cull(List<T> items, int maxVisible, Predicate<T> visible) {
        int limit = Math.max(0, maxVisible);
        List<T> result = new ArrayList<>(Math.min(items.size(), limit));
        for (T item : items) {
            if (result.size() >= limit) {
                break;
            }
            if (visible.test(item)) {
                result.add(item);
            }
        }
        return result;
    }
}
