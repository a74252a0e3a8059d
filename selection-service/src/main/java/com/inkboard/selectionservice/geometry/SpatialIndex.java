package com.inkboard.selectionservice.geometry;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/**
 * Uniform grid over bounding boxes. Every entry is listed in each cell its box
 * overlaps; queries union the candidate cells and then test the true rectangle
 * intersection, so results contain neither false negatives nor false positives.
 *
 * <p>Entries whose box would cover more than {@link #OVERSIZED_CELL_LIMIT} cells are
 * kept in a separate bucket that is a candidate for every query.
 *
 * <p>Not thread-safe; mutated only from the owning session's serialized path.
 */
public class SpatialIndex {
    private static final Logger log = LoggerFactory.getLogger(SpatialIndex.class);
    static final long OVERSIZED_CELL_LIMIT = 1024;

    private final double cellSize;
    private final Map<GridCell, Set<String>> cells = new HashMap<>();
    // last-known box per entry, used to clear exactly the cells it was inserted into
    private final Map<String, Box> entries = new HashMap<>();
    private final Set<String> oversized = new HashSet<>();

    public SpatialIndex(double cellSize) {
        if (!(cellSize > 0) || !Double.isFinite(cellSize)) {
            throw new IllegalArgumentException("cellSize must be a positive finite number: " + cellSize);
        }
        this.cellSize = cellSize;
    }

    /**
     * Inserts or moves an entry. A {@code null} or invalid box just removes it.
     */
    public void insert(String id, Box box) {
        Objects.requireNonNull(id, "id");
        remove(id);
        if (box == null || !box.isValid()) {
            log.debug("Not indexing {}: unusable box {}", id, box);
            return;
        }
        entries.put(id, box);
        CellRange range = rangeOf(box);
        if (range.cellCount() > OVERSIZED_CELL_LIMIT) {
            oversized.add(id);
            return;
        }
        for (long col = range.minCol(); col <= range.maxCol(); col++) {
            for (long row = range.minRow(); row <= range.maxRow(); row++) {
                cells.computeIfAbsent(new GridCell(col, row), k -> new HashSet<>()).add(id);
            }
        }
    }

    /**
     * @return true if the entry was present
     */
    public boolean remove(String id) {
        Box previous = entries.remove(id);
        if (previous == null) {
            return false;
        }
        if (oversized.remove(id)) {
            return true;
        }
        CellRange range = rangeOf(previous);
        for (long col = range.minCol(); col <= range.maxCol(); col++) {
            for (long row = range.minRow(); row <= range.maxRow(); row++) {
                GridCell cell = new GridCell(col, row);
                Set<String> members = cells.get(cell);
                if (members != null) {
                    members.remove(id);
                    if (members.isEmpty()) {
                        cells.remove(cell);
                    }
                }
            }
        }
        return true;
    }

    /**
     * Ids of every entry whose box intersects {@code region}, sorted.
     */
    public List<String> queryRegion(Box region) {
        if (region == null || !region.isValid() || entries.isEmpty()) {
            return List.of();
        }
        CellRange range = rangeOf(region);
        Set<String> candidates = new HashSet<>(oversized);
        if (range.cellCount() > cells.size()) {
            // cheaper to walk the occupied cells than the requested range
            for (Map.Entry<GridCell, Set<String>> cell : cells.entrySet()) {
                if (range.contains(cell.getKey())) {
                    candidates.addAll(cell.getValue());
                }
            }
        } else {
            for (long col = range.minCol(); col <= range.maxCol(); col++) {
                for (long row = range.minRow(); row <= range.maxRow(); row++) {
                    Set<String> members = cells.get(new GridCell(col, row));
                    if (members != null) {
                        candidates.addAll(members);
                    }
                }
            }
        }

        List<String> matches = new ArrayList<>();
        for (String id : candidates) {
            if (entries.get(id).intersects(region)) {
                matches.add(id);
            }
        }
        Collections.sort(matches);
        return matches;
    }

    public boolean contains(String id) {
        return entries.containsKey(id);
    }

    public Optional<Box> boxOf(String id) {
        return Optional.ofNullable(entries.get(id));
    }

    public void clear() {
        cells.clear();
        entries.clear();
        oversized.clear();
    }

    public IndexStats stats() {
        return new IndexStats(entries.size(), cells.size());
    }

    public double cellSize() {
        return cellSize;
    }

    /**
     * Copy of the cell membership, for consistency checks.
     */
    Map<GridCell, Set<String>> cellMembership() {
        Map<GridCell, Set<String>> copy = new HashMap<>();
        cells.forEach((cell, members) -> copy.put(cell, Set.copyOf(members)));
        return copy;
    }

    Set<String> oversizedEntries() {
        return Set.copyOf(oversized);
    }

    private CellRange rangeOf(Box box) {
        return new CellRange(
                cellOf(box.x()), cellOf(box.y()),
                cellOf(box.maxX()), cellOf(box.maxY()));
    }

    private long cellOf(double coordinate) {
        return (long) Math.floor(coordinate / cellSize);
    }

    /**
     * Integer grid coordinates of one cell.
     */
    public record GridCell(long col, long row) {
    }

    public record IndexStats(int entryCount, int cellCount) {
    }

    private record CellRange(long minCol, long minRow, long maxCol, long maxRow) {

        // double arithmetic so far-out coordinates cannot overflow
        double cellCount() {
            return ((double) maxCol - minCol + 1) * ((double) maxRow - minRow + 1);
        }

        boolean contains(GridCell cell) {
            return cell.col() >= minCol && cell.col() <= maxCol
                    && cell.row() >= minRow && cell.row() <= maxRow;
        }
    }
}
