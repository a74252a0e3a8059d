package com.inkboard.selectionservice.geometry;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.util.Collection;

/**
 * Axis-aligned rectangle in canvas coordinates.
 * Edges are inclusive: two boxes that only touch are considered intersecting.
 */
public record Box(double x, double y, double width, double height) {

    public static final Box EMPTY = new Box(0, 0, 0, 0);

    public double maxX() {
        return x + width;
    }

    public double maxY() {
        return y + height;
    }

    /**
     * A box is usable for indexing when every component is finite and the size is not negative.
     */
    @JsonIgnore
    public boolean isValid() {
        return Double.isFinite(x) && Double.isFinite(y)
                && Double.isFinite(width) && Double.isFinite(height)
                && width >= 0 && height >= 0;
    }

    public boolean intersects(Box other) {
        return !(maxX() < other.x
                || x > other.maxX()
                || maxY() < other.y
                || y > other.maxY());
    }

    public Box union(Box other) {
        double minX = Math.min(x, other.x);
        double minY = Math.min(y, other.y);
        double maxX = Math.max(maxX(), other.maxX());
        double maxY = Math.max(maxY(), other.maxY());
        return new Box(minX, minY, maxX - minX, maxY - minY);
    }

    /**
     * Grows the box by {@code margin} on every side.
     */
    public Box expand(double margin) {
        return new Box(x - margin, y - margin, width + margin * 2, height + margin * 2);
    }

    /**
     * Union of all boxes, or {@code null} when the collection is empty.
     */
    public static Box unionOf(Collection<Box> boxes) {
        Box result = null;
        for (Box box : boxes) {
            result = result == null ? box : result.union(box);
        }
        return result;
    }
}
