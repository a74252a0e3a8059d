package com.inkboard.selectionservice.geometry;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Element geometry as last reported by clients of one whiteboard.
 * Serves as the session's {@link BoundsResolver}.
 */
public class ElementBoundsRegistry implements BoundsResolver {
    private final ConcurrentHashMap<String, Box> bounds = new ConcurrentHashMap<>();

    @Override
    public Box resolve(String elementId) {
        return elementId == null ? null : bounds.get(elementId);
    }

    /**
     * @return true if the stored box changed
     */
    public boolean update(String elementId, Box box) {
        if (elementId == null || box == null || !box.isValid()) {
            return false;
        }
        Box previous = bounds.put(elementId, box);
        return !box.equals(previous);
    }

    public boolean remove(String elementId) {
        return elementId != null && bounds.remove(elementId) != null;
    }

    public int size() {
        return bounds.size();
    }

    public Map<String, Box> snapshot() {
        return Map.copyOf(bounds);
    }
}
