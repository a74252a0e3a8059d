package com.inkboard.selectionservice.geometry;

/**
 * Caller-supplied lookup of element geometry. The engine never owns element
 * geometry itself; it asks through this callback.
 */
@FunctionalInterface
public interface BoundsResolver {

    /**
     * @return the element's bounding box, or {@code null} if the element is unknown or was deleted
     */
    Box resolve(String elementId);
}
