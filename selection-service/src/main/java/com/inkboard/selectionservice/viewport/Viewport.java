package com.inkboard.selectionservice.viewport;

import com.inkboard.selectionservice.geometry.Box;
import com.inkboard.selectionservice.geometry.CanvasTransform;

import java.util.Objects;

/**
 * Visible screen rectangle of a client together with its canvas transform.
 */
public record Viewport(Box screenBounds, CanvasTransform transform) {

    public Viewport {
        Objects.requireNonNull(screenBounds, "screenBounds");
        transform = transform == null ? CanvasTransform.IDENTITY : transform;
    }

    public static Viewport of(double x, double y, double width, double height) {
        return new Viewport(new Box(x, y, width, height), CanvasTransform.IDENTITY);
    }

    /**
     * The region to query in canvas coordinates, after growing the screen rectangle by
     * {@code padding} screen pixels on every side.
     */
    public Box canvasRegion(double padding) {
        return transform.toCanvas(screenBounds.expand(padding));
    }
}
