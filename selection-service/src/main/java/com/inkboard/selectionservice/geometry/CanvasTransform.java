package com.inkboard.selectionservice.geometry;

/**
 * Pan/zoom state of a client canvas. A canvas point maps to the screen as
 * {@code screen = (canvas + offset) * zoom}.
 */
public record CanvasTransform(double x, double y, double zoom) {

    public static final CanvasTransform IDENTITY = new CanvasTransform(0, 0, 1);

    public CanvasTransform {
        if (!(zoom > 0) || !Double.isFinite(zoom)) {
            throw new IllegalArgumentException("zoom must be a positive finite number: " + zoom);
        }
    }

    public Box toScreen(Box canvasBox) {
        return new Box(
                (canvasBox.x() + x) * zoom,
                (canvasBox.y() + y) * zoom,
                canvasBox.width() * zoom,
                canvasBox.height() * zoom);
    }

    public Box toCanvas(Box screenBox) {
        return new Box(
                screenBox.x() / zoom - x,
                screenBox.y() / zoom - y,
                screenBox.width() / zoom,
                screenBox.height() / zoom);
    }
}
