package com.inkboard.selectionservice.viewport;

/**
 * Advisory styling for a selection highlight. The renderer decides how to draw them.
 */
public record HighlightHints(double opacity, Style style, Animation animation) {

    public enum Style { SOLID, DASHED, DOTTED }

    public enum Animation { NONE, PULSE, GLOW }

    static HighlightHints forSelection(boolean currentUser, boolean conflicted, PerformanceMode mode) {
        if (conflicted) {
            return new HighlightHints(0.5, Style.DASHED,
                    mode.animateConflicts() ? Animation.PULSE : Animation.NONE);
        }
        return new HighlightHints(currentUser ? 0.4 : 0.3, Style.SOLID, Animation.NONE);
    }
}
