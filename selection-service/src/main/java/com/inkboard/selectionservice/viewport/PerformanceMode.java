package com.inkboard.selectionservice.viewport;

import java.util.Locale;

/**
 * Rendering presets. Lower modes show fewer highlights and drop animation.
 */
public enum PerformanceMode {
    LOW(10, false),
    BALANCED(15, false),
    HIGH(Integer.MAX_VALUE, true);

    private final int selectionCap;
    private final boolean animateConflicts;

    PerformanceMode(int selectionCap, boolean animateConflicts) {
        this.selectionCap = selectionCap;
        this.animateConflicts = animateConflicts;
    }

    public int maxVisible(int configuredMax) {
        return Math.min(selectionCap, Math.max(0, configuredMax));
    }

    public boolean animateConflicts() {
        return animateConflicts;
    }

    public static PerformanceMode parse(String value, PerformanceMode fallback) {
        if (value == null || value.isBlank()) {
            return fallback;
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            return fallback;
        }
    }
}
