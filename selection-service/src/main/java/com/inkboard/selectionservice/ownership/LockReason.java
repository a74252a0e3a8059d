package com.inkboard.selectionservice.ownership;

import java.util.Locale;

public enum LockReason {
    EDITING,
    MOVING,
    STYLING,
    MANUAL;

    /**
     * Lenient parse; unknown or missing values map to {@link #MANUAL}.
     */
    public static LockReason parse(String value) {
        if (value == null || value.isBlank()) {
            return MANUAL;
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            return MANUAL;
        }
    }
}
