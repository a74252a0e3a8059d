package com.inkboard.selectionservice.conflict;

import java.util.Locale;
import java.util.Optional;

/**
 * Resolution actions a user can apply to a conflict.
 */
public enum ConflictResolution {
    OWNERSHIP,
    SHARED,
    CANCEL;

    public static Optional<ConflictResolution> parse(String value) {
        if (value == null) {
            return Optional.empty();
        }
        try {
            return Optional.of(valueOf(value.trim().toUpperCase(Locale.ROOT)));
        } catch (IllegalArgumentException e) {
            return Optional.empty();
        }
    }
}
