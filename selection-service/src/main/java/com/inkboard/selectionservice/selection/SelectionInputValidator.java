package com.inkboard.selectionservice.selection;

import com.inkboard.selectionservice.geometry.Box;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Normalizes inbound selection updates into {@link SelectionRecord}s.
 * Bad parts of an update are dropped or replaced; the update as a whole is never rejected.
 */
public class SelectionInputValidator {
    private static final Logger log = LoggerFactory.getLogger(SelectionInputValidator.class);

    static final Pattern ELEMENT_ID = Pattern.compile("^[a-zA-Z0-9_-]{1,50}$");
    static final double MAX_COORDINATE = 1_000_000;
    static final int MAX_NAME_LENGTH = 100;
    static final String DEFAULT_COLOR = "#000000";

    private static final List<Pattern> COLOR_PATTERNS = List.of(
            Pattern.compile("^#[0-9a-fA-F]{3}$"),
            Pattern.compile("^#[0-9a-fA-F]{6}$"),
            Pattern.compile("^rgb\\(\\s*\\d+\\s*,\\s*\\d+\\s*,\\s*\\d+\\s*\\)$"),
            Pattern.compile("^rgba\\(\\s*\\d+\\s*,\\s*\\d+\\s*,\\s*\\d+\\s*,\\s*[\\d.]+\\s*\\)$"),
            Pattern.compile("^hsl\\(\\s*\\d+\\s*,\\s*\\d+%\\s*,\\s*\\d+%\\s*\\)$"),
            Pattern.compile("^hsla\\(\\s*\\d+\\s*,\\s*\\d+%\\s*,\\s*\\d+%\\s*,\\s*[\\d.]+\\s*\\)$"));

    private final int maxElementIds;

    public SelectionInputValidator(int maxElementIds) {
        if (maxElementIds <= 0) {
            throw new IllegalArgumentException("maxElementIds must be positive");
        }
        this.maxElementIds = maxElementIds;
    }

    /**
     * @param now used when the update carries no timestamp or liveness time
     */
    public SelectionRecord sanitize(SelectionUpdate update, long now) {
        List<String> elementIds = sanitizeElementIds(update.userId(), update.elementIds());
        long timestamp = update.timestamp() > 0 ? update.timestamp() : now;
        long lastSeen = update.lastSeen() > 0 ? update.lastSeen() : now;
        return new SelectionRecord(
                update.userId(),
                sanitizeName(update.userName(), update.userId()),
                sanitizeColor(update.userColor()),
                update.whiteboardId(),
                update.sessionId(),
                elementIds,
                sanitizeBounds(update.selectionBounds()),
                timestamp,
                update.priority(),
                update.multiSelect(),
                update.active(),
                lastSeen);
    }

    public List<String> sanitizeElementIds(String userId, List<String> elementIds) {
        if (elementIds == null || elementIds.isEmpty()) {
            return List.of();
        }
        Set<String> accepted = new LinkedHashSet<>();
        int rejected = 0;
        for (String id : elementIds) {
            if (id != null && ELEMENT_ID.matcher(id).matches()) {
                accepted.add(id);
            } else {
                rejected++;
            }
        }
        if (rejected > 0) {
            log.warn("Dropped {} invalid element ids from selection of {}", rejected, userId);
        }
        List<String> result = new ArrayList<>(accepted);
        if (result.size() > maxElementIds) {
            log.warn("Selection of {} truncated from {} to {} elements", userId, result.size(), maxElementIds);
            result = result.subList(0, maxElementIds);
        }
        return List.copyOf(result);
    }

    public boolean isValidElementId(String elementId) {
        return elementId != null && ELEMENT_ID.matcher(elementId).matches();
    }

    String sanitizeColor(String color) {
        if (color != null) {
            String trimmed = color.trim();
            for (Pattern pattern : COLOR_PATTERNS) {
                if (pattern.matcher(trimmed).matches()) {
                    return trimmed;
                }
            }
        }
        return DEFAULT_COLOR;
    }

    String sanitizeName(String name, String fallback) {
        if (name == null || name.isBlank()) {
            return fallback;
        }
        String trimmed = name.trim();
        return trimmed.length() > MAX_NAME_LENGTH ? trimmed.substring(0, MAX_NAME_LENGTH) : trimmed;
    }

    Box sanitizeBounds(Box bounds) {
        if (bounds == null || !bounds.isValid()) {
            return null;
        }
        if (Math.abs(bounds.x()) > MAX_COORDINATE || Math.abs(bounds.y()) > MAX_COORDINATE
                || bounds.width() > MAX_COORDINATE || bounds.height() > MAX_COORDINATE) {
            return null;
        }
        return bounds;
    }
}
