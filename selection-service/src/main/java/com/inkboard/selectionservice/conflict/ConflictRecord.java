package com.inkboard.selectionservice.conflict;

import java.util.List;

/**
 * Two or more users selecting the same element. Contenders are ranked: the first
 * one is the suggested winner when someone takes control.
 */
public record ConflictRecord(
        String conflictId,
        String elementId,
        List<Contender> contenders,
        ResolutionMode resolutionMode
) {
    private static final String ID_PREFIX = "conflict:";

    public ConflictRecord {
        contenders = List.copyOf(contenders);
    }

    public static String idFor(String elementId) {
        return ID_PREFIX + elementId;
    }

    /**
     * @return the element id addressed by a conflict id, or {@code null} if it is not one
     */
    public static String elementIdOf(String conflictId) {
        if (conflictId == null || !conflictId.startsWith(ID_PREFIX) || conflictId.length() == ID_PREFIX.length()) {
            return null;
        }
        return conflictId.substring(ID_PREFIX.length());
    }

    public Contender leader() {
        return contenders.get(0);
    }

    /**
     * Most recent claim among the contenders, i.e. when the conflict began in its current form.
     */
    public long latestTimestamp() {
        long latest = Long.MIN_VALUE;
        for (Contender contender : contenders) {
            latest = Math.max(latest, contender.timestamp());
        }
        return latest;
    }

    public ConflictRecord withMode(ResolutionMode mode) {
        return new ConflictRecord(conflictId, elementId, contenders, mode);
    }
}
