package com.inkboard.selectionservice.ownership;

/**
 * Exclusive, time-limited claim on an element.
 * A locked record cannot be taken over by anyone else until it expires or is released;
 * an unlocked one is a soft hold that a higher-priority request may preempt.
 */
public record OwnershipRecord(
        String elementId,
        String ownerId,
        String ownerName,
        long acquiredAt,
        long expiresAt,
        boolean locked,
        LockReason lockReason,
        int priority
) {
    public OwnershipRecord {
        if (expiresAt <= acquiredAt) {
            throw new IllegalArgumentException("expiresAt must be after acquiredAt");
        }
    }

    public boolean isExpired(long now) {
        return expiresAt <= now;
    }

    public long remainingMs(long now) {
        return Math.max(0, expiresAt - now);
    }

    public boolean isOwnedBy(String userId) {
        return ownerId.equals(userId);
    }

    OwnershipRecord renewedUntil(long newExpiresAt) {
        return new OwnershipRecord(elementId, ownerId, ownerName, acquiredAt, newExpiresAt, locked, lockReason, priority);
    }
}
