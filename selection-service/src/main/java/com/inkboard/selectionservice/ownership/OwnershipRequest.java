package com.inkboard.selectionservice.ownership;

/**
 * Request to take ownership of an element.
 *
 * @param ttlMs    non-positive values fall back to the manager's default TTL
 * @param priority compared against an existing soft hold's priority
 * @param locked   hard lock when true, soft hold otherwise
 */
public record OwnershipRequest(
        String elementId,
        String userId,
        String userName,
        long ttlMs,
        LockReason reason,
        int priority,
        boolean locked
) {
    public static OwnershipRequest locked(String elementId, String userId, long ttlMs, LockReason reason) {
        return new OwnershipRequest(elementId, userId, userId, ttlMs, reason, 0, true);
    }
}
