package com.inkboard.selectionservice.ownership;

/**
 * Outcome of an ownership request. Contention is an expected result, not an error.
 */
public record AcquireResult(boolean granted, OwnershipRecord record, String reason) {

    public static AcquireResult granted(OwnershipRecord record) {
        return new AcquireResult(true, record, null);
    }

    public static AcquireResult rejected(OwnershipRecord holder, String reason) {
        return new AcquireResult(false, holder, reason);
    }
}
