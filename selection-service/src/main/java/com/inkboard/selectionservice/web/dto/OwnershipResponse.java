package com.inkboard.selectionservice.web.dto;

import com.inkboard.selectionservice.ownership.AcquireResult;
import com.inkboard.selectionservice.ownership.OwnershipRecord;

/**
 * Outcome of an ownership request. When rejected, {@code record} is the current holder's.
 */
public record OwnershipResponse(boolean granted, String reason, OwnershipRecord record) {
    public static OwnershipResponse fromResult(AcquireResult result) {
        return new OwnershipResponse(result.granted(), result.reason(), result.record());
    }
}
