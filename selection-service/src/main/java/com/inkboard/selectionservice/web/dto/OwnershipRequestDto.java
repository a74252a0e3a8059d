package com.inkboard.selectionservice.web.dto;

import com.inkboard.selectionservice.ownership.LockReason;
import com.inkboard.selectionservice.ownership.OwnershipRequest;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.PositiveOrZero;

public record OwnershipRequestDto(
        @NotBlank(message = "elementId is required")
        String elementId,
        @NotBlank(message = "userId is required")
        String userId,
        String userName,
        @PositiveOrZero(message = "ttlMs must not be negative")
        @Max(value = OwnershipRequestDto.MAX_TTL_MS, message = "ttlMs must not exceed 24 hours")
        Long ttlMs,
        String reason,
        Integer priority,
        Boolean locked
) {
    public static final long MAX_TTL_MS = 24 * 60 * 60 * 1000L;

    public OwnershipRequest toRequest() {
        return new OwnershipRequest(
                elementId,
                userId,
                userName,
                ttlMs != null ? ttlMs : 0L,
                LockReason.parse(reason),
                priority != null ? priority : 0,
                locked == null || locked);
    }
}
