package com.inkboard.selectionservice.web.dto;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.PositiveOrZero;

/**
 * Renew or release request; only the current owner succeeds.
 */
public record OwnershipActionRequest(
        @NotBlank(message = "userId is required")
        String userId,
        @PositiveOrZero(message = "ttlMs must not be negative")
        @Max(value = OwnershipRequestDto.MAX_TTL_MS, message = "ttlMs must not exceed 24 hours")
        Long ttlMs
) {
    public long ttlOrDefault() {
        return ttlMs != null ? ttlMs : 0L;
    }
}
