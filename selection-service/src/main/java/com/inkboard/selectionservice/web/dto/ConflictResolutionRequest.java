package com.inkboard.selectionservice.web.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;

public record ConflictResolutionRequest(
        @NotBlank(message = "resolution is required")
        @Pattern(regexp = "(?i)ownership|shared|cancel", message = "resolution must be ownership, shared or cancel")
        String resolution
) {}
