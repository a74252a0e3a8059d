package com.inkboard.selectionservice.web.dto;

import com.inkboard.selectionservice.geometry.Box;
import com.inkboard.selectionservice.geometry.CanvasTransform;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * DTO for a render-tick query: which selections, conflicts and ownerships are visible.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class ViewportQueryRequest {

    /**
     * Visible screen rectangle.
     */
    @NotNull(message = "viewport is required")
    private Box viewport;

    /**
     * Optional pan/zoom; identity when absent.
     */
    private CanvasTransform transform;

    private String currentUserId;

    /**
     * LOW, BALANCED or HIGH; the configured default when absent.
     */
    private String performanceMode;

    @PositiveOrZero(message = "maxVisible must not be negative")
    private Integer maxVisible;
}
