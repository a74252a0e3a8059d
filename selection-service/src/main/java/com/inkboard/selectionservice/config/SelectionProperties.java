package com.inkboard.selectionservice.config;

import com.inkboard.selectionservice.conflict.AutoResolveStrategy;
import com.inkboard.selectionservice.viewport.PerformanceMode;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Tuning constants of the selection engine.
 */
@ConfigurationProperties(prefix = "selection")
public class SelectionProperties {

    /**
     * Edge length of a spatial index cell, in canvas units.
     */
    private double gridCellSize = 256;

    /**
     * Screen pixels added around the viewport so elements just off screen are already
     * rendered during fast pans.
     */
    private double viewportPadding = 50;

    private long defaultTtlMs = 30_000;

    /**
     * A selection whose lastSeen is older than this is dropped by the sweep.
     */
    private long livenessTimeoutMs = 30_000;

    private int maxVisible = 25;

    private PerformanceMode performanceMode = PerformanceMode.BALANCED;

    /**
     * Interval of the maintenance sweep that expires stale selections and ownerships.
     */
    private long sweepIntervalMs = 1_000;

    private long sessionIdleTimeoutMs = 60 * 60 * 1000; // 1 hour

    /**
     * Conflicts left unresolved for longer than this are reported with mode TIMEOUT.
     */
    private long conflictTimeoutMs = 5_000;

    /**
     * Applied by the sweep to conflicts past the timeout. DISABLED leaves them as TIMEOUT.
     */
    private AutoResolveStrategy conflictAutoResolve = AutoResolveStrategy.DISABLED;

    private int maxElementIds = 100;

    /**
     * Maximum age of cached bounds; 0 keeps them until invalidated.
     */
    private long boundsCacheMaxAgeMs = 0;

    public double getGridCellSize() {
        return gridCellSize;
    }

    public void setGridCellSize(double gridCellSize) {
        this.gridCellSize = gridCellSize;
    }

    public double getViewportPadding() {
        return viewportPadding;
    }

    public void setViewportPadding(double viewportPadding) {
        this.viewportPadding = viewportPadding;
    }

    public long getDefaultTtlMs() {
        return defaultTtlMs;
    }

    public void setDefaultTtlMs(long defaultTtlMs) {
        this.defaultTtlMs = defaultTtlMs;
    }

    public long getLivenessTimeoutMs() {
        return livenessTimeoutMs;
    }

    public void setLivenessTimeoutMs(long livenessTimeoutMs) {
        this.livenessTimeoutMs = livenessTimeoutMs;
    }

    public int getMaxVisible() {
        return maxVisible;
    }

    public void setMaxVisible(int maxVisible) {
        this.maxVisible = maxVisible;
    }

    public PerformanceMode getPerformanceMode() {
        return performanceMode;
    }

    public void setPerformanceMode(PerformanceMode performanceMode) {
        this.performanceMode = performanceMode;
    }

    public long getSweepIntervalMs() {
        return sweepIntervalMs;
    }

    public void setSweepIntervalMs(long sweepIntervalMs) {
        this.sweepIntervalMs = sweepIntervalMs;
    }

    public long getSessionIdleTimeoutMs() {
        return sessionIdleTimeoutMs;
    }

    public void setSessionIdleTimeoutMs(long sessionIdleTimeoutMs) {
        this.sessionIdleTimeoutMs = sessionIdleTimeoutMs;
    }

    public long getConflictTimeoutMs() {
        return conflictTimeoutMs;
    }

    public void setConflictTimeoutMs(long conflictTimeoutMs) {
        this.conflictTimeoutMs = conflictTimeoutMs;
    }

    public AutoResolveStrategy getConflictAutoResolve() {
        return conflictAutoResolve;
    }

    public void setConflictAutoResolve(AutoResolveStrategy conflictAutoResolve) {
        this.conflictAutoResolve = conflictAutoResolve;
    }

    public int getMaxElementIds() {
        return maxElementIds;
    }

    public void setMaxElementIds(int maxElementIds) {
        this.maxElementIds = maxElementIds;
    }

    public long getBoundsCacheMaxAgeMs() {
        return boundsCacheMaxAgeMs;
    }

    public void setBoundsCacheMaxAgeMs(long boundsCacheMaxAgeMs) {
        this.boundsCacheMaxAgeMs = boundsCacheMaxAgeMs;
    }
}
