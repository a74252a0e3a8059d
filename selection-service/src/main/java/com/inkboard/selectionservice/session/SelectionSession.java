package com.inkboard.selectionservice.session;

import com.inkboard.selectionservice.config.SelectionProperties;
import com.inkboard.selectionservice.conflict.AutoResolveStrategy;
import com.inkboard.selectionservice.conflict.ConflictRecord;
import com.inkboard.selectionservice.conflict.ConflictResolution;
import com.inkboard.selectionservice.conflict.ConflictResolver;
import com.inkboard.selectionservice.conflict.Contender;
import com.inkboard.selectionservice.conflict.ResolutionMode;
import com.inkboard.selectionservice.geometry.BoundsCache;
import com.inkboard.selectionservice.geometry.Box;
import com.inkboard.selectionservice.geometry.ElementBoundsRegistry;
import com.inkboard.selectionservice.ownership.AcquireResult;
import com.inkboard.selectionservice.ownership.LockReason;
import com.inkboard.selectionservice.ownership.OwnershipManager;
import com.inkboard.selectionservice.ownership.OwnershipRecord;
import com.inkboard.selectionservice.ownership.OwnershipRequest;
import com.inkboard.selectionservice.selection.SelectionInputValidator;
import com.inkboard.selectionservice.selection.SelectionRecord;
import com.inkboard.selectionservice.selection.SelectionStore;
import com.inkboard.selectionservice.selection.SelectionUpdate;
import com.inkboard.selectionservice.viewport.PerformanceMode;
import com.inkboard.selectionservice.viewport.Viewport;
import com.inkboard.selectionservice.viewport.ViewportCuller;
import com.inkboard.selectionservice.viewport.VisibleState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;
import java.util.function.LongSupplier;

/**
 * Selection state of one whiteboard. Every mutation goes through this object's
 * monitor, so events from many users are applied one at a time and the store,
 * conflict list, ownerships, cache and indexes always agree with each other.
 */
public class SelectionSession {
    private static final Logger log = LoggerFactory.getLogger(SelectionSession.class);

    private final String whiteboardId;
    private final long createdAt;
    private final LongSupplier clock;
    private final long livenessTimeoutMs;
    private final long conflictTimeoutMs;
    private final AutoResolveStrategy autoResolve;
    private final int maxVisible;
    private final PerformanceMode defaultMode;

    private final ElementBoundsRegistry elementBounds = new ElementBoundsRegistry();
    private final BoundsCache boundsCache;
    private final ViewportCuller culler;
    private final SelectionStore store = new SelectionStore();
    private final SelectionInputValidator validator;
    private final ConflictResolver conflictResolver = new ConflictResolver();
    private final OwnershipManager ownershipManager;

    private final Set<String> sharedElements = new HashSet<>();
    private List<ConflictRecord> conflicts = List.of();
    private volatile long lastActivityTime;
    private long manualResolutions;
    private long autoResolutions;

    public SelectionSession(String whiteboardId, SelectionProperties properties, LongSupplier clock) {
        this.whiteboardId = Objects.requireNonNull(whiteboardId, "whiteboardId");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.livenessTimeoutMs = properties.getLivenessTimeoutMs();
        this.conflictTimeoutMs = properties.getConflictTimeoutMs();
        this.autoResolve = properties.getConflictAutoResolve() != null
                ? properties.getConflictAutoResolve() : AutoResolveStrategy.DISABLED;
        this.maxVisible = properties.getMaxVisible();
        this.defaultMode = properties.getPerformanceMode();
        this.boundsCache = new BoundsCache(properties.getBoundsCacheMaxAgeMs(), clock);
        this.culler = new ViewportCuller(boundsCache, elementBounds,
                properties.getGridCellSize(), properties.getViewportPadding());
        this.validator = new SelectionInputValidator(properties.getMaxElementIds());
        this.ownershipManager = new OwnershipManager(properties.getDefaultTtlMs(), clock);
        this.createdAt = clock.getAsLong();
        this.lastActivityTime = createdAt;
    }

    /**
     * Applies a selection update. An empty or inactive selection clears the user's selection.
     *
     * @return the stored record, or empty if the user now has no selection
     */
    public synchronized Optional<SelectionRecord> applySelection(SelectionUpdate update) {
        if (update.userId() == null || update.userId().isBlank()) {
            log.warn("Selection update without user id ignored on whiteboard {}", whiteboardId);
            return Optional.empty();
        }
        if (!whiteboardId.equals(update.whiteboardId())) {
            log.warn("Selection update from {} for whiteboard {} ignored by session {}",
                    update.userId(), update.whiteboardId(), whiteboardId);
            return Optional.empty();
        }
        long now = updateLastActivity();
        SelectionRecord record = validator.sanitize(update, now);
        if (record.isEmpty() || !record.active()) {
            clearSelectionInternal(record.userId());
            return Optional.empty();
        }

        store.admit(record);
        culler.trackSelection(record);
        recomputeConflicts();
        log.debug("Selection of {} on {} now {} elements", record.userId(), whiteboardId, record.elementIds().size());
        return Optional.of(record);
    }

    /**
     * @return true if the user had a selection
     */
    public synchronized boolean clearSelection(String userId) {
        updateLastActivity();
        return clearSelectionInternal(userId);
    }

    /**
     * Refreshes a user's liveness without changing the selection.
     */
    public synchronized boolean heartbeat(String userId) {
        return store.touch(userId, updateLastActivity());
    }

    /**
     * Drops everything a departing user holds: their selection and their ownerships.
     */
    public synchronized void disconnect(String userId) {
        updateLastActivity();
        boolean hadSelection = clearSelectionInternal(userId);
        List<OwnershipRecord> released = ownershipManager.releaseAll(userId);
        if (!released.isEmpty()) {
            recomputeConflicts();
        }
        log.info("User {} left whiteboard {} (selection cleared: {}, ownerships released: {})",
                userId, whiteboardId, hadSelection, released.size());
    }

    /**
     * Records new element geometry and refreshes every cached or indexed box depending on it.
     *
     * @return number of elements whose bounds changed
     */
    public synchronized int updateElementBounds(Map<String, Box> bounds) {
        updateLastActivity();
        Set<String> changed = new HashSet<>();
        for (Map.Entry<String, Box> entry : bounds.entrySet()) {
            String elementId = entry.getKey();
            if (!validator.isValidElementId(elementId)) {
                log.warn("Ignoring bounds for invalid element id on whiteboard {}", whiteboardId);
                continue;
            }
            if (elementBounds.update(elementId, entry.getValue())) {
                boundsCache.invalidate(elementId);
                culler.trackElement(elementId);
                changed.add(elementId);
            }
        }
        retrackSelectionsTouching(changed);
        return changed.size();
    }

    /**
     * Forgets a deleted element's geometry. Selections still naming it simply stop
     * counting it towards their bounds.
     */
    public synchronized boolean removeElement(String elementId) {
        updateLastActivity();
        boolean removed = elementBounds.remove(elementId);
        boundsCache.invalidate(elementId);
        culler.untrackElement(elementId);
        retrackSelectionsTouching(Set.of(elementId));
        return removed;
    }

    public synchronized AcquireResult requestOwnership(OwnershipRequest request) {
        updateLastActivity();
        AcquireResult result = ownershipManager.acquire(request);
        if (result.granted()) {
            recomputeConflicts();
        }
        return result;
    }

    public synchronized boolean renewOwnership(String elementId, String userId, long ttlMs) {
        updateLastActivity();
        return ownershipManager.renew(elementId, userId, ttlMs);
    }

    public synchronized boolean releaseOwnership(String elementId, String userId) {
        updateLastActivity();
        boolean released = ownershipManager.release(elementId, userId);
        if (released) {
            recomputeConflicts();
        }
        return released;
    }

    /**
     * Applies a user's decision on a conflict.
     * <ul>
     *     <li>OWNERSHIP: the top-ranked contender gets a locked ownership and the element is
     *     removed from everyone else's selection.</li>
     *     <li>SHARED: the element stays multiply selected; no ownership is created.</li>
     *     <li>CANCEL: nothing changes.</li>
     * </ul>
     *
     * @return false if the conflict does not exist or ownership could not be granted
     */
    public synchronized boolean resolveConflict(String conflictId, ConflictResolution resolution) {
        updateLastActivity();
        if (resolution == null) {
            return false;
        }
        String elementId = ConflictRecord.elementIdOf(conflictId);
        Optional<ConflictRecord> conflict = conflicts.stream()
                .filter(c -> c.elementId().equals(elementId))
                .findFirst();
        if (conflict.isEmpty()) {
            log.warn("Resolution {} for unknown conflict {} on whiteboard {}", resolution, conflictId, whiteboardId);
            return false;
        }

        if (!applyResolution(conflict.get(), resolution, conflict.get().leader())) {
            return false;
        }
        if (resolution != ConflictResolution.CANCEL) {
            manualResolutions++;
        }
        recomputeConflicts();
        return true;
    }

    /**
     * Resolution counts since the session started, plus the conflicts open right now.
     */
    public synchronized ConflictStats conflictStats() {
        return new ConflictStats(manualResolutions + autoResolutions, manualResolutions,
                autoResolutions, conflicts.size());
    }

    /**
     * Active selections, highest priority first; the current user's always leads.
     */
    public synchronized List<SelectionRecord> selections(String currentUserId) {
        return store.activeFor(whiteboardId, currentUserId);
    }

    /**
     * Current conflicts. Those left unresolved past the conflict timeout report TIMEOUT.
     */
    public synchronized List<ConflictRecord> conflicts() {
        long now = clock.getAsLong();
        List<ConflictRecord> result = new ArrayList<>(conflicts.size());
        for (ConflictRecord conflict : conflicts) {
            if (isTimedOut(conflict, now)) {
                result.add(conflict.withMode(ResolutionMode.TIMEOUT));
            } else {
                result.add(conflict);
            }
        }
        return result;
    }

    public synchronized List<OwnershipRecord> ownerships() {
        return ownershipManager.active();
    }

    public synchronized Optional<OwnershipRecord> ownership(String elementId) {
        return ownershipManager.get(elementId);
    }

    public synchronized VisibleState visibleState(Viewport viewport, String currentUserId,
                                                  PerformanceMode mode, Integer maxVisibleOverride) {
        return culler.render(
                selections(currentUserId),
                conflicts(),
                ownerships(),
                viewport,
                currentUserId,
                mode != null ? mode : defaultMode,
                maxVisibleOverride != null ? maxVisibleOverride : maxVisible);
    }

    /**
     * Expires stale selections and ownerships, then applies the auto-resolve strategy to
     * conflicts left unresolved past the timeout. Called by the maintenance scheduler.
     */
    public synchronized SweepResult sweep(long now) {
        List<SelectionRecord> staleSelections = store.expireStale(now, livenessTimeoutMs);
        for (SelectionRecord stale : staleSelections) {
            culler.untrackSelection(stale.userId());
        }
        List<OwnershipRecord> expiredOwnerships = ownershipManager.expireAll(now);
        if (!staleSelections.isEmpty() || !expiredOwnerships.isEmpty()) {
            recomputeConflicts();
        }
        List<String> autoResolved = autoResolveTimedOut(now);
        if (!autoResolved.isEmpty()) {
            recomputeConflicts();
        }
        return new SweepResult(
                staleSelections.stream().map(SelectionRecord::userId).toList(),
                expiredOwnerships,
                autoResolved);
    }

    public boolean isIdle(long now, long idleTimeoutMs) {
        return now - lastActivityTime > idleTimeoutMs;
    }

    /**
     * True when the session is idle and holds nothing a user still depends on:
     * no selections and no unexpired ownerships.
     */
    public synchronized boolean isReclaimable(long now, long idleTimeoutMs) {
        return isIdle(now, idleTimeoutMs) && store.size() == 0 && ownershipManager.active().isEmpty();
    }

    /**
     * Counts as activity, so a session just handed out is not reclaimed by the next sweep.
     */
    public void markActive() {
        updateLastActivity();
    }

    public synchronized void close() {
        ownershipManager.clear();
        store.clear();
        culler.clear();
        boundsCache.invalidateAll();
        sharedElements.clear();
        conflicts = List.of();
    }

    public String whiteboardId() {
        return whiteboardId;
    }

    public long createdAt() {
        return createdAt;
    }

    public long lastActivityTime() {
        return lastActivityTime;
    }

    public synchronized int selectionCount() {
        return store.size();
    }

    private boolean applyResolution(ConflictRecord conflict, ConflictResolution resolution, Contender winner) {
        String elementId = conflict.elementId();
        switch (resolution) {
            case OWNERSHIP -> {
                AcquireResult result = ownershipManager.acquire(new OwnershipRequest(
                        elementId, winner.userId(), winner.displayName(), ownershipManager.defaultTtlMs(),
                        LockReason.MANUAL, winner.priority(), true));
                if (!result.granted()) {
                    log.warn("Conflict {} could not be resolved in favor of {}: {}",
                            conflict.conflictId(), winner.userId(), result.reason());
                    return false;
                }
                for (Contender loser : conflict.contenders()) {
                    if (!loser.userId().equals(winner.userId())) {
                        dropElementFromSelection(loser.userId(), elementId);
                    }
                }
                sharedElements.remove(elementId);
                log.info("Conflict {} resolved: {} owns {}", conflict.conflictId(), winner.userId(), elementId);
            }
            case SHARED -> {
                sharedElements.add(elementId);
                log.info("Conflict {} resolved as shared", conflict.conflictId());
            }
            case CANCEL -> log.debug("Resolution of conflict {} cancelled", conflict.conflictId());
        }
        return true;
    }

    private List<String> autoResolveTimedOut(long now) {
        Optional<ConflictResolution> resolution = autoResolve.resolution();
        if (resolution.isEmpty()) {
            return List.of();
        }
        List<String> resolved = new ArrayList<>();
        for (ConflictRecord conflict : conflicts) {
            if (!isTimedOut(conflict, now)) {
                continue;
            }
            if (applyResolution(conflict, resolution.get(), autoResolve.winner(conflict))) {
                autoResolutions++;
                resolved.add(conflict.conflictId());
            }
        }
        if (!resolved.isEmpty()) {
            log.info("Auto-resolved {} conflict(s) on whiteboard {} with strategy {}",
                    resolved.size(), whiteboardId, autoResolve);
        }
        return resolved;
    }

    private boolean isTimedOut(ConflictRecord conflict, long now) {
        return conflict.resolutionMode() == ResolutionMode.MANUAL
                && conflictTimeoutMs > 0
                && now - conflict.latestTimestamp() > conflictTimeoutMs;
    }

    private boolean clearSelectionInternal(String userId) {
        SelectionRecord removed = store.remove(userId);
        if (removed == null) {
            return false;
        }
        culler.untrackSelection(userId);
        recomputeConflicts();
        return true;
    }

    private void dropElementFromSelection(String userId, String elementId) {
        store.get(userId).ifPresent(selection -> {
            SelectionRecord remaining = selection.withoutElement(elementId);
            store.admit(remaining);
            if (remaining.isEmpty()) {
                culler.untrackSelection(userId);
            } else {
                culler.trackSelection(remaining);
            }
        });
    }

    private void retrackSelectionsTouching(Set<String> elementIds) {
        if (elementIds.isEmpty()) {
            return;
        }
        for (SelectionRecord selection : store.all()) {
            if (selection.explicitBounds() == null
                    && selection.elementIds().stream().anyMatch(elementIds::contains)) {
                culler.trackSelection(selection);
            }
        }
    }

    private void recomputeConflicts() {
        conflicts = conflictResolver.recompute(store.activeFor(whiteboardId), this::modeFor);
        Set<String> contested = new HashSet<>();
        for (ConflictRecord conflict : conflicts) {
            contested.add(conflict.elementId());
        }
        sharedElements.retainAll(contested);
    }

    private ResolutionMode modeFor(String elementId) {
        if (ownershipManager.get(elementId).isPresent()) {
            return ResolutionMode.OWNERSHIP;
        }
        if (sharedElements.contains(elementId)) {
            return ResolutionMode.SHARED;
        }
        return ResolutionMode.MANUAL;
    }

    private long updateLastActivity() {
        long now = clock.getAsLong();
        lastActivityTime = now;
        return now;
    }

    /**
     * What a maintenance sweep removed.
     */
    public record SweepResult(List<String> expiredSelections,
                              List<OwnershipRecord> expiredOwnerships,
                              List<String> autoResolvedConflicts) {

        public boolean isEmpty() {
            return expiredSelections.isEmpty() && expiredOwnerships.isEmpty() && autoResolvedConflicts.isEmpty();
        }
    }

    public record ConflictStats(long totalResolved, long manualResolved, long autoResolved, int currentConflicts) {
    }
}
