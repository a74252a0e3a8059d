package com.inkboard.selectionservice.session;

import com.inkboard.selectionservice.config.SelectionProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;
import java.util.concurrent.*;
import java.util.function.BiConsumer;
import java.util.function.LongSupplier;

/**
 * Owns one {@link SelectionSession} per whiteboard and the single maintenance
 * thread that sweeps all of them. Expiry of selections and ownerships is driven
 * from here on a fixed interval, independent of event volume, so idle whiteboards
 * still reclaim expired state.
 */
public class SelectionSessionManager {
    private static final Logger log = LoggerFactory.getLogger(SelectionSessionManager.class);

    // Map of whiteboard ID to SelectionSession
    private final ConcurrentHashMap<String, SelectionSession> activeSessions = new ConcurrentHashMap<>();
    private final List<BiConsumer<String, SelectionSession.SweepResult>> sweepListeners = new CopyOnWriteArrayList<>();
    private final SelectionProperties properties;
    private final LongSupplier clock;
    private ScheduledExecutorService maintenanceExecutor;

    /**
     * Creates a manager on the system clock and starts the maintenance sweep.
     */
    public SelectionSessionManager(SelectionProperties properties) {
        this(properties, System::currentTimeMillis);
        start();
    }

    /**
     * Creates a manager without a running sweep; callers drive {@link #sweepAll()} themselves.
     */
    public SelectionSessionManager(SelectionProperties properties, LongSupplier clock) {
        this.properties = Objects.requireNonNull(properties, "properties");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    public synchronized void start() {
        if (maintenanceExecutor != null) {
            return;
        }
        maintenanceExecutor = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "selection-maintenance");
            t.setDaemon(true);
            return t;
        });
        maintenanceExecutor.scheduleAtFixedRate(
                this::sweepAll,
                properties.getSweepIntervalMs(),
                properties.getSweepIntervalMs(),
                TimeUnit.MILLISECONDS);
        log.info("Selection maintenance sweep every {}ms", properties.getSweepIntervalMs());
    }

    /**
     * Returns the whiteboard's session, creating it on first use. The lookup counts as
     * activity and runs under the same map entry lock as the idle reclaim in
     * {@link #sweepAll()}, so a session returned here is never one the sweep is closing.
     */
    public SelectionSession getOrCreate(String whiteboardId) {
        Objects.requireNonNull(whiteboardId, "whiteboardId");
        return activeSessions.compute(whiteboardId, (id, existing) -> {
            if (existing != null) {
                existing.markActive();
                return existing;
            }
            log.info("Selection session created for whiteboard {}", id);
            return new SelectionSession(id, properties, clock);
        });
    }

    public Optional<SelectionSession> find(String whiteboardId) {
        return Optional.ofNullable(whiteboardId == null ? null : activeSessions.get(whiteboardId));
    }

    public boolean closeSession(String whiteboardId) {
        SelectionSession session = activeSessions.remove(whiteboardId);
        if (session != null) {
            session.close();
            log.info("Selection session for whiteboard {} closed", whiteboardId);
            return true;
        }
        return false;
    }

    public int sessionCount() {
        return activeSessions.size();
    }

    public Set<String> whiteboardIds() {
        return Set.copyOf(activeSessions.keySet());
    }

    /**
     * Registers a callback invoked for every session whose sweep removed something.
     */
    public void addSweepListener(BiConsumer<String, SelectionSession.SweepResult> listener) {
        sweepListeners.add(listener);
    }

    /**
     * Expires stale state in every session and closes sessions that are idle and hold
     * neither selections nor ownerships.
     */
    public void sweepAll() {
        long now = clock.getAsLong();
        long idleTimeout = properties.getSessionIdleTimeoutMs();
        for (SelectionSession session : activeSessions.values()) {
            try {
                SelectionSession.SweepResult result = session.sweep(now);
                if (!result.isEmpty()) {
                    notifyListeners(session.whiteboardId(), result);
                }
                if (reclaimIfIdle(session, now, idleTimeout)) {
                    session.close();
                    log.info("Selection session for whiteboard {} expired due to inactivity", session.whiteboardId());
                }
            } catch (RuntimeException e) {
                // a failing session must not stop the sweep of the others
                log.error("Maintenance sweep failed for whiteboard {}", session.whiteboardId(), e);
            }
        }
    }

    /**
     * Shuts down the maintenance thread and drops all sessions.
     */
    public synchronized void shutdown() {
        if (maintenanceExecutor != null) {
            maintenanceExecutor.shutdownNow();
            maintenanceExecutor = null;
        }
        activeSessions.values().forEach(SelectionSession::close);
        activeSessions.clear();
        log.info("Selection session manager shut down");
    }

    private boolean reclaimIfIdle(SelectionSession session, long now, long idleTimeout) {
        boolean[] removed = {false};
        activeSessions.computeIfPresent(session.whiteboardId(), (id, current) -> {
            if (current == session && current.isReclaimable(now, idleTimeout)) {
                removed[0] = true;
                return null;
            }
            return current;
        });
        return removed[0];
    }

    private void notifyListeners(String whiteboardId, SelectionSession.SweepResult result) {
        for (BiConsumer<String, SelectionSession.SweepResult> listener : sweepListeners) {
            try {
                listener.accept(whiteboardId, result);
            } catch (RuntimeException e) {
                log.error("Sweep listener failed for whiteboard {}", whiteboardId, e);
            }
        }
    }
}
