package com.inkboard.selectionservice.selection;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Current selection per user for one whiteboard session.
 * Each user has at most one record; a new record replaces the previous one in a
 * single map write, so readers see either the old or the new record, never a mix.
 */
public class SelectionStore {
    private static final Logger log = LoggerFactory.getLogger(SelectionStore.class);

    private static final Comparator<SelectionRecord> PRIORITY_ORDER = Comparator
            .comparingInt(SelectionRecord::priority).reversed()
            .thenComparing(Comparator.comparingLong(SelectionRecord::timestamp).reversed())
            .thenComparing(SelectionRecord::userId);

    private final ConcurrentHashMap<String, SelectionRecord> records = new ConcurrentHashMap<>();

    /**
     * Stores or replaces the user's selection. An empty selection removes the user.
     *
     * @return the previous record for the user, or {@code null}
     */
    public SelectionRecord admit(SelectionRecord record) {
        Objects.requireNonNull(record, "record");
        if (record.isEmpty()) {
            return records.remove(record.userId());
        }
        SelectionRecord previous = records.put(record.userId(), record);
        log.debug("Selection admitted for {}: {} elements", record.userId(), record.elementIds().size());
        return previous;
    }

    /**
     * @return the removed record, or {@code null} if the user had no selection
     */
    public SelectionRecord remove(String userId) {
        return userId == null ? null : records.remove(userId);
    }

    public Optional<SelectionRecord> get(String userId) {
        return Optional.ofNullable(userId == null ? null : records.get(userId));
    }

    /**
     * Refreshes the liveness timestamp without touching the selection itself.
     */
    public boolean touch(String userId, long lastSeen) {
        return records.computeIfPresent(userId, (id, record) -> record.withLastSeen(lastSeen)) != null;
    }

    /**
     * Removes every record whose {@code lastSeen} is older than {@code timeoutMs}.
     *
     * @return the removed records
     */
    public List<SelectionRecord> expireStale(long now, long timeoutMs) {
        List<SelectionRecord> expired = new ArrayList<>();
        for (SelectionRecord record : records.values()) {
            if (now - record.lastSeen() > timeoutMs && records.remove(record.userId(), record)) {
                expired.add(record);
            }
        }
        if (!expired.isEmpty()) {
            log.info("Expired {} stale selections", expired.size());
        }
        return expired;
    }

    /**
     * Active selections for the whiteboard, highest priority first, then most recent.
     */
    public List<SelectionRecord> activeFor(String whiteboardId) {
        return activeFor(whiteboardId, null);
    }

    /**
     * As {@link #activeFor(String)}, but the current user's record, if any, always comes first.
     */
    public List<SelectionRecord> activeFor(String whiteboardId, String currentUserId) {
        List<SelectionRecord> active = new ArrayList<>();
        for (SelectionRecord record : records.values()) {
            if (record.active() && Objects.equals(record.whiteboardId(), whiteboardId)) {
                active.add(record);
            }
        }
        active.sort(PRIORITY_ORDER);
        if (currentUserId != null) {
            for (int i = 0; i < active.size(); i++) {
                if (active.get(i).userId().equals(currentUserId)) {
                    active.add(0, active.remove(i));
                    break;
                }
            }
        }
        return active;
    }

    public Collection<SelectionRecord> all() {
        return List.copyOf(records.values());
    }

    public int size() {
        return records.size();
    }

    public void clear() {
        records.clear();
    }
}
