package com.inkboard.selectionservice.geometry;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;
import java.util.function.LongSupplier;

/**
 * Memoizes element bounding boxes and the union boxes of element sets.
 * Combined entries are keyed by the sorted, deduplicated id list, so any
 * permutation of the same set hits the same entry. Invalidating an element
 * also drops every combined entry it contributed to.
 *
 * <p>Not thread-safe; mutated only from the owning session's serialized path.
 */
public class BoundsCache {
    private static final Logger log = LoggerFactory.getLogger(BoundsCache.class);

    private final Map<String, BoundsEntry> elementEntries = new HashMap<>();
    private final Map<List<String>, BoundsEntry> combinedEntries = new HashMap<>();
    // element id -> combined keys containing it
    private final Map<String, Set<List<String>>> memberships = new HashMap<>();
    private final long maxAgeMs;
    private final LongSupplier clock;

    public BoundsCache() {
        this(0, System::currentTimeMillis);
    }

    /**
     * @param maxAgeMs entries older than this are recomputed on read; 0 disables ageing
     */
    public BoundsCache(long maxAgeMs, LongSupplier clock) {
        if (maxAgeMs < 0) {
            throw new IllegalArgumentException("maxAgeMs must not be negative");
        }
        this.maxAgeMs = maxAgeMs;
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /**
     * Cached box for an element, without consulting any resolver.
     */
    public Optional<Box> get(String elementId) {
        BoundsEntry entry = elementEntries.get(elementId);
        if (entry == null || isStale(entry)) {
            return Optional.empty();
        }
        return Optional.of(entry.box());
    }

    /**
     * Read-through lookup of a single element.
     */
    public Optional<Box> get(String elementId, BoundsResolver resolver) {
        Optional<Box> cached = get(elementId);
        if (cached.isPresent()) {
            return cached;
        }
        return Optional.ofNullable(resolveAndStore(elementId, resolver));
    }

    /**
     * Union box of every resolvable id. Unresolvable ids are skipped; if none resolve
     * the result is empty and nothing is cached.
     *
     * @param forceRefresh bypass cached values but still repopulate the cache
     */
    public Optional<Box> getCombined(Collection<String> elementIds, BoundsResolver resolver, boolean forceRefresh) {
        if (elementIds == null || elementIds.isEmpty()) {
            return Optional.empty();
        }
        List<String> key = canonicalKey(elementIds);
        if (!forceRefresh) {
            BoundsEntry entry = combinedEntries.get(key);
            if (entry != null && !isStale(entry)) {
                return Optional.of(entry.box());
            }
        }

        List<Box> members = new ArrayList<>(key.size());
        for (String id : key) {
            Box box = forceRefresh
                    ? resolveAndStore(id, resolver)
                    : get(id).orElseGet(() -> resolveAndStore(id, resolver));
            if (box != null) {
                members.add(box);
            }
        }

        Box combined = Box.unionOf(members);
        if (combined == null) {
            combinedEntries.remove(key);
            return Optional.empty();
        }
        combinedEntries.put(key, new BoundsEntry(combined, clock.getAsLong()));
        for (String id : key) {
            memberships.computeIfAbsent(id, k -> new HashSet<>()).add(key);
        }
        return Optional.of(combined);
    }

    public void invalidate(String elementId) {
        elementEntries.remove(elementId);
        Set<List<String>> keys = memberships.remove(elementId);
        if (keys == null) {
            return;
        }
        for (List<String> key : keys) {
            combinedEntries.remove(key);
            for (String member : key) {
                if (!member.equals(elementId)) {
                    Set<List<String>> others = memberships.get(member);
                    if (others != null) {
                        others.remove(key);
                        if (others.isEmpty()) {
                            memberships.remove(member);
                        }
                    }
                }
            }
        }
        log.debug("Invalidated bounds for {} and {} combined entries", elementId, keys.size());
    }

    public void invalidateAll() {
        elementEntries.clear();
        combinedEntries.clear();
        memberships.clear();
    }

    public int size() {
        return elementEntries.size() + combinedEntries.size();
    }

    int combinedSize() {
        return combinedEntries.size();
    }

    private Box resolveAndStore(String elementId, BoundsResolver resolver) {
        Box box = resolver == null ? null : resolver.resolve(elementId);
        if (box == null || !box.isValid()) {
            elementEntries.remove(elementId);
            return null;
        }
        elementEntries.put(elementId, new BoundsEntry(box, clock.getAsLong()));
        return box;
    }

    private boolean isStale(BoundsEntry entry) {
        return maxAgeMs > 0 && clock.getAsLong() - entry.cachedAt() > maxAgeMs;
    }

    static List<String> canonicalKey(Collection<String> elementIds) {
        return List.copyOf(new TreeSet<>(elementIds));
    }

    private record BoundsEntry(Box box, long cachedAt) {
    }
}
