package com.inkboard.selectionservice.ownership;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.LongSupplier;

/**
 * Grants, renews and expires ownership of elements.
 *
 * <p>Expiry is tracked in a single queue ordered by expiry time and drained by
 * {@link #expireAll(long)}, which the owning session's maintenance sweep calls on a
 * fixed interval. There is no timer per lock. Lookups never return an expired record,
 * even between sweeps. The queue holds exactly one ticket per live record: renewing,
 * replacing or releasing a record withdraws its ticket.
 */
public class OwnershipManager {
    private static final Logger log = LoggerFactory.getLogger(OwnershipManager.class);

    private final ConcurrentHashMap<String, OwnershipRecord> records = new ConcurrentHashMap<>();
    private final PriorityQueue<ExpiryTicket> expiryQueue =
            new PriorityQueue<>(Comparator.comparingLong(ExpiryTicket::expiresAt));
    private final long defaultTtlMs;
    private final LongSupplier clock;

    public OwnershipManager(long defaultTtlMs, LongSupplier clock) {
        if (defaultTtlMs <= 0) {
            throw new IllegalArgumentException("defaultTtlMs must be positive");
        }
        this.defaultTtlMs = defaultTtlMs;
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    public AcquireResult acquire(String elementId, String userId, long ttlMs, LockReason reason) {
        return acquire(OwnershipRequest.locked(elementId, userId, ttlMs, reason));
    }

    /**
     * Takes ownership unless another user holds an unexpired lock, or holds a soft hold
     * with equal or higher priority. The same user acquiring again replaces their record.
     */
    public synchronized AcquireResult acquire(OwnershipRequest request) {
        if (request.elementId() == null || request.userId() == null) {
            return AcquireResult.rejected(null, "elementId and userId are required");
        }
        long now = clock.getAsLong();
        OwnershipRecord existing = current(request.elementId(), now);
        if (existing != null && !existing.isOwnedBy(request.userId())) {
            if (existing.locked()) {
                log.debug("Ownership of {} rejected for {}: locked by {}",
                        request.elementId(), request.userId(), existing.ownerId());
                return AcquireResult.rejected(existing, "Element is locked by " + existing.ownerName());
            }
            if (request.priority() <= existing.priority()) {
                return AcquireResult.rejected(existing, "Element is held by " + existing.ownerName());
            }
            log.info("Soft hold on {} by {} preempted by {} (priority {} > {})",
                    request.elementId(), existing.ownerId(), request.userId(), request.priority(), existing.priority());
        }

        long ttl = request.ttlMs() > 0 ? request.ttlMs() : defaultTtlMs;
        OwnershipRecord record = new OwnershipRecord(
                request.elementId(),
                request.userId(),
                request.userName() != null ? request.userName() : request.userId(),
                now,
                expiryAt(now, ttl),
                request.locked(),
                request.reason() != null ? request.reason() : LockReason.MANUAL,
                request.priority());
        OwnershipRecord replaced = records.put(record.elementId(), record);
        withdrawTicket(replaced);
        expiryQueue.add(new ExpiryTicket(record.expiresAt(), record));
        log.info("Ownership of {} granted to {} for {}ms ({}{})",
                record.elementId(), record.ownerId(), ttl, record.lockReason(), record.locked() ? ", locked" : "");
        return AcquireResult.granted(record);
    }

    /**
     * Extends the caller's ownership. Fails if the caller is not the current owner.
     */
    public synchronized boolean renew(String elementId, String userId, long ttlMs) {
        long now = clock.getAsLong();
        OwnershipRecord existing = current(elementId, now);
        if (existing == null || !existing.isOwnedBy(userId)) {
            return false;
        }
        long ttl = ttlMs > 0 ? ttlMs : defaultTtlMs;
        OwnershipRecord renewed = existing.renewedUntil(expiryAt(now, ttl));
        records.put(elementId, renewed);
        withdrawTicket(existing);
        expiryQueue.add(new ExpiryTicket(renewed.expiresAt(), renewed));
        log.debug("Ownership of {} renewed by {} until {}", elementId, userId, renewed.expiresAt());
        return true;
    }

    /**
     * Gives up the caller's ownership. Fails if the caller is not the current owner.
     */
    public synchronized boolean release(String elementId, String userId) {
        OwnershipRecord existing = current(elementId, clock.getAsLong());
        if (existing == null || !existing.isOwnedBy(userId)) {
            return false;
        }
        records.remove(elementId, existing);
        withdrawTicket(existing);
        log.info("Ownership of {} released by {}", elementId, userId);
        return true;
    }

    /**
     * Releases everything the user owns, e.g. on disconnect.
     */
    public synchronized List<OwnershipRecord> releaseAll(String userId) {
        List<OwnershipRecord> released = new ArrayList<>();
        for (OwnershipRecord record : records.values()) {
            if (record.isOwnedBy(userId) && records.remove(record.elementId(), record)) {
                withdrawTicket(record);
                released.add(record);
            }
        }
        if (!released.isEmpty()) {
            log.info("Released {} ownerships held by {}", released.size(), userId);
        }
        return released;
    }

    /**
     * Removes every record with {@code expiresAt <= now}.
     *
     * @return the expired records
     */
    public synchronized List<OwnershipRecord> expireAll(long now) {
        List<OwnershipRecord> expired = new ArrayList<>();
        while (!expiryQueue.isEmpty() && expiryQueue.peek().expiresAt() <= now) {
            OwnershipRecord record = expiryQueue.poll().record();
            if (records.remove(record.elementId(), record)) {
                expired.add(record);
            }
        }
        for (OwnershipRecord record : expired) {
            log.info("Ownership of {} by {} expired", record.elementId(), record.ownerId());
        }
        return expired;
    }

    public Optional<OwnershipRecord> get(String elementId) {
        if (elementId == null) {
            return Optional.empty();
        }
        OwnershipRecord record = records.get(elementId);
        if (record == null || record.isExpired(clock.getAsLong())) {
            return Optional.empty();
        }
        return Optional.of(record);
    }

    public long remainingMs(String elementId) {
        long now = clock.getAsLong();
        return get(elementId).map(record -> record.remainingMs(now)).orElse(0L);
    }

    /**
     * Unexpired records ordered by element id.
     */
    public List<OwnershipRecord> active() {
        long now = clock.getAsLong();
        return records.values().stream()
                .filter(record -> !record.isExpired(now))
                .sorted(Comparator.comparing(OwnershipRecord::elementId))
                .toList();
    }

    /**
     * Drops every record, expired or not.
     */
    public synchronized void clear() {
        records.clear();
        expiryQueue.clear();
    }

    public long defaultTtlMs() {
        return defaultTtlMs;
    }

    synchronized int pendingExpiryTickets() {
        return expiryQueue.size();
    }

    private OwnershipRecord current(String elementId, long now) {
        OwnershipRecord record = records.get(elementId);
        if (record != null && record.isExpired(now)) {
            records.remove(elementId, record);
            withdrawTicket(record);
            log.debug("Dropped expired ownership of {} on access", elementId);
            return null;
        }
        return record;
    }

    private void withdrawTicket(OwnershipRecord record) {
        if (record != null) {
            expiryQueue.remove(new ExpiryTicket(record.expiresAt(), record));
        }
    }

    // saturates instead of wrapping, so a huge TTL means "until released"
    private static long expiryAt(long now, long ttl) {
        return ttl > Long.MAX_VALUE - now ? Long.MAX_VALUE : now + ttl;
    }

    private record ExpiryTicket(long expiresAt, OwnershipRecord record) {
    }
}
