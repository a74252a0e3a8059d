package com.inkboard.selectionservice.ownership;

import org.junit.jupiter.api.Test;

import java.util.concurrent.atomic.AtomicLong;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class OwnershipManagerTest {

    private final AtomicLong clock = new AtomicLong(0);
    private final OwnershipManager manager = new OwnershipManager(30_000, clock::get);

    @Test
    void shouldGrantThenRejectOtherUserUntilExpiry() {
        AcquireResult first = manager.acquire("e5", "A", 1_000, LockReason.EDITING);

        assertThat(first.granted()).isTrue();
        assertThat(first.record().expiresAt()).isEqualTo(1_000);

        clock.set(500);
        AcquireResult second = manager.acquire("e5", "B", 1_000, LockReason.EDITING);
        assertThat(second.granted()).isFalse();
        assertThat(second.record().ownerId()).isEqualTo("A");

        clock.set(1_001);
        assertThat(manager.expireAll(1_001)).extracting(OwnershipRecord::ownerId).containsExactly("A");
        assertThat(manager.acquire("e5", "B", 1_000, LockReason.EDITING).granted()).isTrue();
        assertThat(manager.get("e5")).map(OwnershipRecord::ownerId).contains("B");
    }

    @Test
    void shouldHideExpiredRecordsBeforeSweep() {
        manager.acquire("e1", "A", 100, LockReason.MOVING);

        clock.set(100);

        assertThat(manager.get("e1")).isEmpty();
        assertThat(manager.active()).isEmpty();
        assertThat(manager.acquire("e1", "B", 100, LockReason.MOVING).granted()).isTrue();
    }

    @Test
    void shouldLetOwnerReacquire() {
        manager.acquire("e1", "A", 100, LockReason.EDITING);

        AcquireResult again = manager.acquire("e1", "A", 500, LockReason.STYLING);

        assertThat(again.granted()).isTrue();
        assertThat(manager.get("e1")).map(OwnershipRecord::lockReason).contains(LockReason.STYLING);
    }

    @Test
    void shouldPreemptSoftHoldOnlyWithHigherPriority() {
        manager.acquire(new OwnershipRequest("e1", "A", "Alice", 1_000, LockReason.MANUAL, 2, false));

        AcquireResult equal = manager.acquire(new OwnershipRequest("e1", "B", "Bob", 1_000, LockReason.MANUAL, 2, true));
        AcquireResult higher = manager.acquire(new OwnershipRequest("e1", "C", "Carol", 1_000, LockReason.MANUAL, 3, true));

        assertThat(equal.granted()).isFalse();
        assertThat(higher.granted()).isTrue();
        assertThat(manager.get("e1")).map(OwnershipRecord::ownerId).contains("C");
    }

    @Test
    void shouldNeverPreemptLockedRecord() {
        manager.acquire(new OwnershipRequest("e1", "A", "Alice", 1_000, LockReason.EDITING, 0, true));

        AcquireResult result = manager.acquire(new OwnershipRequest("e1", "B", "Bob", 1_000, LockReason.EDITING, 99, true));

        assertThat(result.granted()).isFalse();
        assertThat(result.reason()).contains("Alice");
    }

    @Test
    void shouldOnlyLetOwnerRenewOrRelease() {
        manager.acquire("e1", "A", 1_000, LockReason.EDITING);

        assertThat(manager.renew("e1", "B", 5_000)).isFalse();
        assertThat(manager.release("e1", "B")).isFalse();
        assertThat(manager.get("e1")).map(OwnershipRecord::ownerId).contains("A");

        assertThat(manager.release("e1", "A")).isTrue();
        assertThat(manager.get("e1")).isEmpty();
    }

    @Test
    void shouldExtendExpiryOnRenew() {
        manager.acquire("e1", "A", 1_000, LockReason.EDITING);

        clock.set(800);
        assertThat(manager.renew("e1", "A", 1_000)).isTrue();

        assertThat(manager.get("e1")).map(OwnershipRecord::expiresAt).contains(1_800L);
        // renewing withdraws the original ticket, so nothing fires at the old expiry
        assertThat(manager.expireAll(1_500)).isEmpty();
        assertThat(manager.remainingMs("e1")).isEqualTo(1_000);
        assertThat(manager.expireAll(1_800)).hasSize(1);
        assertThat(manager.pendingExpiryTickets()).isZero();
    }

    @Test
    void shouldKeepOneExpiryTicketPerRecordAcrossRenewals() {
        manager.acquire("e1", "A", 1_000, LockReason.EDITING);

        for (int i = 1; i <= 50; i++) {
            clock.set(i * 10L);
            assertThat(manager.renew("e1", "A", 1_000)).isTrue();
        }
        manager.acquire("e1", "A", 2_000, LockReason.STYLING);

        assertThat(manager.pendingExpiryTickets()).isEqualTo(1);
        manager.release("e1", "A");
        assertThat(manager.pendingExpiryTickets()).isZero();
    }

    @Test
    void shouldSaturateExpiryForHugeTtl() {
        clock.set(5_000);

        AcquireResult result = manager.acquire("e1", "A", Long.MAX_VALUE, LockReason.EDITING);

        assertThat(result.granted()).isTrue();
        assertThat(result.record().expiresAt()).isEqualTo(Long.MAX_VALUE);
        assertThat(manager.renew("e1", "A", Long.MAX_VALUE - 1)).isTrue();
        assertThat(manager.get("e1")).map(OwnershipRecord::expiresAt).contains(Long.MAX_VALUE);
        assertThat(manager.expireAll(clock.get())).isEmpty();
    }

    @Test
    void shouldUseDefaultTtlWhenNoneGiven() {
        AcquireResult result = manager.acquire("e1", "A", 0, LockReason.EDITING);

        assertThat(result.record().expiresAt()).isEqualTo(30_000);
    }

    @Test
    void shouldReleaseEverythingUserOwns() {
        manager.acquire("e1", "A", 1_000, LockReason.EDITING);
        manager.acquire("e2", "A", 1_000, LockReason.EDITING);
        manager.acquire("e3", "B", 1_000, LockReason.EDITING);

        assertThat(manager.releaseAll("A")).extracting(OwnershipRecord::elementId)
                .containsExactlyInAnyOrder("e1", "e2");
        assertThat(manager.active()).extracting(OwnershipRecord::elementId).containsExactly("e3");
    }

    @Test
    void shouldRejectRecordsThatExpireBeforeTheyStart() {
        assertThatThrownBy(() -> new OwnershipRecord("e", "A", "A", 10, 10, true, LockReason.MANUAL, 0))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
