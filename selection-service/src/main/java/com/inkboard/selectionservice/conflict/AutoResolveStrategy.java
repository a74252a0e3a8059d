package com.inkboard.selectionservice.conflict;

import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * What the maintenance sweep does with a conflict left unresolved past the conflict timeout.
 */
public enum AutoResolveStrategy {
    /** Leave it; it is reported as TIMEOUT. */
    DISABLED,
    /** Ownership to the highest-priority contender. */
    PRIORITY,
    /** Ownership to whoever selected the element first. */
    TIMESTAMP,
    /** Ownership to the top-ranked contender. */
    OWNERSHIP,
    /** Keep the element shared. */
    SHARED;

    private static final Comparator<Contender> EARLIEST_CLAIM = Comparator
            .comparingLong(Contender::timestamp)
            .thenComparing(Contender::userId);

    public Optional<ConflictResolution> resolution() {
        return switch (this) {
            case DISABLED -> Optional.empty();
            case SHARED -> Optional.of(ConflictResolution.SHARED);
            case PRIORITY, TIMESTAMP, OWNERSHIP -> Optional.of(ConflictResolution.OWNERSHIP);
        };
    }

    /**
     * The contender who receives ownership under this strategy.
     */
    public Contender winner(ConflictRecord conflict) {
        if (this == TIMESTAMP) {
            List<Contender> contenders = conflict.contenders();
            return contenders.stream().min(EARLIEST_CLAIM).orElse(conflict.leader());
        }
        return conflict.leader();
    }
}
