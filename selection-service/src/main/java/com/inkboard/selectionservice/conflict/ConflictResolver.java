package com.inkboard.selectionservice.conflict;

import com.inkboard.selectionservice.selection.SelectionRecord;

import java.util.*;
import java.util.function.Function;

/**
 * Derives conflicts from the active selections. Stateless: the same input always
 * yields the same output, so conflicts are recomputed rather than patched.
 */
public class ConflictResolver {

    static final Comparator<Contender> RANKING = Comparator
            .comparingInt(Contender::priority).reversed()
            .thenComparingLong(Contender::timestamp)
            .thenComparing(Contender::userId);

    public List<ConflictRecord> recompute(Collection<SelectionRecord> activeSelections) {
        return recompute(activeSelections, elementId -> ResolutionMode.MANUAL);
    }

    /**
     * @param modeLookup current resolution mode per contested element
     * @return conflicts ordered by element id, contenders ranked by priority then earliest claim
     */
    public List<ConflictRecord> recompute(Collection<SelectionRecord> activeSelections,
                                          Function<String, ResolutionMode> modeLookup) {
        Map<String, List<Contender>> byElement = new TreeMap<>();
        for (SelectionRecord selection : activeSelections) {
            if (!selection.active()) {
                continue;
            }
            Contender contender = new Contender(
                    selection.userId(), selection.displayName(), selection.priority(), selection.timestamp());
            for (String elementId : selection.elementIds()) {
                byElement.computeIfAbsent(elementId, k -> new ArrayList<>()).add(contender);
            }
        }

        List<ConflictRecord> conflicts = new ArrayList<>();
        for (Map.Entry<String, List<Contender>> entry : byElement.entrySet()) {
            List<Contender> contenders = entry.getValue();
            if (contenders.size() < 2) {
                continue;
            }
            contenders.sort(RANKING);
            String elementId = entry.getKey();
            ResolutionMode mode = modeLookup.apply(elementId);
            conflicts.add(new ConflictRecord(
                    ConflictRecord.idFor(elementId),
                    elementId,
                    contenders,
                    mode == null ? ResolutionMode.MANUAL : mode));
        }
        return conflicts;
    }
}
