package com.jamcycle.model;

import java.time.Instant;
import java.util.List;

/**
 * Snapshot of a finished cycle kept after roll-over.
 */
public record ArchivedCycle(
        String cycleKey,
        String theme,
        CompetitionPhase finalPhase,
        List<String> winners,
        VoteTally tally,
        boolean weekCancelled,
        Instant archivedAt
) {
    public ArchivedCycle {
        winners = winners == null ? List.of() : List.copyOf(winners);
        tally = tally == null ? VoteTally.empty() : tally;
    }
}
