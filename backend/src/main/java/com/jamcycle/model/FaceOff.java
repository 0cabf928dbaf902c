package com.jamcycle.model;

import java.time.Instant;
import java.util.List;

/**
 * Tie-break vote between the leading teams of a cycle.
 */
public record FaceOff(
        boolean active,
        List<String> teams,
        Instant deadline,
        VoteTally tally
) {
    private static final FaceOff INACTIVE = new FaceOff(false, List.of(), null, VoteTally.empty());

    public FaceOff {
        teams = teams == null ? List.of() : List.copyOf(teams);
        tally = tally == null ? VoteTally.empty() : tally;
        if (active && deadline == null) {
            throw new IllegalArgumentException("active face-off requires a deadline");
        }
    }

    public static FaceOff inactive() {
        return INACTIVE;
    }

    public boolean isDue(Instant now) {
        return active && !now.isBefore(deadline);
    }
}
