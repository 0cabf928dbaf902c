package com.jamcycle.model;

import java.time.Instant;
import java.util.Set;

public record WinnerRecord(
        String cycleKey,
        String team,
        Set<String> memberIds,
        int votes,
        boolean decidedByFaceOff,
        Instant recordedAt
) {
    public WinnerRecord {
        memberIds = memberIds == null ? Set.of() : Set.copyOf(memberIds);
    }
}
