package com.jamcycle.model;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

/**
 * Phase of the active competition cycle for one tenant.
 */
public enum CompetitionPhase {
    SUBMISSION,
    VOTING,
    CANCELLED,
    PAUSED,
    ENDED,
    INACTIVE;

    public String wireValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static Optional<CompetitionPhase> fromWire(String value) {
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        String normalized = value.trim().toUpperCase(Locale.ROOT);
        return Arrays.stream(values())
                .filter(phase -> phase.name().equals(normalized))
                .findFirst();
    }
}
