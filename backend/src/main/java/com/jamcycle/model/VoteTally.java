package com.jamcycle.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Immutable team name to vote count mapping. Counts are never negative.
 */
public final class VoteTally {

    private static final VoteTally EMPTY = new VoteTally(Map.of());

    private final Map<String, Integer> counts;

    private VoteTally(Map<String, Integer> counts) {
        this.counts = counts;
    }

    public static VoteTally empty() {
        return EMPTY;
    }

    @JsonCreator
    public static VoteTally of(Map<String, Integer> counts) {
        if (counts == null || counts.isEmpty()) {
            return EMPTY;
        }
        Map<String, Integer> copy = new LinkedHashMap<>();
        counts.forEach((team, count) -> {
            if (team == null || team.isBlank()) {
                throw new IllegalArgumentException("team name is required");
            }
            copy.put(team, count == null ? 0 : Math.max(0, count));
        });
        return new VoteTally(Collections.unmodifiableMap(copy));
    }

    @JsonValue
    public Map<String, Integer> counts() {
        return counts;
    }

    public boolean isEmpty() {
        return counts.isEmpty();
    }

    public int countFor(String team) {
        return counts.getOrDefault(team, 0);
    }

    public VoteTally increment(String team) {
        return adjust(team, 1);
    }

    public VoteTally decrement(String team) {
        return adjust(team, -1);
    }

    /**
     * Adds a zero entry for every listed team that has no count yet.
     */
    public VoteTally withTeams(Iterable<String> teams) {
        Map<String, Integer> copy = new LinkedHashMap<>(counts);
        for (String team : teams) {
            copy.putIfAbsent(team, 0);
        }
        return of(copy);
    }

    private VoteTally adjust(String team, int delta) {
        Map<String, Integer> copy = new LinkedHashMap<>(counts);
        copy.put(team, Math.max(0, copy.getOrDefault(team, 0) + delta));
        return of(copy);
    }

    @Override
    public boolean equals(Object other) {
        return other instanceof VoteTally tally && counts.equals(tally.counts);
    }

    @Override
    public int hashCode() {
        return counts.hashCode();
    }

    @Override
    public String toString() {
        return "VoteTally" + counts;
    }
}
