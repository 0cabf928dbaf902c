package com.jamcycle.model;

import java.util.Set;
import java.util.TreeSet;

/**
 * A team entered in a cycle. Identity within a cycle is the pair (name, member set).
 */
public record Team(
        String name,
        Set<String> memberIds
) {
    public Team {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("team name is required");
        }
        name = name.trim();
        memberIds = memberIds == null ? Set.of() : Set.copyOf(new TreeSet<>(memberIds));
    }

    public boolean sameIdentity(Team other) {
        return other != null && name.equals(other.name) && memberIds.equals(other.memberIds);
    }
}
