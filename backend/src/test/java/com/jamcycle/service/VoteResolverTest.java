package com.jamcycle.service;

import com.jamcycle.model.VoteTally;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class VoteResolverTest {

    private final VoteResolver voteResolver = new VoteResolver();

    @Test
    void resolve_tieBetweenLeadingTeams() {
        Map<String, Integer> counts = new LinkedHashMap<>();
        counts.put("A", 5);
        counts.put("B", 5);
        counts.put("C", 2);

        VoteResolver.Resolution resolution = voteResolver.resolve(VoteTally.of(counts));

        assertEquals(List.of("A", "B"), resolution.winningTeams());
        assertTrue(resolution.tie());
        assertEquals(5, resolution.winningVotes());
    }

    @Test
    void resolve_uniqueMaximumIsSingleWinner() {
        VoteResolver.Resolution resolution = voteResolver.resolve(VoteTally.of(Map.of("A", 1, "B", 7, "C", 3)));

        assertTrue(resolution.hasWinner());
        assertFalse(resolution.tie());
        assertEquals("B", resolution.singleWinner());
    }

    @Test
    void resolve_emptyTallyHasNoWinner() {
        VoteResolver.Resolution resolution = voteResolver.resolve(VoteTally.empty());

        assertFalse(resolution.hasWinner());
        assertFalse(resolution.tie());
        assertThrows(IllegalStateException.class, resolution::singleWinner);
    }

    @Test
    void resolve_allZeroTallyIsTieAcrossAllTeams() {
        VoteResolver.Resolution resolution = voteResolver.resolve(VoteTally.of(Map.of("Zeta", 0, "Alpha", 0, "Mid", 0)));

        assertTrue(resolution.tie());
        assertEquals(List.of("Alpha", "Mid", "Zeta"), resolution.winningTeams());
    }

    @Test
    void resolve_singleTeamWithoutVotesStillWins() {
        VoteResolver.Resolution resolution = voteResolver.resolve(VoteTally.empty().withTeams(List.of("Solo")));

        assertEquals("Solo", resolution.singleWinner());
        assertEquals(0, resolution.winningVotes());
    }

    @Test
    void resolve_winnerSetNonEmptyExactlyWhenTallyNonEmpty() {
        List<Map<String, Integer>> tallies = List.of(
                Map.of(),
                Map.of("A", 0),
                Map.of("A", 3, "B", 2),
                Map.of("A", 3, "B", 3, "C", 3),
                Map.of("A", 10, "B", 9, "C", 10, "D", 1)
        );
        for (Map<String, Integer> counts : tallies) {
            VoteResolver.Resolution resolution = voteResolver.resolve(VoteTally.of(counts));
            assertEquals(!counts.isEmpty(), resolution.hasWinner(), "tally " + counts);
            int max = counts.values().stream().mapToInt(Integer::intValue).max().orElse(0);
            long holders = counts.values().stream().filter(count -> count == max).count();
            assertEquals(!counts.isEmpty() && holders == 1, resolution.hasWinner() && !resolution.tie(), "tally " + counts);
        }
    }

    @Test
    void voteTally_neverGoesNegative() {
        VoteTally tally = VoteTally.of(Map.of("A", -4)).decrement("A").decrement("B");

        assertEquals(0, tally.countFor("A"));
        assertEquals(0, tally.countFor("B"));
    }
}
