package com.jamcycle.service;

import com.jamcycle.model.VoteTally;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;

/**
 * Picks the leading teams of a tally. No I/O.
 * <p>
 * Absent teams count as zero before they reach this point, so a tally where every team has zero
 * votes resolves as a tie across all of them.
 */
@Component
public class VoteResolver {

    public Resolution resolve(VoteTally tally) {
        if (tally == null || tally.isEmpty()) {
            return new Resolution(List.of(), false, 0);
        }
        int maxVotes = tally.counts().values().stream()
                .mapToInt(Integer::intValue)
                .max()
                .orElse(0);
        List<String> winningTeams = tally.counts().entrySet().stream()
                .filter(entry -> entry.getValue() == maxVotes)
                .map(Map.Entry::getKey)
                .sorted()
                .toList();
        return new Resolution(winningTeams, winningTeams.size() > 1, maxVotes);
    }

    /**
     * @param winningTeams teams holding the maximum count, sorted by name
     */
    public record Resolution(
            List<String> winningTeams,
            boolean tie,
            int winningVotes
    ) {
        public boolean hasWinner() {
            return !winningTeams.isEmpty();
        }

        public String singleWinner() {
            if (winningTeams.size() != 1) {
                throw new IllegalStateException("Resolution has " + winningTeams.size() + " leading teams");
            }
            return winningTeams.get(0);
        }
    }
}
