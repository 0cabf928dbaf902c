package com.jamcycle.service;

import com.jamcycle.model.ArchivedCycle;
import com.jamcycle.model.GuildState;
import com.jamcycle.model.Team;
import com.jamcycle.model.WinnerRecord;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Builders for the records kept per cycle: weekly winners and the roll-over archive.
 */
final class CycleRecords {

    private CycleRecords() {
    }

    static Map<String, WinnerRecord> withWinner(GuildState state, String cycleKey, String team, int votes,
                                                boolean decidedByFaceOff, Instant now) {
        Team entry = state.submissions().get(team);
        Set<String> members = entry == null ? Set.of() : entry.memberIds();
        Map<String, WinnerRecord> winners = new LinkedHashMap<>(state.weeklyWinners());
        winners.put(cycleKey, new WinnerRecord(cycleKey, team, members, votes, decidedByFaceOff, now));
        return winners;
    }

    /**
     * Archive with the current cycle added, or {@code null} when there is nothing new to archive.
     */
    static Map<String, ArchivedCycle> withArchivedCurrentCycle(GuildState state, Instant now) {
        String cycleKey = state.cycle().cycleKey();
        if (cycleKey == null || state.archive().containsKey(cycleKey)) {
            return null;
        }
        WinnerRecord winner = state.weeklyWinners().get(cycleKey);
        ArchivedCycle archived = new ArchivedCycle(
                cycleKey,
                state.cycle().theme(),
                state.phase(),
                winner == null ? List.of() : List.of(winner.team()),
                state.tallyFor(cycleKey),
                state.cycle().weekCancelled(),
                now);
        Map<String, ArchivedCycle> archive = new LinkedHashMap<>(state.archive());
        archive.put(cycleKey, archived);
        return archive;
    }

    /**
     * Key the current cycle's ballots are stored under.
     */
    static String activeCycleKey(GuildState state, Instant now) {
        String stored = state.cycle().cycleKey();
        return stored != null ? stored : CompetitionCalendar.cycleKeyFor(now);
    }
}
