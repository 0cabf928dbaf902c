package com.jamcycle.model;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Everything the scheduler and the command consumer know about one tenant, as read in one pass
 * from the state store.
 */
public record GuildState(
        String tenantId,
        CompetitionCycle cycle,
        TenantConfig config,
        boolean automationEnabled,
        boolean themeGenerationDone,
        String nextWeekTheme,
        Map<String, Team> submissions,
        Map<String, VoteTally> votingResults,
        Map<String, Map<String, String>> individualVotes,
        FaceOff faceOff,
        Map<String, WinnerRecord> weeklyWinners,
        Map<String, ArchivedCycle> archive,
        PendingAnnouncement pendingAnnouncement,
        Instant restartNotBefore
) {
    public GuildState {
        config = config == null ? TenantConfig.defaults() : config;
        submissions = submissions == null ? Map.of() : Map.copyOf(submissions);
        votingResults = votingResults == null ? Map.of() : Map.copyOf(votingResults);
        individualVotes = individualVotes == null ? Map.of() : Map.copyOf(individualVotes);
        faceOff = faceOff == null ? FaceOff.inactive() : faceOff;
        weeklyWinners = weeklyWinners == null ? Map.of() : Map.copyOf(weeklyWinners);
        archive = archive == null ? Map.of() : Map.copyOf(archive);
    }

    public int teamCount() {
        return submissions.size();
    }

    public CompetitionPhase phase() {
        return cycle.phase();
    }

    public String lastAnnouncementToken() {
        return cycle.lastAnnouncementToken();
    }

    /**
     * Votes recorded for the given cycle, limited to the teams still entered. Every entered team is
     * present, with zero when unvoted.
     */
    public VoteTally tallyFor(String cycleKey) {
        VoteTally recorded = votingResults.getOrDefault(cycleKey, VoteTally.empty());
        Map<String, Integer> counts = new LinkedHashMap<>();
        for (String team : submissions.keySet()) {
            counts.put(team, recorded.countFor(team));
        }
        return VoteTally.of(counts);
    }

    public Map<String, String> votesFor(String cycleKey) {
        return individualVotes.getOrDefault(cycleKey, Map.of());
    }
}
