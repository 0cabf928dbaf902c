package com.jamcycle.command;

import com.jamcycle.model.CompetitionPhase;
import com.jamcycle.model.FaceOff;
import com.jamcycle.model.GuildState;
import com.jamcycle.model.Team;
import com.jamcycle.model.VoteTally;
import com.jamcycle.repository.GuildStateRepository;
import com.jamcycle.repository.GuildStateUpdate;
import com.jamcycle.service.CompetitionCalendar;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Destructive operator commands on the entries and votes of a cycle.
 */
@Component
@RequiredArgsConstructor
public class SubmissionCommands {

    private final GuildStateRepository guildStateRepository;

    /**
     * Drops every entry of the current cycle together with the votes cast for them.
     */
    public CommandOutcome clearSubmissions(CommandContext context) {
        GuildState state = context.state();
        String week = currentCycleKey(context);
        int removed = state.teamCount();
        Map<String, VoteTally> results = new LinkedHashMap<>(state.votingResults());
        results.remove(week);
        Map<String, Map<String, String>> individualVotes = new LinkedHashMap<>(state.individualVotes());
        individualVotes.remove(week);
        guildStateRepository.save(context.tenantId(), GuildStateUpdate.create()
                .submissions(Map.of())
                .votingResults(results)
                .individualVotes(individualVotes));
        return CommandOutcome.completed(Map.of("removed", removed));
    }

    public CommandOutcome removeSubmission(CommandContext context) {
        Optional<String> team = context.stringParam("team", "team_name");
        if (team.isEmpty()) {
            return CommandOutcome.failed("missing parameter: team");
        }
        Map<String, Team> submissions = new LinkedHashMap<>(context.state().submissions());
        if (submissions.remove(team.get()) == null) {
            return CommandOutcome.failed("no submission for team " + team.get());
        }
        GuildState state = context.state();
        String week = currentCycleKey(context);
        Map<String, VoteTally> results = new LinkedHashMap<>(state.votingResults());
        VoteTally tally = results.get(week);
        if (tally != null) {
            Map<String, Integer> counts = new LinkedHashMap<>(tally.counts());
            counts.remove(team.get());
            results.put(week, VoteTally.of(counts));
        }
        Map<String, String> votes = new LinkedHashMap<>(state.votesFor(week));
        votes.values().removeIf(team.get()::equals);
        Map<String, Map<String, String>> individualVotes = new LinkedHashMap<>(state.individualVotes());
        if (individualVotes.containsKey(week)) {
            individualVotes.put(week, votes);
        }
        guildStateRepository.save(context.tenantId(), GuildStateUpdate.create()
                .submissions(submissions)
                .votingResults(results)
                .individualVotes(individualVotes));
        return CommandOutcome.completed(Map.of("team", team.get()));
    }

    public CommandOutcome removeVote(CommandContext context) {
        Optional<String> user = context.stringParam("user", "user_id");
        if (user.isEmpty()) {
            return CommandOutcome.failed("missing parameter: user");
        }
        GuildState state = context.state();
        String week = context.stringParam("week", "cycle_key").orElse(currentCycleKey(context));

        Map<String, String> votes = new LinkedHashMap<>(state.votesFor(week));
        String votedFor = votes.remove(user.get());
        if (votedFor == null) {
            return CommandOutcome.failed("no vote by " + user.get() + " in " + week);
        }
        Map<String, Map<String, String>> individualVotes = new LinkedHashMap<>(state.individualVotes());
        individualVotes.put(week, votes);
        Map<String, VoteTally> results = new LinkedHashMap<>(state.votingResults());
        results.put(week, results.getOrDefault(week, VoteTally.empty()).decrement(votedFor));

        guildStateRepository.save(context.tenantId(), GuildStateUpdate.create()
                .individualVotes(individualVotes)
                .votingResults(results));
        return CommandOutcome.completed(Map.of("week", week, "team", votedFor));
    }

    /**
     * Drops the current cycle's entries and votes and reopens submissions.
     */
    public CommandOutcome resetWeek(CommandContext context) {
        GuildState state = context.state();
        String week = currentCycleKey(context);
        Map<String, VoteTally> results = new LinkedHashMap<>(state.votingResults());
        results.remove(week);
        Map<String, Map<String, String>> individualVotes = new LinkedHashMap<>(state.individualVotes());
        individualVotes.keySet().removeIf(key -> key.endsWith(week));

        GuildStateUpdate update = GuildStateUpdate.create()
                .submissions(Map.of())
                .votingResults(results)
                .individualVotes(individualVotes)
                .faceOff(FaceOff.inactive())
                .weekCancelled(false)
                .winnerAnnounced(false)
                .phase(CompetitionPhase.SUBMISSION);
        if (!guildStateRepository.saveIfPhaseMatches(context.tenantId(), state.phase(), update)) {
            return CommandOutcome.concurrentChange();
        }
        return CommandOutcome.completed(Map.of("week", week));
    }

    private static String currentCycleKey(CommandContext context) {
        String stored = context.state().cycle().cycleKey();
        return stored != null ? stored : CompetitionCalendar.cycleKeyFor(context.now());
    }
}
