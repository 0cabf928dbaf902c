package com.jamcycle.service;

import com.jamcycle.model.CompetitionPhase;
import com.jamcycle.model.FaceOff;
import com.jamcycle.model.GuildState;
import com.jamcycle.model.Team;
import com.jamcycle.model.VoteTally;
import com.jamcycle.repository.GuildStateRepository;
import com.jamcycle.repository.GuildStateUpdate;
import com.jamcycle.web.BallotRejectedException;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Team entries and votes of the current cycle.
 * <p>
 * Entries are accepted only while the cycle is in submission, guarded by the stored phase. Votes
 * are read-modify-write on the tally; concurrent voters may lose an update, which is tolerated.
 */
@Service
@RequiredArgsConstructor
public class BallotService {

    private static final Logger log = LoggerFactory.getLogger(BallotService.class);

    static final String FACE_OFF_VOTES_PREFIX = "face_off:";

    private final GuildStateRepository guildStateRepository;
    private final TenantDirectory tenantDirectory;
    private final Clock clock;

    public SubmissionReceipt submitTeam(String tenantId, String teamName, Set<String> memberIds) {
        requireTenant(tenantId);
        Instant now = clock.instant();
        GuildState state = guildStateRepository.load(tenantId);
        if (state.phase() != CompetitionPhase.SUBMISSION) {
            throw BallotRejectedException.phaseClosed("Submissions are not open (phase is " + state.phase().wireValue() + ")");
        }

        Team team = new Team(teamName, memberIds);
        String cycleKey = CycleRecords.activeCycleKey(state, now);
        Team existing = state.submissions().get(team.name());
        if (existing != null) {
            if (existing.sameIdentity(team)) {
                return new SubmissionReceipt(tenantId, cycleKey, existing, true);
            }
            throw BallotRejectedException.teamNameTaken("Team name already entered this week: " + team.name());
        }
        for (Team entered : state.submissions().values()) {
            for (String member : team.memberIds()) {
                if (entered.memberIds().contains(member)) {
                    throw BallotRejectedException.memberAlreadyEntered(
                            "Member " + member + " is already entered with team " + entered.name());
                }
            }
        }

        Map<String, Team> submissions = new LinkedHashMap<>(state.submissions());
        submissions.put(team.name(), team);
        GuildStateUpdate update = GuildStateUpdate.create().submissions(submissions);
        if (!guildStateRepository.saveIfPhaseMatches(tenantId, CompetitionPhase.SUBMISSION, update)) {
            throw BallotRejectedException.phaseClosed("Submissions closed while the entry was being recorded");
        }
        log.info("Team {} entered for tenant {} cycle {} ({} member(s))", team.name(), tenantId, cycleKey, team.memberIds().size());
        return new SubmissionReceipt(tenantId, cycleKey, team, false);
    }

    public VoteReceipt castVote(String tenantId, String userId, String teamName) {
        requireTenant(tenantId);
        if (userId == null || userId.isBlank() || teamName == null || teamName.isBlank()) {
            throw new IllegalArgumentException("userId and teamName are required");
        }
        String voter = userId.trim();
        String team = teamName.trim();
        Instant now = clock.instant();
        GuildState state = guildStateRepository.load(tenantId);
        String cycleKey = CycleRecords.activeCycleKey(state, now);

        if (state.faceOff().active()) {
            return castFaceOffVote(state, cycleKey, voter, team, now);
        }
        if (state.phase() != CompetitionPhase.VOTING) {
            throw BallotRejectedException.phaseClosed("Voting is not open (phase is " + state.phase().wireValue() + ")");
        }
        if (!state.submissions().containsKey(team)) {
            throw BallotRejectedException.unknownTeam("No team named " + team + " entered this week");
        }

        Map<String, String> votes = new LinkedHashMap<>(state.votesFor(cycleKey));
        String previous = votes.put(voter, team);
        VoteTally tally = state.votingResults().getOrDefault(cycleKey, VoteTally.empty());
        if (team.equals(previous)) {
            return new VoteReceipt(tenantId, cycleKey, team, tally.countFor(team), false, previous);
        }
        if (previous != null) {
            tally = tally.decrement(previous);
        }
        tally = tally.increment(team);

        Map<String, VoteTally> results = new LinkedHashMap<>(state.votingResults());
        results.put(cycleKey, tally);
        Map<String, Map<String, String>> individualVotes = new LinkedHashMap<>(state.individualVotes());
        individualVotes.put(cycleKey, votes);
        guildStateRepository.save(tenantId, GuildStateUpdate.create()
                .votingResults(results)
                .individualVotes(individualVotes));
        log.debug("Vote by {} for {} recorded for tenant {} cycle {}", voter, team, tenantId, cycleKey);
        return new VoteReceipt(tenantId, cycleKey, team, tally.countFor(team), false, previous);
    }

    private VoteReceipt castFaceOffVote(GuildState state, String cycleKey, String voter, String team, Instant now) {
        FaceOff faceOff = state.faceOff();
        if (faceOff.isDue(now)) {
            throw BallotRejectedException.phaseClosed("Face-off voting has ended");
        }
        if (!faceOff.teams().contains(team)) {
            throw BallotRejectedException.unknownTeam("Team " + team + " is not part of the face-off");
        }

        String votesKey = FACE_OFF_VOTES_PREFIX + cycleKey;
        Map<String, String> votes = new LinkedHashMap<>(state.individualVotes().getOrDefault(votesKey, Map.of()));
        String previous = votes.put(voter, team);
        VoteTally tally = faceOff.tally();
        if (team.equals(previous)) {
            return new VoteReceipt(state.tenantId(), cycleKey, team, tally.countFor(team), true, previous);
        }
        if (previous != null) {
            tally = tally.decrement(previous);
        }
        tally = tally.increment(team);

        Map<String, Map<String, String>> individualVotes = new LinkedHashMap<>(state.individualVotes());
        individualVotes.put(votesKey, votes);
        guildStateRepository.save(state.tenantId(), GuildStateUpdate.create()
                .faceOffTally(tally)
                .individualVotes(individualVotes));
        return new VoteReceipt(state.tenantId(), cycleKey, team, tally.countFor(team), true, previous);
    }

    private void requireTenant(String tenantId) {
        if (tenantDirectory.find(tenantId).isEmpty()) {
            throw BallotRejectedException.unknownTenant(tenantId);
        }
    }

    public record SubmissionReceipt(
            String tenantId,
            String cycleKey,
            Team team,
            boolean alreadyEntered
    ) {
    }

    /**
     * @param previousTeam team the voter had chosen before this vote, or null
     */
    public record VoteReceipt(
            String tenantId,
            String cycleKey,
            String team,
            int teamVotes,
            boolean faceOff,
            String previousTeam
    ) {
    }
}
