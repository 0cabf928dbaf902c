package com.jamcycle.service;

import com.jamcycle.config.JamCycleProperties;
import com.jamcycle.model.CompetitionPhase;
import com.jamcycle.model.FaceOff;
import com.jamcycle.model.GuildState;
import com.jamcycle.model.Team;
import com.jamcycle.model.VoteTally;
import com.jamcycle.repository.GuildStateRepository;
import com.jamcycle.repository.GuildStateUpdate;
import com.jamcycle.repository.InMemoryGuildStateStore;
import com.jamcycle.web.BallotRejectedException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class BallotServiceTest {

    private static final String TENANT = "guild-1";
    private static final Instant NOW = Instant.parse("2026-10-21T10:00:00Z");

    private GuildStateRepository repository;
    private BallotService ballotService;

    @BeforeEach
    void setUp() {
        JamCycleProperties properties = new JamCycleProperties();
        JamCycleProperties.Tenant tenant = new JamCycleProperties.Tenant();
        tenant.setId(TENANT);
        properties.setTenants(List.of(tenant));
        repository = new GuildStateRepository(new InMemoryGuildStateStore(), properties);
        ballotService = new BallotService(repository, new TenantDirectory(properties), Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Test
    void submitTeamDuringSubmission() {
        openSubmissions();

        BallotService.SubmissionReceipt receipt = ballotService.submitTeam(TENANT, " Night Owls ", Set.of("u1", "u2"));

        assertFalse(receipt.alreadyEntered());
        assertEquals("2026-W43", receipt.cycleKey());
        assertEquals("Night Owls", receipt.team().name());
        assertEquals(Set.of("u1", "u2"), repository.load(TENANT).submissions().get("Night Owls").memberIds());
    }

    @Test
    void resubmittingSameTeamIsIdempotent() {
        openSubmissions();
        ballotService.submitTeam(TENANT, "Night Owls", Set.of("u1", "u2"));

        BallotService.SubmissionReceipt again = ballotService.submitTeam(TENANT, "Night Owls", Set.of("u2", "u1"));

        assertTrue(again.alreadyEntered());
        assertEquals(1, repository.load(TENANT).teamCount());
    }

    @Test
    void takenTeamNameIsRejected() {
        openSubmissions();
        ballotService.submitTeam(TENANT, "Night Owls", Set.of("u1"));

        BallotRejectedException ex = assertThrows(BallotRejectedException.class,
                () -> ballotService.submitTeam(TENANT, "Night Owls", Set.of("u9")));

        assertEquals("team_name_taken", ex.getCode());
        assertEquals(HttpStatus.CONFLICT, ex.getStatus());
    }

    @Test
    void memberCannotJoinTwoTeams() {
        openSubmissions();
        ballotService.submitTeam(TENANT, "Night Owls", Set.of("u1", "u2"));

        BallotRejectedException ex = assertThrows(BallotRejectedException.class,
                () -> ballotService.submitTeam(TENANT, "Early Birds", Set.of("u2", "u3")));

        assertEquals("member_already_entered", ex.getCode());
    }

    @Test
    void submissionOutsideSubmissionPhaseIsRejected() {
        repository.save(TENANT, GuildStateUpdate.create().phase(CompetitionPhase.VOTING));

        BallotRejectedException ex = assertThrows(BallotRejectedException.class,
                () -> ballotService.submitTeam(TENANT, "Night Owls", Set.of("u1")));

        assertEquals("phase_closed", ex.getCode());
        assertTrue(repository.load(TENANT).submissions().isEmpty());
    }

    @Test
    void unknownTenantIsRejected() {
        BallotRejectedException ex = assertThrows(BallotRejectedException.class,
                () -> ballotService.castVote("nobody", "u1", "Night Owls"));

        assertEquals(HttpStatus.NOT_FOUND, ex.getStatus());
        assertEquals("unknown_tenant", ex.getCode());
    }

    @Test
    void changedVoteMovesCount() {
        openVoting();

        BallotService.VoteReceipt first = ballotService.castVote(TENANT, "voter", "A");
        BallotService.VoteReceipt second = ballotService.castVote(TENANT, "voter", "B");

        assertNull(first.previousTeam());
        assertEquals("A", second.previousTeam());
        GuildState stored = repository.load(TENANT);
        VoteTally tally = stored.votingResults().get("2026-W43");
        assertEquals(0, tally.countFor("A"));
        assertEquals(1, tally.countFor("B"));
        assertEquals(Map.of("voter", "B"), stored.votesFor("2026-W43"));
    }

    @Test
    void repeatedVoteIsNoOp() {
        openVoting();
        ballotService.castVote(TENANT, "voter", "A");

        BallotService.VoteReceipt repeat = ballotService.castVote(TENANT, "voter", "A");

        assertEquals(1, repeat.teamVotes());
        assertEquals(1, repository.load(TENANT).votingResults().get("2026-W43").countFor("A"));
    }

    @Test
    void voteForUnknownTeamIsRejected() {
        openVoting();

        BallotRejectedException ex = assertThrows(BallotRejectedException.class,
                () -> ballotService.castVote(TENANT, "voter", "Ghosts"));

        assertEquals("unknown_team", ex.getCode());
    }

    @Test
    void blankVoterIsInvalid() {
        openVoting();

        assertThrows(IllegalArgumentException.class, () -> ballotService.castVote(TENANT, " ", "A"));
    }

    @Test
    void activeFaceOffReceivesVotes() {
        openVoting();
        repository.save(TENANT, GuildStateUpdate.create()
                .faceOff(new FaceOff(true, List.of("A", "B"), NOW.plusSeconds(3600), VoteTally.of(Map.of("A", 0, "B", 0)))));

        BallotService.VoteReceipt receipt = ballotService.castVote(TENANT, "voter", "B");

        assertTrue(receipt.faceOff());
        GuildState stored = repository.load(TENANT);
        assertEquals(1, stored.faceOff().tally().countFor("B"));
        assertEquals(Map.of("voter", "B"),
                stored.individualVotes().get(BallotService.FACE_OFF_VOTES_PREFIX + "2026-W43"));
        assertFalse(stored.votingResults().containsKey("2026-W43"));
    }

    @Test
    void faceOffRejectsTeamsOutsideIt() {
        openVoting();
        repository.save(TENANT, GuildStateUpdate.create()
                .submissions(Map.of(
                        "A", new Team("A", Set.of("u1")),
                        "B", new Team("B", Set.of("u2")),
                        "C", new Team("C", Set.of("u3"))))
                .faceOff(new FaceOff(true, List.of("A", "B"), NOW.plusSeconds(3600), VoteTally.empty())));

        BallotRejectedException ex = assertThrows(BallotRejectedException.class,
                () -> ballotService.castVote(TENANT, "voter", "C"));

        assertEquals("unknown_team", ex.getCode());
    }

    private void openSubmissions() {
        repository.save(TENANT, GuildStateUpdate.create()
                .phase(CompetitionPhase.SUBMISSION)
                .cycleKey("2026-W43"));
    }

    private void openVoting() {
        repository.save(TENANT, GuildStateUpdate.create()
                .phase(CompetitionPhase.VOTING)
                .cycleKey("2026-W43")
                .submissions(Map.of(
                        "A", new Team("A", Set.of("u1")),
                        "B", new Team("B", Set.of("u2")))));
    }
}
