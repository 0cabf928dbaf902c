package com.jamcycle.command;

import com.jamcycle.config.JamCycleProperties;
import com.jamcycle.model.CompetitionPhase;
import com.jamcycle.model.GuildState;
import com.jamcycle.model.Team;
import com.jamcycle.model.TenantDescriptor;
import com.jamcycle.model.TransportKind;
import com.jamcycle.model.VoteTally;
import com.jamcycle.repository.GuildFields;
import com.jamcycle.repository.GuildStateRepository;
import com.jamcycle.repository.GuildStateUpdate;
import com.jamcycle.repository.InMemoryGuildStateStore;
import com.jamcycle.service.PhaseTransitionService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class CommandDispatcherTest {

    private static final Instant NOW = Instant.parse("2026-10-21T10:00:00Z");
    private static final TenantDescriptor TENANT =
            new TenantDescriptor("guild-1", "Guild One", TransportKind.QUEUE, null, null);

    private GuildStateRepository repository;
    private PhaseTransitionService phaseTransitionService;
    private CommandDispatcher dispatcher;

    @BeforeEach
    void setUp() {
        repository = new GuildStateRepository(new InMemoryGuildStateStore(), new JamCycleProperties());
        phaseTransitionService = mock(PhaseTransitionService.class);
        CommandHandlerRegistry registry = new CommandHandlerRegistry(
                new CompetitionCommands(repository, phaseTransitionService),
                new SubmissionCommands(repository),
                new SettingsCommands(repository),
                new BackupCommands(repository));
        dispatcher = new CommandDispatcher(repository, registry, Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Test
    void unknownActionFails() {
        CommandResult result = dispatcher.dispatch(TENANT, new AdminCommand("cmd-1", "launch_rockets", Map.of()));

        assertTrue(result.isFailed());
        assertEquals("cmd-1", result.id());
        assertEquals(CommandDispatcher.UNKNOWN_ACTION, result.error());
        assertEquals(NOW, result.processedAt());
    }

    @Test
    void missingActionIsMalformed() {
        CommandResult result = dispatcher.dispatch(TENANT, new AdminCommand("cmd-1", " ", null));

        assertEquals(CommandDispatcher.MISSING_ACTION, result.error());
    }

    @Test
    void safeModeBlocksResetWeek() {
        seedWeek();

        CommandResult result = dispatcher.dispatch(TENANT, new AdminCommand("cmd-7", "reset_week", Map.of()));

        assertTrue(result.isFailed());
        assertTrue(result.error().contains("safe mode"));
        assertEquals(1, repository.load(TENANT.id()).teamCount());
    }

    @Test
    void resetWeekRunsOnceSafeModeIsOff() {
        seedWeek();
        repository.save(TENANT.id(), GuildStateUpdate.create().safeModeEnabled(false));

        CommandResult result = dispatcher.dispatch(TENANT, new AdminCommand("cmd-8", "reset_week", Map.of()));

        assertEquals(CommandStatus.COMPLETED, result.status());
        GuildState stored = repository.load(TENANT.id());
        assertEquals(CompetitionPhase.SUBMISSION, stored.phase());
        assertTrue(stored.submissions().isEmpty());
        assertFalse(stored.votingResults().containsKey("2026-W43"));
        assertTrue(stored.votesFor("2026-W43").isEmpty());
    }

    @Test
    void clearSubmissionsReportsRemovedCount() {
        seedWeek();
        repository.save(TENANT.id(), GuildStateUpdate.create().safeModeEnabled(false));

        CommandResult result = dispatcher.dispatch(TENANT, new AdminCommand("cmd-9", "clear-submissions", Map.of()));

        assertEquals(Map.of("removed", 1), result.result());
        assertEquals(0, repository.load(TENANT.id()).teamCount());
    }

    @Test
    void setPhaseValidatesParameter() {
        assertEquals("missing parameter: phase",
                dispatcher.dispatch(TENANT, new AdminCommand("a", "set_phase", Map.of())).error());
        assertEquals("invalid phase: warmup",
                dispatcher.dispatch(TENANT, new AdminCommand("b", "set_phase", Map.of("phase", "warmup"))).error());

        CommandResult result = dispatcher.dispatch(TENANT, new AdminCommand("c", "set_phase", Map.of("phase", "Voting")));

        assertEquals(CommandStatus.COMPLETED, result.status());
        assertNull(result.result());
        assertEquals(CompetitionPhase.VOTING, repository.load(TENANT.id()).phase());
    }

    @Test
    void nextPhaseAdvancesSubmissionToVoting() {
        repository.save(TENANT.id(), GuildStateUpdate.create().phase(CompetitionPhase.SUBMISSION));

        dispatcher.dispatch(TENANT, new AdminCommand("n1", "next_phase", Map.of()));

        assertEquals(CompetitionPhase.VOTING, repository.load(TENANT.id()).phase());
    }

    @Test
    void toggleAutomationFlipsFlag() {
        CommandResult result = dispatcher.dispatch(TENANT, new AdminCommand("t1", "toggle_automation", Map.of()));

        assertEquals(Map.of("automation_enabled", false), result.result());
        assertFalse(repository.load(TENANT.id()).automationEnabled());
    }

    @Test
    void startNewWeekDelegatesToTransitions() {
        when(phaseTransitionService.startSubmission(any(GuildState.class), eq("2026-W43"),
                eq("submission_start_2026-W43"), eq(NOW), eq("Night Drive"))).thenReturn(true);

        CommandResult result = dispatcher.dispatch(TENANT,
                new AdminCommand("w1", "start_new_week", Map.of("theme", "Night Drive")));

        assertEquals(Map.of("cycle_key", "2026-W43"), result.result());
    }

    @Test
    void announceWinnersRefusesDuringFaceOffOrTwice() {
        repository.save(TENANT.id(), GuildStateUpdate.create().winnerAnnounced(true));

        CommandResult result = dispatcher.dispatch(TENANT, new AdminCommand("w2", "announce_winner", Map.of()));

        assertEquals("winner already announced for this cycle", result.error());
    }

    @Test
    void announceWinnersReportsLostRace() {
        repository.save(TENANT.id(), GuildStateUpdate.create().cycleKey("2026-W43").phase(CompetitionPhase.VOTING));
        when(phaseTransitionService.announceWinner(any(GuildState.class), eq("winner_2026-W43"), eq(NOW)))
                .thenReturn(false);

        CommandResult result = dispatcher.dispatch(TENANT, new AdminCommand("w3", "announce_winners", Map.of()));

        assertEquals("state changed concurrently; retry the command", result.error());
        verify(phaseTransitionService).announceWinner(any(GuildState.class), eq("winner_2026-W43"), eq(NOW));
    }

    @Test
    void handlerErrorBecomesFailedResult() {
        repository.save(TENANT.id(), GuildStateUpdate.create().put(GuildFields.SUBMISSIONS, "{broken"));

        CommandResult result = dispatcher.dispatch(TENANT, new AdminCommand("x1", "set_theme", Map.of("theme", "Nova")));

        assertTrue(result.isFailed());
        assertEquals("Corrupt guild state field: submissions", result.error());
    }

    private void seedWeek() {
        repository.save(TENANT.id(), GuildStateUpdate.create()
                .phase(CompetitionPhase.VOTING)
                .cycleKey("2026-W43")
                .submissions(Map.of("A", new Team("A", Set.of("u1"))))
                .votingResults(Map.of("2026-W43", VoteTally.of(Map.of("A", 1))))
                .individualVotes(Map.of("2026-W43", Map.of("voter", "A"))));
    }
}
