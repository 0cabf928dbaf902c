package com.jamcycle.command;

import com.jamcycle.model.CompetitionPhase;
import com.jamcycle.model.GuildState;
import com.jamcycle.model.PhaseIntent;
import com.jamcycle.repository.GuildStateRepository;
import com.jamcycle.repository.GuildStateUpdate;
import com.jamcycle.service.CompetitionCalendar;
import com.jamcycle.service.PhaseTransitionService;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.Optional;

/**
 * Operator commands that steer the phase, theme and automation of the current cycle.
 * Phase changes are guarded by the phase read before dispatch.
 */
@Component
@RequiredArgsConstructor
public class CompetitionCommands {

    private final GuildStateRepository guildStateRepository;
    private final PhaseTransitionService phaseTransitionService;

    public CommandOutcome setPhase(CommandContext context) {
        Optional<String> requested = context.stringParam("phase");
        if (requested.isEmpty()) {
            return CommandOutcome.failed("missing parameter: phase");
        }
        Optional<CompetitionPhase> phase = CompetitionPhase.fromWire(requested.get());
        if (phase.isEmpty()) {
            return CommandOutcome.failed("invalid phase: " + requested.get());
        }
        return changePhase(context, GuildStateUpdate.create().phase(phase.get()));
    }

    public CommandOutcome setTheme(CommandContext context) {
        Optional<String> theme = context.stringParam("theme");
        if (theme.isEmpty()) {
            return CommandOutcome.failed("missing parameter: theme");
        }
        guildStateRepository.save(context.tenantId(), GuildStateUpdate.create().theme(theme.get()));
        return CommandOutcome.completed(Map.of("theme", theme.get()));
    }

    public CommandOutcome cancelWeek(CommandContext context) {
        return changePhase(context, GuildStateUpdate.create()
                .phase(CompetitionPhase.CANCELLED)
                .weekCancelled(true));
    }

    public CommandOutcome enableAutomation(CommandContext context) {
        return setAutomation(context, true);
    }

    public CommandOutcome disableAutomation(CommandContext context) {
        return setAutomation(context, false);
    }

    public CommandOutcome toggleAutomation(CommandContext context) {
        return setAutomation(context, !context.state().automationEnabled());
    }

    public CommandOutcome startNewWeek(CommandContext context) {
        String cycleKey = CompetitionCalendar.cycleKeyFor(context.now());
        String theme = context.stringParam("theme").orElse(null);
        GuildState state = context.state();
        if (!phaseTransitionService.startSubmission(state, cycleKey,
                PhaseIntent.START_SUBMISSION.tokenFor(cycleKey), context.now(), theme)) {
            return CommandOutcome.concurrentChange();
        }
        return CommandOutcome.completed(Map.of("cycle_key", cycleKey));
    }

    public CommandOutcome forceVoting(CommandContext context) {
        return changePhase(context, GuildStateUpdate.create().phase(CompetitionPhase.VOTING));
    }

    /**
     * submission -> voting -> ended -> new cycle in submission.
     */
    public CommandOutcome nextPhase(CommandContext context) {
        return switch (context.state().phase()) {
            case SUBMISSION -> forceVoting(context);
            case VOTING -> changePhase(context, GuildStateUpdate.create().phase(CompetitionPhase.ENDED));
            default -> startNewWeek(context);
        };
    }

    public CommandOutcome announceWinners(CommandContext context) {
        GuildState state = context.state();
        if (state.faceOff().active()) {
            return CommandOutcome.failed("a face-off is in progress");
        }
        if (state.cycle().winnerAnnounced()) {
            return CommandOutcome.failed("winner already announced for this cycle");
        }
        String cycleKey = state.cycle().cycleKey() != null
                ? state.cycle().cycleKey()
                : CompetitionCalendar.cycleKeyFor(context.now());
        if (!phaseTransitionService.announceWinner(state, PhaseIntent.ANNOUNCE_WINNER.tokenFor(cycleKey), context.now())) {
            return CommandOutcome.concurrentChange();
        }
        return CommandOutcome.completed();
    }

    private CommandOutcome setAutomation(CommandContext context, boolean enabled) {
        guildStateRepository.save(context.tenantId(), GuildStateUpdate.create().automationEnabled(enabled));
        return CommandOutcome.completed(Map.of("automation_enabled", enabled));
    }

    private CommandOutcome changePhase(CommandContext context, GuildStateUpdate update) {
        if (!guildStateRepository.saveIfPhaseMatches(context.tenantId(), context.state().phase(), update)) {
            return CommandOutcome.concurrentChange();
        }
        return CommandOutcome.completed();
    }
}
