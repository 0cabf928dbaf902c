package com.jamcycle.service;

import com.jamcycle.config.JamCycleProperties;
import com.jamcycle.model.AnnouncementKind;
import com.jamcycle.model.CompetitionPhase;
import com.jamcycle.model.FaceOff;
import com.jamcycle.model.GuildState;
import com.jamcycle.model.VoteTally;
import com.jamcycle.repository.GuildStateRepository;
import com.jamcycle.repository.GuildStateUpdate;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.Random;

/**
 * Tie-break vote between the leading teams of a cycle.
 * <p>
 * The face-off lives entirely in the state store: {@code Inactive -> Active(teams, deadline, tally)
 * -> Inactive}. The deadline is checked on every scheduler tick, so a restart never drops it.
 * Once due, resolution always yields exactly one winner; a tie that persists is broken by the
 * injected {@link Random}.
 */
@Service
@RequiredArgsConstructor
public class FaceOffController {

    private static final Logger log = LoggerFactory.getLogger(FaceOffController.class);

    private final JamCycleProperties jamCycleProperties;
    private final VoteResolver voteResolver;
    private final Random competitionRandom;
    private final GuildStateRepository guildStateRepository;
    private final AnnouncementService announcementService;

    /**
     * Active face-off between {@code tiedTeams}, ending {@code face-off.duration-hours} after {@code now}.
     */
    public FaceOff open(List<String> tiedTeams, Instant now) {
        if (tiedTeams == null || tiedTeams.size() < 2) {
            throw new IllegalArgumentException("face-off needs at least two teams");
        }
        Duration duration = Duration.ofHours(Math.max(1, jamCycleProperties.getFaceOff().getDurationHours()));
        return new FaceOff(true, tiedTeams, now.plus(duration), VoteTally.empty().withTeams(tiedTeams));
    }

    /**
     * Persists a new face-off together with {@code token}, guarded by the token currently stored,
     * then notifies the tenant. A failed notification does not undo the face-off.
     *
     * @return the face-off, or empty if another writer changed the token first
     */
    public Optional<FaceOff> start(GuildState state, List<String> tiedTeams, Instant now, String token) {
        FaceOff faceOff = open(tiedTeams, now);
        GuildStateUpdate update = GuildStateUpdate.create()
                .faceOff(faceOff)
                .token(token);
        if (!guildStateRepository.saveIfTokenMatches(state.tenantId(), state.lastAnnouncementToken(), update)) {
            log.info("Face-off start for tenant {} lost a concurrent update; skipping", state.tenantId());
            return Optional.empty();
        }
        log.info("Face-off started for tenant {} between {} until {}", state.tenantId(), tiedTeams, faceOff.deadline());
        announcementService.publish(state.tenantId(), AnnouncementKind.FACE_OFF_START,
                "It's a tie between " + String.join(", ", tiedTeams)
                        + ". Face-off voting is open until " + faceOff.deadline() + ".");
        return Optional.of(faceOff);
    }

    /**
     * Decides the face-off without side effects.
     *
     * @return empty while {@code now} is before the deadline, when no face-off is active, or when the
     *         face-off has no contenders
     */
    public Optional<FaceOffOutcome> decide(FaceOff faceOff, Instant now) {
        if (!faceOff.isDue(now)) {
            return Optional.empty();
        }
        VoteTally tally = faceOff.tally().withTeams(faceOff.teams());
        VoteResolver.Resolution resolution = voteResolver.resolve(tally);
        if (!resolution.hasWinner()) {
            return Optional.empty();
        }
        if (!resolution.tie()) {
            return Optional.of(new FaceOffOutcome(resolution.singleWinner(), resolution.winningVotes(), false,
                    resolution.winningTeams()));
        }
        List<String> contenders = resolution.winningTeams();
        String drawn = contenders.get(competitionRandom.nextInt(contenders.size()));
        return Optional.of(new FaceOffOutcome(drawn, resolution.winningVotes(), true, contenders));
    }

    /**
     * Resolves a due face-off: records the winner, clears the face-off, ends the cycle and defers the
     * next cycle start to the following UTC day, all in one guarded update.
     *
     * @return the outcome if the face-off was due and the update was written
     */
    public Optional<FaceOffOutcome> resolve(GuildState state, Instant now, String token) {
        FaceOff faceOff = state.faceOff();
        if (faceOff.isDue(now) && faceOff.teams().isEmpty()) {
            discardWithoutContenders(state, token);
            return Optional.empty();
        }
        Optional<FaceOffOutcome> decided = decide(faceOff, now);
        if (decided.isEmpty()) {
            return Optional.empty();
        }
        FaceOffOutcome outcome = decided.get();
        String cycleKey = CycleRecords.activeCycleKey(state, now);
        GuildStateUpdate update = GuildStateUpdate.create()
                .faceOff(FaceOff.inactive())
                .weeklyWinners(CycleRecords.withWinner(state, cycleKey, outcome.winner(), outcome.votes(), true, now))
                .winnerAnnounced(true)
                .phase(CompetitionPhase.ENDED)
                .restartNotBefore(CompetitionCalendar.startOfNextDay(now))
                .token(token);
        if (!guildStateRepository.saveIfTokenMatches(state.tenantId(), state.lastAnnouncementToken(), update)) {
            log.info("Face-off resolution for tenant {} lost a concurrent update; retrying next tick", state.tenantId());
            return Optional.empty();
        }
        log.info("Face-off for tenant {} resolved: winner={} votes={} drawnAtRandom={}",
                state.tenantId(), outcome.winner(), outcome.votes(), outcome.drawnAtRandom());
        return decided;
    }

    /**
     * Clears a due face-off that lists no teams. The cycle keeps its phase, so the regular winner
     * announcement runs again on its own token.
     */
    private void discardWithoutContenders(GuildState state, String token) {
        GuildStateUpdate update = GuildStateUpdate.create()
                .faceOff(FaceOff.inactive())
                .token(token);
        if (guildStateRepository.saveIfTokenMatches(state.tenantId(), state.lastAnnouncementToken(), update)) {
            log.warn("Face-off for tenant {} had no contenders; cleared without a winner", state.tenantId());
        }
    }

    public record FaceOffOutcome(
            String winner,
            int votes,
            boolean drawnAtRandom,
            List<String> contenders
    ) {
    }
}
