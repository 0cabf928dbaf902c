package com.jamcycle.service;

import com.jamcycle.model.AnnouncementKind;
import com.jamcycle.model.ArchivedCycle;
import com.jamcycle.model.CompetitionPhase;
import com.jamcycle.model.FaceOff;
import com.jamcycle.model.GuildState;
import com.jamcycle.model.NotificationDecision;
import com.jamcycle.model.TransitionIntent;
import com.jamcycle.model.VoteTally;
import com.jamcycle.repository.GuildStateRepository;
import com.jamcycle.repository.GuildStateUpdate;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Applies transition intents to the state store.
 * <p>
 * Each transition is a single update that also writes the intent's dedup token, guarded by the
 * token read before the update. If the operator panel changed the token in between, the
 * transition is dropped and re-evaluated on the next tick. Announcements are sent only after the
 * update was written.
 */
@Service
@RequiredArgsConstructor
public class PhaseTransitionService {

    private static final Logger log = LoggerFactory.getLogger(PhaseTransitionService.class);

    private final GuildStateRepository guildStateRepository;
    private final VoteResolver voteResolver;
    private final FaceOffController faceOffController;
    private final AnnouncementService announcementService;
    private final ThemeSource themeSource;

    /**
     * @return true if the transition was written
     */
    public boolean apply(GuildState state, TransitionIntent intent, Instant now) {
        boolean applied = switch (intent.intent()) {
            case START_SUBMISSION -> startSubmission(state, intent.cycleKey(), intent.token(), now);
            case START_VOTING -> startVoting(state, intent.token());
            case CANCEL_FOR_LOW_PARTICIPATION -> cancelForLowParticipation(state, intent.token());
            case REMINDER_SUBMISSION -> remind(state, intent.token(), AnnouncementKind.SUBMISSION_REMINDER,
                    "Last call! Submissions for \"" + themeOf(state) + "\" close tomorrow at noon UTC.");
            case REMINDER_VOTING -> remind(state, intent.token(), AnnouncementKind.VOTING_REMINDER,
                    "Voting closes tomorrow evening. Make your vote count!");
            case ANNOUNCE_WINNER -> announceWinner(state, intent.token(), now);
            case GENERATE_NEXT_THEME -> generateNextTheme(state, intent.token());
            case RESOLVE_FACE_OFF -> resolveFaceOff(state, intent.token(), now);
            case ENTER_INACTIVE -> enterInactive(state, intent.token());
        };
        if (applied) {
            log.info("Applied {} for tenant {} (token={})", intent.intent(), state.tenantId(), intent.token());
        }
        return applied;
    }

    /**
     * Archives the current cycle and opens a new one for {@code cycleKey}.
     *
     * @param theme theme of the new cycle; null keeps the proposed next theme or the current one
     */
    public boolean startSubmission(GuildState state, String cycleKey, String token, Instant now, String theme) {
        String newTheme = theme != null ? theme
                : state.nextWeekTheme() != null ? state.nextWeekTheme()
                : state.cycle().theme();
        GuildStateUpdate update = GuildStateUpdate.create()
                .cycleKey(cycleKey)
                .phase(CompetitionPhase.SUBMISSION)
                .theme(newTheme)
                .weekCancelled(false)
                .winnerAnnounced(false)
                .themeGenerationDone(false)
                .nextWeekTheme(null)
                .submissions(Map.of())
                .faceOff(FaceOff.inactive())
                .restartNotBefore(null)
                .token(token);
        Map<String, ArchivedCycle> archive = CycleRecords.withArchivedCurrentCycle(state, now);
        if (archive != null) {
            update.archive(archive);
        }
        clearBallotsFor(state, cycleKey, update);
        if (!write(state, update, token)) {
            return false;
        }
        announcementService.announce(state, AnnouncementKind.SUBMISSION_START,
                "A new week begins! This week's theme is \"" + newTheme + "\". Submissions are open until Friday noon UTC.");
        return true;
    }

    /**
     * A cycle restarted under a key that already holds votes starts from an empty tally.
     */
    private static void clearBallotsFor(GuildState state, String cycleKey, GuildStateUpdate update) {
        String faceOffKey = BallotService.FACE_OFF_VOTES_PREFIX + cycleKey;
        if (state.votingResults().containsKey(cycleKey) || state.votingResults().containsKey(faceOffKey)) {
            Map<String, VoteTally> results = new LinkedHashMap<>(state.votingResults());
            results.remove(cycleKey);
            results.remove(faceOffKey);
            update.votingResults(results);
        }
        if (state.individualVotes().containsKey(cycleKey) || state.individualVotes().containsKey(faceOffKey)) {
            Map<String, Map<String, String>> individualVotes = new LinkedHashMap<>(state.individualVotes());
            individualVotes.remove(cycleKey);
            individualVotes.remove(faceOffKey);
            update.individualVotes(individualVotes);
        }
    }

    /**
     * Resolves the current cycle's votes: records a single winner, starts a face-off on a tie, or
     * cancels the cycle when nobody entered.
     */
    public boolean announceWinner(GuildState state, String token, Instant now) {
        String cycleKey = CycleRecords.activeCycleKey(state, now);
        VoteResolver.Resolution resolution = voteResolver.resolve(state.tallyFor(cycleKey));

        if (!resolution.hasWinner()) {
            GuildStateUpdate update = GuildStateUpdate.create()
                    .phase(CompetitionPhase.CANCELLED)
                    .weekCancelled(true)
                    .token(token);
            if (!write(state, update, token)) {
                return false;
            }
            announcementService.announce(state, AnnouncementKind.NO_WINNER,
                    "No entries this week, so there is no winner. See you next week!");
            return true;
        }

        if (resolution.tie()) {
            return faceOffController.start(state, resolution.winningTeams(), now, token).isPresent();
        }

        String winner = resolution.singleWinner();
        GuildStateUpdate update = GuildStateUpdate.create()
                .weeklyWinners(CycleRecords.withWinner(state, cycleKey, winner, resolution.winningVotes(), false, now))
                .winnerAnnounced(true)
                .phase(CompetitionPhase.ENDED)
                .token(token);
        if (!write(state, update, token)) {
            return false;
        }
        announcementService.announce(state, AnnouncementKind.WINNER,
                "Congratulations to " + winner + " for winning \"" + themeOf(state) + "\" with "
                        + resolution.winningVotes() + " vote(s)!");
        return true;
    }

    private boolean startSubmission(GuildState state, String cycleKey, String token, Instant now) {
        return startSubmission(state, cycleKey, token, now, null);
    }

    private boolean startVoting(GuildState state, String token) {
        GuildStateUpdate update = GuildStateUpdate.create()
                .phase(CompetitionPhase.VOTING)
                .token(token);
        if (!write(state, update, token)) {
            return false;
        }
        announcementService.announce(state, AnnouncementKind.VOTING_START,
                "Submissions are closed. Voting is open for " + state.teamCount() + " team(s) until Sunday evening UTC.");
        return true;
    }

    private boolean cancelForLowParticipation(GuildState state, String token) {
        GuildStateUpdate update = GuildStateUpdate.create()
                .phase(CompetitionPhase.CANCELLED)
                .weekCancelled(true)
                .token(token);
        if (!write(state, update, token)) {
            return false;
        }
        announcementService.announce(state, AnnouncementKind.WEEK_CANCELLED,
                "This week is cancelled: " + state.teamCount() + " team(s) entered, "
                        + state.config().minTeamsRequired() + " needed. A new week starts Monday.");
        return true;
    }

    private boolean remind(GuildState state, String token, AnnouncementKind kind, String text) {
        if (!write(state, GuildStateUpdate.create().token(token), token)) {
            return false;
        }
        announcementService.announce(state, kind, text);
        return true;
    }

    private boolean generateNextTheme(GuildState state, String token) {
        Optional<String> proposal = themeSource.proposeTheme(state);
        GuildStateUpdate update = GuildStateUpdate.create()
                .themeGenerationDone(true)
                .token(token);
        proposal.ifPresent(update::nextWeekTheme);
        if (!write(state, update, token)) {
            return false;
        }
        if (proposal.isEmpty()) {
            log.info("No next theme available for tenant {}; current theme carries over", state.tenantId());
            return true;
        }

        String theme = proposal.get();
        String tenantId = state.tenantId();
        announcementService.requestDecision(tenantId, AnnouncementKind.THEME_PROPOSAL,
                        "Proposed theme for next week: \"" + theme + "\"")
                .thenAccept(decision -> {
                    if (decision == NotificationDecision.DENY) {
                        discardProposal(tenantId, theme);
                    }
                });
        return true;
    }

    private boolean resolveFaceOff(GuildState state, String token, Instant now) {
        Optional<FaceOffController.FaceOffOutcome> outcome = faceOffController.resolve(state, now, token);
        if (outcome.isEmpty()) {
            return false;
        }
        FaceOffController.FaceOffOutcome resolved = outcome.get();
        String suffix = resolved.drawnAtRandom()
                ? " The face-off was still tied, so the winner was drawn at random."
                : "";
        announcementService.announce(state, AnnouncementKind.WINNER,
                "Face-off result: " + resolved.winner() + " wins \"" + themeOf(state) + "\"!" + suffix);
        return true;
    }

    private boolean enterInactive(GuildState state, String token) {
        return write(state, GuildStateUpdate.create().phase(CompetitionPhase.INACTIVE).token(token), token);
    }

    private void discardProposal(String tenantId, String theme) {
        try {
            GuildState current = guildStateRepository.load(tenantId);
            if (theme.equals(current.nextWeekTheme())) {
                guildStateRepository.save(tenantId, GuildStateUpdate.create().nextWeekTheme(null));
                log.info("Operator denied theme proposal \"{}\" for tenant {}", theme, tenantId);
            }
        } catch (RuntimeException ex) {
            log.warn("Failed to discard theme proposal for tenant {}: {}", tenantId, ex.getMessage());
        }
    }

    private boolean write(GuildState state, GuildStateUpdate update, String token) {
        boolean written = guildStateRepository.saveIfTokenMatches(state.tenantId(), state.lastAnnouncementToken(), update);
        if (!written) {
            log.info("Transition {} for tenant {} lost a concurrent update; re-evaluating next tick", token, state.tenantId());
        }
        return written;
    }

    private static String themeOf(GuildState state) {
        return state.cycle().theme() == null ? "this week's theme" : state.cycle().theme();
    }
}
