package com.jamcycle.service;

import com.jamcycle.model.CompetitionCycle;
import com.jamcycle.model.CompetitionPhase;
import com.jamcycle.model.GuildState;
import com.jamcycle.model.PhaseIntent;
import com.jamcycle.model.TransitionIntent;
import org.springframework.stereotype.Component;

import java.time.DayOfWeek;
import java.time.Instant;
import java.time.ZonedDateTime;
import java.util.Optional;

/**
 * Decides which transition, if any, a tenant is due for at a given instant.
 * <p>
 * Only the current instant and the stored state are evaluated, never history, so missed ticks
 * can skip a reminder but cannot reorder phases. Every intent carries a dedup token
 * ({@code <intent>_<cycleKey>}); an intent whose token equals the stored
 * {@code last_announcement} is never emitted.
 */
@Component
public class PhaseScheduler {

    private static final int VOTING_START_HOUR = 12;
    private static final int REMINDER_HOUR = 18;
    private static final int WINNER_HOUR = 20;
    private static final int THEME_HOUR = 21;

    public Optional<TransitionIntent> evaluate(Instant now, GuildState state) {
        CompetitionCycle cycle = state.cycle();
        String periodKey = CompetitionCalendar.cycleKeyFor(now);

        // face-off deadlines are honoured in every week, automation or not
        if (state.faceOff().active()) {
            if (!state.faceOff().isDue(now)) {
                return Optional.empty();
            }
            return unlessApplied(TransitionIntent.of(PhaseIntent.RESOLVE_FACE_OFF,
                    CycleRecords.activeCycleKey(state, now)), cycle);
        }

        if (!CompetitionCalendar.isCompetitionWeek(now, state.config().biweeklyMode())) {
            if (state.phase() == CompetitionPhase.INACTIVE || state.phase() == CompetitionPhase.PAUSED) {
                return Optional.empty();
            }
            return unlessApplied(TransitionIntent.of(PhaseIntent.ENTER_INACTIVE, periodKey), cycle);
        }

        if (!state.automationEnabled()) {
            return Optional.empty();
        }

        ZonedDateTime time = CompetitionCalendar.utc(now);
        DayOfWeek day = time.getDayOfWeek();
        int hour = time.getHour();

        if (isSubmissionStartDue(now, day, state, periodKey)
                && (state.phase() != CompetitionPhase.SUBMISSION || cycle.weekCancelled())) {
            Optional<TransitionIntent> start = unlessApplied(TransitionIntent.of(PhaseIntent.START_SUBMISSION, periodKey), cycle);
            if (start.isPresent()) {
                return start;
            }
        }

        if (cycle.weekCancelled()) {
            return Optional.empty();
        }

        if (day == DayOfWeek.FRIDAY && hour >= VOTING_START_HOUR && state.phase() == CompetitionPhase.SUBMISSION) {
            PhaseIntent intent = state.teamCount() < state.config().minTeamsRequired()
                    ? PhaseIntent.CANCEL_FOR_LOW_PARTICIPATION
                    : PhaseIntent.START_VOTING;
            return unlessApplied(TransitionIntent.of(intent, periodKey), cycle);
        }

        if (day == DayOfWeek.THURSDAY && hour >= REMINDER_HOUR && state.phase() == CompetitionPhase.SUBMISSION) {
            return unlessApplied(TransitionIntent.of(PhaseIntent.REMINDER_SUBMISSION, periodKey), cycle);
        }

        if (day == DayOfWeek.SATURDAY && hour >= REMINDER_HOUR && state.phase() == CompetitionPhase.VOTING) {
            return unlessApplied(TransitionIntent.of(PhaseIntent.REMINDER_VOTING, periodKey), cycle);
        }

        if (day == DayOfWeek.SUNDAY && hour >= WINNER_HOUR
                && state.phase() == CompetitionPhase.VOTING && !cycle.winnerAnnounced()) {
            return unlessApplied(TransitionIntent.of(PhaseIntent.ANNOUNCE_WINNER, periodKey), cycle);
        }

        if (day == DayOfWeek.SUNDAY && hour >= THEME_HOUR && cycle.winnerAnnounced()
                && !state.themeGenerationDone() && state.nextWeekTheme() == null) {
            return unlessApplied(TransitionIntent.of(PhaseIntent.GENERATE_NEXT_THEME, periodKey), cycle);
        }

        return Optional.empty();
    }

    /**
     * Monday starts a cycle unless a face-off resolution deferred it; a deferred start fires once
     * its instant has passed, within the same ISO week.
     */
    private static boolean isSubmissionStartDue(Instant now, DayOfWeek day, GuildState state, String periodKey) {
        Instant notBefore = state.restartNotBefore();
        if (notBefore == null) {
            return day == DayOfWeek.MONDAY;
        }
        if (now.isBefore(notBefore)) {
            return false;
        }
        return day == DayOfWeek.MONDAY || periodKey.equals(CompetitionCalendar.cycleKeyFor(notBefore));
    }

    private static Optional<TransitionIntent> unlessApplied(TransitionIntent intent, CompetitionCycle cycle) {
        if (intent.token().equals(cycle.lastAnnouncementToken())) {
            return Optional.empty();
        }
        return Optional.of(intent);
    }
}
