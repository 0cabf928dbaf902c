package com.jamcycle.repository;

import com.jamcycle.model.ArchivedCycle;
import com.jamcycle.model.CompetitionPhase;
import com.jamcycle.model.FaceOff;
import com.jamcycle.model.PendingAnnouncement;
import com.jamcycle.model.Team;
import com.jamcycle.model.VoteTally;
import com.jamcycle.model.WinnerRecord;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Field changes written to the state store as one update.
 */
public final class GuildStateUpdate {

    private final Map<String, String> fields = new LinkedHashMap<>();

    private GuildStateUpdate() {
    }

    public static GuildStateUpdate create() {
        return new GuildStateUpdate();
    }

    public GuildStateUpdate phase(CompetitionPhase phase) {
        return put(GuildFields.CURRENT_PHASE, phase.wireValue());
    }

    public GuildStateUpdate theme(String theme) {
        return put(GuildFields.CURRENT_THEME, theme);
    }

    public GuildStateUpdate cycleKey(String cycleKey) {
        return put(GuildFields.CYCLE_KEY, cycleKey);
    }

    public GuildStateUpdate weekCancelled(boolean weekCancelled) {
        return put(GuildFields.WEEK_CANCELLED, Boolean.toString(weekCancelled));
    }

    public GuildStateUpdate winnerAnnounced(boolean winnerAnnounced) {
        return put(GuildFields.WINNER_ANNOUNCED, Boolean.toString(winnerAnnounced));
    }

    public GuildStateUpdate token(String token) {
        return put(GuildFields.LAST_ANNOUNCEMENT, token);
    }

    public GuildStateUpdate automationEnabled(boolean enabled) {
        return put(GuildFields.AUTO_ANNOUNCE, Boolean.toString(enabled));
    }

    public GuildStateUpdate themeGenerationDone(boolean done) {
        return put(GuildFields.THEME_GENERATION_DONE, Boolean.toString(done));
    }

    public GuildStateUpdate nextWeekTheme(String theme) {
        return put(GuildFields.NEXT_WEEK_THEME, theme);
    }

    public GuildStateUpdate safeModeEnabled(boolean enabled) {
        return put(GuildFields.SAFE_MODE_ENABLED, Boolean.toString(enabled));
    }

    public GuildStateUpdate submissions(Map<String, Team> submissions) {
        return put(GuildFields.SUBMISSIONS, GuildStateCodec.writeJson(submissions));
    }

    public GuildStateUpdate votingResults(Map<String, VoteTally> votingResults) {
        return put(GuildFields.VOTING_RESULTS, GuildStateCodec.writeJson(votingResults));
    }

    public GuildStateUpdate individualVotes(Map<String, Map<String, String>> individualVotes) {
        return put(GuildFields.INDIVIDUAL_VOTES, GuildStateCodec.writeJson(individualVotes));
    }

    public GuildStateUpdate weeklyWinners(Map<String, WinnerRecord> weeklyWinners) {
        return put(GuildFields.WEEKLY_WINNERS, GuildStateCodec.writeJson(weeklyWinners));
    }

    public GuildStateUpdate archive(Map<String, ArchivedCycle> archive) {
        return put(GuildFields.CYCLE_ARCHIVE, GuildStateCodec.writeJson(archive));
    }

    public GuildStateUpdate faceOff(FaceOff faceOff) {
        if (!faceOff.active()) {
            put(GuildFields.FACE_OFF_ACTIVE, Boolean.FALSE.toString());
            put(GuildFields.FACE_OFF_TEAMS, null);
            put(GuildFields.FACE_OFF_DEADLINE, null);
            return put(GuildFields.FACE_OFF_RESULTS, null);
        }
        put(GuildFields.FACE_OFF_ACTIVE, Boolean.TRUE.toString());
        put(GuildFields.FACE_OFF_TEAMS, GuildStateCodec.writeJson(faceOff.teams()));
        put(GuildFields.FACE_OFF_DEADLINE, GuildStateCodec.writeInstant(faceOff.deadline()));
        return faceOffTally(faceOff.tally());
    }

    public GuildStateUpdate faceOffTally(VoteTally tally) {
        return put(GuildFields.FACE_OFF_RESULTS, GuildStateCodec.writeJson(tally));
    }

    public GuildStateUpdate pendingAnnouncement(PendingAnnouncement pendingAnnouncement) {
        return put(GuildFields.PENDING_ANNOUNCEMENT, GuildStateCodec.writeJson(pendingAnnouncement));
    }

    public GuildStateUpdate restartNotBefore(Instant restartNotBefore) {
        return put(GuildFields.RESTART_NOT_BEFORE, GuildStateCodec.writeInstant(restartNotBefore));
    }

    /**
     * Sets a field by name; a {@code null} value removes it.
     */
    public GuildStateUpdate put(String field, String value) {
        fields.put(field, value);
        return this;
    }

    public Map<String, String> fields() {
        return Collections.unmodifiableMap(fields);
    }

    public boolean isEmpty() {
        return fields.isEmpty();
    }
}
