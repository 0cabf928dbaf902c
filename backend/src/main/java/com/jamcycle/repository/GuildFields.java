package com.jamcycle.repository;

import java.util.List;

/**
 * Field names of the per-tenant record in the state store.
 */
public final class GuildFields {

    public static final String CURRENT_PHASE = "current_phase";
    public static final String CURRENT_THEME = "current_theme";
    public static final String CYCLE_KEY = "cycle_key";
    public static final String WEEK_CANCELLED = "week_cancelled";
    public static final String WINNER_ANNOUNCED = "winner_announced";
    public static final String LAST_ANNOUNCEMENT = "last_announcement";
    public static final String AUTO_ANNOUNCE = "auto_announce";
    public static final String THEME_GENERATION_DONE = "theme_generation_done";
    public static final String NEXT_WEEK_THEME = "next_week_theme";

    public static final String BIWEEKLY_MODE = "biweekly_mode";
    public static final String MIN_TEAMS_REQUIRED = "min_teams_required";
    public static final String SAFE_MODE_ENABLED = "safe_mode_enabled";
    public static final String REQUIRE_CONFIRMATION = "require_confirmation";
    public static final String CONFIRMATION_TIMEOUT_SECONDS = "confirmation_timeout_seconds";

    public static final String SUBMISSIONS = "submissions";
    public static final String VOTING_RESULTS = "voting_results";
    public static final String INDIVIDUAL_VOTES = "individual_votes";
    public static final String WEEKLY_WINNERS = "weekly_winners";
    public static final String CYCLE_ARCHIVE = "cycle_archive";

    public static final String FACE_OFF_ACTIVE = "face_off_active";
    public static final String FACE_OFF_TEAMS = "face_off_teams";
    public static final String FACE_OFF_DEADLINE = "face_off_deadline";
    public static final String FACE_OFF_RESULTS = "face_off_results";

    public static final String PENDING_ANNOUNCEMENT = "pending_announcement";
    public static final String RESTART_NOT_BEFORE = "restart_not_before";

    /**
     * Settings the operator panel may change through a bulk configuration update.
     */
    public static final List<String> CONFIG_FIELDS = List.of(
            AUTO_ANNOUNCE,
            BIWEEKLY_MODE,
            MIN_TEAMS_REQUIRED,
            SAFE_MODE_ENABLED,
            REQUIRE_CONFIRMATION,
            CONFIRMATION_TIMEOUT_SECONDS
    );

    private GuildFields() {
    }
}
