package com.jamcycle.model;

/**
 * Transition the phase scheduler can ask for on a tick.
 */
public enum PhaseIntent {
    START_SUBMISSION("submission_start"),
    START_VOTING("voting_start"),
    CANCEL_FOR_LOW_PARTICIPATION("week_cancelled"),
    REMINDER_SUBMISSION("submission_reminder"),
    REMINDER_VOTING("voting_reminder"),
    ANNOUNCE_WINNER("winner"),
    GENERATE_NEXT_THEME("theme_generation"),
    RESOLVE_FACE_OFF("face_off_resolved"),
    ENTER_INACTIVE("inactive");

    private final String tokenPrefix;

    PhaseIntent(String tokenPrefix) {
        this.tokenPrefix = tokenPrefix;
    }

    public String tokenFor(String cycleKey) {
        return tokenPrefix + "_" + cycleKey;
    }
}
