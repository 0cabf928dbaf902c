package com.jamcycle.model;

/**
 * Competition settings of one tenant as persisted in the state store.
 */
public record TenantConfig(
        boolean biweeklyMode,
        int minTeamsRequired,
        boolean safeModeEnabled,
        boolean confirmationRequired,
        int confirmationTimeoutSeconds
) {
    public static final int DEFAULT_MIN_TEAMS_REQUIRED = 2;
    public static final int DEFAULT_CONFIRMATION_TIMEOUT_SECONDS = 1800;

    public TenantConfig {
        if (minTeamsRequired < 1) {
            minTeamsRequired = DEFAULT_MIN_TEAMS_REQUIRED;
        }
        if (confirmationTimeoutSeconds <= 0) {
            confirmationTimeoutSeconds = DEFAULT_CONFIRMATION_TIMEOUT_SECONDS;
        }
    }

    public static TenantConfig defaults() {
        return new TenantConfig(false, DEFAULT_MIN_TEAMS_REQUIRED, true, false, DEFAULT_CONFIRMATION_TIMEOUT_SECONDS);
    }
}
