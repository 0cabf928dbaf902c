package com.jamcycle.command;

import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Closed set of operator actions. Anything unrecognised maps to {@link #UNKNOWN}.
 */
public enum CommandKind {
    SET_PHASE(false, "set_phase"),
    SET_THEME(false, "set_theme", "update_theme"),
    CANCEL_WEEK(false, "cancel_week"),
    ENABLE_AUTOMATION(false, "enable_automation"),
    DISABLE_AUTOMATION(false, "disable_automation"),
    TOGGLE_AUTOMATION(false, "toggle_automation"),
    START_NEW_WEEK(false, "start_new_week"),
    CLEAR_SUBMISSIONS(true, "clear_submissions"),
    REMOVE_SUBMISSION(true, "remove_submission"),
    REMOVE_VOTE(true, "remove_vote"),
    RESET_WEEK(true, "reset_week"),
    FORCE_VOTING(false, "force_voting"),
    NEXT_PHASE(false, "next_phase"),
    ANNOUNCE_WINNERS(false, "announce_winners", "announce_winner"),
    BULK_CONFIG_UPDATE(false, "bulk_config_update", "update_config"),
    EXPORT_BACKUP(false, "export_backup", "backup_data"),
    RESTORE_BACKUP(true, "restore_backup"),
    SET_SAFE_MODE(false, "set_safe_mode"),
    UNKNOWN(false);

    private static final Map<String, CommandKind> BY_ACTION = new HashMap<>();

    static {
        for (CommandKind kind : values()) {
            for (String action : kind.actions) {
                BY_ACTION.put(action, kind);
            }
        }
    }

    private final boolean destructive;
    private final List<String> actions;

    CommandKind(boolean destructive, String... actions) {
        this.destructive = destructive;
        this.actions = List.of(actions);
    }

    /**
     * Destructive kinds are refused while the tenant has safe mode enabled.
     */
    public boolean isDestructive() {
        return destructive;
    }

    public String wireName() {
        return actions.isEmpty() ? "unknown" : actions.get(0);
    }

    public static CommandKind fromAction(String action) {
        if (action == null) {
            return UNKNOWN;
        }
        return BY_ACTION.getOrDefault(normalize(action), UNKNOWN);
    }

    /**
     * Lower-cases and maps {@code -} and spaces to {@code _}.
     */
    public static String normalize(String action) {
        return action.trim()
                .toLowerCase(Locale.ROOT)
                .replace('-', '_')
                .replace(' ', '_');
    }
}
