package com.jamcycle.command;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class CommandKindTest {

    @Test
    void actionsAreNormalizedBeforeLookup() {
        assertEquals(CommandKind.RESET_WEEK, CommandKind.fromAction(" Reset-Week "));
        assertEquals(CommandKind.SET_SAFE_MODE, CommandKind.fromAction("set safe mode"));
    }

    @Test
    void legacyAliasesResolve() {
        assertEquals(CommandKind.SET_THEME, CommandKind.fromAction("update_theme"));
        assertEquals(CommandKind.ANNOUNCE_WINNERS, CommandKind.fromAction("announce_winner"));
        assertEquals(CommandKind.BULK_CONFIG_UPDATE, CommandKind.fromAction("update_config"));
        assertEquals(CommandKind.EXPORT_BACKUP, CommandKind.fromAction("backup_data"));
    }

    @Test
    void unrecognisedActionsAreUnknown() {
        assertEquals(CommandKind.UNKNOWN, CommandKind.fromAction("launch_rockets"));
        assertEquals(CommandKind.UNKNOWN, CommandKind.fromAction(null));
        assertEquals("unknown", CommandKind.UNKNOWN.wireName());
    }

    @Test
    void onlyDataDestroyingKindsAreDestructive() {
        assertTrue(CommandKind.CLEAR_SUBMISSIONS.isDestructive());
        assertTrue(CommandKind.REMOVE_SUBMISSION.isDestructive());
        assertTrue(CommandKind.REMOVE_VOTE.isDestructive());
        assertTrue(CommandKind.RESET_WEEK.isDestructive());
        assertTrue(CommandKind.RESTORE_BACKUP.isDestructive());
        assertFalse(CommandKind.SET_PHASE.isDestructive());
        assertFalse(CommandKind.SET_SAFE_MODE.isDestructive());
        assertFalse(CommandKind.EXPORT_BACKUP.isDestructive());
    }
}
