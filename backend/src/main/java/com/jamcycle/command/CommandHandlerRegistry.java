package com.jamcycle.command;

import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;

/**
 * Maps every {@link CommandKind} except {@link CommandKind#UNKNOWN} to its handler. Fails at
 * startup if a kind has no handler.
 */
@Component
public class CommandHandlerRegistry {

    private final Map<CommandKind, CommandHandler> handlers = new EnumMap<>(CommandKind.class);

    public CommandHandlerRegistry(
            CompetitionCommands competitionCommands,
            SubmissionCommands submissionCommands,
            SettingsCommands settingsCommands,
            BackupCommands backupCommands) {
        handlers.put(CommandKind.SET_PHASE, competitionCommands::setPhase);
        handlers.put(CommandKind.SET_THEME, competitionCommands::setTheme);
        handlers.put(CommandKind.CANCEL_WEEK, competitionCommands::cancelWeek);
        handlers.put(CommandKind.ENABLE_AUTOMATION, competitionCommands::enableAutomation);
        handlers.put(CommandKind.DISABLE_AUTOMATION, competitionCommands::disableAutomation);
        handlers.put(CommandKind.TOGGLE_AUTOMATION, competitionCommands::toggleAutomation);
        handlers.put(CommandKind.START_NEW_WEEK, competitionCommands::startNewWeek);
        handlers.put(CommandKind.FORCE_VOTING, competitionCommands::forceVoting);
        handlers.put(CommandKind.NEXT_PHASE, competitionCommands::nextPhase);
        handlers.put(CommandKind.ANNOUNCE_WINNERS, competitionCommands::announceWinners);
        handlers.put(CommandKind.CLEAR_SUBMISSIONS, submissionCommands::clearSubmissions);
        handlers.put(CommandKind.REMOVE_SUBMISSION, submissionCommands::removeSubmission);
        handlers.put(CommandKind.REMOVE_VOTE, submissionCommands::removeVote);
        handlers.put(CommandKind.RESET_WEEK, submissionCommands::resetWeek);
        handlers.put(CommandKind.BULK_CONFIG_UPDATE, settingsCommands::bulkConfigUpdate);
        handlers.put(CommandKind.SET_SAFE_MODE, settingsCommands::setSafeMode);
        handlers.put(CommandKind.EXPORT_BACKUP, backupCommands::exportBackup);
        handlers.put(CommandKind.RESTORE_BACKUP, backupCommands::restoreBackup);

        for (CommandKind kind : CommandKind.values()) {
            if (kind != CommandKind.UNKNOWN && !handlers.containsKey(kind)) {
                throw new IllegalStateException("No handler registered for command kind " + kind);
            }
        }
    }

    public Optional<CommandHandler> handlerFor(CommandKind kind) {
        return Optional.ofNullable(handlers.get(kind));
    }
}
