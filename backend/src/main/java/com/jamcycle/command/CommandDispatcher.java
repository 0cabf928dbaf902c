package com.jamcycle.command;

import com.jamcycle.model.GuildState;
import com.jamcycle.model.TenantDescriptor;
import com.jamcycle.repository.GuildStateRepository;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.Optional;

/**
 * Applies one operator command to one tenant and turns the outcome into a result record.
 * Never throws: malformed, unknown, refused and failing commands all come back as {@code failed}.
 */
@Service
@RequiredArgsConstructor
public class CommandDispatcher {

    private static final Logger log = LoggerFactory.getLogger(CommandDispatcher.class);

    public static final String MISSING_ACTION = "malformed command: missing action";
    public static final String UNKNOWN_ACTION = "unknown action";
    public static final String SAFE_MODE_REJECTION = "blocked by safe mode: %s is a destructive action";

    private final GuildStateRepository guildStateRepository;
    private final CommandHandlerRegistry commandHandlerRegistry;
    private final Clock clock;

    public CommandResult dispatch(TenantDescriptor tenant, AdminCommand command) {
        Instant now = clock.instant();
        if (!command.hasAction()) {
            log.warn("Command {} for tenant {} has no action", command.id(), tenant.id());
            return CommandResult.failed(command.id(), MISSING_ACTION, now);
        }

        CommandKind kind = CommandKind.fromAction(command.action());
        Optional<CommandHandler> handler = commandHandlerRegistry.handlerFor(kind);
        if (handler.isEmpty()) {
            log.warn("Unknown action '{}' in command {} for tenant {}", command.action(), command.id(), tenant.id());
            return CommandResult.failed(command.id(), UNKNOWN_ACTION, now);
        }

        try {
            GuildState state = guildStateRepository.load(tenant.id());
            if (kind.isDestructive() && state.config().safeModeEnabled()) {
                log.warn("Command {} ({}) for tenant {} refused: safe mode is enabled", command.id(), kind.wireName(), tenant.id());
                return CommandResult.failed(command.id(), String.format(SAFE_MODE_REJECTION, kind.wireName()), now);
            }

            CommandOutcome outcome = handler.get().handle(new CommandContext(tenant, command, kind, state, now));
            if (!outcome.success()) {
                log.warn("Command {} ({}) for tenant {} failed: {}", command.id(), kind.wireName(), tenant.id(), outcome.error());
                return CommandResult.failed(command.id(), outcome.error(), now);
            }
            log.info("Command {} ({}) for tenant {} completed", command.id(), kind.wireName(), tenant.id());
            return CommandResult.completed(command.id(), now, outcome.payload());
        } catch (RuntimeException ex) {
            log.error("Command {} ({}) for tenant {} raised an error", command.id(), kind.wireName(), tenant.id(), ex);
            String message = ex.getMessage() == null || ex.getMessage().isBlank()
                    ? ex.getClass().getSimpleName()
                    : ex.getMessage();
            return CommandResult.failed(command.id(), message, now);
        }
    }
}
