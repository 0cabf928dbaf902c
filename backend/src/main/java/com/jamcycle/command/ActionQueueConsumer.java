package com.jamcycle.command;

import com.jamcycle.command.transport.AdminPanelTransport;
import com.jamcycle.command.transport.AdminPanelTransportException;
import com.jamcycle.command.transport.AdminPanelTransports;
import com.jamcycle.config.JamCycleProperties;
import com.jamcycle.model.TenantDescriptor;
import com.jamcycle.service.TenantDirectory;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;

/**
 * Polls every tenant's operator panel for commands, applies them and reports the results.
 * <p>
 * Each tenant uses exactly one transport per pass. A poll failure skips the tenant until the next
 * pass; a failing tenant never stops the others.
 */
@Service
@RequiredArgsConstructor
public class ActionQueueConsumer {

    private static final Logger log = LoggerFactory.getLogger(ActionQueueConsumer.class);
    private static final String POLL_CONCERN = "poll";

    private final JamCycleProperties jamCycleProperties;
    private final TenantDirectory tenantDirectory;
    private final AdminPanelTransports adminPanelTransports;
    private final CommandDispatcher commandDispatcher;
    private final ProcessedCommandCache processedCommandCache;
    private final CommandResultReporter commandResultReporter;
    private final StatusPublisher statusPublisher;
    private final ThrottledLogger throttledLogger;

    @Scheduled(
            fixedDelayString = "${jamcycle.admin-panel.poll-interval-ms:5000}",
            initialDelayString = "${jamcycle.admin-panel.initial-delay-ms:5000}")
    public void scheduledPoll() {
        if (!jamCycleProperties.getAdminPanel().isEnabled()) {
            return;
        }
        pollAll();
    }

    /**
     * @return number of commands processed across all tenants
     */
    public int pollAll() {
        int processed = 0;
        for (TenantDescriptor tenant : tenantDirectory.all()) {
            try {
                processed += pollTenant(tenant);
            } catch (RuntimeException ex) {
                log.error("Admin panel pass failed for tenant {}", tenant.id(), ex);
            }
        }
        return processed;
    }

    public int pollTenant(TenantDescriptor tenant) {
        Optional<AdminPanelTransport> transport = adminPanelTransports.primaryFor(tenant);
        if (transport.isEmpty()) {
            throttledLogger.warn(log, tenant.id(), POLL_CONCERN,
                    "No " + tenant.transport() + " transport available; commands are not being consumed");
            return 0;
        }

        List<AdminCommand> commands;
        try {
            commands = transport.get().poll(tenant);
        } catch (AdminPanelTransportException ex) {
            throttledLogger.warn(log, tenant.id(), POLL_CONCERN, "Command poll failed: " + ex.getMessage());
            return 0;
        }

        if (commands.isEmpty()) {
            statusPublisher.publishIfDue(tenant);
            return 0;
        }
        for (AdminCommand command : commands) {
            process(tenant, command);
            statusPublisher.publish(tenant);
        }
        return commands.size();
    }

    CommandResult process(TenantDescriptor tenant, AdminCommand command) {
        Optional<CommandResult> previous = processedCommandCache.find(tenant.id(), command.id());
        CommandResult result;
        if (previous.isPresent()) {
            log.info("Command {} for tenant {} was already processed; re-reporting its result", command.id(), tenant.id());
            result = previous.get();
        } else {
            result = commandDispatcher.dispatch(tenant, command);
            processedCommandCache.remember(tenant.id(), result);
        }
        commandResultReporter.report(tenant, result);
        return result;
    }
}
