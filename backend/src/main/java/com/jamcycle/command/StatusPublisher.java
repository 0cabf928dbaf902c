package com.jamcycle.command;

import com.jamcycle.command.transport.AdminPanelTransport;
import com.jamcycle.command.transport.AdminPanelTransportException;
import com.jamcycle.command.transport.AdminPanelTransports;
import com.jamcycle.config.JamCycleProperties;
import com.jamcycle.model.GuildState;
import com.jamcycle.model.TenantDescriptor;
import com.jamcycle.repository.GuildStateRepository;
import com.jamcycle.repository.GuildStateStoreException;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Pushes the competition status of a tenant to its operator panel, after each command and on a
 * fixed cadence when idle. Failures are logged through {@link ThrottledLogger}.
 */
@Component
@RequiredArgsConstructor
public class StatusPublisher {

    private static final Logger log = LoggerFactory.getLogger(StatusPublisher.class);
    private static final String CONCERN = "status-publish";

    private final GuildStateRepository guildStateRepository;
    private final AdminPanelTransports adminPanelTransports;
    private final ThrottledLogger throttledLogger;
    private final JamCycleProperties jamCycleProperties;
    private final Clock clock;

    private final Map<String, Instant> lastPublished = new ConcurrentHashMap<>();

    public boolean publish(TenantDescriptor tenant) {
        Instant now = clock.instant();
        Optional<AdminPanelTransport> transport = adminPanelTransports.primaryFor(tenant);
        if (transport.isEmpty()) {
            throttledLogger.warn(log, tenant.id(), CONCERN, "Status not published: no transport available");
            return false;
        }
        try {
            GuildState state = guildStateRepository.load(tenant.id());
            transport.get().publishStatus(tenant, StatusSnapshot.of(tenant, state, now));
            lastPublished.put(tenant.id(), now);
            return true;
        } catch (AdminPanelTransportException | GuildStateStoreException ex) {
            throttledLogger.warn(log, tenant.id(), CONCERN, "Status not published: " + ex.getMessage());
            return false;
        }
    }

    /**
     * Publishes unless a snapshot went out within {@code status-interval-seconds}.
     */
    public boolean publishIfDue(TenantDescriptor tenant) {
        Instant last = lastPublished.get(tenant.id());
        long intervalSeconds = jamCycleProperties.getAdminPanel().getStatusIntervalSeconds();
        if (last != null && clock.instant().isBefore(last.plusSeconds(intervalSeconds))) {
            return false;
        }
        return publish(tenant);
    }
}
