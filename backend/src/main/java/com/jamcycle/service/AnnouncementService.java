package com.jamcycle.service;

import com.jamcycle.model.AnnouncementKind;
import com.jamcycle.model.GuildState;
import com.jamcycle.model.NotificationDecision;
import com.jamcycle.model.PendingAnnouncement;
import com.jamcycle.repository.GuildStateRepository;
import com.jamcycle.repository.GuildStateUpdate;
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Sends competition announcements through the {@link NotificationChannel}.
 * <p>
 * Tenants that require confirmation get the text parked as a pending announcement. An operator
 * approval publishes it, a denial drops it, and otherwise the scheduler tick publishes it once the
 * confirmation deadline has passed. Notification failures are logged and never fail the caller.
 */
@Service
@RequiredArgsConstructor
public class AnnouncementService {

    private static final Logger log = LoggerFactory.getLogger(AnnouncementService.class);

    private final NotificationChannel notificationChannel;
    private final GuildStateRepository guildStateRepository;
    private final Clock clock;

    private final Set<CompletableFuture<?>> inFlight = ConcurrentHashMap.newKeySet();

    public void announce(GuildState state, AnnouncementKind kind, String text) {
        String tenantId = state.tenantId();
        if (!state.config().confirmationRequired()) {
            publish(tenantId, kind, text);
            return;
        }

        if (state.pendingAnnouncement() != null) {
            // one slot: flush the older one before parking the new text
            publish(tenantId, state.pendingAnnouncement().kind(), state.pendingAnnouncement().text());
        }
        Instant deadline = clock.instant().plusSeconds(state.config().confirmationTimeoutSeconds());
        PendingAnnouncement pending = new PendingAnnouncement(kind, text, deadline);
        guildStateRepository.save(tenantId, GuildStateUpdate.create().pendingAnnouncement(pending));
        log.info("Announcement {} for tenant {} awaits confirmation until {}", kind, tenantId, deadline);

        requestDecision(tenantId, AnnouncementKind.CONFIRMATION_REQUEST, text)
                .thenAccept(decision -> onConfirmation(tenantId, pending, decision));
    }

    /**
     * Publishes the parked announcement once its confirmation window has elapsed.
     *
     * @return true if an announcement was published
     */
    public boolean publishDueAnnouncement(GuildState state, Instant now) {
        PendingAnnouncement pending = state.pendingAnnouncement();
        if (pending == null || !pending.isDue(now)) {
            return false;
        }
        guildStateRepository.save(state.tenantId(), clearPending());
        log.info("Confirmation window for {} on tenant {} elapsed; publishing", pending.kind(), state.tenantId());
        publish(state.tenantId(), pending.kind(), pending.text());
        return true;
    }

    /**
     * Publishes immediately, bypassing confirmation.
     */
    public void publish(String tenantId, AnnouncementKind kind, String text) {
        try {
            notificationChannel.publish(tenantId, kind, text);
        } catch (RuntimeException ex) {
            log.warn("Failed to publish {} for tenant {}: {}", kind, tenantId, ex.getMessage());
        }
    }

    /**
     * Asks the operators for a decision. Failures and cancellations read as
     * {@link NotificationDecision#TIMEOUT}.
     */
    public CompletableFuture<NotificationDecision> requestDecision(String tenantId, AnnouncementKind kind, String text) {
        CompletableFuture<NotificationDecision> request;
        try {
            request = notificationChannel.requestDecision(tenantId, kind, text);
        } catch (RuntimeException ex) {
            log.warn("Failed to request {} decision for tenant {}: {}", kind, tenantId, ex.getMessage());
            return CompletableFuture.completedFuture(NotificationDecision.TIMEOUT);
        }
        if (request == null) {
            return CompletableFuture.completedFuture(NotificationDecision.TIMEOUT);
        }
        inFlight.add(request);
        request.whenComplete((decision, error) -> inFlight.remove(request));
        return request.handle((decision, error) -> {
            if (error != null) {
                log.debug("Decision request {} for tenant {} ended without answer: {}", kind, tenantId, error.getMessage());
                return NotificationDecision.TIMEOUT;
            }
            return decision == null ? NotificationDecision.TIMEOUT : decision;
        });
    }

    public int inFlightRequests() {
        return inFlight.size();
    }

    @PreDestroy
    public void cancelPendingRequests() {
        if (!inFlight.isEmpty()) {
            log.info("Cancelling {} pending confirmation request(s)", inFlight.size());
        }
        for (CompletableFuture<?> request : Set.copyOf(inFlight)) {
            request.cancel(true);
        }
        inFlight.clear();
    }

    private void onConfirmation(String tenantId, PendingAnnouncement pending, NotificationDecision decision) {
        if (decision == NotificationDecision.TIMEOUT) {
            return;
        }
        try {
            GuildState current = guildStateRepository.load(tenantId);
            if (!pending.equals(current.pendingAnnouncement())) {
                log.debug("Pending {} for tenant {} already handled", pending.kind(), tenantId);
                return;
            }
            guildStateRepository.save(tenantId, clearPending());
            if (decision == NotificationDecision.APPROVE) {
                publish(tenantId, pending.kind(), pending.text());
            } else {
                log.info("Operator denied {} announcement for tenant {}", pending.kind(), tenantId);
            }
        } catch (RuntimeException ex) {
            log.warn("Failed to apply {} decision for tenant {}: {}", decision, tenantId, ex.getMessage());
        }
    }

    private static GuildStateUpdate clearPending() {
        return GuildStateUpdate.create().pendingAnnouncement(null);
    }
}
