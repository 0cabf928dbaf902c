package com.jamcycle.service;

import com.jamcycle.config.JamCycleProperties;
import com.jamcycle.model.AnnouncementKind;
import com.jamcycle.model.GuildState;
import com.jamcycle.model.NotificationDecision;
import com.jamcycle.model.PendingAnnouncement;
import com.jamcycle.repository.GuildFields;
import com.jamcycle.repository.GuildStateRepository;
import com.jamcycle.repository.GuildStateUpdate;
import com.jamcycle.repository.InMemoryGuildStateStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class AnnouncementServiceTest {

    private static final String TENANT = "guild-1";
    private static final Instant NOW = Instant.parse("2026-10-23T12:05:00Z");

    private NotificationChannel channel;
    private GuildStateRepository repository;
    private AnnouncementService service;

    @BeforeEach
    void setUp() {
        channel = mock(NotificationChannel.class);
        repository = new GuildStateRepository(new InMemoryGuildStateStore(), new JamCycleProperties());
        service = new AnnouncementService(channel, repository, Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Test
    void publishesDirectlyWithoutConfirmation() {
        GuildState state = stateWith(GuildStateUpdate.create());

        service.announce(state, AnnouncementKind.VOTING_START, "Voting is open");

        verify(channel).publish(TENANT, AnnouncementKind.VOTING_START, "Voting is open");
        verify(channel, never()).requestDecision(any(), any(), any());
    }

    @Test
    void publishFailureIsSwallowed() {
        doThrow(new IllegalStateException("chat offline")).when(channel).publish(anyString(), any(), anyString());

        assertDoesNotThrow(() -> service.publish(TENANT, AnnouncementKind.WINNER, "A wins"));
    }

    @Test
    void confirmationParksAnnouncementUntilAnswered() {
        CompletableFuture<NotificationDecision> answer = new CompletableFuture<>();
        when(channel.requestDecision(eq(TENANT), eq(AnnouncementKind.CONFIRMATION_REQUEST), anyString())).thenReturn(answer);
        GuildState state = confirmingState();

        service.announce(state, AnnouncementKind.WINNER, "A wins");

        PendingAnnouncement pending = repository.load(TENANT).pendingAnnouncement();
        assertNotNull(pending);
        assertEquals(AnnouncementKind.WINNER, pending.kind());
        assertEquals(NOW.plusSeconds(600), pending.deadline());
        assertEquals(1, service.inFlightRequests());
        verify(channel, never()).publish(anyString(), any(), anyString());

        answer.complete(NotificationDecision.APPROVE);

        assertNull(repository.load(TENANT).pendingAnnouncement());
        assertEquals(0, service.inFlightRequests());
        verify(channel).publish(TENANT, AnnouncementKind.WINNER, "A wins");
    }

    @Test
    void deniedAnnouncementIsDropped() {
        when(channel.requestDecision(eq(TENANT), eq(AnnouncementKind.CONFIRMATION_REQUEST), anyString()))
                .thenReturn(CompletableFuture.completedFuture(NotificationDecision.DENY));

        service.announce(confirmingState(), AnnouncementKind.WINNER, "A wins");

        assertNull(repository.load(TENANT).pendingAnnouncement());
        verify(channel, never()).publish(anyString(), any(), anyString());
    }

    @Test
    void timedOutAnnouncementWaitsForDeadline() {
        when(channel.requestDecision(eq(TENANT), eq(AnnouncementKind.CONFIRMATION_REQUEST), anyString()))
                .thenReturn(CompletableFuture.completedFuture(NotificationDecision.TIMEOUT));
        service.announce(confirmingState(), AnnouncementKind.WINNER, "A wins");
        GuildState parked = repository.load(TENANT);

        assertFalse(service.publishDueAnnouncement(parked, NOW.plusSeconds(599)));
        assertTrue(service.publishDueAnnouncement(parked, NOW.plusSeconds(600)));

        assertNull(repository.load(TENANT).pendingAnnouncement());
        verify(channel).publish(TENANT, AnnouncementKind.WINNER, "A wins");
    }

    @Test
    void newAnnouncementFlushesOlderPendingOne() {
        when(channel.requestDecision(eq(TENANT), eq(AnnouncementKind.CONFIRMATION_REQUEST), anyString()))
                .thenReturn(CompletableFuture.completedFuture(NotificationDecision.TIMEOUT));
        service.announce(confirmingState(), AnnouncementKind.VOTING_REMINDER, "Vote!");

        service.announce(repository.load(TENANT), AnnouncementKind.WINNER, "A wins");

        verify(channel).publish(TENANT, AnnouncementKind.VOTING_REMINDER, "Vote!");
        assertEquals(AnnouncementKind.WINNER, repository.load(TENANT).pendingAnnouncement().kind());
    }

    @Test
    void failedDecisionRequestReadsAsTimeout() {
        when(channel.requestDecision(anyString(), any(), anyString()))
                .thenReturn(CompletableFuture.failedFuture(new IllegalStateException("no operators")));

        NotificationDecision decision = service.requestDecision(TENANT, AnnouncementKind.THEME_PROPOSAL, "Theme?").join();

        assertEquals(NotificationDecision.TIMEOUT, decision);
    }

    @Test
    void shutdownCancelsOutstandingRequests() {
        CompletableFuture<NotificationDecision> answer = new CompletableFuture<>();
        when(channel.requestDecision(anyString(), any(), anyString())).thenReturn(answer);

        CompletableFuture<NotificationDecision> decision =
                service.requestDecision(TENANT, AnnouncementKind.THEME_PROPOSAL, "Theme?");
        service.cancelPendingRequests();

        assertTrue(answer.isCancelled());
        assertEquals(NotificationDecision.TIMEOUT, decision.join());
        assertEquals(0, service.inFlightRequests());
    }

    private GuildState confirmingState() {
        return stateWith(GuildStateUpdate.create()
                .put(GuildFields.REQUIRE_CONFIRMATION, "true")
                .put(GuildFields.CONFIRMATION_TIMEOUT_SECONDS, "600"));
    }

    private GuildState stateWith(GuildStateUpdate update) {
        repository.save(TENANT, update);
        return repository.load(TENANT);
    }
}
