package com.jamcycle.service;

import com.jamcycle.model.AnnouncementKind;
import com.jamcycle.model.NotificationDecision;

import java.util.concurrent.CompletableFuture;

/**
 * Outbound announcements and operator confirmations. The chat front end is an external collaborator;
 * implementations must not block the calling loop.
 */
public interface NotificationChannel {

    /**
     * Publishes an announcement to the tenant's members.
     */
    void publish(String tenantId, AnnouncementKind kind, String text);

    /**
     * Asks the tenant's operators to approve or deny an action. The future completes with
     * {@link NotificationDecision#TIMEOUT} when nobody answers in time.
     */
    CompletableFuture<NotificationDecision> requestDecision(String tenantId, AnnouncementKind kind, String text);
}
