package com.jamcycle.service;

import com.jamcycle.model.AnnouncementKind;
import com.jamcycle.model.NotificationDecision;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.concurrent.CompletableFuture;

/**
 * Default channel used when no chat front end is wired: announcements go to the log and
 * confirmation requests are never answered.
 */
@Component
public class LoggingNotificationChannel implements NotificationChannel {

    private static final Logger log = LoggerFactory.getLogger(LoggingNotificationChannel.class);

    @Override
    public void publish(String tenantId, AnnouncementKind kind, String text) {
        log.info("Announcement for tenant {} ({}): {}", tenantId, kind, text);
    }

    @Override
    public CompletableFuture<NotificationDecision> requestDecision(String tenantId, AnnouncementKind kind, String text) {
        log.info("Confirmation requested for tenant {} ({}): {}", tenantId, kind, text);
        return CompletableFuture.completedFuture(NotificationDecision.TIMEOUT);
    }
}
