package com.jamcycle.model;

import java.time.Instant;

/**
 * Announcement waiting for operator confirmation. Published automatically once the deadline passes.
 */
public record PendingAnnouncement(
        AnnouncementKind kind,
        String text,
        Instant deadline
) {
    public PendingAnnouncement {
        if (kind == null) {
            throw new IllegalArgumentException("kind is required");
        }
        if (deadline == null) {
            throw new IllegalArgumentException("deadline is required");
        }
        text = text == null ? "" : text;
    }

    public boolean isDue(Instant now) {
        return !now.isBefore(deadline);
    }
}
