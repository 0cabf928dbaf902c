package com.jamcycle.model;

/**
 * The single active cycle of a tenant.
 *
 * @param lastAnnouncementToken dedup token of the last transition applied to this cycle, or null
 */
public record CompetitionCycle(
        String cycleKey,
        String theme,
        CompetitionPhase phase,
        boolean weekCancelled,
        boolean winnerAnnounced,
        String lastAnnouncementToken
) {
    public CompetitionCycle {
        phase = phase == null ? CompetitionPhase.INACTIVE : phase;
    }
}
