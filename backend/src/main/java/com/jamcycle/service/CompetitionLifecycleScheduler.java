package com.jamcycle.service;

import com.jamcycle.config.JamCycleProperties;
import com.jamcycle.model.GuildState;
import com.jamcycle.model.TenantDescriptor;
import com.jamcycle.model.TransitionIntent;
import com.jamcycle.repository.GuildStateRepository;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.Optional;

/**
 * Hourly phase tick across all tenants. Each tenant is evaluated in isolation: a failure is
 * logged and the pass continues with the next tenant.
 */
@Service
@RequiredArgsConstructor
public class CompetitionLifecycleScheduler {

    private static final Logger log = LoggerFactory.getLogger(CompetitionLifecycleScheduler.class);

    private final JamCycleProperties jamCycleProperties;
    private final TenantDirectory tenantDirectory;
    private final GuildStateRepository guildStateRepository;
    private final PhaseScheduler phaseScheduler;
    private final PhaseTransitionService phaseTransitionService;
    private final AnnouncementService announcementService;
    private final Clock clock;

    @Scheduled(
            fixedRateString = "${jamcycle.scheduler.tick-interval-ms:3600000}",
            initialDelayString = "${jamcycle.scheduler.initial-delay-ms:10000}")
    public void scheduledTick() {
        if (!jamCycleProperties.getScheduler().isEnabled()) {
            log.debug("Phase tick skipped by config (jamcycle.scheduler.enabled=false)");
            return;
        }
        tick();
    }

    public TickSummary tick() {
        Instant now = clock.instant();
        int evaluated = 0;
        int applied = 0;
        int failed = 0;
        for (TenantDescriptor tenant : tenantDirectory.all()) {
            try {
                evaluated++;
                if (tickTenant(tenant.id(), now)) {
                    applied++;
                }
            } catch (RuntimeException ex) {
                failed++;
                log.error("Phase tick failed for tenant {}", tenant.id(), ex);
            }
        }
        log.debug("Phase tick at {}: tenants={}, transitions={}, failures={}", now, evaluated, applied, failed);
        return new TickSummary(evaluated, applied, failed);
    }

    /**
     * @return true if a transition was applied for the tenant
     */
    public boolean tickTenant(String tenantId, Instant now) {
        GuildState state = guildStateRepository.load(tenantId);
        if (announcementService.publishDueAnnouncement(state, now)) {
            state = guildStateRepository.load(tenantId);
        }

        Optional<TransitionIntent> intent = phaseScheduler.evaluate(now, state);
        if (intent.isEmpty()) {
            return false;
        }
        return phaseTransitionService.apply(state, intent.get(), now);
    }

    public record TickSummary(
            int tenantsEvaluated,
            int transitionsApplied,
            int failures
    ) {
    }
}
