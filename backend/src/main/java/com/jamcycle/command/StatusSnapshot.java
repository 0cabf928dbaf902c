package com.jamcycle.command;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.jamcycle.model.GuildState;
import com.jamcycle.model.TenantDescriptor;

import java.time.Instant;

/**
 * Competition status pushed to the operator panel.
 */
public record StatusSnapshot(
        String phase,
        String theme,
        @JsonProperty("automation_enabled") boolean automationEnabled,
        @JsonProperty("week_cancelled") boolean weekCancelled,
        @JsonProperty("team_count") int teamCount,
        @JsonProperty("tenant_id") String tenantId,
        @JsonProperty("tenant_name") String tenantName,
        @JsonProperty("last_updated") Instant lastUpdated
) {
    public static StatusSnapshot of(TenantDescriptor tenant, GuildState state, Instant now) {
        return new StatusSnapshot(
                state.phase().wireValue(),
                state.cycle().theme(),
                state.automationEnabled(),
                state.cycle().weekCancelled(),
                state.teamCount(),
                tenant.id(),
                tenant.name(),
                now
        );
    }
}
