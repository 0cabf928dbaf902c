package com.jamcycle.command;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.jamcycle.model.CompetitionPhase;
import com.jamcycle.model.GuildState;
import com.jamcycle.model.Team;
import com.jamcycle.model.TenantConfig;
import com.jamcycle.model.VoteTally;
import com.jamcycle.model.WinnerRecord;
import com.jamcycle.repository.GuildFields;
import com.jamcycle.repository.GuildStateCodec;
import com.jamcycle.repository.GuildStateRepository;
import com.jamcycle.repository.GuildStateUpdate;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Export and restore of a tenant's competition state.
 * <p>
 * The backup document holds the current cycle, its entries and votes, past winners and the
 * tenant settings. Restore applies only the sections it recognises.
 */
@Component
@RequiredArgsConstructor
public class BackupCommands {

    private static final Logger log = LoggerFactory.getLogger(BackupCommands.class);

    static final String SETTINGS = "settings";

    private static final TypeReference<Map<String, Team>> SUBMISSIONS_TYPE = new TypeReference<>() {
    };
    private static final TypeReference<Map<String, VoteTally>> VOTING_RESULTS_TYPE = new TypeReference<>() {
    };
    private static final TypeReference<Map<String, Map<String, String>>> INDIVIDUAL_VOTES_TYPE = new TypeReference<>() {
    };
    private static final TypeReference<Map<String, WinnerRecord>> WINNERS_TYPE = new TypeReference<>() {
    };

    private final GuildStateRepository guildStateRepository;

    public CommandOutcome exportBackup(CommandContext context) {
        GuildState state = context.state();
        ObjectMapper mapper = GuildStateCodec.objectMapper();
        TenantConfig config = state.config();

        Map<String, Object> settings = new LinkedHashMap<>();
        settings.put(GuildFields.AUTO_ANNOUNCE, state.automationEnabled());
        settings.put(GuildFields.BIWEEKLY_MODE, config.biweeklyMode());
        settings.put(GuildFields.MIN_TEAMS_REQUIRED, config.minTeamsRequired());
        settings.put(GuildFields.SAFE_MODE_ENABLED, config.safeModeEnabled());
        settings.put(GuildFields.REQUIRE_CONFIRMATION, config.confirmationRequired());
        settings.put(GuildFields.CONFIRMATION_TIMEOUT_SECONDS, config.confirmationTimeoutSeconds());

        Map<String, Object> backup = new LinkedHashMap<>();
        backup.put("tenant_id", context.tenantId());
        backup.put("tenant_name", context.tenant().name());
        backup.put("timestamp", context.now().toString());
        backup.put(GuildFields.CYCLE_KEY, state.cycle().cycleKey());
        backup.put(GuildFields.CURRENT_THEME, state.cycle().theme());
        backup.put(GuildFields.CURRENT_PHASE, state.phase().wireValue());
        backup.put(GuildFields.SUBMISSIONS, mapper.convertValue(state.submissions(), Map.class));
        backup.put(GuildFields.VOTING_RESULTS, mapper.convertValue(state.votingResults(), Map.class));
        backup.put(GuildFields.INDIVIDUAL_VOTES, mapper.convertValue(state.individualVotes(), Map.class));
        backup.put(GuildFields.WEEKLY_WINNERS, mapper.convertValue(state.weeklyWinners(), Map.class));
        backup.put(SETTINGS, settings);

        log.info("Exported backup for tenant {} ({} team(s))", context.tenantId(), state.teamCount());
        return CommandOutcome.completed(Map.of("backup", backup));
    }

    public CommandOutcome restoreBackup(CommandContext context) {
        Optional<Map<String, Object>> backup = context.mapParam("backup");
        if (backup.isEmpty()) {
            return CommandOutcome.failed("Missing or invalid backup object");
        }
        GuildStateUpdate update;
        try {
            update = toUpdate(backup.get());
        } catch (IllegalArgumentException ex) {
            return CommandOutcome.failed("invalid backup: " + ex.getMessage());
        }
        if (update.isEmpty()) {
            return CommandOutcome.failed("backup contains no restorable sections");
        }
        guildStateRepository.save(context.tenantId(), update);
        log.info("Restored backup for tenant {} ({} field(s))", context.tenantId(), update.fields().size());
        return CommandOutcome.completed(Map.of("restored_fields", update.fields().keySet().stream().toList()));
    }

    private static GuildStateUpdate toUpdate(Map<String, Object> backup) {
        ObjectMapper mapper = GuildStateCodec.objectMapper();
        GuildStateUpdate update = GuildStateUpdate.create();

        if (backup.get(GuildFields.CYCLE_KEY) != null) {
            update.cycleKey(String.valueOf(backup.get(GuildFields.CYCLE_KEY)));
        }
        if (backup.get(GuildFields.CURRENT_THEME) != null) {
            update.theme(String.valueOf(backup.get(GuildFields.CURRENT_THEME)));
        }
        if (backup.get(GuildFields.CURRENT_PHASE) != null) {
            String phase = String.valueOf(backup.get(GuildFields.CURRENT_PHASE));
            update.phase(CompetitionPhase.fromWire(phase)
                    .orElseThrow(() -> new IllegalArgumentException("unknown phase " + phase)));
        }
        if (backup.containsKey(GuildFields.SUBMISSIONS)) {
            update.submissions(orEmpty(mapper.convertValue(backup.get(GuildFields.SUBMISSIONS), SUBMISSIONS_TYPE)));
        }
        if (backup.containsKey(GuildFields.VOTING_RESULTS)) {
            update.votingResults(orEmpty(mapper.convertValue(backup.get(GuildFields.VOTING_RESULTS), VOTING_RESULTS_TYPE)));
        }
        if (backup.containsKey(GuildFields.INDIVIDUAL_VOTES)) {
            update.individualVotes(orEmpty(mapper.convertValue(backup.get(GuildFields.INDIVIDUAL_VOTES), INDIVIDUAL_VOTES_TYPE)));
        }
        if (backup.containsKey(GuildFields.WEEKLY_WINNERS)) {
            update.weeklyWinners(orEmpty(mapper.convertValue(backup.get(GuildFields.WEEKLY_WINNERS), WINNERS_TYPE)));
        }

        if (backup.get(SETTINGS) instanceof Map<?, ?> settings) {
            for (String field : GuildFields.CONFIG_FIELDS) {
                Object value = settings.get(field);
                if (value != null) {
                    update.put(field, String.valueOf(value));
                }
            }
        }
        return update;
    }

    private static <K, V> Map<K, V> orEmpty(Map<K, V> map) {
        return map == null ? Map.of() : map;
    }
}
