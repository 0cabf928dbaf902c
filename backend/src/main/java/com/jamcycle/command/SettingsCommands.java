package com.jamcycle.command;

import com.jamcycle.repository.GuildFields;
import com.jamcycle.repository.GuildStateCodec;
import com.jamcycle.repository.GuildStateRepository;
import com.jamcycle.repository.GuildStateUpdate;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Operator commands that change tenant settings.
 */
@Component
@RequiredArgsConstructor
public class SettingsCommands {

    private static final Logger log = LoggerFactory.getLogger(SettingsCommands.class);

    private static final Set<String> BOOLEAN_SETTINGS = Set.of(
            GuildFields.AUTO_ANNOUNCE,
            GuildFields.BIWEEKLY_MODE,
            GuildFields.SAFE_MODE_ENABLED,
            GuildFields.REQUIRE_CONFIRMATION
    );
    private static final Set<String> INTEGER_SETTINGS = Set.of(
            GuildFields.MIN_TEAMS_REQUIRED,
            GuildFields.CONFIRMATION_TIMEOUT_SECONDS
    );

    private final GuildStateRepository guildStateRepository;

    /**
     * Applies the allow-listed keys of {@code params.updates} (or of {@code params} itself).
     * Unknown keys and unparsable values are ignored and reported.
     */
    public CommandOutcome bulkConfigUpdate(CommandContext context) {
        Map<String, Object> updates = context.mapParam("updates").orElse(context.params());
        GuildStateUpdate update = GuildStateUpdate.create();
        Map<String, Object> applied = new LinkedHashMap<>();
        List<String> ignored = new ArrayList<>();

        updates.forEach((key, rawValue) -> {
            String field = key == null ? "" : key.trim();
            String value = rawValue == null ? null : String.valueOf(rawValue).trim();
            if (BOOLEAN_SETTINGS.contains(field)) {
                Boolean parsed = GuildStateCodec.parseBooleanOrNull(value);
                if (parsed != null) {
                    update.put(field, parsed.toString());
                    applied.put(field, parsed);
                    return;
                }
            } else if (INTEGER_SETTINGS.contains(field)) {
                Integer parsed = parsePositiveInt(value);
                if (parsed != null) {
                    update.put(field, parsed.toString());
                    applied.put(field, parsed);
                    return;
                }
            }
            ignored.add(field);
        });

        if (update.isEmpty()) {
            return CommandOutcome.failed("no recognized config keys in update");
        }
        guildStateRepository.save(context.tenantId(), update);
        log.info("Config for tenant {} updated: {} (ignored: {})", context.tenantId(), applied, ignored);
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("applied", applied);
        payload.put("ignored", ignored);
        return CommandOutcome.completed(payload);
    }

    public CommandOutcome setSafeMode(CommandContext context) {
        Optional<Boolean> enable = context.booleanParam("enable", "enabled");
        if (enable.isEmpty()) {
            return CommandOutcome.failed("Invalid enable parameter; expected boolean");
        }
        guildStateRepository.save(context.tenantId(), GuildStateUpdate.create().safeModeEnabled(enable.get()));
        return CommandOutcome.completed(Map.of("safe_mode_enabled", enable.get()));
    }

    private static Integer parsePositiveInt(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            int parsed = Integer.parseInt(value);
            return parsed >= 1 ? parsed : null;
        } catch (NumberFormatException ex) {
            return null;
        }
    }
}
