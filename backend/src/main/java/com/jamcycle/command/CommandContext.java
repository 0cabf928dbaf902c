package com.jamcycle.command;

import com.jamcycle.model.GuildState;
import com.jamcycle.model.TenantDescriptor;
import com.jamcycle.repository.GuildStateCodec;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * One command being applied to one tenant, with the state read just before dispatch.
 */
public record CommandContext(
        TenantDescriptor tenant,
        AdminCommand command,
        CommandKind kind,
        GuildState state,
        Instant now
) {
    public String tenantId() {
        return tenant.id();
    }

    public Map<String, Object> params() {
        return command.params();
    }

    /**
     * First non-blank string among the named parameters.
     */
    public Optional<String> stringParam(String... names) {
        for (String name : names) {
            Object value = command.params().get(name);
            if (value != null && !String.valueOf(value).isBlank()) {
                return Optional.of(String.valueOf(value).trim());
            }
        }
        return Optional.empty();
    }

    /**
     * First named parameter that reads as a boolean; see {@link GuildStateCodec#parseBooleanOrNull(String)}.
     */
    public Optional<Boolean> booleanParam(String... names) {
        for (String name : names) {
            Object value = command.params().get(name);
            if (value instanceof Boolean flag) {
                return Optional.of(flag);
            }
            if (value != null) {
                Boolean parsed = GuildStateCodec.parseBooleanOrNull(String.valueOf(value));
                if (parsed != null) {
                    return Optional.of(parsed);
                }
            }
        }
        return Optional.empty();
    }

    public Optional<Map<String, Object>> mapParam(String name) {
        Object value = command.params().get(name);
        if (value instanceof Map<?, ?> map) {
            Map<String, Object> copy = new LinkedHashMap<>();
            map.forEach((key, entry) -> copy.put(String.valueOf(key), entry));
            return Optional.of(copy);
        }
        return Optional.empty();
    }
}
