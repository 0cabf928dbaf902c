package com.jamcycle.command;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Command issued by the operator panel: {@code {"id", "action", "params"}}.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record AdminCommand(
        String id,
        String action,
        Map<String, Object> params
) {
    public AdminCommand {
        params = params == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(params));
    }

    public boolean hasAction() {
        return action != null && !action.isBlank();
    }
}
