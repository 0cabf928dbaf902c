package com.jamcycle.command;

import com.jamcycle.config.JamCycleProperties;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Results of the most recently processed command ids per tenant, so a redelivered command is
 * answered again without being re-applied.
 */
@Component
@RequiredArgsConstructor
public class ProcessedCommandCache {

    private final JamCycleProperties jamCycleProperties;

    private final Map<String, Map<String, CommandResult>> byTenant = new ConcurrentHashMap<>();

    public Optional<CommandResult> find(String tenantId, String commandId) {
        if (commandId == null) {
            return Optional.empty();
        }
        Map<String, CommandResult> results = tenantResults(tenantId);
        synchronized (results) {
            return Optional.ofNullable(results.get(commandId));
        }
    }

    public void remember(String tenantId, CommandResult result) {
        if (result.id() == null) {
            return;
        }
        Map<String, CommandResult> results = tenantResults(tenantId);
        synchronized (results) {
            results.put(result.id(), result);
        }
    }

    private Map<String, CommandResult> tenantResults(String tenantId) {
        int capacity = Math.max(1, jamCycleProperties.getAdminPanel().getProcessedCacheSize());
        return byTenant.computeIfAbsent(tenantId, ignored -> new LinkedHashMap<>(16, 0.75f, true) {
            @Override
            protected boolean removeEldestEntry(Map.Entry<String, CommandResult> eldest) {
                return size() > capacity;
            }
        });
    }
}
