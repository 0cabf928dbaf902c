package com.jamcycle.repository;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Repository;

import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;

@Repository
@ConditionalOnProperty(
        prefix = "jamcycle.store",
        name = "mode",
        havingValue = "in_memory",
        matchIfMissing = true
)
public class InMemoryGuildStateStore implements GuildStateStore {

    private final Map<String, Map<String, String>> tenants = new ConcurrentHashMap<>();

    @Override
    public CompletableFuture<Map<String, String>> readAll(String tenantId) {
        Map<String, String> fields = fieldsOf(tenantId);
        synchronized (fields) {
            return CompletableFuture.completedFuture(Map.copyOf(fields));
        }
    }

    @Override
    public CompletableFuture<Void> set(String tenantId, String field, String value) {
        Map<String, String> changes = new HashMap<>();
        changes.put(Objects.requireNonNull(field, "field is required"), value);
        return setAll(tenantId, changes);
    }

    @Override
    public CompletableFuture<Void> setAll(String tenantId, Map<String, String> fields) {
        Map<String, String> stored = fieldsOf(tenantId);
        synchronized (stored) {
            apply(stored, fields);
        }
        return CompletableFuture.completedFuture(null);
    }

    @Override
    public CompletableFuture<Boolean> compareAndSet(
            String tenantId,
            String guardField,
            String expected,
            Map<String, String> fields
    ) {
        Map<String, String> stored = fieldsOf(tenantId);
        synchronized (stored) {
            if (!Objects.equals(stored.get(guardField), expected)) {
                return CompletableFuture.completedFuture(false);
            }
            apply(stored, fields);
            return CompletableFuture.completedFuture(true);
        }
    }

    private Map<String, String> fieldsOf(String tenantId) {
        return tenants.computeIfAbsent(Objects.requireNonNull(tenantId, "tenantId is required"), ignored -> new HashMap<>());
    }

    private static void apply(Map<String, String> stored, Map<String, String> changes) {
        changes.forEach((field, value) -> {
            if (value == null) {
                stored.remove(field);
            } else {
                stored.put(field, value);
            }
        });
    }
}
