package com.jamcycle.repository;

import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Durable per-tenant key/value storage of competition state.
 * <p>
 * No transaction spans more than one call. A {@code null} value in a field map removes that field.
 */
public interface GuildStateStore {

    CompletableFuture<Map<String, String>> readAll(String tenantId);

    CompletableFuture<Void> set(String tenantId, String field, String value);

    /**
     * Applies all field changes as one update.
     */
    CompletableFuture<Void> setAll(String tenantId, Map<String, String> fields);

    /**
     * Applies all field changes as one update only if {@code guardField} currently holds
     * {@code expected} ({@code null} meaning absent).
     *
     * @return true when the guard matched and the update was written
     */
    CompletableFuture<Boolean> compareAndSet(
            String tenantId,
            String guardField,
            String expected,
            Map<String, String> fields
    );
}
