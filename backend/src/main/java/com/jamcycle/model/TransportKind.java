package com.jamcycle.model;

import java.util.Locale;

/**
 * How a tenant exchanges commands, results and status with its operator panel.
 */
public enum TransportKind {
    QUEUE,
    HTTP;

    public static TransportKind fromConfig(String value) {
        if (value == null || value.isBlank()) {
            return QUEUE;
        }
        return switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "queue", "redis" -> QUEUE;
            case "http", "backend" -> HTTP;
            default -> throw new IllegalArgumentException("Unsupported admin panel transport: " + value);
        };
    }

    public TransportKind alternate() {
        return this == QUEUE ? HTTP : QUEUE;
    }
}
