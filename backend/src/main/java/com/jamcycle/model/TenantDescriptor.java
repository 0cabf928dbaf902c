package com.jamcycle.model;

/**
 * A tenant known to this process and how its operator panel is reached.
 */
public record TenantDescriptor(
        String id,
        String name,
        TransportKind transport,
        String backendUrl,
        String backendToken
) {
    public TenantDescriptor {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("tenant id is required");
        }
        id = id.trim();
        name = name == null || name.isBlank() ? id : name.trim();
        transport = transport == null ? TransportKind.QUEUE : transport;
    }

    public boolean hasHttpEndpoint() {
        return backendUrl != null && !backendUrl.isBlank() && backendToken != null && !backendToken.isBlank();
    }
}
