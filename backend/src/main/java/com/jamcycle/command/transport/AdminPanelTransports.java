package com.jamcycle.command.transport;

import com.jamcycle.model.TenantDescriptor;
import com.jamcycle.model.TransportKind;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Resolves the transport configured for a tenant, and the alternate one used only to retry a
 * failed result write.
 */
@Component
public class AdminPanelTransports {

    private final Map<TransportKind, AdminPanelTransport> byKind = new EnumMap<>(TransportKind.class);

    public AdminPanelTransports(List<AdminPanelTransport> transports) {
        for (AdminPanelTransport transport : transports) {
            byKind.put(transport.kind(), transport);
        }
    }

    public Optional<AdminPanelTransport> primaryFor(TenantDescriptor tenant) {
        AdminPanelTransport transport = byKind.get(tenant.transport());
        if (transport == null || !transport.supports(tenant)) {
            return Optional.empty();
        }
        return Optional.of(transport);
    }

    public Optional<AdminPanelTransport> alternateFor(TenantDescriptor tenant) {
        AdminPanelTransport transport = byKind.get(tenant.transport().alternate());
        if (transport == null || !transport.supports(tenant)) {
            return Optional.empty();
        }
        return Optional.of(transport);
    }
}
