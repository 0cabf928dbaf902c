package com.jamcycle.service;

import com.jamcycle.config.JamCycleProperties;
import com.jamcycle.model.TenantDescriptor;
import com.jamcycle.model.TransportKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Tenants configured for this process, in configuration order.
 */
@Component
public class TenantDirectory {

    private static final Logger log = LoggerFactory.getLogger(TenantDirectory.class);

    private final Map<String, TenantDescriptor> tenants;
    private final List<TenantDescriptor> ordered;

    public TenantDirectory(JamCycleProperties jamCycleProperties) {
        Map<String, TenantDescriptor> byId = new LinkedHashMap<>();
        for (JamCycleProperties.Tenant tenant : jamCycleProperties.getTenants()) {
            if (tenant.getId() == null || tenant.getId().isBlank()) {
                log.warn("Skipping tenant entry without id");
                continue;
            }
            TenantDescriptor descriptor = new TenantDescriptor(
                    tenant.getId(),
                    tenant.getName(),
                    TransportKind.fromConfig(tenant.getTransport()),
                    tenant.getBackendUrl(),
                    tenant.getBackendToken());
            if (descriptor.transport() == TransportKind.HTTP && !descriptor.hasHttpEndpoint()) {
                throw new IllegalStateException(
                        "Tenant " + descriptor.id() + " uses the http transport but has no backend-url/backend-token");
            }
            if (byId.putIfAbsent(descriptor.id(), descriptor) != null) {
                log.warn("Duplicate tenant id {} ignored", descriptor.id());
            }
        }
        this.tenants = Map.copyOf(byId);
        this.ordered = List.copyOf(byId.values());
        log.info("Tenant directory loaded with {} tenant(s)", ordered.size());
    }

    public List<TenantDescriptor> all() {
        return ordered;
    }

    public Optional<TenantDescriptor> find(String tenantId) {
        if (tenantId == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(tenants.get(tenantId.trim()));
    }
}
