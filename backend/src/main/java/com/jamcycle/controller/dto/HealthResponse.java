package com.jamcycle.controller.dto;

public record HealthResponse(
        String status,
        boolean schedulerEnabled,
        boolean adminPanelEnabled,
        String storeMode,
        int tenantCount
) {
}
