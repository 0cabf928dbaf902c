package com.jamcycle.controller;

import com.jamcycle.config.JamCycleProperties;
import com.jamcycle.controller.dto.HealthResponse;
import com.jamcycle.service.TenantDirectory;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/jamcycle")
@RequiredArgsConstructor
public class HealthController {

    private final JamCycleProperties jamCycleProperties;
    private final TenantDirectory tenantDirectory;

    @GetMapping("/health")
    public HealthResponse health() {
        return new HealthResponse(
                "UP",
                jamCycleProperties.getScheduler().isEnabled(),
                jamCycleProperties.getAdminPanel().isEnabled(),
                jamCycleProperties.getStore().getMode(),
                tenantDirectory.all().size()
        );
    }
}
