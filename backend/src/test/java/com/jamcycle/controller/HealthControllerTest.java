package com.jamcycle.controller;

import com.jamcycle.config.JamCycleProperties;
import com.jamcycle.model.TenantDescriptor;
import com.jamcycle.model.TransportKind;
import com.jamcycle.service.TenantDirectory;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.context.annotation.Import;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import java.util.List;

import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(HealthController.class)
@Import(JamCycleProperties.class)
class HealthControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockitoBean
    private TenantDirectory tenantDirectory;

    @Test
    void health_reportsLoopSwitchesAndTenantCount() throws Exception {
        when(tenantDirectory.all()).thenReturn(List.of(
                new TenantDescriptor("guild-a", "Guild A", TransportKind.QUEUE, null, null),
                new TenantDescriptor("guild-b", "Guild B", TransportKind.QUEUE, null, null)));

        mockMvc.perform(get("/api/jamcycle/health"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("UP"))
                .andExpect(jsonPath("$.schedulerEnabled").value(false))
                .andExpect(jsonPath("$.adminPanelEnabled").value(false))
                .andExpect(jsonPath("$.storeMode").value("in_memory"))
                .andExpect(jsonPath("$.tenantCount").value(2));
    }
}
