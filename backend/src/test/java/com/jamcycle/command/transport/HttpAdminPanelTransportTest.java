package com.jamcycle.command.transport;

import com.jamcycle.command.AdminCommand;
import com.jamcycle.command.CommandResult;
import com.jamcycle.model.TenantDescriptor;
import com.jamcycle.model.TransportKind;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestClient;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.springframework.http.HttpMethod.GET;
import static org.springframework.http.HttpMethod.POST;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.content;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.header;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.jsonPath;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withServerError;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withStatus;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

class HttpAdminPanelTransportTest {

    private static final TenantDescriptor TENANT =
            new TenantDescriptor("guild-1", "Guild One", TransportKind.HTTP, "http://panel.test/", "s3cret");

    private MockRestServiceServer server;
    private HttpAdminPanelTransport transport;

    @BeforeEach
    void setUp() {
        RestClient.Builder builder = RestClient.builder();
        server = MockRestServiceServer.bindTo(builder).build();
        transport = new HttpAdminPanelTransport(builder.build());
    }

    @Test
    void pollSendsTokenAndParsesCommand() {
        server.expect(requestTo("http://panel.test/api/jamcycle/action"))
                .andExpect(method(GET))
                .andExpect(header("X-JC-Token", "s3cret"))
                .andExpect(header("Authorization", "Bearer s3cret"))
                .andRespond(withSuccess("""
                        {"id":"cmd-1","action":"set_phase","params":{"phase":"voting"}}
                        """, MediaType.APPLICATION_JSON));

        List<AdminCommand> commands = transport.poll(TENANT);

        assertEquals(List.of(new AdminCommand("cmd-1", "set_phase", Map.of("phase", "voting"))), commands);
        server.verify();
    }

    @Test
    void emptyPollReturnsNoCommands() {
        server.expect(requestTo("http://panel.test/api/jamcycle/action"))
                .andRespond(withStatus(HttpStatus.NO_CONTENT));

        assertTrue(transport.poll(TENANT).isEmpty());
    }

    @Test
    void resultIsPostedAsJson() {
        server.expect(requestTo("http://panel.test/api/jamcycle/action-result"))
                .andExpect(method(POST))
                .andExpect(content().contentType(MediaType.APPLICATION_JSON))
                .andExpect(jsonPath("$.id").value("cmd-1"))
                .andExpect(jsonPath("$.status").value("failed"))
                .andExpect(jsonPath("$.error").value("unknown action"))
                .andExpect(jsonPath("$.processed_at").value("2026-10-21T10:00:00Z"))
                .andRespond(withSuccess());

        transport.publishResult(TENANT, CommandResult.failed("cmd-1", "unknown action", Instant.parse("2026-10-21T10:00:00Z")));

        server.verify();
    }

    @Test
    void serverErrorBecomesTransportException() {
        server.expect(requestTo("http://panel.test/api/jamcycle/action"))
                .andRespond(withServerError());

        AdminPanelTransportException ex = assertThrows(AdminPanelTransportException.class, () -> transport.poll(TENANT));

        assertEquals("HTTP poll for tenant guild-1 failed with status 500", ex.getMessage());
    }

    @Test
    void tenantWithoutEndpointIsRefused() {
        TenantDescriptor queueTenant = new TenantDescriptor("guild-2", null, TransportKind.QUEUE, null, null);

        assertThrows(AdminPanelTransportException.class, () -> transport.poll(queueTenant));
    }
}
