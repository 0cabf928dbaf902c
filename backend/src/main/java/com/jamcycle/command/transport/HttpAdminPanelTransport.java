package com.jamcycle.command.transport;

import com.jamcycle.command.AdminCommand;
import com.jamcycle.command.CommandResult;
import com.jamcycle.command.StatusSnapshot;
import com.jamcycle.model.TenantDescriptor;
import com.jamcycle.model.TransportKind;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;

import java.util.List;

/**
 * Short-poll transport against the operator panel's back end. The shared secret is sent as
 * {@code X-JC-Token} and as a bearer token.
 */
@Component
public class HttpAdminPanelTransport implements AdminPanelTransport {

    static final String TOKEN_HEADER = "X-JC-Token";
    static final String ACTION_PATH = "/api/jamcycle/action";
    static final String RESULT_PATH = "/api/jamcycle/action-result";
    static final String STATUS_PATH = "/api/jamcycle/status";

    private final RestClient adminPanelRestClient;

    public HttpAdminPanelTransport(@Qualifier("adminPanelRestClient") RestClient adminPanelRestClient) {
        this.adminPanelRestClient = adminPanelRestClient;
    }

    @Override
    public TransportKind kind() {
        return TransportKind.HTTP;
    }

    @Override
    public boolean supports(TenantDescriptor tenant) {
        return tenant.hasHttpEndpoint();
    }

    @Override
    public List<AdminCommand> poll(TenantDescriptor tenant) {
        requireEndpoint(tenant);
        try {
            ResponseEntity<String> response = adminPanelRestClient.get()
                    .uri(url(tenant, ACTION_PATH))
                    .headers(headers -> authenticate(headers, tenant))
                    .accept(MediaType.APPLICATION_JSON)
                    .retrieve()
                    .toEntity(String.class);
            return AdminPanelJsonCodec.readCommands(response.getBody());
        } catch (RestClientException ex) {
            throw transportFailure("poll", tenant, ex);
        }
    }

    @Override
    public void publishResult(TenantDescriptor tenant, CommandResult result) {
        post(tenant, RESULT_PATH, AdminPanelJsonCodec.write(result), "result write");
    }

    @Override
    public void publishStatus(TenantDescriptor tenant, StatusSnapshot snapshot) {
        post(tenant, STATUS_PATH, AdminPanelJsonCodec.write(snapshot), "status write");
    }

    private void post(TenantDescriptor tenant, String path, String body, String operation) {
        requireEndpoint(tenant);
        try {
            adminPanelRestClient.post()
                    .uri(url(tenant, path))
                    .headers(headers -> authenticate(headers, tenant))
                    .contentType(MediaType.APPLICATION_JSON)
                    .body(body)
                    .retrieve()
                    .toBodilessEntity();
        } catch (RestClientException ex) {
            throw transportFailure(operation, tenant, ex);
        }
    }

    private static void authenticate(HttpHeaders headers, TenantDescriptor tenant) {
        headers.set(TOKEN_HEADER, tenant.backendToken());
        headers.setBearerAuth(tenant.backendToken());
    }

    private static String url(TenantDescriptor tenant, String path) {
        String base = tenant.backendUrl().trim();
        while (base.endsWith("/")) {
            base = base.substring(0, base.length() - 1);
        }
        return base + path;
    }

    private static void requireEndpoint(TenantDescriptor tenant) {
        if (!tenant.hasHttpEndpoint()) {
            throw new AdminPanelTransportException("Tenant " + tenant.id() + " has no HTTP endpoint configured");
        }
    }

    private static AdminPanelTransportException transportFailure(String operation, TenantDescriptor tenant, RestClientException ex) {
        if (ex instanceof RestClientResponseException response) {
            return new AdminPanelTransportException(
                    "HTTP " + operation + " for tenant " + tenant.id() + " failed with status " + response.getStatusCode().value(), ex);
        }
        if (ex instanceof ResourceAccessException) {
            return new AdminPanelTransportException(
                    "HTTP " + operation + " for tenant " + tenant.id() + " could not reach " + tenant.backendUrl(), ex);
        }
        return new AdminPanelTransportException("HTTP " + operation + " for tenant " + tenant.id() + " failed: " + ex.getMessage(), ex);
    }
}
