package com.jamcycle.command;

import com.jamcycle.command.transport.AdminPanelTransport;
import com.jamcycle.command.transport.AdminPanelTransportException;
import com.jamcycle.model.TenantDescriptor;
import com.jamcycle.model.TransportKind;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Queue;

/**
 * In-memory transport for the command pipeline tests.
 */
class RecordingTransport implements AdminPanelTransport {

    private final TransportKind kind;
    private final Map<String, Queue<AdminCommand>> pending = new HashMap<>();
    final List<CommandResult> results = new ArrayList<>();
    final List<StatusSnapshot> statuses = new ArrayList<>();
    boolean failPolls;
    boolean failWrites;

    RecordingTransport(TransportKind kind) {
        this.kind = kind;
    }

    void enqueue(String tenantId, AdminCommand command) {
        pending.computeIfAbsent(tenantId, ignored -> new ArrayDeque<>()).add(command);
    }

    @Override
    public TransportKind kind() {
        return kind;
    }

    @Override
    public boolean supports(TenantDescriptor tenant) {
        return kind == TransportKind.QUEUE || tenant.hasHttpEndpoint();
    }

    @Override
    public List<AdminCommand> poll(TenantDescriptor tenant) {
        if (failPolls) {
            throw new AdminPanelTransportException("poll refused");
        }
        Queue<AdminCommand> queue = pending.getOrDefault(tenant.id(), new ArrayDeque<>());
        List<AdminCommand> taken = new ArrayList<>(queue);
        queue.clear();
        return taken;
    }

    @Override
    public void publishResult(TenantDescriptor tenant, CommandResult result) {
        if (failWrites) {
            throw new AdminPanelTransportException("write refused");
        }
        results.add(result);
    }

    @Override
    public void publishStatus(TenantDescriptor tenant, StatusSnapshot snapshot) {
        if (failWrites) {
            throw new AdminPanelTransportException("write refused");
        }
        statuses.add(snapshot);
    }
}
