package com.jamcycle.command.transport;

import com.jamcycle.command.AdminCommand;
import com.jamcycle.command.CommandResult;
import com.jamcycle.command.StatusSnapshot;
import com.jamcycle.model.TenantDescriptor;
import com.jamcycle.model.TransportKind;

import java.util.List;

/**
 * One way of exchanging commands, results and status with the operator panel. Every call is
 * bounded by a short timeout and reports failure as {@link AdminPanelTransportException}.
 */
public interface AdminPanelTransport {

    TransportKind kind();

    /**
     * Whether this transport can reach the tenant's panel at all.
     */
    boolean supports(TenantDescriptor tenant);

    /**
     * Takes the pending commands for the tenant. Taken commands are not redelivered by the
     * transport itself.
     */
    List<AdminCommand> poll(TenantDescriptor tenant);

    void publishResult(TenantDescriptor tenant, CommandResult result);

    void publishStatus(TenantDescriptor tenant, StatusSnapshot snapshot);
}
