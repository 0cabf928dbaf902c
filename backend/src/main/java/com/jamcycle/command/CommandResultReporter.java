package com.jamcycle.command;

import com.jamcycle.command.transport.AdminPanelTransport;
import com.jamcycle.command.transport.AdminPanelTransportException;
import com.jamcycle.command.transport.AdminPanelTransports;
import com.jamcycle.model.TenantDescriptor;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Writes command results back to the operator panel: primary transport first, then one retry on
 * the alternate transport. A result that cannot be written is logged and dropped.
 */
@Component
@RequiredArgsConstructor
public class CommandResultReporter {

    private static final Logger log = LoggerFactory.getLogger(CommandResultReporter.class);
    private static final String CONCERN = "result-write";

    private final AdminPanelTransports adminPanelTransports;
    private final ThrottledLogger throttledLogger;

    /**
     * @return true if some transport accepted the result
     */
    public boolean report(TenantDescriptor tenant, CommandResult result) {
        String primaryFailure = "no primary transport available";
        Optional<AdminPanelTransport> primary = adminPanelTransports.primaryFor(tenant);
        if (primary.isPresent()) {
            try {
                primary.get().publishResult(tenant, result);
                return true;
            } catch (AdminPanelTransportException ex) {
                primaryFailure = ex.getMessage();
                log.debug("Result {} for tenant {} not written via {}: {}",
                        result.id(), tenant.id(), primary.get().kind(), ex.getMessage());
            }
        }

        Optional<AdminPanelTransport> alternate = adminPanelTransports.alternateFor(tenant);
        if (alternate.isEmpty()) {
            throttledLogger.error(log, tenant.id(), CONCERN,
                    "Result " + result.id() + " dropped: " + primaryFailure + "; no alternate transport");
            return false;
        }
        try {
            alternate.get().publishResult(tenant, result);
            log.info("Result {} for tenant {} written via alternate transport {}", result.id(), tenant.id(), alternate.get().kind());
            return true;
        } catch (AdminPanelTransportException ex) {
            throttledLogger.error(log, tenant.id(), CONCERN,
                    "Result " + result.id() + " dropped: " + primaryFailure + "; alternate failed: " + ex.getMessage());
            return false;
        }
    }
}
