package com.jamcycle.command.transport;

/**
 * A queue or HTTP exchange with the operator panel failed or timed out.
 */
public class AdminPanelTransportException extends RuntimeException {

    public AdminPanelTransportException(String message) {
        super(message);
    }

    public AdminPanelTransportException(String message, Throwable cause) {
        super(message, cause);
    }
}
