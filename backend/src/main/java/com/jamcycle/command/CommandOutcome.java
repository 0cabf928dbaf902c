package com.jamcycle.command;

import java.util.Map;

/**
 * What a command handler reports back to the dispatcher.
 */
public record CommandOutcome(
        boolean success,
        String error,
        Map<String, Object> payload
) {
    public CommandOutcome {
        payload = payload == null ? Map.of() : payload;
    }

    public static CommandOutcome completed() {
        return new CommandOutcome(true, null, Map.of());
    }

    public static CommandOutcome completed(Map<String, Object> payload) {
        return new CommandOutcome(true, null, payload);
    }

    public static CommandOutcome failed(String error) {
        return new CommandOutcome(false, error, Map.of());
    }

    public static CommandOutcome concurrentChange() {
        return failed("state changed concurrently; retry the command");
    }
}
