package com.jamcycle.command;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.Map;

/**
 * Result record written back to the operator panel for one command.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record CommandResult(
        String id,
        CommandStatus status,
        String error,
        @JsonProperty("processed_at") Instant processedAt,
        Map<String, Object> result
) {
    public static CommandResult completed(String id, Instant processedAt, Map<String, Object> result) {
        return new CommandResult(id, CommandStatus.COMPLETED, null, processedAt,
                result == null || result.isEmpty() ? null : result);
    }

    public static CommandResult failed(String id, String error, Instant processedAt) {
        return new CommandResult(id, CommandStatus.FAILED, error, processedAt, null);
    }

    public boolean isFailed() {
        return status == CommandStatus.FAILED;
    }
}
