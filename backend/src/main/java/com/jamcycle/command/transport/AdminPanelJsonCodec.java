package com.jamcycle.command.transport;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.jamcycle.command.AdminCommand;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * JSON encoding of the operator panel wire formats.
 */
public final class AdminPanelJsonCodec {

    private static final Logger log = LoggerFactory.getLogger(AdminPanelJsonCodec.class);

    private static final ObjectMapper OBJECT_MAPPER = JsonMapper.builder()
            .addModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .build();

    private AdminPanelJsonCodec() {
    }

    public static String write(Object value) {
        try {
            return OBJECT_MAPPER.writeValueAsString(value);
        } catch (JsonProcessingException ex) {
            throw new IllegalStateException("Failed to serialize admin panel payload", ex);
        }
    }

    /**
     * Reads one command. Unparsable payloads become a command without action so that they are
     * reported as malformed instead of being dropped; a missing id is generated.
     */
    public static AdminCommand readCommand(String payload) {
        try {
            return toCommand(OBJECT_MAPPER.readTree(payload));
        } catch (JsonProcessingException ex) {
            log.warn("Unparsable admin command payload: {}", ex.getOriginalMessage());
            return new AdminCommand(generatedId(), null, Map.of());
        }
    }

    /**
     * Reads a poll response body: a single command object, an array of them, or nothing.
     */
    public static List<AdminCommand> readCommands(String body) {
        if (body == null || body.isBlank()) {
            return List.of();
        }
        JsonNode root;
        try {
            root = OBJECT_MAPPER.readTree(body);
        } catch (JsonProcessingException ex) {
            log.warn("Unparsable admin command poll response: {}", ex.getOriginalMessage());
            return List.of(new AdminCommand(generatedId(), null, Map.of()));
        }
        if (root == null || root.isNull() || root.isMissingNode()) {
            return List.of();
        }
        if (!root.isArray()) {
            if (root.isObject() && root.isEmpty()) {
                return List.of();
            }
            return List.of(toCommand(root));
        }
        List<AdminCommand> commands = new ArrayList<>();
        root.forEach(node -> commands.add(toCommand(node)));
        return commands;
    }

    private static AdminCommand toCommand(JsonNode node) {
        if (node == null || !node.isObject()) {
            return new AdminCommand(generatedId(), null, Map.of());
        }
        AdminCommand command;
        try {
            command = OBJECT_MAPPER.treeToValue(node, AdminCommand.class);
        } catch (JsonProcessingException | IllegalArgumentException ex) {
            String id = node.path("id").isTextual() ? node.path("id").asText() : generatedId();
            return new AdminCommand(id, null, Map.of());
        }
        if (command.id() == null || command.id().isBlank()) {
            return new AdminCommand(generatedId(), command.action(), command.params());
        }
        return command;
    }

    private static String generatedId() {
        return "unidentified-" + UUID.randomUUID();
    }
}
