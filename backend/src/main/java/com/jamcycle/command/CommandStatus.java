package com.jamcycle.command;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum CommandStatus {
    PENDING,
    COMPLETED,
    FAILED;

    @JsonValue
    public String wireValue() {
        return name().toLowerCase(Locale.ROOT);
    }
}
