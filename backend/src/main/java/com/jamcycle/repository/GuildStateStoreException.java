package com.jamcycle.repository;

public class GuildStateStoreException extends RuntimeException {

    public GuildStateStoreException(String message) {
        super(message);
    }

    public GuildStateStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
