package com.jamcycle.command;

@FunctionalInterface
public interface CommandHandler {

    CommandOutcome handle(CommandContext context);
}
