package com.example.orchestrator.command;

/**
 * Executes one family of staff commands. Handlers are consulted in {@code @Order} sequence and the
 * first one that supports a command handles it.
 */
public interface OperationHandler {

    boolean supports(ParsedCommand command);

    OperationResult handle(ParsedCommand command, CommandContext context);
}
