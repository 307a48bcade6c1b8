package com.example.orchestrator.command;

/**
 * Who issued a command and where the answer goes.
 *
 * @param senderPhone canonical phone of the requester, the verified staff phone for alias senders
 * @param roleLevel access level of the resolved staff identity, 0 when unresolved
 * @param mediaUrl attachment of the triggering message, if any
 */
public record CommandContext(
        String tenantId,
        String clientId,
        String senderPhone,
        int roleLevel,
        boolean staff,
        String conversationId,
        String mediaUrl) {
}
