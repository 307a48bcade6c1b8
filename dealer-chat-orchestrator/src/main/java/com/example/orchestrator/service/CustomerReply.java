package com.example.orchestrator.service;

/**
 * @param text reply to send, may be null when only an escalation is wanted
 * @param escalate hand the conversation to a human
 */
public record CustomerReply(String text, boolean escalate, String reason) {

    public static CustomerReply reply(String text) {
        return new CustomerReply(text, false, null);
    }

    public static CustomerReply handoff(String text, String reason) {
        return new CustomerReply(text, true, reason);
    }
}
