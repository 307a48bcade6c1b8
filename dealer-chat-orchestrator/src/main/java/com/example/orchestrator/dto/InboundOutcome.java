package com.example.orchestrator.dto;

public enum InboundOutcome {
    PROCESSED,
    /** The gateway delivered a message id that was already handled. */
    DUPLICATE,
    /** The sender could not be turned into a phone number. */
    IGNORED
}
