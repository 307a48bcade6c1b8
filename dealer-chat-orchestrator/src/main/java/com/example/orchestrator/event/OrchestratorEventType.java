package com.example.orchestrator.event;

public enum OrchestratorEventType {
    CONVERSATION_STARTED,
    CONVERSATION_ESCALATED,
    CONVERSATION_CLOSED,
    CONVERSATION_REOPENED,
    CONVERSATION_STAFF_VERIFIED,
    BROADCAST_COMPLETED
}
