package com.example.orchestrator.domain;

public enum ConversationStatus {
    ACTIVE,
    ESCALATED,
    CLOSED
}
