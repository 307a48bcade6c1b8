package com.example.orchestrator.domain;

public enum ConversationType {
    CUSTOMER,
    STAFF
}
