package com.example.orchestrator.domain;

public enum MessageDirection {
    INBOUND,
    OUTBOUND
}
