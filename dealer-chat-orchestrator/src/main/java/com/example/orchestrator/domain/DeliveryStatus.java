package com.example.orchestrator.domain;

public enum DeliveryStatus {
    RECEIVED,
    SENT,
    FAILED
}
