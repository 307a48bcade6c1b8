package com.example.orchestrator.gateway;

public record GatewaySendResult(String messageId) {
}
