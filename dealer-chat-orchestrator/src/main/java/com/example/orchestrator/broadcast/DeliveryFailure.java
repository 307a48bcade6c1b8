package com.example.orchestrator.broadcast;

public record DeliveryFailure(String recipient, String reason) {
}
