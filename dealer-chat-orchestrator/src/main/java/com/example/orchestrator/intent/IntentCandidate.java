package com.example.orchestrator.intent;

public record IntentCandidate(MessageIntent intent, double confidence) {
}
