package com.example.orchestrator.intent;

/**
 * Classifier verdict for one inbound message. Never persisted.
 */
public record ClassificationResult(MessageIntent intent, boolean isStaff, double confidence) {

    public ClassificationResult {
        if (intent == null) {
            throw new IllegalArgumentException("intent is required");
        }
        if (confidence < 0.0 || confidence > 1.0) {
            throw new IllegalArgumentException("confidence must be within [0, 1]: " + confidence);
        }
    }

    public boolean isStaffCommand() {
        return isStaff && intent.isStaffCommand();
    }
}
