package com.example.orchestrator.broadcast;

import java.util.List;

public record BroadcastResult(int delivered, int failed, List<DeliveryFailure> failures, List<String> deliveredTo) {

    public BroadcastResult {
        failures = failures == null ? List.of() : List.copyOf(failures);
        deliveredTo = deliveredTo == null ? List.of() : List.copyOf(deliveredTo);
    }

    public static BroadcastResult empty() {
        return new BroadcastResult(0, 0, List.of(), List.of());
    }

    public int attempted() {
        return delivered + failed;
    }
}
