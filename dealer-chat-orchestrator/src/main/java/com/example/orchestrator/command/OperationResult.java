package com.example.orchestrator.command;

import com.example.orchestrator.domain.StaffRole;
import java.util.Set;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class OperationResult {

    boolean success;
    String message;
    byte[] artifactBytes;
    String filename;
    /** The handler expects the requester to answer, e.g. a menu or a multi-step upload. */
    boolean followUp;
    @Builder.Default
    Set<StaffRole> broadcastToRoles = Set.of();

    public static OperationResult success(String message) {
        return OperationResult.builder().success(true).message(message).build();
    }

    public static OperationResult failure(String message) {
        return OperationResult.builder().success(false).message(message).build();
    }

    public boolean hasArtifact() {
        return artifactBytes != null && artifactBytes.length > 0;
    }

    public boolean shouldBroadcast() {
        return success && hasArtifact() && broadcastToRoles != null && !broadcastToRoles.isEmpty();
    }
}
