package com.example.orchestrator.broadcast;

import com.example.orchestrator.domain.StaffRole;
import java.util.Set;

/**
 * One artifact to fan out to every staff member of the tenant holding one of {@code roles}.
 *
 * @param excludedPhone the requester, who already received the artifact directly
 */
public record BroadcastJob(
        byte[] artifact,
        String filename,
        String caption,
        Set<StaffRole> roles,
        String tenantId,
        String clientId,
        String excludedPhone) {

    public BroadcastJob {
        roles = roles == null ? Set.of() : Set.copyOf(roles);
    }
}
