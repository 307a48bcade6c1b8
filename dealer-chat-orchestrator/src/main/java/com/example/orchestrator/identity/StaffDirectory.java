package com.example.orchestrator.identity;

import com.example.orchestrator.domain.StaffIdentity;
import com.example.orchestrator.domain.StaffRole;
import java.util.Collection;
import java.util.List;

/**
 * Read access to registered staff. Stored phone numbers are returned as written, unnormalized.
 */
public interface StaffDirectory {

    /** Active staff of the tenant plus active platform-wide staff. */
    List<StaffIdentity> findCandidates(String tenantId);

    /** Active staff of the tenant holding one of the given roles. */
    List<StaffIdentity> findByRoles(String tenantId, Collection<StaffRole> roles);
}
