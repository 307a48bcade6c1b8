package com.example.orchestrator.identity;

import com.example.orchestrator.domain.StaffIdentity;
import java.util.List;
import java.util.Optional;

/**
 * Outcome of a staff lookup for one sender.
 *
 * @param identities every staff record whose stored phone matched
 * @param ambiguous more than one record matched; the sender must be treated as non-staff
 * @param phone canonical phone that was matched, the verified staff phone when resolved through an alias
 * @param aliasId canonical alias identifier the resolution went through, or null
 */
public record IdentityResolution(List<StaffIdentity> identities, boolean ambiguous, String phone, String aliasId) {

    public IdentityResolution {
        identities = identities == null ? List.of() : List.copyOf(identities);
    }

    public static IdentityResolution none(String phone) {
        return new IdentityResolution(List.of(), false, phone, null);
    }

    public static IdentityResolution of(List<StaffIdentity> identities, String phone) {
        return new IdentityResolution(identities, identities.size() > 1, phone, null);
    }

    public IdentityResolution withAlias(String alias) {
        return new IdentityResolution(identities, ambiguous, phone, alias);
    }

    public Optional<StaffIdentity> staff() {
        return identities.size() == 1 ? Optional.of(identities.get(0)) : Optional.empty();
    }

    public boolean isStaff() {
        return staff().isPresent();
    }

    public boolean hasMatches() {
        return !identities.isEmpty();
    }

    public boolean viaAlias() {
        return aliasId != null;
    }

    public int roleLevel() {
        return staff().map(StaffIdentity::effectiveRoleLevel).orElse(0);
    }
}
