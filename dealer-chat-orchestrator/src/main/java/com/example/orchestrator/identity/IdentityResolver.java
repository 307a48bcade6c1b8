package com.example.orchestrator.identity;

import com.example.orchestrator.domain.Conversation;
import com.example.orchestrator.domain.StaffIdentity;
import com.example.orchestrator.service.ConversationRepository;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

/**
 * Maps a sender identifier to the staff records registered under that number.
 *
 * <p>Stored numbers are compared in canonical form against the three variants of the sender, so
 * {@code 0812...}, {@code 62812...} and {@code +62 812-...} all denote the same person. Alias
 * identifiers are followed through the {@code linkedLids} of a verified conversation.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class IdentityResolver {

    private final PhoneNormalizer phoneNormalizer;
    private final StaffDirectory staffDirectory;
    private final ConversationRepository conversationRepository;

    public IdentityResolution resolve(String tenantId, String identifier) {
        String canonical = phoneNormalizer.normalize(identifier);
        if (canonical.isEmpty()) {
            return IdentityResolution.none(canonical);
        }

        if (phoneNormalizer.isAlias(identifier)) {
            return resolveAlias(tenantId, canonical).orElseGet(() -> IdentityResolution.none(canonical));
        }

        IdentityResolution direct = resolvePhone(tenantId, canonical);
        if (direct.hasMatches()) {
            return direct;
        }
        // some gateway events deliver the alias digits without the @lid suffix
        return resolveAlias(tenantId, canonical).orElse(direct);
    }

    /** Directory lookup for a number, without alias handling. */
    public IdentityResolution resolvePhone(String tenantId, String phone) {
        String canonical = phoneNormalizer.normalize(phone);
        if (canonical.isEmpty()) {
            return IdentityResolution.none(canonical);
        }
        PhoneVariants variants = phoneNormalizer.variants(canonical);

        Map<String, StaffIdentity> matches = new LinkedHashMap<>();
        for (StaffIdentity candidate : staffDirectory.findCandidates(tenantId)) {
            if (variants.matches(phoneNormalizer.normalize(candidate.getPhone()))) {
                matches.putIfAbsent(candidate.getId(), candidate);
            }
        }

        IdentityResolution resolution = IdentityResolution.of(List.copyOf(matches.values()), canonical);
        if (resolution.ambiguous()) {
            log.warn("Ambiguous staff identity in tenant {}: {} records share phone {} ({}); treating sender as customer",
                    tenantId, matches.size(), canonical, matches.keySet());
        }
        return resolution;
    }

    private Optional<IdentityResolution> resolveAlias(String tenantId, String alias) {
        Optional<Conversation> linked = conversationRepository.findByLinkedLid(tenantId, alias);
        if (linked.isEmpty()) {
            return Optional.empty();
        }
        String staffPhone = linked.get().contextOrEmpty().getVerifiedStaffPhone();
        if (!StringUtils.hasText(staffPhone)) {
            return Optional.empty();
        }
        IdentityResolution resolution = resolvePhone(tenantId, staffPhone);
        if (!resolution.hasMatches()) {
            log.info("Alias {} is linked to {} but no active staff record carries that phone", alias, staffPhone);
            return Optional.empty();
        }
        log.debug("Resolved alias {} to staff phone {}", alias, resolution.phone());
        return Optional.of(resolution.withAlias(alias));
    }
}
