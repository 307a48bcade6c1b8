package com.example.orchestrator.broadcast;

import com.example.orchestrator.domain.StaffIdentity;
import com.example.orchestrator.gateway.GatewayAdapter;
import com.example.orchestrator.identity.PhoneNormalizer;
import com.example.orchestrator.identity.PhoneVariants;
import com.example.orchestrator.identity.StaffDirectory;
import java.util.ArrayList;
import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Delivers one artifact to the role-filtered staff of a tenant.
 *
 * <p>The requester is excluded in every phone format, recipients registered twice under different
 * formats get one copy, and sends run one after another. Transient failures are retried inside the
 * gateway client. A failed recipient is recorded and the loop moves on; this method does not throw
 * for delivery problems.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class BroadcastDispatcher {

    private final StaffDirectory staffDirectory;
    private final PhoneNormalizer phoneNormalizer;
    private final GatewayAdapter gatewayAdapter;

    public BroadcastResult broadcast(BroadcastJob job) {
        if (job.roles().isEmpty() || job.artifact() == null || job.artifact().length == 0) {
            return BroadcastResult.empty();
        }

        Map<String, StaffIdentity> recipients = recipients(job);
        if (recipients.isEmpty()) {
            log.info("No broadcast recipients for {} in tenant {} (roles {})",
                    job.filename(), job.tenantId(), job.roles());
            return BroadcastResult.empty();
        }

        String document = Base64.getEncoder().encodeToString(job.artifact());
        List<String> deliveredTo = new ArrayList<>();
        List<DeliveryFailure> failures = new ArrayList<>();

        for (Map.Entry<String, StaffIdentity> entry : recipients.entrySet()) {
            String phone = entry.getKey();
            StaffIdentity recipient = entry.getValue();
            try {
                gatewayAdapter.sendDocument(job.clientId(), phone, document, job.filename(), job.caption());
                deliveredTo.add(phone);
            } catch (RuntimeException ex) {
                log.warn("Broadcast of {} to {} ({}, {}) in tenant {} failed: {}",
                        job.filename(), phone, recipient.displayName(), recipient.getRole(),
                        job.tenantId(), ex.getMessage());
                failures.add(new DeliveryFailure(phone, ex.getMessage()));
            }
        }

        log.info("Broadcast of {} in tenant {}: {} delivered, {} failed",
                job.filename(), job.tenantId(), deliveredTo.size(), failures.size());
        return new BroadcastResult(deliveredTo.size(), failures.size(), failures, deliveredTo);
    }

    /** Recipients keyed by their country-code form, in directory order, without the requester. */
    private Map<String, StaffIdentity> recipients(BroadcastJob job) {
        PhoneVariants sender = phoneNormalizer.variants(phoneNormalizer.normalize(job.excludedPhone()));
        Map<String, StaffIdentity> recipients = new LinkedHashMap<>();
        for (StaffIdentity identity : staffDirectory.findByRoles(job.tenantId(), job.roles())) {
            String phone = phoneNormalizer.normalize(identity.getPhone());
            if (phone.isEmpty() || sender.matches(phone)) {
                continue;
            }
            recipients.putIfAbsent(phoneNormalizer.variants(phone).countryCodePrefixed(), identity);
        }
        return recipients;
    }
}
