package com.example.orchestrator.service;

import com.example.orchestrator.domain.Conversation;
import com.example.orchestrator.domain.ConversationContext;
import com.example.orchestrator.domain.ConversationStatus;
import com.example.orchestrator.domain.ConversationType;
import com.example.orchestrator.event.OrchestratorEvent;
import com.example.orchestrator.event.OrchestratorEventPublisher;
import com.example.orchestrator.event.OrchestratorEventType;
import com.example.orchestrator.identity.PhoneNormalizer;
import com.example.orchestrator.service.exception.ServiceException;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.function.UnaryOperator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.util.StringUtils;

/**
 * The only writer of conversation status and context.
 *
 * <pre>
 *   ACTIVE --escalate--> ESCALATED --close--> CLOSED --inbound--> ACTIVE
 * </pre>
 *
 * Requests that do not fit the current status are ignored and reported as {@code false}. Callers
 * are expected to hold the conversation lock from {@link ConversationLocks}.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ConversationStateMachine {

    private final ConversationRepository conversationRepository;
    private final OrchestratorEventPublisher eventPublisher;
    private final PhoneNormalizer phoneNormalizer;

    @Transactional
    public Conversation getOrCreate(String tenantId, String phone, boolean isStaff) {
        String canonical = phoneNormalizer.normalize(phone);
        if (!StringUtils.hasText(tenantId) || canonical.isEmpty()) {
            throw ServiceException.badRequest("Tenant and a phone number are required to open a conversation");
        }
        return conversationRepository.findByTenantAndPhone(tenantId, canonical)
                .orElseGet(() -> start(tenantId, canonical, isStaff));
    }

    private Conversation start(String tenantId, String phone, boolean isStaff) {
        Instant now = Instant.now();
        Conversation conversation = Conversation.builder()
                .id(UUID.randomUUID().toString())
                .tenantId(tenantId)
                .customerPhone(phone)
                .staff(isStaff)
                .conversationType(isStaff ? ConversationType.STAFF : ConversationType.CUSTOMER)
                .status(ConversationStatus.ACTIVE)
                .createdAt(now)
                .lastMessageAt(now)
                .context(ConversationContext.empty())
                .build();
        conversationRepository.saveConversation(conversation);

        publish(OrchestratorEventType.CONVERSATION_STARTED, conversation, now,
                Map.of("customerPhone", phone, "staff", isStaff));
        return conversation;
    }

    /**
     * Records activity. A closed conversation is reopened.
     *
     * @return true when the conversation was reopened
     */
    @Transactional
    public boolean onInbound(Conversation conversation) {
        Instant now = Instant.now();
        conversation.setLastMessageAt(now);
        if (conversation.getStatus() != ConversationStatus.CLOSED) {
            conversationRepository.saveConversation(conversation);
            return false;
        }

        conversation.setStatus(ConversationStatus.ACTIVE);
        conversation.setClosedAt(null);
        conversationRepository.saveConversation(conversation);
        publish(OrchestratorEventType.CONVERSATION_REOPENED, conversation, now, Map.of());
        return true;
    }

    @Transactional
    public boolean escalate(Conversation conversation, String reason) {
        if (conversation.getStatus() != ConversationStatus.ACTIVE) {
            log.debug("Ignoring escalation of conversation {} in status {}",
                    conversation.getId(), conversation.getStatus());
            return false;
        }
        Instant now = Instant.now();
        conversation.setStatus(ConversationStatus.ESCALATED);
        conversation.setEscalatedAt(now);
        conversationRepository.saveConversation(conversation);

        publish(OrchestratorEventType.CONVERSATION_ESCALATED, conversation, now,
                Map.of("reason", StringUtils.hasText(reason) ? reason : "unspecified"));
        return true;
    }

    @Transactional
    public boolean close(Conversation conversation, String closingText) {
        if (conversation.getStatus() != ConversationStatus.ESCALATED) {
            log.debug("Ignoring close of conversation {} in status {}",
                    conversation.getId(), conversation.getStatus());
            return false;
        }
        Instant now = Instant.now();
        ConversationContext context = conversation.contextOrEmpty().copy();
        context.setClosingMessage(closingText);
        conversation.setContext(context);
        conversation.setStatus(ConversationStatus.CLOSED);
        conversation.setClosedAt(now);
        conversationRepository.saveConversation(conversation);

        publish(OrchestratorEventType.CONVERSATION_CLOSED, conversation, now,
                Map.of("status", ConversationStatus.CLOSED.name()));
        return true;
    }

    @Transactional
    public boolean markStaff(Conversation conversation) {
        if (conversation.isStaff()) {
            return false;
        }
        conversation.setStaff(true);
        conversation.setConversationType(ConversationType.STAFF);
        conversationRepository.saveConversation(conversation);
        log.info("Conversation {} in tenant {} marked as staff", conversation.getId(), conversation.getTenantId());
        return true;
    }

    /**
     * Applies {@code mutator} to a copy of the context and stores the validated result.
     *
     * @throws IllegalArgumentException when the result carries a blank verified staff phone
     */
    @Transactional
    public boolean updateContext(Conversation conversation, UnaryOperator<ConversationContext> mutator) {
        ConversationContext updated = mutator.apply(conversation.contextOrEmpty().copy());
        if (updated == null) {
            log.debug("Context mutator returned nothing for conversation {}", conversation.getId());
            return false;
        }
        conversation.setContext(validated(updated));
        conversationRepository.saveConversation(conversation);
        return true;
    }

    /**
     * Binds a gateway alias to a verified staff phone on this conversation and marks it as staff.
     */
    @Transactional
    public boolean linkAlias(Conversation conversation, String aliasId, String staffPhone, String verifiedVia) {
        String alias = phoneNormalizer.normalize(aliasId);
        if (alias.isEmpty()) {
            log.debug("Ignoring alias link without alias for conversation {}", conversation.getId());
            return false;
        }
        Instant now = Instant.now();
        updateContext(conversation, context -> {
            context.setVerifiedStaffPhone(staffPhone);
            context.getLinkedLids().add(alias);
            if (!StringUtils.hasText(context.getOriginalLid())) {
                context.setOriginalLid(aliasId);
            }
            context.setVerifiedVia(verifiedVia);
            context.setVerifiedAt(now);
            return context;
        });
        markStaff(conversation);

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("alias", alias);
        payload.put("staffPhone", conversation.getContext().getVerifiedStaffPhone());
        payload.put("verifiedVia", verifiedVia);
        publish(OrchestratorEventType.CONVERSATION_STAFF_VERIFIED, conversation, now, payload);
        return true;
    }

    private ConversationContext validated(ConversationContext context) {
        String staffPhone = context.getVerifiedStaffPhone();
        if (staffPhone != null) {
            String canonical = phoneNormalizer.normalize(staffPhone);
            if (canonical.isEmpty()) {
                throw new IllegalArgumentException("verifiedStaffPhone must not be blank");
            }
            context.setVerifiedStaffPhone(canonical);
        }
        Set<String> lids = new LinkedHashSet<>();
        if (context.getLinkedLids() != null) {
            for (String lid : context.getLinkedLids()) {
                String canonical = phoneNormalizer.normalize(lid);
                if (!canonical.isEmpty()) {
                    lids.add(canonical);
                }
            }
        }
        context.setLinkedLids(lids);
        return context;
    }

    private void publish(OrchestratorEventType type, Conversation conversation, Instant at, Map<String, Object> payload) {
        eventPublisher.publishLifecycleEvent(OrchestratorEvent.builder()
                .eventId(UUID.randomUUID().toString())
                .type(type)
                .tenantId(conversation.getTenantId())
                .conversationId(conversation.getId())
                .occurredAt(at)
                .payload(payload)
                .build());
    }
}
