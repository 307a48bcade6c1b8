package com.example.orchestrator.service;

import com.example.orchestrator.domain.Conversation;
import com.example.orchestrator.domain.ConversationMessage;
import com.example.orchestrator.domain.ConversationStatus;
import com.example.orchestrator.service.exception.ServiceException;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

/**
 * Read and manual-escalation access for dealership dashboards.
 */
@Service
@RequiredArgsConstructor
public class ConversationAdminService {

    static final int MAX_MESSAGES = 200;

    private final ConversationRepository conversationRepository;
    private final ConversationStateMachine stateMachine;
    private final ConversationLocks conversationLocks;

    public List<Conversation> listConversations(String tenantId, ConversationStatus status) {
        if (!StringUtils.hasText(tenantId)) {
            throw ServiceException.badRequest("tenantId is required");
        }
        return conversationRepository.findByTenant(tenantId, status);
    }

    public Conversation getConversation(String conversationId) {
        return conversationRepository.getConversation(conversationId)
                .orElseThrow(() -> ServiceException.notFound("Conversation not found"));
    }

    public List<ConversationMessage> getMessages(String conversationId, int limit) {
        getConversation(conversationId);
        return conversationRepository.getMessages(conversationId, Math.min(Math.max(limit, 1), MAX_MESSAGES));
    }

    public Conversation escalate(String conversationId, String reason) {
        Conversation snapshot = getConversation(conversationId);
        return conversationLocks.withLock(snapshot.getTenantId(), snapshot.getCustomerPhone(), () -> {
            Conversation conversation = getConversation(conversationId);
            if (!stateMachine.escalate(conversation, reason)) {
                throw ServiceException.invalidTransition(
                        "Conversation is %s and cannot be escalated".formatted(conversation.getStatus()));
            }
            return conversation;
        });
    }
}
