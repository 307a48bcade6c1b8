package com.example.orchestrator.service;

import com.example.orchestrator.domain.Conversation;
import com.example.orchestrator.domain.ConversationMessage;
import com.example.orchestrator.domain.ConversationStatus;
import java.util.List;
import java.util.Optional;

public interface ConversationRepository {

    Conversation saveConversation(Conversation conversation);

    Optional<Conversation> getConversation(String conversationId);

    Optional<Conversation> findByTenantAndPhone(String tenantId, String customerPhone);

    /**
     * Finds the conversation whose context links the given canonical alias identifier.
     */
    Optional<Conversation> findByLinkedLid(String tenantId, String lid);

    List<Conversation> findByTenant(String tenantId, ConversationStatus status);

    void appendMessage(ConversationMessage message);

    List<ConversationMessage> getMessages(String conversationId, int limit);
}
