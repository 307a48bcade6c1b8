package com.example.orchestrator.persistence;

import com.example.orchestrator.domain.Conversation;
import com.example.orchestrator.domain.ConversationContext;
import com.example.orchestrator.domain.ConversationStatus;
import com.example.orchestrator.domain.ConversationType;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.time.Instant;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

@Slf4j
@Component
@RequiredArgsConstructor
public class ConversationEntityMapper {

    private final ObjectMapper objectMapper;

    public ConversationEntity toEntity(Conversation conversation) {
        ConversationEntity entity = new ConversationEntity();
        entity.setId(conversation.getId());
        entity.setTenantId(conversation.getTenantId());
        entity.setCustomerPhone(conversation.getCustomerPhone());
        entity.setStaff(conversation.isStaff());
        entity.setConversationType(conversation.getConversationType() != null
                ? conversation.getConversationType()
                : (conversation.isStaff() ? ConversationType.STAFF : ConversationType.CUSTOMER));
        entity.setStatus(conversation.getStatus() != null ? conversation.getStatus() : ConversationStatus.ACTIVE);
        entity.setEscalatedAt(conversation.getEscalatedAt());
        entity.setClosedAt(conversation.getClosedAt());
        entity.setCreatedAt(conversation.getCreatedAt());
        entity.setLastMessageAt(conversation.getLastMessageAt());
        entity.setContextData(writeContext(conversation.getContext()));
        entity.setVersion(conversation.getVersion());
        return entity;
    }

    public Conversation toDomain(ConversationEntity entity) {
        if (entity == null) {
            return null;
        }
        return Conversation.builder()
                .id(entity.getId())
                .tenantId(entity.getTenantId())
                .customerPhone(entity.getCustomerPhone())
                .staff(entity.isStaff())
                .conversationType(entity.getConversationType())
                .status(entity.getStatus() != null ? entity.getStatus() : ConversationStatus.ACTIVE)
                .escalatedAt(entity.getEscalatedAt())
                .closedAt(entity.getClosedAt())
                .createdAt(entity.getCreatedAt() != null ? entity.getCreatedAt() : Instant.now())
                .lastMessageAt(entity.getLastMessageAt())
                .context(readContext(entity.getId(), entity.getContextData()))
                .version(entity.getVersion())
                .build();
    }

    private String writeContext(ConversationContext context) {
        if (context == null) {
            return null;
        }
        try {
            return objectMapper.writeValueAsString(context);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Unable to serialize conversation context", e);
        }
    }

    private ConversationContext readContext(String conversationId, String json) {
        if (!StringUtils.hasText(json)) {
            return ConversationContext.empty();
        }
        try {
            ConversationContext context = objectMapper.readValue(json, ConversationContext.class);
            return context != null ? context : ConversationContext.empty();
        } catch (JsonProcessingException e) {
            log.warn("Discarding unreadable context of conversation {}", conversationId, e);
            return ConversationContext.empty();
        }
    }
}
