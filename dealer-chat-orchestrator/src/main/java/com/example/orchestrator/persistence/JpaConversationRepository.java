package com.example.orchestrator.persistence;

import com.example.orchestrator.config.OrchestratorProperties;
import com.example.orchestrator.domain.Conversation;
import com.example.orchestrator.domain.ConversationMessage;
import com.example.orchestrator.domain.ConversationStatus;
import com.example.orchestrator.service.ConversationRepository;
import com.example.orchestrator.service.RedisKeyFactory;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.time.Duration;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.redisson.api.RList;
import org.redisson.api.RedissonClient;
import org.redisson.codec.TypedJsonJacksonCodec;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.util.StringUtils;

/**
 * Conversation rows live in the relational store; message history lives in a Redis list per conversation.
 */
@Repository
@RequiredArgsConstructor
public class JpaConversationRepository implements ConversationRepository {

    private final ConversationJpaRepository conversationJpaRepository;
    private final ConversationEntityMapper mapper;
    private final RedissonClient redissonClient;
    private final RedisKeyFactory keyFactory;
    private final OrchestratorProperties properties;
    private final ObjectMapper objectMapper;

    private volatile TypedJsonJacksonCodec messageCodec;

    @Override
    @Transactional
    public Conversation saveConversation(Conversation conversation) {
        ConversationEntity saved = conversationJpaRepository.saveAndFlush(mapper.toEntity(conversation));
        conversation.setVersion(saved.getVersion());
        return conversation;
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<Conversation> getConversation(String conversationId) {
        if (!StringUtils.hasText(conversationId)) {
            return Optional.empty();
        }
        return conversationJpaRepository.findById(conversationId).map(mapper::toDomain);
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<Conversation> findByTenantAndPhone(String tenantId, String customerPhone) {
        if (!StringUtils.hasText(tenantId) || !StringUtils.hasText(customerPhone)) {
            return Optional.empty();
        }
        return conversationJpaRepository.findByTenantIdAndCustomerPhone(tenantId, customerPhone).map(mapper::toDomain);
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<Conversation> findByLinkedLid(String tenantId, String lid) {
        if (!StringUtils.hasText(tenantId) || !StringUtils.hasText(lid)) {
            return Optional.empty();
        }
        // the LIKE pre-filter over the JSON column is coarse; membership is checked on the parsed context
        return conversationJpaRepository.findContextMentioning(tenantId, lid).stream()
                .map(mapper::toDomain)
                .filter(conversation -> conversation.contextOrEmpty().hasLinkedLid(lid))
                .filter(conversation -> StringUtils.hasText(conversation.contextOrEmpty().getVerifiedStaffPhone()))
                .findFirst();
    }

    @Override
    @Transactional(readOnly = true)
    public List<Conversation> findByTenant(String tenantId, ConversationStatus status) {
        if (!StringUtils.hasText(tenantId)) {
            return Collections.emptyList();
        }
        List<ConversationEntity> entities = status == null
                ? conversationJpaRepository.findByTenantIdOrderByLastMessageAtDesc(tenantId)
                : conversationJpaRepository.findByTenantIdAndStatusOrderByLastMessageAtDesc(tenantId, status);
        return entities.stream().map(mapper::toDomain).toList();
    }

    @Override
    public void appendMessage(ConversationMessage message) {
        if (message == null || !StringUtils.hasText(message.getConversationId())) {
            return;
        }
        RList<ConversationMessage> list = messageList(message.getConversationId());
        list.add(message);
        Duration ttl = properties.getRedis().getMessageTtl();
        if (ttl != null && !ttl.isNegative() && !ttl.isZero()) {
            list.expire(ttl);
        }
    }

    @Override
    public List<ConversationMessage> getMessages(String conversationId, int limit) {
        if (!StringUtils.hasText(conversationId) || limit <= 0) {
            return Collections.emptyList();
        }
        RList<ConversationMessage> list = messageList(conversationId);
        int size = list.size();
        if (size == 0) {
            return Collections.emptyList();
        }
        return list.range(Math.max(0, size - limit), size - 1);
    }

    private RList<ConversationMessage> messageList(String conversationId) {
        return redissonClient.getList(keyFactory.messagesKey(conversationId), messageCodec());
    }

    private TypedJsonJacksonCodec messageCodec() {
        if (messageCodec == null) {
            messageCodec = new TypedJsonJacksonCodec(ConversationMessage.class, objectMapper);
        }
        return messageCodec;
    }
}
