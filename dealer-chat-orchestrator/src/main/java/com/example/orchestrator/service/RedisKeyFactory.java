package com.example.orchestrator.service;

import com.example.orchestrator.config.OrchestratorProperties;
import org.springframework.stereotype.Component;

@Component
public class RedisKeyFactory {

    private final OrchestratorProperties properties;

    public RedisKeyFactory(OrchestratorProperties properties) {
        this.properties = properties;
    }

    private String prefix() {
        return properties.getRedis().getKeyPrefix();
    }

    public String messagesKey(String conversationId) {
        return "%s:conversation:%s:messages".formatted(prefix(), conversationId);
    }

    public String conversationLockKey(String tenantId, String phone) {
        return "%s:conversation:%s:%s:lock".formatted(prefix(), tenantId, phone);
    }

    public String processedMessageKey(String clientId, String messageId) {
        return "%s:inbound:%s:%s".formatted(prefix(), clientId, messageId);
    }
}
