package com.example.orchestrator.service;

import com.example.orchestrator.service.exception.ServiceException;
import java.util.function.Supplier;
import lombok.RequiredArgsConstructor;
import org.redisson.api.RLock;
import org.redisson.api.RedissonClient;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

/**
 * Serializes units of work per (tenant, canonical phone) across all orchestrator instances.
 */
@Component
@RequiredArgsConstructor
public class ConversationLocks {

    private final RedissonClient redissonClient;
    private final RedisKeyFactory keyFactory;

    public <T> T withLock(String tenantId, String phone, Supplier<T> supplier) {
        if (!StringUtils.hasText(tenantId) || !StringUtils.hasText(phone)) {
            throw ServiceException.badRequest("Tenant and phone are required to lock a conversation");
        }
        RLock lock = redissonClient.getLock(keyFactory.conversationLockKey(tenantId, phone));
        lock.lock();
        try {
            return supplier.get();
        } finally {
            lock.unlock();
        }
    }
}
