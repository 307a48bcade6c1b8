package com.example.orchestrator.config;

import java.time.Duration;
import org.redisson.Redisson;
import org.redisson.api.RedissonClient;
import org.redisson.config.Config;
import org.redisson.config.SingleServerConfig;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.data.redis.RedisProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.util.StringUtils;

/**
 * Redisson backs conversation locks, webhook de-duplication and message history.
 */
@Configuration
public class RedissonConfig {

    @Bean(destroyMethod = "shutdown")
    @ConditionalOnMissingBean
    public RedissonClient redissonClient(RedisProperties redisProperties) {
        Config config = new Config();
        SingleServerConfig server = config.useSingleServer()
                .setAddress(redisAddress(redisProperties))
                .setDatabase(redisProperties.getDatabase())
                .setClientName(redisProperties.getClientName())
                .setUsername(redisProperties.getUsername())
                .setPassword(
                        StringUtils.hasText(redisProperties.getPassword())
                                ? redisProperties.getPassword()
                                : null);
        Duration timeout = redisProperties.getTimeout();
        if (timeout != null && !timeout.isZero() && !timeout.isNegative()) {
            server.setTimeout((int) timeout.toMillis());
        }
        return Redisson.create(config);
    }

    private String redisAddress(RedisProperties redisProperties) {
        boolean sslEnabled = redisProperties.getSsl() != null && redisProperties.getSsl().isEnabled();
        return (sslEnabled ? "rediss://" : "redis://") + redisProperties.getHost() + ":" + redisProperties.getPort();
    }
}
