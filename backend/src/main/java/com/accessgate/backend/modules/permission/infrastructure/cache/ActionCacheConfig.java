package com.accessgate.backend.modules.permission.infrastructure.cache;

import java.time.Duration;

import com.accessgate.backend.modules.permission.application.ActionCache;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.core.StringRedisTemplate;

@Configuration(proxyBeanMethods = false)
public class ActionCacheConfig {

    @Bean
    @ConditionalOnProperty(value = "rbac.cache.provider", havingValue = "caffeine", matchIfMissing = true)
    public ActionCache caffeineActionCache(
            @Value("${rbac.cache.ttl:10m}") Duration ttl,
            @Value("${rbac.cache.max-size:10000}") long maxSize
    ) {
        return new CaffeineActionCache(ttl, maxSize);
    }

    @Bean
    @ConditionalOnProperty(value = "rbac.cache.provider", havingValue = "redis")
    public ActionCache redisActionCache(
            StringRedisTemplate redisTemplate,
            @Value("${rbac.cache.ttl:10m}") Duration ttl
    ) {
        return new RedisActionCache(redisTemplate, ttl);
    }
}
