package com.accessgate.backend.modules.permission.infrastructure.cache;

import java.time.Duration;
import java.util.Optional;

import com.accessgate.backend.modules.permission.application.ActionCache;
import com.accessgate.backend.modules.permission.domain.HttpMethods;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.ValueOperations;

/**
 * Shared action cache for multi-instance deployments. Every (method, path) is its own key with the cache TTL, so
 * entries for paths that stop being requested expire on their own.
 *
 * <p>Invalidation bumps a per-method generation counter that is part of every entry key; entries written under an
 * older generation are never read again and age out with their TTL. Redis failures degrade to cache misses so
 * authorization keeps working against the catalog.
 */
public class RedisActionCache implements ActionCache {

    private static final Logger log = LoggerFactory.getLogger(RedisActionCache.class);
    private static final String KEY_PREFIX = "accessgate:actions:";
    private static final String INITIAL_GENERATION = "0";

    private final StringRedisTemplate redisTemplate;
    private final Duration ttl;

    public RedisActionCache(StringRedisTemplate redisTemplate, Duration ttl) {
        this.redisTemplate = redisTemplate;
        this.ttl = ttl;
    }

    @Override
    public Optional<String> get(String method, String path) {
        try {
            return Optional.ofNullable(values().get(entryKey(method, path)));
        } catch (DataAccessException ex) {
            log.warn("Action cache read failed for {} {}: {}", method, path, ex.getMessage());
            return Optional.empty();
        }
    }

    @Override
    public void put(String method, String path, String action) {
        try {
            values().set(entryKey(method, path), action == null ? NO_ACTION : action, ttl);
        } catch (DataAccessException ex) {
            log.warn("Action cache write failed for {} {}: {}", method, path, ex.getMessage());
        }
    }

    @Override
    public void invalidateMethod(String method) {
        try {
            Long generation = values().increment(generationKey(method));
            log.debug("Action cache generation for {} is now {}", method, generation);
        } catch (DataAccessException ex) {
            log.warn("Action cache invalidation failed for {}: {}", method, ex.getMessage());
        }
    }

    @Override
    public void invalidateAll() {
        for (String method : HttpMethods.SUPPORTED) {
            invalidateMethod(method);
        }
    }

    private String entryKey(String method, String path) {
        String generation = values().get(generationKey(method));
        return KEY_PREFIX + method + ":" + (generation == null ? INITIAL_GENERATION : generation) + ":" + path;
    }

    private ValueOperations<String, String> values() {
        return redisTemplate.opsForValue();
    }

    private static String generationKey(String method) {
        return KEY_PREFIX + method + ":generation";
    }
}
