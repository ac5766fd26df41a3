package com.accessgate.backend.modules.permission.infrastructure.cache;

import java.time.Duration;
import java.util.Optional;

import com.accessgate.backend.modules.permission.application.ActionCache;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;

/**
 * In-process, size bounded action cache with a write TTL.
 */
public class CaffeineActionCache implements ActionCache {

    private final Cache<CacheKey, String> cache;

    public CaffeineActionCache(Duration ttl, long maxSize) {
        this.cache = Caffeine.newBuilder()
                .expireAfterWrite(ttl)
                .maximumSize(maxSize)
                .build();
    }

    @Override
    public Optional<String> get(String method, String path) {
        return Optional.ofNullable(cache.getIfPresent(new CacheKey(method, path)));
    }

    @Override
    public void put(String method, String path, String action) {
        cache.put(new CacheKey(method, path), action == null ? NO_ACTION : action);
    }

    @Override
    public void invalidateMethod(String method) {
        cache.asMap().keySet().removeIf(key -> key.method().equals(method));
    }

    @Override
    public void invalidateAll() {
        cache.invalidateAll();
    }

    long estimatedSize() {
        cache.cleanUp();
        return cache.estimatedSize();
    }

    private record CacheKey(String method, String path) {
    }
}
