package com.accessgate.backend.modules.permission.application;

import java.util.Optional;

/**
 * Cache of resolved (method, path) to action lookups in front of the permission catalog.
 *
 * <p>A lookup that found no permission is cached as {@link #NO_ACTION} so repeated misses skip pattern matching.
 * Readers may observe entries from before an invalidation; callers must tolerate that.
 */
public interface ActionCache {

    String NO_ACTION = "";

    Optional<String> get(String method, String path);

    void put(String method, String path, String action);

    /**
     * Drops every cached entry for the method, since a new pattern can change the result for any path.
     */
    void invalidateMethod(String method);

    void invalidateAll();
}
