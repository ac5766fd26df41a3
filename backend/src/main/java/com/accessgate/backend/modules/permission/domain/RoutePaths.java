package com.accessgate.backend.modules.permission.domain;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Helpers for the {@code /api/v<N>} version prefix every public route carries. Stored permission routes and
 * lookups both use the prefix-free form so they stay stable across API versions.
 */
public final class RoutePaths {

    private static final Pattern VERSION_PREFIX = Pattern.compile("^/api/v\\d+(?=/|$)");

    private RoutePaths() {
    }

    public static boolean hasVersionPrefix(String route) {
        return route != null && VERSION_PREFIX.matcher(route).find();
    }

    public static String stripVersionPrefix(String route) {
        if (route == null) {
            return null;
        }
        Matcher matcher = VERSION_PREFIX.matcher(route);
        if (!matcher.find()) {
            return route;
        }
        String remainder = route.substring(matcher.end());
        return remainder.isEmpty() ? "/" : remainder;
    }

    /**
     * Drops the query string and a trailing slash (except for the root path) and guarantees a leading slash.
     */
    public static String normalize(String path) {
        if (path == null || path.isEmpty()) {
            return "/";
        }
        String normalized = path;
        int queryIndex = normalized.indexOf('?');
        if (queryIndex >= 0) {
            normalized = normalized.substring(0, queryIndex);
        }
        if (!normalized.startsWith("/")) {
            normalized = "/" + normalized;
        }
        if (normalized.length() > 1 && normalized.endsWith("/")) {
            normalized = normalized.substring(0, normalized.length() - 1);
        }
        return normalized;
    }
}
