package com.accessgate.backend.modules.authorization.domain;

import java.util.List;
import java.util.Locale;

import com.accessgate.backend.modules.permission.domain.RoutePatternMatcher;

/**
 * Derives an action for routes that have no catalog entry: the first path segment names the resource and the
 * HTTP method, plus the second segment for some shapes, names the operation.
 */
public final class ActionNamingConvention {

    static final String UNKNOWN_RESOURCE = "unknown";

    private ActionNamingConvention() {
    }

    public static String infer(String method, String path) {
        String normalizedPath = path == null ? "" : path;
        List<String> segments = RoutePatternMatcher.segments(normalizedPath);
        String resource = segments.isEmpty() ? UNKNOWN_RESOURCE : segments.get(0);
        return resource + ":" + operation(method.toUpperCase(Locale.ROOT), normalizedPath, segments);
    }

    private static String operation(String method, String path, List<String> segments) {
        switch (method) {
            case "GET":
                if (segments.size() > 1 && ("profile".equals(segments.get(1)) || "roles".equals(segments.get(1)))) {
                    return segments.get(1);
                }
                return path.contains(":") || segments.size() > 1 ? "detail" : "list";
            case "POST":
                return segments.size() > 1 ? segments.get(1) : "create";
            case "PUT":
            case "PATCH":
                return "update";
            case "DELETE":
                return "delete";
            default:
                return method.toLowerCase(Locale.ROOT);
        }
    }
}
