package com.accessgate.backend.modules.permission.domain;

import java.util.Locale;
import java.util.Set;

public final class HttpMethods {

    public static final Set<String> SUPPORTED = Set.of("GET", "POST", "PUT", "PATCH", "DELETE", "HEAD", "OPTIONS");

    private HttpMethods() {
    }

    public static String normalize(String method) {
        return method == null ? null : method.trim().toUpperCase(Locale.ROOT);
    }

    public static boolean isSupported(String method) {
        return method != null && SUPPORTED.contains(normalize(method));
    }
}
