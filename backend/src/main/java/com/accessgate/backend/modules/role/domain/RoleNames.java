package com.accessgate.backend.modules.role.domain;

import java.util.regex.Pattern;

public final class RoleNames {

    public static final int MAX_LENGTH = 50;
    public static final String ADMIN = "ADMIN";

    private static final Pattern NAME_PATTERN = Pattern.compile("^[A-Z_]+$");

    private RoleNames() {
    }

    public static boolean isValid(String name) {
        return name != null
                && name.length() <= MAX_LENGTH
                && NAME_PATTERN.matcher(name).matches();
    }
}
