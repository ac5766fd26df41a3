package com.accessgate.backend.modules.permission.domain;

import java.util.regex.Pattern;

/**
 * Action strings are {@code module:operation}: exactly one colon, lowercase words, hyphens between words allowed.
 */
public final class ActionFormat {

    private static final Pattern ACTION = Pattern.compile("^[a-z]+(-[a-z]+)*:[a-z]+(-[a-z]+)*$");
    public static final int MAX_LENGTH = 100;

    private ActionFormat() {
    }

    public static boolean isValid(String action) {
        return action != null && action.length() <= MAX_LENGTH && ACTION.matcher(action).matches();
    }
}
