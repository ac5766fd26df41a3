package com.accessgate.backend.modules.permission.domain;

import java.util.ArrayList;
import java.util.List;

/**
 * Segment-wise matching of stored route patterns against concrete request paths.
 *
 * <p>Both sides are split on {@code /} with empty segments dropped, so leading and trailing slashes are
 * insignificant. A pattern segment starting with {@code :} matches any single path segment; every other
 * segment must be equal to the path segment.
 */
public final class RoutePatternMatcher {

    private static final String PARAM_PREFIX = ":";

    private RoutePatternMatcher() {
    }

    public static boolean matches(String pattern, String path) {
        if (pattern == null || path == null) {
            return false;
        }
        if (pattern.equals(path)) {
            return true;
        }
        List<String> patternSegments = segments(pattern);
        List<String> pathSegments = segments(path);
        if (patternSegments.size() != pathSegments.size()) {
            return false;
        }
        for (int i = 0; i < patternSegments.size(); i++) {
            String patternSegment = patternSegments.get(i);
            if (isParameter(patternSegment)) {
                continue;
            }
            if (!patternSegment.equals(pathSegments.get(i))) {
                return false;
            }
        }
        return true;
    }

    /**
     * Orders patterns of equal length from most to least specific: at the first position where one pattern has a
     * literal segment and the other a parameter, the literal one sorts first.
     */
    public static int compareSpecificity(String left, String right) {
        List<String> leftSegments = segments(left);
        List<String> rightSegments = segments(right);
        int shared = Math.min(leftSegments.size(), rightSegments.size());
        for (int i = 0; i < shared; i++) {
            boolean leftParam = isParameter(leftSegments.get(i));
            boolean rightParam = isParameter(rightSegments.get(i));
            if (leftParam != rightParam) {
                return leftParam ? 1 : -1;
            }
        }
        return Integer.compare(literalCount(rightSegments), literalCount(leftSegments));
    }

    public static List<String> segments(String route) {
        List<String> result = new ArrayList<>();
        if (route == null) {
            return result;
        }
        for (String segment : route.split("/")) {
            if (!segment.isEmpty()) {
                result.add(segment);
            }
        }
        return result;
    }

    public static boolean isParameter(String segment) {
        return segment.startsWith(PARAM_PREFIX);
    }

    private static int literalCount(List<String> segments) {
        int count = 0;
        for (String segment : segments) {
            if (!isParameter(segment)) {
                count++;
            }
        }
        return count;
    }
}
