package com.monolith.maven.template.eval;

import java.util.List;
import java.util.Map;

/**
 * Resolves dotted path expressions against a scope.
 * <p>
 * Syntax:
 * <pre>
 * education.2.institute
 * education.9.institute | default:'N/A'
 * </pre>
 * All-digit segments index into lists, other segments look up map keys. A missing key,
 * an index out of range or a segment applied to a scalar makes the walk fail; the
 * result is then the default literal if one was given, otherwise absent.
 */
public final class ValueResolver {

    private static final String DEFAULT_FILTER = "default:";

    private ValueResolver() {
    }

    public static ResolvedValue resolve(String pathExpr, Object scope) {
        if (pathExpr == null) {
            return ResolvedValue.absent();
        }

        String[] parts = pathExpr.split("\\|", -1);
        String path = parts[0].trim();
        String defaultValue = null;
        if (parts.length > 1) {
            defaultValue = parseDefault(parts[1]);
        }

        Object current = scope;
        for (String rawSegment : path.split("\\.", -1)) {
            String segment = rawSegment.trim();
            if (current instanceof List && isDigits(segment)) {
                List<?> list = (List<?>) current;
                int index;
                try {
                    index = Integer.parseInt(segment);
                } catch (NumberFormatException e) {
                    return fallback(defaultValue);
                }
                if (index >= list.size()) {
                    return fallback(defaultValue);
                }
                current = list.get(index);
            } else if (current instanceof Map && ((Map<?, ?>) current).containsKey(segment)) {
                current = ((Map<?, ?>) current).get(segment);
            } else {
                return fallback(defaultValue);
            }
        }
        return ResolvedValue.resolved(current);
    }

    /**
     * Parses the {@code default:'literal'} clause. Returns null when the clause is not a default filter.
     */
    static String parseDefault(String filter) {
        int idx = filter.indexOf(DEFAULT_FILTER);
        if (idx < 0) {
            return null;
        }
        return stripQuotes(filter.substring(idx + DEFAULT_FILTER.length()).trim());
    }

    /**
     * Strips every leading and trailing double quote, then every leading and trailing single quote.
     */
    static String stripQuotes(String text) {
        return strip(strip(text, '"'), '\'');
    }

    private static String strip(String text, char c) {
        int start = 0;
        int end = text.length();
        while (start < end && text.charAt(start) == c) {
            start++;
        }
        while (end > start && text.charAt(end - 1) == c) {
            end--;
        }
        return text.substring(start, end);
    }

    private static boolean isDigits(String segment) {
        if (segment.isEmpty()) {
            return false;
        }
        for (int i = 0; i < segment.length(); i++) {
            if (!Character.isDigit(segment.charAt(i))) {
                return false;
            }
        }
        return true;
    }

    private static ResolvedValue fallback(String defaultValue) {
        return defaultValue != null ? ResolvedValue.defaulted(defaultValue) : ResolvedValue.absent();
    }
}
