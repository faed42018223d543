package com.monolith.maven.template.eval;

import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Outcome of resolving a path expression against a scope.
 * <p>
 * Callers decide what an unresolved path means for them: variable substitution
 * reads it as text, conditions as truthiness, loops as a sequence.
 */
public final class ResolvedValue {

    public enum Status {
        RESOLVED,
        DEFAULTED,
        ABSENT
    }

    private static final ResolvedValue ABSENT = new ResolvedValue(Status.ABSENT, null);

    private final Status status;
    private final Object value;

    private ResolvedValue(Status status, Object value) {
        this.status = status;
        this.value = value;
    }

    public static ResolvedValue resolved(Object value) {
        return new ResolvedValue(Status.RESOLVED, value);
    }

    public static ResolvedValue defaulted(String defaultValue) {
        return new ResolvedValue(Status.DEFAULTED, defaultValue);
    }

    public static ResolvedValue absent() {
        return ABSENT;
    }

    public Status getStatus() {
        return status;
    }

    /**
     * The native value: the context object, the default literal, or {@code null} when absent.
     */
    public Object getValue() {
        return value;
    }

    public boolean isAbsent() {
        return status == Status.ABSENT;
    }

    /**
     * Text form used for variable substitution. Absent and null values render as "".
     */
    public String asText() {
        return value == null ? "" : String.valueOf(value);
    }

    public boolean isTruthy() {
        if (value == null) {
            return false;
        }
        if (value instanceof Boolean) {
            return (Boolean) value;
        }
        if (value instanceof Number) {
            return ((Number) value).doubleValue() != 0.0;
        }
        if (value instanceof CharSequence) {
            return ((CharSequence) value).length() > 0;
        }
        if (value instanceof Collection) {
            return !((Collection<?>) value).isEmpty();
        }
        if (value instanceof Map) {
            return !((Map<?, ?>) value).isEmpty();
        }
        return true;
    }

    /**
     * Elements a loop iterates over. A value that is not a list is a one-element sequence.
     */
    public List<Object> asIterable() {
        if (value == null) {
            return List.of();
        }
        if (value instanceof List) {
            return Collections.unmodifiableList((List<?>) value);
        }
        return Collections.singletonList(value);
    }

    @Override
    public String toString() {
        return status + "(" + value + ")";
    }
}
