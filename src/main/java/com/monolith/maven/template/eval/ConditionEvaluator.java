package com.monolith.maven.template.eval;

import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Evaluates the condition of an {@code if}/{@code elseif} tag.
 * <p>
 * A condition is one of:
 * <ul>
 *   <li>the literal {@code true} or {@code false} (any case),</li>
 *   <li>a comparison {@code left OP right} with OP in {@code == != >= <= > <},</li>
 *   <li>a path, true when the resolved value is truthy.</li>
 * </ul>
 * Operators are looked for in the order listed, so {@code >=} wins over {@code >}.
 */
public final class ConditionEvaluator {

    private static final List<String> OPERATORS = List.of("==", "!=", ">=", "<=", ">", "<");

    private static final Pattern NUMBER = Pattern.compile("[+-]?(\\d+\\.?\\d*|\\.\\d+)([eE][+-]?\\d+)?");

    private ConditionEvaluator() {
    }

    public static boolean evaluate(String expr, Object scope) {
        String condition = expr == null ? "" : expr.trim();

        if (condition.equalsIgnoreCase("true")) {
            return true;
        }
        if (condition.equalsIgnoreCase("false")) {
            return false;
        }

        for (String op : OPERATORS) {
            int idx = condition.indexOf(op);
            if (idx < 0) {
                continue;
            }
            Object left = operand(condition.substring(0, idx), scope);
            Object right = operand(condition.substring(idx + op.length()), scope);
            return compare(left, op, right);
        }

        return ValueResolver.resolve(condition, scope).isTruthy();
    }

    /**
     * Resolves one side of a comparison. Text that is not a resolvable path is used as a literal.
     */
    private static Object operand(String text, Object scope) {
        String trimmed = text.trim();
        ResolvedValue resolved = ValueResolver.resolve(trimmed, scope);
        if (resolved.isAbsent()) {
            return stripQuoteChars(trimmed);
        }
        return resolved.getValue();
    }

    static boolean compare(Object left, String op, Object right) {
        Double l = toNumber(left);
        Double r = toNumber(right);
        if (l != null && r != null) {
            switch (op) {
                case "==":
                    return l.doubleValue() == r.doubleValue();
                case "!=":
                    return l.doubleValue() != r.doubleValue();
                case ">=":
                    return l >= r;
                case "<=":
                    return l <= r;
                case ">":
                    return l > r;
                case "<":
                    return l < r;
                default:
                    return false;
            }
        }

        // Order operators are undefined on text
        String ls = text(left).toLowerCase(Locale.ROOT);
        String rs = stripQuoteChars(text(right)).toLowerCase(Locale.ROOT);
        switch (op) {
            case "==":
                return ls.equals(rs);
            case "!=":
                return !ls.equals(rs);
            default:
                return false;
        }
    }

    private static Double toNumber(Object value) {
        if (value instanceof Boolean) {
            return (Boolean) value ? 1.0 : 0.0;
        }
        if (value instanceof Number) {
            return ((Number) value).doubleValue();
        }
        if (value instanceof CharSequence) {
            String s = value.toString().trim();
            if (NUMBER.matcher(s).matches()) {
                return Double.parseDouble(s);
            }
        }
        return null;
    }

    /**
     * Strips any run of single and double quotes, in any mix, from both ends.
     */
    static String stripQuoteChars(String text) {
        int start = 0;
        int end = text.length();
        while (start < end && isQuote(text.charAt(start))) {
            start++;
        }
        while (end > start && isQuote(text.charAt(end - 1))) {
            end--;
        }
        return text.substring(start, end);
    }

    private static boolean isQuote(char c) {
        return c == '"' || c == '\'';
    }

    private static String text(Object value) {
        return value == null ? "" : String.valueOf(value);
    }
}
