package io.journeyguard.core.model;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Shared JSON tree helpers used by the views, analyzers and repairs.
 *
 * <p>
 * Thread-safe: stateless utility class.
 */
public final class JsonNodes {

    /** Discriminator value marking an expression object. */
    public static final String EXPRESSION = "expression";

    private JsonNodes() {}

    /**
     * Returns the textual value of {@code field} on {@code node}, or {@code null} when the node is
     * absent, the field is absent, or the field is not a JSON string.
     */
    public static String text(JsonNode node, String field) {
        if (node == null || !node.isObject()) {
            return null;
        }
        JsonNode value = node.get(field);
        return value != null && value.isTextual() ? value.asText() : null;
    }

    /** Returns {@code true} for a non-empty JSON string field. */
    public static boolean hasText(JsonNode node, String field) {
        String value = text(node, field);
        return value != null && !value.isEmpty();
    }

    /** Returns {@code true} if {@code node} is an object of the form {@code {"type": "expression", "value": ...}}. */
    public static boolean isExpression(JsonNode node) {
        return node != null && node.isObject() && EXPRESSION.equals(text(node, "type")) && node.has("value");
    }

    /**
     * Returns the expression text of an expression object, or {@code null} if the node is not an
     * expression or its value is not a string.
     */
    public static String expressionText(JsonNode node) {
        if (!isExpression(node)) {
            return null;
        }
        JsonNode value = node.get("value");
        return value.isTextual() ? value.asText() : null;
    }

    /** Returns {@code true} if {@code value} both starts and ends with a backtick. */
    public static boolean isBacktickWrapped(String value) {
        return value != null && value.startsWith("`") && value.endsWith("`");
    }

    /** Removes one leading and one trailing backtick if the value is backtick-wrapped. */
    public static String stripOuterBackticks(String value) {
        if (!isBacktickWrapped(value)) {
            return value;
        }
        return value.length() < 2 ? "" : value.substring(1, value.length() - 1);
    }

    /** Removes every leading and trailing backtick, like a character strip. */
    public static String trimBackticks(String value) {
        int start = 0;
        int end = value.length();
        while (start < end && value.charAt(start) == '`') {
            start++;
        }
        while (end > start && value.charAt(end - 1) == '`') {
            end--;
        }
        return value.substring(start, end);
    }

    /** Name of the JSON type of {@code node} for messages: {@code string}, {@code number}, {@code object}, ... */
    public static String typeName(JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            return "null";
        }
        if (node.isTextual()) {
            return "string";
        }
        if (node.isIntegralNumber()) {
            return "integer";
        }
        if (node.isNumber()) {
            return "number";
        }
        if (node.isBoolean()) {
            return "boolean";
        }
        return node.isArray() ? "array" : "object";
    }
}
