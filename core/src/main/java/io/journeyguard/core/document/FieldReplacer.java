package io.journeyguard.core.document;

import com.fasterxml.jackson.core.io.JsonStringEncoder;
import com.fasterxml.jackson.databind.JsonNode;
import io.journeyguard.core.error.FieldReplacementException;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Replaces the string value of one node field by sequential text search. The document is never
 * parsed, so replacement also works on malformed JSON.
 *
 * <p>
 * A field path is {@code <node-id>/<field>/.../<field>}; {@code .} is accepted as a separator too.
 * The node is located as an object key whose value opens an object, then each field name is
 * searched after the previous match. Numeric segments are array indices and are skipped.
 */
public final class FieldReplacer {

    private FieldReplacer() {
        // utility class
    }

    /**
     * Replaces the string value at {@code fieldPath}.
     *
     * @param text         the journey text
     * @param fieldPath    node id followed by the field path within the node
     * @param escapedValue the new value, already escaped for a JSON string
     * @return the updated text
     * @throws FieldReplacementException if the node, a field or the string value cannot be found
     */
    public static String replace(String text, String fieldPath, String escapedValue) {
        Objects.requireNonNull(text, "text must not be null");
        Objects.requireNonNull(fieldPath, "fieldPath must not be null");
        Objects.requireNonNull(escapedValue, "escapedValue must not be null");

        List<String> segments = Arrays.asList(fieldPath.replace('.', '/').split("/", -1));
        if (segments.size() < 2) {
            throw new FieldReplacementException("Path must have at least a node id and one field", fieldPath);
        }
        if (segments.stream().anyMatch(String::isEmpty)) {
            throw new FieldReplacementException("Path contains an empty segment", fieldPath);
        }

        String nodeId = segments.get(0);
        Matcher node = Pattern.compile('"' + Pattern.quote(nodeId) + "\"\\s*:\\s*\\{").matcher(text);
        if (!node.find()) {
            throw new FieldReplacementException("Could not find node \"" + nodeId + "\" in nodes section", fieldPath);
        }
        int position = node.end();

        for (String field : segments.subList(1, segments.size())) {
            if (isIndex(field)) {
                continue;
            }
            Matcher match = Pattern.compile('"' + Pattern.quote(field) + "\"\\s*:\\s*").matcher(text);
            if (!match.find(position)) {
                throw new FieldReplacementException(
                        "Could not find field \"" + field + "\" after previous position", fieldPath);
            }
            position = match.end();
        }

        int open = position;
        while (open < text.length() && Character.isWhitespace(text.charAt(open))) {
            open++;
        }
        if (open >= text.length() || text.charAt(open) != '"') {
            throw new FieldReplacementException("Field does not contain a string value", fieldPath);
        }
        int close = closingQuote(text, open + 1);
        if (close < 0) {
            throw new FieldReplacementException("String value is not terminated", fieldPath);
        }
        return text.substring(0, open + 1) + escapedValue + text.substring(close);
    }

    /** Escapes a value for embedding inside a JSON string, without the surrounding quotes. */
    public static String escape(String value) {
        return new String(JsonStringEncoder.getInstance().quoteAsString(value));
    }

    /** Serializes a JSON tree with two-space indentation. */
    public static String stringify(JsonNode value) {
        return PrettyJson.write(value);
    }

    private static int closingQuote(String text, int from) {
        int i = from;
        while (i < text.length()) {
            char c = text.charAt(i);
            if (c == '\\') {
                i += 2;
            } else if (c == '"') {
                return i;
            } else {
                i++;
            }
        }
        return -1;
    }

    private static boolean isIndex(String segment) {
        return segment.chars().allMatch(Character::isDigit);
    }
}
