package io.journeyguard.core.variables;

import io.journeyguard.core.model.JsonNodes;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Lexical extraction of variable references and field accesses from expression text.
 *
 * <p>
 * The expression language is not parsed. Interpolations, quoted strings and {@code @ns.fn(...)}
 * platform calls are stripped with regular expressions and identifiers are matched in what is
 * left, so deeply nested expressions may be read imprecisely.
 *
 * <p>
 * Thread-safe: stateless utility class.
 */
public final class ExpressionReferences {

    static final Pattern INTERPOLATION = Pattern.compile("\\$\\{([^}]+)\\}");
    static final Pattern BACKTICK_SPAN = Pattern.compile("`[^`]*`");
    private static final Pattern DOUBLE_QUOTED = Pattern.compile("\"[^\"]*\"");
    private static final Pattern SINGLE_QUOTED = Pattern.compile("'[^']*'");
    private static final Pattern STARTS_WITH_IDENTIFIER = Pattern.compile("^[a-zA-Z_]");

    private static final Pattern REFERENCE_CALL = Pattern.compile(
            "@[a-zA-Z_][a-zA-Z0-9_]*(?:\\.[a-zA-Z_][a-zA-Z0-9_]*(?:\\([^)]*\\))?)*(?:\\.[a-zA-Z_][a-zA-Z0-9_]*)*");
    private static final Pattern IDENTIFIER =
            Pattern.compile("(?<!@)\\b([a-zA-Z_][a-zA-Z0-9_]*)(?:\\.[a-zA-Z_][a-zA-Z0-9_]*)*");

    private static final Pattern FIELD_CALL =
            Pattern.compile("@[a-zA-Z_][a-zA-Z0-9_]*(?:\\.[a-zA-Z_][a-zA-Z0-9_]*)*(?:\\([^)]*\\))?");
    private static final Pattern FIELD_ACCESS = Pattern.compile(
            "\\b([a-zA-Z_][a-zA-Z0-9_]*)\\.([a-zA-Z_][a-zA-Z0-9_]*(?:\\.[a-zA-Z_][a-zA-Z0-9_]*)*)");

    static final Set<String> KEYWORDS = Set.of(
            "true", "false", "null", "undefined", "True", "False", "None", "if", "else", "return", "var", "let",
            "const");

    private ExpressionReferences() {
        // utility class
    }

    /** A {@code variable.field} access; only the first field of a chain is kept. */
    public record FieldAccess(String variable, String field) {}

    /**
     * Variable names referenced by an expression, in order of appearance (duplicates kept).
     *
     * @param value expression text, may be {@code null}
     */
    public static List<String> references(String value) {
        if (value == null || value.isEmpty()) {
            return List.of();
        }
        String cleaned = value;
        if (value.contains("${")) {
            List<String> interpolations = interpolations(value);
            if (!interpolations.isEmpty()) {
                cleaned = String.join(" ", interpolations);
            }
        } else if (JsonNodes.isBacktickWrapped(value)) {
            return List.of();
        } else if (!value.contains("`")) {
            if (!STARTS_WITH_IDENTIFIER.matcher(value.strip()).find()) {
                return List.of();
            }
        } else {
            cleaned = BACKTICK_SPAN.matcher(value).replaceAll("");
        }

        cleaned = DOUBLE_QUOTED.matcher(cleaned).replaceAll("");
        cleaned = SINGLE_QUOTED.matcher(cleaned).replaceAll("");
        cleaned = REFERENCE_CALL.matcher(cleaned).replaceAll("");

        List<String> names = new ArrayList<>();
        Matcher matcher = IDENTIFIER.matcher(cleaned);
        while (matcher.find()) {
            String name = matcher.group(1);
            if (!value.contains("@" + name) && !KEYWORDS.contains(name)) {
                names.add(name);
            }
        }
        return names;
    }

    /**
     * Field accesses of the form {@code var.field(.more)*} in an expression, in order of
     * appearance. Accesses on {@code @var} are ignored.
     */
    public static List<FieldAccess> fieldAccesses(String value) {
        if (value == null || value.isEmpty()) {
            return List.of();
        }
        String cleaned = value;
        if (value.contains("${")) {
            List<String> interpolations = interpolations(value);
            if (!interpolations.isEmpty()) {
                cleaned = String.join(" ", interpolations);
            }
        } else if (JsonNodes.isBacktickWrapped(value)) {
            cleaned = JsonNodes.stripOuterBackticks(value);
        } else if (!value.contains("`")) {
            if (!value.contains(".")) {
                return List.of();
            }
        } else {
            cleaned = BACKTICK_SPAN.matcher(value).replaceAll("");
        }

        cleaned = DOUBLE_QUOTED.matcher(cleaned).replaceAll("");
        cleaned = SINGLE_QUOTED.matcher(cleaned).replaceAll("");
        cleaned = FIELD_CALL.matcher(cleaned).replaceAll("");

        List<FieldAccess> accesses = new ArrayList<>();
        Matcher matcher = FIELD_ACCESS.matcher(cleaned);
        while (matcher.find()) {
            String variable = matcher.group(1);
            if (!value.contains("@" + variable)) {
                String chain = matcher.group(2);
                int dot = chain.indexOf('.');
                accesses.add(new FieldAccess(variable, dot < 0 ? chain : chain.substring(0, dot)));
            }
        }
        return accesses;
    }

    /** Bodies of every {@code ${...}} interpolation, in order. */
    public static List<String> interpolations(String value) {
        List<String> bodies = new ArrayList<>();
        Matcher matcher = INTERPOLATION.matcher(value);
        while (matcher.find()) {
            bodies.add(matcher.group(1));
        }
        return bodies;
    }
}
