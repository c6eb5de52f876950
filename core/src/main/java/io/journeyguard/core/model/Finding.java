package io.journeyguard.core.model;

import java.util.Objects;

/**
 * One analysis result. Findings are accumulated into a {@link ValidationReport}; they are never
 * thrown.
 *
 * @param category the analyzer family that produced it
 * @param severity error or warning
 * @param nodeId   the offending node, or {@code null} for document-level findings
 * @param field    the offending field path, or {@code null}
 * @param message  human-readable message
 * @param hint     how the finding can be fixed
 */
public record Finding(
        Category category, Severity severity, String nodeId, String field, String message, FixHint hint) {

    public Finding {
        Objects.requireNonNull(category, "category must not be null");
        Objects.requireNonNull(severity, "severity must not be null");
        Objects.requireNonNull(message, "message must not be null");
        hint = hint == null ? FixHint.none() : hint;
    }

    public static Finding error(Category category, String nodeId, String message) {
        return new Finding(category, Severity.ERROR, nodeId, null, message, FixHint.none());
    }

    public static Finding warning(Category category, String nodeId, String message) {
        return new Finding(category, Severity.WARNING, nodeId, null, message, FixHint.none());
    }

    /** Returns a copy carrying the given field path. */
    public Finding withField(String field) {
        return new Finding(category, severity, nodeId, field, message, hint);
    }

    /** Returns a copy carrying the given fix hint. */
    public Finding withHint(FixHint hint) {
        return new Finding(category, severity, nodeId, field, message, hint);
    }

    public boolean isFixable() {
        return hint.isFixable();
    }
}
