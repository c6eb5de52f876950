package io.journeyguard.core.model;

import java.util.List;
import java.util.Objects;

/**
 * Resolved type of a node: its top-level {@link NodeKind} plus the effective registry key.
 *
 * <p>
 * The key is the node's own {@code type} for non-action nodes, {@code action.type} for action
 * nodes, and {@code action.metadata.type} for form-family actions. When resolution fails the key
 * may be {@code null} and {@link #problems()} explains why.
 *
 * @param kind     top-level kind
 * @param key      effective registry key, or {@code null} if unresolvable
 * @param problems resolution problems, in detection order
 */
public record NodeType(NodeKind kind, String key, List<String> problems) {

    public NodeType {
        Objects.requireNonNull(kind, "kind must not be null");
        problems = problems == null ? List.of() : List.copyOf(problems);
    }

    /** Returns {@code true} if an effective key was determined. */
    public boolean isResolved() {
        return key != null;
    }
}
