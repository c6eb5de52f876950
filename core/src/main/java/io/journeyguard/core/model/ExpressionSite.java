package io.journeyguard.core.model;

/**
 * An expression value found inside a node.
 *
 * @param nodeId      the owning node
 * @param path        dotted location inside the node, e.g. {@code action.text} or {@code links[0].data}
 * @param field       the last path segment, e.g. {@code text}
 * @param value       the expression text
 * @param information whether the owning node is an information action
 */
public record ExpressionSite(String nodeId, String path, String field, String value, boolean information) {}
