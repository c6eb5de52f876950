package io.journeyguard.core.model;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * View over one entry of a node's {@code links} array.
 *
 * <p>
 * A {@code null} or empty target means "no outgoing edge"; loop bodies use such links to
 * signal a retry, so it is not an error.
 *
 * @param index        position within the links array
 * @param name         link name, or {@code null}
 * @param rawType      declared {@code type}, or {@code null}
 * @param target       target node id, or {@code null}
 * @param presentation declared {@code presentation}, or {@code null}
 * @param json         the underlying JSON value (may be a non-object)
 */
public record Link(int index, String name, String rawType, String target, String presentation, JsonNode json) {

    static Link of(int index, JsonNode json) {
        return new Link(
                index,
                JsonNodes.text(json, "name"),
                JsonNodes.text(json, "type"),
                JsonNodes.text(json, "target"),
                JsonNodes.text(json, "presentation"),
                json);
    }

    /** Returns {@code true} if the array entry is a JSON object. */
    public boolean isObject() {
        return json != null && json.isObject();
    }

    /** Returns {@code true} if the link points somewhere. */
    public boolean hasTarget() {
        return target != null && !target.isEmpty();
    }

    /** Returns {@code true} if the link object carries a {@code name} key. */
    public boolean hasName() {
        return isObject() && json.has("name");
    }

    /** Returns {@code true} if the link object carries a {@code type} key. */
    public boolean hasType() {
        return isObject() && json.has("type");
    }

    /** Returns {@code true} if the link object carries a {@code presentation} key. */
    public boolean hasPresentation() {
        return isObject() && json.has("presentation");
    }

    /** The parsed kind, or {@code null} if the declared type is not a known kind. */
    public LinkKind kind() {
        return LinkKind.fromWire(rawType).orElse(null);
    }

    /** Returns {@code true} if this link is of the given kind. */
    public boolean is(LinkKind kind) {
        return kind.wireName().equals(rawType);
    }

    /** Name for messages: the declared name, or {@code link[i]}. */
    public String displayName() {
        return name != null ? name : "link[" + index + "]";
    }
}
