package io.journeyguard.core.model;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Reference from a loop or block container to its body.
 *
 * <p>
 * The {@code body} is the embedded, denormalized copy of the body's entry node. The canonical
 * entry node lives in the workflow's node map under {@link #entryId()}.
 *
 * @param containerId id of the loop/block node
 * @param kind        container kind, {@link NodeKind#LOOP} or {@link NodeKind#BLOCK}
 * @param body        embedded body object, or {@code null} if the field is absent or not an object
 * @param entryId     {@code body.id}, or {@code null}
 */
public record BodyRef(String containerId, NodeKind kind, JsonNode body, String entryId) {

    /** The field that holds the embedded body ({@code loop_body} or {@code block}). */
    public String bodyKey() {
        return kind.bodyKey();
    }

    /** Returns {@code true} if an embedded body object is present. */
    public boolean hasBody() {
        return body != null;
    }

    /** Returns {@code true} if the body names its entry node. */
    public boolean hasEntryId() {
        return entryId != null;
    }
}
