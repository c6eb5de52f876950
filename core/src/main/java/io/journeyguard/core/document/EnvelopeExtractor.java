package io.journeyguard.core.document;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.journeyguard.core.error.EnvelopeException;
import java.util.Objects;

/**
 * Locates the {@code workflow} object of a journey document. Exported journeys carry it at
 * {@code exports[0].data.versions[0].workflow}; bare documents carry a top-level {@code workflow}.
 */
public final class EnvelopeExtractor {

    private EnvelopeExtractor() {
        // utility class
    }

    /**
     * Extracts the workflow.
     *
     * @param root         the document root
     * @param documentName file name used in error reports
     * @return the workflow object, shared with {@code root}
     * @throws EnvelopeException naming the first key missing along the envelope path
     */
    public static ObjectNode extract(ObjectNode root, String documentName) {
        Objects.requireNonNull(root, "root must not be null");
        if (root.has("exports")) {
            return fromExports(root.get("exports"), documentName);
        }
        if (root.has("workflow")) {
            return requireObject(root.get("workflow"), documentName);
        }
        throw new EnvelopeException("The journey JSON should have an 'exports' or 'workflow' key.", documentName);
    }

    private static ObjectNode fromExports(JsonNode exports, String documentName) {
        if (!exports.isArray()) {
            throw new EnvelopeException("The 'exports' key should have a list value.", documentName);
        }
        JsonNode first = exports.path(0);
        if (!first.isObject() || !first.has("data")) {
            throw new EnvelopeException("The 'exports' key should have included a 'data' key.", documentName);
        }
        JsonNode data = first.get("data");
        if (!data.isObject() || !data.has("versions")) {
            throw new EnvelopeException("The 'data' key should have included a 'versions' key.", documentName);
        }
        JsonNode version = data.get("versions").path(0);
        if (!version.isObject() || !version.has("workflow")) {
            throw new EnvelopeException("The 'versions' key should have included a 'workflow' key.", documentName);
        }
        return requireObject(version.get("workflow"), documentName);
    }

    private static ObjectNode requireObject(JsonNode workflow, String documentName) {
        if (!workflow.isObject()) {
            throw new EnvelopeException(
                    "The 'workflow' key should have an object value, found " + workflow.getNodeType(), documentName);
        }
        return (ObjectNode) workflow;
    }
}
