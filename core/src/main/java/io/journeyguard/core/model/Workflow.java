package io.journeyguard.core.model;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.journeyguard.core.registry.NodeRegistry;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Snapshot view over the {@code workflow} object of a journey document.
 *
 * <p>
 * Node types are resolved once, at construction. A view must be rebuilt with {@link #of} after
 * any structural mutation of the underlying tree, otherwise its resolved data is stale.
 *
 * <p>
 * Thread-safety: the view itself is immutable, but it shares the mutable Jackson tree.
 */
public final class Workflow {

    private final ObjectNode json;
    private final NodeRegistry registry;
    private final Map<String, JourneyNode> nodes;
    private final List<String> malformedKeys;

    private Workflow(
            ObjectNode json, NodeRegistry registry, Map<String, JourneyNode> nodes, List<String> malformedKeys) {
        this.json = json;
        this.registry = registry;
        this.nodes = nodes;
        this.malformedKeys = malformedKeys;
    }

    /**
     * Builds a view over a workflow object.
     *
     * @param json     the {@code workflow} object
     * @param registry the node type registry used for type resolution
     * @return a fresh view
     */
    public static Workflow of(ObjectNode json, NodeRegistry registry) {
        Objects.requireNonNull(json, "workflow json must not be null");
        Objects.requireNonNull(registry, "registry must not be null");

        Map<String, JourneyNode> nodes = new LinkedHashMap<>();
        List<String> malformed = new ArrayList<>();
        JsonNode nodesJson = json.get("nodes");
        if (nodesJson != null && nodesJson.isObject()) {
            Iterator<Map.Entry<String, JsonNode>> fields = nodesJson.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> entry = fields.next();
                if (!entry.getValue().isObject()) {
                    malformed.add(entry.getKey());
                    continue;
                }
                ObjectNode node = (ObjectNode) entry.getValue();
                NodeType type = NodeTypeResolver.resolve(entry.getKey(), node, registry);
                nodes.put(entry.getKey(), new JourneyNode(entry.getKey(), node, type));
            }
        }
        return new Workflow(
                json, registry, Collections.unmodifiableMap(nodes), Collections.unmodifiableList(malformed));
    }

    /** The {@code workflow.id} value, or {@code null}. */
    public String id() {
        return JsonNodes.text(json, "id");
    }

    public boolean hasId() {
        return json.has("id");
    }

    /** The {@code head} value, or {@code null}. */
    public String head() {
        return JsonNodes.text(json, "head");
    }

    public boolean hasHead() {
        return json.has("head");
    }

    /** Returns {@code true} if {@code nodes} is present and a JSON object. */
    public boolean hasNodes() {
        JsonNode nodesJson = json.get("nodes");
        return nodesJson != null && nodesJson.isObject();
    }

    /** All well-formed nodes, in document order. */
    public Map<String, JourneyNode> nodes() {
        return nodes;
    }

    /** Keys of {@code nodes} entries that are not JSON objects. */
    public List<String> malformedKeys() {
        return malformedKeys;
    }

    public Optional<JourneyNode> node(String id) {
        return id == null ? Optional.empty() : Optional.ofNullable(nodes.get(id));
    }

    public boolean contains(String id) {
        return id != null && nodes.containsKey(id);
    }

    /** Loop and block nodes, in document order. */
    public List<JourneyNode> containers() {
        List<JourneyNode> containers = new ArrayList<>();
        for (JourneyNode node : nodes.values()) {
            if (node.isContainer()) {
                containers.add(node);
            }
        }
        return containers;
    }

    /** The underlying {@code workflow} object. */
    public ObjectNode json() {
        return json;
    }

    /** The {@code nodes} object, or {@code null} when absent. */
    public ObjectNode nodesJson() {
        JsonNode nodesJson = json.get("nodes");
        return nodesJson != null && nodesJson.isObject() ? (ObjectNode) nodesJson : null;
    }

    public NodeRegistry registry() {
        return registry;
    }
}
