package io.journeyguard.core.model;

import com.fasterxml.jackson.databind.JsonNode;
import io.journeyguard.core.registry.NodeRegistry;
import io.journeyguard.core.registry.NodeTypeDefinition;
import java.util.ArrayList;
import java.util.List;

/**
 * Computes the {@link NodeType} of a node once, so every analyzer sees the same effective key
 * and the same resolution problems.
 *
 * <p>
 * Thread-safe: stateless utility class.
 */
public final class NodeTypeResolver {

    private NodeTypeResolver() {
        // utility class
    }

    /**
     * Resolves the type of a node.
     *
     * @param nodeId   id used in problem messages
     * @param node     the node object
     * @param registry registry used to detect action types misplaced into the node's own type
     * @return the resolved type, never {@code null}
     */
    public static NodeType resolve(String nodeId, JsonNode node, NodeRegistry registry) {
        String type = JsonNodes.text(node, "type");
        NodeKind kind = NodeKind.fromWire(type);
        List<String> problems = new ArrayList<>();

        if (!node.has("type")) {
            problems.add("Node " + nodeId + " is missing a 'type' key.");
            return new NodeType(NodeKind.UNTYPED, null, problems);
        }
        if (type == null) {
            problems.add("Node " + nodeId + " has a non-string 'type' key.");
            return new NodeType(NodeKind.UNTYPED, null, problems);
        }

        if (kind != NodeKind.ACTION) {
            boolean misplacedAction = registry.find(type).map(NodeTypeDefinition::action).orElse(false);
            if (misplacedAction) {
                problems.add("Node " + nodeId + " has an action type: " + type + " in its type which is not valid.");
                return new NodeType(kind, null, problems);
            }
            return new NodeType(kind, type, problems);
        }

        JsonNode action = node.get("action");
        if (action == null || !action.isObject()) {
            problems.add("Node " + nodeId + " is missing an 'action' key.");
            return new NodeType(kind, null, problems);
        }
        String actionType = JsonNodes.text(action, "type");
        if (actionType == null) {
            problems.add("Node " + nodeId + " is missing a 'type' key in the 'action' key.");
            return new NodeType(kind, null, problems);
        }

        if (actionType.contains("form")) {
            JsonNode metadata = action.get("metadata");
            if (metadata == null || !metadata.isObject()) {
                problems.add("Node " + nodeId + " is missing a 'metadata' key in the 'action' key.");
            } else {
                String metadataType = JsonNodes.text(metadata, "type");
                if (metadataType != null) {
                    return new NodeType(kind, metadataType, problems);
                }
                problems.add("Node " + nodeId
                        + " is missing a 'type' key in the 'metadata' key of the 'action' key.");
            }
        }
        return new NodeType(kind, actionType, problems);
    }
}
