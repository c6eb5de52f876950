package io.journeyguard.core.model;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * Read-only view over one entry of the workflow's {@code nodes} map. The underlying
 * {@link ObjectNode} stays the source of truth; repairs mutate it and rebuild the
 * {@link Workflow} view afterwards.
 */
public final class JourneyNode {

    private final String key;
    private final ObjectNode json;
    private final NodeType type;
    private final List<Link> links;
    private final BodyRef bodyRef;

    JourneyNode(String key, ObjectNode json, NodeType type) {
        this.key = key;
        this.json = json;
        this.type = type;
        this.links = readLinks(json);
        this.bodyRef = readBody(key, json, type.kind());
    }

    private static List<Link> readLinks(ObjectNode json) {
        JsonNode array = json.get("links");
        if (array == null || !array.isArray()) {
            return List.of();
        }
        List<Link> result = new ArrayList<>(array.size());
        for (int i = 0; i < array.size(); i++) {
            result.add(Link.of(i, array.get(i)));
        }
        return Collections.unmodifiableList(result);
    }

    private static BodyRef readBody(String key, ObjectNode json, NodeKind kind) {
        if (!kind.isContainer()) {
            return null;
        }
        JsonNode body = json.get(kind.bodyKey());
        if (body == null || !body.isObject()) {
            return new BodyRef(key, kind, null, null);
        }
        return new BodyRef(key, kind, body, JsonNodes.text(body, "id"));
    }

    /** The key under which this node is stored in the nodes map. */
    public String key() {
        return key;
    }

    /** The node's own {@code id} field, or {@code null} when absent or not a string. */
    public String declaredId() {
        return JsonNodes.text(json, "id");
    }

    /** Returns {@code true} if the node object carries an {@code id} key. */
    public boolean hasDeclaredId() {
        return json.has("id");
    }

    /** The node's own {@code type} field, or {@code null}. */
    public String rawType() {
        return JsonNodes.text(json, "type");
    }

    public NodeType type() {
        return type;
    }

    public NodeKind kind() {
        return type.kind();
    }

    /** The effective registry key, or {@code null} when unresolved. */
    public String typeKey() {
        return type.key();
    }

    /** The {@code action} object of an action node, or {@code null}. */
    public JsonNode action() {
        JsonNode action = json.get("action");
        return action != null && action.isObject() ? action : null;
    }

    /** The {@code action.type} value, or {@code null}. */
    public String actionType() {
        return JsonNodes.text(action(), "type");
    }

    /** Returns {@code true} if this is an action node whose {@code action.type} equals {@code actionType}. */
    public boolean isAction(String actionType) {
        return type.kind() == NodeKind.ACTION && actionType.equals(actionType());
    }

    /** Returns {@code true} if {@code action.type} mentions {@code form}. */
    public boolean isFormAction() {
        String actionType = actionType();
        return type.kind() == NodeKind.ACTION && actionType != null && actionType.contains("form");
    }

    /** Returns {@code true} if the node is an information action. */
    public boolean isInformation() {
        return isAction("information");
    }

    public boolean isContainer() {
        return type.kind().isContainer();
    }

    /** Outgoing links in declaration order; empty when {@code links} is absent or not an array. */
    public List<Link> links() {
        return links;
    }

    /** Link targets in declaration order, skipping links without a target. */
    public List<String> targets() {
        List<String> targets = new ArrayList<>(links.size());
        for (Link link : links) {
            if (link.hasTarget()) {
                targets.add(link.target());
            }
        }
        return targets;
    }

    /** The body reference of a loop or block node. */
    public Optional<BodyRef> bodyRef() {
        return Optional.ofNullable(bodyRef);
    }

    /** The underlying JSON object. Mutations are visible to the document but not to this view. */
    public ObjectNode json() {
        return json;
    }

    @Override
    public String toString() {
        return "JourneyNode{key=" + key + ", type=" + type.key() + "}";
    }
}
