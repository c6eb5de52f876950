package io.journeyguard.core.repair;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.journeyguard.core.model.Category;
import io.journeyguard.core.model.JsonNodes;
import io.journeyguard.core.model.NodeKind;
import io.journeyguard.core.registry.NodeRegistry;
import io.journeyguard.core.registry.NodeTypeDefinition;
import io.journeyguard.core.structure.StructureAnalyzer;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.UUID;
import java.util.function.Supplier;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * The default repair catalogue for the {@code workflow} object.
 *
 * <p>
 * Repairs run in a fixed order and mutate the tree in place. Each returns the changes it
 * made; a repair that finds nothing to do returns nothing, so a second pass over a repaired
 * workflow produces no records.
 */
public final class WorkflowRepairs {

    private static final Pattern BACKTICK_CONCATENATION =
            Pattern.compile("`[^`]*`\\s*\\+\\s*[a-zA-Z_][a-zA-Z0-9_.]*");
    private static final Pattern IDENTIFIER = Pattern.compile("[a-zA-Z_][a-zA-Z0-9_.]*");
    private static final List<String> INFORMATION_FIELDS = List.of("text", "title", "button_text");
    private static final Set<String> METADATA_ACTIONS = Set.of("auth_pass", "reject");
    private static final int MAX_EXCERPT = 80;
    private static final Set<String> EMBEDDED_BODIES = Set.of("loop_body", "block");

    private final NodeRegistry registry;
    private final Supplier<UUID> uuids;

    public WorkflowRepairs(NodeRegistry registry, Supplier<UUID> uuids) {
        this.registry = Objects.requireNonNull(registry, "registry must not be null");
        this.uuids = Objects.requireNonNull(uuids, "uuids must not be null");
    }

    /**
     * Applies the whole catalogue to a workflow.
     *
     * @param workflow the {@code workflow} object
     * @return the changes made, in application order
     */
    public List<FixRecord> apply(ObjectNode workflow) {
        List<FixRecord> records = new ArrayList<>();
        if (!(workflow.get("nodes") instanceof ObjectNode)) {
            return records;
        }
        fixIdentifiers(workflow, records);
        records.addAll(resyncBodies(workflow));
        fixInternalBackticks(workflow, records);
        fixSetVariablesBackticks(workflow, records);
        fixLinkKinds(workflow, records);
        fixTerminalMetadata(workflow, records);
        fixGetInformationForms(workflow, records);
        fixStrictEquality(workflow, records);
        fixInformationNodes(workflow, records);
        return records;
    }

    // --- Identifiers ---

    private void fixIdentifiers(ObjectNode workflow, List<FixRecord> records) {
        ObjectNode nodes = (ObjectNode) workflow.get("nodes");
        Map<String, String> mapping = new LinkedHashMap<>();
        nodes.fieldNames().forEachRemaining(key -> {
            if (!StructureAnalyzer.isValidUuid(key)) {
                mapping.put(key, uuids.get().toString());
            }
        });
        String head = JsonNodes.text(workflow, "head");
        if (head != null && !StructureAnalyzer.isValidUuid(head) && !mapping.containsKey(head)) {
            mapping.put(head, uuids.get().toString());
        }

        if (!mapping.isEmpty()) {
            ObjectNode renamed = workflow.objectNode();
            Iterator<Map.Entry<String, JsonNode>> entries = nodes.fields();
            while (entries.hasNext()) {
                Map.Entry<String, JsonNode> entry = entries.next();
                String newId = mapping.getOrDefault(entry.getKey(), entry.getKey());
                if (entry.getValue() instanceof ObjectNode) {
                    ObjectNode node = (ObjectNode) entry.getValue();
                    node.put("id", newId);
                    remapReferences(node, mapping);
                }
                renamed.set(newId, entry.getValue());
            }
            workflow.set("nodes", renamed);
            nodes = renamed;
            if (head != null) {
                workflow.put("head", mapping.getOrDefault(head, head));
            }
            mapping.forEach((from, to) ->
                    records.add(structure(null, "Replaced invalid UUID '" + from + "' with valid UUID '" + to + "'")));
        }

        Iterator<Map.Entry<String, JsonNode>> entries = nodes.fields();
        while (entries.hasNext()) {
            Map.Entry<String, JsonNode> entry = entries.next();
            if (!(entry.getValue() instanceof ObjectNode)) {
                continue;
            }
            ObjectNode node = (ObjectNode) entry.getValue();
            String key = entry.getKey();
            if (!key.equals(JsonNodes.text(node, "id"))) {
                String action = node.has("id") ? "Fixed mismatched" : "Added missing";
                node.put("id", key);
                records.add(structure(key, action + " id for node " + key));
            }
        }

        String workflowId = JsonNodes.text(workflow, "id");
        if (!StructureAnalyzer.isValidUuid(workflowId)) {
            String action = workflow.has("id") ? "Generated new" : "Added missing";
            String newId = uuids.get().toString();
            workflow.put("id", newId);
            records.add(structure(null, action + " workflow ID: " + newId));
        }
    }

    private static void remapReferences(ObjectNode node, Map<String, String> mapping) {
        JsonNode links = node.get("links");
        if (links != null && links.isArray()) {
            for (JsonNode link : links) {
                String target = JsonNodes.text(link, "target");
                if (target != null && !target.isEmpty() && mapping.containsKey(target)) {
                    ((ObjectNode) link).put("target", mapping.get(target));
                }
            }
        }
        NodeKind kind = NodeKind.fromWire(JsonNodes.text(node, "type"));
        if (kind.isContainer() && node.get(kind.bodyKey()) instanceof ObjectNode) {
            ObjectNode body = (ObjectNode) node.get(kind.bodyKey());
            String entryId = JsonNodes.text(body, "id");
            if (entryId != null && mapping.containsKey(entryId)) {
                body.put("id", mapping.get(entryId));
            }
        }
    }

    // --- Embedded bodies ---

    /**
     * Replaces every embedded loop or block body that differs from its node in the nodes map with
     * a deep copy of that node. Passes repeat until stable so nested bodies end up consistent.
     *
     * @param workflow the {@code workflow} object
     * @return one record per container whose body changed
     */
    public List<FixRecord> resyncBodies(ObjectNode workflow) {
        List<FixRecord> records = new ArrayList<>();
        if (!(workflow.get("nodes") instanceof ObjectNode)) {
            return records;
        }
        ObjectNode nodes = (ObjectNode) workflow.get("nodes");
        Map<String, FixRecord> changed = new LinkedHashMap<>();
        int containers = 0;
        for (JsonNode node : nodes) {
            if (NodeKind.fromWire(JsonNodes.text(node, "type")).isContainer()) {
                containers++;
            }
        }
        for (int pass = 0; pass <= containers; pass++) {
            boolean dirty = false;
            Iterator<Map.Entry<String, JsonNode>> entries = nodes.fields();
            while (entries.hasNext()) {
                Map.Entry<String, JsonNode> entry = entries.next();
                JsonNode node = entry.getValue();
                NodeKind kind = NodeKind.fromWire(JsonNodes.text(node, "type"));
                if (!kind.isContainer() || !node.isObject()) {
                    continue;
                }
                String bodyKey = kind.bodyKey();
                JsonNode body = node.get(bodyKey);
                String entryId = JsonNodes.text(body, "id");
                JsonNode entryNode = entryId == null ? null : nodes.get(entryId);
                if (entryNode == null || !entryNode.isObject() || entryNode.equals(body)) {
                    continue;
                }
                ((ObjectNode) node).set(bodyKey, entryNode.deepCopy());
                String key = entry.getKey();
                changed.putIfAbsent(key, structure(key, "Node " + key + ": Synchronized '" + bodyKey
                        + "' field with node " + entryId + " from nodes dictionary"));
                dirty = true;
            }
            if (!dirty) {
                break;
            }
        }
        records.addAll(changed.values());
        return records;
    }

    // --- Expression text ---

    private void fixInternalBackticks(ObjectNode workflow, List<FixRecord> records) {
        forEachNode(workflow, (key, node) -> {
            String type = JsonNodes.text(node, "type");
            JsonNode condition = node.get("condition");
            if ("loop".equals(type) && JsonNodes.isExpression(condition)) {
                String value = JsonNodes.expressionText(condition);
                String fixed = replaceInternalBackticks(value);
                if (fixed != null) {
                    ((ObjectNode) condition).put("value", fixed);
                    records.add(expressions(key, "Node " + key + ": Fixed backticks in loop condition: " + value
                            + " → " + fixed));
                }
            } else if ("condition".equals(type) && condition != null && condition.isObject()) {
                for (String field : List.of("field", "value")) {
                    JsonNode expression = condition.get(field);
                    String value = JsonNodes.expressionText(expression);
                    String fixed = replaceInternalBackticks(value);
                    if (fixed != null) {
                        ((ObjectNode) expression).put("value", fixed);
                        records.add(expressions(key, "Node " + key + ": Replaced internal backticks with quotes in "
                                + "condition '" + field + "': " + value + " → " + fixed));
                    }
                }
            }
        });
    }

    /**
     * Drops the outer backticks of a wrapped value and turns its inner backticks into double
     * quotes; returns {@code null} when the value has no inner backticks.
     */
    static String replaceInternalBackticks(String value) {
        if (value == null || value.length() < 2 || !JsonNodes.isBacktickWrapped(value)) {
            return null;
        }
        String inner = value.substring(1, value.length() - 1);
        return inner.contains("`") ? inner.replace('`', '"') : null;
    }

    private void fixSetVariablesBackticks(ObjectNode workflow, List<FixRecord> records) {
        forEachAction(workflow, (key, node, action) -> {
            JsonNode variables = action.get("variables");
            if (!"set_variables".equals(JsonNodes.text(action, "type")) || variables == null || !variables.isArray()) {
                return;
            }
            for (JsonNode variable : variables) {
                JsonNode expression = variable.get("value");
                String value = JsonNodes.expressionText(expression);
                if (value != null && value.length() >= 4 && value.startsWith("`{") && value.endsWith("}`")) {
                    String fixed = value.substring(1, value.length() - 1);
                    ((ObjectNode) expression).put("value", fixed);
                    records.add(expressions(key, "Node " + key + ": Removed unnecessary backticks from variable '"
                            + JsonNodes.text(variable, "name") + "': " + excerpt(value) + " → " + excerpt(fixed)));
                }
            }
        });
    }

    // --- Links and action shape ---

    private void fixLinkKinds(ObjectNode workflow, List<FixRecord> records) {
        forEachNode(workflow, (key, node) -> {
            String type = JsonNodes.text(node, "type");
            JsonNode action = node.get("action");
            boolean isAction = "action".equals(type) && action != null && action.isObject();
            String lookup = isAction ? JsonNodes.text(action, "type") : type;
            NodeTypeDefinition definition = lookup == null ? null : registry.find(lookup).orElse(null);
            JsonNode links = node.get("links");
            if (definition == null || !definition.hasRequiredLinks() || links == null || !links.isArray()) {
                return;
            }
            String display = isAction ? type + "/" + lookup : type;
            for (JsonNode link : links) {
                String name = JsonNodes.text(link, "name");
                String expected = name == null ? null : definition.expectedLinkType(name);
                String current = JsonNodes.text(link, "type");
                if (expected != null && !expected.equals(current)) {
                    ((ObjectNode) link).put("type", expected);
                    records.add(structure(key, "Node " + key + " (" + display + "): Fixed link '" + name
                            + "' type from '" + current + "' to '" + expected + "'"));
                }
            }
        });
    }

    private void fixTerminalMetadata(ObjectNode workflow, List<FixRecord> records) {
        forEachAction(workflow, (key, node, action) -> {
            String actionType = JsonNodes.text(action, "type");
            if (METADATA_ACTIONS.contains(actionType) && !action.has("metadata")) {
                action.putObject("metadata").put("type", actionType);
                records.add(new FixRecord(Category.REQUIRED_FIELDS, key, "Node " + key
                        + ": Added missing 'metadata' field to " + actionType + " action node"));
            }
        });
    }

    private void fixGetInformationForms(ObjectNode workflow, List<FixRecord> records) {
        forEachAction(workflow, (key, node, action) -> {
            if (!"get_information".equals(JsonNodes.text(action, "type"))) {
                return;
            }
            action.put("type", "form");
            ObjectNode metadata = action.get("metadata") instanceof ObjectNode
                    ? (ObjectNode) action.get("metadata")
                    : action.putObject("metadata");
            metadata.put("type", "get_information");
            records.add(structure(key, "Node " + key + ": Converted deprecated 'get_information' action to form "
                    + "structure with metadata"));
        });
    }

    // --- Operators ---

    /** Every expression in a node except the embedded bodies, which the final resync rewrites. */
    private void fixStrictEquality(ObjectNode workflow, List<FixRecord> records) {
        forEachNode(workflow, (key, node) -> normalizeChildren(node, key, "", EMBEDDED_BODIES, records));
    }

    private static void normalizeEquality(JsonNode json, String key, String path, List<FixRecord> records) {
        if (!json.isObject()) {
            return;
        }
        String value = JsonNodes.expressionText(json);
        if (value != null) {
            List<String> changes = new ArrayList<>();
            String fixed = value;
            int notEqual = count(fixed, "!==");
            if (notEqual > 0) {
                fixed = fixed.replace("!==", "!=");
                changes.add("!== → != (" + occurrences(notEqual) + ")");
            }
            int equal = count(fixed, "===");
            if (equal > 0) {
                fixed = fixed.replace("===", "==");
                changes.add("=== → == (" + occurrences(equal) + ")");
            }
            if (!changes.isEmpty()) {
                ((ObjectNode) json).put("value", fixed);
                records.add(expressions(key, "Node " + key + " field '" + path
                        + "': Fixed strict equality operators: " + String.join(", ", changes)));
            }
        }
        normalizeChildren(json, key, path, Set.of(), records);
    }

    private static void normalizeChildren(
            JsonNode json, String key, String path, Set<String> skipped, List<FixRecord> records) {
        Iterator<Map.Entry<String, JsonNode>> fields = json.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            if (skipped.contains(field.getKey())) {
                continue;
            }
            JsonNode child = field.getValue();
            String childPath = path.isEmpty() ? field.getKey() : path + "." + field.getKey();
            if (child.isObject()) {
                normalizeEquality(child, key, childPath, records);
            } else if (child.isArray()) {
                for (int i = 0; i < child.size(); i++) {
                    normalizeEquality(child.get(i), key, childPath + "[" + i + "]", records);
                }
            }
        }
    }

    private static int count(String text, String token) {
        int count = 0;
        for (int i = text.indexOf(token); i >= 0; i = text.indexOf(token, i + token.length())) {
            count++;
        }
        return count;
    }

    private static String occurrences(int count) {
        return count + (count > 1 ? " occurrences" : " occurrence");
    }

    // --- Information nodes ---

    private void fixInformationNodes(ObjectNode workflow, List<FixRecord> records) {
        forEachAction(workflow, (key, node, action) -> {
            if (!"information".equals(JsonNodes.text(action, "type"))) {
                return;
            }
            if (!action.has("title")) {
                action.putObject("title").put("type", JsonNodes.EXPRESSION).put("value", "\"\"");
                records.add(new FixRecord(Category.REQUIRED_FIELDS, key, "Node " + key
                        + ": Added missing 'title' field to information node with empty string value"));
            }
            for (String field : INFORMATION_FIELDS) {
                JsonNode expression = action.get(field);
                String value = JsonNodes.expressionText(expression);
                String fixed = value == null ? null : rebuildConcatenation(value);
                if (fixed != null && !fixed.equals(value)) {
                    ((ObjectNode) expression).put("value", fixed);
                    records.add(expressions(key, "Node " + key + ": Converted excessive backticking to template "
                            + "literal in " + field + " field: " + excerpt(value) + " → " + excerpt(fixed)));
                }
            }
        });
    }

    /**
     * Rewrites {@code `a` + x + `b`} style concatenation, optionally wrapped in double backticks,
     * into a single template {@code `"a" x "b"`}. Returns {@code null} when the value has no
     * such concatenation or cannot be tokenized.
     */
    static String rebuildConcatenation(String value) {
        String clean = value.strip();
        boolean doubleWrapped = false;
        if (clean.startsWith("`` ") && clean.endsWith(" ``")) {
            doubleWrapped = true;
            clean = clean.length() > 6 ? clean.substring(3, clean.length() - 3).strip() : "";
        } else if (clean.startsWith("``") && clean.endsWith("``")) {
            doubleWrapped = true;
            clean = clean.length() > 4 ? clean.substring(2, clean.length() - 2).strip() : "";
        }
        if (!doubleWrapped && !BACKTICK_CONCATENATION.matcher(clean).find()) {
            return null;
        }

        List<String> parts = new ArrayList<>();
        int pos = 0;
        while (pos < clean.length()) {
            char c = clean.charAt(pos);
            if (Character.isWhitespace(c)) {
                pos++;
            } else if (c == '`') {
                int end = clean.indexOf('`', pos + 1);
                if (end < 0) {
                    return null;
                }
                parts.add("\"" + clean.substring(pos + 1, end) + "\"");
                pos = end + 1;
            } else if (c == '+') {
                pos++;
            } else {
                Matcher matcher = IDENTIFIER.matcher(clean).region(pos, clean.length());
                if (!matcher.lookingAt()) {
                    return null;
                }
                parts.add(matcher.group());
                pos = matcher.end();
            }
        }
        return parts.isEmpty() ? null : "`" + String.join(" ", parts) + "`";
    }

    // --- Helpers ---

    @FunctionalInterface
    private interface NodeVisitor {
        void visit(String key, ObjectNode node);
    }

    @FunctionalInterface
    private interface ActionVisitor {
        void visit(String key, ObjectNode node, ObjectNode action);
    }

    private static void forEachNode(ObjectNode workflow, NodeVisitor visitor) {
        JsonNode nodes = workflow.get("nodes");
        if (nodes == null || !nodes.isObject()) {
            return;
        }
        Iterator<Map.Entry<String, JsonNode>> entries = nodes.fields();
        while (entries.hasNext()) {
            Map.Entry<String, JsonNode> entry = entries.next();
            if (entry.getValue() instanceof ObjectNode) {
                visitor.visit(entry.getKey(), (ObjectNode) entry.getValue());
            }
        }
    }

    private static void forEachAction(ObjectNode workflow, ActionVisitor visitor) {
        forEachNode(workflow, (key, node) -> {
            if ("action".equals(JsonNodes.text(node, "type")) && node.get("action") instanceof ObjectNode) {
                visitor.visit(key, node, (ObjectNode) node.get("action"));
            }
        });
    }

    static ArrayNode linksOf(ObjectNode node) {
        return node.get("links") instanceof ArrayNode ? (ArrayNode) node.get("links") : node.putArray("links");
    }

    private static String excerpt(String value) {
        return value.length() > MAX_EXCERPT ? value.substring(0, MAX_EXCERPT) + "..." : value;
    }

    private static FixRecord structure(String nodeId, String description) {
        return new FixRecord(Category.STRUCTURE, nodeId, description);
    }

    private static FixRecord expressions(String nodeId, String description) {
        return new FixRecord(Category.EXPRESSIONS, nodeId, description);
    }
}
