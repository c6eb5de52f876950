package io.journeyguard.core.repair;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.json.JsonWriteFeature;
import com.fasterxml.jackson.core.util.MinimalPrettyPrinter;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.journeyguard.core.model.Category;
import io.journeyguard.core.model.Finding;
import io.journeyguard.core.model.FixHint;
import io.journeyguard.core.model.JsonNodes;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.UUID;
import java.util.function.Supplier;

/**
 * Applies the variable fixes carried by {@link FixHint}s: declaring variables in the journey's
 * initial {@code set_variables} step and adding missing fields to variable initializers.
 */
public final class VariableRepairs {

    private static final ObjectMapper MAPPER =
            new ObjectMapper().enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS);
    private static final ObjectWriter INITIALIZER_WRITER =
            MAPPER.writer(new SpacedPrinter()).with(JsonWriteFeature.ESCAPE_NON_ASCII);
    private static final Set<String> EMPTY_INITIALIZERS = Set.of("null", "{}", "`{}`", "\"{}\"");
    private static final String NULL_VALUE = "null";

    private final Supplier<UUID> uuids;

    public VariableRepairs(Supplier<UUID> uuids) {
        this.uuids = Objects.requireNonNull(uuids, "uuids must not be null");
    }

    // --- Declarations ---

    /**
     * Declares every variable named by a {@link FixHint.Type#DECLARE_VARIABLE} hint with the value
     * {@code null}, creating the initial {@code set_variables} node when the journey has none.
     */
    public List<FixRecord> declare(ObjectNode workflow, List<Finding> findings) {
        Set<String> names = new LinkedHashSet<>();
        for (Finding finding : findings) {
            if (finding.hint().type() == FixHint.Type.DECLARE_VARIABLE) {
                names.add(finding.hint().variable());
            }
        }
        return declare(workflow, names);
    }

    List<FixRecord> declare(ObjectNode workflow, Set<String> names) {
        List<FixRecord> records = new ArrayList<>();
        ObjectNode nodes = workflow.get("nodes") instanceof ObjectNode ? (ObjectNode) workflow.get("nodes") : null;
        String head = JsonNodes.text(workflow, "head");
        if (names.isEmpty() || nodes == null || !(nodes.get(head) instanceof ObjectNode)) {
            return records;
        }

        String targetId = findInitialSetVariables(nodes, head);
        if (targetId != null) {
            Set<String> existing = variableNames(nodes.get(targetId));
            names = new LinkedHashSet<>(names);
            names.removeAll(existing);
            if (names.isEmpty()) {
                return records;
            }
        } else {
            targetId = createInitialSetVariables(nodes, (ObjectNode) nodes.get(head));
            records.add(new FixRecord(Category.VARIABLES, targetId,
                    "Created new set_variables node " + targetId + " at the start of the journey"));
        }

        ObjectNode action = (ObjectNode) nodes.get(targetId).get("action");
        ArrayNode variables = action.get("variables") instanceof ArrayNode
                ? (ArrayNode) action.get("variables")
                : action.putArray("variables");
        for (String name : names) {
            ObjectNode variable = variables.addObject();
            variable.put("name", name);
            variable.putObject("value").put("type", JsonNodes.EXPRESSION).put("value", NULL_VALUE);
            records.add(new FixRecord(Category.VARIABLES, targetId,
                    "Added variable '" + name + "' with value '" + NULL_VALUE + "' to set_variables node " + targetId));
        }
        return records;
    }

    /** The head, or the head's first link target, when it is a {@code set_variables} action. */
    private static String findInitialSetVariables(ObjectNode nodes, String head) {
        JsonNode headNode = nodes.get(head);
        if (isSetVariables(headNode)) {
            return head;
        }
        String first = firstTarget(headNode);
        return first != null && isSetVariables(nodes.get(first)) ? first : null;
    }

    private String createInitialSetVariables(ObjectNode nodes, ObjectNode headNode) {
        String newId = uuids.get().toString();
        String next = firstTarget(headNode);

        ObjectNode created = nodes.objectNode();
        created.put("id", newId);
        created.put("type", "action");
        created.putObject("action").put("type", "set_variables").putArray("variables");
        ArrayNode links = created.putArray("links");
        if (next != null) {
            links.addObject().put("name", "child").put("type", "branch").put("target", next);
        }
        nodes.set(newId, created);

        ArrayNode headLinks = WorkflowRepairs.linksOf(headNode);
        if (headLinks.isEmpty() || !headLinks.get(0).isObject()) {
            headLinks.insertObject(0).put("name", "child").put("type", "branch").put("target", newId);
        } else {
            ((ObjectNode) headLinks.get(0)).put("target", newId);
        }
        return newId;
    }

    private static String firstTarget(JsonNode node) {
        JsonNode links = node.get("links");
        if (links == null || !links.isArray() || links.isEmpty()) {
            return null;
        }
        String target = JsonNodes.text(links.get(0), "target");
        return target == null || target.isEmpty() ? null : target;
    }

    private static boolean isSetVariables(JsonNode node) {
        return node != null
                && "action".equals(JsonNodes.text(node, "type"))
                && "set_variables".equals(JsonNodes.text(node.get("action"), "type"));
    }

    private static Set<String> variableNames(JsonNode node) {
        Set<String> names = new LinkedHashSet<>();
        JsonNode variables = node.get("action").get("variables");
        if (variables != null && variables.isArray()) {
            for (JsonNode variable : variables) {
                String name = JsonNodes.text(variable, "name");
                if (name != null) {
                    names.add(name);
                }
            }
        }
        return names;
    }

    // --- Field initialization ---

    /**
     * Adds the fields named by {@link FixHint.Type#INITIALIZE_FIELDS} hints to the first
     * {@code set_variables} initializer of each variable. Hints for the same variable are merged.
     */
    public List<FixRecord> initializeFields(ObjectNode workflow, List<Finding> findings) {
        Map<String, Set<String>> fields = new LinkedHashMap<>();
        for (Finding finding : findings) {
            FixHint hint = finding.hint();
            if (hint.type() == FixHint.Type.INITIALIZE_FIELDS) {
                fields.computeIfAbsent(hint.variable(), v -> new TreeSet<>()).addAll(hint.fields());
            }
        }
        List<FixRecord> records = new ArrayList<>();
        JsonNode nodes = workflow.get("nodes");
        if (nodes == null || !nodes.isObject()) {
            return records;
        }
        fields.forEach((name, required) -> initialize(nodes, name, List.copyOf(required)).ifPresent(records::add));
        return records;
    }

    private Optional<FixRecord> initialize(JsonNode nodes, String name, List<String> required) {
        Iterator<Map.Entry<String, JsonNode>> entries = nodes.fields();
        while (entries.hasNext()) {
            Map.Entry<String, JsonNode> entry = entries.next();
            if (!isSetVariables(entry.getValue())) {
                continue;
            }
            JsonNode variables = entry.getValue().get("action").get("variables");
            if (variables == null || !variables.isArray()) {
                continue;
            }
            for (JsonNode variable : variables) {
                if (!name.equals(JsonNodes.text(variable, "name"))) {
                    continue;
                }
                JsonNode expression = variable.get("value");
                String current = JsonNodes.expressionText(expression);
                if (current == null) {
                    continue;
                }
                String updated = withFields(current, required);
                if (updated != null) {
                    ((ObjectNode) expression).put("value", updated);
                    String description = EMPTY_INITIALIZERS.contains(current)
                            ? "Updated variable '" + name + "' initialization from "
                                    + (NULL_VALUE.equals(current) ? "null" : "empty object")
                                    + " to object with fields: " + required
                            : "Added missing fields " + missingFrom(current, required) + " to variable '" + name
                                    + "' initialization";
                    return Optional.of(new FixRecord(Category.VARIABLES, entry.getKey(), description));
                }
            }
        }
        return Optional.empty();
    }

    /**
     * Returns the initializer rewritten to contain every required field, or {@code null} when it
     * already does or cannot be parsed as a JSON object.
     */
    static String withFields(String current, List<String> required) {
        if (EMPTY_INITIALIZERS.contains(current)) {
            StringBuilder value = new StringBuilder("{");
            for (int i = 0; i < required.size(); i++) {
                value.append(i == 0 ? "" : ", ").append('"').append(required.get(i)).append("\": \"\"");
            }
            return value.append('}').toString();
        }
        ObjectNode parsed = parseObject(current);
        if (parsed == null) {
            return null;
        }
        boolean added = false;
        for (String field : required) {
            if (!parsed.has(field)) {
                parsed.put(field, "");
                added = true;
            }
        }
        if (!added) {
            return null;
        }
        try {
            return INITIALIZER_WRITER.writeValueAsString(parsed);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize initializer", e);
        }
    }

    private static List<String> missingFrom(String current, List<String> required) {
        ObjectNode parsed = parseObject(current);
        return required.stream().filter(f -> parsed == null || !parsed.has(f)).toList();
    }

    private static ObjectNode parseObject(String current) {
        String json = JsonNodes.stripOuterBackticks(current);
        if (json.isBlank()) {
            return null;
        }
        try {
            JsonNode parsed = MAPPER.readTree(json);
            return parsed instanceof ObjectNode ? (ObjectNode) parsed : null;
        } catch (IOException e) {
            return null;
        }
    }

    /** Single-line JSON with a space after every {@code :} and {@code ,}. */
    private static final class SpacedPrinter extends MinimalPrettyPrinter {

        private static final long serialVersionUID = 1L;

        @Override
        public void writeObjectFieldValueSeparator(JsonGenerator g) throws IOException {
            g.writeRaw(": ");
        }

        @Override
        public void writeObjectEntrySeparator(JsonGenerator g) throws IOException {
            g.writeRaw(", ");
        }

        @Override
        public void writeArrayValueSeparator(JsonGenerator g) throws IOException {
            g.writeRaw(", ");
        }
    }
}
