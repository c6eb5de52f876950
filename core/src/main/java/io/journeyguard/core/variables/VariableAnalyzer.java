package io.journeyguard.core.variables;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.journeyguard.core.model.Category;
import io.journeyguard.core.model.Finding;
import io.journeyguard.core.model.FixHint;
import io.journeyguard.core.model.JourneyNode;
import io.journeyguard.core.model.JsonNodes;
import io.journeyguard.core.model.NodeKind;
import io.journeyguard.core.model.Workflow;
import io.journeyguard.core.spi.AnalysisContext;
import io.journeyguard.core.spi.JourneyAnalyzer;
import io.journeyguard.core.variables.ExpressionReferences.FieldAccess;
import java.io.IOException;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Queue;
import java.util.Set;
import java.util.TreeSet;

/**
 * Variable declaration and use: references to undeclared or out-of-scope variables, fields read
 * from variables whose initializer does not define them, and {@code output_var} targets that no
 * {@code set_variables} step initializes.
 *
 * <p>
 * Fixable findings carry a {@link FixHint#declareVariable} or {@link FixHint#initializeFields}
 * hint for the variable repairs.
 */
public final class VariableAnalyzer implements JourneyAnalyzer {

    private static final ObjectMapper MAPPER =
            new ObjectMapper().enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS);

    private static final List<String> SCHEMA_MARKERS = List.of("\"type\":", "\"properties\":", "\"$schema\":", "\"format\":");
    private static final Set<String> EMPTY_OBJECT_LITERALS = Set.of("{}", "`{}`", "\"{}\"");
    private static final String ERROR_VARIABLE = "error";

    @Override
    public Category category() {
        return Category.VARIABLES;
    }

    @Override
    public List<Finding> analyze(AnalysisContext context) {
        Workflow workflow = context.workflow();
        List<Finding> findings = new ArrayList<>();
        checkScoping(workflow, findings);
        checkFieldInitialization(workflow, findings);
        checkOutputVarInitialization(workflow, findings);
        return findings;
    }

    // --- Scoping ---

    private void checkScoping(Workflow workflow, List<Finding> findings) {
        Set<String> implicit = workflow.registry().constants().platformImplicitVariables().keySet();
        ScopeMap scopes = ScopeMap.of(workflow);

        Set<String> global = new HashSet<>();
        Map<String, Set<String>> perLoop = new LinkedHashMap<>();
        for (JourneyNode node : workflow.nodes().values()) {
            Set<String> declared = DeclarationCollector.declaredIn(node);
            scopes.loopOf(node.key()).ifPresentOrElse(
                    loop -> perLoop.computeIfAbsent(loop, l -> new HashSet<>()).addAll(declared),
                    () -> global.addAll(declared));
        }

        for (JourneyNode node : workflow.nodes().values()) {
            String key = node.key();
            String loop = scopes.loopOf(key).orElse(null);
            Set<String> inScope = new HashSet<>(global);
            if (loop != null) {
                inScope.addAll(perLoop.getOrDefault(loop, Set.of()));
            }
            for (String name : referencesIn(node)) {
                if (inScope.contains(name)) {
                    continue;
                }
                if (implicit.contains(name)) {
                    findings.add(implicitFinding(key, name));
                    continue;
                }
                String declaringLoop = perLoop.entrySet().stream()
                        .filter(e -> e.getValue().contains(name))
                        .map(Map.Entry::getKey)
                        .findFirst()
                        .orElse(null);
                if (declaringLoop == null) {
                    findings.add(error(key, "Node " + key + " references undefined variable '" + name + "'.")
                            .withHint(FixHint.declareVariable(name)));
                } else if (loop != null) {
                    findings.add(error(
                            key,
                            "Node " + key + " (inside loop " + loop + ") references variable '" + name + "' which "
                                    + "is not in scope. It is declared only inside loop " + declaringLoop
                                    + "; variables created inside a loop are visible only within that loop. "
                                    + "Initialize the variable with set_variables before both loops."));
                } else {
                    findings.add(error(
                            key,
                            "Node " + key + " (outside loop) references variable '" + name + "' which was "
                                    + "declared inside loop " + declaringLoop + ". Variables created with "
                                    + "output_var inside loops are not accessible outside the loop. Initialize "
                                    + "the variable with set_variables before the loop."));
                }
            }
        }
    }

    private static Finding implicitFinding(String key, String name) {
        if (ERROR_VARIABLE.equals(name)) {
            return error(
                            key,
                            "Node " + key + " references implicit variable 'error' which is NOT declared. The "
                                    + "'error' variable is provided by the platform only after certain node "
                                    + "executions (typically in failure branches), so using it in nodes reachable "
                                    + "from multiple paths may fail at runtime. Initialize it with set_variables "
                                    + "({\"name\": \"error\", \"value\": \"null\"}), guard the expression, or make "
                                    + "the node reachable only from failure branches.")
                    .withHint(FixHint.declareVariable(name));
        }
        return error(
                key,
                "Node " + key + " references implicit platform variable '" + name + "' which is NOT declared. "
                        + "This variable may not be available in all execution contexts.");
    }

    /** Variables referenced by a node's expressions, skipping schema payloads and IdP provider config. */
    static Set<String> referencesIn(JourneyNode node) {
        Set<String> names = new LinkedHashSet<>();
        boolean invokeIdp = node.isAction("invoke_idp");
        collectReferences(node.json(), null, invokeIdp, names);
        return names;
    }

    private static void collectReferences(JsonNode json, String parentKey, boolean invokeIdp, Set<String> names) {
        if ("form_schema".equals(parentKey) || "data_json_schema".equals(parentKey)) {
            return;
        }
        if (invokeIdp && "provider_config".equals(parentKey)) {
            return;
        }
        if (JsonNodes.isExpression(json)) {
            String text = valueText(json.get("value"));
            if (SCHEMA_MARKERS.stream().noneMatch(text::contains)) {
                names.addAll(ExpressionReferences.references(text));
            }
        }
        Iterator<Map.Entry<String, JsonNode>> fields = json.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            JsonNode value = field.getValue();
            if (value.isObject()) {
                collectReferences(value, field.getKey(), invokeIdp, names);
            } else if (value.isArray()) {
                for (JsonNode item : value) {
                    if (item.isObject()) {
                        collectReferences(item, field.getKey(), invokeIdp, names);
                    }
                }
            }
        }
    }

    // --- Field initialization ---

    private void checkFieldInitialization(Workflow workflow, List<Finding> findings) {
        Map<String, Set<String>> initialized = new LinkedHashMap<>();
        Set<String> outputVarVariables = new HashSet<>();
        for (JourneyNode node : workflow.nodes().values()) {
            if (!node.isAction("form")) {
                outputVarVariables.addAll(DeclarationCollector.outputVars(node.json()));
            }
            if (node.isAction("set_variables")) {
                readInitializers(node.action().get("variables"), initialized);
            }
        }

        Map<String, Set<Access>> accessed = new LinkedHashMap<>();
        for (JourneyNode node : workflow.nodes().values()) {
            collectFieldAccesses(node.json(), node.key(), accessed);
        }

        for (Map.Entry<String, Set<Access>> entry : accessed.entrySet()) {
            String name = entry.getKey();
            Set<Access> accesses = entry.getValue();
            Set<String> fields = new TreeSet<>();
            Set<String> nodes = new TreeSet<>();
            accesses.forEach(a -> {
                fields.add(a.field());
                nodes.add(a.nodeId());
            });
            boolean alsoOutputVar = outputVarVariables.contains(name);

            if (initialized.containsKey(name)) {
                Set<String> known = initialized.get(name);
                if (known.isEmpty()) {
                    String message = alsoOutputVar
                            ? "Variable '" + name + "' is initialized as empty object {} AND used as output_var, "
                                    + "but fields " + fields + " are accessed in nodes " + nodes + ". Initialize it "
                                    + "in set_variables with a structure that includes all accessed fields."
                            : "Variable '" + name + "' is initialized as empty object {}, but fields " + fields
                                    + " are accessed in nodes " + nodes + ". Initialize it with a structure that "
                                    + "includes all accessed fields.";
                    findings.add(error(null, message).withHint(FixHint.initializeFields(name, List.copyOf(fields))));
                    continue;
                }
                List<String> missing = accesses.stream()
                        .map(Access::field)
                        .filter(f -> !known.contains(f))
                        .distinct()
                        .sorted()
                        .toList();
                if (missing.isEmpty()) {
                    continue;
                }
                FixHint hint = FixHint.initializeFields(name, missing);
                for (Access access : accesses) {
                    if (known.contains(access.field())) {
                        continue;
                    }
                    String message = "Variable '" + name + "' does not have field '" + access.field()
                            + "' initialized, but it is accessed in node " + access.nodeId() + "."
                            + (alsoOutputVar
                                    ? " This variable is ALSO used as output_var; initialize it with a nested "
                                            + "structure that includes '" + access.field() + "'."
                                    : " Add '" + access.field() + "' to its set_variables initializer.");
                    findings.add(error(access.nodeId(), message).withHint(hint));
                }
            } else if (outputVarVariables.contains(name)) {
                findings.add(error(
                                null,
                                "Variable '" + name + "' is created via output_var but fields " + fields
                                        + " are accessed in nodes " + nodes + " without explicit initialization. "
                                        + "Platform nodes may not return the expected field structure; initialize '"
                                        + name + "' with set_variables before accessing its fields.")
                        .withHint(FixHint.initializeFields(name, List.copyOf(fields))));
            }
        }
    }

    private record Access(String field, String nodeId) {}

    private static void readInitializers(JsonNode variables, Map<String, Set<String>> initialized) {
        if (variables == null || !variables.isArray()) {
            return;
        }
        for (JsonNode variable : variables) {
            String name = JsonNodes.text(variable, "name");
            if (name == null || !variable.has("value")) {
                continue;
            }
            String text = JsonNodes.expressionText(variable.get("value"));
            if (text == null) {
                continue;
            }
            Set<String> keys = initializerKeys(text);
            if (keys != null) {
                initialized.put(name, keys);
            }
        }
    }

    /**
     * Keys defined by an initializer expression: an object gives its keys, any other JSON value
     * gives none, and unparseable text gives {@code null} unless it is an empty-object literal.
     */
    static Set<String> initializerKeys(String text) {
        String json = JsonNodes.stripOuterBackticks(text);
        Set<String> literal = EMPTY_OBJECT_LITERALS.contains(json.strip()) ? new LinkedHashSet<>() : null;
        if (json.isBlank()) {
            return literal;
        }
        try {
            JsonNode parsed = MAPPER.readTree(json);
            Set<String> keys = new LinkedHashSet<>();
            if (parsed.isObject()) {
                parsed.fieldNames().forEachRemaining(keys::add);
            }
            return keys;
        } catch (IOException e) {
            return literal;
        }
    }

    private static void collectFieldAccesses(JsonNode json, String nodeId, Map<String, Set<Access>> accessed) {
        if (JsonNodes.isExpression(json)) {
            for (FieldAccess access : ExpressionReferences.fieldAccesses(valueText(json.get("value")))) {
                accessed.computeIfAbsent(access.variable(), v -> new LinkedHashSet<>())
                        .add(new Access(access.field(), nodeId));
            }
        }
        for (JsonNode value : json) {
            if (value.isObject()) {
                collectFieldAccesses(value, nodeId, accessed);
            } else if (value.isArray()) {
                for (JsonNode item : value) {
                    if (item.isObject()) {
                        collectFieldAccesses(item, nodeId, accessed);
                    }
                }
            }
        }
    }

    // --- output_var initialization ---

    private void checkOutputVarInitialization(Workflow workflow, List<Finding> findings) {
        Set<String> initialized = new HashSet<>();
        Map<String, String> firstUse = new LinkedHashMap<>();
        Map<String, Boolean> usedByForm = new LinkedHashMap<>();

        Set<String> visited = new HashSet<>();
        Queue<String> queue = new ArrayDeque<>();
        if (workflow.contains(workflow.head())) {
            queue.add(workflow.head());
        }
        while (!queue.isEmpty()) {
            String nodeId = queue.poll();
            if (visited.contains(nodeId) || !workflow.contains(nodeId)) {
                continue;
            }
            visited.add(nodeId);
            JourneyNode node = workflow.nodes().get(nodeId);
            if (node.isAction("set_variables")) {
                initialized.addAll(DeclarationCollector.variableNames(node.action().get("variables")));
            }
            boolean form = node.isAction("form");
            for (String name : DeclarationCollector.outputVars(node.json())) {
                if (!firstUse.containsKey(name)) {
                    firstUse.put(name, nodeId);
                    usedByForm.put(name, form);
                }
            }
            queue.addAll(node.targets());
            if (node.kind() == NodeKind.LOOP || node.kind() == NodeKind.BLOCK) {
                node.bodyRef().filter(b -> b.hasEntryId()).ifPresent(b -> queue.add(b.entryId()));
            }
        }

        for (Map.Entry<String, String> use : firstUse.entrySet()) {
            String name = use.getKey();
            if (usedByForm.get(name) || initialized.contains(name)) {
                continue;
            }
            findings.add(error(
                            use.getValue(),
                            "Variable '" + name + "' is used as output_var in node " + use.getValue() + " but was "
                                    + "not initialized. Add {\"name\": \"" + name + "\", \"value\": \"null\"} to the "
                                    + "initial set_variables node; platform nodes that set output_var overwrite "
                                    + "pre-initialized variables.")
                    .withHint(FixHint.declareVariable(name)));
        }
    }

    private static String valueText(JsonNode value) {
        return value.isTextual() ? value.asText() : value.toString();
    }

    private static Finding error(String nodeId, String message) {
        return Finding.error(Category.VARIABLES, nodeId, message);
    }
}
