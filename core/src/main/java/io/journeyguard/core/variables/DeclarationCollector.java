package io.journeyguard.core.variables;

import com.fasterxml.jackson.databind.JsonNode;
import io.journeyguard.core.model.JourneyNode;
import io.journeyguard.core.model.JsonNodes;
import io.journeyguard.core.model.NodeKind;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * Finds the variables a node declares.
 *
 * <p>
 * Thread-safe: stateless utility class.
 */
public final class DeclarationCollector {

    private DeclarationCollector() {
        // utility class
    }

    /**
     * Variables declared by a node: every {@code output_var} string anywhere inside it,
     * {@code set_variables} names, {@code action.var_name}, and loop {@code variables[].name}.
     */
    public static Set<String> declaredIn(JourneyNode node) {
        Set<String> declared = new LinkedHashSet<>(outputVars(node.json()));
        JsonNode action = node.action();
        if (node.kind() == NodeKind.ACTION && action != null) {
            if ("set_variables".equals(JsonNodes.text(action, "type"))) {
                declared.addAll(variableNames(action.get("variables")));
            }
            String varName = JsonNodes.text(action, "var_name");
            if (varName != null) {
                declared.add(varName);
            }
        }
        if (node.kind() == NodeKind.LOOP) {
            declared.addAll(variableNames(node.json().get("variables")));
        }
        return declared;
    }

    /** Every string-valued {@code output_var} found recursively under {@code json}, in document order. */
    public static Set<String> outputVars(JsonNode json) {
        Set<String> names = new LinkedHashSet<>();
        collectOutputVars(json, names);
        return names;
    }

    /** The {@code name} of each entry of a {@code variables} array. */
    public static Set<String> variableNames(JsonNode variables) {
        Set<String> names = new LinkedHashSet<>();
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

    private static void collectOutputVars(JsonNode json, Set<String> names) {
        if (json.isObject()) {
            Iterator<Map.Entry<String, JsonNode>> fields = json.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> field = fields.next();
                if ("output_var".equals(field.getKey()) && field.getValue().isTextual()) {
                    names.add(field.getValue().asText());
                } else {
                    collectOutputVars(field.getValue(), names);
                }
            }
        } else if (json.isArray()) {
            for (JsonNode item : json) {
                collectOutputVars(item, names);
            }
        }
    }
}
