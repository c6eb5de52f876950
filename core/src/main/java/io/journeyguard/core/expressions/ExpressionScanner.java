package io.journeyguard.core.expressions;

import com.fasterxml.jackson.databind.JsonNode;
import io.journeyguard.core.model.ExpressionSite;
import io.journeyguard.core.model.JourneyNode;
import io.journeyguard.core.model.JsonNodes;
import io.journeyguard.core.model.Workflow;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

/**
 * Collects every expression value of a workflow as an {@link ExpressionSite}.
 *
 * <p>
 * The walk descends into objects and into arrays of objects. Only non-empty string values are
 * reported; other expression values carry nothing to lint.
 */
public final class ExpressionScanner {

    private ExpressionScanner() {
        // utility class
    }

    /** All expression sites, in node order and then document order within each node. */
    public static List<ExpressionSite> scan(Workflow workflow) {
        List<ExpressionSite> sites = new ArrayList<>();
        for (JourneyNode node : workflow.nodes().values()) {
            walk(node.json(), node.key(), "", null, node.isInformation(), sites);
        }
        return sites;
    }

    private static void walk(
            JsonNode json, String nodeId, String path, String field, boolean information, List<ExpressionSite> out) {
        if (JsonNodes.isExpression(json)) {
            String value = JsonNodes.expressionText(json);
            if (value != null && !value.isEmpty()) {
                out.add(new ExpressionSite(nodeId, path, field, value, information));
            }
        }
        Iterator<Map.Entry<String, JsonNode>> fields = json.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> entry = fields.next();
            String key = entry.getKey();
            String childPath = path.isEmpty() ? key : path + "." + key;
            JsonNode value = entry.getValue();
            if (value.isObject()) {
                walk(value, nodeId, childPath, key, information, out);
            } else if (value.isArray()) {
                for (int i = 0; i < value.size(); i++) {
                    if (value.get(i).isObject()) {
                        walk(value.get(i), nodeId, childPath + "[" + i + "]", key, information, out);
                    }
                }
            }
        }
    }
}
