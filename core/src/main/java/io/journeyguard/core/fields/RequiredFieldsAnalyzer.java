package io.journeyguard.core.fields;

import com.fasterxml.jackson.databind.JsonNode;
import io.journeyguard.core.model.Category;
import io.journeyguard.core.model.Finding;
import io.journeyguard.core.model.JourneyNode;
import io.journeyguard.core.model.JsonNodes;
import io.journeyguard.core.model.Link;
import io.journeyguard.core.model.NodeKind;
import io.journeyguard.core.model.Workflow;
import io.journeyguard.core.registry.NodeRegistry;
import io.journeyguard.core.registry.NodeTypeDefinition;
import io.journeyguard.core.registry.RegistryConstants;
import io.journeyguard.core.spi.AnalysisContext;
import io.journeyguard.core.spi.JourneyAnalyzer;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Checks that every node carries the fields its type requires, in the shape the platform
 * expects: required node and action fields, data payload formats, form schemas and condition
 * structure.
 */
public final class RequiredFieldsAnalyzer implements JourneyAnalyzer {

    private static final Set<String> EXPRESSION_DATA_ACTIONS = Set.of(
            "json_data", "sdk_data", "custom_activity_log", "custom_session_data", "custom_token_enrichment");
    private static final Set<String> JSON_DATA_ACTIONS = Set.of("json_data", "sdk_data");
    private static final String EXPRESSION_SHAPE = "{\"type\": \"expression\", \"value\": \"...\"}";

    private final FormSchemaChecker formSchemas = new FormSchemaChecker();

    @Override
    public Category category() {
        return Category.REQUIRED_FIELDS;
    }

    @Override
    public List<Finding> analyze(AnalysisContext context) {
        Workflow workflow = context.workflow();
        NodeRegistry registry = context.registry();
        List<Finding> findings = new ArrayList<>();
        for (JourneyNode node : workflow.nodes().values()) {
            checkNodeFields(node, registry, findings);
        }
        for (JourneyNode node : workflow.nodes().values()) {
            checkActionFields(node, registry, findings);
        }
        for (JourneyNode node : workflow.nodes().values()) {
            checkPlainStringFields(node, registry, findings);
        }
        for (JourneyNode node : workflow.nodes().values()) {
            checkFormSchemas(node, findings);
        }
        for (JourneyNode node : workflow.nodes().values()) {
            checkCondition(node, registry.constants(), findings);
        }
        for (JourneyNode node : workflow.nodes().values()) {
            checkJsonDataFormat(node, findings);
        }
        return findings;
    }

    // --- Node-level required fields ---

    private void checkNodeFields(JourneyNode node, NodeRegistry registry, List<Finding> findings) {
        String type = node.rawType();
        Optional<NodeTypeDefinition> found = type == null ? Optional.empty() : registry.find(type);
        if (found.isEmpty()) {
            return;
        }
        NodeTypeDefinition definition = found.get();
        String key = node.key();
        if (definition.deprecated()) {
            findings.add(error(key, "Node '" + key + "' uses deprecated node type '" + type + "'. This node type is "
                    + "no longer supported. Use '" + nullToEmpty(definition.replacement()) + "' instead."));
            return;
        }
        List<String> anyOf = definition.atLeastOneOf();
        if (!anyOf.isEmpty() && anyOf.stream().noneMatch(node.json()::has)) {
            findings.add(error(key, "Node " + key + " (" + type + ") must have at least one of: "
                    + String.join(", ", anyOf)));
        }
        for (String field : definition.requiredFields().keySet()) {
            if (!node.json().has(field)) {
                findings.add(error(key, "Node " + key + " (" + type + ") is missing required field: " + field)
                        .withField(field));
            } else if (isEmpty(node.json().get(field))) {
                findings.add(error(key, "Node " + key + " (" + type + ") has empty value for required field '"
                                + field + "'. This field must contain a non-empty value for the journey to run."
                                + example(field))
                        .withField(field));
            }
        }
    }

    /** Null, a blank string, or an expression whose value is blank once backticks are trimmed. */
    static boolean isEmpty(JsonNode value) {
        if (value == null || value.isNull()) {
            return true;
        }
        if (value.isTextual()) {
            return value.asText().isBlank();
        }
        if (value.isObject() && JsonNodes.EXPRESSION.equals(JsonNodes.text(value, "type"))) {
            JsonNode inner = value.get("value");
            if (inner == null || inner.isNull()) {
                return true;
            }
            return inner.isTextual() && JsonNodes.trimBackticks(inner.asText()).isBlank();
        }
        return false;
    }

    private static String example(String field) {
        switch (field) {
            case "phone":
                return "\n  Example: \"phone\": {\"type\": \"expression\", \"value\": \"userProfile.phone\"}";
            case "email":
                return "\n  Example: \"email\": {\"type\": \"expression\", \"value\": \"userProfile.email\"}";
            case "user_identifier":
                return "\n  Example: \"user_identifier\": {\"type\": \"expression\", \"value\": \"emailData.email\"}";
            default:
                return "";
        }
    }

    // --- Action fields and data payloads ---

    private void checkActionFields(JourneyNode node, NodeRegistry registry, List<Finding> findings) {
        JsonNode action = node.kind() == NodeKind.ACTION ? node.action() : null;
        String actionType = node.actionType();
        if (action == null || actionType == null) {
            return;
        }
        Optional<NodeTypeDefinition> found = registry.find(actionType);
        if (found.isEmpty()) {
            return;
        }
        String key = node.key();
        Map<String, String> required = found.get().requiredFields();
        for (String field : required.keySet()) {
            if (!action.has(field)) {
                findings.add(error(key, "Node " + key + " (action type '" + actionType + "') is missing required "
                                + "field '" + field + "'. Action type '" + actionType + "' requires: "
                                + String.join(", ", required.keySet()))
                        .withField("action." + field));
            }
        }

        JsonNode data = action.get("data");
        if (data == null) {
            return;
        }
        String prefix = "Node " + key + " (action type '" + actionType + "') ";
        if ("events_enrichment".equals(actionType)) {
            checkEnrichmentData(key, prefix, data, findings);
        } else if (EXPRESSION_DATA_ACTIONS.contains(actionType)) {
            if (!data.isObject()) {
                findings.add(error(key, prefix + "has 'data' field that is not an object. Expected an expression "
                        + "object with 'type' and 'value' fields.").withField("action.data"));
            } else if (!JsonNodes.EXPRESSION.equals(JsonNodes.text(data, "type"))) {
                findings.add(error(key, prefix + "has 'data' field without type='expression'. The 'data' field "
                        + "should be: " + EXPRESSION_SHAPE).withField("action.data"));
            }
        }
    }

    private void checkEnrichmentData(String key, String prefix, JsonNode data, List<Finding> findings) {
        if (!data.isArray()) {
            findings.add(error(key, prefix + "has 'data' field that is not an array. events_enrichment requires "
                    + "'data' to be an array of key/value pairs: [{\"key\": \"field_name\", \"value\": "
                    + EXPRESSION_SHAPE + "}]").withField("action.data"));
            return;
        }
        for (int i = 0; i < data.size(); i++) {
            JsonNode item = data.get(i);
            String field = "action.data[" + i + "]";
            if (!item.isObject()) {
                findings.add(error(key, prefix + "data[" + i + "] is not an object. Each data item must have 'key' "
                        + "and 'value' fields.").withField(field));
                continue;
            }
            if (!item.has("key")) {
                findings.add(error(key, prefix + "data[" + i + "] is missing 'key' field. Use 'key' (not 'name') "
                        + "for the field name.").withField(field));
            }
            JsonNode value = item.get("value");
            if (value == null) {
                findings.add(error(key, prefix + "data[" + i + "] is missing 'value' field.").withField(field));
            } else if (value.isObject() && !JsonNodes.EXPRESSION.equals(JsonNodes.text(value, "type"))) {
                findings.add(error(key, prefix + "data[" + i + "] value should be an expression object: "
                        + EXPRESSION_SHAPE).withField(field));
            }
        }
    }

    private void checkPlainStringFields(JourneyNode node, NodeRegistry registry, List<Finding> findings) {
        JsonNode action = node.kind() == NodeKind.ACTION ? node.action() : null;
        String actionType = node.actionType();
        if (action == null || actionType == null) {
            return;
        }
        registry.find(actionType).ifPresent(definition -> definition.requiredFields().forEach((field, kind) -> {
            JsonNode value = action.get(field);
            if (!"string".equals(kind) || value == null || !value.isObject()
                    || !JsonNodes.EXPRESSION.equals(JsonNodes.text(value, "type"))) {
                return;
            }
            JsonNode inner = value.get("value");
            String actual = inner == null ? "" : inner.isTextual() ? inner.asText() : inner.toString();
            String clean = inner != null && inner.isTextual() ? JsonNodes.trimBackticks(actual) : actual;
            findings.add(error(node.key(), "Node " + node.key() + " (" + actionType + ") field '" + field
                            + "' must be a plain JSON string, not an expression object. Change from:\n  \"" + field
                            + "\": {\"type\": \"expression\", \"value\": \"" + actual + "\"}\nto:\n  \"" + field
                            + "\": \"" + clean + "\"")
                    .withField("action." + field));
        }));
    }

    // --- Form schemas ---

    private void checkFormSchemas(JourneyNode node, List<Finding> findings) {
        JsonNode action = node.kind() == NodeKind.ACTION ? node.action() : null;
        if (action == null) {
            return;
        }
        String key = node.key();
        String formType = JsonNodes.text(action.get("metadata"), "type");

        JsonNode formSchema = action.get("form_schema");
        if (formSchema != null && formSchema.isObject() && formSchema.has("value")) {
            formSchemas.check(formSchema.get("value"), key, "form_schema")
                    .forEach(problem -> findings.add(error(key, problem).withField("action.form_schema")));
            if ("get_information".equals(formType)) {
                checkGetInformation(node, action, findings);
            }
        }

        if ("login_form".equals(formType)) {
            for (Link link : node.links()) {
                JsonNode schema = link.isObject() ? link.json().get("data_json_schema") : null;
                if (schema == null || !schema.isObject() || !schema.has("value")) {
                    continue;
                }
                JsonNode value = schema.get("value");
                if (value.isTextual() && !value.asText().isBlank()) {
                    String label = "data_json_schema (link: " + (link.name() != null ? link.name() : "unknown") + ")";
                    formSchemas.check(value, key, label).forEach(problem -> findings.add(
                            error(key, problem).withField("links[" + link.index() + "].data_json_schema")));
                }
            }
        }
    }

    private void checkGetInformation(JourneyNode node, JsonNode action, List<Finding> findings) {
        String key = node.key();
        String prefix = "Node " + key + " is a get_information form ";
        if (!node.json().has("output_var")) {
            findings.add(error(key, prefix + "but is missing top-level 'output_var' field."));
        }
        JsonNode appData = action.get("app_data");
        if (appData == null) {
            findings.add(error(key, prefix + "but is missing 'app_data' field.").withField("action.app_data"));
        } else if (appData.isObject() && appData.isEmpty()) {
            findings.add(error(key, prefix + "with invalid 'app_data': {}\n  'app_data' must be an expression "
                    + "object.\n  Correct: \"app_data\": {\"type\": \"expression\", \"value\": \"{}\"}\n"
                    + "  Incorrect: \"app_data\": {}").withField("action.app_data"));
        } else if (appData.isObject() && !appData.has("type")) {
            findings.add(error(key, prefix + "with 'app_data' object missing 'type' field.\n  Expected expression "
                    + "format: " + EXPRESSION_SHAPE).withField("action.app_data"));
        }
        if (!node.json().has("strings")) {
            findings.add(error(key, prefix + "but is missing top-level 'strings' array."));
        }
    }

    // --- Conditions ---

    private void checkCondition(JourneyNode node, RegistryConstants constants, List<Finding> findings) {
        JsonNode condition = node.kind() == NodeKind.CONDITION ? node.json().get("condition") : null;
        if (condition == null || !condition.isObject()) {
            return;
        }
        String key = node.key();
        JsonNode type = condition.get("type");
        if (type == null) {
            findings.add(error(key, "Node " + key + " condition is missing 'type' field. Must be 'generic'.")
                    .withField("condition.type"));
        } else {
            String value = type.isTextual() ? type.asText() : type.toString();
            if (!type.isTextual() || !RegistryConstants.allows(constants.validConditionTypes(), value)) {
                String message = JsonNodes.EXPRESSION.equals(value)
                        ? "Node " + key + " has invalid condition type: 'expression'. Condition nodes must use "
                                + "'type': 'generic'. Put the expression in the 'field' property instead."
                        : "Node " + key + " has invalid condition type: '" + value + "'. Valid types are: "
                                + String.join(", ", constants.validConditionTypes());
                findings.add(error(key, message).withField("condition.type"));
            }
        }

        JsonNode dataType = condition.get("data_type");
        String validDataTypes = String.join(", ", constants.validConditionDataTypes());
        if (dataType == null) {
            findings.add(error(key, "Node " + key + " condition is missing required 'data_type' field. Must be one "
                    + "of: " + validDataTypes).withField("condition.data_type"));
        } else {
            String value = dataType.isTextual() ? dataType.asText() : dataType.toString();
            if (!dataType.isTextual() || !RegistryConstants.allows(constants.validConditionDataTypes(), value)) {
                findings.add(error(key, "Node " + key + " has invalid condition data_type: '" + value + "'. Valid "
                        + "types are: " + validDataTypes).withField("condition.data_type"));
            }
        }

        if (!condition.has("field")) {
            findings.add(error(key, "Node " + key + " condition is missing required 'field' field.")
                    .withField("condition.field"));
        }
        if (!condition.has("value")) {
            findings.add(error(key, "Node " + key + " condition is missing required 'value' field.")
                    .withField("condition.value"));
        }
    }

    // --- json_data / sdk_data payloads ---

    private void checkJsonDataFormat(JourneyNode node, List<Finding> findings) {
        String actionType = node.actionType();
        if (node.kind() != NodeKind.ACTION || !JSON_DATA_ACTIONS.contains(actionType)) {
            return;
        }
        String value = JsonNodes.expressionText(node.action().get("data"));
        if (value == null) {
            return;
        }
        String key = node.key();
        if (value.startsWith("`{") && value.endsWith("}`")) {
            if (value.contains("${")) {
                findings.add(error(key, "Node " + key + " (" + actionType + ") uses template string syntax in "
                        + "'data' field. " + actionType + " nodes should use simple JSON format with direct "
                        + "variable references.\n  Incorrect: `{\"key\": \"${variable}\"}`\n"
                        + "  Correct: {\"key\":variable}\n"
                        + "Remove the backticks and ${} interpolation.").withField("action.data"));
            }
        } else if (value.contains("${") && !value.startsWith("`")) {
            String stripped = value.strip();
            if (stripped.startsWith("{") && stripped.endsWith("}")) {
                findings.add(error(key, "Node " + key + " (" + actionType + ") uses ${} interpolation in 'data' "
                        + "field. " + actionType + " nodes should use simple JSON format with direct variable "
                        + "references.\n  Incorrect: {\"key\": \"${variable}\"}\n  Correct: {\"key\":variable}")
                        .withField("action.data"));
            }
        }
    }

    private static String nullToEmpty(String value) {
        return value == null ? "" : value;
    }

    private static Finding error(String nodeId, String message) {
        return Finding.error(Category.REQUIRED_FIELDS, nodeId, message);
    }
}
