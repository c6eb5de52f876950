package io.journeyguard.core.fields;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Validates the JSON text held by a {@code form_schema} or a login-form link's
 * {@code data_json_schema} expression.
 *
 * <p>
 * Form schemas are arrays of input field definitions; link schemas are JSON Schema objects.
 * Messages are returned rather than thrown.
 */
final class FormSchemaChecker {

    static final List<String> FIELD_PROPERTIES =
            List.of("type", "name", "label", "defaultValue", "dataType", "required", "readonly");

    private static final Set<String> PLACEHOLDERS = Set.of("", "...", "{}", "[]", "``");

    private final ObjectMapper mapper = new ObjectMapper().enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS);

    /**
     * Checks one schema value.
     *
     * @param value      the expression value of the schema
     * @param nodeId     owning node, for messages
     * @param schemaType label used in messages, e.g. {@code form_schema}
     * @return problems found, empty when the schema is usable
     */
    List<String> check(JsonNode value, String nodeId, String schemaType) {
        List<String> problems = new ArrayList<>();
        String text = value == null || value.isNull() ? "" : value.isTextual() ? value.asText() : value.toString();
        String placeholder = "Node " + nodeId + " has an empty or placeholder " + schemaType
                + ". Must contain valid field definitions.";
        if (PLACEHOLDERS.contains(text.strip())) {
            problems.add(placeholder);
            return problems;
        }

        String json = text.strip();
        if (json.startsWith("`") && json.endsWith("`")) {
            json = json.substring(1, json.length() - 1);
        }
        if (PLACEHOLDERS.contains(json.strip())) {
            problems.add(placeholder);
            return problems;
        }

        JsonNode parsed;
        try {
            parsed = mapper.readTree(json);
        } catch (JsonProcessingException e) {
            problems.add("Node " + nodeId + " " + schemaType + " contains invalid JSON: " + e.getOriginalMessage());
            return problems;
        }

        if (parsed.isArray()) {
            checkFieldDefinitions(parsed, nodeId, schemaType, problems);
        } else if (parsed.isObject() && schemaType.contains("data_json_schema")) {
            if (!parsed.has("properties") && !parsed.has("type")) {
                problems.add("Node " + nodeId + " " + schemaType
                        + " appears to be a JSON schema but is missing 'properties' or 'type' field.");
            }
        }
        return problems;
    }

    private void checkFieldDefinitions(JsonNode fields, String nodeId, String schemaType, List<String> problems) {
        if (fields.isEmpty()) {
            problems.add("Node " + nodeId + " " + schemaType
                    + " is an empty array. Must contain at least one field definition.");
            return;
        }
        for (int i = 0; i < fields.size(); i++) {
            JsonNode field = fields.get(i);
            if (!field.isObject()) {
                problems.add("Node " + nodeId + " " + schemaType + " field " + i + " is not an object.");
                continue;
            }
            String label = "Node " + nodeId + " " + schemaType + " field '" + fieldName(field, i) + "'";
            List<String> missing = FIELD_PROPERTIES.stream().filter(p -> !field.has(p)).toList();
            if (!missing.isEmpty()) {
                problems.add(label + " is missing required properties: " + String.join(", ", missing));
            }
            JsonNode type = field.get("type");
            if (type != null && !"input".equals(type.asText(null))) {
                problems.add(label + " has invalid type '" + (type.isTextual() ? type.asText() : type.toString())
                        + "'. Only 'input' type is supported.");
            }
            JsonNode dataType = field.get("dataType");
            if (dataType != null && "string".equals(dataType.asText(null)) && !field.has("format")) {
                problems.add(label + " with dataType 'string' is missing 'format' property.");
            }
        }
    }

    private static String fieldName(JsonNode field, int index) {
        JsonNode name = field.get("name");
        if (name == null) {
            return String.valueOf(index);
        }
        return name.isTextual() ? name.asText() : name.toString();
    }
}
