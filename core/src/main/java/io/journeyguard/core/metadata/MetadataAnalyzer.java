package io.journeyguard.core.metadata;

import com.fasterxml.jackson.databind.JsonNode;
import io.journeyguard.core.model.Category;
import io.journeyguard.core.model.Finding;
import io.journeyguard.core.model.FixHint;
import io.journeyguard.core.model.JsonNodes;
import io.journeyguard.core.registry.RegistryConstants;
import io.journeyguard.core.spi.AnalysisContext;
import io.journeyguard.core.spi.JourneyAnalyzer;
import java.util.ArrayList;
import java.util.List;

/**
 * Checks the journey-level metadata of an {@code exports} document: journey type, policy id,
 * descriptions, the {@code versions} array and the fields of the first version.
 *
 * <p>
 * Documents holding a bare top-level {@code workflow} have no metadata; they yield a single
 * finding about the missing envelope.
 */
public final class MetadataAnalyzer implements JourneyAnalyzer {

    private static final List<String> DATA_FIELDS = List.of("policy_id", "type", "desc", "versions");
    private static final List<String> VERSION_FIELDS =
            List.of("schema_version", "filter_criteria", "workflow", "version_id", "state", "desc");
    private static final int SCHEMA_VERSION = 2;
    private static final int MIN_DESCRIPTION_LENGTH = 3;

    @Override
    public Category category() {
        return Category.METADATA;
    }

    @Override
    public List<Finding> analyze(AnalysisContext context) {
        List<Finding> findings = new ArrayList<>();
        JsonNode exports = context.root().get("exports");
        if (exports == null || !exports.isArray()) {
            findings.add(error("Journey JSON is missing 'exports' array or it's not a list."));
            return findings;
        }
        JsonNode data = exports.isEmpty() ? null : exports.get(0).get("data");
        if (data == null || !data.isObject()) {
            findings.add(error("Journey exports array is empty or missing 'data' field."));
            return findings;
        }
        RegistryConstants constants = context.registry().constants();
        checkJourneyType(data, constants, findings);
        checkDataFields(data, findings);
        checkFirstVersion(data, constants, findings);
        return findings;
    }

    private void checkJourneyType(JsonNode data, RegistryConstants constants, List<Finding> findings) {
        if (!data.has("type")) {
            findings.add(error("Journey data is missing required 'type' field. Must be 'anonymous'.")
                    .withHint(FixHint.catalogue()));
            return;
        }
        JsonNode type = data.get("type");
        String value = type.isTextual() ? type.asText() : type.toString();
        if (!type.isTextual() || !RegistryConstants.allows(constants.validJourneyTypes(), value)) {
            findings.add(error("Invalid journey type: '" + value + "'. Valid types are: "
                            + String.join(", ", constants.validJourneyTypes()))
                    .withHint(FixHint.catalogue()));
        }
    }

    private void checkDataFields(JsonNode data, List<Finding> findings) {
        for (String field : DATA_FIELDS) {
            if (!data.has(field)) {
                Finding missing = error("Journey data is missing required field '" + field + "'");
                findings.add("type".equals(field) ? missing.withHint(FixHint.catalogue()) : missing);
            }
        }

        JsonNode policyId = data.get("policy_id");
        if (policyId != null) {
            if (!policyId.isTextual()) {
                findings.add(error("Journey data field 'policy_id' must be a string, got "
                        + JsonNodes.typeName(policyId)));
            } else if (policyId.asText().isBlank()) {
                findings.add(error("Journey data field 'policy_id' cannot be empty. Must contain a valid policy ID."));
            }
        }

        JsonNode desc = data.get("desc");
        if (desc != null && !desc.isTextual()) {
            findings.add(error("Journey data field 'desc' must be a string, got " + JsonNodes.typeName(desc)));
        }

        JsonNode versions = data.get("versions");
        if (versions != null) {
            if (!versions.isArray()) {
                findings.add(error("Journey 'versions' field must be a list/array."));
            } else if (versions.isEmpty()) {
                findings.add(error("Journey versions array is empty. Must contain at least one version."));
            }
        }
    }

    private void checkFirstVersion(JsonNode data, RegistryConstants constants, List<Finding> findings) {
        JsonNode versions = data.get("versions");
        if (versions == null || !versions.isArray() || versions.isEmpty()) {
            return;
        }
        JsonNode version = versions.get(0);
        if (!version.isObject()) {
            findings.add(error("Journey version must be an object, got " + JsonNodes.typeName(version)));
            return;
        }

        for (String field : VERSION_FIELDS) {
            if (!version.has(field)) {
                Finding missing = error("Journey version is missing required field '" + field + "'");
                boolean defaulted = "state".equals(field) || "desc".equals(field);
                findings.add(defaulted ? missing.withHint(FixHint.catalogue()) : missing);
            }
        }

        JsonNode schemaVersion = version.get("schema_version");
        if (schemaVersion != null) {
            if (!schemaVersion.isIntegralNumber()) {
                findings.add(error("Journey version field 'schema_version' must be an integer, got "
                        + JsonNodes.typeName(schemaVersion)));
            } else if (schemaVersion.asLong() != SCHEMA_VERSION) {
                findings.add(error("Journey version field 'schema_version' must be " + SCHEMA_VERSION + ", got "
                        + schemaVersion.asText()));
            }
        }

        checkFilterCriteria(version.get("filter_criteria"), findings);

        JsonNode versionId = version.get("version_id");
        if (versionId != null) {
            if (!versionId.isTextual()) {
                findings.add(error("Journey version field 'version_id' must be a string, got "
                        + JsonNodes.typeName(versionId)));
            } else if (versionId.asText().isBlank()) {
                findings.add(error(
                        "Journey version field 'version_id' cannot be empty. Must contain a valid version ID."));
            }
        }

        JsonNode desc = version.get("desc");
        if (desc != null) {
            if (!desc.isTextual()) {
                findings.add(error("Journey version field 'desc' must be a string, got " + JsonNodes.typeName(desc)));
            } else if (desc.asText().isBlank()) {
                findings.add(error("Journey version field 'desc' cannot be empty. Must contain a description."));
            } else if (desc.asText().strip().length() < MIN_DESCRIPTION_LENGTH) {
                findings.add(error("Journey version field 'desc' is too short ('" + desc.asText()
                        + "'). Must contain a meaningful description."));
            }
        }

        JsonNode state = version.get("state");
        if (state != null) {
            String value = state.isTextual() ? state.asText() : state.toString();
            if (!state.isTextual() || !RegistryConstants.allows(constants.validVersionStates(), value)) {
                findings.add(error("Invalid state value '" + value + "'. Valid values are: "
                                + String.join(", ", constants.validVersionStates()))
                        .withHint(FixHint.catalogue()));
            }
        }
    }

    private void checkFilterCriteria(JsonNode filterCriteria, List<Finding> findings) {
        if (filterCriteria == null) {
            return;
        }
        if (!filterCriteria.isObject()) {
            findings.add(error("Journey version field 'filter_criteria' must be an object/dict, got "
                    + JsonNodes.typeName(filterCriteria)));
            return;
        }
        JsonNode type = filterCriteria.get("type");
        if (type == null) {
            findings.add(error("Journey version field 'filter_criteria' must have a 'type' field"));
        } else if (!JsonNodes.EXPRESSION.equals(type.asText(null))) {
            findings.add(error("Journey version field 'filter_criteria' type must be 'expression', got '"
                    + (type.isTextual() ? type.asText() : type.toString()) + "'"));
        }
        if (!filterCriteria.has("value")) {
            findings.add(error("Journey version field 'filter_criteria' must have a 'value' field"));
        }
    }

    private static Finding error(String message) {
        return Finding.error(Category.METADATA, null, message);
    }
}
