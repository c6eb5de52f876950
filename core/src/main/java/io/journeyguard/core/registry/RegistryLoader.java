package io.journeyguard.core.registry;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.networknt.schema.JsonSchema;
import com.networknt.schema.JsonSchemaFactory;
import com.networknt.schema.SpecVersion;
import com.networknt.schema.ValidationMessage;
import io.journeyguard.core.error.RegistryLoadException;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Loads the node type registry from JSON. The document is validated against the bundled JSON
 * Schema before any definition is read.
 *
 * <p>
 * Thread-safe: the schema is compiled once and the loader holds no mutable state.
 */
public final class RegistryLoader {

    private static final Logger LOG = LoggerFactory.getLogger(RegistryLoader.class);

    /** Classpath location of the bundled registry. */
    public static final String DEFAULT_RESOURCE = "/io/journeyguard/node-definitions.json";

    static final String SCHEMA_RESOURCE = "/io/journeyguard/node-definitions.schema.json";

    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final JsonSchemaFactory SCHEMA_FACTORY =
            JsonSchemaFactory.getInstance(SpecVersion.VersionFlag.V202012);

    private final JsonSchema schema;

    public RegistryLoader() {
        this.schema = SCHEMA_FACTORY.getSchema(readResource(SCHEMA_RESOURCE));
    }

    /**
     * Loads the registry bundled on the classpath.
     *
     * @throws RegistryLoadException if the bundled registry is missing or invalid
     */
    public NodeRegistry loadDefault() {
        return parse(readResource(DEFAULT_RESOURCE), "classpath:" + DEFAULT_RESOURCE);
    }

    /**
     * Loads a registry override from the filesystem. A missing file degrades to an empty registry
     * so that validation can still run; analyzers skip registry-backed checks in that case.
     *
     * @param path the override file
     * @throws RegistryLoadException if the file exists but is unreadable, unparseable or
     *     schema-invalid
     */
    public NodeRegistry load(Path path) {
        if (!Files.exists(path)) {
            LOG.warn("Registry file not found, continuing with an empty registry: path={}", path);
            return NodeRegistry.empty();
        }
        String source = path.toString();
        JsonNode root;
        try {
            root = MAPPER.readTree(path.toFile());
        } catch (JsonProcessingException e) {
            throw new RegistryLoadException("Registry is not valid JSON: " + e.getOriginalMessage(), e, source);
        } catch (IOException e) {
            throw new RegistryLoadException("Failed to read registry: " + e.getMessage(), e, source);
        }
        return parse(root, source);
    }

    /**
     * Builds a registry from an already-parsed document.
     *
     * @param root   the registry document
     * @param source a description of where it came from, for error messages
     */
    public NodeRegistry parse(JsonNode root, String source) {
        if (root == null || !root.isObject()) {
            throw new RegistryLoadException("Registry must be a JSON object", source);
        }
        Set<ValidationMessage> errors = schema.validate(root);
        if (!errors.isEmpty()) {
            String detail = errors.stream()
                    .map(ValidationMessage::getMessage)
                    .sorted()
                    .collect(Collectors.joining("; "));
            throw new RegistryLoadException("Registry does not match its schema: " + detail, source);
        }

        Map<String, NodeTypeDefinition> definitions = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> nodes = root.path("nodes").fields();
        while (nodes.hasNext()) {
            Map.Entry<String, JsonNode> entry = nodes.next();
            definitions.put(entry.getKey(), readDefinition(entry.getKey(), entry.getValue()));
        }
        RegistryConstants constants = readConstants(root.path("constants"));

        NodeRegistry registry = new NodeRegistry(definitions, constants);
        LOG.info(
                "Registry loaded: source={}, node_types={}, terminal_types={}",
                source,
                registry.size(),
                registry.terminalTypes().size());
        return registry;
    }

    private static NodeTypeDefinition readDefinition(String name, JsonNode node) {
        Map<String, String> requiredFields = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> fields = node.path("required_fields").fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            requiredFields.put(field.getKey(), field.getValue().asText());
        }
        JsonNode links = node.path("required_links");
        JsonNode replacement = node.get("replacement");
        return new NodeTypeDefinition(
                name,
                requiredFields,
                strings(links.path("branch")),
                strings(links.path("escape")),
                node.path("is_terminal").asBoolean(false),
                node.path("is_action").asBoolean(false),
                node.path("deprecated").asBoolean(false),
                replacement != null && replacement.isTextual() ? replacement.asText() : null,
                strings(node.path("at_least_one_of")));
    }

    private static RegistryConstants readConstants(JsonNode constants) {
        Map<String, String> implicit = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> entries =
                constants.path("platform_implicit_variables").fields();
        while (entries.hasNext()) {
            Map.Entry<String, JsonNode> entry = entries.next();
            implicit.put(entry.getKey(), entry.getValue().asText());
        }
        return new RegistryConstants(
                strings(constants.path("valid_journey_types")),
                strings(constants.path("valid_version_states")),
                strings(constants.path("valid_link_types")),
                strings(constants.path("valid_presentation_values")),
                strings(constants.path("valid_condition_types")),
                strings(constants.path("valid_condition_data_types")),
                strings(constants.path("known_namespaces")),
                strings(constants.path("valid_std_functions")),
                implicit);
    }

    private static List<String> strings(JsonNode array) {
        List<String> values = new ArrayList<>();
        if (array.isArray()) {
            array.forEach(value -> values.add(value.asText()));
        }
        return values;
    }

    private static JsonNode readResource(String resource) {
        try (InputStream in = RegistryLoader.class.getResourceAsStream(resource)) {
            if (in == null) {
                throw new RegistryLoadException("Bundled resource not found", "classpath:" + resource);
            }
            return MAPPER.readTree(in);
        } catch (IOException e) {
            throw new RegistryLoadException("Failed to read bundled resource: " + e.getMessage(), e, "classpath:" + resource);
        }
    }
}
