package io.journeyguard.core.registry;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;

/**
 * Static catalogue of node types and constants. Immutable once built and safe to share across
 * threads.
 */
public final class NodeRegistry {

    private static final NodeRegistry EMPTY = new NodeRegistry(Map.of(), RegistryConstants.empty());

    private final Map<String, NodeTypeDefinition> definitions;
    private final RegistryConstants constants;
    private final Set<String> terminalTypes;

    public NodeRegistry(Map<String, NodeTypeDefinition> definitions, RegistryConstants constants) {
        Objects.requireNonNull(definitions, "definitions must not be null");
        Objects.requireNonNull(constants, "constants must not be null");
        this.definitions = Collections.unmodifiableMap(new LinkedHashMap<>(definitions));
        this.constants = constants;
        Set<String> terminals = new TreeSet<>();
        definitions.forEach((name, def) -> {
            if (def.terminal()) {
                terminals.add(name);
            }
        });
        this.terminalTypes = Collections.unmodifiableSet(terminals);
    }

    /** A registry with no node types and empty constants. */
    public static NodeRegistry empty() {
        return EMPTY;
    }

    /**
     * Looks up a node type definition.
     *
     * @param type the registry key, may be {@code null}
     * @return the definition, or empty if unknown
     */
    public Optional<NodeTypeDefinition> find(String type) {
        return type == null ? Optional.empty() : Optional.ofNullable(definitions.get(type));
    }

    /**
     * Looks up a node type definition, throwing if not found.
     *
     * @throws IllegalArgumentException if the type is not registered
     */
    public NodeTypeDefinition require(String type) {
        return find(type)
                .orElseThrow(() -> new IllegalArgumentException("No node type registered for key: '" + type + "'"));
    }

    public boolean contains(String type) {
        return type != null && definitions.containsKey(type);
    }

    /** Returns {@code true} if the named type is flagged {@code is_terminal}. */
    public boolean isTerminal(String type) {
        return type != null && terminalTypes.contains(type);
    }

    /** Names of all terminal types, sorted. */
    public Set<String> terminalTypes() {
        return terminalTypes;
    }

    public Map<String, NodeTypeDefinition> definitions() {
        return definitions;
    }

    public RegistryConstants constants() {
        return constants;
    }

    /** Returns {@code true} if no node types are registered. */
    public boolean isEmpty() {
        return definitions.isEmpty();
    }

    public int size() {
        return definitions.size();
    }
}
