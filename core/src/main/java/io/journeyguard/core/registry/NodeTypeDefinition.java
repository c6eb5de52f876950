package io.journeyguard.core.registry;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Catalogue entry for one node type.
 *
 * @param name                 the registry key
 * @param requiredFields       field name to expected kind ({@code expression}, {@code string},
 *                             {@code object}, {@code array}), in declaration order
 * @param requiredBranchLinks  names of required {@code branch} links
 * @param requiredEscapeLinks  names of required {@code escape} links
 * @param terminal             {@code true} for end states such as {@code auth_pass}
 * @param action               {@code true} if the type is an {@code action.type} value
 * @param deprecated           {@code true} if the type is no longer supported
 * @param replacement          the suggested replacement type, or {@code null}
 * @param atLeastOneOf         fields of which at least one must be present
 */
public record NodeTypeDefinition(
        String name,
        Map<String, String> requiredFields,
        List<String> requiredBranchLinks,
        List<String> requiredEscapeLinks,
        boolean terminal,
        boolean action,
        boolean deprecated,
        String replacement,
        List<String> atLeastOneOf) {

    public NodeTypeDefinition {
        Objects.requireNonNull(name, "name must not be null");
        requiredFields = requiredFields == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(requiredFields));
        requiredBranchLinks = requiredBranchLinks == null ? List.of() : List.copyOf(requiredBranchLinks);
        requiredEscapeLinks = requiredEscapeLinks == null ? List.of() : List.copyOf(requiredEscapeLinks);
        atLeastOneOf = atLeastOneOf == null ? List.of() : List.copyOf(atLeastOneOf);
    }

    /** Returns {@code true} if any branch or escape link is required. */
    public boolean hasRequiredLinks() {
        return !requiredBranchLinks.isEmpty() || !requiredEscapeLinks.isEmpty();
    }

    /**
     * Returns the link kind a link of the given name must have: {@code branch}, {@code escape},
     * or {@code null} if the name is not required.
     */
    public String expectedLinkType(String linkName) {
        if (requiredBranchLinks.contains(linkName)) {
            return "branch";
        }
        return requiredEscapeLinks.contains(linkName) ? "escape" : null;
    }
}
