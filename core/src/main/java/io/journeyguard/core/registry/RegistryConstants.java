package io.journeyguard.core.registry;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Constant lists shipped alongside the node definitions. An empty list disables the membership
 * check it backs.
 */
public record RegistryConstants(
        List<String> validJourneyTypes,
        List<String> validVersionStates,
        List<String> validLinkTypes,
        List<String> validPresentationValues,
        List<String> validConditionTypes,
        List<String> validConditionDataTypes,
        List<String> knownNamespaces,
        List<String> validStdFunctions,
        Map<String, String> platformImplicitVariables) {

    private static final RegistryConstants EMPTY =
            new RegistryConstants(null, null, null, null, null, null, null, null, null);

    public RegistryConstants {
        validJourneyTypes = copy(validJourneyTypes);
        validVersionStates = copy(validVersionStates);
        validLinkTypes = copy(validLinkTypes);
        validPresentationValues = copy(validPresentationValues);
        validConditionTypes = copy(validConditionTypes);
        validConditionDataTypes = copy(validConditionDataTypes);
        knownNamespaces = copy(knownNamespaces);
        validStdFunctions = copy(validStdFunctions);
        platformImplicitVariables = platformImplicitVariables == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(platformImplicitVariables));
    }

    private static List<String> copy(List<String> values) {
        return values == null ? List.of() : List.copyOf(values);
    }

    public static RegistryConstants empty() {
        return EMPTY;
    }

    /**
     * Membership test that passes whenever {@code allowed} is empty, so an unconfigured constant
     * never produces findings.
     */
    public static boolean allows(List<String> allowed, String value) {
        return allowed.isEmpty() || allowed.contains(value);
    }
}
