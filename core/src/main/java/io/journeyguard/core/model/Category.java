package io.journeyguard.core.model;

import java.util.Optional;

/** The analyzer family a finding or fix belongs to. */
public enum Category {
    METADATA("metadata", "Journey Metadata Validation"),
    STRUCTURE("structure", "Journey Structure Validation"),
    REQUIRED_FIELDS("required-fields", "Journey Required Fields Validation"),
    EXPRESSIONS("expressions", "Journey Expression Validation"),
    VARIABLES("variables", "Journey Variable Validation");

    private final String id;
    private final String title;

    Category(String id, String title) {
        this.id = id;
        this.title = title;
    }

    /** Short identifier used on the command line. */
    public String id() {
        return id;
    }

    /** Heading used in reports. */
    public String title() {
        return title;
    }

    public static Optional<Category> fromId(String id) {
        for (Category category : values()) {
            if (category.id.equalsIgnoreCase(id)) {
                return Optional.of(category);
            }
        }
        return Optional.empty();
    }
}
