package io.journeyguard.core.model;

import java.util.Optional;

/** Kind of a link: primary flow or error/alternate flow. */
public enum LinkKind {
    BRANCH("branch"),
    ESCAPE("escape");

    private final String wireName;

    LinkKind(String wireName) {
        this.wireName = wireName;
    }

    /** The value used in the {@code type} field of a link. */
    public String wireName() {
        return wireName;
    }

    /** Parses a wire value; unknown or {@code null} values yield empty. */
    public static Optional<LinkKind> fromWire(String value) {
        for (LinkKind kind : values()) {
            if (kind.wireName.equals(value)) {
                return Optional.of(kind);
            }
        }
        return Optional.empty();
    }
}
