package io.journeyguard.core.model;

import java.util.Locale;

/**
 * Top-level discriminator of a node, derived from its own {@code type} field. The effective
 * registry type of an {@link #ACTION} node is resolved further by {@link NodeTypeResolver}.
 */
public enum NodeKind {
    ACTION,
    CONDITION,
    LOOP,
    BLOCK,
    /** Any other declared type, typically a platform node such as an OTP authenticator. */
    PLATFORM,
    /** The node declares no {@code type} at all. */
    UNTYPED;

    /** Maps a raw {@code type} value to its kind. */
    public static NodeKind fromWire(String type) {
        if (type == null) {
            return UNTYPED;
        }
        switch (type) {
            case "action":
                return ACTION;
            case "condition":
                return CONDITION;
            case "loop":
                return LOOP;
            case "block":
                return BLOCK;
            default:
                return PLATFORM;
        }
    }

    /** Returns {@code true} for loop and block nodes, which own an embedded body. */
    public boolean isContainer() {
        return this == LOOP || this == BLOCK;
    }

    /** The field that holds the embedded body for container kinds, otherwise {@code null}. */
    public String bodyKey() {
        if (this == LOOP) {
            return "loop_body";
        }
        return this == BLOCK ? "block" : null;
    }

    /** Lower-case wire name, as used in messages. */
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
