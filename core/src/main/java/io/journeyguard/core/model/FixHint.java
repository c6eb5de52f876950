package io.journeyguard.core.model;

import java.util.List;
import java.util.Objects;

/**
 * Tells the repair engine whether, and how, a finding can be fixed automatically.
 *
 * @param type     the kind of fix
 * @param variable the variable to declare or initialize, or {@code null}
 * @param fields   the fields to initialize (sorted), empty otherwise
 */
public record FixHint(Type type, String variable, List<String> fields) {

    private static final FixHint NONE = new FixHint(Type.NONE, null, List.of());
    private static final FixHint CATALOGUE = new FixHint(Type.CATALOGUE, null, List.of());

    /** The kind of automatic fix available. */
    public enum Type {
        /** Report only. */
        NONE,
        /** Handled by the default repair catalogue. */
        CATALOGUE,
        /** Declare the variable in the initial {@code set_variables} step. */
        DECLARE_VARIABLE,
        /** Add missing fields to the variable's {@code set_variables} value. */
        INITIALIZE_FIELDS
    }

    public FixHint {
        Objects.requireNonNull(type, "type must not be null");
        fields = fields == null ? List.of() : List.copyOf(fields);
    }

    public static FixHint none() {
        return NONE;
    }

    public static FixHint catalogue() {
        return CATALOGUE;
    }

    public static FixHint declareVariable(String name) {
        Objects.requireNonNull(name, "name must not be null");
        return new FixHint(Type.DECLARE_VARIABLE, name, List.of());
    }

    public static FixHint initializeFields(String name, List<String> fields) {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(fields, "fields must not be null");
        return new FixHint(Type.INITIALIZE_FIELDS, name, fields.stream().distinct().sorted().toList());
    }

    /** Returns {@code true} for every type except {@link Type#NONE}. */
    public boolean isFixable() {
        return type != Type.NONE;
    }
}
