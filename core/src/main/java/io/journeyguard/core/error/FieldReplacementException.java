package io.journeyguard.core.error;

/** Thrown when a text-level field replacement cannot locate its node, field or string value. */
public final class FieldReplacementException extends JourneyException {

    private static final long serialVersionUID = 1L;

    private final String fieldPath;

    public FieldReplacementException(String message, String fieldPath) {
        super(message, null, Phase.REPAIR);
        this.fieldPath = fieldPath;
    }

    /** The requested {@code <node-id>/<field>/...} path. */
    public String fieldPath() {
        return fieldPath;
    }
}
