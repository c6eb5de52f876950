package io.journeyguard.core.error;

/**
 * Thrown when a node-definitions registry exists but cannot be parsed or does not conform to the
 * registry schema. A registry that is simply absent is not an error.
 */
public final class RegistryLoadException extends JourneyLoadException {

    private static final long serialVersionUID = 1L;

    public RegistryLoadException(String message, String source) {
        super(message, null, source);
    }

    public RegistryLoadException(String message, Throwable cause, String source) {
        super(message, cause, null, source);
    }
}
