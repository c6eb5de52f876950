package io.journeyguard.core.error;

/**
 * Thrown when the workflow cannot be located inside the document envelope. The message names the
 * first missing key along the {@code exports[0].data.versions[0].workflow} path.
 */
public final class EnvelopeException extends JourneyLoadException {

    private static final long serialVersionUID = 1L;

    public EnvelopeException(String message, String documentName) {
        super(message, documentName, documentName);
    }
}
