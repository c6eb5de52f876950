package io.journeyguard.core.error;

/** Thrown when a journey document is not valid JSON or its root is not a JSON object. */
public final class DocumentParseException extends JourneyLoadException {

    private static final long serialVersionUID = 1L;

    public DocumentParseException(String message, String documentName) {
        super(message, documentName, documentName);
    }

    public DocumentParseException(String message, Throwable cause, String documentName) {
        super(message, cause, documentName, documentName);
    }
}
