package io.journeyguard.core.error;

/**
 * Thrown when a repaired document cannot be written back. The run is aborted; the original file
 * content is left in place.
 */
public final class PersistException extends JourneyException {

    private static final long serialVersionUID = 1L;

    public PersistException(String message, Throwable cause, String documentName) {
        super(message, cause, documentName, Phase.REPAIR);
    }
}
