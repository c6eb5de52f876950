package io.journeyguard.core.error;

/**
 * Abstract base for all journey-guard exceptions. Never thrown directly; use the concrete
 * subclasses under {@link JourneyLoadException} or the repair-phase types.
 *
 * <p>
 * Analysis findings are never exceptions. Only conditions that stop a run (an unusable
 * document, an unreadable registry, a failed write) are thrown.
 */
public abstract class JourneyException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    /** Phase in which the error occurred. */
    public enum Phase {
        LOAD,
        REPAIR
    }

    private final String documentName;
    private final Phase phase;

    protected JourneyException(String message, String documentName, Phase phase) {
        super(message);
        this.documentName = documentName;
        this.phase = phase;
    }

    protected JourneyException(String message, Throwable cause, String documentName, Phase phase) {
        super(message, cause);
        this.documentName = documentName;
        this.phase = phase;
    }

    /** Bare file name of the document involved, or {@code null} if not file-backed. */
    public String documentName() {
        return documentName;
    }

    /** Human-readable error description (alias for {@link #getMessage()}). */
    public String detail() {
        return getMessage();
    }

    /** The phase in which the error occurred. */
    public Phase phase() {
        return phase;
    }
}
