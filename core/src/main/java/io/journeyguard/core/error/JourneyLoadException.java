package io.journeyguard.core.error;

/**
 * Abstract parent for load-time errors. A load failure is fatal to a single run: no analyzer
 * executes without a usable workflow. Carries the {@code source} that failed to load (a file
 * name or classpath resource).
 */
public abstract class JourneyLoadException extends JourneyException {

    private static final long serialVersionUID = 1L;

    private final String source;

    protected JourneyLoadException(String message, String documentName, String source) {
        super(message, documentName, Phase.LOAD);
        this.source = source;
    }

    protected JourneyLoadException(String message, Throwable cause, String documentName, String source) {
        super(message, cause, documentName, Phase.LOAD);
        this.source = source;
    }

    /** The source that failed to load, or {@code null} if unknown. */
    public String source() {
        return source;
    }
}
