package io.journeyguard.cli.security;

/**
 * Thrown when a file fails the access checks of {@link PathGuard}. Messages carry at most the bare
 * file name, never an absolute path.
 */
public final class PathAccessException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public PathAccessException(String message) {
        super(message);
    }

    public PathAccessException(String message, Throwable cause) {
        super(message, cause);
    }
}
