package io.journeyguard.cli.config;

/**
 * Thrown when configuration loading fails: an explicit config file that is missing, invalid YAML,
 * or an environment override that cannot be parsed.
 */
public class ConfigLoadException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public ConfigLoadException(String message) {
        super(message);
    }

    public ConfigLoadException(String message, Throwable cause) {
        super(message, cause);
    }
}
