package com.billow;

/**
 * Indicates missing or invalid startup configuration. This is always fatal.
 */
public class ConfigException extends Exception {
    /**
     * Create a new configuration exception.
     *
     * @param message
     *            Description of the problem.
     */
    public ConfigException(String message) {
        super(message);
    }

    /**
     * Create a new configuration exception with a cause.
     *
     * @param message
     *            Description of the problem.
     * @param cause
     *            The underlying error.
     */
    public ConfigException(String message, Throwable cause) {
        super(message, cause);
    }
}
