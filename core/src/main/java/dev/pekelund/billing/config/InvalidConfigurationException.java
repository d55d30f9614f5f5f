package dev.pekelund.billing.config;

/**
 * Signals a recognized option with an unusable value. Raised before the pipeline touches any
 * persisted state.
 */
public class InvalidConfigurationException extends RuntimeException {

    public InvalidConfigurationException(String message) {
        super(message);
    }

    public InvalidConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
