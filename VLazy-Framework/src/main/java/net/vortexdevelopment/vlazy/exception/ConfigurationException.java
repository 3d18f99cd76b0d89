package net.vortexdevelopment.vlazy.exception;

/**
 * Thrown while declaring properties, when the declaration itself is invalid.
 * For example {@code required} combined with a default, or a declaration made after
 * the registry has been sealed by the first record instance.
 */
public class ConfigurationException extends LazyRecordException {
    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
