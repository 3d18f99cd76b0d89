package net.vortexdevelopment.vlazy.exception;

/**
 * Thrown when a named method chain cannot be applied to a property value.
 */
public class TransformException extends LazyRecordException {
    public TransformException(String message) {
        super(message);
    }

    public TransformException(String message, Throwable cause) {
        super(message, cause);
    }
}
