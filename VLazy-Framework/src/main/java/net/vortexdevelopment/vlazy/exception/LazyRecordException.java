package net.vortexdevelopment.vlazy.exception;

/**
 * Base type for every error raised by the attribute resolution engine.
 */
public class LazyRecordException extends RuntimeException {
    public LazyRecordException(String message) {
        super(message);
    }

    public LazyRecordException(String message, Throwable cause) {
        super(message, cause);
    }
}
