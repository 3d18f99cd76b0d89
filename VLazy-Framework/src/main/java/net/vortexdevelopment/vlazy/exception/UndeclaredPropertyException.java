package net.vortexdevelopment.vlazy.exception;

import lombok.Getter;

/**
 * Thrown on any access to a property name the record type never declared.
 * Unlike {@link MissingAttributeException}, lenient accessors do not swallow it.
 */
@Getter
public class UndeclaredPropertyException extends LazyRecordException {
    private final String propertyName;
    private final Class<?> recordType;

    public UndeclaredPropertyException(Class<?> recordType, String propertyName) {
        super("`" + propertyName + "` isn't defined for " + recordType.getSimpleName());
        this.recordType = recordType;
        this.propertyName = propertyName;
    }
}
