package net.vortexdevelopment.vlazy.exception;

import lombok.Getter;

/**
 * Thrown when a record is constructed from a payload that lacks a required key.
 * The record is not usable.
 */
@Getter
public class RequiredAttributeException extends LazyRecordException {
    private final String propertyName;
    private final Class<?> recordType;

    public RequiredAttributeException(Class<?> recordType, String propertyName) {
        super(recordType.getSimpleName() + " requires `" + propertyName + "`");
        this.recordType = recordType;
        this.propertyName = propertyName;
    }
}
