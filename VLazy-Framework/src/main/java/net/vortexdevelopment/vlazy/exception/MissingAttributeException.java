package net.vortexdevelopment.vlazy.exception;

import lombok.Getter;

import java.util.List;

/**
 * Thrown by strict reads when no value can be produced for a property, after any refresh attempt.
 * Identifies the source key the value was expected under, not the property name.
 */
@Getter
public class MissingAttributeException extends LazyRecordException {
    private final List<String> sourceKeys;
    private final Class<?> recordType;

    public MissingAttributeException(Class<?> recordType, List<String> sourceKeys) {
        super(message(recordType, sourceKeys));
        this.recordType = recordType;
        this.sourceKeys = List.copyOf(sourceKeys);
    }

    /**
     * @return the primary (first candidate) source key
     */
    public String getSourceKey() {
        return sourceKeys.get(0);
    }

    private static String message(Class<?> recordType, List<String> sourceKeys) {
        if (sourceKeys.size() == 1) {
            return "`" + sourceKeys.get(0) + "` is missing for " + recordType.getSimpleName();
        }
        return "None of " + sourceKeys + " is present for " + recordType.getSimpleName();
    }
}
