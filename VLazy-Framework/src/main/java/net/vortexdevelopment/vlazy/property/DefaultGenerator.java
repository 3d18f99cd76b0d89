package net.vortexdevelopment.vlazy.property;

/**
 * Produces a default value lazily, the first time a property is read without a source value.
 *
 * @param <R> the record type
 */
@FunctionalInterface
public interface DefaultGenerator<R> {
    Object generate(R record);
}
