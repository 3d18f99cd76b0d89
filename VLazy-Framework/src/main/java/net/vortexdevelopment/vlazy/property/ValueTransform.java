package net.vortexdevelopment.vlazy.property;

/**
 * Transformation applied to a raw source value before it is cached.
 * Receives the owning record, so a transform may read other properties.
 *
 * @param <R> the record type
 */
@FunctionalInterface
public interface ValueTransform<R> {
    Object apply(R record, Object value);
}
