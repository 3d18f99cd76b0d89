package net.vortexdevelopment.vlazy.annotation;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Enables debug logging for the annotated record type.
 * When placed on a record class, cache hits, misses, refreshes and evictions of its
 * instances are printed.
 */
@Retention(RetentionPolicy.RUNTIME)
@Target(ElementType.TYPE)
public @interface EnableDebug {
}
