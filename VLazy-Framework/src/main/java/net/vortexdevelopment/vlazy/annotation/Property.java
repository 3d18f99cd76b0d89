package net.vortexdevelopment.vlazy.annotation;

import java.lang.annotation.ElementType;
import java.lang.annotation.Repeatable;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Declares a property on a record class, read by {@code PropertyRegistry.scan(Class)}.
 * Declarations on a superclass are inherited; re-declaring a name on a subclass replaces it
 * for the subclass only.
 *
 * <p>Usage example:
 * <pre>
 * {@code
 * @Property(name = "id", required = true, identity = true)
 * @Property(name = "displayName", from = {"nickname", "fullName"}, with = "trim")
 * @Property(name = "tags", defaultMethod = "emptyTags")
 * public class User extends LazyRecord {
 *     private static final PropertyRegistry<User> PROPERTIES = PropertyRegistry.scan(User.class);
 *     ...
 * }
 * }
 * </pre>
 */
@Retention(RetentionPolicy.RUNTIME)
@Target(ElementType.TYPE)
@Repeatable(Properties.class)
public @interface Property {
    /**
     * The property name.
     */
    String name();

    /**
     * Source keys, tried left to right. Empty means the property name itself.
     */
    String[] from() default {};

    boolean required() default false;

    boolean identity() default false;

    /**
     * Shortcut for a {@code null} default.
     */
    boolean nullable() default false;

    /**
     * Method chain applied to the raw value (e.g. "trim" or "getName.length").
     */
    String with() default "";

    /**
     * Name of a no-argument method on the record that produces the default value.
     */
    String defaultMethod() default "";
}
