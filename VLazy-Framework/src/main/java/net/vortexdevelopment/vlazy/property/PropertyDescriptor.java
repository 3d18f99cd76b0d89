package net.vortexdevelopment.vlazy.property;

import lombok.AccessLevel;
import lombok.Getter;
import net.vortexdevelopment.vlazy.exception.ConfigurationException;
import org.jetbrains.annotations.Nullable;

import java.util.List;

/**
 * Immutable metadata for one declared property.
 *
 * @param <R> the record type the transform and default generator receive
 */
@Getter
public class PropertyDescriptor<R> {
    private final String name;
    private final List<String> sourceKeys;
    private final boolean required;
    private final boolean identity;
    @Getter(AccessLevel.NONE)
    private final boolean hasDefault;
    @Nullable
    private final Object defaultValue;
    @Nullable
    private final DefaultGenerator<? super R> defaultGenerator;
    @Nullable
    private final ValueTransform<? super R> transform;
    private final boolean transformDefault;

    private PropertyDescriptor(String name, List<String> sourceKeys, boolean required, boolean identity,
                               boolean hasDefault, @Nullable Object defaultValue,
                               @Nullable DefaultGenerator<? super R> defaultGenerator,
                               @Nullable ValueTransform<? super R> transform, boolean transformDefault) {
        this.name = name;
        this.sourceKeys = List.copyOf(sourceKeys);
        this.required = required;
        this.identity = identity;
        this.hasDefault = hasDefault;
        this.defaultValue = defaultValue;
        this.defaultGenerator = defaultGenerator;
        this.transform = transform;
        this.transformDefault = transformDefault;
    }

    /**
     * Validate the options and build the descriptor.
     *
     * @param name the property name
     * @param options the declared options
     * @param transformDefaults the registry-wide setting, used when the options leave it unset
     * @throws ConfigurationException if the options are contradictory
     */
    static <R> PropertyDescriptor<R> create(String name, PropertyOptions<R> options, boolean transformDefaults) {
        if (name == null || name.isBlank()) {
            throw new ConfigurationException("Property name must not be blank");
        }
        if (options.isRequired() && options.hasDefault()) {
            throw new ConfigurationException("Property `" + name + "` cannot be both required and have a default");
        }
        if (options.getTransform() != null && options.getTransformMethod() != null) {
            throw new ConfigurationException("Property `" + name + "` declares both a transform function and a transform method");
        }
        for (String key : options.getFrom()) {
            if (key == null || key.isBlank()) {
                throw new ConfigurationException("Property `" + name + "` has a blank source key");
            }
        }

        List<String> sourceKeys = options.getFrom().isEmpty() ? List.of(name) : options.getFrom();
        ValueTransform<? super R> transform = options.getTransform();
        if (options.getTransformMethod() != null) {
            if (options.getTransformMethod().isBlank()) {
                throw new ConfigurationException("Property `" + name + "` has a blank transform method");
            }
            transform = new MethodChainTransform(options.getTransformMethod());
        }
        boolean transformDefault = options.getTransformDefault() != null
                ? options.getTransformDefault()
                : transformDefaults;

        return new PropertyDescriptor<>(name, sourceKeys, options.isRequired(), options.isIdentity(),
                options.hasDefault(), options.getDefaultValue(), options.getDefaultGenerator(),
                transform, transformDefault);
    }

    public boolean hasDefault() {
        return hasDefault;
    }

    /**
     * @return the first candidate source key
     */
    public String getSourceKey() {
        return sourceKeys.get(0);
    }

    /**
     * A read that finds neither a source value nor a default fails.
     */
    public boolean isRuntimeRequired() {
        return !hasDefault;
    }

    /**
     * Apply the transform, if any, to a raw source value.
     */
    public Object transform(R record, Object rawValue) {
        return transform == null ? rawValue : transform.apply(record, rawValue);
    }

    /**
     * Produce the default value, running the generator if there is one.
     * The transform is applied only when {@link #isTransformDefault()} is set.
     */
    public Object resolveDefault(R record) {
        Object value = defaultGenerator != null ? defaultGenerator.generate(record) : defaultValue;
        return transformDefault ? transform(record, value) : value;
    }

    @Override
    public String toString() {
        return "PropertyDescriptor{" + name + " <- " + sourceKeys
                + (required ? ", required" : "")
                + (identity ? ", identity" : "")
                + (hasDefault ? ", default" : "")
                + (transform != null ? ", transformed" : "")
                + "}";
    }
}
