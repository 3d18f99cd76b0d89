package net.vortexdevelopment.vlazy.property;

import lombok.AccessLevel;
import lombok.Getter;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.function.Function;

/**
 * The options a property is declared with.
 * <p>
 * Usage:
 * <pre>
 * {@code
 * PropertyOptions.<User>builder()
 *         .from("nickname", "fullName")
 *         .with(String::trim)
 *         .defaultGenerator(user -> "anonymous")
 *         .build();
 * }
 * </pre>
 * Validation happens when the options are declared into a {@link PropertyRegistry}.
 *
 * @param <R> the record type transforms and generators receive
 */
@Getter
public class PropertyOptions<R> {
    private static final PropertyOptions<Object> NONE = new Builder<>().build();

    private final boolean required;
    private final boolean identity;
    private final List<String> from;
    @Getter(AccessLevel.NONE)
    private final boolean hasDefault;
    @Nullable
    private final Object defaultValue;
    @Nullable
    private final DefaultGenerator<? super R> defaultGenerator;
    @Nullable
    private final ValueTransform<? super R> transform;
    @Nullable
    private final String transformMethod;
    /**
     * Per-property override of {@code RegistrySettings#transformDefaults}, {@code null} when unset.
     */
    @Nullable
    private final Boolean transformDefault;

    private PropertyOptions(Builder<R> builder) {
        this.required = builder.required;
        this.identity = builder.identity;
        this.from = Collections.unmodifiableList(new ArrayList<>(builder.from));
        this.hasDefault = builder.hasDefault;
        this.defaultValue = builder.defaultValue;
        this.defaultGenerator = builder.defaultGenerator;
        this.transform = builder.transform;
        this.transformMethod = builder.transformMethod;
        this.transformDefault = builder.transformDefault;
    }

    public boolean hasDefault() {
        return hasDefault;
    }

    /**
     * Options with every setting left at its default.
     */
    @SuppressWarnings("unchecked")
    public static <R> PropertyOptions<R> none() {
        return (PropertyOptions<R>) NONE;
    }

    public static <R> Builder<R> builder() {
        return new Builder<>();
    }

    public static class Builder<R> {
        private boolean required;
        private boolean identity;
        private final List<String> from = new ArrayList<>();
        private boolean hasDefault;
        private Object defaultValue;
        private DefaultGenerator<? super R> defaultGenerator;
        private ValueTransform<? super R> transform;
        private String transformMethod;
        private Boolean transformDefault;

        /**
         * The payload must contain one of the property's source keys when the record is constructed.
         */
        public Builder<R> required() {
            return required(true);
        }

        public Builder<R> required(boolean required) {
            this.required = required;
            return this;
        }

        /**
         * The property takes part in record equality.
         */
        public Builder<R> identity() {
            return identity(true);
        }

        public Builder<R> identity(boolean identity) {
            this.identity = identity;
            return this;
        }

        /**
         * Source keys to look the raw value up under, tried left to right.
         * Repeated calls append candidates.
         */
        public Builder<R> from(String... keys) {
            this.from.addAll(Arrays.asList(keys));
            return this;
        }

        public Builder<R> from(List<String> keys) {
            this.from.addAll(keys);
            return this;
        }

        public Builder<R> defaultValue(@Nullable Object value) {
            this.hasDefault = true;
            this.defaultValue = value;
            this.defaultGenerator = null;
            return this;
        }

        /**
         * Default computed on first read, with the owning record as argument.
         */
        public Builder<R> defaultGenerator(DefaultGenerator<? super R> generator) {
            this.hasDefault = true;
            this.defaultValue = null;
            this.defaultGenerator = generator;
            return this;
        }

        /**
         * Shortcut for {@code defaultValue(null)}.
         */
        public Builder<R> nullable() {
            return defaultValue(null);
        }

        /**
         * Transform of the raw value alone. The raw value is cast to the function's input type.
         */
        @SuppressWarnings("unchecked")
        public <V> Builder<R> with(Function<V, ?> function) {
            this.transform = (record, value) -> function.apply((V) value);
            return this;
        }

        /**
         * Transform that also receives the owning record.
         */
        public Builder<R> withRecord(ValueTransform<? super R> transform) {
            this.transform = transform;
            return this;
        }

        /**
         * Transform by calling a chain of no-argument methods on the value, e.g. {@code "trim"}.
         */
        public Builder<R> withMethod(String methodChain) {
            this.transformMethod = methodChain;
            return this;
        }

        public Builder<R> transformDefault(boolean transformDefault) {
            this.transformDefault = transformDefault;
            return this;
        }

        public PropertyOptions<R> build() {
            return new PropertyOptions<>(this);
        }
    }
}
