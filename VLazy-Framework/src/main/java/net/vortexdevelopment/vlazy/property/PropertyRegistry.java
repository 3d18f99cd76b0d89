package net.vortexdevelopment.vlazy.property;

import lombok.Getter;
import net.vortexdevelopment.vlazy.annotation.EnableDebug;
import net.vortexdevelopment.vlazy.annotation.Property;
import net.vortexdevelopment.vlazy.config.RegistrySettings;
import net.vortexdevelopment.vlazy.debug.DebugLogger;
import net.vortexdevelopment.vlazy.exception.ConfigurationException;
import net.vortexdevelopment.vlazy.exception.LazyRecordException;

import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;
import java.util.ArrayDeque;
import java.util.Collections;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Ordered collection of the properties declared by one record type.
 * <p>
 * A registry is populated while its record class initialises and is sealed as soon as the
 * first record is constructed against it. Subclasses get a detached copy through
 * {@link #inheritInto(Class)}, so declarations on either side never leak into the other.
 *
 * @param <R> the record type
 */
public class PropertyRegistry<R> {
    @Getter
    private final Class<R> recordType;
    @Getter
    private final RegistrySettings settings;
    private final Map<String, PropertyDescriptor<? super R>> descriptors;
    private volatile boolean sealed;

    private PropertyRegistry(Class<R> recordType, RegistrySettings settings,
                             Map<String, PropertyDescriptor<? super R>> descriptors) {
        this.recordType = recordType;
        this.settings = settings;
        this.descriptors = descriptors;
        if (recordType.isAnnotationPresent(EnableDebug.class)) {
            DebugLogger.enableDebugFor(recordType);
        }
    }

    /**
     * Create an empty registry with settings read from the environment.
     */
    public static <R> PropertyRegistry<R> forType(Class<R> recordType) {
        return forType(recordType, RegistrySettings.defaults());
    }

    public static <R> PropertyRegistry<R> forType(Class<R> recordType, RegistrySettings settings) {
        return new PropertyRegistry<>(recordType, settings, new LinkedHashMap<>());
    }

    /**
     * Create a registry from the {@link Property} annotations on the record type and its superclasses.
     * Superclass declarations are applied first.
     */
    public static <R> PropertyRegistry<R> scan(Class<R> recordType) {
        return scan(recordType, RegistrySettings.defaults());
    }

    public static <R> PropertyRegistry<R> scan(Class<R> recordType, RegistrySettings settings) {
        PropertyRegistry<R> registry = forType(recordType, settings);
        Deque<Class<?>> hierarchy = new ArrayDeque<>();
        for (Class<?> type = recordType; type != null && type != Object.class; type = type.getSuperclass()) {
            hierarchy.push(type);
        }
        for (Class<?> type : hierarchy) {
            for (Property property : type.getDeclaredAnnotationsByType(Property.class)) {
                registry.declare(property.name(), optionsFrom(recordType, property));
            }
        }
        DebugLogger.log(recordType, "Scanned %d properties for %s", registry.size(), recordType.getName());
        return registry;
    }

    private static <R> PropertyOptions<R> optionsFrom(Class<R> recordType, Property property) {
        PropertyOptions.Builder<R> builder = PropertyOptions.<R>builder()
                .required(property.required())
                .identity(property.identity())
                .from(property.from());
        if (property.nullable()) {
            builder.nullable();
        }
        if (!property.with().isEmpty()) {
            builder.withMethod(property.with());
        }
        if (!property.defaultMethod().isEmpty()) {
            if (property.nullable()) {
                throw new ConfigurationException("Property `" + property.name() + "` cannot be both nullable and have a default method");
            }
            Method method = findDefaultMethod(recordType, property.defaultMethod());
            if (method == null) {
                throw new ConfigurationException("Default method `" + property.defaultMethod() + "` for property `"
                        + property.name() + "` not found on " + recordType.getName());
            }
            builder.defaultGenerator(record -> invokeDefaultMethod(method, record));
        }
        return builder.build();
    }

    private static Method findDefaultMethod(Class<?> recordType, String methodName) {
        for (Class<?> type = recordType; type != null; type = type.getSuperclass()) {
            for (Method method : type.getDeclaredMethods()) {
                if (method.getName().equals(methodName) && method.getParameterCount() == 0) {
                    method.setAccessible(true);
                    return method;
                }
            }
        }
        return null;
    }

    private static Object invokeDefaultMethod(Method method, Object record) {
        try {
            return method.invoke(record);
        } catch (IllegalAccessException e) {
            throw new LazyRecordException("Cannot access default method " + method.getName(), e);
        } catch (InvocationTargetException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException runtimeException) {
                throw runtimeException;
            }
            if (cause instanceof Error error) {
                throw error;
            }
            throw new LazyRecordException("Default method " + method.getName() + " failed", cause);
        }
    }

    /**
     * Declare a property with default options.
     */
    public String declare(String name) {
        return declare(name, PropertyOptions.none());
    }

    /**
     * Declare a property, replacing any earlier declaration of the same name.
     *
     * @return the canonical property name
     * @throws ConfigurationException if the options are invalid or the registry is sealed
     */
    public String declare(String name, PropertyOptions<? super R> options) {
        if (sealed) {
            throw new ConfigurationException("Cannot declare `" + name + "`: properties of "
                    + recordType.getSimpleName() + " are sealed once a record exists");
        }
        PropertyDescriptor<? super R> descriptor = PropertyDescriptor.create(name, options, settings.isTransformDefaults());
        descriptors.put(descriptor.getName(), descriptor);
        DebugLogger.log(recordType, "Declared %s", descriptor);
        return descriptor.getName();
    }

    /**
     * Chaining variant of {@link #declare(String)}.
     */
    public PropertyRegistry<R> property(String name) {
        declare(name);
        return this;
    }

    /**
     * Chaining variant of {@link #declare(String, PropertyOptions)}.
     */
    public PropertyRegistry<R> property(String name, PropertyOptions<? super R> options) {
        declare(name, options);
        return this;
    }

    /**
     * Copy every declaration into a fresh, unsealed registry for a subclass.
     */
    public <C extends R> PropertyRegistry<C> inheritInto(Class<C> childType) {
        return new PropertyRegistry<>(childType, settings, new LinkedHashMap<>(descriptors));
    }

    public Optional<PropertyDescriptor<? super R>> lookup(String name) {
        return Optional.ofNullable(descriptors.get(name));
    }

    public boolean contains(String name) {
        return descriptors.containsKey(name);
    }

    /**
     * @return property names in declaration order
     */
    public List<String> names() {
        return List.copyOf(descriptors.keySet());
    }

    public List<String> requiredNames() {
        return descriptors.values().stream()
                .filter(PropertyDescriptor::isRequired)
                .map(PropertyDescriptor::getName)
                .toList();
    }

    public List<String> identityNames() {
        return descriptors.values().stream()
                .filter(PropertyDescriptor::isIdentity)
                .map(PropertyDescriptor::getName)
                .toList();
    }

    public Map<String, PropertyDescriptor<? super R>> descriptors() {
        return Collections.unmodifiableMap(descriptors);
    }

    public int size() {
        return descriptors.size();
    }

    /**
     * Forbid further declarations. Called when the first record is constructed.
     */
    public void seal() {
        if (!sealed) {
            sealed = true;
            DebugLogger.log(recordType, "Sealed %d properties", descriptors.size());
        }
    }

    public boolean isSealed() {
        return sealed;
    }
}
