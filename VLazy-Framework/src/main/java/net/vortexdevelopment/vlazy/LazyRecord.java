package net.vortexdevelopment.vlazy;

import net.vortexdevelopment.vlazy.exception.ConfigurationException;
import net.vortexdevelopment.vlazy.exception.MissingAttributeException;
import net.vortexdevelopment.vlazy.exception.RequiredAttributeException;
import net.vortexdevelopment.vlazy.exception.UndeclaredPropertyException;
import net.vortexdevelopment.vlazy.property.PropertyRegistry;
import net.vortexdevelopment.vlazy.resolver.AttributeResolver;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Base class for records whose values are resolved lazily from a source payload.
 * <p>
 * Usage:
 * <pre>
 * {@code
 * public class User extends LazyRecord {
 *     static final PropertyRegistry<User> PROPERTIES = PropertyRegistry.forType(User.class)
 *             .property("id", PropertyOptions.<User>builder().required().identity().build())
 *             .property("age", PropertyOptions.<User>builder().with((String value) -> Integer.valueOf(value)).defaultValue(0).build());
 *
 *     public User(Map<String, ?> attributes) {
 *         super(PROPERTIES, attributes);
 *     }
 *
 *     public Integer getAge() {
 *         return read("age", Integer.class);
 *     }
 *
 *     @Override
 *     public Map<String, ?> refresh() {
 *         markFullyLoaded();
 *         return client.fetchUser(read("id"));
 *     }
 * }
 * }
 * </pre>
 * Instances are meant for a single owner; nothing here is synchronized.
 */
public abstract class LazyRecord implements RefreshProtocol {
    private final AttributeResolver<?> resolver;

    protected <R> LazyRecord(PropertyRegistry<R> registry) {
        this(registry, Collections.emptyMap());
    }

    /**
     * @param registry the properties of this record type
     * @param attributes the initial source payload
     * @throws ConfigurationException if this record is not an instance of the registry's record type
     * @throws RequiredAttributeException if a required property has no source key in the payload
     */
    protected <R> LazyRecord(@NotNull PropertyRegistry<R> registry, @Nullable Map<String, ?> attributes) {
        Class<R> recordType = registry.getRecordType();
        if (!recordType.isInstance(this)) {
            throw new ConfigurationException("Registry of " + recordType.getName()
                    + " cannot back a " + getClass().getName());
        }
        this.resolver = new AttributeResolver<>(registry, recordType.cast(this), this, attributes);
        this.resolver.verifyRequired();
    }

    /**
     * Default refresh: nothing more to fetch, the record is fully loaded.
     */
    @Override
    public Map<String, ?> refresh() {
        markFullyLoaded();
        return Collections.emptyMap();
    }

    /**
     * Strict read.
     *
     * @throws MissingAttributeException if no value can be produced
     * @throws UndeclaredPropertyException if the property was never declared
     */
    public Object read(String name) {
        return resolver.read(name);
    }

    public <T> T read(String name, Class<T> type) {
        return type.cast(resolver.read(name));
    }

    /**
     * Lenient read: a missing value yields {@code null}. Undeclared names still fail.
     */
    @Nullable
    public Object get(String name) {
        try {
            return resolver.read(name);
        } catch (MissingAttributeException e) {
            return null;
        }
    }

    public Optional<Object> find(String name) {
        return Optional.ofNullable(get(name));
    }

    public void set(String name, @Nullable Object value) {
        resolver.write(name, value);
    }

    /**
     * Write every entry in the map's iteration order.
     * Nothing is written if any name is undeclared.
     *
     * @throws UndeclaredPropertyException naming the first undeclared key
     */
    public void setAll(Map<String, ?> values) {
        for (String name : values.keySet()) {
            if (!getRegistry().contains(name)) {
                throw new UndeclaredPropertyException(getClass(), name);
            }
        }
        values.forEach(resolver::write);
    }

    /**
     * Discard an explicit write.
     *
     * @return whether there was one
     */
    public boolean unset(String name) {
        return resolver.discardWrite(name);
    }

    /**
     * Evict one computed value so the next read recomputes it.
     */
    public boolean invalidate(String name) {
        return resolver.invalidate(name);
    }

    /**
     * Call {@link #refresh()}, merge its result and clear computed values.
     * Reads that miss go through the same path, so {@link #refresh()} is the only hook to override.
     *
     * @return this record
     */
    public final LazyRecord reload() {
        resolver.reload();
        return this;
    }

    public boolean isFullyLoaded() {
        return resolver.isFullyLoaded();
    }

    protected void setFullyLoaded(boolean fullyLoaded) {
        resolver.setFullyLoaded(fullyLoaded);
    }

    protected void markFullyLoaded() {
        resolver.setFullyLoaded(true);
    }

    /**
     * Every property resolved, refreshing as needed.
     *
     * @throws MissingAttributeException if any property cannot be produced
     */
    public Map<String, Object> toMap() {
        return resolver.toMap(true);
    }

    public Map<String, Object> toMap(boolean strict) {
        return resolver.toMap(strict);
    }

    public PropertyRegistry<?> getRegistry() {
        return resolver.getRegistry();
    }

    AttributeResolver<?> resolver() {
        return resolver;
    }

    /**
     * Records of the same class are equal when all identity properties resolve to equal values.
     * Without identity properties, or when an identity value cannot be resolved on either side,
     * only the same instance is equal.
     */
    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (obj == null || obj.getClass() != getClass()) {
            return false;
        }
        List<Object> identity = identityValues();
        if (identity == null) {
            return false;
        }
        return identity.equals(((LazyRecord) obj).identityValues());
    }

    @Override
    public int hashCode() {
        List<Object> identity = identityValues();
        if (identity == null) {
            return System.identityHashCode(this);
        }
        return 31 * getClass().hashCode() + identity.hashCode();
    }

    /**
     * @return the resolved identity values, or {@code null} if there are none or one is missing
     */
    @Nullable
    private List<Object> identityValues() {
        List<String> identityNames = getRegistry().identityNames();
        if (identityNames.isEmpty()) {
            return null;
        }
        List<Object> values = new ArrayList<>(identityNames.size());
        for (String name : identityNames) {
            try {
                values.add(resolver.read(name));
            } catch (MissingAttributeException e) {
                return null;
            }
        }
        return values;
    }

    /**
     * Shows only values already resolved; never triggers loading.
     */
    @Override
    public String toString() {
        return getClass().getSimpleName() + resolver.toMap(false);
    }
}
