package net.vortexdevelopment.vlazy.resolver;

import lombok.Getter;
import net.vortexdevelopment.vlazy.RefreshProtocol;
import net.vortexdevelopment.vlazy.debug.DebugLogger;
import net.vortexdevelopment.vlazy.exception.MissingAttributeException;
import net.vortexdevelopment.vlazy.exception.RequiredAttributeException;
import net.vortexdevelopment.vlazy.exception.UndeclaredPropertyException;
import net.vortexdevelopment.vlazy.property.PropertyDescriptor;
import net.vortexdevelopment.vlazy.property.PropertyRegistry;
import org.jetbrains.annotations.Nullable;

import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Per-record value store implementing the lazy resolution algorithm.
 * <p>
 * A read looks in this order: explicit writes, computed cache, then the raw source data under
 * the property's source keys, then the property's default. When no source key is present and
 * the record is not fully loaded, the refresh collaborator is called once before giving up on
 * the source data. Values produced from source or default are cached until the next reload.
 * <p>
 * Not thread-safe. Each instance is owned by exactly one record.
 *
 * @param <R> the record type
 */
public class AttributeResolver<R> {
    @Getter
    private final PropertyRegistry<R> registry;
    private final R owner;
    private final RefreshProtocol refreshProtocol;

    private final Map<String, Object> sourceData;
    private final Map<String, Object> computedCache = new HashMap<>();
    private final Map<String, Object> writeOverlay = new HashMap<>();

    @Getter
    private boolean fullyLoaded;
    private boolean refreshing;
    private int generation;

    /**
     * Bind a resolver to its record. Seals the registry, but does not verify required
     * properties; call {@link #verifyRequired()} once the record is ready.
     *
     * @param registry the record type's properties
     * @param owner the record transforms and defaults receive
     * @param refreshProtocol called on a miss and on {@link #reload()}
     * @param sourceData the initial payload, copied
     */
    public AttributeResolver(PropertyRegistry<R> registry, R owner, RefreshProtocol refreshProtocol,
                             @Nullable Map<String, ?> sourceData) {
        this.registry = registry;
        this.owner = owner;
        this.refreshProtocol = refreshProtocol;
        this.sourceData = sourceData == null ? new HashMap<>() : new HashMap<>(sourceData);
        registry.seal();
    }

    /**
     * Check that the payload holds a source key for every required property.
     *
     * @throws RequiredAttributeException naming the first required property, in declaration order, that is absent
     */
    public void verifyRequired() {
        for (PropertyDescriptor<? super R> descriptor : registry.descriptors().values()) {
            if (descriptor.isRequired() && presentSourceKey(descriptor) == null) {
                throw new RequiredAttributeException(recordClass(), descriptor.getName());
            }
        }
    }

    /**
     * Resolve a property's value.
     *
     * @throws UndeclaredPropertyException if the name was never declared
     * @throws MissingAttributeException if neither the source data, after any refresh, nor a default provides a value
     */
    public Object read(String name) {
        PropertyDescriptor<? super R> descriptor = describe(name);
        if (writeOverlay.containsKey(name)) {
            return writeOverlay.get(name);
        }
        if (computedCache.containsKey(name)) {
            DebugLogger.log(registry.getRecordType(), "Cache HIT for %s", name);
            return computedCache.get(name);
        }
        DebugLogger.log(registry.getRecordType(), "Cache MISS for %s", name);
        Object value = load(descriptor);
        computedCache.put(name, value);
        return value;
    }

    private Object load(PropertyDescriptor<? super R> descriptor) {
        String sourceKey = presentSourceKey(descriptor);
        if (sourceKey == null && !fullyLoaded && !refreshing) {
            DebugLogger.log(registry.getRecordType(), "No source value for %s, refreshing", descriptor.getName());
            reload();
            sourceKey = presentSourceKey(descriptor);
        }
        if (sourceKey != null) {
            return descriptor.transform(owner, sourceData.get(sourceKey));
        }
        if (descriptor.isRuntimeRequired()) {
            throw new MissingAttributeException(recordClass(), descriptor.getSourceKeys());
        }
        return descriptor.resolveDefault(owner);
    }

    /**
     * Store an explicit value. It is returned verbatim, without transform, until discarded.
     */
    public void write(String name, @Nullable Object value) {
        describe(name);
        writeOverlay.put(name, value);
    }

    /**
     * Drop an explicit write so the source-derived value is visible again.
     *
     * @return whether there was a write to discard
     */
    public boolean discardWrite(String name) {
        describe(name);
        if (!writeOverlay.containsKey(name)) {
            return false;
        }
        writeOverlay.remove(name);
        return true;
    }

    /**
     * Evict one computed value, so the next read recomputes it.
     *
     * @return whether a value was cached
     */
    public boolean invalidate(String name) {
        describe(name);
        if (!computedCache.containsKey(name)) {
            return false;
        }
        computedCache.remove(name);
        DebugLogger.log(registry.getRecordType(), "Evicted %s", name);
        return true;
    }

    /**
     * Call the refresh collaborator and merge its result.
     * Misses that happen while the refresh runs do not trigger a nested refresh.
     */
    public void reload() {
        Map<String, ?> result;
        refreshing = true;
        try {
            result = refreshProtocol.refresh();
        } finally {
            refreshing = false;
        }
        mergeReloadResult(result);
    }

    /**
     * Merge new source entries over the existing ones and clear the computed cache.
     * Explicit writes are kept.
     */
    public void mergeReloadResult(@Nullable Map<String, ?> newSourceData) {
        if (newSourceData != null) {
            sourceData.putAll(newSourceData);
        }
        DebugLogger.log(registry.getRecordType(), "Merged %d reloaded keys, clearing %d cached values",
                newSourceData == null ? 0 : newSourceData.size(), computedCache.size());
        computedCache.clear();
        generation++;
    }

    /**
     * Snapshot of the record's values in declaration order, explicit writes winning over computed values.
     * <p>
     * A strict snapshot that triggers a refresh part way through is collected again from the merged
     * source data, without further refreshes, so no entry predates the refresh.
     *
     * @param strict resolve every property, refreshing and failing as {@link #read(String)} does;
     *               otherwise include only what is already cached or written
     */
    public Map<String, Object> toMap(boolean strict) {
        if (!strict) {
            return collect(false);
        }
        int before = generation;
        Map<String, Object> result = collect(true);
        if (generation != before) {
            DebugLogger.log(registry.getRecordType(), "Refreshed while collecting, collecting again");
            boolean wasRefreshing = refreshing;
            refreshing = true;
            try {
                result = collect(true);
            } finally {
                refreshing = wasRefreshing;
            }
        }
        return result;
    }

    private Map<String, Object> collect(boolean strict) {
        Map<String, Object> result = new LinkedHashMap<>();
        for (String name : registry.names()) {
            if (writeOverlay.containsKey(name)) {
                result.put(name, writeOverlay.get(name));
            } else if (strict) {
                result.put(name, read(name));
            } else if (computedCache.containsKey(name)) {
                result.put(name, computedCache.get(name));
            }
        }
        return Collections.unmodifiableMap(result);
    }

    public void setFullyLoaded(boolean fullyLoaded) {
        this.fullyLoaded = fullyLoaded;
    }

    public boolean isCached(String name) {
        return computedCache.containsKey(name);
    }

    public Set<String> cachedNames() {
        return Set.copyOf(computedCache.keySet());
    }

    public boolean isWritten(String name) {
        return writeOverlay.containsKey(name);
    }

    /**
     * @return whether the raw source data currently holds any of the property's source keys
     */
    public boolean hasSourceValue(String name) {
        return presentSourceKey(describe(name)) != null;
    }

    private PropertyDescriptor<? super R> describe(String name) {
        return registry.lookup(name)
                .orElseThrow(() -> new UndeclaredPropertyException(recordClass(), name));
    }

    @Nullable
    private String presentSourceKey(PropertyDescriptor<? super R> descriptor) {
        List<String> keys = descriptor.getSourceKeys();
        for (String key : keys) {
            if (sourceData.containsKey(key)) {
                return key;
            }
        }
        return null;
    }

    private Class<?> recordClass() {
        return owner.getClass();
    }
}
