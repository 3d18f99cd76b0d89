package net.vortexdevelopment.vlazy;

import java.util.Map;

/**
 * Fetches fresh source data for a record.
 * <p>
 * Invoked synchronously when a read misses, or explicitly through {@link LazyRecord#reload()}.
 * The returned entries are merged into the record's source data, overriding existing keys.
 * An implementation must mark its record fully loaded once further refreshes are pointless,
 * otherwise every later miss triggers another refresh.
 * <p>
 * Exceptions propagate unchanged to the caller of the read or reload. Checked failures
 * (for example an {@link java.io.IOException}) should be wrapped in an unchecked exception.
 */
@FunctionalInterface
public interface RefreshProtocol {
    /**
     * @return new source entries; may be empty, {@code null} is treated as empty
     */
    Map<String, ?> refresh();
}
