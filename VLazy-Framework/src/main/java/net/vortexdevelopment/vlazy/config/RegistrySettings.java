package net.vortexdevelopment.vlazy.config;

import lombok.Builder;
import lombok.Getter;
import net.vortexdevelopment.vlazy.debug.DebugLogger;

/**
 * Registry-wide behaviour switches.
 * Built explicitly or from {@link Environment} through {@link #defaults()}.
 */
@Getter
@Builder(toBuilder = true)
public class RegistrySettings {
    public static final String TRANSFORM_DEFAULTS_KEY = "vlazy.transform-defaults";

    /**
     * Whether a property's transform is also applied to values produced by its default.
     * A property can override this with {@code transformDefault}.
     */
    private final boolean transformDefaults;

    /**
     * Creates settings from the environment, falling back to sensible defaults.
     */
    public static RegistrySettings defaults() {
        boolean transformDefaults = Environment.getInstance().getPropertyAsBoolean(TRANSFORM_DEFAULTS_KEY, false);
        DebugLogger.log(RegistrySettings.class, "Default settings: transformDefaults=%s", transformDefaults);
        return RegistrySettings.builder()
                .transformDefaults(transformDefaults)
                .build();
    }
}
