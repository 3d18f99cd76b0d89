package net.vortexdevelopment.vlazy.debug;

import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Debug logger utility keyed by class.
 * Record types are enabled through {@link net.vortexdevelopment.vlazy.annotation.EnableDebug},
 * any class through {@link #enableDebugFor(Class[])}, and everything through the
 * {@code vlazy.debug.all} system property.
 */
public class DebugLogger {

    private static final Set<String> enabledClasses = ConcurrentHashMap.newKeySet();
    private static final boolean GLOBAL_DEBUG = Boolean.getBoolean("vlazy.debug.all");

    /**
     * Enable debug logging for one or more classes.
     * Called by the property registry when it finds @EnableDebug on a record type.
     */
    public static void enableDebugFor(Class<?>... classes) {
        for (Class<?> clazz : classes) {
            enabledClasses.add(clazz.getName());
        }
    }

    /**
     * Disable debug logging for a class enabled earlier.
     */
    public static void disableDebugFor(Class<?> clazz) {
        enabledClasses.remove(clazz.getName());
    }

    /**
     * Check if debug logging is enabled for a class.
     */
    public static boolean isEnabled(Class<?> clazz) {
        return GLOBAL_DEBUG || enabledClasses.contains(clazz.getName());
    }

    /**
     * Log a debug message for a specific class.
     *
     * @param clazz the class to log for
     * @param message the debug message
     */
    public static void log(Class<?> clazz, String message) {
        if (isEnabled(clazz)) {
            System.out.println("[DEBUG:" + clazz.getSimpleName() + "] " + message);
        }
    }

    /**
     * Log a formatted debug message for a specific class.
     * Arguments are only formatted when logging is enabled for the class.
     *
     * @param clazz the class to log for
     * @param format the format string
     * @param args the arguments
     */
    public static void log(Class<?> clazz, String format, Object... args) {
        if (isEnabled(clazz)) {
            System.out.println("[DEBUG:" + clazz.getSimpleName() + "] " + String.format(format, args));
        }
    }

    /**
     * Clear all enabled debug classes (for testing).
     */
    public static void clearAll() {
        enabledClasses.clear();
    }
}
