package com.splittree.common;

import java.util.Locale;

/**
 * Abstraction for reading environment variables or configuration values.
 * <p>
 * Used to avoid direct calls to {@link System#getenv(String)} in code,
 * so that unit tests can provide their own environment source.
 */
@FunctionalInterface
public interface IEnvGetter {
    /**
     * Default implementation backed by {@link System#getenv(String)}.
     */
    IEnvGetter env = System::getenv;

    /**
     * Returns the value of the given environment variable, or {@code null} if unset.
     */
    String get(String name);

    /**
     * {@code true} or {@code false}, case-insensitive. Anything else is rejected.
     */
    static boolean getBooleanOr(IEnvGetter env, String name, boolean defaultValue) {
        String value = env.get(name);
        if (value == null || value.isBlank()) return defaultValue;
        String trimmed = value.trim();
        if (trimmed.equalsIgnoreCase("true")) return true;
        if (trimmed.equalsIgnoreCase("false")) return false;
        throw new IllegalStateException("Invalid boolean for environment variable: " + name + " = '" + value + "'");
    }

    /**
     * Exactly one (non-blank) character. Surrounding whitespace is ignored.
     */
    static char getCharOr(IEnvGetter env, String name, char defaultValue) {
        String value = env.get(name);
        if (value == null || value.isBlank()) return defaultValue;
        String trimmed = value.trim();
        if (trimmed.length() != 1) {
            throw new IllegalStateException("Expected a single character for environment variable: " + name + " = '" + value + "'");
        }
        return trimmed.charAt(0);
    }

    /**
     * Enum constant by name, case-insensitive.
     */
    static <E extends Enum<E>> E getEnumOr(IEnvGetter env, String name, Class<E> type, E defaultValue) {
        String value = env.get(name);
        if (value == null || value.isBlank()) return defaultValue;
        try {
            return Enum.valueOf(type, value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalStateException("Invalid " + type.getSimpleName() + " for environment variable: " + name + " = '" + value + "'", e);
        }
    }

    /**
     * Reads from this source first and falls back to {@code fallback} for missing or blank values.
     */
    default IEnvGetter orElse(IEnvGetter fallback) {
        return name -> {
            String value = get(name);
            return (value != null && !value.isBlank()) ? value : fallback.get(name);
        };
    }
}
