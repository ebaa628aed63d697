package com.taskpilot.orchestrator.api;

import java.util.Locale;
import java.util.Map;
import java.util.UUID;

/**
 * Typed access to a request's params. Missing or malformed values raise
 * IllegalArgumentException, which the dispatcher reports as INVALID_PARAMS.
 */
public final class RequestParams {

    private final Map<String, Object> values;

    public RequestParams(Map<String, Object> values) {
        this.values = values == null ? Map.of() : values;
    }

    public String requireString(String name) {
        String value = optString(name);
        if (value == null) {
            throw new IllegalArgumentException("Missing required parameter: " + name);
        }
        return value;
    }

    /** Null when absent or blank. */
    public String optString(String name) {
        Object value = values.get(name);
        if (value == null) return null;
        String s = value.toString();
        return s.isBlank() ? null : s;
    }

    /** Raw string, blank kept; null only when absent. */
    public String rawString(String name) {
        Object value = values.get(name);
        return value == null ? null : value.toString();
    }

    public UUID requireUuid(String name) {
        String value = requireString(name);
        try {
            return UUID.fromString(value.strip());
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Parameter " + name + " is not a valid id: " + value);
        }
    }

    public int optInt(String name, int defaultValue) {
        Object value = values.get(name);
        if (value == null) return defaultValue;
        if (value instanceof Number n) return n.intValue();
        try {
            return Integer.parseInt(value.toString().strip());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Parameter " + name + " must be an integer: " + value);
        }
    }

    public <E extends Enum<E>> E requireEnum(String name, Class<E> type) {
        return parseEnum(name, requireString(name), type);
    }

    public <E extends Enum<E>> E optEnum(String name, Class<E> type) {
        String value = optString(name);
        return value == null ? null : parseEnum(name, value, type);
    }

    private static <E extends Enum<E>> E parseEnum(String name, String value, Class<E> type) {
        try {
            return Enum.valueOf(type, value.strip().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Invalid " + name + ": " + value);
        }
    }
}
