package io.quiby.util;

import org.jspecify.annotations.Nullable;

public final class Assert {

    private Assert() {
    }

    /**
     * Checks that the given parameter is not {@code null}.
     *
     * @param name the parameter name, used in the exception message
     * @param value the parameter value
     * @param <T> the value type
     * @return the value, for chaining in assignments
     * @throws IllegalArgumentException if the value is {@code null}
     */
    public static <T> T checkNotNullParam(String name, @Nullable T value) {
        if (value == null) {
            throw new IllegalArgumentException("Parameter '" + name + "' may not be null");
        }
        return value;
    }
}
