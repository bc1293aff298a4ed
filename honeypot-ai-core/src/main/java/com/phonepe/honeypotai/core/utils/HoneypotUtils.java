package com.phonepe.honeypotai.core.utils;

import lombok.experimental.UtilityClass;

import java.util.List;

/**
 * Small helpers shared across components
 */
@UtilityClass
public class HoneypotUtils {

    public static Throwable rootCause(final Throwable throwable) {
        var cause = throwable;
        while (cause.getCause() != null && cause.getCause() != cause) {
            cause = cause.getCause();
        }
        return cause;
    }

    /**
     * Last {@code count} elements of a list, or the whole list if it is shorter
     */
    public static <T> List<T> lastN(final List<T> items, int count) {
        if (items == null || items.isEmpty()) {
            return List.of();
        }
        return List.copyOf(items.subList(Math.max(0, items.size() - count), items.size()));
    }
}
