package com.phonepe.honeypotai.core.utils;

import com.google.common.base.Strings;
import lombok.experimental.UtilityClass;

import java.util.Objects;

/**
 * Loads variables from environment
 */
@UtilityClass
public class EnvLoader {
    /**
     * Reads a mandatory environment variable
     * @param variable the name of the variable
     * @return the value of the variable
     */
    public static String readEnv(final String variable) {
        return Objects.requireNonNull(System.getenv(variable),
                                      "Please set environment variable: %s".formatted(variable));
    }

    /**
     * Reads an optional environment variable
     * @param variable the name of the variable
     * @param defaultValue value returned when the variable is missing or blank
     * @return the value of the variable or the default
     */
    public static String readEnv(final String variable, final String defaultValue) {
        final var value = System.getenv(variable);
        return Strings.isNullOrEmpty(value) || value.isBlank() ? defaultValue : value.trim();
    }
}
