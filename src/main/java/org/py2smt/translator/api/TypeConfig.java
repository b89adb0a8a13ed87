package org.py2smt.translator.api;

import java.util.Objects;

/**
 * The sort labels written into every {@code define-fun}: one for all
 * parameters and one for the return value. No per-symbol typing exists.
 *
 * @param parameterType The SMT-LIB2 sort of every parameter, e.g. {@code Int}.
 * @param returnType The SMT-LIB2 sort of the return value.
 */
public record TypeConfig(String parameterType, String returnType) {

    /** {@code Int} for parameters and return value. */
    public static final TypeConfig DEFAULT = uniform("Int");

    public TypeConfig {
        Objects.requireNonNull(parameterType, "parameterType");
        Objects.requireNonNull(returnType, "returnType");
        if (parameterType.isBlank() || returnType.isBlank()) {
            throw new IllegalArgumentException("Sort labels must not be blank");
        }
    }

    /**
     * Uses the same sort for parameters and the return value, the way the
     * single global type label works.
     *
     * @param type The sort label.
     * @return A new configuration.
     */
    public static TypeConfig uniform(String type) {
        return new TypeConfig(type, type);
    }
}
