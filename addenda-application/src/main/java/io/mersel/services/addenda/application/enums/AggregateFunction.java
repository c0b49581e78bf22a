package io.mersel.services.addenda.application.enums;

import java.util.Locale;
import java.util.Optional;

/**
 * Funciones de agregación disponibles en expresiones {@code nombre(ruta)}.
 */
public enum AggregateFunction {
    SUM,
    COUNT,
    AVG,
    MAX,
    MIN,
    FIRST,
    LAST;

    /** Las funciones numéricas ignoran los valores que no son números. */
    public boolean isNumeric() {
        return this == SUM || this == AVG || this == MAX || this == MIN;
    }

    public static Optional<AggregateFunction> fromName(String name) {
        if (name == null || name.isBlank()) {
            return Optional.empty();
        }
        try {
            return Optional.of(valueOf(name.strip().toUpperCase(Locale.ROOT)));
        } catch (IllegalArgumentException e) {
            return Optional.empty();
        }
    }
}
