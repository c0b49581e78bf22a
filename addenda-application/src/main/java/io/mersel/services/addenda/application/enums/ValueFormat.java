package io.mersel.services.addenda.application.enums;

import java.util.Locale;
import java.util.Optional;

/**
 * Formatos aplicables con la sintaxis {@code variable | formato[:argumento]}.
 */
public enum ValueFormat {
    UPPERCASE("uppercase"),
    LOWERCASE("lowercase"),
    TITLE("title"),
    /** Argumento: patrón strftime, por defecto {@code %Y-%m-%d}. */
    DATE("date"),
    /** Argumento: número de decimales, por defecto 2. */
    NUMBER("number"),
    /** Argumento: símbolo de moneda, por defecto {@code $}. */
    CURRENCY("currency");

    private final String keyword;

    ValueFormat(String keyword) {
        this.keyword = keyword;
    }

    public String keyword() {
        return keyword;
    }

    /**
     * Busca el formato por su palabra clave, sin distinguir mayúsculas.
     */
    public static Optional<ValueFormat> fromKeyword(String keyword) {
        if (keyword == null) {
            return Optional.empty();
        }
        String normalized = keyword.strip().toLowerCase(Locale.ROOT);
        for (ValueFormat format : values()) {
            if (format.keyword.equals(normalized)) {
                return Optional.of(format);
            }
        }
        return Optional.empty();
    }
}
