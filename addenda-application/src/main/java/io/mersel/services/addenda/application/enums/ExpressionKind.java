package io.mersel.services.addenda.application.enums;

/**
 * Forma sintáctica de una expresión {@code {{ ... }}} de plantilla.
 * <p>
 * La expresión se clasifica una sola vez y luego se despacha por tipo.
 */
public enum ExpressionKind {
    /** {@code cfdi_total} */
    IDENTIFIER,
    /** {@code cfdi_total | currency:$} */
    FORMATTED,
    /** {@code conceptos.0.descripcion} */
    PATH,
    /** {@code sum(conceptos.importe)} */
    FUNCTION,
    /** Cualquier otra forma. */
    UNRECOGNIZED
}
