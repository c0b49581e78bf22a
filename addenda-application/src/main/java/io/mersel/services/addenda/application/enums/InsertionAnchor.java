package io.mersel.services.addenda.application.enums;

/**
 * Regla que determinó el punto de inserción del nodo {@code cfdi:Addenda}.
 * <p>
 * El orden refleja la secuencia de hijos exigida por el esquema CFDI 4.0:
 * la addenda va después de {@code Complemento}, o después de {@code Conceptos},
 * o al final del comprobante.
 */
public enum InsertionAnchor {
    AFTER_COMPLEMENTO,
    AFTER_CONCEPTOS,
    END_OF_ROOT
}
