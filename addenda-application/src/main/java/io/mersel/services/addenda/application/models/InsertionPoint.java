package io.mersel.services.addenda.application.models;

import io.mersel.services.addenda.application.enums.InsertionAnchor;

/**
 * Posición donde debe quedar el elemento {@code cfdi:Addenda}.
 *
 * @param parentName nombre local del padre (normalmente {@code Comprobante})
 * @param index      posición entre los hijos elemento del padre
 * @param anchor     regla que determinó la posición
 */
public record InsertionPoint(String parentName, int index, InsertionAnchor anchor) {
}
