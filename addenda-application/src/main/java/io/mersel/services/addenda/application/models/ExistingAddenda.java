package io.mersel.services.addenda.application.models;

import java.util.Map;

/**
 * Hijo directo de un {@code cfdi:Addenda} ya presente en el comprobante.
 *
 * @param tag        nombre local del elemento
 * @param namespace  namespace del elemento; {@code null} si no tiene
 * @param attributes atributos del elemento
 * @param text       contenido de texto recortado
 * @param xml        serialización del elemento
 */
public record ExistingAddenda(
        String tag,
        String namespace,
        Map<String, String> attributes,
        String text,
        String xml
) {

    public ExistingAddenda {
        attributes = attributes == null ? Map.of() : Map.copyOf(attributes);
    }
}
