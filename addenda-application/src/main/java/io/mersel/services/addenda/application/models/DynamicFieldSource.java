package io.mersel.services.addenda.application.models;

/**
 * Origen de un valor dinámico: objeto fuente (p. ej. "Sales Invoice", "Customer", "CFDI")
 * y atributo a leer de él. La lectura real la hace el llamador mediante
 * {@code DynamicValueLookup}.
 */
public record DynamicFieldSource(
        String sourceName,
        String fieldName
) {
}
