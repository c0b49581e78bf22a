package io.mersel.services.addenda.application.models;

import java.util.List;
import java.util.Optional;

/**
 * Tipo de addenda: namespace, esquema XSD y campos que la componen.
 * <p>
 * Es inmutable; una renderización siempre trabaja con una foto fija del tipo.
 *
 * @param name      nombre del tipo (p. ej. "Walmart", "Soriana")
 * @param version   versión en formato {@code x.y} o {@code x.y.z}
 * @param namespace namespace que se declara en la raíz de la addenda; opcional
 * @param xsdSchema texto del esquema XSD; opcional
 * @param fields    definiciones de campos en orden
 */
public record AddendaType(
        String name,
        String version,
        String namespace,
        String xsdSchema,
        List<FieldDefinition> fields
) {

    public AddendaType {
        fields = fields == null ? List.of() : List.copyOf(fields);
    }

    public boolean hasNamespace() {
        return namespace != null && !namespace.isBlank();
    }

    public boolean hasSchema() {
        return xsdSchema != null && !xsdSchema.isBlank();
    }

    public List<FieldDefinition> mandatoryFields() {
        return fields.stream().filter(FieldDefinition::mandatory).toList();
    }

    public Optional<FieldDefinition> findField(String fieldName) {
        return fields.stream().filter(f -> f.name().equals(fieldName)).findFirst();
    }
}
