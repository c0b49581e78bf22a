package io.mersel.services.addenda.application.models;

import io.mersel.services.addenda.application.enums.FieldType;

/**
 * Definición de un campo de un tipo de addenda.
 *
 * @param name              nombre del campo, usado como clave en el contexto de variables
 * @param label             etiqueta legible para mensajes de error
 * @param type              tipo de dato esperado
 * @param mandatory         si el campo debe tener valor configurado
 * @param validationPattern expresión regular opcional que el valor debe cumplir
 */
public record FieldDefinition(
        String name,
        String label,
        FieldType type,
        boolean mandatory,
        String validationPattern
) {

    public FieldDefinition {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("El nombre del campo es obligatorio");
        }
        if (label == null || label.isBlank()) {
            label = name;
        }
        if (type == null) {
            type = FieldType.DATA;
        }
    }

    public static FieldDefinition of(String name, boolean mandatory) {
        return new FieldDefinition(name, name, FieldType.DATA, mandatory, null);
    }

    public boolean hasValidationPattern() {
        return validationPattern != null && !validationPattern.isBlank();
    }
}
