package io.mersel.services.addenda.application.models;

import io.mersel.services.addenda.application.enums.FieldTransformation;

/**
 * Valor configurado para un campo de addenda (configuración por cliente).
 *
 * @param fieldName      nombre del campo
 * @param value          valor fijo; ignorado si el campo es dinámico y la fuente responde
 * @param dynamicSource  origen dinámico; {@code null} para valores fijos
 * @param transformation transformación a aplicar sobre el valor resuelto
 * @param defaultValue   valor de respaldo cuando no hay valor fijo ni dinámico
 */
public record ConfiguredFieldValue(
        String fieldName,
        String value,
        DynamicFieldSource dynamicSource,
        FieldTransformation transformation,
        String defaultValue
) {

    public ConfiguredFieldValue {
        if (fieldName == null || fieldName.isBlank()) {
            throw new IllegalArgumentException("El nombre del campo es obligatorio");
        }
        if (transformation == null) {
            transformation = FieldTransformation.NONE;
        }
    }

    public static ConfiguredFieldValue fixed(String fieldName, String value) {
        return new ConfiguredFieldValue(fieldName, value, null, FieldTransformation.NONE, null);
    }

    public static ConfiguredFieldValue dynamic(String fieldName, String sourceName, String sourceField,
                                               FieldTransformation transformation, String defaultValue) {
        return new ConfiguredFieldValue(fieldName, null,
                new DynamicFieldSource(sourceName, sourceField), transformation, defaultValue);
    }

    public boolean isDynamic() {
        return dynamicSource != null
                && dynamicSource.sourceName() != null && !dynamicSource.sourceName().isBlank()
                && dynamicSource.fieldName() != null && !dynamicSource.fieldName().isBlank();
    }
}
