package io.mersel.services.addenda.application.interfaces;

import io.mersel.services.addenda.application.models.ValidationReport;

/**
 * Compila esquemas XSD y entrega validadores listos para usar.
 */
public interface IXsdValidatorFactory {

    /**
     * @throws SchemaCompilationException si el esquema está vacío, mal formado o es inválido
     */
    IXsdValidator create(String xsdSchema) throws SchemaCompilationException;

    /**
     * Validación puntual. Un esquema que no compila produce un reporte inválido con el
     * error de compilación, en lugar de una excepción.
     */
    ValidationReport validateAgainst(String xml, String xsdSchema);
}
