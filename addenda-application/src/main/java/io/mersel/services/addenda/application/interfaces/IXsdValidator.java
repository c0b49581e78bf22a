package io.mersel.services.addenda.application.interfaces;

import io.mersel.services.addenda.application.models.SchemaInfo;
import io.mersel.services.addenda.application.models.ValidationReport;

import java.util.List;

/**
 * Validador ligado a un esquema XSD ya compilado.
 * <p>
 * Las instancias son inmutables y seguras entre hilos. Un esquema inválido nunca produce
 * un validador: la fábrica lanza {@link SchemaCompilationException}.
 * Las violaciones de esquema no se lanzan; se devuelven como datos del reporte. Lo mismo
 * aplica a un XML mal formado o demasiado grande.
 */
public interface IXsdValidator {

    boolean validate(String xml);

    /** Errores y advertencias, sin sugerencias ni información de esquema. */
    ValidationReport validateWithDetails(String xml);

    SchemaInfo getSchemaInfo();

    /**
     * Sugerencias de corrección en español. Vacía si y solo si el XML es válido.
     */
    List<String> suggestFixes(String xml);

    ValidationReport createValidationReport(String xml, boolean includeSchemaInfo);

    /** Un reporte por documento, con {@code fileIndex} igual a su posición. */
    List<ValidationReport> validateMultipleFiles(List<String> xmlDocuments);
}
