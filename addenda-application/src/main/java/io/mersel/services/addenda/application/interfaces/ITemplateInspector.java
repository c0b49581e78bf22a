package io.mersel.services.addenda.application.interfaces;

import io.mersel.services.addenda.application.models.TemplateInspection;

/**
 * Inspección y vista previa de plantillas sin datos reales.
 */
public interface ITemplateInspector {

    TemplateInspection inspect(String template);

    /**
     * Renderiza con datos de muestra derivados de los nombres de variable y devuelve
     * el resultado con sangría.
     */
    String preview(String template, String namespaceUri) throws AddendaProcessingException;
}
