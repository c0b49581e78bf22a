package io.mersel.services.addenda.application.interfaces;

import io.mersel.services.addenda.application.models.VariableContext;

import java.util.List;

/**
 * Renderiza plantillas de addenda con marcadores {@code {{ expr }}}.
 */
public interface ITemplateRenderer {

    /**
     * Sustituye cada marcador por su valor escapado para XML.
     *
     * @return XML renderizado; cadena vacía para una plantilla vacía
     * @throws AddendaBuildException       si el resultado no es XML bien formado
     * @throws UnresolvedVariableException en modo estricto, ante una expresión sin valor
     * @throws InputTooLargeException      si la plantilla excede el tamaño máximo
     */
    String render(String template, VariableContext context) throws AddendaProcessingException;

    /**
     * Igual que {@link #render(String, VariableContext)} y además declara {@code namespaceUri}
     * como namespace por defecto del elemento raíz. Un namespace nulo o vacío se ignora.
     */
    String render(String template, VariableContext context, String namespaceUri)
            throws AddendaProcessingException;

    /** Constructor fluido sobre la misma plantilla y contexto. */
    IAddendaXmlBuilder builder(String template, VariableContext context);

    /** Expresiones distintas de la plantilla, en orden de aparición. */
    List<String> extractExpressions(String template);
}
