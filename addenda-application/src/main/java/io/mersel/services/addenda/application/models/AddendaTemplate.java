package io.mersel.services.addenda.application.models;

/**
 * Plantilla XML con expresiones {@code {{ expr }}}. Pertenece a exactamente un tipo de addenda.
 *
 * @param name            nombre de la plantilla
 * @param addendaTypeName tipo de addenda al que pertenece
 * @param templateXml     texto de la plantilla
 * @param defaultTemplate si es la plantilla por defecto de su tipo (como máximo una por tipo)
 */
public record AddendaTemplate(
        String name,
        String addendaTypeName,
        String templateXml,
        boolean defaultTemplate
) {
}
