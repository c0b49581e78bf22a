package io.mersel.services.addenda.application.interfaces;

import io.mersel.services.addenda.application.models.AddendaGenerationRequest;
import io.mersel.services.addenda.application.models.AddendaGenerationResult;

/**
 * Orquesta la generación completa de una addenda: contexto de variables, selección de
 * plantilla, render, validación XSD e inserción opcional en el CFDI.
 */
public interface IAddendaGenerationService {

    /**
     * @throws InvalidAddendaDefinitionException si el tipo, las plantillas o los valores de campo no son válidos
     * @throws CfdiStructureException            si se exige estructura válida y el CFDI no la tiene
     * @throws AddendaProcessingException        ante cualquier otro fallo de parseo o render
     */
    AddendaGenerationResult generate(AddendaGenerationRequest request) throws AddendaProcessingException;
}
