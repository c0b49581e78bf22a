package io.mersel.services.addenda.application.interfaces;

/**
 * El CFDI no cumple la estructura mínima requerida para recibir una addenda.
 */
public class CfdiStructureException extends AddendaProcessingException {

    public CfdiStructureException(String reason) {
        super(reason);
    }
}
