package io.mersel.services.addenda.application.interfaces;

/**
 * El esquema XSD no pudo compilarse.
 * <p>
 * No existe un validador "roto": si la compilación falla, el llamador recibe
 * esta excepción y nunca una instancia de validador.
 */
public class SchemaCompilationException extends AddendaProcessingException {

    public SchemaCompilationException(String message, Throwable cause) {
        super(message, cause);
    }
}
