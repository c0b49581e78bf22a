package io.mersel.services.addenda.application.interfaces;

/**
 * Raíz de los errores del pipeline de addendas.
 * <p>
 * Las violaciones de esquema XSD no son excepciones: viajan como datos dentro de
 * {@code ValidationReport}.
 */
public class AddendaProcessingException extends Exception {

    public AddendaProcessingException(String message) {
        super(message);
    }

    public AddendaProcessingException(String message, Throwable cause) {
        super(message, cause);
    }
}
