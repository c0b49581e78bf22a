package io.mersel.services.addenda.application.interfaces;

/**
 * La plantilla, una vez sustituidas sus expresiones, no produjo XML bien formado.
 */
public class AddendaBuildException extends MalformedXmlException {

    public AddendaBuildException(String message, int lineNumber, int columnNumber, Throwable cause) {
        super(message, lineNumber, columnNumber, cause);
    }
}
