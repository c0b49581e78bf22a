package io.mersel.services.addenda.application.interfaces;

/**
 * XML mal formado (CFDI, fragmento de addenda o salida renderizada).
 * <p>
 * El mensaje conserva el texto original del parser; línea y columna son {@code -1}
 * cuando el parser no las reporta.
 */
public class MalformedXmlException extends AddendaProcessingException {

    private final int lineNumber;
    private final int columnNumber;

    public MalformedXmlException(String message, Throwable cause) {
        this(message, -1, -1, cause);
    }

    public MalformedXmlException(String message, int lineNumber, int columnNumber, Throwable cause) {
        super(message, cause);
        this.lineNumber = lineNumber;
        this.columnNumber = columnNumber;
    }

    public int getLineNumber() {
        return lineNumber;
    }

    public int getColumnNumber() {
        return columnNumber;
    }
}
