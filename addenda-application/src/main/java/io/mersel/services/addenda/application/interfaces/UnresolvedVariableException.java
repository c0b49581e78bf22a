package io.mersel.services.addenda.application.interfaces;

/**
 * Expresión sin valor en el contexto. Solo se lanza en modo {@code STRICT}.
 */
public class UnresolvedVariableException extends AddendaProcessingException {

    private final String expression;

    public UnresolvedVariableException(String expression, String reason) {
        super("No se pudo resolver la expresión '" + expression + "': " + reason);
        this.expression = expression;
    }

    public String getExpression() {
        return expression;
    }
}
