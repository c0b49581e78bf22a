package io.mersel.services.addenda.application.interfaces;

import java.util.List;

/**
 * Definición de addenda inválida: tipo, plantilla o valores de campo que no
 * respetan sus reglas (versión, nombres duplicados, campos obligatorios, etc.).
 */
public class InvalidAddendaDefinitionException extends AddendaProcessingException {

    private final List<String> violations;

    public InvalidAddendaDefinitionException(String message) {
        this(message, List.of(message));
    }

    public InvalidAddendaDefinitionException(String message, List<String> violations) {
        super(message);
        this.violations = List.copyOf(violations);
    }

    public List<String> getViolations() {
        return violations;
    }
}
