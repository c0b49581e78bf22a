package io.mersel.services.addenda.application.models;

/**
 * Hallazgo de una validación XSD.
 *
 * @param line            línea (1-based); {@code -1} si el validador no la reporta
 * @param column          columna (1-based); {@code -1} si el validador no la reporta
 * @param message         mensaje crudo del validador
 * @param friendlyMessage mensaje en español, legible para el usuario
 */
public record ValidationIssue(
        int line,
        int column,
        String message,
        String friendlyMessage
) {

    public boolean hasLocation() {
        return line > 0;
    }

    /** {@code "Línea 3, columna 7: mensaje"} o solo el mensaje si no hay posición. */
    public String describe() {
        String text = friendlyMessage != null ? friendlyMessage : message;
        if (!hasLocation()) {
            return text;
        }
        return column > 0
                ? "Línea " + line + ", columna " + column + ": " + text
                : "Línea " + line + ": " + text;
    }
}
