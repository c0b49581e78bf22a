package io.mersel.services.addenda.application.enums;

/**
 * Política ante expresiones que no pueden resolverse contra el contexto de variables.
 * <ul>
 *   <li>{@link #LENIENT}: la expresión se sustituye por cadena vacía (comportamiento histórico)</li>
 *   <li>{@link #STRICT}: se lanza {@code UnresolvedVariableException}</li>
 * </ul>
 */
public enum ResolutionMode {
    LENIENT,
    STRICT
}
