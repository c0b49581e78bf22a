package io.mersel.services.addenda.application.interfaces;

import io.mersel.services.addenda.application.enums.ResolutionMode;
import io.mersel.services.addenda.application.models.VariableContext;

/**
 * Evalúa una expresión de plantilla contra un contexto de variables.
 * <p>
 * Gramática soportada:
 * <ul>
 *   <li>{@code nombre}: búsqueda directa</li>
 *   <li>{@code nombre | formato[:arg]}: {@code uppercase}, {@code lowercase}, {@code title},
 *       {@code date}, {@code number}, {@code currency}</li>
 *   <li>{@code a.b.0.c}: ruta sobre mapas y listas</li>
 *   <li>{@code funcion(ruta)}: {@code sum}, {@code count}, {@code avg}, {@code max},
 *       {@code min}, {@code first}, {@code last}</li>
 * </ul>
 */
public interface IVariableResolver {

    /**
     * Resuelve la expresión.
     *
     * @param expression texto dentro de {@code {{ }}}, sin las llaves
     * @param context    contexto de variables
     * @return valor resuelto; cadena vacía si no hay valor y el modo es {@code LENIENT}
     * @throws UnresolvedVariableException solo en modo {@code STRICT}
     */
    String resolve(String expression, VariableContext context) throws UnresolvedVariableException;

    ResolutionMode getMode();
}
