package io.mersel.services.addenda.application.models;

import java.util.List;

/**
 * Resultado de inspeccionar una plantilla sin renderizarla.
 *
 * @param expressions expresiones distintas en orden de aparición
 * @param warnings    advertencias (expresiones no reconocidas, variables sin valor de muestra, ...)
 */
public record TemplateInspection(List<String> expressions, List<String> warnings) {

    public TemplateInspection {
        expressions = expressions == null ? List.of() : List.copyOf(expressions);
        warnings = warnings == null ? List.of() : List.copyOf(warnings);
    }
}
