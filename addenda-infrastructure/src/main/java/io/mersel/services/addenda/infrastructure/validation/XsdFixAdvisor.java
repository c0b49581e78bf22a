package io.mersel.services.addenda.infrastructure.validation;

import io.mersel.services.addenda.application.models.ValidationIssue;

import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Propone una corrección por cada error de validación.
 * <p>
 * Nunca devuelve vacío para un error: si el mensaje no encaja en ningún caso conocido
 * se sugiere {@link #GENERIC_SUGGESTION}.
 */
final class XsdFixAdvisor {

    static final String GENERIC_SUGGESTION = "Revisar la estructura del XML contra el esquema XSD";

    static final String DATE_SUGGESTION = "Corregir formato de fecha. Use formato ISO: YYYY-MM-DD (ej: 2025-07-20)";
    static final String DECIMAL_SUGGESTION = "Corregir formato numérico. Use formato decimal (ej: 1000.00)";
    static final String INTEGER_SUGGESTION = "Corregir formato de número entero (ej: 123)";
    static final String DATATYPE_SUGGESTION = "Verificar que el valor cumple con las restricciones del tipo de dato";
    static final String ORDER_SUGGESTION = "Verificar que todos los elementos estén en el orden correcto según el esquema";
    static final String NAMESPACE_SUGGESTION = "Verificar que los namespaces estén declarados correctamente";

    private XsdFixAdvisor() {}

    static List<String> suggest(List<ValidationIssue> errors) {
        return errors.stream().map(XsdFixAdvisor::suggest).toList();
    }

    static String suggest(ValidationIssue error) {
        Optional<XsdError> parsed = XsdErrorHumanizer.parse(error.message());
        if (parsed.isEmpty()) {
            return fromRawMessage(error.message());
        }
        XsdError e = parsed.get();
        return switch (e.code()) {
            case INCOMPLETE_CONTENT -> missingElement(e.expected());
            case UNEXPECTED_ELEMENT -> e.expected().isEmpty()
                    ? ORDER_SUGGESTION
                    : "Verificar el orden de los elementos: se encontró <" + e.subject()
                      + "> donde se esperaba " + tags(e.expected());
            case NO_CHILD_EXPECTED -> "Eliminar el elemento <" + e.subject()
                    + "> o moverlo a la posición que indica el esquema";
            case INVALID_DATATYPE -> forDatatype(e.detail());
            case INVALID_VALUE, TOO_SHORT, TOO_LONG -> DATATYPE_SUGGESTION;
            case ENUMERATION -> "Usar uno de los valores permitidos: " + String.join(", ", e.expected());
            case PATTERN -> "Ajustar el valor \"" + e.value() + "\" al patrón " + e.detail();
            case TEXT_ONLY -> "Quitar los elementos hijos de <" + e.subject() + ">";
            case NO_TEXT_ALLOWED -> "Quitar el texto directo de <" + e.subject() + ">";
            case ATTRIBUTE_NOT_ALLOWED -> "Eliminar el atributo \"" + e.subject() + "\" de <" + e.detail() + ">";
            case ATTRIBUTE_REQUIRED -> "Agregar el atributo obligatorio \"" + e.subject() + "\" en <" + e.detail() + ">";
            case UNDECLARED_ELEMENT -> NAMESPACE_SUGGESTION;
        };
    }

    private static String missingElement(List<String> expected) {
        if (expected.isEmpty()) {
            return "Agregar elementos obligatorios que faltan según el esquema";
        }
        if (expected.size() == 1) {
            return "Agregar elemento obligatorio faltante: <" + expected.get(0) + ">";
        }
        return "Agregar uno de los elementos esperados: " + tags(expected);
    }

    private static String forDatatype(String xsdType) {
        return switch (xsdType.toLowerCase(Locale.ROOT)) {
            case "date", "datetime" -> DATE_SUGGESTION;
            case "decimal", "double", "float" -> DECIMAL_SUGGESTION;
            case "int", "integer", "long", "short", "positiveinteger", "nonnegativeinteger" -> INTEGER_SUGGESTION;
            default -> DATATYPE_SUGGESTION;
        };
    }

    /** Mensajes que no vienen de la validación de esquema (XML mal formado, tamaño). */
    private static String fromRawMessage(String message) {
        String lower = message == null ? "" : message.toLowerCase(Locale.ROOT);
        if (lower.contains("namespace")) {
            return NAMESPACE_SUGGESTION;
        }
        if (lower.contains("attribute") && (lower.contains("required") || lower.contains("missing"))) {
            return "Agregar atributos obligatorios que faltan";
        }
        return GENERIC_SUGGESTION;
    }

    private static String tags(List<String> names) {
        return names.stream().map(n -> "<" + n + ">").collect(Collectors.joining(", "));
    }
}
