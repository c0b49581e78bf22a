package io.mersel.services.addenda.infrastructure.validation;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Convierte los mensajes de validación de Xerces a un texto en español.
 * <p>
 * Los mensajes de Xerces traen URIs de namespace y códigos técnicos
 * (p. ej. {@code cvc-complex-type.2.4.b}). Esta clase:
 * <ul>
 *   <li>elimina los namespaces en notación Clark</li>
 *   <li>reconoce el código y extrae elemento, valor y lista de esperados</li>
 *   <li>redacta una explicación en español</li>
 * </ul>
 * Si el mensaje no coincide con ningún patrón conocido se devuelve sin namespaces.
 */
final class XsdErrorHumanizer {

    private XsdErrorHumanizer() {}

    // ── Limpieza de namespaces ──────────────────────────────────────

    /** {"namespace-uri":Nombre} y listas {"ns":A, "ns":B}. */
    private static final Pattern NS_QUOTED_PREFIX = Pattern.compile("\"[^\"]+\":");

    /**
     * {@code {"http://ejemplo/addenda":total}} → {@code total}.
     */
    static String stripNamespaces(String msg) {
        if (msg == null) return null;
        msg = NS_QUOTED_PREFIX.matcher(msg).replaceAll("");
        msg = msg.replace("{", "").replace("}", "");
        return msg.replaceAll("  +", " ");
    }

    // ── Patrones por código ─────────────────────────────────────────

    private static final Pattern CVC_2_4_A = Pattern.compile(
            "cvc-complex-type\\.2\\.4\\.a:\\s*Invalid content was found starting with element '([^']+)'\\." +
            "\\s*One of '([^']+)' is expected\\.");

    private static final Pattern CVC_2_4_B = Pattern.compile(
            "cvc-complex-type\\.2\\.4\\.b:\\s*The content of element '([^']+)' is not complete\\." +
            "\\s*One of '([^']+)' is expected\\.");

    private static final Pattern CVC_2_4_D = Pattern.compile(
            "cvc-complex-type\\.2\\.4\\.d:\\s*Invalid content was found starting with element '([^']+)'\\." +
            "\\s*No child element");

    private static final Pattern CVC_TYPE_3_1_3 = Pattern.compile(
            "cvc-type\\.3\\.1\\.3:\\s*The value '([^']*)' of element '([^']+)' is not valid\\.");

    private static final Pattern CVC_DATATYPE = Pattern.compile(
            "cvc-datatype-valid\\.1\\.2\\.1:\\s*'([^']*)' is not a valid value for '([^']+)'\\.");

    private static final Pattern CVC_ENUM = Pattern.compile(
            "cvc-enumeration-valid:\\s*Value '([^']*)' is not facet-valid with respect to enumeration '\\[([^\\]]*)\\]'");

    private static final Pattern CVC_PATTERN = Pattern.compile(
            "cvc-pattern-valid:\\s*Value '([^']*)' is not facet-valid with respect to pattern '(.+)' for type");

    private static final Pattern CVC_LENGTH = Pattern.compile(
            "cvc-(min|max)Length-valid:\\s*Value '([^']*)' with length = '(\\d+)' is not facet-valid " +
            "with respect to (?:min|max)Length '(\\d+)'");

    private static final Pattern CVC_2_2 = Pattern.compile(
            "cvc-complex-type\\.2\\.2:\\s*Element '([^']+)' must have no element \\[children\\]");

    private static final Pattern CVC_2_3 = Pattern.compile(
            "cvc-complex-type\\.2\\.3:\\s*Element '([^']+)' cannot have character");

    private static final Pattern CVC_ATTR_NOT_ALLOWED = Pattern.compile(
            "cvc-complex-type\\.3\\.2\\.2:\\s*Attribute '([^']+)' is not allowed to appear in element '([^']+)'\\.");

    private static final Pattern CVC_ATTR_REQUIRED = Pattern.compile(
            "cvc-complex-type\\.4:\\s*Attribute '([^']+)' must appear on element '([^']+)'\\.");

    private static final Pattern CVC_ELT_1 = Pattern.compile(
            "cvc-elt\\.1(?:\\.a)?:\\s*Cannot find the declaration of element '([^']+)'\\.");

    // ── Análisis ────────────────────────────────────────────────────

    /**
     * Descompone un mensaje de Xerces; vacío si el código no es conocido.
     */
    static Optional<XsdError> parse(String rawMsg) {
        if (rawMsg == null || rawMsg.isBlank()) {
            return Optional.empty();
        }
        String msg = stripNamespaces(rawMsg);
        Matcher m;

        m = CVC_2_4_A.matcher(msg);
        if (m.find()) {
            return Optional.of(new XsdError(XsdErrorCode.UNEXPECTED_ELEMENT,
                    clean(m.group(1)), null, parseList(m.group(2)), null));
        }
        m = CVC_2_4_B.matcher(msg);
        if (m.find()) {
            return Optional.of(new XsdError(XsdErrorCode.INCOMPLETE_CONTENT,
                    clean(m.group(1)), null, parseList(m.group(2)), null));
        }
        m = CVC_2_4_D.matcher(msg);
        if (m.find()) {
            return Optional.of(new XsdError(XsdErrorCode.NO_CHILD_EXPECTED, clean(m.group(1)), null, null, null));
        }
        m = CVC_TYPE_3_1_3.matcher(msg);
        if (m.find()) {
            return Optional.of(new XsdError(XsdErrorCode.INVALID_VALUE, clean(m.group(2)), m.group(1), null, null));
        }
        m = CVC_DATATYPE.matcher(msg);
        if (m.find()) {
            return Optional.of(new XsdError(XsdErrorCode.INVALID_DATATYPE, null, m.group(1), null, m.group(2)));
        }
        m = CVC_ENUM.matcher(msg);
        if (m.find()) {
            return Optional.of(new XsdError(XsdErrorCode.ENUMERATION, null, m.group(1),
                    parseList(m.group(2)), null));
        }
        m = CVC_PATTERN.matcher(msg);
        if (m.find()) {
            return Optional.of(new XsdError(XsdErrorCode.PATTERN, null, m.group(1), null, m.group(2)));
        }
        m = CVC_LENGTH.matcher(msg);
        if (m.find()) {
            XsdErrorCode code = "min".equals(m.group(1)) ? XsdErrorCode.TOO_SHORT : XsdErrorCode.TOO_LONG;
            return Optional.of(new XsdError(code, m.group(3), m.group(2), null, m.group(4)));
        }
        m = CVC_2_2.matcher(msg);
        if (m.find()) {
            return Optional.of(new XsdError(XsdErrorCode.TEXT_ONLY, clean(m.group(1)), null, null, null));
        }
        m = CVC_2_3.matcher(msg);
        if (m.find()) {
            return Optional.of(new XsdError(XsdErrorCode.NO_TEXT_ALLOWED, clean(m.group(1)), null, null, null));
        }
        m = CVC_ATTR_NOT_ALLOWED.matcher(msg);
        if (m.find()) {
            return Optional.of(new XsdError(XsdErrorCode.ATTRIBUTE_NOT_ALLOWED,
                    m.group(1), null, null, clean(m.group(2))));
        }
        m = CVC_ATTR_REQUIRED.matcher(msg);
        if (m.find()) {
            return Optional.of(new XsdError(XsdErrorCode.ATTRIBUTE_REQUIRED,
                    m.group(1), null, null, clean(m.group(2))));
        }
        m = CVC_ELT_1.matcher(msg);
        if (m.find()) {
            return Optional.of(new XsdError(XsdErrorCode.UNDECLARED_ELEMENT, clean(m.group(1)), null, null, null));
        }
        return Optional.empty();
    }

    /**
     * Mensaje en español para el usuario, sin posición (la agrega el reporte).
     */
    static String humanize(String rawMsg) {
        if (rawMsg == null || rawMsg.isBlank()) {
            return rawMsg;
        }
        return parse(rawMsg).map(XsdErrorHumanizer::describe).orElseGet(() -> stripNamespaces(rawMsg));
    }

    private static String describe(XsdError e) {
        return switch (e.code()) {
            case UNEXPECTED_ELEMENT -> "El elemento \"" + e.subject() + "\" no es válido en esta posición."
                    + expectedSuffix(" Se esperaba: ", e.expected());
            case INCOMPLETE_CONTENT -> "El contenido del elemento \"" + e.subject() + "\" está incompleto."
                    + expectedSuffix(" Elemento(s) obligatorio(s) faltante(s): ", e.expected());
            case NO_CHILD_EXPECTED -> "El elemento \"" + e.subject()
                    + "\" no se esperaba: no se admiten más elementos en esta posición.";
            case INVALID_VALUE -> e.value().isEmpty()
                    ? "El valor del elemento \"" + e.subject() + "\" no puede estar vacío."
                    : "El valor del elemento \"" + e.subject() + "\" no es válido: \"" + truncate(e.value(), 50) + "\".";
            case INVALID_DATATYPE -> "El valor \"" + truncate(e.value(), 50) + "\" no corresponde al tipo "
                    + friendlyTypeName(e.detail()) + ".";
            case ENUMERATION -> "El valor \"" + e.value() + "\" no está permitido. Valores permitidos: "
                    + String.join(", ", e.expected()) + ".";
            case PATTERN -> "El valor \"" + truncate(e.value(), 50) + "\" no cumple el patrón " + e.detail() + ".";
            case TOO_SHORT -> "El valor es demasiado corto (longitud: " + e.subject() + ", mínimo: "
                    + e.detail() + "): \"" + truncate(e.value(), 40) + "\".";
            case TOO_LONG -> "El valor es demasiado largo (longitud: " + e.subject() + ", máximo: "
                    + e.detail() + "): \"" + truncate(e.value(), 40) + "\".";
            case TEXT_ONLY -> "El elemento \"" + e.subject() + "\" no admite elementos hijos, solo texto.";
            case NO_TEXT_ALLOWED -> "El elemento \"" + e.subject()
                    + "\" no admite texto directo; el contenido debe ir en elementos hijos.";
            case ATTRIBUTE_NOT_ALLOWED -> "El atributo \"" + e.subject() + "\" no está permitido en el elemento \""
                    + e.detail() + "\".";
            case ATTRIBUTE_REQUIRED -> "Falta el atributo obligatorio \"" + e.subject() + "\" en el elemento \""
                    + e.detail() + "\".";
            case UNDECLARED_ELEMENT -> "El elemento \"" + e.subject()
                    + "\" no está declarado en el esquema (revise el namespace).";
        };
    }

    // ── Auxiliares ──────────────────────────────────────────────────

    /**
     * {@code "ns:Elemento"} → {@code "Elemento"}, sin comillas.
     */
    static String clean(String s) {
        if (s == null) return "";
        s = NS_QUOTED_PREFIX.matcher(s).replaceAll("");
        s = s.replace("{", "").replace("}", "");
        int colon = s.lastIndexOf(':');
        if (colon >= 0) s = s.substring(colon + 1);
        return s.replace("\"", "").replace("'", "").trim();
    }

    /**
     * {@code "'ns:A', 'ns:B'"} → {@code [A, B]}.
     */
    static List<String> parseList(String raw) {
        if (raw == null || raw.isBlank()) return List.of();
        var result = new ArrayList<String>();
        for (String part : raw.split(",")) {
            String cleaned = clean(part.trim());
            if (!cleaned.isBlank()) {
                result.add(cleaned);
            }
        }
        return result;
    }

    private static String expectedSuffix(String label, List<String> expected) {
        if (expected.isEmpty()) return "";
        return label + formatList(expected) + ".";
    }

    /** Más de tres elementos: los tres primeros y "y N más". */
    private static String formatList(List<String> items) {
        if (items.size() <= 3) {
            return String.join(", ", items);
        }
        return items.get(0) + ", " + items.get(1) + ", " + items.get(2)
                + " y " + (items.size() - 3) + " más";
    }

    static String friendlyTypeName(String xsdType) {
        if (xsdType == null || xsdType.isBlank()) return "esperado";
        return switch (xsdType.toLowerCase(Locale.ROOT)) {
            case "date" -> "fecha (AAAA-MM-DD)";
            case "datetime" -> "fecha-hora (AAAA-MM-DDThh:mm:ss)";
            case "decimal" -> "decimal";
            case "integer", "int", "long", "short" -> "entero";
            case "positiveinteger" -> "entero positivo";
            case "nonnegativeinteger" -> "entero no negativo";
            case "boolean" -> "booleano (true/false)";
            case "anyuri" -> "URI";
            case "time" -> "hora (hh:mm:ss)";
            case "gyear" -> "año (AAAA)";
            case "gyearmonth" -> "año-mes (AAAA-MM)";
            default -> "\"" + xsdType + "\"";
        };
    }

    private static String truncate(String s, int max) {
        if (s == null) return "";
        if (s.length() <= max) return s;
        return s.substring(0, max) + "…";
    }
}
