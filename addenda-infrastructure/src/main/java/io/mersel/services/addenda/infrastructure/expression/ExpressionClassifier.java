package io.mersel.services.addenda.infrastructure.expression;

import io.mersel.services.addenda.application.enums.AggregateFunction;
import io.mersel.services.addenda.application.enums.ValueFormat;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Clasifica una expresión una sola vez en su variante.
 * <p>
 * Orden de decisión:
 * <ol>
 *   <li>{@code |} → formato sobre la parte izquierda</li>
 *   <li>{@code (} → función; se evalúa antes que la ruta porque {@code sum(a.b)} contiene ambos</li>
 *   <li>{@code .} → ruta</li>
 *   <li>resto → identificador</li>
 * </ol>
 */
public final class ExpressionClassifier {

    private static final Pattern FUNCTION = Pattern.compile("^(\\w+)\\s*\\(\\s*([^()]*?)\\s*\\)$");
    private static final Pattern IDENTIFIER = Pattern.compile("^[^\\s|().{}]+$");

    private ExpressionClassifier() {
    }

    public static Expression classify(String raw) {
        String source = raw == null ? "" : raw.strip();
        if (source.isEmpty()) {
            return new UnrecognizedExpression(source, "expresión vacía");
        }

        int pipe = source.indexOf('|');
        if (pipe >= 0) {
            return classifyFormatted(source, pipe);
        }
        return classifyPlain(source, source);
    }

    private static Expression classifyFormatted(String source, int pipe) {
        String left = source.substring(0, pipe).strip();
        String spec = source.substring(pipe + 1).strip();
        if (left.isEmpty() || spec.isEmpty()) {
            return new UnrecognizedExpression(source, "formato incompleto");
        }
        if (spec.indexOf('|') >= 0) {
            return new UnrecognizedExpression(source, "solo se admite un formato por expresión");
        }

        Expression base = classifyPlain(left, left);
        if (base instanceof UnrecognizedExpression) {
            return new UnrecognizedExpression(source, ((UnrecognizedExpression) base).reason());
        }

        String formatName = spec;
        String argument = null;
        int colon = spec.indexOf(':');
        if (colon >= 0) {
            formatName = spec.substring(0, colon).strip();
            argument = spec.substring(colon + 1);
        }
        ValueFormat format = ValueFormat.fromKeyword(formatName).orElse(null);
        return new FormattedExpression(source, base, format, formatName, argument);
    }

    private static Expression classifyPlain(String text, String source) {
        if (text.indexOf('(') >= 0 || text.indexOf(')') >= 0) {
            return classifyFunction(text, source);
        }
        if (text.indexOf('.') >= 0) {
            List<String> segments = splitPath(text);
            return segments.isEmpty()
                    ? new UnrecognizedExpression(source, "ruta con segmentos vacíos")
                    : new PathExpression(source, segments);
        }
        if (IDENTIFIER.matcher(text).matches()) {
            return new IdentifierExpression(source, text);
        }
        return new UnrecognizedExpression(source, "sintaxis no reconocida");
    }

    private static Expression classifyFunction(String text, String source) {
        Matcher m = FUNCTION.matcher(text);
        if (!m.matches()) {
            return new UnrecognizedExpression(source, "llamada a función mal formada");
        }
        var function = AggregateFunction.fromName(m.group(1));
        if (function.isEmpty()) {
            return new UnrecognizedExpression(source, "función desconocida: " + m.group(1));
        }
        String arg = m.group(2).strip();
        if (arg.isEmpty()) {
            return new FunctionExpression(source, function.get(), List.of());
        }
        List<String> segments = arg.indexOf('.') >= 0 ? splitPath(arg) : List.of(arg);
        if (segments.isEmpty() || !segments.stream().allMatch(s -> IDENTIFIER.matcher(s).matches())) {
            return new UnrecognizedExpression(source, "argumento inválido: " + arg);
        }
        return new FunctionExpression(source, function.get(), segments);
    }

    /**
     * Divide {@code a.b.c}; devuelve lista vacía si algún segmento queda vacío.
     */
    private static List<String> splitPath(String text) {
        String[] parts = text.split("\\.", -1);
        var segments = new ArrayList<String>(parts.length);
        for (String part : parts) {
            String segment = part.strip();
            if (segment.isEmpty()) {
                return List.of();
            }
            segments.add(segment);
        }
        return segments;
    }
}
