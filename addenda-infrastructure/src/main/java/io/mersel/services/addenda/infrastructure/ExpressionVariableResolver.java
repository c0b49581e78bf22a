package io.mersel.services.addenda.infrastructure;

import io.mersel.services.addenda.application.enums.ResolutionMode;
import io.mersel.services.addenda.application.interfaces.IVariableResolver;
import io.mersel.services.addenda.application.interfaces.UnresolvedVariableException;
import io.mersel.services.addenda.application.models.VariableContext;
import io.mersel.services.addenda.infrastructure.config.AddendaProperties;
import io.mersel.services.addenda.infrastructure.expression.Aggregates;
import io.mersel.services.addenda.infrastructure.expression.Expression;
import io.mersel.services.addenda.infrastructure.expression.ExpressionClassifier;
import io.mersel.services.addenda.infrastructure.expression.FormattedExpression;
import io.mersel.services.addenda.infrastructure.expression.FunctionExpression;
import io.mersel.services.addenda.infrastructure.expression.IdentifierExpression;
import io.mersel.services.addenda.infrastructure.expression.PathExpression;
import io.mersel.services.addenda.infrastructure.expression.UnrecognizedExpression;
import io.mersel.services.addenda.infrastructure.expression.ValueFormatter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Resolución de expresiones {@code {{ }}} contra un {@link VariableContext}.
 * <p>
 * La expresión se clasifica una vez ({@link ExpressionClassifier}) y se evalúa según su
 * variante. En modo {@code LENIENT} cualquier valor ausente, ruta rota o expresión no
 * reconocida produce cadena vacía; en modo {@code STRICT} se lanza
 * {@link UnresolvedVariableException}.
 * <p>
 * Sin estado mutable: una instancia se puede compartir entre hilos.
 */
@Service
public class ExpressionVariableResolver implements IVariableResolver {

    private static final Logger log = LoggerFactory.getLogger(ExpressionVariableResolver.class);

    private final ResolutionMode mode;

    @Autowired
    public ExpressionVariableResolver(AddendaProperties properties) {
        this(properties.getResolution().getMode());
    }

    public ExpressionVariableResolver(ResolutionMode mode) {
        this.mode = mode != null ? mode : ResolutionMode.LENIENT;
    }

    @Override
    public ResolutionMode getMode() {
        return mode;
    }

    @Override
    public String resolve(String expression, VariableContext context) throws UnresolvedVariableException {
        Expression parsed = ExpressionClassifier.classify(expression);
        VariableContext variables = context != null ? context : VariableContext.empty();
        Optional<String> value = evaluate(parsed, variables);
        if (value.isPresent()) {
            return value.get();
        }
        return unresolved(parsed);
    }

    private Optional<String> evaluate(Expression expression, VariableContext context) {
        return switch (expression.kind()) {
            case IDENTIFIER -> lookupScalar(context, ((IdentifierExpression) expression).name());
            case PATH -> walkPath(context, (PathExpression) expression);
            case FUNCTION -> aggregate(context, (FunctionExpression) expression);
            case FORMATTED -> applyFormat(context, (FormattedExpression) expression);
            case UNRECOGNIZED -> Optional.empty();
        };
    }

    private Optional<String> applyFormat(VariableContext context, FormattedExpression expression) {
        Optional<Object> raw = rawValue(expression.base(), context);
        if (raw.isEmpty()) {
            return Optional.empty();
        }
        if (!expression.isKnownFormat()) {
            log.debug("Formato desconocido '{}' en '{}', se usa el valor sin formato",
                    expression.formatName(), expression.source());
            return Optional.of(ValueFormatter.toText(raw.get()));
        }
        return Optional.of(ValueFormatter.format(raw.get(), expression.format(), expression.argument()));
    }

    /**
     * Valor sin convertir a texto, para que los formatos de número y fecha trabajen sobre el original.
     */
    private Optional<Object> rawValue(Expression expression, VariableContext context) {
        return switch (expression.kind()) {
            case IDENTIFIER -> scalar(context.lookup(((IdentifierExpression) expression).name()).orElse(null));
            case PATH -> scalar(walk(context, (PathExpression) expression));
            case FUNCTION -> aggregate(context, (FunctionExpression) expression).<Object>map(v -> v);
            default -> Optional.empty();
        };
    }

    private Optional<String> lookupScalar(VariableContext context, String name) {
        return scalar(context.lookup(name).orElse(null)).map(ValueFormatter::toText);
    }

    private Optional<String> walkPath(VariableContext context, PathExpression expression) {
        return scalar(walk(context, expression)).map(ValueFormatter::toText);
    }

    /**
     * Recorre mapas por clave y listas por índice. Una clave literal con puntos
     * presente en el contexto tiene prioridad sobre el recorrido.
     */
    private Object walk(VariableContext context, PathExpression expression) {
        Optional<Object> literal = context.lookup(expression.source());
        if (literal.isPresent()) {
            return literal.get();
        }
        Object current = context.lookup(expression.root()).orElse(null);
        List<String> segments = expression.segments();
        for (int i = 1; i < segments.size() && current != null; i++) {
            current = step(current, segments.get(i));
        }
        return current;
    }

    private static Object step(Object current, String segment) {
        if (current instanceof Map) {
            return ((Map<?, ?>) current).get(segment);
        }
        if (current instanceof List) {
            List<?> list = (List<?>) current;
            Integer index = parseIndex(segment);
            if (index == null || index >= list.size()) {
                return null;
            }
            return list.get(index);
        }
        return null;
    }

    private Optional<String> aggregate(VariableContext context, FunctionExpression expression) {
        if (!expression.hasArgument()) {
            return Optional.of(Aggregates.apply(expression.function(), List.of()));
        }
        List<String> argument = expression.argument();
        // Raíz ausente equivale a lista vacía: sum/count dan 0 y first/last cadena vacía.
        var values = new ArrayList<Object>();
        context.lookup(argument.get(0)).ifPresent(root -> collect(root, argument, 1, values));
        return Optional.of(Aggregates.apply(expression.function(), values));
    }

    /**
     * Reúne los valores alcanzados por la ruta. Un segmento no numérico sobre una lista se
     * aplica a cada elemento, de modo que {@code conceptos.importe} produce un valor por concepto.
     */
    private static void collect(Object current, List<String> segments, int index, List<Object> out) {
        if (current == null) {
            return;
        }
        if (index == segments.size()) {
            if (current instanceof List) {
                for (Object item : (List<?>) current) {
                    if (item != null) {
                        out.add(item);
                    }
                }
            } else if (!(current instanceof CharSequence) || ((CharSequence) current).length() > 0) {
                out.add(current);
            }
            return;
        }
        String segment = segments.get(index);
        if (current instanceof Map) {
            collect(((Map<?, ?>) current).get(segment), segments, index + 1, out);
        } else if (current instanceof List) {
            List<?> list = (List<?>) current;
            Integer position = parseIndex(segment);
            if (position != null) {
                if (position < list.size()) {
                    collect(list.get(position), segments, index + 1, out);
                }
            } else {
                for (Object item : list) {
                    collect(item, segments, index, out);
                }
            }
        }
    }

    /** Solo valores escalares; mapas y listas cuentan como ausentes. */
    private static Optional<Object> scalar(Object value) {
        if (value == null || value instanceof Map || value instanceof List) {
            return Optional.empty();
        }
        return Optional.of(value);
    }

    private static Integer parseIndex(String segment) {
        if (segment.isEmpty() || !segment.chars().allMatch(Character::isDigit) || segment.length() > 9) {
            return null;
        }
        return Integer.parseInt(segment);
    }

    private String unresolved(Expression expression) throws UnresolvedVariableException {
        String reason = expression instanceof UnrecognizedExpression
                ? ((UnrecognizedExpression) expression).reason()
                : "sin valor en el contexto";
        if (mode == ResolutionMode.STRICT) {
            throw new UnresolvedVariableException(expression.source(), reason);
        }
        log.debug("Expresión '{}' sin resolver ({}), se sustituye por cadena vacía", expression.source(), reason);
        return "";
    }
}
