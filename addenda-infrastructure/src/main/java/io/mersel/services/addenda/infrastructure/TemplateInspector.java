package io.mersel.services.addenda.infrastructure;

import io.mersel.services.addenda.application.enums.ResolutionMode;
import io.mersel.services.addenda.application.interfaces.AddendaProcessingException;
import io.mersel.services.addenda.application.interfaces.ITemplateInspector;
import io.mersel.services.addenda.application.interfaces.ITemplateRenderer;
import io.mersel.services.addenda.application.models.TemplateInspection;
import io.mersel.services.addenda.application.models.VariableContext;
import io.mersel.services.addenda.infrastructure.config.AddendaProperties;
import io.mersel.services.addenda.infrastructure.diagnostics.AddendaMetrics;
import io.mersel.services.addenda.infrastructure.expression.Expression;
import io.mersel.services.addenda.infrastructure.expression.ExpressionClassifier;
import io.mersel.services.addenda.infrastructure.expression.FormattedExpression;
import io.mersel.services.addenda.infrastructure.expression.UnrecognizedExpression;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Inspección de plantillas y vista previa con datos de muestra.
 * <p>
 * La vista previa siempre resuelve en modo {@link ResolutionMode#LENIENT}: una expresión
 * sin dato de muestra queda vacía y se reporta como advertencia en {@link #inspect(String)}.
 */
@Service
public class TemplateInspector implements ITemplateInspector {

    private static final Pattern BLOCK_TAG = Pattern.compile("\\{%.*?%\\}", Pattern.DOTALL);

    private final ITemplateRenderer renderer;

    public TemplateInspector(AddendaProperties properties, AddendaMetrics metrics) {
        this.renderer = new XmlTemplateRenderer(
                new ExpressionVariableResolver(ResolutionMode.LENIENT), properties, metrics);
    }

    @Override
    public TemplateInspection inspect(String template) {
        List<String> expressions = renderer.extractExpressions(template);
        var warnings = new ArrayList<String>();

        if (expressions.isEmpty()) {
            warnings.add("La plantilla no contiene variables dinámicas");
        }
        if (template != null && BLOCK_TAG.matcher(template).find()) {
            warnings.add("Los bloques {% ... %} no se interpretan y se copian tal cual");
        }
        for (String raw : expressions) {
            Expression expression = ExpressionClassifier.classify(raw);
            if (expression instanceof UnrecognizedExpression) {
                warnings.add("Variable posiblemente inválida: " + raw
                        + " (" + ((UnrecognizedExpression) expression).reason() + ")");
            } else if (expression instanceof FormattedExpression
                    && !((FormattedExpression) expression).isKnownFormat()) {
                warnings.add("Formato desconocido '" + ((FormattedExpression) expression).formatName()
                        + "' en: " + raw + "; se usará el valor sin formato");
            } else if (sampleKey(expression).isEmpty()) {
                warnings.add("Sin dato de muestra para: " + raw + "; la vista previa lo calcula sin datos");
            }
        }
        return new TemplateInspection(expressions, warnings);
    }

    @Override
    public String preview(String template, String namespaceUri) throws AddendaProcessingException {
        String rendered = renderer.render(template, sampleContext(template), namespaceUri);
        if (rendered.isEmpty()) {
            return rendered;
        }
        return SecureXml.prettyPrint(SecureXml.parse(rendered, "La vista previa"));
    }

    /**
     * Datos de muestra derivados del nombre de cada variable.
     */
    VariableContext sampleContext(String template) {
        var sample = new LinkedHashMap<String, Object>();
        for (String raw : renderer.extractExpressions(template)) {
            sampleKey(ExpressionClassifier.classify(raw))
                    .ifPresent(key -> sample.putIfAbsent(key, sampleValue(key)));
        }
        return VariableContext.builder().fieldValues(sample).build();
    }

    static String sampleValue(String variable) {
        String name = variable.toLowerCase(Locale.ROOT);
        if (containsAny(name, "fecha", "date")) {
            return "2025-07-20";
        }
        if (containsAny(name, "monto", "amount", "total")) {
            return "1000.00";
        }
        if (containsAny(name, "codigo", "code")) {
            return "ABC123";
        }
        if (containsAny(name, "folio", "numero")) {
            return "12345";
        }
        return "Valor_" + variable;
    }

    /**
     * Clave con la que el resolvedor encontrará el dato de muestra. Una ruta se publica
     * con su clave punteada literal. Las funciones agregan listas y no tienen muestra.
     */
    private static Optional<String> sampleKey(Expression expression) {
        return switch (expression.kind()) {
            case IDENTIFIER, PATH -> Optional.of(expression.source());
            case FORMATTED -> sampleKey(((FormattedExpression) expression).base());
            case FUNCTION, UNRECOGNIZED -> Optional.empty();
        };
    }

    private static boolean containsAny(String text, String... keywords) {
        for (String keyword : keywords) {
            if (text.contains(keyword)) {
                return true;
            }
        }
        return false;
    }
}
