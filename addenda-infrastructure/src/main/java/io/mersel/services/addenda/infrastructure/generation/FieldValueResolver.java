package io.mersel.services.addenda.infrastructure.generation;

import io.mersel.services.addenda.application.enums.FieldTransformation;
import io.mersel.services.addenda.application.interfaces.DynamicValueLookup;
import io.mersel.services.addenda.application.models.ConfiguredFieldValue;
import io.mersel.services.addenda.infrastructure.expression.ValueFormatter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.math.RoundingMode;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.ResolverStyle;
import java.time.format.DateTimeParseException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Resuelve los valores configurados de campos a texto.
 * <p>
 * Campo dinámico: valor de la fuente, si no el valor por defecto. Campo fijo: valor,
 * si no el valor por defecto. La transformación se aplica solo sobre valores no vacíos.
 */
@Component
public class FieldValueResolver {

    private static final Logger log = LoggerFactory.getLogger(FieldValueResolver.class);

    private static final DateTimeFormatter OUTPUT_DATE = DateTimeFormatter.ofPattern("yyyy-MM-dd");
    private static final DateTimeFormatter SPACED_DATE_TIME = DateTimeFormatter.ofPattern("uuuu-MM-dd HH:mm:ss")
            .withResolverStyle(ResolverStyle.STRICT);

    /**
     * @return nombre de campo → valor, en el orden de configuración
     */
    public Map<String, String> resolve(List<ConfiguredFieldValue> values, DynamicValueLookup lookup) {
        var resolved = new LinkedHashMap<String, String>();
        for (ConfiguredFieldValue value : values) {
            resolved.put(value.fieldName(), resolve(value, lookup));
        }
        return resolved;
    }

    public String resolve(ConfiguredFieldValue value, DynamicValueLookup lookup) {
        String raw;
        if (value.isDynamic()) {
            raw = lookupDynamic(value, lookup).orElse(nullToEmpty(value.defaultValue()));
        } else {
            raw = firstNonEmpty(value.value(), value.defaultValue());
        }
        return raw.isEmpty() ? raw : transform(raw, value.transformation());
    }

    static String transform(String value, FieldTransformation transformation) {
        return switch (transformation) {
            case NONE -> value;
            case UPPERCASE -> value.toUpperCase(Locale.ROOT);
            case LOWERCASE -> value.toLowerCase(Locale.ROOT);
            case TITLE -> ValueFormatter.titleCase(value);
            case TRIM -> value.strip();
            case NUMBER_FORMAT -> ValueFormatter.toNumber(value)
                    .map(n -> n.setScale(2, RoundingMode.HALF_UP).toPlainString())
                    .orElse(value);
            case DATE_FORMAT -> toIsoDate(value).orElse(value);
        };
    }

    private Optional<String> lookupDynamic(ConfiguredFieldValue value, DynamicValueLookup lookup) {
        try {
            return lookup.lookup(value.dynamicSource())
                    .map(ValueFormatter::toText);
        } catch (RuntimeException e) {
            log.warn("No se pudo leer {}.{} para el campo {}: {}",
                    value.dynamicSource().sourceName(), value.dynamicSource().fieldName(),
                    value.fieldName(), e.getMessage());
            return Optional.empty();
        }
    }

    private static Optional<String> toIsoDate(String value) {
        String text = value.strip();
        try {
            return Optional.of(OUTPUT_DATE.format(LocalDateTime.parse(text, SPACED_DATE_TIME)));
        } catch (DateTimeParseException e) {
            log.trace("{} no tiene formato yyyy-MM-dd HH:mm:ss", text);
        }
        try {
            return Optional.of(OUTPUT_DATE.format(LocalDateTime.parse(text)));
        } catch (DateTimeParseException e) {
            log.trace("{} no es fecha-hora ISO", text);
        }
        try {
            return Optional.of(OUTPUT_DATE.format(LocalDate.parse(text)));
        } catch (DateTimeParseException e) {
            return Optional.empty();
        }
    }

    private static String firstNonEmpty(String first, String second) {
        if (first != null && !first.isEmpty()) return first;
        return nullToEmpty(second);
    }

    private static String nullToEmpty(String s) {
        return s == null ? "" : s;
    }
}
