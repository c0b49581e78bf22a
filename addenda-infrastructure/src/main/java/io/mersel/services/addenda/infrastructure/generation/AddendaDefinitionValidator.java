package io.mersel.services.addenda.infrastructure.generation;

import io.mersel.services.addenda.application.enums.FieldType;
import io.mersel.services.addenda.application.interfaces.InvalidAddendaDefinitionException;
import io.mersel.services.addenda.application.interfaces.MalformedXmlException;
import io.mersel.services.addenda.application.models.AddendaTemplate;
import io.mersel.services.addenda.application.models.AddendaType;
import io.mersel.services.addenda.application.models.FieldDefinition;
import io.mersel.services.addenda.infrastructure.SecureXml;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.ResolverStyle;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Reglas de definición de tipos, plantillas y valores de campo.
 * <p>
 * Cada método acumula todas las violaciones y lanza una sola
 * {@link InvalidAddendaDefinitionException} con la lista completa.
 */
@Component
public class AddendaDefinitionValidator {

    private static final Pattern VERSION = Pattern.compile("^\\d+\\.\\d+(\\.\\d+)?$");
    private static final Pattern FIELD_NAME = Pattern.compile("^[a-zA-Z][a-zA-Z0-9_]*$");
    private static final Set<String> BOOLEAN_VALUES = Set.of("0", "1", "true", "false", "yes", "no");

    private static final DateTimeFormatter DATE = DateTimeFormatter.ofPattern("uuuu-MM-dd")
            .withResolverStyle(ResolverStyle.STRICT);
    private static final DateTimeFormatter SPACED_DATE_TIME = DateTimeFormatter.ofPattern("uuuu-MM-dd HH:mm:ss")
            .withResolverStyle(ResolverStyle.STRICT);

    public void validateType(AddendaType type) throws InvalidAddendaDefinitionException {
        var violations = new ArrayList<String>();

        if (type.name() == null || type.name().isBlank()) {
            violations.add("El tipo de addenda debe tener nombre");
        }
        if (type.version() != null && !type.version().isBlank() && !VERSION.matcher(type.version()).matches()) {
            violations.add("La versión debe seguir el formato x.y o x.y.z (ej: 1.0, 1.2.3): " + type.version());
        }

        Set<String> seen = new HashSet<>();
        for (FieldDefinition field : type.fields()) {
            if (!seen.add(field.name())) {
                violations.add("Nombre de campo duplicado: " + field.name());
            }
            if (!FIELD_NAME.matcher(field.name()).matches()) {
                violations.add("Nombre de campo '" + field.name()
                        + "' debe iniciar con letra y ser alfanumérico (se permiten guiones bajos)");
            }
            if (field.hasValidationPattern()) {
                try {
                    Pattern.compile(field.validationPattern());
                } catch (PatternSyntaxException e) {
                    violations.add("Patrón de validación inválido en '" + field.name() + "': " + e.getDescription());
                }
            }
        }

        if (type.hasSchema()) {
            try {
                SecureXml.parse(type.xsdSchema(), "El esquema XSD");
            } catch (MalformedXmlException e) {
                violations.add("Esquema XSD inválido: " + e.getMessage());
            }
        }

        throwIfAny("Tipo de addenda inválido", violations);
    }

    /**
     * Como máximo una plantilla por defecto, y todas del mismo tipo.
     */
    public void validateTemplates(AddendaType type, List<AddendaTemplate> templates)
            throws InvalidAddendaDefinitionException {
        var violations = new ArrayList<String>();

        long defaults = templates.stream().filter(AddendaTemplate::defaultTemplate).count();
        if (defaults > 1) {
            violations.add("Ya existe un template por defecto para el tipo " + type.name()
                    + " (" + defaults + " marcados)");
        }
        for (AddendaTemplate template : templates) {
            if (template.addendaTypeName() != null && !template.addendaTypeName().equals(type.name())) {
                violations.add("El template '" + template.name() + "' pertenece al tipo "
                        + template.addendaTypeName() + ", no a " + type.name());
            }
        }

        throwIfAny("Templates inválidos", violations);
    }

    /**
     * Valores resueltos frente a las definiciones del tipo: obligatorios presentes,
     * tipo de dato, patrón y ausencia de campos no declarados.
     */
    public void validateFieldValues(AddendaType type, Map<String, String> values)
            throws InvalidAddendaDefinitionException {
        var violations = new ArrayList<String>();

        for (String name : values.keySet()) {
            if (type.findField(name).isEmpty()) {
                violations.add("El campo '" + name + "' no pertenece al tipo de addenda '" + type.name() + "'");
            }
        }

        for (FieldDefinition field : type.fields()) {
            String value = values.get(field.name());
            if (value == null || value.isBlank()) {
                if (field.mandatory()) {
                    violations.add("Campo obligatorio faltante: " + field.label());
                }
                continue;
            }
            if (!matchesType(value.strip(), field.type())) {
                violations.add("Valor no válido para tipo " + field.type() + " en '" + field.label() + "': " + value);
            }
            if (field.hasValidationPattern() && !Pattern.compile(field.validationPattern()).matcher(value).lookingAt()) {
                violations.add("El valor '" + value + "' no cumple con el patrón de validación '"
                        + field.validationPattern() + "'");
            }
        }

        throwIfAny("Valores de campo inválidos", violations);
    }

    static boolean matchesType(String value, FieldType type) {
        try {
            switch (type) {
                case INT -> Long.parseLong(value);
                case FLOAT -> new BigDecimal(value);
                case DATE -> LocalDate.parse(value, DATE);
                case DATETIME -> parseDateTime(value);
                case CHECK -> {
                    return BOOLEAN_VALUES.contains(value.toLowerCase(Locale.ROOT));
                }
                case DATA -> {
                    return true;
                }
            }
            return true;
        } catch (NumberFormatException | DateTimeParseException e) {
            return false;
        }
    }

    private static void parseDateTime(String value) {
        try {
            LocalDateTime.parse(value, SPACED_DATE_TIME);
        } catch (DateTimeParseException e) {
            LocalDateTime.parse(value);
        }
    }

    private static void throwIfAny(String title, List<String> violations) throws InvalidAddendaDefinitionException {
        if (!violations.isEmpty()) {
            throw new InvalidAddendaDefinitionException(title + ": " + String.join("; ", violations), violations);
        }
    }
}
