package io.mersel.services.addenda.infrastructure.generation;

import io.mersel.services.addenda.application.enums.FieldType;
import io.mersel.services.addenda.application.interfaces.InvalidAddendaDefinitionException;
import io.mersel.services.addenda.application.models.AddendaTemplate;
import io.mersel.services.addenda.application.models.AddendaType;
import io.mersel.services.addenda.application.models.FieldDefinition;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("AddendaDefinitionValidator")
class AddendaDefinitionValidatorTest {

    private final AddendaDefinitionValidator validator = new AddendaDefinitionValidator();

    private static AddendaType type(String version, FieldDefinition... fields) {
        return new AddendaType("Walmart", version, null, null, List.of(fields));
    }

    @Nested
    @DisplayName("validateType")
    class TypeTests {

        @Test
        @DisplayName("Tipo correcto no lanza")
        void tipo_correcto() {
            var ok = type("1.2.3",
                    new FieldDefinition("numero_proveedor", "Número de proveedor", FieldType.INT, true, "^\\d+$"),
                    FieldDefinition.of("orden_compra", false));

            assertThatCode(() -> validator.validateType(ok)).doesNotThrowAnyException();
        }

        @Test
        @DisplayName("Versión vacía se acepta")
        void version_vacia() {
            assertThatCode(() -> validator.validateType(type(null))).doesNotThrowAnyException();
        }

        @Test
        @DisplayName("Acumula todas las violaciones en una sola excepción")
        void acumula_violaciones() {
            var bad = new AddendaType(" ", "1", null, "<xs:schema", List.of(
                    FieldDefinition.of("campo", false),
                    FieldDefinition.of("campo", false),
                    FieldDefinition.of("1malo", false),
                    new FieldDefinition("patron", "Patrón", FieldType.DATA, false, "([a-z")));

            assertThatThrownBy(() -> validator.validateType(bad))
                    .isInstanceOfSatisfying(InvalidAddendaDefinitionException.class, e -> {
                        assertThat(e.getMessage()).startsWith("Tipo de addenda inválido: ");
                        assertThat(e.getViolations()).hasSize(6);
                        assertThat(e.getViolations()).contains(
                                "El tipo de addenda debe tener nombre",
                                "La versión debe seguir el formato x.y o x.y.z (ej: 1.0, 1.2.3): 1",
                                "Nombre de campo duplicado: campo",
                                "Nombre de campo '1malo' debe iniciar con letra y ser alfanumérico (se permiten guiones bajos)");
                        assertThat(e.getViolations()).anyMatch(v -> v.startsWith("Patrón de validación inválido en 'patron'"));
                        assertThat(e.getViolations()).anyMatch(v -> v.startsWith("Esquema XSD inválido: "));
                    });
        }
    }

    @Nested
    @DisplayName("validateTemplates")
    class TemplateTests {

        @Test
        @DisplayName("Dos plantillas por defecto → violación")
        void dos_por_defecto() {
            var templates = List.of(
                    new AddendaTemplate("A", "Walmart", "<a/>", true),
                    new AddendaTemplate("B", "Walmart", "<b/>", true));

            assertThatThrownBy(() -> validator.validateTemplates(type("1.0"), templates))
                    .isInstanceOf(InvalidAddendaDefinitionException.class)
                    .hasMessageContaining("Ya existe un template por defecto para el tipo Walmart (2 marcados)");
        }

        @Test
        @DisplayName("Plantilla de otro tipo → violación")
        void otro_tipo() {
            var templates = List.of(new AddendaTemplate("A", "Soriana", "<a/>", true));

            assertThatThrownBy(() -> validator.validateTemplates(type("1.0"), templates))
                    .isInstanceOfSatisfying(InvalidAddendaDefinitionException.class, e ->
                            assertThat(e.getViolations()).containsExactly(
                                    "El template 'A' pertenece al tipo Soriana, no a Walmart"));
        }

        @Test
        @DisplayName("Una por defecto y otras normales es válido")
        void una_por_defecto() {
            var templates = List.of(
                    new AddendaTemplate("A", "Walmart", "<a/>", true),
                    new AddendaTemplate("B", "Walmart", "<b/>", false),
                    new AddendaTemplate("C", null, "<c/>", false));

            assertThatCode(() -> validator.validateTemplates(type("1.0"), templates)).doesNotThrowAnyException();
        }
    }

    @Nested
    @DisplayName("validateFieldValues")
    class FieldValueTests {

        private final AddendaType walmart = type("1.0",
                new FieldDefinition("numero_proveedor", "Número de proveedor", FieldType.INT, true, null),
                new FieldDefinition("orden_compra", "Orden de compra", FieldType.DATA, true, "PO-\\d+"),
                new FieldDefinition("fecha_entrega", "Fecha de entrega", FieldType.DATE, false, null));

        @Test
        @DisplayName("Valores correctos no lanzan")
        void valores_correctos() {
            var values = Map.of("numero_proveedor", "123", "orden_compra", "PO-9 urgente", "fecha_entrega", "");

            assertThatCode(() -> validator.validateFieldValues(walmart, values)).doesNotThrowAnyException();
        }

        @Test
        @DisplayName("Reporta obligatorios faltantes, tipo, patrón y campos ajenos")
        void todas_las_violaciones() {
            var values = Map.of(
                    "orden_compra", "OC-1",
                    "fecha_entrega", "20/07/2025",
                    "extra", "x");

            assertThatThrownBy(() -> validator.validateFieldValues(walmart, values))
                    .isInstanceOfSatisfying(InvalidAddendaDefinitionException.class, e ->
                            assertThat(e.getViolations()).containsExactlyInAnyOrder(
                                    "El campo 'extra' no pertenece al tipo de addenda 'Walmart'",
                                    "Campo obligatorio faltante: Número de proveedor",
                                    "El valor 'OC-1' no cumple con el patrón de validación 'PO-\\d+'",
                                    "Valor no válido para tipo DATE en 'Fecha de entrega': 20/07/2025"));
        }
    }

    @ParameterizedTest(name = "{1}: ''{0}'' → {2}")
    @CsvSource({
            "42, INT, true",
            "4.2, INT, false",
            "4.2, FLOAT, true",
            "abc, FLOAT, false",
            "2025-07-20, DATE, true",
            "2025-7-20, DATE, false",
            "2025-07-20 10:00:00, DATETIME, true",
            "2025-07-20T10:00:00, DATETIME, true",
            "2025-07-20, DATETIME, false",
            "Yes, CHECK, true",
            "0, CHECK, true",
            "si, CHECK, false",
            "cualquier cosa, DATA, true"
    })
    @DisplayName("matchesType")
    void tipos(String value, FieldType type, boolean expected) {
        assertThat(AddendaDefinitionValidator.matchesType(value, type)).isEqualTo(expected);
    }
}
