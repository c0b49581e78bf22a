package io.mersel.services.addenda.infrastructure.generation;

import io.mersel.services.addenda.application.enums.FieldTransformation;
import io.mersel.services.addenda.application.interfaces.DynamicValueLookup;
import io.mersel.services.addenda.application.models.ConfiguredFieldValue;
import io.mersel.services.addenda.application.models.DynamicFieldSource;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("FieldValueResolver")
class FieldValueResolverTest {

    private static final DynamicFieldSource ORDER = new DynamicFieldSource("Sales Invoice", "po_no");

    @Mock
    private DynamicValueLookup lookup;

    private FieldValueResolver resolver;

    @BeforeEach
    void setUp() {
        resolver = new FieldValueResolver();
    }

    @Nested
    @DisplayName("Valores fijos")
    class FixedTests {

        @Test
        @DisplayName("Usa el valor fijo sin consultar fuentes")
        void valor_fijo() {
            assertThat(resolver.resolve(ConfiguredFieldValue.fixed("proveedor", "ACME"), lookup)).isEqualTo("ACME");
            verify(lookup, never()).lookup(any());
        }

        @Test
        @DisplayName("Valor fijo vacío → valor por defecto")
        void valor_por_defecto() {
            var value = new ConfiguredFieldValue("moneda", "", null, FieldTransformation.NONE, "MXN");

            assertThat(resolver.resolve(value, lookup)).isEqualTo("MXN");
        }

        @Test
        @DisplayName("Sin valor ni defecto → cadena vacía sin transformar")
        void sin_valor() {
            var value = new ConfiguredFieldValue("nota", null, null, FieldTransformation.NUMBER_FORMAT, null);

            assertThat(resolver.resolve(value, lookup)).isEmpty();
        }
    }

    @Nested
    @DisplayName("Valores dinámicos")
    class DynamicTests {

        @Test
        @DisplayName("La fuente tiene prioridad sobre el valor por defecto")
        void fuente_prioritaria() {
            when(lookup.lookup(ORDER)).thenReturn(Optional.of("PO-55"));
            var value = ConfiguredFieldValue.dynamic("orden", "Sales Invoice", "po_no", FieldTransformation.NONE, "SIN-PO");

            assertThat(resolver.resolve(value, lookup)).isEqualTo("PO-55");
        }

        @Test
        @DisplayName("Fuente sin valor → valor por defecto")
        void fuente_vacia() {
            when(lookup.lookup(ORDER)).thenReturn(Optional.empty());
            var value = ConfiguredFieldValue.dynamic("orden", "Sales Invoice", "po_no", FieldTransformation.NONE, "SIN-PO");

            assertThat(resolver.resolve(value, lookup)).isEqualTo("SIN-PO");
        }

        @Test
        @DisplayName("Error de la fuente → valor por defecto, sin propagar")
        void fuente_con_error() {
            when(lookup.lookup(ORDER)).thenThrow(new IllegalStateException("sin conexión"));
            var value = ConfiguredFieldValue.dynamic("orden", "Sales Invoice", "po_no", FieldTransformation.NONE, "SIN-PO");

            assertThat(resolver.resolve(value, lookup)).isEqualTo("SIN-PO");
        }

        @Test
        @DisplayName("Valores no textuales se convierten a texto antes de transformar")
        void valor_numerico() {
            when(lookup.lookup(ORDER)).thenReturn(Optional.of(new BigDecimal("1500.5")));
            var value = ConfiguredFieldValue.dynamic("orden", "Sales Invoice", "po_no",
                    FieldTransformation.NUMBER_FORMAT, null);

            assertThat(resolver.resolve(value, lookup)).isEqualTo("1500.50");
        }

        @Test
        @DisplayName("Sin nombre de fuente el campo se trata como fijo")
        void fuente_incompleta() {
            var value = new ConfiguredFieldValue("orden", "FIJO", new DynamicFieldSource("", "po_no"),
                    FieldTransformation.NONE, null);

            assertThat(resolver.resolve(value, lookup)).isEqualTo("FIJO");
            verify(lookup, never()).lookup(any());
        }
    }

    @Test
    @DisplayName("resolve de una lista conserva el orden de configuración")
    void lista_en_orden() {
        Map<String, String> resolved = resolver.resolve(List.of(
                ConfiguredFieldValue.fixed("b", "2"),
                ConfiguredFieldValue.fixed("a", "1"),
                new ConfiguredFieldValue("c", " x ", null, FieldTransformation.TRIM, null)),
                DynamicValueLookup.NONE);

        assertThat(resolved).containsExactly(Map.entry("b", "2"), Map.entry("a", "1"), Map.entry("c", "x"));
    }

    @ParameterizedTest(name = "{1}: ''{0}'' → ''{2}''")
    @CsvSource(delimiter = '|', value = {
            "acme industrial     | UPPERCASE     | ACME INDUSTRIAL",
            "ACME Industrial     | LOWERCASE     | acme industrial",
            "acme INDUSTRIAL     | TITLE         | Acme Industrial",
            "1234.567            | NUMBER_FORMAT | 1234.57",
            "2.005               | NUMBER_FORMAT | 2.01",
            "abc                 | NUMBER_FORMAT | abc",
            "1E200000000         | NUMBER_FORMAT | 1E200000000",
            "2025-07-20 14:30:00 | DATE_FORMAT   | 2025-07-20",
            "2025-07-20T14:30:00 | DATE_FORMAT   | 2025-07-20",
            "2025-07-20          | DATE_FORMAT   | 2025-07-20",
            "2025-02-30 14:30:00 | DATE_FORMAT   | 2025-02-30 14:30:00",
            "20/07/2025          | DATE_FORMAT   | 20/07/2025",
            "sin cambio          | NONE          | sin cambio"
    })
    @DisplayName("Transformaciones")
    void transformaciones(String value, FieldTransformation transformation, String expected) {
        assertThat(FieldValueResolver.transform(value, transformation)).isEqualTo(expected);
    }
}
