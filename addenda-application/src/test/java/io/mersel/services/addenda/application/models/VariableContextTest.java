package io.mersel.services.addenda.application.models;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("VariableContext")
class VariableContextTest {

    @Nested
    @DisplayName("Prioridad de capas")
    class PriorityTests {

        @Test
        @DisplayName("sistema < campos < CFDI")
        void prioridad() {
            var context = VariableContext.builder()
                    .systemVariables(Map.of("a", "sistema", "b", "sistema", "c", "sistema"))
                    .fieldValues(Map.of("b", "campo", "c", "campo"))
                    .cfdiData(Map.of("c", "cfdi"))
                    .build();

            assertThat(context.lookup("a")).contains("sistema");
            assertThat(context.lookup("b")).contains("campo");
            assertThat(context.lookup("c")).contains("cfdi");
            assertThat(context.size()).isEqualTo(3);
        }

        @Test
        @DisplayName("Un null no oculta capas inferiores")
        void nulos() {
            var fields = new HashMap<String, Object>();
            fields.put("b", null);

            var context = VariableContext.builder()
                    .systemVariables(Map.of("b", "sistema"))
                    .fieldValues(fields)
                    .build();

            assertThat(context.lookup("b")).contains("sistema");
        }

        @Test
        @DisplayName("Capas nulas se tratan como vacías")
        void capas_nulas() {
            var context = VariableContext.builder()
                    .systemVariables(null)
                    .fieldValues(null)
                    .cfdiData(null)
                    .build();

            assertThat(context.size()).isZero();
            assertThat(VariableContext.empty().lookup("x")).isEmpty();
        }
    }

    @Nested
    @DisplayName("Alias CFDI")
    class AliasTests {

        @Test
        @DisplayName("uuid y total se publican también como cfdi_*")
        void alias() {
            var context = VariableContext.builder()
                    .cfdiData(Map.of("uuid", "ABC-123", "total", "500.00"))
                    .build();

            assertThat(context.lookup("cfdi_uuid")).contains("ABC-123");
            assertThat(context.lookup("cfdi_total")).contains("500.00");
            assertThat(context.lookup("uuid")).contains("ABC-123");
        }

        @Test
        @DisplayName("La clave explícita gana sobre el alias")
        void clave_explicita() {
            var context = VariableContext.builder()
                    .cfdiData(Map.of("total", "1.00", "cfdi_total", "2.00"))
                    .build();

            assertThat(context.lookup("cfdi_total")).contains("2.00");
        }

        @Test
        @DisplayName("Origen vacío no genera alias")
        void origen_vacio() {
            var context = VariableContext.builder()
                    .fieldValues(Map.of("cfdi_uuid", "campo"))
                    .cfdiData(Map.of("uuid", ""))
                    .build();

            assertThat(context.lookup("cfdi_uuid")).contains("campo");
        }

        @Test
        @DisplayName("Los alias solo se aplican a la capa CFDI")
        void solo_cfdi() {
            var context = VariableContext.builder()
                    .fieldValues(Map.of("uuid", "campo"))
                    .build();

            assertThat(context.contains("cfdi_uuid")).isFalse();
        }
    }

    @Test
    @DisplayName("Conserva valores estructurados y es inmutable")
    void inmutable() {
        var context = VariableContext.builder()
                .cfdiData(Map.of("conceptos", List.of(Map.of("importe", "1.00"))))
                .build();

        assertThat(context.lookup("conceptos")).hasValueSatisfying(v -> assertThat(v).isInstanceOf(List.class));
        assertThatThrownBy(() -> context.asMap().put("x", "y")).isInstanceOf(UnsupportedOperationException.class);
    }
}
