package io.mersel.services.addenda.infrastructure;

import io.mersel.services.addenda.application.interfaces.AddendaBuildException;
import io.mersel.services.addenda.application.models.TemplateInspection;
import io.mersel.services.addenda.application.models.VariableContext;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("TemplateInspector")
class TemplateInspectorTest {

    private static final String TEMPLATE = "<addenda>"
            + "<folio>{{ folio_proveedor }}</folio>"
            + "<fecha>{{ fecha_entrega|date:%d/%m/%Y }}</fecha>"
            + "<total>{{ monto_total|currency }}</total>"
            + "<proveedor>{{ proveedor.nombre }}</proveedor>"
            + "<suma>{{ sum(conceptos.importe) }}</suma>"
            + "</addenda>";

    private final TemplateInspector inspector = new TemplateInspector(TestFixtures.properties(), TestFixtures.metrics());

    @Nested
    @DisplayName("inspect")
    class InspectTests {

        @Test
        @DisplayName("Lista expresiones y advierte las que no tienen muestra")
        void expresiones_y_advertencias() {
            TemplateInspection inspection = inspector.inspect(TEMPLATE);

            assertThat(inspection.expressions()).containsExactly(
                    "folio_proveedor", "fecha_entrega|date:%d/%m/%Y", "monto_total|currency",
                    "proveedor.nombre", "sum(conceptos.importe)");
            assertThat(inspection.warnings()).containsExactly(
                    "Sin dato de muestra para: sum(conceptos.importe); la vista previa lo calcula sin datos");
        }

        @Test
        @DisplayName("Plantilla sin variables")
        void sin_variables() {
            assertThat(inspector.inspect("<a/>").warnings())
                    .containsExactly("La plantilla no contiene variables dinámicas");
        }

        @Test
        @DisplayName("Expresión no reconocida y formato desconocido")
        void expresiones_dudosas() {
            TemplateInspection inspection = inspector.inspect("<a>{{ a b }}{{ total|rara }}</a>");

            assertThat(inspection.warnings()).hasSize(2);
            assertThat(inspection.warnings().get(0)).startsWith("Variable posiblemente inválida: a b (");
            assertThat(inspection.warnings().get(1))
                    .isEqualTo("Formato desconocido 'rara' en: total|rara; se usará el valor sin formato");
        }

        @Test
        @DisplayName("Bloques {% %} se advierten")
        void bloques() {
            assertThat(inspector.inspect("<a>{% if x %}{{ x }}{% endif %}</a>").warnings())
                    .containsExactly("Los bloques {% ... %} no se interpretan y se copian tal cual");
        }
    }

    @Nested
    @DisplayName("preview")
    class PreviewTests {

        @Test
        @DisplayName("Renderiza con datos de muestra y sangría")
        void vista_previa() throws Exception {
            String preview = inspector.preview(TEMPLATE, null);

            assertThat(preview).startsWith(SecureXml.XML_DECLARATION + "\n<addenda>");
            assertThat(preview)
                    .contains("  <folio>12345</folio>")
                    .contains("<fecha>20/07/2025</fecha>")
                    .contains("<total>$1,000.00</total>")
                    .contains("<proveedor>Valor_proveedor.nombre</proveedor>")
                    .contains("<suma>0</suma>");
        }

        @Test
        @DisplayName("Aplica el namespace indicado")
        void con_namespace() throws Exception {
            assertThat(inspector.preview("<p>{{ codigo }}</p>", "urn:pedido"))
                    .contains("<p xmlns=\"urn:pedido\">ABC123</p>");
        }

        @Test
        @DisplayName("Plantilla vacía → cadena vacía")
        void vacia() throws Exception {
            assertThat(inspector.preview("", null)).isEmpty();
        }

        @Test
        @DisplayName("Plantilla que no produce XML → AddendaBuildException")
        void mal_formada() {
            assertThatThrownBy(() -> inspector.preview("<a>{{ x }}", null))
                    .isInstanceOf(AddendaBuildException.class);
        }
    }

    @Test
    @DisplayName("sampleContext publica rutas con su clave literal")
    void contexto_de_muestra() {
        VariableContext context = inspector.sampleContext("<a>{{ cliente.rfc }}{{ fecha|date }}</a>");

        assertThat(context.lookup("cliente.rfc")).contains("Valor_cliente.rfc");
        assertThat(context.lookup("fecha")).contains("2025-07-20");
    }

    @ParameterizedTest
    @CsvSource({
            "fecha_entrega, 2025-07-20",
            "delivery_date, 2025-07-20",
            "monto, 1000.00",
            "Total_Factura, 1000.00",
            "codigo_tienda, ABC123",
            "numero_pedido, 12345",
            "proveedor, Valor_proveedor"
    })
    @DisplayName("sampleValue por palabra clave")
    void valor_de_muestra(String variable, String expected) {
        assertThat(TemplateInspector.sampleValue(variable)).isEqualTo(expected);
    }
}
