package io.mersel.services.addenda.infrastructure;

import io.mersel.services.addenda.application.enums.FieldTransformation;
import io.mersel.services.addenda.application.enums.FieldType;
import io.mersel.services.addenda.application.enums.InsertionAnchor;
import io.mersel.services.addenda.application.enums.ResolutionMode;
import io.mersel.services.addenda.application.interfaces.CfdiStructureException;
import io.mersel.services.addenda.application.interfaces.InvalidAddendaDefinitionException;
import io.mersel.services.addenda.application.models.AddendaGenerationRequest;
import io.mersel.services.addenda.application.models.AddendaGenerationResult;
import io.mersel.services.addenda.application.models.AddendaTemplate;
import io.mersel.services.addenda.application.models.AddendaType;
import io.mersel.services.addenda.application.models.CfdiNamespaces;
import io.mersel.services.addenda.application.models.ConfiguredFieldValue;
import io.mersel.services.addenda.application.models.FieldDefinition;
import io.mersel.services.addenda.infrastructure.cfdi.DomCfdiParser;
import io.mersel.services.addenda.infrastructure.config.AddendaProperties;
import io.mersel.services.addenda.infrastructure.diagnostics.AddendaMetrics;
import io.mersel.services.addenda.infrastructure.generation.AddendaDefinitionValidator;
import io.mersel.services.addenda.infrastructure.generation.FieldValueResolver;
import io.mersel.services.addenda.infrastructure.generation.TemplateCatalog;
import io.mersel.services.addenda.infrastructure.generation.VariableContextFactory;
import io.mersel.services.addenda.infrastructure.validation.XsdValidatorFactory;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("AddendaGenerationService")
class AddendaGenerationServiceTest {

    private static final String PEDIDO_TEMPLATE = "<addenda tipo=\"{{ tipo }}\">"
            + "<folio>{{ folio }}</folio>"
            + "<fecha>{{ cfdi_fecha|date:%Y-%m-%d }}</fecha>"
            + "<total>{{ cfdi_total }}</total>"
            + "</addenda>";

    private SimpleMeterRegistry registry;
    private AddendaGenerationService service;
    private AddendaType pedido;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        var properties = new AddendaProperties();
        var metrics = new AddendaMetrics(registry);
        Clock clock = Clock.fixed(Instant.parse("2025-07-21T12:00:00Z"), ZoneOffset.UTC);

        service = new AddendaGenerationService(
                new AddendaDefinitionValidator(),
                new FieldValueResolver(),
                new VariableContextFactory(clock),
                new TemplateCatalog(),
                new XmlTemplateRenderer(new ExpressionVariableResolver(ResolutionMode.LENIENT), properties, metrics),
                new DomCfdiParser(CfdiNamespaces.CFDI_40, properties, metrics),
                new XsdValidatorFactory(properties, metrics),
                metrics);

        pedido = new AddendaType("Pedido", "1.2", null, TestFixtures.read("addenda-pedido.xsd"), List.of(
                new FieldDefinition("folio", "Folio del pedido", FieldType.DATA, true, null),
                new FieldDefinition("tipo", "Tipo de pedido", FieldType.DATA, true, null)));
    }

    private AddendaGenerationRequest.Builder pedidoRequest(String tipo) {
        return AddendaGenerationRequest.builder()
                .addendaType(pedido)
                .templates(List.of(new AddendaTemplate("Pedido v1", "Pedido", PEDIDO_TEMPLATE, true)))
                .fieldValues(List.of(
                        ConfiguredFieldValue.fixed("folio", "F-1"),
                        ConfiguredFieldValue.dynamic("tipo", "Sales Invoice", "prioridad",
                                FieldTransformation.LOWERCASE, "normal")))
                .dynamicLookup(source -> Optional.ofNullable(tipo))
                .cfdiXml(TestFixtures.read("cfdi-timbrado.xml"));
    }

    @Nested
    @DisplayName("Flujo completo")
    class FullFlowTests {

        @Test
        @DisplayName("Renderiza, valida contra el XSD e inserta tras el Complemento")
        void genera_valida_e_inserta() throws Exception {
            AddendaGenerationResult result = service.generate(pedidoRequest("URGENTE").insertIntoCfdi(true).build());

            assertThat(result.getAddendaXml()).isEqualTo("<addenda tipo=\"urgente\">"
                    + "<folio>F-1</folio><fecha>2025-07-20</fecha><total>1160.00</total></addenda>");
            assertThat(result.getTemplateName()).isEqualTo("Pedido v1");
            assertThat(result.getFieldValues()).containsEntry("folio", "F-1").containsEntry("tipo", "urgente");
            assertThat(result.isCfdiDataUsed()).isTrue();
            assertThat(result.getValidationReport()).isNotNull();
            assertThat(result.isValid()).isTrue();
            assertThat(result.getInsertionAnchor()).isEqualTo(InsertionAnchor.AFTER_COMPLEMENTO);
            assertThat(result.getCfdiXml())
                    .startsWith(SecureXml.XML_DECLARATION)
                    .contains("<cfdi:Addenda>")
                    .contains("<folio>F-1</folio>");
            assertThat(registry.get("addenda_generations_total").tag("result", "success").counter().count())
                    .isEqualTo(1.0);
        }

        @Test
        @DisplayName("Fuente dinámica vacía usa el valor por defecto")
        void valor_por_defecto() throws Exception {
            AddendaGenerationResult result = service.generate(pedidoRequest(null).build());

            assertThat(result.getAddendaXml()).startsWith("<addenda tipo=\"normal\">");
            assertThat(result.getCfdiXml()).isNull();
            assertThat(result.getInsertionAnchor()).isNull();
        }

        @Test
        @DisplayName("Addenda que no cumple el XSD no se inserta")
        void invalida_no_se_inserta() throws Exception {
            AddendaGenerationResult result = service.generate(pedidoRequest("raro").insertIntoCfdi(true).build());

            assertThat(result.isValid()).isFalse();
            assertThat(result.getValidationReport().getSuggestions())
                    .contains("Usar uno de los valores permitidos: normal, urgente");
            assertThat(result.getCfdiXml()).isNull();
            assertThat(result.getInsertionAnchor()).isNull();
        }

        @Test
        @DisplayName("Sin validación de salida no hay reporte")
        void sin_validacion() throws Exception {
            AddendaGenerationResult result = service.generate(
                    pedidoRequest("raro").validateOutput(false).insertIntoCfdi(true).build());

            assertThat(result.getValidationReport()).isNull();
            assertThat(result.isValid()).isTrue();
            assertThat(result.getInsertionAnchor()).isEqualTo(InsertionAnchor.AFTER_COMPLEMENTO);
        }
    }

    @Nested
    @DisplayName("Plantilla de muestra y namespace")
    class SampleTemplateTests {

        @Test
        @DisplayName("Sin plantillas ni CFDI: plantilla básica con el namespace del tipo")
        void plantilla_basica() throws Exception {
            var walmart = new AddendaType("Walmart", "1.0", "urn:walmart", null, List.of());

            AddendaGenerationResult result = service.generate(AddendaGenerationRequest.builder()
                    .addendaType(walmart)
                    .build());

            assertThat(result.getTemplateName()).isEqualTo("Template Básico");
            assertThat(result.getAddendaXml()).startsWith("<Walmart xmlns=\"urn:walmart\">");
            assertThat(result.isCfdiDataUsed()).isFalse();
            assertThat(result.getValidationReport()).isNull();
        }
    }

    @Nested
    @DisplayName("Errores")
    class ErrorTests {

        @Test
        @DisplayName("CFDI sin estructura mínima → CfdiStructureException")
        void estructura_invalida() {
            String cfdi = "<cfdi:Comprobante xmlns:cfdi=\"http://www.sat.gob.mx/cfd/4\" Version=\"3.3\"/>";

            assertThatThrownBy(() -> service.generate(pedidoRequest("normal").cfdiXml(cfdi).build()))
                    .isInstanceOf(CfdiStructureException.class)
                    .hasMessage("CFDI debe ser versión 4.0 (versión encontrada: 3.3)");
            assertThat(registry.get("addenda_generations_total").tag("result", "failure").counter().count())
                    .isEqualTo(1.0);
        }

        @Test
        @DisplayName("Estructura incompleta tolerada si no se exige")
        void estructura_tolerada() throws Exception {
            String cfdi = "<cfdi:Comprobante xmlns:cfdi=\"http://www.sat.gob.mx/cfd/4\" Version=\"4.0\" Total=\"5.00\"/>";

            AddendaGenerationResult result = service.generate(pedidoRequest("normal")
                    .cfdiXml(cfdi)
                    .requireValidStructure(false)
                    .validateOutput(false)
                    .insertIntoCfdi(true)
                    .build());

            assertThat(result.getAddendaXml()).contains("<total>5.00</total>");
            assertThat(result.getInsertionAnchor()).isEqualTo(InsertionAnchor.END_OF_ROOT);
        }

        @Test
        @DisplayName("Campo obligatorio sin valor → InvalidAddendaDefinitionException")
        void campo_obligatorio() {
            var request = pedidoRequest("normal")
                    .fieldValues(List.of(ConfiguredFieldValue.fixed("tipo", "normal")))
                    .build();

            assertThatThrownBy(() -> service.generate(request))
                    .isInstanceOfSatisfying(InvalidAddendaDefinitionException.class, e ->
                            assertThat(e.getViolations()).containsExactly("Campo obligatorio faltante: Folio del pedido"));
        }

        @Test
        @DisplayName("Plantilla solicitada inexistente")
        void plantilla_inexistente() {
            assertThatThrownBy(() -> service.generate(pedidoRequest("normal").templateName("v9").build()))
                    .isInstanceOf(InvalidAddendaDefinitionException.class)
                    .hasMessage("Template no encontrado para Pedido: v9");
        }
    }
}
