package io.mersel.services.addenda.infrastructure.generation;

import io.mersel.services.addenda.application.interfaces.ICfdiDocument;
import io.mersel.services.addenda.application.models.CfdiNamespaces;
import io.mersel.services.addenda.application.models.VariableContext;
import io.mersel.services.addenda.infrastructure.TestFixtures;
import io.mersel.services.addenda.infrastructure.cfdi.DomCfdiParser;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("VariableContextFactory")
class VariableContextFactoryTest {

    private VariableContextFactory factory;

    @BeforeEach
    void setUp() {
        Clock clock = Clock.fixed(Instant.parse("2025-03-05T08:09:10Z"), ZoneOffset.UTC);
        factory = new VariableContextFactory(clock);
    }

    @Test
    @DisplayName("Variables de sistema desde el reloj inyectado")
    void variables_de_sistema() {
        assertThat(factory.systemVariables()).containsExactly(
                Map.entry("current_date", "2025-03-05"),
                Map.entry("current_datetime", "2025-03-05T08:09:10"),
                Map.entry("current_time", "08:09:10"),
                Map.entry("current_year", "2025"),
                Map.entry("current_month", "03"),
                Map.entry("current_day", "05"));
    }

    @Test
    @DisplayName("Sin CFDI: sistema y campos")
    void sin_cfdi() {
        VariableContext context = factory.create(Map.of("proveedor", "ACME"), null);

        assertThat(context.lookup("proveedor")).contains("ACME");
        assertThat(context.lookup("current_year")).contains("2025");
        assertThat(context.lookup("cfdi_uuid")).isEmpty();
    }

    @Test
    @DisplayName("Con CFDI: datos planos y lista de conceptos")
    void con_cfdi() throws Exception {
        var parser = new DomCfdiParser(CfdiNamespaces.CFDI_40, TestFixtures.properties(), TestFixtures.metrics());
        ICfdiDocument cfdi = parser.parse(TestFixtures.read("cfdi-timbrado.xml"));

        VariableContext context = factory.create(Map.of(), cfdi);

        assertThat(context.lookup("cfdi_uuid")).contains("ABC-123");
        assertThat(context.lookup(VariableContextFactory.LINE_ITEMS_KEY)).hasValueSatisfying(value -> {
            assertThat(value).isInstanceOf(List.class);
            List<?> conceptos = (List<?>) value;
            assertThat(conceptos).hasSize(2);
            assertThat(((Map<?, ?>) conceptos.get(0)).get("descripcion")).isEqualTo("Laptop");
        });
    }

    @Test
    @DisplayName("Los datos del CFDI prevalecen sobre campos con la misma clave")
    void prioridad_cfdi() throws Exception {
        var parser = new DomCfdiParser(CfdiNamespaces.CFDI_40, TestFixtures.properties(), TestFixtures.metrics());
        ICfdiDocument cfdi = parser.parse(TestFixtures.read("cfdi-timbrado.xml"));

        VariableContext context = factory.create(Map.of("cfdi_total", "1.00", "current_year", "1999"), cfdi);

        assertThat(context.lookup("cfdi_total")).contains("1160.00");
        assertThat(context.lookup("current_year")).contains("1999");
    }
}
