package io.mersel.services.addenda.infrastructure.config;

import io.mersel.services.addenda.application.enums.ResolutionMode;
import io.mersel.services.addenda.application.interfaces.IAddendaGenerationService;
import io.mersel.services.addenda.application.interfaces.ICfdiParser;
import io.mersel.services.addenda.application.interfaces.ITemplateInspector;
import io.mersel.services.addenda.application.interfaces.ITemplateRenderer;
import io.mersel.services.addenda.application.interfaces.IVariableResolver;
import io.mersel.services.addenda.application.interfaces.IXsdValidatorFactory;
import io.mersel.services.addenda.application.models.CfdiNamespaces;
import io.micrometer.core.instrument.MeterRegistry;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("InfrastructureConfig")
class InfrastructureConfigTest {

    private final ApplicationContextRunner contextRunner = new ApplicationContextRunner()
            .withUserConfiguration(InfrastructureConfig.class);

    @Test
    @DisplayName("Publica todos los servicios del núcleo")
    void publica_servicios() {
        contextRunner.run(context -> {
            assertThat(context).hasNotFailed();
            assertThat(context).hasSingleBean(IVariableResolver.class);
            assertThat(context).hasSingleBean(ITemplateRenderer.class);
            assertThat(context).hasSingleBean(ITemplateInspector.class);
            assertThat(context).hasSingleBean(ICfdiParser.class);
            assertThat(context).hasSingleBean(IXsdValidatorFactory.class);
            assertThat(context).hasSingleBean(IAddendaGenerationService.class);
            assertThat(context).hasSingleBean(MeterRegistry.class);
            assertThat(context.getBean(CfdiNamespaces.class)).isEqualTo(CfdiNamespaces.CFDI_40);
        });
    }

    @Test
    @DisplayName("Las propiedades addenda.* se aplican a los beans")
    void propiedades() {
        contextRunner
                .withPropertyValues(
                        "addenda.resolution.mode=STRICT",
                        "addenda.cfdi.required-version-prefix=5.",
                        "addenda.limits.max-document-size-mb=-3")
                .run(context -> {
                    assertThat(context.getBean(IVariableResolver.class).getMode()).isEqualTo(ResolutionMode.STRICT);
                    assertThat(context.getBean(CfdiNamespaces.class).requiredVersionPrefix()).isEqualTo("5.");
                    assertThat(context.getBean(AddendaProperties.class).maxDocumentBytes()).isEqualTo(5L * 1024 * 1024);
                });
    }

    @Test
    @DisplayName("Un Clock propio reemplaza al del sistema")
    void reloj_propio() {
        Clock fixed = Clock.fixed(Instant.parse("2025-01-01T00:00:00Z"), ZoneOffset.UTC);

        contextRunner
                .withBean(Clock.class, () -> fixed)
                .run(context -> assertThat(context.getBean(Clock.class)).isSameAs(fixed));
    }
}
