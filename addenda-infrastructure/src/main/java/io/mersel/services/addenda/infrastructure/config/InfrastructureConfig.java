package io.mersel.services.addenda.infrastructure.config;

import io.mersel.services.addenda.application.models.CfdiNamespaces;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.ComponentScan;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Configuración Spring de la capa de infraestructura.
 * <p>
 * Escanea los componentes de render, parser CFDI, validación XSD y métricas, y publica
 * la tabla de namespaces CFDI y el reloj del sistema como beans.
 */
@Configuration
@ComponentScan(basePackages = "io.mersel.services.addenda.infrastructure")
@EnableConfigurationProperties(AddendaProperties.class)
public class InfrastructureConfig {

    @Bean
    @ConditionalOnMissingBean
    public Clock addendaClock(AddendaProperties properties) {
        return Clock.system(properties.zoneId());
    }

    @Bean
    @ConditionalOnMissingBean
    public CfdiNamespaces cfdiNamespaces(AddendaProperties properties) {
        return properties.toCfdiNamespaces();
    }

    // Sin actuator no hay registro de métricas autoconfigurado.
    @Bean
    @ConditionalOnMissingBean
    public MeterRegistry meterRegistry() {
        return new SimpleMeterRegistry();
    }
}
