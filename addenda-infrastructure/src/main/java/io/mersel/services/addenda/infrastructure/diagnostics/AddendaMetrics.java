package io.mersel.services.addenda.infrastructure.diagnostics;

import com.github.benmanes.caffeine.cache.Cache;
import io.mersel.services.addenda.application.enums.InsertionAnchor;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Locale;

/**
 * Métricas propias del servicio de addendas.
 */
@Component
public class AddendaMetrics {

    private final MeterRegistry registry;

    public AddendaMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    /**
     * Registra una renderización de plantilla.
     *
     * @param result "success", "empty" o "error"
     */
    public void recordRender(String result) {
        Counter.builder("addenda_render_total")
                .tag("result", result)
                .description("Plantillas de addenda renderizadas")
                .register(registry)
                .increment();
    }

    /**
     * Registra una inserción de addenda en un CFDI.
     */
    public void recordInsertion(InsertionAnchor anchor) {
        Counter.builder("addenda_insert_total")
                .tag("anchor", anchor.name().toLowerCase(Locale.ROOT))
                .description("Addendas insertadas en CFDI")
                .register(registry)
                .increment();
    }

    /**
     * Registra una validación XSD.
     *
     * @param result     "valid", "invalid" o "error"
     * @param durationMs duración en milisegundos
     */
    public void recordValidation(String result, long durationMs) {
        Counter.builder("addenda_validations_total")
                .tag("result", result)
                .description("Validaciones XSD ejecutadas")
                .register(registry)
                .increment();

        Timer.builder("addenda_validation_duration")
                .description("Duración de la validación XSD")
                .register(registry)
                .record(Duration.ofMillis(durationMs));
    }

    /**
     * Registra una compilación de esquema XSD.
     *
     * @param success    si el esquema compiló
     * @param durationMs duración en milisegundos
     */
    public void recordSchemaCompilation(boolean success, long durationMs) {
        Counter.builder("addenda_schema_compilations_total")
                .tag("status", success ? "success" : "failure")
                .description("Esquemas XSD compilados")
                .register(registry)
                .increment();

        Timer.builder("addenda_schema_compilation_duration")
                .description("Duración de la compilación de esquemas XSD")
                .register(registry)
                .record(Duration.ofMillis(durationMs));
    }

    /**
     * Registra una generación completa.
     *
     * @param result "success" o "failure"
     */
    public void recordGeneration(String result, long durationMs) {
        Counter.builder("addenda_generations_total")
                .tag("result", result)
                .description("Generaciones de addenda")
                .register(registry)
                .increment();

        Timer.builder("addenda_generation_duration")
                .description("Duración de la generación de addenda")
                .register(registry)
                .record(Duration.ofMillis(durationMs));
    }

    /**
     * Gauge sobre el tamaño estimado de la caché de esquemas compilados.
     */
    public void registerSchemaCacheSizeGauge(Cache<?, ?> cache) {
        Gauge.builder("addenda_schema_cache_size", cache, c -> (double) c.estimatedSize())
                .description("Esquemas XSD compilados en caché")
                .register(registry);
    }
}
