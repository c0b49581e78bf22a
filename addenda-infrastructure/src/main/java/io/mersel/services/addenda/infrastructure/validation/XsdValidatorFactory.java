package io.mersel.services.addenda.infrastructure.validation;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import io.mersel.services.addenda.application.interfaces.IXsdValidator;
import io.mersel.services.addenda.application.interfaces.IXsdValidatorFactory;
import io.mersel.services.addenda.application.interfaces.MalformedXmlException;
import io.mersel.services.addenda.application.interfaces.SchemaCompilationException;
import io.mersel.services.addenda.application.models.ValidationIssue;
import io.mersel.services.addenda.application.models.ValidationReport;
import io.mersel.services.addenda.infrastructure.SecureXml;
import io.mersel.services.addenda.infrastructure.config.AddendaProperties;
import io.mersel.services.addenda.infrastructure.diagnostics.AddendaMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.w3c.dom.Document;
import org.xml.sax.SAXException;

import javax.xml.transform.stream.StreamSource;
import javax.xml.validation.Schema;
import java.io.StringReader;
import java.time.Duration;
import java.util.List;

/**
 * Compila esquemas XSD y entrega validadores inmutables.
 * <p>
 * Los validadores se guardan en una caché Caffeine indexada por el texto del esquema,
 * con tamaño máximo y TTL configurables ({@code addenda.cache.*}). Un esquema que no
 * compila nunca entra en la caché.
 */
@Service
public class XsdValidatorFactory implements IXsdValidatorFactory {

    private static final Logger log = LoggerFactory.getLogger(XsdValidatorFactory.class);

    private final AddendaProperties properties;
    private final AddendaMetrics metrics;
    private final Cache<String, IXsdValidator> validatorCache;

    public XsdValidatorFactory(AddendaProperties properties, AddendaMetrics metrics) {
        this.properties = properties;
        this.metrics = metrics;
        this.validatorCache = Caffeine.newBuilder()
                .maximumSize(properties.getCache().getSchemaMaxSize())
                .expireAfterWrite(Duration.ofHours(properties.getCache().getSchemaTtlHours()))
                .build();
        metrics.registerSchemaCacheSizeGauge(validatorCache);
    }

    @Override
    public IXsdValidator create(String xsdSchema) throws SchemaCompilationException {
        if (xsdSchema == null || xsdSchema.isBlank()) {
            throw new SchemaCompilationException("El esquema XSD está vacío", null);
        }
        IXsdValidator cached = validatorCache.getIfPresent(xsdSchema);
        if (cached != null) {
            return cached;
        }
        IXsdValidator compiled = compile(xsdSchema);
        validatorCache.put(xsdSchema, compiled);
        return compiled;
    }

    @Override
    public ValidationReport validateAgainst(String xml, String xsdSchema) {
        try {
            return create(xsdSchema).createValidationReport(xml, false);
        } catch (SchemaCompilationException e) {
            log.warn("Validación puntual sin esquema utilizable: {}", e.getMessage());
            return ValidationReport.builder()
                    .errors(List.of(new ValidationIssue(-1, -1, e.getMessage(), e.getMessage())))
                    .suggestions(List.of("Corregir el esquema XSD antes de validar documentos"))
                    .build();
        }
    }

    /** Número de validadores en caché. */
    public long cachedCount() {
        return validatorCache.estimatedSize();
    }

    private IXsdValidator compile(String xsdSchema) throws SchemaCompilationException {
        long startTime = System.currentTimeMillis();
        try {
            Document xsdDocument = SecureXml.parse(xsdSchema, "El esquema XSD");
            Schema schema = SecureXml.newSchemaFactory().newSchema(new StreamSource(new StringReader(xsdSchema)));

            long elapsed = System.currentTimeMillis() - startTime;
            metrics.recordSchemaCompilation(true, elapsed);
            log.info("Esquema XSD compilado en {} ms", elapsed);

            return new JaxpXsdValidator(schema, SchemaIntrospector.introspect(xsdDocument),
                    properties.maxDocumentBytes(), metrics);
        } catch (MalformedXmlException e) {
            metrics.recordSchemaCompilation(false, System.currentTimeMillis() - startTime);
            throw new SchemaCompilationException(e.getMessage(), e);
        } catch (SAXException e) {
            metrics.recordSchemaCompilation(false, System.currentTimeMillis() - startTime);
            log.warn("Esquema XSD inválido: {}", e.getMessage());
            throw new SchemaCompilationException("El esquema XSD no es válido: " + e.getMessage(), e);
        }
    }
}
