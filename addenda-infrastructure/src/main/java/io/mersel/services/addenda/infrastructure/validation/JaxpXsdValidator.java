package io.mersel.services.addenda.infrastructure.validation;

import io.mersel.services.addenda.application.interfaces.IXsdValidator;
import io.mersel.services.addenda.application.interfaces.InputTooLargeException;
import io.mersel.services.addenda.application.interfaces.MalformedXmlException;
import io.mersel.services.addenda.application.models.SchemaInfo;
import io.mersel.services.addenda.application.models.ValidationIssue;
import io.mersel.services.addenda.application.models.ValidationReport;
import io.mersel.services.addenda.infrastructure.SecureXml;
import io.mersel.services.addenda.infrastructure.diagnostics.AddendaMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.xml.sax.ErrorHandler;
import org.xml.sax.SAXException;
import org.xml.sax.SAXNotRecognizedException;
import org.xml.sax.SAXNotSupportedException;
import org.xml.sax.SAXParseException;

import javax.xml.XMLConstants;
import javax.xml.transform.stream.StreamSource;
import javax.xml.validation.Schema;
import javax.xml.validation.Validator;
import java.io.IOException;
import java.io.StringReader;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Validador JAXP ligado a un esquema ya compilado.
 * <p>
 * Inmutable: el {@link Schema} de JAXP es seguro entre hilos y cada llamada crea su
 * propio {@link Validator} y sus propias listas de errores.
 * <p>
 * Antes de validar, el XML pasa por el parser endurecido de {@link SecureXml}: un
 * documento con DOCTYPE, mal formado o demasiado grande se reporta como error del
 * reporte y nunca llega al validador de esquema.
 */
final class JaxpXsdValidator implements IXsdValidator {

    private static final Logger log = LoggerFactory.getLogger(JaxpXsdValidator.class);

    private static final String XERCES_LOCALE_PROPERTY = "http://apache.org/xml/properties/locale";

    private final Schema schema;
    private final SchemaInfo schemaInfo;
    private final long maxDocumentBytes;
    private final AddendaMetrics metrics;

    JaxpXsdValidator(Schema schema, SchemaInfo schemaInfo, long maxDocumentBytes, AddendaMetrics metrics) {
        this.schema = schema;
        this.schemaInfo = schemaInfo;
        this.maxDocumentBytes = maxDocumentBytes;
        this.metrics = metrics;
    }

    @Override
    public boolean validate(String xml) {
        return validateWithDetails(xml).isValid();
    }

    @Override
    public ValidationReport validateWithDetails(String xml) {
        long startTime = System.currentTimeMillis();
        var collector = new IssueCollector();

        try {
            SecureXml.checkSize(xml, maxDocumentBytes);
            SecureXml.parse(xml, "El XML");
        } catch (InputTooLargeException e) {
            collector.addError(-1, -1, e.getMessage());
            return finish(collector, "error", startTime);
        } catch (MalformedXmlException e) {
            collector.addError(e.getLineNumber(), e.getColumnNumber(), e.getMessage());
            return finish(collector, "error", startTime);
        }

        Validator validator = schema.newValidator();
        try {
            validator.setProperty(XMLConstants.ACCESS_EXTERNAL_DTD, "");
            validator.setProperty(XMLConstants.ACCESS_EXTERNAL_SCHEMA, "");
        } catch (SAXNotRecognizedException | SAXNotSupportedException e) {
            log.warn("El validador no soporta las propiedades de protección XXE");
        }
        try {
            validator.setProperty(XERCES_LOCALE_PROPERTY, Locale.ENGLISH);
        } catch (SAXNotRecognizedException | SAXNotSupportedException e) {
            log.debug("El validador no soporta la propiedad de locale");
        }
        validator.setErrorHandler(collector);

        try {
            validator.validate(new StreamSource(new StringReader(xml)));
        } catch (SAXParseException e) {
            // Xerces relanza el error fatal que ya pasó por el ErrorHandler
            if (!collector.alreadyRecorded(e)) {
                collector.addError(e.getLineNumber(), e.getColumnNumber(), e.getMessage());
            }
        } catch (SAXException | IOException e) {
            collector.addError(-1, -1, "Error de validación de esquema: " + e.getMessage());
            log.warn("Validación XSD interrumpida: {}", e.getMessage());
            return finish(collector, "error", startTime);
        }

        return finish(collector, collector.errors.isEmpty() ? "valid" : "invalid", startTime);
    }

    @Override
    public SchemaInfo getSchemaInfo() {
        return schemaInfo;
    }

    @Override
    public List<String> suggestFixes(String xml) {
        ValidationReport report = validateWithDetails(xml);
        return report.isValid() ? List.of() : XsdFixAdvisor.suggest(report.getErrors());
    }

    @Override
    public ValidationReport createValidationReport(String xml, boolean includeSchemaInfo) {
        ValidationReport details = validateWithDetails(xml);
        return details.toBuilder()
                .suggestions(details.isValid() ? List.of() : XsdFixAdvisor.suggest(details.getErrors()))
                .schemaInfo(includeSchemaInfo ? schemaInfo : null)
                .build();
    }

    @Override
    public List<ValidationReport> validateMultipleFiles(List<String> xmlDocuments) {
        var reports = new ArrayList<ValidationReport>(xmlDocuments.size());
        for (int i = 0; i < xmlDocuments.size(); i++) {
            reports.add(createValidationReport(xmlDocuments.get(i), false).toBuilder()
                    .fileIndex(i)
                    .build());
        }
        return reports;
    }

    private ValidationReport finish(IssueCollector collector, String result, long startTime) {
        long elapsed = System.currentTimeMillis() - startTime;
        metrics.recordValidation(result, elapsed);
        log.debug("Validación XSD: {} ({} errores, {} advertencias, {} ms)",
                result, collector.errors.size(), collector.warnings.size(), elapsed);
        return ValidationReport.builder()
                .errors(collector.errors)
                .warnings(collector.warnings)
                .build();
    }

    /**
     * Acumula errores y advertencias de una sola llamada.
     */
    private static final class IssueCollector implements ErrorHandler {

        private final List<ValidationIssue> errors = new ArrayList<>();
        private final List<ValidationIssue> warnings = new ArrayList<>();
        private SAXParseException lastFatal;

        @Override
        public void warning(SAXParseException e) {
            warnings.add(toIssue(e.getLineNumber(), e.getColumnNumber(), e.getMessage()));
        }

        @Override
        public void error(SAXParseException e) {
            errors.add(toIssue(e.getLineNumber(), e.getColumnNumber(), e.getMessage()));
        }

        @Override
        public void fatalError(SAXParseException e) {
            lastFatal = e;
            errors.add(toIssue(e.getLineNumber(), e.getColumnNumber(), e.getMessage()));
        }

        void addError(int line, int column, String message) {
            errors.add(toIssue(line, column, message));
        }

        boolean alreadyRecorded(SAXParseException e) {
            return lastFatal != null
                    && lastFatal.getLineNumber() == e.getLineNumber()
                    && lastFatal.getColumnNumber() == e.getColumnNumber()
                    && String.valueOf(lastFatal.getMessage()).equals(e.getMessage());
        }

        private static ValidationIssue toIssue(int line, int column, String message) {
            return new ValidationIssue(line, column, message, XsdErrorHumanizer.humanize(message));
        }
    }
}
