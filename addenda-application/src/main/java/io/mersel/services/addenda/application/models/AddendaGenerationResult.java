package io.mersel.services.addenda.application.models;

import io.mersel.services.addenda.application.enums.InsertionAnchor;

import java.util.Map;

/**
 * Resultado de generar una addenda.
 */
public class AddendaGenerationResult {

    private final String addendaXml;
    private final String cfdiXml;
    private final String templateName;
    private final Map<String, String> fieldValues;
    private final boolean cfdiDataUsed;
    private final InsertionAnchor insertionAnchor;
    private final ValidationReport validationReport;
    private final long durationMs;

    private AddendaGenerationResult(Builder builder) {
        this.addendaXml = builder.addendaXml;
        this.cfdiXml = builder.cfdiXml;
        this.templateName = builder.templateName;
        this.fieldValues = builder.fieldValues != null ? Map.copyOf(builder.fieldValues) : Map.of();
        this.cfdiDataUsed = builder.cfdiDataUsed;
        this.insertionAnchor = builder.insertionAnchor;
        this.validationReport = builder.validationReport;
        this.durationMs = builder.durationMs;
    }

    /** XML de la addenda renderizada (sin declaración XML). */
    public String getAddendaXml() {
        return addendaXml;
    }

    /** CFDI con la addenda insertada; {@code null} si no se pidió inserción. */
    public String getCfdiXml() {
        return cfdiXml;
    }

    public String getTemplateName() {
        return templateName;
    }

    /** Valores de campos resueltos que alimentaron la plantilla. */
    public Map<String, String> getFieldValues() {
        return fieldValues;
    }

    public boolean isCfdiDataUsed() {
        return cfdiDataUsed;
    }

    /** Ancla usada al insertar; {@code null} si no hubo inserción. */
    public InsertionAnchor getInsertionAnchor() {
        return insertionAnchor;
    }

    /** Reporte XSD; {@code null} si el tipo no tiene esquema o no se pidió validar. */
    public ValidationReport getValidationReport() {
        return validationReport;
    }

    public boolean isValid() {
        return validationReport == null || validationReport.isValid();
    }

    public long getDurationMs() {
        return durationMs;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String addendaXml;
        private String cfdiXml;
        private String templateName;
        private Map<String, String> fieldValues;
        private boolean cfdiDataUsed;
        private InsertionAnchor insertionAnchor;
        private ValidationReport validationReport;
        private long durationMs;

        private Builder() {
        }

        public Builder addendaXml(String addendaXml) {
            this.addendaXml = addendaXml;
            return this;
        }

        public Builder cfdiXml(String cfdiXml) {
            this.cfdiXml = cfdiXml;
            return this;
        }

        public Builder templateName(String templateName) {
            this.templateName = templateName;
            return this;
        }

        public Builder fieldValues(Map<String, String> fieldValues) {
            this.fieldValues = fieldValues;
            return this;
        }

        public Builder cfdiDataUsed(boolean cfdiDataUsed) {
            this.cfdiDataUsed = cfdiDataUsed;
            return this;
        }

        public Builder insertionAnchor(InsertionAnchor insertionAnchor) {
            this.insertionAnchor = insertionAnchor;
            return this;
        }

        public Builder validationReport(ValidationReport validationReport) {
            this.validationReport = validationReport;
            return this;
        }

        public Builder durationMs(long durationMs) {
            this.durationMs = durationMs;
            return this;
        }

        public AddendaGenerationResult build() {
            return new AddendaGenerationResult(this);
        }
    }
}
