package io.mersel.services.addenda.application.models;

import io.mersel.services.addenda.application.interfaces.DynamicValueLookup;

import java.util.List;

/**
 * Solicitud de generación de una addenda.
 * <p>
 * Reúne el tipo de addenda, sus plantillas candidatas, la configuración de campos del cliente
 * y, opcionalmente, el CFDI timbrado del que se extraen datos y en el que se inserta el resultado.
 */
public class AddendaGenerationRequest {

    private final AddendaType addendaType;
    private final List<AddendaTemplate> templates;
    private final String templateName;
    private final List<ConfiguredFieldValue> fieldValues;
    private final DynamicValueLookup dynamicLookup;
    private final String cfdiXml;
    private final boolean insertIntoCfdi;
    private final boolean validateOutput;
    private final boolean requireValidStructure;

    private AddendaGenerationRequest(Builder builder) {
        this.addendaType = builder.addendaType;
        this.templates = List.copyOf(builder.templates);
        this.templateName = builder.templateName;
        this.fieldValues = List.copyOf(builder.fieldValues);
        this.dynamicLookup = builder.dynamicLookup != null ? builder.dynamicLookup : DynamicValueLookup.NONE;
        this.cfdiXml = builder.cfdiXml;
        this.insertIntoCfdi = builder.insertIntoCfdi;
        this.validateOutput = builder.validateOutput;
        this.requireValidStructure = builder.requireValidStructure;
    }

    public AddendaType getAddendaType() {
        return addendaType;
    }

    /** Plantillas registradas para el tipo. */
    public List<AddendaTemplate> getTemplates() {
        return templates;
    }

    /** Plantilla solicitada explícitamente; {@code null} para usar la de por defecto. */
    public String getTemplateName() {
        return templateName;
    }

    public List<ConfiguredFieldValue> getFieldValues() {
        return fieldValues;
    }

    public DynamicValueLookup getDynamicLookup() {
        return dynamicLookup;
    }

    /** CFDI timbrado; {@code null} si se genera sin comprobante. */
    public String getCfdiXml() {
        return cfdiXml;
    }

    public boolean hasCfdi() {
        return cfdiXml != null && !cfdiXml.isBlank();
    }

    public boolean isInsertIntoCfdi() {
        return insertIntoCfdi;
    }

    /** Validar la addenda contra el XSD del tipo (si lo tiene). */
    public boolean isValidateOutput() {
        return validateOutput;
    }

    /**
     * Si es {@code true}, un CFDI sin la estructura mínima aborta la generación con
     * {@code CfdiStructureException}; si es {@code false} solo se registra una advertencia.
     */
    public boolean isRequireValidStructure() {
        return requireValidStructure;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private AddendaType addendaType;
        private List<AddendaTemplate> templates = List.of();
        private String templateName;
        private List<ConfiguredFieldValue> fieldValues = List.of();
        private DynamicValueLookup dynamicLookup;
        private String cfdiXml;
        private boolean insertIntoCfdi;
        private boolean validateOutput = true;
        private boolean requireValidStructure = true;

        private Builder() {
        }

        public Builder addendaType(AddendaType addendaType) {
            this.addendaType = addendaType;
            return this;
        }

        public Builder templates(List<AddendaTemplate> templates) {
            this.templates = templates != null ? templates : List.of();
            return this;
        }

        public Builder templateName(String templateName) {
            this.templateName = templateName;
            return this;
        }

        public Builder fieldValues(List<ConfiguredFieldValue> fieldValues) {
            this.fieldValues = fieldValues != null ? fieldValues : List.of();
            return this;
        }

        public Builder dynamicLookup(DynamicValueLookup dynamicLookup) {
            this.dynamicLookup = dynamicLookup;
            return this;
        }

        public Builder cfdiXml(String cfdiXml) {
            this.cfdiXml = cfdiXml;
            return this;
        }

        public Builder insertIntoCfdi(boolean insertIntoCfdi) {
            this.insertIntoCfdi = insertIntoCfdi;
            return this;
        }

        public Builder validateOutput(boolean validateOutput) {
            this.validateOutput = validateOutput;
            return this;
        }

        public Builder requireValidStructure(boolean requireValidStructure) {
            this.requireValidStructure = requireValidStructure;
            return this;
        }

        public AddendaGenerationRequest build() {
            if (addendaType == null) {
                throw new IllegalStateException("addendaType es obligatorio");
            }
            return new AddendaGenerationRequest(this);
        }
    }
}
