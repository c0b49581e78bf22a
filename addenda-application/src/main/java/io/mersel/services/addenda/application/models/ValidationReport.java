package io.mersel.services.addenda.application.models;

import java.time.Instant;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Reporte de validación XSD de un documento.
 * <p>
 * Invariante: {@code valid} es {@code true} si y solo si la lista de errores está vacía.
 * Las sugerencias, cuando se calculan, son no vacías exactamente cuando el documento es inválido.
 */
public class ValidationReport {

    private final boolean valid;
    private final List<ValidationIssue> errors;
    private final List<ValidationIssue> warnings;
    private final List<String> suggestions;
    private final SchemaInfo schemaInfo;
    private final Instant timestamp;
    private final Integer fileIndex;

    private ValidationReport(Builder builder) {
        this.errors = List.copyOf(builder.errors);
        this.warnings = List.copyOf(builder.warnings);
        this.valid = this.errors.isEmpty();
        this.suggestions = List.copyOf(builder.suggestions);
        this.schemaInfo = builder.schemaInfo;
        this.timestamp = builder.timestamp != null ? builder.timestamp : Instant.now();
        this.fileIndex = builder.fileIndex;
    }

    public boolean isValid() {
        return valid;
    }

    public List<ValidationIssue> getErrors() {
        return errors;
    }

    public List<ValidationIssue> getWarnings() {
        return warnings;
    }

    /** Sugerencias de corrección; vacía si no se solicitaron o el documento es válido. */
    public List<String> getSuggestions() {
        return suggestions;
    }

    /** Información del esquema; {@code null} si no se solicitó. */
    public SchemaInfo getSchemaInfo() {
        return schemaInfo;
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    /** Posición del archivo en una validación múltiple; {@code null} para validaciones sueltas. */
    public Integer getFileIndex() {
        return fileIndex;
    }

    public int getErrorCount() {
        return errors.size();
    }

    public int getWarningCount() {
        return warnings.size();
    }

    /** Mensajes amigables de los errores, con posición cuando existe. */
    public List<String> errorMessages() {
        return errors.stream().map(ValidationIssue::describe).toList();
    }

    /**
     * Resumen textual: {@code "XML válido"} o los errores unidos por {@code "; "}.
     */
    public String errorSummary() {
        if (valid) {
            return "XML válido";
        }
        return errors.stream().map(ValidationIssue::describe).collect(Collectors.joining("; "));
    }

    public Builder toBuilder() {
        return new Builder()
                .errors(errors)
                .warnings(warnings)
                .suggestions(suggestions)
                .schemaInfo(schemaInfo)
                .timestamp(timestamp)
                .fileIndex(fileIndex);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private List<ValidationIssue> errors = List.of();
        private List<ValidationIssue> warnings = List.of();
        private List<String> suggestions = List.of();
        private SchemaInfo schemaInfo;
        private Instant timestamp;
        private Integer fileIndex;

        private Builder() {
        }

        public Builder errors(List<ValidationIssue> errors) {
            this.errors = errors != null ? errors : List.of();
            return this;
        }

        public Builder warnings(List<ValidationIssue> warnings) {
            this.warnings = warnings != null ? warnings : List.of();
            return this;
        }

        public Builder suggestions(List<String> suggestions) {
            this.suggestions = suggestions != null ? suggestions : List.of();
            return this;
        }

        public Builder schemaInfo(SchemaInfo schemaInfo) {
            this.schemaInfo = schemaInfo;
            return this;
        }

        public Builder timestamp(Instant timestamp) {
            this.timestamp = timestamp;
            return this;
        }

        public Builder fileIndex(Integer fileIndex) {
            this.fileIndex = fileIndex;
            return this;
        }

        public ValidationReport build() {
            return new ValidationReport(this);
        }
    }
}
