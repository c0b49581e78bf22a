package io.mersel.services.addenda.application.models;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Tabla única de variables disponible para una renderización.
 * <p>
 * Se construye fusionando tres capas en orden creciente de prioridad:
 * <ol>
 *   <li>variables de sistema ({@code current_date}, ...)</li>
 *   <li>valores de campos configurados</li>
 *   <li>datos extraídos del CFDI</li>
 * </ol>
 * Ante una colisión de clave gana la capa de mayor prioridad. Los valores {@code null}
 * se tratan como ausentes y no sobrescriben capas inferiores.
 * <p>
 * Sobre la capa CFDI se aplica {@link #CFDI_ALIASES}: si el dato de origen está presente
 * (p. ej. {@code uuid}) se publica también con su clave {@code cfdi_*}, salvo que la misma
 * capa ya traiga esa clave explícitamente.
 * <p>
 * La instancia es inmutable una vez construida.
 */
public final class VariableContext {

    /** Alias de datos CFDI → clave canónica usada por las plantillas. */
    public static final Map<String, String> CFDI_ALIASES = aliases();

    private static final VariableContext EMPTY = new VariableContext(Map.of());

    private final Map<String, Object> variables;

    private VariableContext(Map<String, Object> variables) {
        this.variables = variables;
    }

    public static VariableContext empty() {
        return EMPTY;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Valor crudo de la variable (texto, número, mapa o lista), si existe.
     */
    public Optional<Object> lookup(String key) {
        return Optional.ofNullable(variables.get(key));
    }

    public boolean contains(String key) {
        return variables.containsKey(key);
    }

    public Set<String> keys() {
        return variables.keySet();
    }

    /** Vista de solo lectura de todas las variables. */
    public Map<String, Object> asMap() {
        return variables;
    }

    public int size() {
        return variables.size();
    }

    @Override
    public String toString() {
        return "VariableContext" + variables.keySet();
    }

    private static Map<String, String> aliases() {
        var map = new LinkedHashMap<String, String>();
        map.put("uuid", "cfdi_uuid");
        map.put("fecha", "cfdi_fecha");
        map.put("total", "cfdi_total");
        map.put("subtotal", "cfdi_subtotal");
        map.put("impuestos", "cfdi_impuestos");
        return Collections.unmodifiableMap(map);
    }

    public static final class Builder {

        private Map<String, ?> systemVariables = Map.of();
        private Map<String, ?> fieldValues = Map.of();
        private Map<String, ?> cfdiData = Map.of();

        private Builder() {
        }

        public Builder systemVariables(Map<String, ?> systemVariables) {
            this.systemVariables = systemVariables != null ? systemVariables : Map.of();
            return this;
        }

        public Builder fieldValues(Map<String, ?> fieldValues) {
            this.fieldValues = fieldValues != null ? fieldValues : Map.of();
            return this;
        }

        public Builder cfdiData(Map<String, ?> cfdiData) {
            this.cfdiData = cfdiData != null ? cfdiData : Map.of();
            return this;
        }

        public VariableContext build() {
            var merged = new LinkedHashMap<String, Object>();
            putLayer(merged, systemVariables);
            putLayer(merged, fieldValues);
            putLayer(merged, withAliases(cfdiData));
            return new VariableContext(Collections.unmodifiableMap(merged));
        }

        private static void putLayer(Map<String, Object> target, Map<String, ?> layer) {
            layer.forEach((key, value) -> {
                if (key != null && value != null) {
                    target.put(key, value);
                }
            });
        }

        private static Map<String, ?> withAliases(Map<String, ?> cfdi) {
            if (cfdi.isEmpty()) {
                return cfdi;
            }
            var layer = new LinkedHashMap<String, Object>(cfdi);
            CFDI_ALIASES.forEach((source, alias) -> {
                Object value = cfdi.get(source);
                if (isPresent(value) && !cfdi.containsKey(alias)) {
                    layer.put(alias, value);
                }
            });
            return layer;
        }

        private static boolean isPresent(Object value) {
            if (value == null) return false;
            if (value instanceof CharSequence cs) return cs.length() > 0;
            return true;
        }
    }
}
