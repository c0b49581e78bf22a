package io.mersel.services.addenda.application.models;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Impuesto trasladado o retenido de un concepto.
 */
public record CfdiTax(
        String base,
        String taxCode,
        String factorType,
        String rate,
        String amount
) {

    /** Vista con las claves que usan las plantillas ({@code impuesto}, {@code importe}, ...). */
    public Map<String, Object> toVariableMap() {
        var map = new LinkedHashMap<String, Object>();
        map.put("base", nullToEmpty(base));
        map.put("impuesto", nullToEmpty(taxCode));
        map.put("tipo_factor", nullToEmpty(factorType));
        map.put("tasa_cuota", nullToEmpty(rate));
        map.put("importe", nullToEmpty(amount));
        return map;
    }

    static String nullToEmpty(String value) {
        return value == null ? "" : value;
    }
}
