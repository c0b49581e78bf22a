package io.mersel.services.addenda.application.models;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static io.mersel.services.addenda.application.models.CfdiTax.nullToEmpty;

/**
 * Concepto ({@code cfdi:Concepto}) del comprobante.
 *
 * @param lineNumber numeración a partir de 1 en orden de documento
 */
public record CfdiLineItem(
        int lineNumber,
        String quantity,
        String unit,
        String unitCode,
        String description,
        String unitValue,
        String amount,
        String productServiceCode,
        String identificationNumber,
        String discount,
        List<CfdiTax> transferredTaxes,
        List<CfdiTax> withheldTaxes
) {

    public CfdiLineItem {
        transferredTaxes = transferredTaxes == null ? List.of() : List.copyOf(transferredTaxes);
        withheldTaxes = withheldTaxes == null ? List.of() : List.copyOf(withheldTaxes);
    }

    /**
     * Vista con las claves en español que consumen las plantillas
     * ({@code conceptos.importe}, {@code conceptos.impuestos.traslados}, ...).
     */
    public Map<String, Object> toVariableMap() {
        var map = new LinkedHashMap<String, Object>();
        map.put("line_number", lineNumber);
        map.put("cantidad", nullToEmpty(quantity));
        map.put("unidad", nullToEmpty(unit));
        map.put("clave_unidad", nullToEmpty(unitCode));
        map.put("descripcion", nullToEmpty(description));
        map.put("valor_unitario", nullToEmpty(unitValue));
        map.put("importe", nullToEmpty(amount));
        map.put("clave_prodserv", nullToEmpty(productServiceCode));
        map.put("no_identificacion", nullToEmpty(identificationNumber));
        map.put("descuento", nullToEmpty(discount));

        var taxes = new LinkedHashMap<String, Object>();
        taxes.put("traslados", transferredTaxes.stream().map(CfdiTax::toVariableMap).toList());
        taxes.put("retenciones", withheldTaxes.stream().map(CfdiTax::toVariableMap).toList());
        map.put("impuestos", taxes);
        return map;
    }
}
