package io.mersel.services.addenda.application.models;

/**
 * Tabla de namespaces que el parser CFDI usa para sus consultas.
 * <p>
 * Se inyecta en lugar de estar embebida en el código, de modo que una nueva versión
 * del esquema SAT solo requiera cambiar configuración.
 *
 * @param cfdiUri               namespace del comprobante (alias {@code cfdi})
 * @param tfdUri                namespace del TimbreFiscalDigital (alias {@code tfd})
 * @param requiredVersionPrefix prefijo que debe tener el atributo {@code Version}
 */
public record CfdiNamespaces(
        String cfdiUri,
        String tfdUri,
        String requiredVersionPrefix
) {

    public static final String CFDI_PREFIX = "cfdi";
    public static final String TFD_PREFIX = "tfd";

    /** CFDI 4.0 con TimbreFiscalDigital 1.1. */
    public static final CfdiNamespaces CFDI_40 = new CfdiNamespaces(
            "http://www.sat.gob.mx/cfd/4",
            "http://www.sat.gob.mx/TimbreFiscalDigital",
            "4.");

    public CfdiNamespaces {
        if (cfdiUri == null || cfdiUri.isBlank()) {
            throw new IllegalArgumentException("El namespace CFDI es obligatorio");
        }
        if (tfdUri == null || tfdUri.isBlank()) {
            throw new IllegalArgumentException("El namespace TimbreFiscalDigital es obligatorio");
        }
        if (requiredVersionPrefix == null) {
            requiredVersionPrefix = "";
        }
    }
}
