package io.mersel.services.addenda.application.models;

/**
 * Resultado de la verificación estructural de un CFDI.
 *
 * @param valid  si la estructura mínima está presente
 * @param reason motivo legible cuando {@code valid} es {@code false}; {@code null} en caso contrario
 */
public record StructureCheck(boolean valid, String reason) {

    private static final StructureCheck OK = new StructureCheck(true, null);

    public static StructureCheck ok() {
        return OK;
    }

    public static StructureCheck invalid(String reason) {
        return new StructureCheck(false, reason);
    }
}
