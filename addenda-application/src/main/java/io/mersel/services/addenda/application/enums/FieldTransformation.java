package io.mersel.services.addenda.application.enums;

/**
 * Transformación aplicada a un valor configurado de campo antes de entrar al contexto.
 */
public enum FieldTransformation {
    NONE,
    UPPERCASE,
    LOWERCASE,
    TITLE,
    TRIM,
    /** Número con 2 decimales; si el valor no es numérico se deja intacto. */
    NUMBER_FORMAT,
    /** Fecha {@code yyyy-MM-dd}; si el valor no es fecha se deja intacto. */
    DATE_FORMAT
}
