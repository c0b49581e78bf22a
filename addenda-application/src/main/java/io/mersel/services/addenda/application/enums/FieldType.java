package io.mersel.services.addenda.application.enums;

/**
 * Tipo de dato declarado para un campo de addenda.
 */
public enum FieldType {
    DATA,
    INT,
    FLOAT,
    DATE,
    DATETIME,
    CHECK
}
