package io.mersel.services.addenda.infrastructure.validation;

/**
 * Códigos de error de Xerces que el servicio sabe interpretar.
 */
enum XsdErrorCode {
    /** cvc-complex-type.2.4.a: elemento fuera de lugar. */
    UNEXPECTED_ELEMENT,
    /** cvc-complex-type.2.4.b: falta un elemento obligatorio al final del contenido. */
    INCOMPLETE_CONTENT,
    /** cvc-complex-type.2.4.d: sobra un elemento. */
    NO_CHILD_EXPECTED,
    /** cvc-type.3.1.3 */
    INVALID_VALUE,
    /** cvc-datatype-valid.1.2.1 */
    INVALID_DATATYPE,
    /** cvc-enumeration-valid */
    ENUMERATION,
    /** cvc-pattern-valid */
    PATTERN,
    /** cvc-minLength-valid */
    TOO_SHORT,
    /** cvc-maxLength-valid */
    TOO_LONG,
    /** cvc-complex-type.2.2 */
    TEXT_ONLY,
    /** cvc-complex-type.2.3 */
    NO_TEXT_ALLOWED,
    /** cvc-complex-type.3.2.2 */
    ATTRIBUTE_NOT_ALLOWED,
    /** cvc-complex-type.4 */
    ATTRIBUTE_REQUIRED,
    /** cvc-elt.1: elemento sin declaración, normalmente un namespace incorrecto. */
    UNDECLARED_ELEMENT
}
