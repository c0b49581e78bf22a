package io.mersel.services.addenda.infrastructure.validation;

import java.util.List;

/**
 * Mensaje de Xerces ya descompuesto, sin namespaces.
 *
 * @param code     tipo de error
 * @param subject  elemento (o atributo) principal del mensaje
 * @param value    valor ofensivo; cadena vacía si no aplica
 * @param expected elementos o valores esperados
 * @param detail   dato adicional (tipo XSD, límite de longitud, elemento contenedor)
 */
record XsdError(
        XsdErrorCode code,
        String subject,
        String value,
        List<String> expected,
        String detail
) {

    XsdError {
        expected = expected == null ? List.of() : List.copyOf(expected);
        subject = subject == null ? "" : subject;
        value = value == null ? "" : value;
        detail = detail == null ? "" : detail;
    }
}
