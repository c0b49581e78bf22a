package io.mersel.services.addenda.application.models;

/**
 * Elemento con nombre declarado en un esquema.
 *
 * @param name      nombre declarado
 * @param type      atributo {@code type}; cadena vacía para tipos anónimos
 * @param minOccurs valor declarado o {@code "1"}
 * @param maxOccurs valor declarado o {@code "1"}
 */
public record SchemaElementInfo(String name, String type, String minOccurs, String maxOccurs) {

    public boolean isRequired() {
        return !"0".equals(minOccurs);
    }
}
