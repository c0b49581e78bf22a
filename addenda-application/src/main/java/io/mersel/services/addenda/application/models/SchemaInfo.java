package io.mersel.services.addenda.application.models;

import java.util.List;

/**
 * Resumen introspectivo de un esquema XSD compilado, independiente de cualquier instancia XML.
 *
 * @param targetNamespace      namespace objetivo; cadena vacía si no declara
 * @param version              atributo {@code version} del esquema; cadena vacía si no declara
 * @param elementFormDefault   valor declarado o {@code "unqualified"}
 * @param attributeFormDefault valor declarado o {@code "unqualified"}
 * @param elements             todos los {@code xs:element} con nombre, en orden de documento
 * @param complexTypes         nombres de {@code xs:complexType}
 * @param simpleTypes          nombres de {@code xs:simpleType}
 */
public record SchemaInfo(
        String targetNamespace,
        String version,
        String elementFormDefault,
        String attributeFormDefault,
        List<SchemaElementInfo> elements,
        List<String> complexTypes,
        List<String> simpleTypes
) {

    public SchemaInfo {
        elements = elements == null ? List.of() : List.copyOf(elements);
        complexTypes = complexTypes == null ? List.of() : List.copyOf(complexTypes);
        simpleTypes = simpleTypes == null ? List.of() : List.copyOf(simpleTypes);
    }

    public List<String> elementNames() {
        return elements.stream().map(SchemaElementInfo::name).toList();
    }
}
