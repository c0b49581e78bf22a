package io.mersel.services.addenda.application.interfaces;

import io.mersel.services.addenda.application.enums.InsertionAnchor;
import io.mersel.services.addenda.application.models.CfdiLineItem;
import io.mersel.services.addenda.application.models.ExistingAddenda;
import io.mersel.services.addenda.application.models.InsertionPoint;
import io.mersel.services.addenda.application.models.StructureCheck;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * CFDI parseado. Se puede leer cuantas veces se quiera; admite una sola inserción.
 */
public interface ICfdiDocument {

    /**
     * Datos planos del comprobante: atributos de Comprobante, UUID del timbre,
     * emisor, receptor y primer concepto. Los atributos ausentes se devuelven como cadena vacía.
     */
    Map<String, String> extractData();

    /** Todos los conceptos con sus traslados y retenciones. */
    List<CfdiLineItem> extractLineItems();

    /**
     * Posición del {@code cfdi:Addenda}: tras {@code Complemento}, si no tras {@code Conceptos},
     * si no al final de la raíz.
     */
    InsertionPoint findInsertionPoint();

    /**
     * Inserta el fragmento dentro del {@code cfdi:Addenda} (creándolo si no existe)
     * y devuelve el CFDI serializado con declaración XML.
     *
     * @throws InputTooLargeException si el fragmento excede el tamaño máximo
     * @throws MalformedXmlException  si el fragmento no es XML bien formado
     * @throws IllegalStateException  si el documento ya recibió una inserción
     */
    String insert(String addendaXml) throws InputTooLargeException, MalformedXmlException;

    /** Ancla que se usó en la inserción; vacío si aún no se insertó. */
    Optional<InsertionAnchor> insertedAt();

    StructureCheck validateStructure();

    /** {@code true} si existe un {@code Addenda} con al menos un elemento hijo. */
    boolean hasAddenda();

    List<ExistingAddenda> existingAddendas();

    /** Serialización actual con declaración XML y sangría. */
    String toXml();
}
