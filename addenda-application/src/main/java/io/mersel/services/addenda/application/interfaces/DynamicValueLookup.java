package io.mersel.services.addenda.application.interfaces;

import io.mersel.services.addenda.application.models.DynamicFieldSource;

import java.util.Optional;

/**
 * Lectura de valores dinámicos de objetos fuente (factura de venta, cliente, ...).
 * <p>
 * La implementa el llamador; este núcleo no accede a ningún almacenamiento.
 */
@FunctionalInterface
public interface DynamicValueLookup {

    /** Sin fuentes: siempre vacío. */
    DynamicValueLookup NONE = source -> Optional.empty();

    /**
     * @param source objeto fuente y atributo a leer
     * @return el valor, o vacío si la fuente no lo tiene
     */
    Optional<Object> lookup(DynamicFieldSource source);
}
