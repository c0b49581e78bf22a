package io.mersel.services.addenda.infrastructure.cfdi;

import io.mersel.services.addenda.application.models.CfdiNamespaces;
import org.w3c.dom.Element;

import javax.xml.XMLConstants;
import javax.xml.namespace.NamespaceContext;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Namespaces para las consultas XPath sobre un CFDI concreto.
 * <p>
 * El alias {@code cfdi} apunta al namespace por defecto del documento si lo declara,
 * si no al prefijo {@code cfdi} declarado en la raíz y, como último recurso, al valor
 * configurado. El alias {@code tfd} existe siempre, aunque el documento no lo declare.
 */
final class CfdiNamespaceContext implements NamespaceContext {

    private final Map<String, String> namespaces;

    private CfdiNamespaceContext(Map<String, String> namespaces) {
        this.namespaces = Collections.unmodifiableMap(namespaces);
    }

    static CfdiNamespaceContext forDocument(Element root, CfdiNamespaces configured) {
        var map = new LinkedHashMap<String, String>();

        String defaultNs = root.lookupNamespaceURI(null);
        String declaredCfdi = root.lookupNamespaceURI(CfdiNamespaces.CFDI_PREFIX);
        if (defaultNs != null && !defaultNs.isEmpty()) {
            map.put(CfdiNamespaces.CFDI_PREFIX, defaultNs);
        } else if (declaredCfdi != null && !declaredCfdi.isEmpty()) {
            map.put(CfdiNamespaces.CFDI_PREFIX, declaredCfdi);
        } else {
            map.put(CfdiNamespaces.CFDI_PREFIX, configured.cfdiUri());
        }

        String declaredTfd = root.lookupNamespaceURI(CfdiNamespaces.TFD_PREFIX);
        map.put(CfdiNamespaces.TFD_PREFIX,
                declaredTfd != null && !declaredTfd.isEmpty() ? declaredTfd : configured.tfdUri());
        return new CfdiNamespaceContext(map);
    }

    String cfdiNamespace() {
        return namespaces.get(CfdiNamespaces.CFDI_PREFIX);
    }

    String tfdNamespace() {
        return namespaces.get(CfdiNamespaces.TFD_PREFIX);
    }

    @Override
    public String getNamespaceURI(String prefix) {
        return namespaces.getOrDefault(prefix, XMLConstants.NULL_NS_URI);
    }

    @Override
    public String getPrefix(String namespaceURI) {
        return namespaces.entrySet().stream()
                .filter(e -> e.getValue().equals(namespaceURI))
                .map(Map.Entry::getKey)
                .findFirst()
                .orElse(null);
    }

    @Override
    public Iterator<String> getPrefixes(String namespaceURI) {
        var prefix = getPrefix(namespaceURI);
        return prefix != null ? List.of(prefix).iterator() : Collections.emptyIterator();
    }
}
