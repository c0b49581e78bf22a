package io.mersel.services.addenda.infrastructure.validation;

import io.mersel.services.addenda.application.models.SchemaElementInfo;
import io.mersel.services.addenda.application.models.SchemaInfo;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.NodeList;

import javax.xml.XMLConstants;
import java.util.ArrayList;
import java.util.List;

/**
 * Lee la estructura declarada de un XSD sin validar ninguna instancia.
 */
final class SchemaIntrospector {

    private static final String XS = XMLConstants.W3C_XML_SCHEMA_NS_URI;
    private static final String UNQUALIFIED = "unqualified";
    private static final String ONE = "1";

    private SchemaIntrospector() {}

    static SchemaInfo introspect(Document xsd) {
        Element root = xsd.getDocumentElement();

        var elements = new ArrayList<SchemaElementInfo>();
        NodeList declared = xsd.getElementsByTagNameNS(XS, "element");
        for (int i = 0; i < declared.getLength(); i++) {
            Element el = (Element) declared.item(i);
            if (!el.hasAttribute("name")) {
                continue;
            }
            elements.add(new SchemaElementInfo(
                    el.getAttribute("name"),
                    el.getAttribute("type"),
                    attributeOr(el, "minOccurs", ONE),
                    attributeOr(el, "maxOccurs", ONE)));
        }

        return new SchemaInfo(
                root.getAttribute("targetNamespace"),
                root.getAttribute("version"),
                attributeOr(root, "elementFormDefault", UNQUALIFIED),
                attributeOr(root, "attributeFormDefault", UNQUALIFIED),
                elements,
                namesOf(xsd, "complexType"),
                namesOf(xsd, "simpleType"));
    }

    private static List<String> namesOf(Document xsd, String localName) {
        var names = new ArrayList<String>();
        NodeList nodes = xsd.getElementsByTagNameNS(XS, localName);
        for (int i = 0; i < nodes.getLength(); i++) {
            Element el = (Element) nodes.item(i);
            if (el.hasAttribute("name")) {
                names.add(el.getAttribute("name"));
            }
        }
        return names;
    }

    private static String attributeOr(Element el, String name, String fallback) {
        return el.hasAttribute(name) ? el.getAttribute(name) : fallback;
    }
}
