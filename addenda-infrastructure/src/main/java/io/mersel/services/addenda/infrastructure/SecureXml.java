package io.mersel.services.addenda.infrastructure;

import io.mersel.services.addenda.application.interfaces.InputTooLargeException;
import io.mersel.services.addenda.application.interfaces.MalformedXmlException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.w3c.dom.Document;
import org.w3c.dom.Node;
import org.w3c.dom.NodeList;
import org.xml.sax.ErrorHandler;
import org.xml.sax.InputSource;
import org.xml.sax.SAXException;
import org.xml.sax.SAXNotRecognizedException;
import org.xml.sax.SAXNotSupportedException;
import org.xml.sax.SAXParseException;

import javax.xml.XMLConstants;
import javax.xml.parsers.DocumentBuilder;
import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;
import javax.xml.transform.OutputKeys;
import javax.xml.transform.Transformer;
import javax.xml.transform.TransformerException;
import javax.xml.transform.TransformerFactory;
import javax.xml.transform.dom.DOMSource;
import javax.xml.transform.stream.StreamResult;
import javax.xml.validation.SchemaFactory;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.StringReader;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.util.Locale;

/**
 * Parseo y serialización XML endurecidos contra XXE.
 * <p>
 * Todos los parsers del servicio pasan por aquí: DOCTYPE prohibido, entidades externas
 * deshabilitadas y sin resolución de recursos externos en esquemas.
 */
public final class SecureXml {

    private static final Logger log = LoggerFactory.getLogger(SecureXml.class);

    public static final String XML_DECLARATION = "<?xml version=\"1.0\" encoding=\"UTF-8\"?>";

    /** Mensajes de Xerces en inglés, independientes del locale de la JVM. */
    private static final String XERCES_LOCALE_PROPERTY = "http://apache.org/xml/properties/locale";

    private static final ErrorHandler RAISING_ERROR_HANDLER = new ErrorHandler() {
        @Override
        public void warning(SAXParseException e) {
            log.debug("Advertencia del parser XML: {}", e.getMessage());
        }

        @Override
        public void error(SAXParseException e) throws SAXException {
            throw e;
        }

        @Override
        public void fatalError(SAXParseException e) throws SAXException {
            throw e;
        }
    };

    private SecureXml() {
    }

    /**
     * Rechaza el texto si su tamaño en UTF-8 supera {@code maxBytes}.
     */
    public static void checkSize(String xml, long maxBytes) throws InputTooLargeException {
        if (xml == null) {
            return;
        }
        // Cota inferior barata antes de codificar: cada char ocupa al menos un byte.
        if (xml.length() > maxBytes) {
            throw new InputTooLargeException(xml.length(), maxBytes);
        }
        long bytes = xml.getBytes(StandardCharsets.UTF_8).length;
        if (bytes > maxBytes) {
            throw new InputTooLargeException(bytes, maxBytes);
        }
    }

    public static void checkSize(byte[] xml, long maxBytes) throws InputTooLargeException {
        if (xml != null && xml.length > maxBytes) {
            throw new InputTooLargeException(xml.length, maxBytes);
        }
    }

    /**
     * DocumentBuilder con namespaces y protección XXE.
     */
    public static DocumentBuilder newDocumentBuilder() throws ParserConfigurationException {
        DocumentBuilderFactory dbFactory = DocumentBuilderFactory.newInstance();
        dbFactory.setNamespaceAware(true);
        // XXE
        dbFactory.setFeature("http://apache.org/xml/features/disallow-doctype-decl", true);
        dbFactory.setFeature("http://xml.org/sax/features/external-general-entities", false);
        dbFactory.setFeature("http://xml.org/sax/features/external-parameter-entities", false);
        dbFactory.setFeature("http://apache.org/xml/features/nonvalidating/load-external-dtd", false);
        dbFactory.setXIncludeAware(false);
        dbFactory.setExpandEntityReferences(false);
        dbFactory.setIgnoringComments(true);
        DocumentBuilder builder = dbFactory.newDocumentBuilder();
        builder.setErrorHandler(RAISING_ERROR_HANDLER);
        return builder;
    }

    /**
     * Parsea el texto; cualquier error se reporta como {@link MalformedXmlException}
     * con el mensaje del parser y la posición si existe.
     *
     * @param what descripción del documento para el mensaje ("CFDI", "addenda", ...)
     */
    public static Document parse(String xml, String what) throws MalformedXmlException {
        if (xml == null || xml.isBlank()) {
            throw new MalformedXmlException(what + " vacío", null);
        }
        try {
            return newDocumentBuilder().parse(new InputSource(new StringReader(xml)));
        } catch (SAXParseException e) {
            throw new MalformedXmlException(
                    what + " no es XML bien formado: " + e.getMessage(),
                    e.getLineNumber(), e.getColumnNumber(), e);
        } catch (SAXException | IOException e) {
            throw new MalformedXmlException(what + " no es XML bien formado: " + e.getMessage(), e);
        } catch (ParserConfigurationException e) {
            throw new IllegalStateException("Parser XML no disponible", e);
        }
    }

    public static Document parse(byte[] xml, String what) throws MalformedXmlException {
        if (xml == null || xml.length == 0) {
            throw new MalformedXmlException(what + " vacío", null);
        }
        try {
            return newDocumentBuilder().parse(new InputSource(new ByteArrayInputStream(xml)));
        } catch (SAXParseException e) {
            throw new MalformedXmlException(
                    what + " no es XML bien formado: " + e.getMessage(),
                    e.getLineNumber(), e.getColumnNumber(), e);
        } catch (SAXException | IOException e) {
            throw new MalformedXmlException(what + " no es XML bien formado: " + e.getMessage(), e);
        } catch (ParserConfigurationException e) {
            throw new IllegalStateException("Parser XML no disponible", e);
        }
    }

    /**
     * SchemaFactory W3C sin acceso a DTD ni esquemas externos.
     */
    public static SchemaFactory newSchemaFactory() {
        SchemaFactory factory = SchemaFactory.newInstance(XMLConstants.W3C_XML_SCHEMA_NS_URI);
        try {
            factory.setProperty(XMLConstants.ACCESS_EXTERNAL_DTD, "");
            factory.setProperty(XMLConstants.ACCESS_EXTERNAL_SCHEMA, "");
        } catch (SAXNotRecognizedException | SAXNotSupportedException e) {
            log.warn("SchemaFactory no soporta las propiedades de protección XXE");
        }
        try {
            factory.setProperty(XERCES_LOCALE_PROPERTY, Locale.ENGLISH);
        } catch (SAXNotRecognizedException | SAXNotSupportedException e) {
            log.debug("SchemaFactory no soporta la propiedad de locale");
        }
        return factory;
    }

    /**
     * Serializa el nodo sin declaración XML.
     */
    public static String serialize(Node node) {
        return transform(node, false);
    }

    /**
     * Serializa el documento con declaración XML y sangría de dos espacios.
     * Sobre una copia se descartan los espacios de sangría entre elementos, de modo que no se
     * dupliquen; el texto de los elementos hoja se conserva aunque sea solo espacios.
     */
    public static String prettyPrint(Document document) {
        Document copy = (Document) document.cloneNode(true);
        stripIndentation(copy.getDocumentElement());
        return XML_DECLARATION + "\n" + transform(copy, true).strip() + "\n";
    }

    /**
     * Elimina en sitio los nodos de texto formados solo por espacios de los elementos
     * que tienen hijos elemento. Un elemento hoja como {@code <nota> </nota>} no cambia.
     */
    public static void stripIndentation(Node node) {
        if (node == null) {
            return;
        }
        NodeList children = node.getChildNodes();
        boolean hasElementChildren = false;
        for (int i = 0; i < children.getLength(); i++) {
            if (children.item(i).getNodeType() == Node.ELEMENT_NODE) {
                hasElementChildren = true;
                break;
            }
        }
        if (!hasElementChildren) {
            return;
        }
        for (int i = children.getLength() - 1; i >= 0; i--) {
            Node child = children.item(i);
            if (child.getNodeType() == Node.TEXT_NODE && child.getNodeValue().isBlank()) {
                node.removeChild(child);
            } else if (child.getNodeType() == Node.ELEMENT_NODE) {
                stripIndentation(child);
            }
        }
    }

    private static String transform(Node node, boolean indent) {
        try {
            TransformerFactory tf = TransformerFactory.newInstance();
            tf.setFeature(XMLConstants.FEATURE_SECURE_PROCESSING, true);
            tf.setAttribute(XMLConstants.ACCESS_EXTERNAL_DTD, "");
            tf.setAttribute(XMLConstants.ACCESS_EXTERNAL_STYLESHEET, "");
            Transformer transformer = tf.newTransformer();
            transformer.setOutputProperty(OutputKeys.OMIT_XML_DECLARATION, "yes");
            transformer.setOutputProperty(OutputKeys.ENCODING, "UTF-8");
            transformer.setOutputProperty(OutputKeys.INDENT, indent ? "yes" : "no");
            if (indent) {
                transformer.setOutputProperty("{http://xml.apache.org/xslt}indent-amount", "2");
            }
            var out = new StringWriter();
            transformer.transform(new DOMSource(node), new StreamResult(out));
            return out.toString();
        } catch (TransformerException e) {
            throw new IllegalStateException("No se pudo serializar el XML: " + e.getMessage(), e);
        }
    }
}
