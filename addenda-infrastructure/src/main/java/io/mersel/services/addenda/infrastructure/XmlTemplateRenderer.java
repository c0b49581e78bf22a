package io.mersel.services.addenda.infrastructure;

import io.mersel.services.addenda.application.interfaces.AddendaBuildException;
import io.mersel.services.addenda.application.interfaces.AddendaProcessingException;
import io.mersel.services.addenda.application.interfaces.IAddendaXmlBuilder;
import io.mersel.services.addenda.application.interfaces.ITemplateRenderer;
import io.mersel.services.addenda.application.interfaces.IVariableResolver;
import io.mersel.services.addenda.application.interfaces.MalformedXmlException;
import io.mersel.services.addenda.application.models.VariableContext;
import io.mersel.services.addenda.infrastructure.config.AddendaProperties;
import io.mersel.services.addenda.infrastructure.diagnostics.AddendaMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.Node;
import org.w3c.dom.NodeList;

import javax.xml.XMLConstants;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Renderizador de plantillas de addenda.
 * <p>
 * Recorre la plantilla una sola vez de izquierda a derecha buscando {@code {{ expr }}},
 * resuelve cada expresión y escapa el <b>resultado</b> (nunca el marcado de la plantilla).
 * El texto final debe ser XML bien formado; si se indica un namespace, se declara como
 * namespace por defecto de la raíz y se aplica a los elementos sin prefijo.
 * <p>
 * Los bloques {@code {% ... %}} no se interpretan y quedan tal cual.
 */
@Service
public class XmlTemplateRenderer implements ITemplateRenderer {

    private static final Logger log = LoggerFactory.getLogger(XmlTemplateRenderer.class);

    static final Pattern PLACEHOLDER = Pattern.compile("\\{\\{\\s*(.+?)\\s*\\}\\}");

    private final IVariableResolver resolver;
    private final AddendaMetrics metrics;
    private final long maxTemplateBytes;

    public XmlTemplateRenderer(IVariableResolver resolver, AddendaProperties properties, AddendaMetrics metrics) {
        this.resolver = resolver;
        this.metrics = metrics;
        this.maxTemplateBytes = properties.maxDocumentBytes();
    }

    @Override
    public String render(String template, VariableContext context) throws AddendaProcessingException {
        return render(template, context, null);
    }

    @Override
    public String render(String template, VariableContext context, String namespaceUri)
            throws AddendaProcessingException {
        if (template == null || template.isBlank()) {
            metrics.recordRender("empty");
            return "";
        }
        SecureXml.checkSize(template, maxTemplateBytes);

        try {
            String substituted = substitute(template, context);
            Document document = parseRendered(substituted);

            String result = substituted;
            if (namespaceUri != null && !namespaceUri.isBlank()) {
                applyDefaultNamespace(document, namespaceUri.strip());
                result = SecureXml.serialize(document.getDocumentElement());
            }
            metrics.recordRender("success");
            log.debug("Plantilla renderizada ({} caracteres)", result.length());
            return result;
        } catch (AddendaProcessingException e) {
            metrics.recordRender("error");
            throw e;
        }
    }

    @Override
    public IAddendaXmlBuilder builder(String template, VariableContext context) {
        return new AddendaXmlBuilder(this, template, context, null);
    }

    @Override
    public List<String> extractExpressions(String template) {
        if (template == null || template.isEmpty()) {
            return List.of();
        }
        var expressions = new LinkedHashSet<String>();
        Matcher m = PLACEHOLDER.matcher(template);
        while (m.find()) {
            expressions.add(m.group(1).strip());
        }
        return new ArrayList<>(expressions);
    }

    private String substitute(String template, VariableContext context) throws AddendaProcessingException {
        Matcher m = PLACEHOLDER.matcher(template);
        var out = new StringBuilder(template.length());
        int last = 0;
        while (m.find()) {
            out.append(template, last, m.start());
            out.append(escape(resolver.resolve(m.group(1), context)));
            last = m.end();
        }
        out.append(template, last, template.length());
        return out.toString();
    }

    private static Document parseRendered(String xml) throws AddendaBuildException {
        try {
            return SecureXml.parse(xml, "La addenda renderizada");
        } catch (MalformedXmlException e) {
            throw new AddendaBuildException(
                    "Error construyendo XML: " + e.getMessage(),
                    e.getLineNumber(), e.getColumnNumber(), e.getCause());
        }
    }

    /**
     * Escapa las cinco entidades predefinidas de XML.
     */
    static String escape(String value) {
        if (value == null || value.isEmpty()) {
            return "";
        }
        var sb = new StringBuilder(value.length() + 16);
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            switch (c) {
                case '&' -> sb.append("&amp;");
                case '<' -> sb.append("&lt;");
                case '>' -> sb.append("&gt;");
                case '"' -> sb.append("&quot;");
                case '\'' -> sb.append("&apos;");
                default -> sb.append(c);
            }
        }
        return sb.toString();
    }

    /**
     * Declara {@code namespaceUri} como namespace por defecto de la raíz y lo aplica a los
     * elementos sin prefijo que estaban en el namespace por defecto anterior.
     * Aplicarlo dos veces con el mismo valor no cambia el resultado.
     */
    static void applyDefaultNamespace(Document document, String namespaceUri) {
        Element root = document.getDocumentElement();
        String previous = root.getPrefix() == null ? root.getNamespaceURI() : null;
        Element renamed = rename(document, root, previous, namespaceUri);
        renamed.setAttributeNS(XMLConstants.XMLNS_ATTRIBUTE_NS_URI, XMLConstants.XMLNS_ATTRIBUTE, namespaceUri);
    }

    private static Element rename(Document document, Element element, String previous, String namespaceUri) {
        Element current = element;
        if (element.getPrefix() == null && Objects.equals(element.getNamespaceURI(), previous)) {
            current = (Element) document.renameNode(element, namespaceUri, element.getLocalName());
            if (current.hasAttributeNS(XMLConstants.XMLNS_ATTRIBUTE_NS_URI, XMLConstants.XMLNS_ATTRIBUTE)) {
                current.removeAttributeNS(XMLConstants.XMLNS_ATTRIBUTE_NS_URI, XMLConstants.XMLNS_ATTRIBUTE);
            }
        }
        NodeList children = current.getChildNodes();
        for (int i = 0; i < children.getLength(); i++) {
            Node child = children.item(i);
            if (child.getNodeType() == Node.ELEMENT_NODE) {
                rename(document, (Element) child, previous, namespaceUri);
            }
        }
        return current;
    }
}
