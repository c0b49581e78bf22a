package io.mersel.services.addenda.infrastructure.cfdi;

import io.mersel.services.addenda.application.enums.InsertionAnchor;
import io.mersel.services.addenda.application.interfaces.ICfdiDocument;
import io.mersel.services.addenda.application.interfaces.InputTooLargeException;
import io.mersel.services.addenda.application.interfaces.MalformedXmlException;
import io.mersel.services.addenda.application.models.CfdiLineItem;
import io.mersel.services.addenda.application.models.CfdiNamespaces;
import io.mersel.services.addenda.application.models.CfdiTax;
import io.mersel.services.addenda.application.models.ExistingAddenda;
import io.mersel.services.addenda.application.models.InsertionPoint;
import io.mersel.services.addenda.application.models.StructureCheck;
import io.mersel.services.addenda.infrastructure.SecureXml;
import io.mersel.services.addenda.infrastructure.diagnostics.AddendaMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.w3c.dom.Attr;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.NamedNodeMap;
import org.w3c.dom.Node;
import org.w3c.dom.NodeList;

import javax.xml.XMLConstants;
import javax.xml.xpath.XPath;
import javax.xml.xpath.XPathConstants;
import javax.xml.xpath.XPathExpressionException;
import javax.xml.xpath.XPathFactory;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * CFDI sobre DOM.
 * <p>
 * No es seguro entre hilos: cada operación lógica debe parsear su propio documento.
 * Admite una sola inserción; el elemento {@code Addenda} se reutiliza si ya existe,
 * por lo que el documento nunca termina con dos.
 */
class DomCfdiDocument implements ICfdiDocument {

    private static final Logger log = LoggerFactory.getLogger(DomCfdiDocument.class);

    private static final String ADDENDA = "Addenda";
    private static final String TIMBRE = "TimbreFiscalDigital";
    private static final List<String> REQUIRED_ELEMENTS = List.of("Emisor", "Receptor", "Conceptos");

    private final Document document;
    private final Element root;
    private final CfdiNamespaceContext namespaceContext;
    private final CfdiNamespaces configured;
    private final long maxFragmentBytes;
    private final AddendaMetrics metrics;
    private final XPath xpath;

    private InsertionAnchor insertedAt;

    DomCfdiDocument(Document document, CfdiNamespaceContext namespaceContext, CfdiNamespaces configured,
                    long maxFragmentBytes, AddendaMetrics metrics) {
        this.document = document;
        this.root = document.getDocumentElement();
        this.namespaceContext = namespaceContext;
        this.configured = configured;
        this.maxFragmentBytes = maxFragmentBytes;
        this.metrics = metrics;
        this.xpath = XPathFactory.newInstance().newXPath();
        this.xpath.setNamespaceContext(namespaceContext);
    }

    // ── Datos ───────────────────────────────────────────────────────

    @Override
    public Map<String, String> extractData() {
        var data = new LinkedHashMap<String, String>();
        data.put("cfdi_uuid", findUuid());
        data.put("cfdi_version", attr(root, "Version", ""));
        data.put("cfdi_serie", attr(root, "Serie", ""));
        data.put("cfdi_folio", attr(root, "Folio", ""));
        data.put("cfdi_fecha", attr(root, "Fecha", ""));
        data.put("cfdi_tipo_comprobante", attr(root, "TipoDeComprobante", ""));
        data.put("cfdi_forma_pago", attr(root, "FormaPago", ""));
        data.put("cfdi_metodo_pago", attr(root, "MetodoPago", ""));
        data.put("cfdi_moneda", attr(root, "Moneda", "MXN"));
        data.put("cfdi_tipo_cambio", attr(root, "TipoCambio", "1"));
        data.put("cfdi_subtotal", attr(root, "SubTotal", "0"));
        data.put("cfdi_descuento", attr(root, "Descuento", "0"));
        data.put("cfdi_total", attr(root, "Total", "0"));

        first(".//cfdi:Emisor").ifPresent(emisor -> {
            data.put("emisor_rfc", attr(emisor, "Rfc", ""));
            data.put("emisor_nombre", attr(emisor, "Nombre", ""));
            data.put("emisor_regimen_fiscal", attr(emisor, "RegimenFiscal", ""));
        });

        first(".//cfdi:Receptor").ifPresent(receptor -> {
            data.put("receptor_rfc", attr(receptor, "Rfc", ""));
            data.put("receptor_nombre", attr(receptor, "Nombre", ""));
            data.put("receptor_uso_cfdi", attr(receptor, "UsoCFDI", ""));
            data.put("receptor_residencia_fiscal", attr(receptor, "ResidenciaFiscal", ""));
            data.put("receptor_regimen_fiscal", attr(receptor, "RegimenFiscalReceptor", ""));
        });

        // Solo el primer concepto; el detalle completo sale de extractLineItems().
        first(".//cfdi:Concepto").ifPresent(concepto -> {
            data.put("concepto_cantidad", attr(concepto, "Cantidad", "0"));
            data.put("concepto_unidad", attr(concepto, "Unidad", ""));
            data.put("concepto_clave_unidad", attr(concepto, "ClaveUnidad", ""));
            data.put("concepto_descripcion", attr(concepto, "Descripcion", ""));
            data.put("concepto_valor_unitario", attr(concepto, "ValorUnitario", "0"));
            data.put("concepto_importe", attr(concepto, "Importe", "0"));
            data.put("concepto_clave_prodserv", attr(concepto, "ClaveProdServ", ""));
        });
        return data;
    }

    @Override
    public List<CfdiLineItem> extractLineItems() {
        var items = new ArrayList<CfdiLineItem>();
        List<Element> conceptos = all(".//cfdi:Concepto");
        for (int i = 0; i < conceptos.size(); i++) {
            Element concepto = conceptos.get(i);
            List<CfdiTax> traslados = List.of();
            List<CfdiTax> retenciones = List.of();
            Optional<Element> impuestos = first(concepto, ".//cfdi:Impuestos");
            if (impuestos.isPresent()) {
                traslados = taxes(impuestos.get(), ".//cfdi:Traslado");
                retenciones = taxes(impuestos.get(), ".//cfdi:Retencion");
            }
            items.add(new CfdiLineItem(
                    i + 1,
                    attr(concepto, "Cantidad", "0"),
                    attr(concepto, "Unidad", ""),
                    attr(concepto, "ClaveUnidad", ""),
                    attr(concepto, "Descripcion", ""),
                    attr(concepto, "ValorUnitario", "0"),
                    attr(concepto, "Importe", "0"),
                    attr(concepto, "ClaveProdServ", ""),
                    attr(concepto, "NoIdentificacion", ""),
                    attr(concepto, "Descuento", "0"),
                    traslados,
                    retenciones));
        }
        return items;
    }

    private List<CfdiTax> taxes(Element impuestos, String expression) {
        var result = new ArrayList<CfdiTax>();
        for (Element tax : all(impuestos, expression)) {
            result.add(new CfdiTax(
                    attr(tax, "Base", "0"),
                    attr(tax, "Impuesto", ""),
                    attr(tax, "TipoFactor", ""),
                    attr(tax, "TasaOCuota", ""),
                    attr(tax, "Importe", "0")));
        }
        return result;
    }

    private String findUuid() {
        Optional<Element> timbre = first(".//tfd:" + TIMBRE);
        if (timbre.isEmpty()) {
            timbre = findByNameFragment(root, TIMBRE);
        }
        return timbre.map(t -> attr(t, "UUID", "")).orElse("");
    }

    private static Optional<Element> findByNameFragment(Element element, String fragment) {
        NodeList all = element.getElementsByTagName("*");
        for (int i = 0; i < all.getLength(); i++) {
            Element candidate = (Element) all.item(i);
            if (candidate.getNodeName().contains(fragment)) {
                return Optional.of(candidate);
            }
        }
        return Optional.empty();
    }

    // ── Inserción ───────────────────────────────────────────────────

    @Override
    public InsertionPoint findInsertionPoint() {
        Anchor anchor = locateAnchor();
        return new InsertionPoint(anchor.parent.getLocalName(), anchor.index, anchor.kind);
    }

    @Override
    public String insert(String addendaXml) throws InputTooLargeException, MalformedXmlException {
        if (insertedAt != null) {
            throw new IllegalStateException("El CFDI ya recibió una addenda en esta operación");
        }
        SecureXml.checkSize(addendaXml, maxFragmentBytes);
        Document fragment = SecureXml.parse(addendaXml, "La addenda");

        Anchor anchor = locateAnchor();
        Element container = first(".//cfdi:" + ADDENDA).orElseGet(() -> createAddendaContainer(anchor));
        container.appendChild(document.importNode(fragment.getDocumentElement(), true));

        insertedAt = anchor.kind;
        metrics.recordInsertion(anchor.kind);
        log.info("Addenda insertada en el CFDI ({})", anchor.kind);
        return SecureXml.prettyPrint(document);
    }

    @Override
    public Optional<InsertionAnchor> insertedAt() {
        return Optional.ofNullable(insertedAt);
    }

    private Element createAddendaContainer(Anchor anchor) {
        String prefix = root.getPrefix();
        String qualifiedName = prefix == null || prefix.isEmpty() ? ADDENDA : prefix + ":" + ADDENDA;
        String namespace = root.getNamespaceURI() != null ? root.getNamespaceURI() : namespaceContext.cfdiNamespace();
        Element container = document.createElementNS(namespace, qualifiedName);
        if (anchor.after != null) {
            anchor.parent.insertBefore(container, anchor.after.getNextSibling());
        } else {
            anchor.parent.appendChild(container);
        }
        return container;
    }

    /**
     * Tras {@code Complemento}; si no, tras {@code Conceptos}; si no, al final de la raíz.
     */
    private Anchor locateAnchor() {
        Optional<Element> complemento = first(".//cfdi:Complemento");
        if (complemento.isPresent()) {
            return Anchor.following(complemento.get(), InsertionAnchor.AFTER_COMPLEMENTO);
        }
        Optional<Element> conceptos = first(".//cfdi:Conceptos");
        if (conceptos.isPresent()) {
            return Anchor.following(conceptos.get(), InsertionAnchor.AFTER_CONCEPTOS);
        }
        return new Anchor(root, null, childElements(root).size(), InsertionAnchor.END_OF_ROOT);
    }

    private record Anchor(Element parent, Element after, int index, InsertionAnchor kind) {

        static Anchor following(Element sibling, InsertionAnchor kind) {
            Element parent = (Element) sibling.getParentNode();
            return new Anchor(parent, sibling, childElements(parent).indexOf(sibling) + 1, kind);
        }
    }

    // ── Estructura ──────────────────────────────────────────────────

    @Override
    public StructureCheck validateStructure() {
        String rootName = root.getLocalName() != null ? root.getLocalName() : root.getNodeName();
        if (!rootName.contains("Comprobante")) {
            return StructureCheck.invalid("XML no es un comprobante CFDI válido");
        }

        String version = root.getAttribute("Version");
        String requiredPrefix = configured.requiredVersionPrefix();
        if (version.isEmpty() || !version.startsWith(requiredPrefix)) {
            String expected = requiredPrefix.endsWith(".") ? requiredPrefix + "0" : requiredPrefix;
            String found = version.isEmpty() ? "sin versión" : "versión encontrada: " + version;
            return StructureCheck.invalid("CFDI debe ser versión " + expected + " (" + found + ")");
        }

        for (String element : REQUIRED_ELEMENTS) {
            if (first(".//cfdi:" + element).isEmpty()) {
                return StructureCheck.invalid("Elemento obligatorio faltante: " + element);
            }
        }
        return StructureCheck.ok();
    }

    @Override
    public boolean hasAddenda() {
        return first(".//cfdi:" + ADDENDA)
                .map(addenda -> !childElements(addenda).isEmpty())
                .orElse(false);
    }

    @Override
    public List<ExistingAddenda> existingAddendas() {
        Optional<Element> container = first(".//cfdi:" + ADDENDA);
        if (container.isEmpty()) {
            return List.of();
        }
        var result = new ArrayList<ExistingAddenda>();
        for (Element child : childElements(container.get())) {
            result.add(new ExistingAddenda(
                    child.getLocalName(),
                    child.getNamespaceURI(),
                    attributes(child),
                    directText(child),
                    SecureXml.serialize(child)));
        }
        return result;
    }

    @Override
    public String toXml() {
        return SecureXml.prettyPrint(document);
    }

    // ── Auxiliares ──────────────────────────────────────────────────

    private Optional<Element> first(String expression) {
        return first(root, expression);
    }

    private Optional<Element> first(Element context, String expression) {
        try {
            Node node = (Node) xpath.evaluate(expression, context, XPathConstants.NODE);
            return node instanceof Element element ? Optional.of(element) : Optional.empty();
        } catch (XPathExpressionException e) {
            throw new IllegalStateException("Expresión XPath inválida: " + expression, e);
        }
    }

    private List<Element> all(String expression) {
        return all(root, expression);
    }

    private List<Element> all(Element context, String expression) {
        try {
            NodeList nodes = (NodeList) xpath.evaluate(expression, context, XPathConstants.NODESET);
            var result = new ArrayList<Element>(nodes.getLength());
            for (int i = 0; i < nodes.getLength(); i++) {
                result.add((Element) nodes.item(i));
            }
            return result;
        } catch (XPathExpressionException e) {
            throw new IllegalStateException("Expresión XPath inválida: " + expression, e);
        }
    }

    private static List<Element> childElements(Element parent) {
        var result = new ArrayList<Element>();
        NodeList children = parent.getChildNodes();
        for (int i = 0; i < children.getLength(); i++) {
            if (children.item(i).getNodeType() == Node.ELEMENT_NODE) {
                result.add((Element) children.item(i));
            }
        }
        return result;
    }

    private static String attr(Element element, String name, String defaultValue) {
        return element.hasAttribute(name) ? element.getAttribute(name) : defaultValue;
    }

    private static Map<String, String> attributes(Element element) {
        var map = new LinkedHashMap<String, String>();
        NamedNodeMap attrs = element.getAttributes();
        for (int i = 0; i < attrs.getLength(); i++) {
            Attr attr = (Attr) attrs.item(i);
            if (XMLConstants.XMLNS_ATTRIBUTE_NS_URI.equals(attr.getNamespaceURI())) {
                continue;
            }
            map.put(attr.getName(), attr.getValue());
        }
        return map;
    }

    private static String directText(Element element) {
        var sb = new StringBuilder();
        NodeList children = element.getChildNodes();
        for (int i = 0; i < children.getLength(); i++) {
            Node child = children.item(i);
            if (child.getNodeType() == Node.TEXT_NODE || child.getNodeType() == Node.CDATA_SECTION_NODE) {
                sb.append(child.getNodeValue());
            }
        }
        return sb.toString().strip();
    }
}
