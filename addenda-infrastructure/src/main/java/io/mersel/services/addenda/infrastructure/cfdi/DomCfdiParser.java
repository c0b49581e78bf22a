package io.mersel.services.addenda.infrastructure.cfdi;

import io.mersel.services.addenda.application.interfaces.ICfdiDocument;
import io.mersel.services.addenda.application.interfaces.ICfdiParser;
import io.mersel.services.addenda.application.interfaces.InputTooLargeException;
import io.mersel.services.addenda.application.interfaces.MalformedXmlException;
import io.mersel.services.addenda.application.models.CfdiNamespaces;
import io.mersel.services.addenda.infrastructure.SecureXml;
import io.mersel.services.addenda.infrastructure.config.AddendaProperties;
import io.mersel.services.addenda.infrastructure.diagnostics.AddendaMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.w3c.dom.Document;

/**
 * Parser DOM de CFDI timbrados.
 * <p>
 * El límite de tamaño se comprueba antes de parsear; el parser prohíbe DOCTYPE y
 * entidades externas. Cada llamada devuelve un documento independiente.
 */
@Service
public class DomCfdiParser implements ICfdiParser {

    private static final Logger log = LoggerFactory.getLogger(DomCfdiParser.class);

    private static final String DOCUMENT_NAME = "El CFDI";

    private final CfdiNamespaces namespaces;
    private final AddendaMetrics metrics;
    private final long maxDocumentBytes;

    public DomCfdiParser(CfdiNamespaces namespaces, AddendaProperties properties, AddendaMetrics metrics) {
        this.namespaces = namespaces;
        this.metrics = metrics;
        this.maxDocumentBytes = properties.maxDocumentBytes();
    }

    @Override
    public ICfdiDocument parse(String cfdiXml) throws InputTooLargeException, MalformedXmlException {
        SecureXml.checkSize(cfdiXml, maxDocumentBytes);
        return wrap(SecureXml.parse(cfdiXml, DOCUMENT_NAME));
    }

    @Override
    public ICfdiDocument parse(byte[] cfdiXml) throws InputTooLargeException, MalformedXmlException {
        SecureXml.checkSize(cfdiXml, maxDocumentBytes);
        return wrap(SecureXml.parse(cfdiXml, DOCUMENT_NAME));
    }

    private ICfdiDocument wrap(Document document) {
        var context = CfdiNamespaceContext.forDocument(document.getDocumentElement(), namespaces);
        log.debug("CFDI parseado: raíz={}, namespace cfdi={}",
                document.getDocumentElement().getLocalName(), context.cfdiNamespace());
        return new DomCfdiDocument(document, context, namespaces, maxDocumentBytes, metrics);
    }
}
