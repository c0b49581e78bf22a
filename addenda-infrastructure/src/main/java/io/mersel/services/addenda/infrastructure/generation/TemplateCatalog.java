package io.mersel.services.addenda.infrastructure.generation;

import io.mersel.services.addenda.application.interfaces.InvalidAddendaDefinitionException;
import io.mersel.services.addenda.application.models.AddendaTemplate;
import io.mersel.services.addenda.application.models.AddendaType;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;

/**
 * Selección de plantilla para un tipo de addenda.
 */
@Component
public class TemplateCatalog {

    static final String SAMPLE_TEMPLATE_NAME = "Template Básico";

    /**
     * Plantilla con el nombre indicado; si no se indica, la de por defecto, luego la
     * primera del tipo y, si no hay ninguna, una plantilla de muestra.
     *
     * @throws InvalidAddendaDefinitionException si se pidió un nombre que no existe
     */
    public AddendaTemplate select(AddendaType type, List<AddendaTemplate> templates, String requestedName)
            throws InvalidAddendaDefinitionException {
        if (requestedName != null && !requestedName.isBlank()) {
            return templates.stream()
                    .filter(t -> requestedName.equals(t.name()))
                    .findFirst()
                    .orElseThrow(() -> new InvalidAddendaDefinitionException(
                            "Template no encontrado para " + type.name() + ": " + requestedName));
        }
        return findDefault(templates)
                .or(() -> templates.stream().findFirst())
                .orElseGet(() -> sampleTemplate(type));
    }

    public Optional<AddendaTemplate> findDefault(List<AddendaTemplate> templates) {
        return templates.stream().filter(AddendaTemplate::defaultTemplate).findFirst();
    }

    /**
     * Plantilla genérica con los datos principales del comprobante. La raíz toma el
     * nombre del tipo, reducido a un nombre XML válido.
     */
    public AddendaTemplate sampleTemplate(AddendaType type) {
        String root = rootElementName(type.name());
        String xml = "<" + root + ">\n"
                + "  <informacionGeneral>\n"
                + "    <fechaEmision>{{ cfdi_fecha }}</fechaEmision>\n"
                + "    <folioFiscal>{{ cfdi_uuid }}</folioFiscal>\n"
                + "    <montoTotal>{{ cfdi_total }}</montoTotal>\n"
                + "  </informacionGeneral>\n"
                + "  <proveedor>\n"
                + "    <rfc>{{ emisor_rfc }}</rfc>\n"
                + "    <razonSocial>{{ emisor_nombre }}</razonSocial>\n"
                + "  </proveedor>\n"
                + "  <cliente>\n"
                + "    <rfc>{{ receptor_rfc }}</rfc>\n"
                + "    <razonSocial>{{ receptor_nombre }}</razonSocial>\n"
                + "  </cliente>\n"
                + "</" + root + ">";
        return new AddendaTemplate(SAMPLE_TEMPLATE_NAME, type.name(), xml, true);
    }

    static String rootElementName(String typeName) {
        String cleaned = typeName == null ? "" : typeName.replaceAll("[^A-Za-z0-9_]", "");
        if (cleaned.isEmpty()) {
            return "addenda";
        }
        return Character.isLetter(cleaned.charAt(0)) || cleaned.charAt(0) == '_' ? cleaned : "addenda" + cleaned;
    }
}
