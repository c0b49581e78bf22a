package io.mersel.services.addenda.infrastructure;

import io.mersel.services.addenda.application.interfaces.AddendaProcessingException;
import io.mersel.services.addenda.application.interfaces.CfdiStructureException;
import io.mersel.services.addenda.application.interfaces.IAddendaGenerationService;
import io.mersel.services.addenda.application.interfaces.ICfdiDocument;
import io.mersel.services.addenda.application.interfaces.ICfdiParser;
import io.mersel.services.addenda.application.interfaces.ITemplateRenderer;
import io.mersel.services.addenda.application.interfaces.IXsdValidatorFactory;
import io.mersel.services.addenda.application.models.AddendaGenerationRequest;
import io.mersel.services.addenda.application.models.AddendaGenerationResult;
import io.mersel.services.addenda.application.models.AddendaTemplate;
import io.mersel.services.addenda.application.models.AddendaType;
import io.mersel.services.addenda.application.models.StructureCheck;
import io.mersel.services.addenda.application.models.ValidationReport;
import io.mersel.services.addenda.application.models.VariableContext;
import io.mersel.services.addenda.infrastructure.diagnostics.AddendaMetrics;
import io.mersel.services.addenda.infrastructure.generation.AddendaDefinitionValidator;
import io.mersel.services.addenda.infrastructure.generation.FieldValueResolver;
import io.mersel.services.addenda.infrastructure.generation.TemplateCatalog;
import io.mersel.services.addenda.infrastructure.generation.VariableContextFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.Map;

/**
 * Generación completa de una addenda.
 * <p>
 * Pasos:
 * <ol>
 *   <li>valida tipo, plantillas y valores de campo</li>
 *   <li>parsea el CFDI (si hay) y comprueba su estructura</li>
 *   <li>arma el contexto: sistema &lt; campos &lt; datos CFDI</li>
 *   <li>selecciona y renderiza la plantilla con el namespace del tipo</li>
 *   <li>valida contra el XSD del tipo, si lo tiene</li>
 *   <li>inserta en el CFDI, solo si la addenda es válida</li>
 * </ol>
 */
@Service
public class AddendaGenerationService implements IAddendaGenerationService {

    private static final Logger log = LoggerFactory.getLogger(AddendaGenerationService.class);

    private final AddendaDefinitionValidator definitionValidator;
    private final FieldValueResolver fieldValueResolver;
    private final VariableContextFactory contextFactory;
    private final TemplateCatalog templateCatalog;
    private final ITemplateRenderer renderer;
    private final ICfdiParser cfdiParser;
    private final IXsdValidatorFactory validatorFactory;
    private final AddendaMetrics metrics;

    public AddendaGenerationService(AddendaDefinitionValidator definitionValidator,
                                    FieldValueResolver fieldValueResolver,
                                    VariableContextFactory contextFactory,
                                    TemplateCatalog templateCatalog,
                                    ITemplateRenderer renderer,
                                    ICfdiParser cfdiParser,
                                    IXsdValidatorFactory validatorFactory,
                                    AddendaMetrics metrics) {
        this.definitionValidator = definitionValidator;
        this.fieldValueResolver = fieldValueResolver;
        this.contextFactory = contextFactory;
        this.templateCatalog = templateCatalog;
        this.renderer = renderer;
        this.cfdiParser = cfdiParser;
        this.validatorFactory = validatorFactory;
        this.metrics = metrics;
    }

    @Override
    public AddendaGenerationResult generate(AddendaGenerationRequest request) throws AddendaProcessingException {
        long startTime = System.currentTimeMillis();
        AddendaType type = request.getAddendaType();
        try {
            AddendaGenerationResult result = doGenerate(request, type, startTime);
            metrics.recordGeneration("success", result.getDurationMs());
            log.info("Addenda {} generada con template '{}' en {} ms (válida: {})",
                    type.name(), result.getTemplateName(), result.getDurationMs(), result.isValid());
            return result;
        } catch (AddendaProcessingException e) {
            metrics.recordGeneration("failure", System.currentTimeMillis() - startTime);
            log.warn("Generación de addenda {} fallida: {}", type.name(), e.getMessage());
            throw e;
        }
    }

    private AddendaGenerationResult doGenerate(AddendaGenerationRequest request, AddendaType type, long startTime)
            throws AddendaProcessingException {
        definitionValidator.validateType(type);
        definitionValidator.validateTemplates(type, request.getTemplates());

        Map<String, String> fieldValues = fieldValueResolver.resolve(
                request.getFieldValues(), request.getDynamicLookup());
        definitionValidator.validateFieldValues(type, fieldValues);

        ICfdiDocument cfdi = request.hasCfdi() ? parseCfdi(request) : null;
        VariableContext context = contextFactory.create(fieldValues, cfdi);

        AddendaTemplate template = templateCatalog.select(type, request.getTemplates(), request.getTemplateName());
        String addendaXml = renderer.builder(template.templateXml(), context)
                .withNamespace(type.hasNamespace() ? type.namespace() : null)
                .render();

        ValidationReport report = null;
        if (request.isValidateOutput() && type.hasSchema()) {
            report = validatorFactory.create(type.xsdSchema()).createValidationReport(addendaXml, false);
            if (!report.isValid()) {
                log.warn("Addenda {} no cumple su XSD: {}", type.name(), report.errorSummary());
            }
        }

        var result = AddendaGenerationResult.builder()
                .addendaXml(addendaXml)
                .templateName(template.name())
                .fieldValues(fieldValues)
                .cfdiDataUsed(cfdi != null)
                .validationReport(report);

        if (request.isInsertIntoCfdi() && cfdi != null) {
            if (report != null && !report.isValid()) {
                log.warn("Se omite la inserción en el CFDI: la addenda {} es inválida", type.name());
            } else {
                result.cfdiXml(cfdi.insert(addendaXml))
                        .insertionAnchor(cfdi.insertedAt().orElse(null));
            }
        }

        return result.durationMs(System.currentTimeMillis() - startTime).build();
    }

    private ICfdiDocument parseCfdi(AddendaGenerationRequest request) throws AddendaProcessingException {
        ICfdiDocument cfdi = cfdiParser.parse(request.getCfdiXml());
        StructureCheck structure = cfdi.validateStructure();
        if (!structure.valid()) {
            if (request.isRequireValidStructure()) {
                throw new CfdiStructureException(structure.reason());
            }
            log.warn("CFDI con estructura incompleta, se continúa: {}", structure.reason());
        }
        if (cfdi.hasAddenda()) {
            log.debug("El CFDI ya contiene una addenda; la nueva se agrega al mismo elemento");
        }
        return cfdi;
    }
}
