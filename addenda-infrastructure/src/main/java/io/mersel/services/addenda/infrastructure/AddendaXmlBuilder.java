package io.mersel.services.addenda.infrastructure;

import io.mersel.services.addenda.application.interfaces.AddendaProcessingException;
import io.mersel.services.addenda.application.interfaces.IAddendaXmlBuilder;
import io.mersel.services.addenda.application.interfaces.ITemplateRenderer;
import io.mersel.services.addenda.application.models.VariableContext;

/**
 * Paso fluido {@code withNamespace(...).render()} sobre {@link ITemplateRenderer}.
 * Cada llamada devuelve una instancia nueva; la original no cambia.
 */
final class AddendaXmlBuilder implements IAddendaXmlBuilder {

    private final ITemplateRenderer renderer;
    private final String template;
    private final VariableContext context;
    private final String namespaceUri;

    AddendaXmlBuilder(ITemplateRenderer renderer, String template, VariableContext context, String namespaceUri) {
        this.renderer = renderer;
        this.template = template;
        this.context = context;
        this.namespaceUri = namespaceUri;
    }

    @Override
    public IAddendaXmlBuilder withNamespace(String namespaceUri) {
        return new AddendaXmlBuilder(renderer, template, context, namespaceUri);
    }

    @Override
    public String render() throws AddendaProcessingException {
        return renderer.render(template, context, namespaceUri);
    }
}
