package io.mersel.services.addenda.application.interfaces;

/**
 * Constructor fluido de una addenda: plantilla fija, namespace opcional.
 * <p>
 * Cada paso es independiente e idempotente: llamar dos veces a {@link #withNamespace(String)}
 * con el mismo valor, o a {@link #render()} varias veces, produce el mismo resultado.
 */
public interface IAddendaXmlBuilder {

    IAddendaXmlBuilder withNamespace(String namespaceUri);

    String render() throws AddendaProcessingException;
}
