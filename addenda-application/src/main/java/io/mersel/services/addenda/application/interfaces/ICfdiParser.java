package io.mersel.services.addenda.application.interfaces;

/**
 * Parser seguro de CFDI timbrados.
 */
public interface ICfdiParser {

    /**
     * @throws InputTooLargeException si el texto supera el tamaño máximo, antes de parsear
     * @throws MalformedXmlException  si el texto no es XML bien formado o declara un DOCTYPE
     */
    ICfdiDocument parse(String cfdiXml) throws InputTooLargeException, MalformedXmlException;

    ICfdiDocument parse(byte[] cfdiXml) throws InputTooLargeException, MalformedXmlException;
}
