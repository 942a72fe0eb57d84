package io.github.cepeppe.flex.xml;

import java.util.List;
import java.util.Map;

/**
 * Elemento XML generico: nome, attributi (nell'ordine del documento) e figli ordinati.
 * Il testo degli elementi non è conservato: il formato Flex è solo ad attributi.
 *
 * @param name       nome locale dell'elemento
 * @param attributes attributi non modificabili, in ordine di documento
 * @param children   figli non modificabili, in ordine di documento
 * @param line       riga di apertura dell'elemento (1-based), per i messaggi
 */
public record XmlNode(String name, Map<String, String> attributes, List<XmlNode> children, int line) {

    public String attribute(String attributeName) {
        return attributes.get(attributeName);
    }
}
