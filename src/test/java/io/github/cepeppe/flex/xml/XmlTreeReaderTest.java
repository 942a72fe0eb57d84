package io.github.cepeppe.flex.xml;

import io.github.cepeppe.flex.exception.MalformedInputException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class XmlTreeReaderTest {

    private static XmlNode read(String xml) {
        return new XmlTreeReader().read(new ByteArrayInputStream(xml.getBytes(StandardCharsets.UTF_8)));
    }

    @Test
    @DisplayName("Albero con attributi e figli in ordine di documento, entità decodificate")
    void readsTree() {
        XmlNode root = read("""
                <?xml version="1.0" encoding="UTF-8"?>
                <!-- commento ignorato -->
                <A x="1" y="S&amp;P">
                  <B n="first"/>
                  testo ignorato
                  <C/>
                  <B n="second"/>
                </A>
                """);

        assertEquals("A", root.name());
        assertEquals(List.of("x", "y"), List.copyOf(root.attributes().keySet()));
        assertEquals("S&P", root.attribute("y"));
        assertEquals(List.of("B", "C", "B"), root.children().stream().map(XmlNode::name).toList());
        assertEquals("second", root.children().get(2).attribute("n"));
        assertTrue(root.children().get(1).children().isEmpty());
        assertEquals(4, root.children().get(0).line());
    }

    @Test
    @DisplayName("Annidamento profondo senza ricorsione")
    void deepNesting() {
        int depth = 500;
        StringBuilder xml = new StringBuilder();
        for (int i = 0; i < depth; i++) xml.append("<N>");
        for (int i = 0; i < depth; i++) xml.append("</N>");

        XmlNode node = read(xml.toString());
        int levels = 1;
        while (!node.children().isEmpty()) {
            node = node.children().get(0);
            levels++;
        }
        assertEquals(depth, levels);
    }

    @Test
    @DisplayName("Tag non chiusi o mal annidati → MalformedInputException con riga")
    void malformed() {
        MalformedInputException ex = assertThrows(MalformedInputException.class,
                () -> read("<A>\n<B>\n</A>"));
        assertEquals(3, ex.getLine());
    }

    @Test
    @DisplayName("Nodi e mappe non modificabili")
    void immutable() {
        XmlNode root = read("<A x=\"1\"><B/></A>");
        assertThrows(UnsupportedOperationException.class, () -> root.attributes().put("y", "2"));
        assertThrows(UnsupportedOperationException.class, () -> root.children().clear());
    }
}
