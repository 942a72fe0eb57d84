package io.github.cepeppe.flex.xml;

import com.fasterxml.jackson.dataformat.xml.XmlFactory;
import io.github.cepeppe.flex.exception.MalformedInputException;
import io.github.cepeppe.flex.logging.FlexLogger;

import javax.xml.stream.Location;
import javax.xml.stream.XMLInputFactory;
import javax.xml.stream.XMLStreamConstants;
import javax.xml.stream.XMLStreamException;
import javax.xml.stream.XMLStreamReader;
import java.io.InputStream;
import java.io.Reader;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Parse generico di un documento XML in un albero di {@link XmlNode}.
 *
 * <h2>Note</h2>
 * <ul>
 *   <li>Usa lo StAX reader di jackson-dataformat-xml (Woodstox), con DTD ed entità esterne disabilitate.</li>
 *   <li>Un documento che dichiara una DTD è rifiutato.</li>
 *   <li>Iterativo (stack esplicito): tempo e memoria lineari nel numero di elementi.</li>
 * </ul>
 */
public final class XmlTreeReader {

    private static final FlexLogger LOG = FlexLogger.getLogger(XmlTreeReader.class);

    private final XMLInputFactory inputFactory;

    public XmlTreeReader() {
        XMLInputFactory f = new XmlFactory().getXMLInputFactory();
        f.setProperty(XMLInputFactory.SUPPORT_DTD, Boolean.FALSE);
        f.setProperty(XMLInputFactory.IS_SUPPORTING_EXTERNAL_ENTITIES, Boolean.FALSE);
        f.setProperty(XMLInputFactory.IS_COALESCING, Boolean.FALSE);
        this.inputFactory = f;
    }

    /**
     * Legge l'intero documento da byte. La codifica è quella dichiarata nel prolog
     * (o rilevata dal BOM), UTF-8 in assenza di entrambi. Lo stream non viene chiuso.
     *
     * @return l'elemento radice
     * @throws MalformedInputException se il documento non è XML ben formato (o dichiara una DTD)
     */
    public XmlNode read(InputStream in) {
        XMLStreamReader reader = null;
        try {
            reader = inputFactory.createXMLStreamReader(in);
            return readTree(reader);
        } catch (XMLStreamException e) {
            throw malformed(e);
        } finally {
            closeQuietly(reader);
        }
    }

    /**
     * Legge l'intero documento da caratteri già decodificati: l'{@code encoding} del prolog è ignorato.
     * Il reader non viene chiuso.
     */
    public XmlNode read(Reader in) {
        XMLStreamReader reader = null;
        try {
            reader = inputFactory.createXMLStreamReader(in);
            return readTree(reader);
        } catch (XMLStreamException e) {
            throw malformed(e);
        } finally {
            closeQuietly(reader);
        }
    }

    private static MalformedInputException malformed(XMLStreamException e) {
        Location loc = e.getLocation();
        return new MalformedInputException("Malformed XML: " + firstLine(e.getMessage()),
                loc != null ? loc.getLineNumber() : -1, loc != null ? loc.getColumnNumber() : -1, e);
    }

    private XmlNode readTree(XMLStreamReader reader) throws XMLStreamException {
        Deque<Builder> stack = new ArrayDeque<>();
        XmlNode root = null;
        int elements = 0;

        while (reader.hasNext()) {
            int event = reader.next();
            switch (event) {
                case XMLStreamConstants.DTD: {
                    Location loc = reader.getLocation();
                    throw new MalformedInputException("DTD declarations are not allowed",
                            loc.getLineNumber(), loc.getColumnNumber(), null);
                }
                case XMLStreamConstants.START_ELEMENT: {
                    Map<String, String> attrs = new LinkedHashMap<>();
                    for (int i = 0; i < reader.getAttributeCount(); i++) {
                        attrs.put(reader.getAttributeLocalName(i), reader.getAttributeValue(i));
                    }
                    stack.push(new Builder(reader.getLocalName(), attrs, reader.getLocation().getLineNumber()));
                    elements++;
                    break;
                }
                case XMLStreamConstants.END_ELEMENT: {
                    XmlNode node = stack.pop().build();
                    if (stack.isEmpty()) {
                        root = node;
                    } else {
                        stack.peek().children.add(node);
                    }
                    break;
                }
                default:
                    // testo, commenti, processing instruction: ignorati
                    break;
            }
        }

        if (root == null) {
            throw new MalformedInputException("Document has no root element", -1, -1, null);
        }
        LOG.debug("XML tree read: root={}, elements={}", root.name(), elements);
        return root;
    }

    private static String firstLine(String message) {
        if (message == null) return "unknown error";
        int nl = message.indexOf('\n');
        return nl < 0 ? message : message.substring(0, nl);
    }

    private static void closeQuietly(XMLStreamReader reader) {
        if (reader == null) return;
        try {
            reader.close();
        } catch (XMLStreamException e) {
            LOG.debug("Error closing XML reader: {}", e.getMessage());
        }
    }

    private static final class Builder {
        private final String name;
        private final Map<String, String> attributes;
        private final int line;
        private final List<XmlNode> children = new ArrayList<>();

        private Builder(String name, Map<String, String> attributes, int line) {
            this.name = name;
            this.attributes = attributes;
            this.line = line;
        }

        private XmlNode build() {
            return new XmlNode(name,
                    attributes.isEmpty() ? Map.of() : Collections.unmodifiableMap(attributes),
                    children.isEmpty() ? List.of() : Collections.unmodifiableList(children),
                    line);
        }
    }
}
