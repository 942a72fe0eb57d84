package io.github.cepeppe.flex.exception;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Errore fatale di parsing: interrompe l'intera chiamata, nessun grafo parziale viene restituito.
 * <p>
 * Porta sempre il {@code path} dell'elemento (o attributo) che ha causato il fallimento, nel formato
 * {@code FlexQueryResponse/FlexStatements/FlexStatement[0]/Trades/Trade[3]@quantity}.
 */
public class FlexParseException extends FlexException {

    private static final long serialVersionUID = 1L;

    private final String path;

    public FlexParseException(Code code, String path, String message) {
        this(code, path, message, Map.of(), null);
    }

    public FlexParseException(Code code, String path, String message, Map<String, ?> context, Throwable cause) {
        super(code, message + (path != null ? " (path=" + path + ")" : ""), withPath(path, context), cause);
        this.path = path;
    }

    /** Errore strutturale: root inattesa, wrapper mancante/duplicato, count incoerente. */
    public static FlexParseException structure(String path, String message, Object... kvPairs) {
        return new FlexParseException(Code.STRUCTURE, path, message, fromPairs(kvPairs), null);
    }

    public String getPath() {
        return path;
    }

    private static Map<String, Object> withPath(String path, Map<String, ?> context) {
        Map<String, Object> map = new LinkedHashMap<>();
        if (path != null) map.put("path", path);
        if (context != null) map.putAll(context);
        return map;
    }
}
