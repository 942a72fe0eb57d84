package io.github.cepeppe.flex.exception;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Eccezione radice della libreria.
 * <p>
 * Caratteristiche:
 * <ul>
 *   <li>Unchecked: estende {@link RuntimeException}; il chiamante decide se e dove gestirla.</li>
 *   <li>Codice macchina {@link Code}: categorizza l'errore (parsing, retrieval, configurazione...).</li>
 *   <li>Context immutabile: metadati chiave/valore (path dell'elemento, campo, valore grezzo, ...).</li>
 * </ul>
 *
 * <strong>Nota</strong>: non inserire nel context il token Flex o altri segreti.
 */
public class FlexException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    /** Categoria macchina dell'errore. */
    private final Code code;

    /** Metadati immutabili che contestualizzano l'errore. */
    private final Map<String, Object> context;

    /* =======================
       Costruttori principali
       ======================= */

    public FlexException(Code code, String message) {
        this(code, message, null, null);
    }

    public FlexException(Code code, String message, Throwable cause) {
        this(code, message, null, cause);
    }

    public FlexException(Code code, String message, Map<String, ?> context) {
        this(code, message, context, null);
    }

    public FlexException(Code code, String message, Map<String, ?> context, Throwable cause) {
        super(message, cause);
        this.code = code != null ? code : Code.UNKNOWN;
        this.context = toImmutableContext(context);
    }

    /* =======================
       Factory helpers
       ======================= */

    /**
     * Crea un'eccezione con coppie chiave/valore (varargs) per il context.
     * Esempio: {@code FlexException.of(Code.CONFIG, "Invalid date mode", "value", raw)}
     *
     * @throws IllegalArgumentException se il numero di elementi di {@code kvPairs} è dispari
     */
    public static FlexException of(Code code, String message, Object... kvPairs) {
        return new FlexException(code, message, fromPairs(kvPairs), null);
    }

    /** Wrappa una {@code cause} aggiungendo codice, messaggio e context. */
    public static FlexException wrap(Throwable cause, Code code, String message, Object... kvPairs) {
        if (cause instanceof FlexException fe) {
            Map<String, Object> merged = new LinkedHashMap<>(fe.getContext());
            merged.putAll(fromPairs(kvPairs));
            return new FlexException(
                    code != null ? code : fe.getCode(),
                    message != null ? message : fe.getMessage(),
                    merged,
                    fe
            );
        }
        return new FlexException(code, message, fromPairs(kvPairs), cause);
    }

    /* =======================
       Accessors
       ======================= */

    public Code getCode() {
        return code;
    }

    public Map<String, Object> getContext() {
        return context;
    }

    /* =======================
       Utility
       ======================= */

    private static Map<String, Object> toImmutableContext(Map<String, ?> ctx) {
        if (ctx == null || ctx.isEmpty()) return Map.of();
        Map<String, Object> copy = new LinkedHashMap<>();
        ctx.forEach((k, v) -> copy.put(Objects.toString(k, "null"), v));
        return Collections.unmodifiableMap(copy);
    }

    protected static Map<String, Object> fromPairs(Object... kvPairs) {
        if (kvPairs == null || kvPairs.length == 0) return Map.of();
        if ((kvPairs.length & 1) == 1) {
            throw new IllegalArgumentException("kvPairs deve avere un numero pari di elementi (chiave, valore, ...)");
        }
        Map<String, Object> map = new LinkedHashMap<>();
        for (int i = 0; i < kvPairs.length; i += 2) {
            map.put(Objects.toString(kvPairs[i], "null"), kvPairs[i + 1]);
        }
        return Collections.unmodifiableMap(map);
    }

    /** Categorie di errore. */
    public enum Code {
        MALFORMED_INPUT, STRUCTURE, REQUIRED_FIELD, AMBIGUOUS_DATE, COERCION,
        STRICT_MODE, CONFIG, IO, RETRIEVAL, BAD_RESPONSE, TIMEOUT, INTERNAL, UNKNOWN
    }
}
