package io.github.cepeppe.flex.exception;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Il download dello statement è fallito: codice d'errore del servizio Flex, budget di polling
 * esaurito, risposta non interpretabile o errore di trasporto.
 * <p>
 * {@link #getErrorCode()} contiene il codice del servizio (es. {@code 1012}, token scaduto) quando disponibile.
 */
public class FlexRetrievalException extends FlexException {

    private static final long serialVersionUID = 1L;

    private final Integer errorCode;

    public FlexRetrievalException(Code code, String message, Integer errorCode, Throwable cause) {
        super(code, message, contextOf(errorCode), cause);
        this.errorCode = errorCode;
    }

    /** Risposta con {@code Status=Fail} e codice non ritentabile. */
    public static FlexRetrievalException serviceError(int errorCode, String errorMessage) {
        return new FlexRetrievalException(Code.RETRIEVAL,
                "Flex service error " + errorCode + ": " + errorMessage, errorCode, null);
    }

    /** Risposta che non è né un FlexStatementResponse né un FlexQueryResponse. */
    public static FlexRetrievalException badResponse(String message, Throwable cause) {
        return new FlexRetrievalException(Code.BAD_RESPONSE, message, null, cause);
    }

    public Integer getErrorCode() {
        return errorCode;
    }

    private static Map<String, Object> contextOf(Integer errorCode) {
        Map<String, Object> ctx = new LinkedHashMap<>();
        if (errorCode != null) ctx.put("errorCode", errorCode);
        return ctx;
    }
}
