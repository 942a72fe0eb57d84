package io.github.cepeppe.flex.exception;

import io.github.cepeppe.flex.coercion.FieldType;

import java.util.Map;

/**
 * Il valore grezzo di un attributo non rispetta la grammatica del tipo dichiarato
 * (es. testo non numerico in un campo decimale).
 */
public class CoercionException extends FlexParseException {

    private static final long serialVersionUID = 1L;

    private final String rawValue;
    private final FieldType targetType;

    public CoercionException(String path, String rawValue, FieldType targetType, String reason) {
        this(Code.COERCION, path, rawValue, targetType, reason, null);
    }

    public CoercionException(String path, String rawValue, FieldType targetType, String reason, Throwable cause) {
        this(Code.COERCION, path, rawValue, targetType, reason, cause);
    }

    protected CoercionException(Code code, String path, String rawValue, FieldType targetType,
                                String reason, Throwable cause) {
        super(code, path,
                "Cannot coerce '" + rawValue + "' to " + targetType + ": " + reason,
                Map.of("raw", String.valueOf(rawValue), "targetType", String.valueOf(targetType)),
                cause);
        this.rawValue = rawValue;
        this.targetType = targetType;
    }

    public String getRawValue() {
        return rawValue;
    }

    public FieldType getTargetType() {
        return targetType;
    }
}
