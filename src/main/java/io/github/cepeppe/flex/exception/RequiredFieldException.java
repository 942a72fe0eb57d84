package io.github.cepeppe.flex.exception;

import java.util.Map;

/**
 * Un attributo dichiarato obbligatorio manca (o è vuoto) su un elemento riconosciuto.
 * Indica una variante di documento non supportata, quindi è sempre fatale.
 */
public class RequiredFieldException extends FlexParseException {

    private static final long serialVersionUID = 1L;

    private final String recordType;
    private final String field;

    public RequiredFieldException(String path, String recordType, String field) {
        super(Code.REQUIRED_FIELD, path,
                "Missing required field '" + field + "' on record " + recordType,
                Map.of("record", recordType, "field", field), null);
        this.recordType = recordType;
        this.field = field;
    }

    public String getRecordType() {
        return recordType;
    }

    public String getField() {
        return field;
    }
}
