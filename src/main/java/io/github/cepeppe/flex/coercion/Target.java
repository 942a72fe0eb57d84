package io.github.cepeppe.flex.coercion;

import java.util.Objects;

/**
 * Destinazione di una coercion: tipo, tabella di codici (solo per {@link FieldType#CODE} e
 * {@link FieldType#CODE_LIST}) e separatore delle liste.
 */
public record Target(FieldType type, Class<? extends Enum<?>> codeTable, String separator) {

    public Target {
        Objects.requireNonNull(type, "type");
        if ((type == FieldType.CODE || type == FieldType.CODE_LIST) && codeTable == null) {
            throw new IllegalArgumentException(type + " target requires a code table");
        }
        if (type == FieldType.CODE_LIST && (separator == null || separator.isEmpty())) {
            throw new IllegalArgumentException("CODE_LIST target requires a separator");
        }
    }

    public static Target of(FieldType type) {
        return new Target(type, null, null);
    }

    public static Target code(Class<? extends Enum<?>> table) {
        return new Target(FieldType.CODE, table, null);
    }

    public static Target codeList(Class<? extends Enum<?>> table, String separator) {
        return new Target(FieldType.CODE_LIST, table, separator);
    }
}
