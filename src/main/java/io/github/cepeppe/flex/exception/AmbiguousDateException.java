package io.github.cepeppe.flex.exception;

import io.github.cepeppe.flex.coercion.DateMode;
import io.github.cepeppe.flex.coercion.FieldType;

/**
 * Una data in forma {@code NN/NN/yyyy} con entrambi i gruppi &le; 12 e diversi non può essere
 * disambiguata nella modalità attiva. Si evita l'interpretazione silenziosa MM/dd vs dd/MM:
 * il chiamante può preselezionare {@link DateMode#LEGACY} o {@link DateMode#DAY_FIRST}.
 */
public class AmbiguousDateException extends CoercionException {

    private static final long serialVersionUID = 1L;

    private final DateMode mode;

    public AmbiguousDateException(String path, String rawValue, FieldType targetType, DateMode mode) {
        super(Code.AMBIGUOUS_DATE, path, rawValue, targetType,
                "month/day order is ambiguous under date mode " + mode, null);
        this.mode = mode;
    }

    public DateMode getMode() {
        return mode;
    }
}
