package io.github.cepeppe.flex.coercion;

/**
 * Tipi di destinazione supportati dal motore di coercion.
 * Ogni attributo dello schema dichiara uno di questi tipi.
 */
public enum FieldType {
    /** Testo, eventualmente trimmato. */
    TEXT,
    /** Intero base 10 (es. {@code count}). */
    INTEGER,
    /** Decimale esatto ({@link java.math.BigDecimal}), separatori di migliaia rimossi. */
    DECIMAL,
    /** {@code Y} / {@code N}. */
    BOOLEAN,
    /** Data di calendario. */
    DATE,
    /** Ora del giorno {@code HH:mm:ss} o {@code HHmmss}. */
    TIME,
    /** Data e ora combinate. */
    DATE_TIME,
    /** Singolo codice enumerato. */
    CODE,
    /** Lista ordinata di codici enumerati (duplicati conservati). */
    CODE_LIST
}
