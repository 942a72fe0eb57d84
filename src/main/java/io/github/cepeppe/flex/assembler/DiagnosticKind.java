package io.github.cepeppe.flex.assembler;

/** Classificazione degli eventi non fatali raccolti durante il parsing. */
public enum DiagnosticKind {
    /** Elemento fuori vocabolario: il sottoalbero è stato saltato. */
    UNMAPPED_ELEMENT,
    /** Attributo non dichiarato su un elemento noto. */
    SCHEMA_DRIFT,
    /** Codice fuori dalla tabella nota, conservato come testo grezzo. */
    UNRECOGNIZED_CODE
}
