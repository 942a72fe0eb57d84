package io.github.cepeppe.flex.coercion;

/**
 * Modalità di interpretazione delle date in forma {@code NN/NN/yyyy}.
 * <p>
 * Le forme {@code yyyy-MM-dd}, {@code yyyyMMdd} e {@code dd-MMM-yy} non sono ambigue
 * e sono accettate in ogni modalità.
 */
public enum DateMode {
    /** Solo forme non ambigue; le date con {@code /} sono rifiutate. */
    ISO,
    /** {@code MM/dd/yyyy}: il primo gruppo è il mese (default storico del fornitore). */
    LEGACY,
    /** {@code dd/MM/yyyy}: override esplicito per export europei. */
    DAY_FIRST,
    /** Nessuna modalità scelta: si accetta solo ciò che è deducibile senza indovinare. */
    AUTO
}
