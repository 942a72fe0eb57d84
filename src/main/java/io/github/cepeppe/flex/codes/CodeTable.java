package io.github.cepeppe.flex.codes;

/**
 * Contratto comune delle tabelle di codici: ogni membro espone il testo esatto
 * che il servizio Flex scrive nell'attributo XML (es. {@code "BUY (Ca.)"}).
 */
public interface CodeTable {

    /** Testo del codice così come appare nel documento. */
    String code();
}
