package io.github.cepeppe.flex.assembler;

/**
 * Evento non fatale: il parsing prosegue, l'evento viene restituito insieme al risultato.
 *
 * @param path     path dell'elemento o dell'attributo (es. {@code .../Trades/Trade[3]@buySell})
 * @param rawValue valore grezzo coinvolto (per gli elementi non mappati, il nome dell'elemento)
 * @param kind     classificazione
 * @param message  descrizione leggibile
 */
public record Diagnostic(String path, String rawValue, DiagnosticKind kind, String message) {

    @Override
    public String toString() {
        return kind + " at " + path + ": " + message;
    }
}
