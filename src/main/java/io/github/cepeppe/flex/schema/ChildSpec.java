package io.github.cepeppe.flex.schema;

/**
 * Figlio strutturale di un record: un elemento singolo oppure una sezione ripetuta.
 *
 * @param elementName   nome del figlio diretto nel documento (il wrapper, per le sezioni)
 * @param component     nome del componente del record
 * @param index         posizione del componente nel costruttore canonico
 * @param kind          singolo o sezione
 * @param itemType      record costruito per ogni elemento
 * @param itemElement   nome dell'elemento item
 * @param nested        wrapper intermedio, vuoto se assente
 * @param countAttribute attributo del wrapper con il numero di item, vuoto se assente
 * @param required      se il figlio deve comparire
 */
public record ChildSpec(String elementName,
                        String component,
                        int index,
                        Kind kind,
                        Class<? extends Record> itemType,
                        String itemElement,
                        String nested,
                        String countAttribute,
                        boolean required) {

    public enum Kind {
        /** Al più un elemento, componente nullable. */
        SINGLE,
        /** Wrapper con zero o più item, componente {@code List}. */
        SECTION
    }

    public boolean hasNested() {
        return !nested.isEmpty();
    }

    public boolean hasCount() {
        return !countAttribute.isEmpty();
    }
}
