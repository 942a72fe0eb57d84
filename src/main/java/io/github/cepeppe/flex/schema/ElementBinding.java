package io.github.cepeppe.flex.schema;

/**
 * Risultato di un lookup nel {@link SchemaRegistry}: lo schema del record oppure
 * il risultato distinto {@link Unmapped} per gli elementi fuori vocabolario.
 */
public sealed interface ElementBinding permits ElementBinding.Mapped, ElementBinding.Unmapped {

    String elementName();

    record Mapped(RecordSchema schema) implements ElementBinding {
        @Override
        public String elementName() {
            return schema.elementName();
        }
    }

    record Unmapped(String elementName) implements ElementBinding {
    }
}
