package io.github.cepeppe.flex.codes;

import java.util.Objects;
import java.util.Optional;

/**
 * Valore di un codice enumerato: un membro noto della tabella {@code E}, oppure la variante
 * {@link Unrecognized} che conserva il testo grezzo.
 * <p>
 * È il meccanismo di compatibilità in avanti: un codice nuovo introdotto dal fornitore non fa mai
 * fallire il parsing, viene solo marcato come non riconosciuto.
 *
 * <pre>{@code
 * FlexCode<BuySell> side = trade.buySell();
 * if (side.is(BuySell.BUY)) { ... }
 * side.known().ifPresentOrElse(..., () -> log(side.raw()));
 * }</pre>
 *
 * @param <E> tabella di codici di riferimento
 */
public sealed interface FlexCode<E extends Enum<E> & CodeTable> permits FlexCode.Known, FlexCode.Unrecognized {

    /** Testo del codice come appare nel documento (per i membri noti coincide con {@link CodeTable#code()}). */
    String raw();

    /** {@code true} se il valore appartiene alla tabella nota. */
    boolean isKnown();

    /** Membro noto, se presente. */
    Optional<E> known();

    /** {@code true} se il valore è esattamente il membro indicato. */
    default boolean is(E member) {
        return known().map(m -> m == member).orElse(false);
    }

    /** Membro noto oppure {@code fallback} per i codici non riconosciuti. */
    default E orElse(E fallback) {
        return known().orElse(fallback);
    }

    static <E extends Enum<E> & CodeTable> FlexCode<E> of(E member) {
        return new Known<>(member);
    }

    static <E extends Enum<E> & CodeTable> FlexCode<E> unrecognized(String raw) {
        return new Unrecognized<>(raw);
    }

    /** Membro della tabella nota. */
    record Known<E extends Enum<E> & CodeTable>(E value) implements FlexCode<E> {
        public Known {
            Objects.requireNonNull(value, "value");
        }

        @Override public String raw() { return value.code(); }
        @Override public boolean isKnown() { return true; }
        @Override public Optional<E> known() { return Optional.of(value); }
        @Override public String toString() { return value.name(); }
    }

    /** Codice fuori dalla tabella nota: conserva il testo originale. */
    record Unrecognized<E extends Enum<E> & CodeTable>(String raw) implements FlexCode<E> {
        public Unrecognized {
            Objects.requireNonNull(raw, "raw");
        }

        @Override public boolean isKnown() { return false; }
        @Override public Optional<E> known() { return Optional.empty(); }
        @Override public String toString() { return "Unrecognized[" + raw + "]"; }
    }
}
