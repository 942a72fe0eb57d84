package io.github.cepeppe.flex.codes;

import lombok.experimental.UtilityClass;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Lookup testo-&gt;membro per tutte le tabelle di codici.
 * <p>
 * L'indice di ogni tabella è costruito una sola volta per classe ({@link ClassValue}) ed è immutabile,
 * quindi il lookup è sicuro da thread concorrenti senza sincronizzazione.
 */
@UtilityClass
public class CodeTables {

    private static final ClassValue<Map<String, Enum<?>>> INDEX = new ClassValue<>() {
        @Override
        protected Map<String, Enum<?>> computeValue(Class<?> type) {
            Map<String, Enum<?>> byCode = new LinkedHashMap<>();
            for (Object constant : type.getEnumConstants()) {
                Enum<?> member = (Enum<?>) constant;
                Enum<?> previous = byCode.put(((CodeTable) member).code(), member);
                if (previous != null) {
                    throw new IllegalStateException("Duplicate code '" + ((CodeTable) member).code()
                            + "' in " + type.getSimpleName());
                }
            }
            return Collections.unmodifiableMap(byCode);
        }
    };

    /**
     * Confronto esatto (case-sensitive) del testo con i codici della tabella.
     *
     * @return il membro noto, o la variante non riconosciuta che conserva {@code raw}
     */
    @SuppressWarnings("unchecked")
    public static <E extends Enum<E> & CodeTable> FlexCode<E> lookup(Class<E> table, String raw) {
        Enum<?> member = INDEX.get(table).get(raw);
        if (member == null) {
            return FlexCode.unrecognized(raw);
        }
        return FlexCode.of((E) member);
    }

    /** {@code true} se {@code raw} è un codice noto della tabella. */
    public static boolean isKnown(Class<? extends Enum<?>> table, String raw) {
        return INDEX.get(table).containsKey(raw);
    }

    /** Forza la costruzione dell'indice (usato all'inizializzazione del registry). */
    public static int warmUp(Class<? extends Enum<?>> table) {
        return INDEX.get(table).size();
    }
}
