package io.github.cepeppe.flex.coercion;

import io.github.cepeppe.flex.Constants;
import io.github.cepeppe.flex.Env;
import io.github.cepeppe.flex.exception.FlexException;
import io.github.cepeppe.flex.logging.FlexLogger;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

import java.util.Locale;

/**
 * Configurazione immutabile del motore di coercion.
 *
 * <h2>Default</h2>
 * <ul>
 *   <li>{@code dateMode} = {@link DateMode#AUTO}</li>
 *   <li>{@code strictAmbiguity} = {@code true}: una data ambigua in AUTO è un errore, non un'ipotesi</li>
 *   <li>{@code dateTimeSeparator} = {@code ';'}</li>
 *   <li>{@code trimText} = {@code true}</li>
 *   <li>{@code legacyCodeRuns} = {@code false}</li>
 * </ul>
 *
 * <h2>Origine dei valori</h2>
 * {@link #fromEnvOrDefault()} legge le chiavi {@code FLEX_DATE_MODE}, {@code FLEX_STRICT_AMBIGUITY},
 * {@code FLEX_DATETIME_SEPARATOR}, {@code FLEX_TRIM_TEXT}, {@code FLEX_LEGACY_CODE_RUNS} tramite {@link Env}.
 */
@Getter
@Builder(toBuilder = true)
@ToString
public final class CoercionOptions {

    private static final FlexLogger LOG = FlexLogger.getLogger(CoercionOptions.class);

    /** Modalità per le date con {@code /}. */
    @Builder.Default
    private final DateMode dateMode = DateMode.AUTO;

    /** In {@link DateMode#AUTO}: fallisce sulle date ambigue invece di assumere month-first. */
    @Builder.Default
    private final boolean strictAmbiguity = true;

    /** Separatore atteso tra data e ora; gli altri separatori standard sono provati dopo. */
    @Builder.Default
    private final char dateTimeSeparator = Constants.Parsing.DEFAULT_DATETIME_SEPARATOR;

    /** Rimuove gli spazi di padding dai campi testo. */
    @Builder.Default
    private final boolean trimText = true;

    /** Accetta liste di codici mono-carattere concatenate senza separatore (documenti legacy). */
    @Builder.Default
    private final boolean legacyCodeRuns = false;

    /** Opzioni di default. */
    public static CoercionOptions defaults() {
        return CoercionOptions.builder().build();
    }

    /**
     * Costruisce le opzioni leggendo l'ambiente; le chiavi assenti mantengono il default.
     *
     * @throws FlexException con codice {@code CONFIG} se {@code FLEX_DATE_MODE} o il separatore non sono validi
     */
    public static CoercionOptions fromEnvOrDefault() {
        String modeRaw = Env.getOr(Constants.Parsing.KEY_DATE_MODE, DateMode.AUTO.name());
        DateMode mode;
        try {
            mode = DateMode.valueOf(modeRaw.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw FlexException.wrap(e, FlexException.Code.CONFIG,
                    "Invalid " + Constants.Parsing.KEY_DATE_MODE + ": " + modeRaw, "value", modeRaw);
        }

        String sepRaw = Env.getOrDefault(Constants.Parsing.KEY_DATETIME_SEPARATOR,
                String.valueOf(Constants.Parsing.DEFAULT_DATETIME_SEPARATOR));
        if (sepRaw.length() != 1) {
            throw FlexException.of(FlexException.Code.CONFIG,
                    Constants.Parsing.KEY_DATETIME_SEPARATOR + " must be a single character", "value", sepRaw);
        }

        CoercionOptions options = CoercionOptions.builder()
                .dateMode(mode)
                .strictAmbiguity(Env.getBool(Constants.Parsing.KEY_STRICT_AMBIGUITY, true))
                .dateTimeSeparator(sepRaw.charAt(0))
                .trimText(Env.getBool(Constants.Parsing.KEY_TRIM_TEXT, true))
                .legacyCodeRuns(Env.getBool(Constants.Parsing.KEY_LEGACY_CODE_RUNS, false))
                .build();
        LOG.info("Coercion options loaded: {}", options);
        return options;
    }
}
