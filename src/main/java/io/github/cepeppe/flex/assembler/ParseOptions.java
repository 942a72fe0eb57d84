package io.github.cepeppe.flex.assembler;

import io.github.cepeppe.flex.Constants;
import io.github.cepeppe.flex.Env;
import io.github.cepeppe.flex.coercion.CoercionOptions;
import io.github.cepeppe.flex.logging.FlexLogger;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

/**
 * Opzioni di un parsing.
 *
 * <ul>
 *   <li>{@code strict}: elementi non mappati, schema drift e codici sconosciuti diventano errori fatali.</li>
 *   <li>{@code permissive}: gli attributi non dichiarati sono conservati in
 *       {@link FlexParseResult#extraAttributes()} invece di essere scartati.</li>
 *   <li>{@code coercion}: regole di conversione (date, trim, liste di codici).</li>
 * </ul>
 */
@Getter
@Builder(toBuilder = true)
@ToString
public final class ParseOptions {

    private static final FlexLogger LOG = FlexLogger.getLogger(ParseOptions.class);

    @Builder.Default
    private final boolean strict = false;

    @Builder.Default
    private final boolean permissive = false;

    @Builder.Default
    private final CoercionOptions coercion = CoercionOptions.defaults();

    public static ParseOptions defaults() {
        return ParseOptions.builder().build();
    }

    /** Legge {@code FLEX_STRICT}, {@code FLEX_PERMISSIVE} e le chiavi di {@link CoercionOptions#fromEnvOrDefault()}. */
    public static ParseOptions fromEnvOrDefault() {
        ParseOptions options = ParseOptions.builder()
                .strict(Env.getBool(Constants.Parsing.KEY_STRICT, false))
                .permissive(Env.getBool(Constants.Parsing.KEY_PERMISSIVE, false))
                .coercion(CoercionOptions.fromEnvOrDefault())
                .build();
        LOG.info("Parse options loaded: strict={}, permissive={}", options.isStrict(), options.isPermissive());
        return options;
    }
}
