package io.github.cepeppe.flex.client;

import io.github.cepeppe.flex.Constants;
import io.github.cepeppe.flex.Env;
import io.github.cepeppe.flex.logging.FlexLogger;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

/**
 * Configurazione immutabile del client del servizio Flex.
 * <p>
 * La classe incapsula:
 * <ul>
 *   <li>il token d'accesso e l'id della query Flex,</li>
 *   <li>l'URL base del servizio e la versione dell'API,</li>
 *   <li>gli intervalli di polling e il numero massimo di poll.</li>
 * </ul>
 *
 * <h3>Immutabilità &amp; sicurezza</h3>
 * Tutti i campi sono {@code final}. Il {@code toString()} non include mai il token.
 *
 * <h3>Esempio d'uso</h3>
 * <pre>{@code
 * FlexClientConfig cfg = FlexClientConfig.builder()
 *         .token(token)
 *         .queryId("123456")
 *         .build();
 * }</pre>
 */
@Getter
@AllArgsConstructor(access = AccessLevel.PRIVATE)
@Builder(toBuilder = true)
@ToString(onlyExplicitlyIncluded = true)
public class FlexClientConfig {

    private static final FlexLogger LOG = FlexLogger.getLogger(FlexClientConfig.class);

    /** Token del servizio Flex (attenzione a non loggarlo). */
    private final String token;

    @ToString.Include
    private final String queryId;

    @ToString.Include
    @Builder.Default
    private final String baseUrl = Constants.FlexService.DEFAULT_BASE_URL;

    @ToString.Include
    @Builder.Default
    private final String apiVersion = Constants.FlexService.DEFAULT_API_VERSION;

    /** Attesa tra due poll quando lo statement non è ancora pronto (1009, 1019). */
    @ToString.Include
    @Builder.Default
    private final long pollIntervalMs = Constants.FlexService.DEFAULT_POLL_INTERVAL_MS;

    /** Attesa dopo una risposta di throttling (1018). */
    @ToString.Include
    @Builder.Default
    private final long throttleIntervalMs = Constants.FlexService.DEFAULT_THROTTLE_INTERVAL_MS;

    @ToString.Include
    @Builder.Default
    private final int maxPolls = Constants.FlexService.DEFAULT_MAX_POLLS;

    /**
     * Verifica minima dei parametri, chiamata dal client alla costruzione.
     *
     * @throws IllegalArgumentException se token o query id mancano, o se un intervallo è negativo
     */
    public FlexClientConfig validate() {
        if (token == null || token.isBlank()) {
            throw new IllegalArgumentException("token mancante o vuoto");
        }
        if (queryId == null || queryId.isBlank()) {
            throw new IllegalArgumentException("queryId mancante o vuoto");
        }
        if (baseUrl == null || baseUrl.isBlank()) {
            throw new IllegalArgumentException("baseUrl mancante o vuoto");
        }
        if (pollIntervalMs < 0 || throttleIntervalMs < 0) {
            throw new IllegalArgumentException("intervalli di polling negativi non consentiti");
        }
        if (maxPolls < 1) {
            throw new IllegalArgumentException("maxPolls deve essere almeno 1");
        }
        return this;
    }

    /**
     * Costruisce la configurazione dall'ambiente.
     * <p>
     * {@code FLEX_TOKEN} e {@code FLEX_QUERY_ID} sono obbligatorie; le altre chiavi hanno i default di
     * {@link Constants.FlexService}.
     *
     * @throws io.github.cepeppe.flex.exception.FlexException con codice {@code CONFIG} se manca una chiave obbligatoria
     */
    public static FlexClientConfig fromEnv() {
        String token = Env.require(Constants.FlexService.KEY_TOKEN);
        String queryId = Env.require(Constants.FlexService.KEY_QUERY_ID);

        FlexClientConfig cfg = builderFromEnv()
                .token(token)
                .queryId(queryId)
                .build()
                .validate();

        // Log non sensibile (il token non compare in toString)
        LOG.info("FlexClientConfig loaded: {}", cfg);
        return cfg;
    }

    /**
     * Builder con URL, versione dell'API e parametri di polling letti dall'ambiente
     * ({@code FLEX_BASE_URL}, {@code FLEX_API_VERSION}, {@code FLEX_POLL_INTERVAL_MS},
     * {@code FLEX_THROTTLE_INTERVAL_MS}, {@code FLEX_MAX_POLLS}). Token e query id restano da impostare.
     */
    public static FlexClientConfigBuilder builderFromEnv() {
        return FlexClientConfig.builder()
                .baseUrl(Env.getOr(Constants.FlexService.KEY_BASE_URL, Constants.FlexService.DEFAULT_BASE_URL))
                .apiVersion(Env.getOr(Constants.FlexService.KEY_API_VERSION, Constants.FlexService.DEFAULT_API_VERSION))
                .pollIntervalMs(Env.getLong(Constants.FlexService.KEY_POLL_INTERVAL_MS,
                        Constants.FlexService.DEFAULT_POLL_INTERVAL_MS))
                .throttleIntervalMs(Env.getLong(Constants.FlexService.KEY_THROTTLE_INTERVAL_MS,
                        Constants.FlexService.DEFAULT_THROTTLE_INTERVAL_MS))
                .maxPolls(Env.getInt(Constants.FlexService.KEY_MAX_POLLS, Constants.FlexService.DEFAULT_MAX_POLLS));
    }
}
