package io.github.cepeppe.flex.http;

import io.github.cepeppe.flex.Env;
import io.github.cepeppe.flex.logging.FlexLogger;
import io.github.cepeppe.flex.utils.HttpUtils;

import java.io.IOException;
import java.net.Authenticator;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.time.Instant;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ThreadLocalRandom;

import static io.github.cepeppe.flex.Constants.Http.*;

/**
 * Implementazione di {@link HttpClientPort} basata su {@link HttpClient} (Java 11+).
 * <p>
 * La classe incapsula:
 * <ul>
 *   <li>Invio sincrono di richieste HTTP, corpo della risposta in byte.</li>
 *   <li>Retry con backoff esponenziale (con cap) + jitter e rispetto dell'header Retry-After:
 *     <ul>
 *       <li>Codici di stato HTTP configurabili (es. 429, 503...)</li>
 *       <li>Eccezioni I/O/timeout sollevate dal client HTTP</li>
 *     </ul>
 *   </li>
 *   <li>Parametri di retry configurabili via {@link Env} (con fallback ai default di libreria).</li>
 * </ul>
 *
 * <h2>Configurazione</h2>
 * <ul>
 *   <li><b>BASE_BACKOFF_MS</b>: base del backoff esponenziale in millisecondi.</li>
 *   <li><b>MAX_ATTEMPTS</b>: numero massimo di tentativi inclusivo del primo.</li>
 *   <li><b>RETRY_STATUS_SET</b>: insieme di status HTTP per cui ritentare.</li>
 *   <li><b>BACKOFF_CAP_MS</b>: cap massimo per il backoff.</li>
 *   <li><b>JITTER_MIN</b>/<b>JITTER_MAX</b>: moltiplicatori jitter (default 0.5–1.5).</li>
 * </ul>
 *
 * <h2>Thread-safety</h2>
 * L'istanza di {@link HttpClient} è thread-safe; i parametri di retry sono letti una volta alla costruzione.
 *
 * <p><b>Nota</b>: gli URL del servizio Flex contengono il token; nei log passano sempre da
 * {@link HttpUtils#maskToken(java.net.URI)}.</p>
 */
public class BaseHttpClient implements HttpClientPort {

    private static final FlexLogger LOG = FlexLogger.getLogger(BaseHttpClient.class);

    private final HttpClient client;

    /**
     * Base (in millisecondi) per il calcolo del backoff esponenziale:
     * <pre>delay(attempt) = min(BASE * 2^(attempt-1), BACKOFF_CAP_MS) * jitter</pre>
     */
    private long retryBaseBackoffMs;

    /** Massimo numero di tentativi complessivi (incluso il primo invio). */
    private int retryMaxAttempts;

    /** Codici di stato HTTP considerati ritentabili. */
    private Set<Integer> retryStatusSet;

    private long backoffCapMs;
    private double jitterMin;
    private double jitterMax;

    public BaseHttpClient() {
        this(DEFAULT_CONNECT_TIMEOUT);
    }

    /**
     * @param connectTimeout timeout di connessione da usare per il client
     */
    public BaseHttpClient(Duration connectTimeout) {
        this(newClient(connectTimeout));
    }

    BaseHttpClient(HttpClient client) {
        this.client = client;
        loadRetrySettingsOrDefault();
    }

    private static HttpClient newClient(Duration connectTimeout) {
        HttpClient.Builder httpClientBuilder = HttpClient.newBuilder()
                .connectTimeout(connectTimeout)
                .version(DEFAULT_HTTP_VERSION)
                .followRedirects(HttpClient.Redirect.NORMAL);

        // autenticatore di sistema, se presente
        Authenticator auth = Authenticator.getDefault();
        if (auth != null) {
            httpClientBuilder.authenticator(auth);
        }

        return httpClientBuilder.build();
    }

    /**
     * Carica i parametri di retry tramite {@link Env}; valori mancanti o incoerenti tornano ai default.
     */
    private void loadRetrySettingsOrDefault() {
        this.retryBaseBackoffMs = Env.getLong(KEY_BASE_BACKOFF_MS, DEFAULT_BASE_BACKOFF_MS);
        this.retryMaxAttempts   = Env.getInt(KEY_MAX_ATTEMPTS, DEFAULT_MAX_ATTEMPTS);
        this.retryStatusSet     = Env.getSetOf(KEY_RETRY_STATUS_SET, Integer::valueOf, DEFAULT_RETRY_STATUS_SET);

        this.backoffCapMs = Env.getLong(KEY_BACKOFF_CAP_MS, DEFAULT_BACKOFF_CAP_MS);
        this.jitterMin    = Env.getDouble(KEY_JITTER_MIN, 0.5d);
        this.jitterMax    = Env.getDouble(KEY_JITTER_MAX, 1.5d);

        // clamp jitter coerente
        if (this.jitterMin <= 0d || this.jitterMax < this.jitterMin) {
            this.jitterMin = 0.5d;
            this.jitterMax = 1.5d;
        }
        if (this.retryBaseBackoffMs < 1L) this.retryBaseBackoffMs = 100L;
        if (this.backoffCapMs < this.retryBaseBackoffMs) this.backoffCapMs = Math.max(1000L, this.retryBaseBackoffMs);
        if (this.retryMaxAttempts < 1) this.retryMaxAttempts = 1;
    }

    /**
     * Invio sincrono con retry.
     * <ol>
     *   <li>Se la risposta <i>non</i> è in {@code retryStatusSet}, ritorna subito.</li>
     *   <li>Se è ritentabile o è stata sollevata una {@link IOException}: attende il backoff e ritenta
     *       fino a {@code retryMaxAttempts}.</li>
     *   <li>A tentativi esauriti restituisce l'ultima risposta; senza alcuna risposta rilancia l'ultima eccezione.</li>
     * </ol>
     */
    @Override
    public HttpResponse<byte[]> sendWithRetry(HttpRequest req) throws IOException, InterruptedException {
        String target = req.method() + " " + HttpUtils.maskToken(req.uri());
        LOG.debug("Sending sync http request with enabled retries: {}", target);

        int attempt = 1;
        while (true) {
            try {
                HttpResponse<byte[]> res = this.client.send(req, HttpResponse.BodyHandlers.ofByteArray());

                if (!this.retryStatusSet.contains(res.statusCode()) || attempt >= this.retryMaxAttempts) {
                    return res;
                }

                long retryAfterMs = parseRetryAfterMillis(res, Instant.now()).orElse(0L);
                long delay = computeDelayMs(attempt, retryAfterMs);
                LOG.debug("Attempt {}/{} for {} returned {}, retrying in {} ms",
                        attempt, retryMaxAttempts, target, res.statusCode(), delay);
                Thread.sleep(delay);
                attempt++;

            } catch (IOException ex) {
                if (attempt >= this.retryMaxAttempts) {
                    throw ex;
                }
                long delay = computeDelayMs(attempt, null);
                LOG.debug("Attempt {}/{} for {} failed ({}), retrying in {} ms",
                        attempt, retryMaxAttempts, target, ex.toString(), delay);
                Thread.sleep(delay);
                attempt++;
            }
        }
    }

    /**
     * Calcolo del delay:
     * - base * 2^(attempt-1) con cap
     * - Retry-After (se presente) vince sul base, entro il cap
     * - jitter moltiplicativo in [jitterMin, jitterMax]
     */
    long computeDelayMs(int attempt, Long retryAfterMsNullable) {
        double exp = Math.pow(2.0d, Math.max(0, attempt - 1));
        long backoff = (long) Math.min(retryBaseBackoffMs * exp, (double) backoffCapMs);

        if (retryAfterMsNullable != null && retryAfterMsNullable > 0L) {
            backoff = Math.min(Math.max(backoff, retryAfterMsNullable), backoffCapMs);
        }

        double jitter = jitterMax > jitterMin
                ? ThreadLocalRandom.current().nextDouble(jitterMin, jitterMax)
                : jitterMin;
        return (long) Math.max(1L, Math.floor(backoff * jitter));
    }

    /**
     * Parsing header Retry-After: intero (secondi) oppure HTTP-date (RFC_1123).
     */
    static Optional<Long> parseRetryAfterMillis(HttpResponse<?> res, Instant now) {
        Optional<String> v = res.headers().firstValue("Retry-After");
        if (v.isEmpty()) return Optional.empty();
        String s = v.get().trim();
        try {
            if (!s.isEmpty() && s.chars().allMatch(Character::isDigit)) {
                return Optional.of(Math.max(0L, Long.parseLong(s) * 1000L));
            }
            Instant when = Instant.from(DateTimeFormatter.RFC_1123_DATE_TIME.parse(s));
            return Optional.of(Math.max(0L, when.toEpochMilli() - now.toEpochMilli()));
        } catch (DateTimeParseException | NumberFormatException e) {
            LOG.debug("Ignoring unparseable Retry-After '{}'", s);
            return Optional.empty();
        }
    }
}
