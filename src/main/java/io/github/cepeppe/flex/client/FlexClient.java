package io.github.cepeppe.flex.client;

import io.github.cepeppe.flex.Constants;
import io.github.cepeppe.flex.FlexParser;
import io.github.cepeppe.flex.assembler.FlexParseResult;
import io.github.cepeppe.flex.assembler.ParseOptions;
import io.github.cepeppe.flex.exception.FlexException;
import io.github.cepeppe.flex.exception.FlexRetrievalException;
import io.github.cepeppe.flex.http.BaseHttpClient;
import io.github.cepeppe.flex.http.HttpClientPort;
import io.github.cepeppe.flex.logging.FlexLogger;
import io.github.cepeppe.flex.utils.HttpUtils;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

import static io.github.cepeppe.flex.Constants.FlexService.*;

/**
 * Client del Flex Web Service (versione 3): scarica uno statement con il protocollo a due fasi.
 *
 * <h2>Protocollo</h2>
 * <ol>
 *   <li>{@code SendRequest?v=3&t=<token>&q=<queryId>}: il servizio risponde con una
 *       {@link FlexStatementResponse} contenente {@code ReferenceCode} e {@code Url}.</li>
 *   <li>{@code GetStatement?v=3&t=<token>&q=<referenceCode>}: ripetuto finché lo statement è pronto.
 *       I codici {@code 1009}/{@code 1019} (generazione in corso, server occupato) attendono
 *       {@code pollIntervalMs}, il codice {@code 1018} (throttling) attende {@code throttleIntervalMs};
 *       ogni altro codice è un errore.</li>
 * </ol>
 *
 * Gli errori di trasporto (I/O, 5xx, 429) sono ritentati dal {@link HttpClientPort} con backoff esponenziale.
 * Il chiamante riceve sempre il documento completo oppure una {@link FlexRetrievalException}.
 * Il token non viene mai scritto nei log: gli URL sono loggati con {@link HttpUtils#maskToken(URI)}.
 */
public class FlexClient {

    private static final FlexLogger LOG = FlexLogger.getLogger(FlexClient.class);

    private static final String STATEMENT_MARKER = "FlexQueryResponse";

    /** Attesa tra due poll; sostituibile nei test. */
    @FunctionalInterface
    public interface Sleeper {
        void sleep(long millis) throws InterruptedException;
    }

    private final FlexClientConfig config;
    private final HttpClientPort http;
    private final Sleeper sleeper;

    public FlexClient(FlexClientConfig config) {
        this(config, new BaseHttpClient());
    }

    public FlexClient(FlexClientConfig config, HttpClientPort http) {
        this(config, http, Thread::sleep);
    }

    public FlexClient(FlexClientConfig config, HttpClientPort http, Sleeper sleeper) {
        this.config = Objects.requireNonNull(config, "config").validate();
        this.http = Objects.requireNonNull(http, "http");
        this.sleeper = Objects.requireNonNull(sleeper, "sleeper");
    }

    /**
     * Scarica lo statement e lo restituisce come XML grezzo, byte per byte come inviato dal servizio.
     *
     * @return il documento {@code FlexQueryResponse} completo
     * @throws FlexRetrievalException codice del servizio, budget di polling esaurito, risposta non interpretabile
     *                                o errore di trasporto
     */
    public byte[] fetchRaw() {
        long start = System.nanoTime();
        byte[] body = requestStatement();
        if (isStatement(body)) {
            LOG.info("Flex statement for query {} returned directly by SendRequest", config.getQueryId());
            return body;
        }

        FlexStatementResponse access = FlexStatementResponse.fromXml(body);
        if (!access.isSuccess() || access.getReferenceCode() == null || access.getReferenceCode().isBlank()) {
            FlexRetrievalException ex = failureOf(access, body);
            LOG.error("SendRequest for query {} failed: {}", config.getQueryId(), ex.getMessage());
            throw ex;
        }

        String url = (access.getUrl() == null || access.getUrl().isBlank())
                ? HttpUtils.joinUrl(config.getBaseUrl(), GET_STATEMENT_PATH)
                : access.getUrl().trim();

        byte[] statement = pollStatement(url, access.getReferenceCode().trim());
        LOG.info("Flex statement for query {} downloaded ({} bytes) in {} ms",
                config.getQueryId(), statement.length, (System.nanoTime() - start) / 1_000_000L);
        return statement;
    }

    /**
     * Scarica lo statement e lo converte nel grafo tipizzato.
     *
     * @param options opzioni del parsing
     * @throws FlexRetrievalException se il download fallisce
     * @throws FlexException          (sottoclassi di parsing) se il documento scaricato non è valido
     */
    public FlexParseResult fetch(ParseOptions options) {
        return FlexParser.parse(fetchRaw(), options);
    }

    public FlexParseResult fetch() {
        return fetch(ParseOptions.defaults());
    }

    /* =======================
       Fase 1: SendRequest
       ======================= */

    private byte[] requestStatement() {
        String url = HttpUtils.joinUrl(config.getBaseUrl(), SEND_REQUEST_PATH);
        return get(url, config.getQueryId());
    }

    /* =======================
       Fase 2: GetStatement
       ======================= */

    private byte[] pollStatement(String url, String referenceCode) {
        for (int poll = 1; poll <= config.getMaxPolls(); poll++) {
            byte[] body = get(url, referenceCode);
            if (isStatement(body)) {
                return body;
            }

            FlexStatementResponse response = FlexStatementResponse.fromXml(body);
            Integer code = response.getErrorCode();
            if (code == null) {
                throw FlexRetrievalException.badResponse(
                        "GetStatement returned neither a statement nor an error code: "
                                + HttpUtils.safePreview(HttpUtils.asciiView(body), 200), null);
            }

            long waitMs;
            if (NOT_READY_ERROR_CODES.contains(code)) {
                waitMs = config.getPollIntervalMs();
            } else if (THROTTLED_ERROR_CODES.contains(code)) {
                waitMs = config.getThrottleIntervalMs();
            } else {
                FlexRetrievalException ex = FlexRetrievalException.serviceError(code, response.getErrorMessage());
                LOG.error("GetStatement for reference {} failed: {}", referenceCode, ex.getMessage());
                throw ex;
            }

            if (poll < config.getMaxPolls()) {
                LOG.warn("Statement {} not ready (code {}: {}), poll {}/{}, waiting {} ms",
                        referenceCode, code, response.getErrorMessage(), poll, config.getMaxPolls(), waitMs);
                pause(waitMs);
            }
        }

        LOG.error("Statement {} not ready after {} polls", referenceCode, config.getMaxPolls());
        throw new FlexRetrievalException(FlexException.Code.TIMEOUT,
                "Statement " + referenceCode + " not ready after " + config.getMaxPolls() + " polls", null, null);
    }

    /* =======================
       Helper
       ======================= */

    private byte[] get(String url, String query) {
        Map<String, String> params = new LinkedHashMap<>();
        params.put(PARAM_VERSION, config.getApiVersion());
        params.put(PARAM_TOKEN, config.getToken());
        params.put(PARAM_QUERY, query);
        URI uri = URI.create(HttpUtils.setQueryParams(url, params));

        HttpRequest req = HttpRequest.newBuilder(uri)
                .header("User-Agent", USER_AGENT)
                .timeout(Constants.Http.DEFAULT_REQUEST_TIMEOUT)
                .GET()
                .build();

        HttpResponse<byte[]> res;
        try {
            res = http.sendWithRetry(req);
        } catch (IOException e) {
            LOG.error("Transport error calling {}: {}", HttpUtils.maskToken(uri), e.toString());
            throw new FlexRetrievalException(FlexException.Code.RETRIEVAL,
                    "Transport error calling " + HttpUtils.maskToken(uri), null, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new FlexRetrievalException(FlexException.Code.RETRIEVAL,
                    "Interrupted while calling " + HttpUtils.maskToken(uri), null, e);
        }

        if (!Constants.Http.DEFAULT_OK_STATUS_SET.contains(res.statusCode())) {
            LOG.error("HTTP {} from {}", res.statusCode(), HttpUtils.maskToken(uri));
            throw FlexRetrievalException.badResponse("HTTP " + res.statusCode() + " from "
                    + HttpUtils.maskToken(uri) + ": " + HttpUtils.safePreview(HttpUtils.asciiView(res.body()), 200), null);
        }
        byte[] body = res.body();
        if (HttpUtils.asciiView(body).isBlank()) {
            throw FlexRetrievalException.badResponse("Empty body from " + HttpUtils.maskToken(uri), null);
        }
        return body;
    }

    private void pause(long millis) {
        if (millis <= 0) return;
        try {
            sleeper.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new FlexRetrievalException(FlexException.Code.RETRIEVAL,
                    "Interrupted while waiting for the statement", null, e);
        }
    }

    private static boolean isStatement(byte[] body) {
        return HttpUtils.asciiView(body).contains(STATEMENT_MARKER);
    }

    private static FlexRetrievalException failureOf(FlexStatementResponse response, byte[] body) {
        if (response.hasErrorCode()) {
            return FlexRetrievalException.serviceError(response.getErrorCode(), response.getErrorMessage());
        }
        return FlexRetrievalException.badResponse(
                "SendRequest returned no reference code: " + HttpUtils.safePreview(HttpUtils.asciiView(body), 200), null);
    }
}
