package io.github.cepeppe.flex;

import java.net.http.HttpClient;
import java.time.Duration;
import java.util.List;
import java.util.Set;

public class Constants {

    // =====================================================================
    // HTTP CLIENT
    // =====================================================================

    public static final class Http {
        private Http() { /* no-op */ }

        // Ignorato se la connessione viene riusata da una richiesta precedente.
        public static final Duration DEFAULT_CONNECT_TIMEOUT = Duration.ofSeconds(10);

        // Timeout di una singola HttpRequest; gli statement grandi richiedono più dei 5s tipici di una REST API.
        public static final Duration DEFAULT_REQUEST_TIMEOUT = Duration.ofSeconds(30);

        // Il servizio Flex risponde in HTTP/1.1
        public static final HttpClient.Version DEFAULT_HTTP_VERSION = HttpClient.Version.HTTP_1_1;

        // HTTP Response status che portano a retry
        public static final Set<Integer> DEFAULT_RETRY_STATUS_SET = Set.of(429, 500, 502, 503, 504);

        // OK HTTP Response status
        public static final Set<Integer> DEFAULT_OK_STATUS_SET = Set.of(200, 201, 202, 203);

        // Default Base backoff exp
        public static final long DEFAULT_BASE_BACKOFF_MS = 500L;

        // Cap del backoff
        public static final long DEFAULT_BACKOFF_CAP_MS = 5_000L;

        // Default retry max attempts (incluso il primo invio)
        public static final int DEFAULT_MAX_ATTEMPTS = 3;

        // Chiavi di override (Env / System Properties)
        public static final String KEY_BASE_BACKOFF_MS  = "BASE_BACKOFF_MS";
        public static final String KEY_MAX_ATTEMPTS     = "MAX_ATTEMPTS";
        public static final String KEY_RETRY_STATUS_SET = "RETRY_STATUS_SET";
        public static final String KEY_BACKOFF_CAP_MS   = "BACKOFF_CAP_MS";
        public static final String KEY_JITTER_MIN       = "JITTER_MIN";
        public static final String KEY_JITTER_MAX       = "JITTER_MAX";
    }

    // =====================================================================
    // PARSING
    // =====================================================================

    public static final class Parsing {
        private Parsing() { /* no-op */ }

        public static final char DEFAULT_DATETIME_SEPARATOR = ';';

        // Separatori data/ora provati dopo quello configurato, in quest'ordine ("" = nessun separatore)
        public static final List<String> STANDARD_DATETIME_SEPARATORS = List.of(";", ",", " ", "");

        // Separatore di default per le liste di codici (notes, code)
        public static final String DEFAULT_CODE_LIST_SEPARATOR = ";";

        // Sotto questa lunghezza un valore data-ora contiene solo la data
        public static final int MIN_DATETIME_LENGTH = 12;

        // Anni a due cifre: > pivot -> 19xx, altrimenti 20xx
        public static final int TWO_DIGIT_YEAR_PIVOT = 68;

        public static final String KEY_DATE_MODE          = "FLEX_DATE_MODE";
        public static final String KEY_STRICT_AMBIGUITY   = "FLEX_STRICT_AMBIGUITY";
        public static final String KEY_DATETIME_SEPARATOR = "FLEX_DATETIME_SEPARATOR";
        public static final String KEY_TRIM_TEXT          = "FLEX_TRIM_TEXT";
        public static final String KEY_LEGACY_CODE_RUNS   = "FLEX_LEGACY_CODE_RUNS";
        public static final String KEY_STRICT             = "FLEX_STRICT";
        public static final String KEY_PERMISSIVE         = "FLEX_PERMISSIVE";
    }

    // =====================================================================
    // FLEX WEB SERVICE
    // =====================================================================

    public static final class FlexService {
        private FlexService() { /* no instances */ }

        public static final String DEFAULT_BASE_URL = "https://gdcdyn.interactivebrokers.com/Universal/servlet/";

        public static final String SEND_REQUEST_PATH  = "FlexStatementService.SendRequest";
        public static final String GET_STATEMENT_PATH = "FlexStatementService.GetStatement";

        public static final String DEFAULT_API_VERSION = "3";

        // Il servizio rifiuta user-agent sconosciuti
        public static final String USER_AGENT = "Java";

        public static final String PARAM_VERSION = "v";
        public static final String PARAM_TOKEN   = "t";
        public static final String PARAM_QUERY   = "q";

        // Statement in generazione / server occupato: riprovare più tardi
        public static final Set<Integer> NOT_READY_ERROR_CODES = Set.of(1009, 1019);

        // Troppe richieste
        public static final Set<Integer> THROTTLED_ERROR_CODES = Set.of(1018);

        public static final long DEFAULT_POLL_INTERVAL_MS     = 5_000L;
        public static final long DEFAULT_THROTTLE_INTERVAL_MS = 10_000L;
        public static final int  DEFAULT_MAX_POLLS            = 20;

        public static final String KEY_TOKEN                = "FLEX_TOKEN";
        public static final String KEY_QUERY_ID             = "FLEX_QUERY_ID";
        public static final String KEY_BASE_URL             = "FLEX_BASE_URL";
        public static final String KEY_API_VERSION          = "FLEX_API_VERSION";
        public static final String KEY_POLL_INTERVAL_MS     = "FLEX_POLL_INTERVAL_MS";
        public static final String KEY_THROTTLE_INTERVAL_MS = "FLEX_THROTTLE_INTERVAL_MS";
        public static final String KEY_MAX_POLLS            = "FLEX_MAX_POLLS";
    }

    private Constants() {}
}
