package io.github.cepeppe.flex.utils;

import io.github.cepeppe.flex.Constants;

import java.net.URI;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Utility HTTP/URL a basso livello (senza dipendenze esterne).
 *
 * <p><b>Obiettivi</b>:
 * <ul>
 *   <li>Composizione di URL (join base+path, query param).</li>
 *   <li>Mascheramento del token Flex prima di scrivere un URL nei log.</li>
 *   <li>Anteprime troncate dei body per messaggi d'errore.</li>
 * </ul>
 */
public final class HttpUtils {

    private static final Pattern TOKEN_PARAM =
            Pattern.compile("([?&]" + Pattern.quote(Constants.FlexService.PARAM_TOKEN) + "=)[^&#]*");

    private HttpUtils(){}

    /**
     * Unisce un URL base e un path, evitando doppie o mancanti slash.
     *
     * @param base base URL (es. {@code https://gdcdyn.interactivebrokers.com/Universal/servlet/})
     * @param path path logico, con o senza slash iniziale
     * @return URL risultante
     */
    public static String joinUrl(String base, String path) {
        if (base == null || base.isBlank()) return path;
        if (path == null || path.isBlank()) return base;

        boolean baseEndsWithSlash = base.endsWith("/");
        boolean pathStartsWithSlash = path.startsWith("/");
        if (baseEndsWithSlash && pathStartsWithSlash) {
            return base + path.substring(1);
        } else if (!baseEndsWithSlash && !pathStartsWithSlash) {
            return base + "/" + path;
        } else {
            return base + path;
        }
    }

    /**
     * Restituisce un URL con i query param aggiunti, partendo da {@code url}.
     *
     * <p><b>Comportamento</b>:
     * <ul>
     *   <li>Se {@code queryParams} è null o vuota restituisce l'URL invariato.</li>
     *   <li>Filtra entry con chiave o valore null/blank.</li>
     *   <li>Applica URL-encoding UTF-8 a nomi e valori.</li>
     *   <li>Se l'URL ha già una query, appende con {@code &} preservando quella esistente.</li>
     * </ul>
     *
     * @param url         URL base (può già contenere una query)
     * @param queryParams mappa nome→valore, nell'ordine di iterazione della mappa
     */
    public static String setQueryParams(String url, Map<String, String> queryParams) {
        if (url == null || url.isBlank()) return url;
        if (queryParams == null || queryParams.isEmpty()) return stripTrailingQuestionMark(url);

        String newQuery = queryParams.entrySet().stream()
                .filter(e -> e.getKey() != null && !e.getKey().isBlank())
                .filter(e -> e.getValue() != null && !e.getValue().isBlank())
                .map(e -> encodeQueryComponent(e.getKey()) + "=" + encodeQueryComponent(e.getValue()))
                .collect(Collectors.joining("&"));

        if (newQuery.isBlank()) {
            return stripTrailingQuestionMark(url);
        }

        int qIdx = url.indexOf('?');
        if (qIdx < 0) {
            return url + "?" + newQuery;
        }
        if (qIdx == url.length() - 1 || url.endsWith("&")) {
            return url + newQuery;
        }
        return url + "&" + newQuery;
    }

    /** Sostituisce il valore del parametro token ({@code t=}) con {@code ***}. */
    public static String maskToken(String url) {
        if (url == null) return null;
        return TOKEN_PARAM.matcher(url).replaceAll("$1***");
    }

    public static String maskToken(URI uri) {
        return uri == null ? "null" : maskToken(uri.toString());
    }

    /**
     * Anteprima sicura di un body per messaggi d'errore/logging.
     *
     * @param s      stringa originale (può essere {@code null})
     * @param maxLen numero massimo di caratteri
     * @return anteprima troncata con "..." se necessario
     */
    public static String safePreview(String s, int maxLen) {
        if (s == null) return "null";
        if (maxLen <= 0) return "";
        return s.length() <= maxLen ? s : s.substring(0, maxLen) + "...";
    }

    /**
     * Vista testuale di un body grezzo, un carattere per byte (ISO-8859-1).
     * Adatta a cercare marker ASCII e a produrre anteprime per i log, non a leggere il contenuto:
     * i caratteri non ASCII di altre codifiche risultano spezzati.
     *
     * @return stringa vuota se {@code body} è {@code null}
     */
    public static String asciiView(byte[] body) {
        if (body == null) return "";
        return new String(body, StandardCharsets.ISO_8859_1);
    }

    /** URL-encode per componenti di query (UTF-8). */
    private static String encodeQueryComponent(String v) {
        return URLEncoder.encode(v, StandardCharsets.UTF_8);
    }

    private static String stripTrailingQuestionMark(String s) {
        if (s == null || s.isEmpty()) return s;
        return s.endsWith("?") ? s.substring(0, s.length() - 1) : s;
    }
}
