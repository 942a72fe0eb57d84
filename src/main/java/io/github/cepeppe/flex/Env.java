package io.github.cepeppe.flex;

import io.github.cepeppe.flex.exception.FlexException;
import io.github.cepeppe.flex.logging.FlexLogger;
import lombok.experimental.UtilityClass;

import java.io.BufferedReader;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;

/**
 * Lettura della configurazione.
 * <p>
 * Ordine di risoluzione di una chiave: System property, variabile d'ambiente, file {@code .env}
 * nella working directory (percorso sovrascrivibile con la System property {@code flex.dotenv}).
 */
@UtilityClass
public class Env {
    private static final FlexLogger LOG = FlexLogger.getLogger(Env.class);
    private static final Map<String, String> DOTENV =
            loadDotenv(Paths.get(System.getProperty("flex.dotenv", ".env")));

    public static String get(String key) {
        String v = System.getProperty(key);
        if (v != null) return v;
        v = System.getenv(key);
        if (v != null) return v;
        return DOTENV.get(key);
    }

    public static String getOrDefault(String key, String def) {
        String v = get(key);
        return v != null ? v : def;
    }

    /** Come get(), ma con default anche per valori blank. */
    public static String getOr(String key, String defaultValue) {
        String v = get(key);
        if (v == null || v.isBlank()) return defaultValue;
        return v;
    }

    /**
     * Valore obbligatorio.
     *
     * @throws FlexException con codice {@code CONFIG} se la chiave manca o è vuota
     */
    public static String require(String key) {
        String v = get(key);
        if (v == null || v.isBlank()) {
            LOG.error("Missing required configuration key '{}'", key);
            throw FlexException.of(FlexException.Code.CONFIG, "Missing required config: " + key, "key", key);
        }
        return v;
    }

    /** Boolean helper: true se "true"/"1"/"yes" (case-insensitive). */
    public static boolean getBool(String key, boolean defaultValue) {
        String v = get(key);
        if (v == null || v.isBlank()) return defaultValue;
        v = v.trim().toLowerCase(Locale.ROOT);
        return v.equals("true") || v.equals("1") || v.equals("yes");
    }

    /** int helper */
    public static int getInt(String key, int defaultValue) {
        return getParsed(key, Integer::parseInt, defaultValue);
    }

    /** long helper */
    public static long getLong(String key, long defaultValue) {
        return getParsed(key, Long::parseLong, defaultValue);
    }

    /** double helper */
    public static double getDouble(String key, double defaultValue) {
        return getParsed(key, Double::parseDouble, defaultValue);
    }

    /**
     * Insieme di valori separati da {@code ,} o {@code ;}, eventualmente tra {@code []}.
     * Gli elementi non convertibili vengono scartati con un warning; se non ne resta nessuno si usa il default.
     */
    public static <T> Set<T> getSetOf(String key, Function<String, T> parser, Set<T> defaultValue) {
        String raw = get(key);
        if (raw == null || raw.isBlank()) return defaultValue;

        String s = raw.trim();
        if (s.startsWith("[") && s.endsWith("]")) {
            s = s.substring(1, s.length() - 1);
        }

        Set<T> out = new LinkedHashSet<>();
        for (String part : s.split("[,;]")) {
            String token = part.trim();
            if (token.isEmpty()) continue;
            try {
                out.add(parser.apply(token));
            } catch (RuntimeException e) {
                LOG.warn("Unable to convert '{}' for key {}: {}", token, key, e.toString());
            }
        }
        return out.isEmpty() ? defaultValue : Collections.unmodifiableSet(out);
    }

    private static <T> T getParsed(String key, Function<String, T> parser, T defaultValue) {
        String v = get(key);
        if (v == null || v.isBlank()) return defaultValue;
        try {
            return parser.apply(v.trim());
        } catch (NumberFormatException nfe) {
            LOG.error("Unable to parse {}='{}', using default {}", key, v, defaultValue);
            return defaultValue;
        }
    }

    private static Map<String, String> loadDotenv(Path path) {
        Map<String, String> map = new HashMap<>();
        if (!Files.exists(path)) {
            LOG.debug(".env not found at {}", path.toAbsolutePath());
            return map;
        }
        try (BufferedReader br = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            String line;
            while ((line = br.readLine()) != null) {
                String trimmed = line.trim();
                if (trimmed.isEmpty() || trimmed.startsWith("#")) continue;
                int eq = trimmed.indexOf('=');
                if (eq <= 0) continue; // righe senza '=' o con chiave vuota
                String key = trimmed.substring(0, eq).trim();
                String val = trimmed.substring(eq + 1).trim();

                // Rimuove eventuali virgolette esterne
                if (val.length() >= 2
                        && ((val.startsWith("\"") && val.endsWith("\"")) || (val.startsWith("'") && val.endsWith("'")))) {
                    val = val.substring(1, val.length() - 1);
                }
                map.put(key, val);
            }
            LOG.info(".env loaded with {} entries from {}", map.size(), path.toAbsolutePath());
        } catch (IOException e) {
            LOG.warn("Error reading .env at {}: {}", path.toAbsolutePath(), e.getMessage(), e);
        }
        return map;
    }
}
