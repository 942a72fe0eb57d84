package io.github.cepeppe.flex;

import io.github.cepeppe.flex.assembler.ParseOptions;
import io.github.cepeppe.flex.client.FlexClientConfig;
import io.github.cepeppe.flex.coercion.CoercionOptions;
import io.github.cepeppe.flex.coercion.DateMode;
import io.github.cepeppe.flex.exception.FlexException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Test della lettura della configurazione tramite System property (prima fonte di {@link Env}).
 * Le chiavi impostate vengono rimosse dopo ogni test.
 */
class EnvTest {

    private final List<String> keys = new ArrayList<>();

    private void set(String key, String value) {
        keys.add(key);
        System.setProperty(key, value);
    }

    @AfterEach
    void clear() {
        keys.forEach(System::clearProperty);
    }

    @Nested
    @DisplayName("Helper tipizzati")
    class Helpers {

        @Test
        @DisplayName("get/getOr/getOrDefault: chiave assente, blank, valorizzata")
        void strings() {
            assertNull(Env.get("flex.test.absent"));
            assertEquals("d", Env.getOrDefault("flex.test.absent", "d"));

            set("flex.test.blank", "  ");
            assertEquals("  ", Env.getOrDefault("flex.test.blank", "d"));
            assertEquals("d", Env.getOr("flex.test.blank", "d"));

            set("flex.test.value", "x");
            assertEquals("x", Env.get("flex.test.value"));
        }

        @Test
        @DisplayName("getBool: true/1/yes, altrimenti false; default se assente")
        void booleans() {
            set("flex.test.b1", "YES");
            set("flex.test.b2", "1");
            set("flex.test.b3", "nope");
            assertTrue(Env.getBool("flex.test.b1", false));
            assertTrue(Env.getBool("flex.test.b2", false));
            assertFalse(Env.getBool("flex.test.b3", true));
            assertTrue(Env.getBool("flex.test.absent", true));
        }

        @Test
        @DisplayName("Numeri non validi → default")
        void numbers() {
            set("flex.test.n", " 42 ");
            set("flex.test.bad", "forty-two");
            assertEquals(42, Env.getInt("flex.test.n", 0));
            assertEquals(42L, Env.getLong("flex.test.n", 0L));
            assertEquals(7, Env.getInt("flex.test.bad", 7));
            assertEquals(0.5d, Env.getDouble("flex.test.bad", 0.5d));
        }

        @Test
        @DisplayName("getSetOf: separatori ',' e ';', parentesi quadre, elementi non validi scartati")
        void sets() {
            set("flex.test.set", "[429, 500;x, 503]");
            assertEquals(Set.of(429, 500, 503), Env.getSetOf("flex.test.set", Integer::valueOf, Set.of()));

            set("flex.test.set.bad", "x;y");
            assertEquals(Set.of(1), Env.getSetOf("flex.test.set.bad", Integer::valueOf, Set.of(1)));
        }

        @Test
        @DisplayName("require: chiave mancante → CONFIG")
        void require() {
            FlexException ex = assertThrows(FlexException.class, () -> Env.require("flex.test.absent"));
            assertEquals(FlexException.Code.CONFIG, ex.getCode());
            assertEquals("flex.test.absent", ex.getContext().get("key"));
        }
    }

    @Nested
    @DisplayName("Opzioni lette dall'ambiente")
    class Options {

        @Test
        @DisplayName("ParseOptions e CoercionOptions da chiavi FLEX_*")
        void parseOptions() {
            set(Constants.Parsing.KEY_STRICT, "true");
            set(Constants.Parsing.KEY_DATE_MODE, "day_first");
            set(Constants.Parsing.KEY_DATETIME_SEPARATOR, "|");
            set(Constants.Parsing.KEY_LEGACY_CODE_RUNS, "yes");

            ParseOptions options = ParseOptions.fromEnvOrDefault();
            assertTrue(options.isStrict());
            assertFalse(options.isPermissive());
            assertEquals(DateMode.DAY_FIRST, options.getCoercion().getDateMode());
            assertEquals('|', options.getCoercion().getDateTimeSeparator());
            assertTrue(options.getCoercion().isLegacyCodeRuns());
            assertTrue(options.getCoercion().isTrimText());
        }

        @Test
        @DisplayName("Modalità data o separatore non validi → CONFIG")
        void invalidCoercionOptions() {
            set(Constants.Parsing.KEY_DATE_MODE, "sideways");
            FlexException mode = assertThrows(FlexException.class, CoercionOptions::fromEnvOrDefault);
            assertEquals(FlexException.Code.CONFIG, mode.getCode());

            set(Constants.Parsing.KEY_DATE_MODE, "ISO");
            set(Constants.Parsing.KEY_DATETIME_SEPARATOR, ";;");
            FlexException sep = assertThrows(FlexException.class, CoercionOptions::fromEnvOrDefault);
            assertEquals(FlexException.Code.CONFIG, sep.getCode());
        }

        @Test
        @DisplayName("FlexClientConfig.fromEnv(): chiavi obbligatorie e valori numerici")
        void clientConfig() {
            set(Constants.FlexService.KEY_TOKEN, "tok");
            set(Constants.FlexService.KEY_QUERY_ID, "123456");
            set(Constants.FlexService.KEY_MAX_POLLS, "5");

            FlexClientConfig cfg = FlexClientConfig.fromEnv();
            assertEquals("tok", cfg.getToken());
            assertEquals("123456", cfg.getQueryId());
            assertEquals(5, cfg.getMaxPolls());
            assertEquals(Constants.FlexService.DEFAULT_POLL_INTERVAL_MS, cfg.getPollIntervalMs());
        }
    }
}
