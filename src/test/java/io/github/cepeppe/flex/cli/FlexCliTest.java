package io.github.cepeppe.flex.cli;

import com.fasterxml.jackson.databind.JsonNode;
import io.github.cepeppe.flex.Constants;
import io.github.cepeppe.flex.client.FlexClient;
import io.github.cepeppe.flex.client.FlexClientConfig;
import io.github.cepeppe.flex.exception.FlexRetrievalException;
import io.github.cepeppe.flex.json.JsonCodec;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

/**
 * Test della riga di comando: exit code, output su stdout/stderr, opzioni.
 * Il download è sostituito da un {@link FlexClient} mockato tramite la factory del costruttore.
 */
class FlexCliTest {

    private static final String STATEMENT = """
            <FlexQueryResponse queryName="Downloaded" type="AF">
              <FlexStatements count="1">
                <FlexStatement accountId="U123456" fromDate="20170501" toDate="20170531"/>
              </FlexStatements>
            </FlexQueryResponse>""";

    private final ByteArrayOutputStream outBytes = new ByteArrayOutputStream();
    private final ByteArrayOutputStream errBytes = new ByteArrayOutputStream();
    private final PrintStream out = new PrintStream(outBytes, true, StandardCharsets.UTF_8);
    private final PrintStream err = new PrintStream(errBytes, true, StandardCharsets.UTF_8);

    private final AtomicReference<FlexClientConfig> usedConfig = new AtomicReference<>();
    private FlexClient client;
    private FlexCli cli;

    @BeforeEach
    void setUp() {
        client = mock(FlexClient.class);
        cli = new FlexCli(cfg -> {
            usedConfig.set(cfg);
            return client;
        });
    }

    @AfterEach
    void clearProperties() {
        System.clearProperty(Constants.FlexService.KEY_TOKEN);
        System.clearProperty(Constants.FlexService.KEY_QUERY_ID);
        System.clearProperty(Constants.FlexService.KEY_API_VERSION);
        System.clearProperty(Constants.FlexService.KEY_POLL_INTERVAL_MS);
        System.clearProperty(Constants.FlexService.KEY_THROTTLE_INTERVAL_MS);
        System.clearProperty(Constants.FlexService.KEY_MAX_POLLS);
    }

    private int run(String... args) {
        return cli.run(args, out, err);
    }

    private String stdout() {
        return outBytes.toString(StandardCharsets.UTF_8);
    }

    private String stderr() {
        return errBytes.toString(StandardCharsets.UTF_8);
    }

    private static String fixture() throws Exception {
        return Paths.get(FlexCliTest.class.getResource("/fixtures/sample-statement.xml").toURI()).toString();
    }

    @Nested
    @DisplayName("Uso")
    class Usage {

        @Test
        @DisplayName("Senza argomenti → usage su stderr, exit 2")
        void noArgs() {
            assertEquals(FlexCli.EXIT_USAGE, run());
            assertTrue(stderr().contains("Usage:"));
            assertEquals("", stdout());
        }

        @Test
        @DisplayName("--help → usage su stdout, exit 0")
        void help() {
            assertEquals(FlexCli.EXIT_OK, run("--help"));
            assertTrue(stdout().contains("flex-statement parse"));
        }

        @Test
        @DisplayName("Comando sconosciuto → exit 2")
        void unknownCommand() {
            assertEquals(FlexCli.EXIT_USAGE, run("export"));
            assertTrue(stderr().contains("Unknown command 'export'"));
        }
    }

    @Nested
    @DisplayName("parse")
    class Parse {

        @Test
        @DisplayName("Statement di esempio → JSON del risultato su stdout")
        void parseFixture() throws Exception {
            assertEquals(FlexCli.EXIT_OK, run("parse", fixture()));

            JsonNode root = JsonCodec.mapper().readTree(stdout());
            assertEquals("Monthly activity", root.path("response").path("queryName").asText());
            JsonNode trades = root.path("response").path("statements").get(0).path("trades");
            assertEquals(3, trades.size());
            assertEquals("BUY", trades.get(0).path("buySell").asText());
            assertEquals(0, root.path("diagnostics").size());
        }

        @Test
        @DisplayName("--date-mode non valido → exit 2")
        void invalidDateMode() throws Exception {
            assertEquals(FlexCli.EXIT_USAGE, run("parse", fixture(), "--date-mode", "sideways"));
            assertTrue(stderr().contains("Invalid --date-mode 'sideways'"));
        }

        @Test
        @DisplayName("Opzione senza valore, opzione sconosciuta, FILE mancante o doppio → exit 2")
        void usageErrors() throws Exception {
            assertEquals(FlexCli.EXIT_USAGE, run("parse", fixture(), "--date-mode"));
            assertEquals(FlexCli.EXIT_USAGE, run("parse", fixture(), "--lenient"));
            assertEquals(FlexCli.EXIT_USAGE, run("parse"));
            assertEquals(FlexCli.EXIT_USAGE, run("parse", fixture(), fixture()));
        }

        @Test
        @DisplayName("File inesistente → exit 1 con codice IO")
        void missingFile(@TempDir Path dir) {
            assertEquals(FlexCli.EXIT_ERROR, run("parse", dir.resolve("missing.xml").toString()));
            assertTrue(stderr().contains("Error [IO]"));
        }

        @Test
        @DisplayName("--strict con una sezione sconosciuta → exit 1; senza --strict → diagnostica nel JSON")
        void strictFlag(@TempDir Path dir) throws Exception {
            Path file = dir.resolve("drift.xml");
            Files.writeString(file, STATEMENT.replace("toDate=\"20170531\"/>",
                    "toDate=\"20170531\"><FancyNewSection/></FlexStatement>"));

            assertEquals(FlexCli.EXIT_ERROR, run("parse", file.toString(), "--strict"));
            assertTrue(stderr().contains("Error [STRICT_MODE]"));

            assertEquals(FlexCli.EXIT_OK, run("parse", file.toString(), "--date-mode", "iso"));
            JsonNode diagnostics = JsonCodec.mapper().readTree(stdout()).path("diagnostics");
            assertEquals(1, diagnostics.size());
            assertEquals("UNMAPPED_ELEMENT", diagnostics.get(0).path("kind").asText());
        }
    }

    @Nested
    @DisplayName("fetch")
    class Fetch {

        @Test
        @DisplayName("XML grezzo su stdout; configurazione costruita dalle opzioni")
        void fetchRaw() {
            when(client.fetchRaw()).thenReturn(STATEMENT.getBytes(StandardCharsets.UTF_8));

            assertEquals(FlexCli.EXIT_OK, run("fetch", "--token", "tok", "--query", "123456"));

            assertEquals(STATEMENT, stdout().strip());
            assertEquals("tok", usedConfig.get().getToken());
            assertEquals("123456", usedConfig.get().getQueryId());
        }

        @Test
        @DisplayName("--json --out FILE → JSON del grafo scritto su file")
        void fetchJsonToFile(@TempDir Path dir) throws Exception {
            when(client.fetchRaw()).thenReturn(STATEMENT.getBytes(StandardCharsets.UTF_8));
            Path target = dir.resolve("statement.json");

            assertEquals(FlexCli.EXIT_OK, run("fetch", "--token", "tok", "--query", "1", "--json", "--out", target.toString()));

            JsonNode root = JsonCodec.mapper().readTree(Files.readString(target));
            assertEquals("Downloaded", root.path("response").path("queryName").asText());
            assertEquals("", stdout());
        }

        @Test
        @DisplayName("Token e query id da FLEX_TOKEN / FLEX_QUERY_ID")
        void credentialsFromEnv() {
            System.setProperty(Constants.FlexService.KEY_TOKEN, "env-token");
            System.setProperty(Constants.FlexService.KEY_QUERY_ID, "654321");
            when(client.fetchRaw()).thenReturn(STATEMENT.getBytes(StandardCharsets.UTF_8));

            assertEquals(FlexCli.EXIT_OK, run("fetch"));
            assertEquals("env-token", usedConfig.get().getToken());
            assertEquals("654321", usedConfig.get().getQueryId());
        }

        @Test
        @DisplayName("Versione API e parametri di polling da FLEX_*, token e query dalle opzioni")
        void pollingSettingsFromEnv() {
            System.setProperty(Constants.FlexService.KEY_MAX_POLLS, "2");
            System.setProperty(Constants.FlexService.KEY_POLL_INTERVAL_MS, "123");
            System.setProperty(Constants.FlexService.KEY_THROTTLE_INTERVAL_MS, "456");
            System.setProperty(Constants.FlexService.KEY_API_VERSION, "4");
            when(client.fetchRaw()).thenReturn(STATEMENT.getBytes(StandardCharsets.UTF_8));

            assertEquals(FlexCli.EXIT_OK, run("fetch", "--token", "T", "--query", "Q"));

            FlexClientConfig cfg = usedConfig.get();
            assertEquals("T", cfg.getToken());
            assertEquals("Q", cfg.getQueryId());
            assertEquals(2, cfg.getMaxPolls());
            assertEquals(123L, cfg.getPollIntervalMs());
            assertEquals(456L, cfg.getThrottleIntervalMs());
            assertEquals("4", cfg.getApiVersion());
            assertEquals(Constants.FlexService.DEFAULT_BASE_URL, cfg.getBaseUrl());
        }

        @Test
        @DisplayName("Statement ISO-8859-1: XML grezzo copiato byte per byte, JSON decodificato secondo il prolog")
        void nonUtf8Statement(@TempDir Path dir) throws Exception {
            byte[] latin1 = ("<?xml version=\"1.0\" encoding=\"ISO-8859-1\"?>\n"
                    + STATEMENT.replace("Downloaded", "Société")).getBytes(StandardCharsets.ISO_8859_1);
            when(client.fetchRaw()).thenReturn(latin1);
            Path raw = dir.resolve("statement.xml");
            Path json = dir.resolve("statement.json");

            assertEquals(FlexCli.EXIT_OK, run("fetch", "--token", "tok", "--query", "1", "--out", raw.toString()));
            assertEquals(FlexCli.EXIT_OK, run("fetch", "--token", "tok", "--query", "1", "--json", "--out", json.toString()));

            assertArrayEquals(latin1, Files.readAllBytes(raw));
            assertEquals("Société", JsonCodec.mapper().readTree(Files.readString(json))
                    .path("response").path("queryName").asText());
        }

        @Test
        @DisplayName("Configurazione non valida da FLEX_* → exit 2 con messaggio, nessun client creato")
        void invalidConfig() {
            System.setProperty(Constants.FlexService.KEY_MAX_POLLS, "0");

            assertEquals(FlexCli.EXIT_USAGE, run("fetch", "--token", "tok", "--query", "1"));

            assertTrue(stderr().startsWith("Invalid configuration: maxPolls"), stderr());
            assertNull(usedConfig.get());
        }

        @Test
        @DisplayName("Path di output non valido → exit 2 prima del download")
        void invalidOutputPath() {
            assertEquals(FlexCli.EXIT_USAGE, run("fetch", "--token", "tok", "--query", "1", "--out", "bad\0name"));

            assertTrue(stderr().startsWith("Invalid configuration:"), stderr());
            assertNull(usedConfig.get());
        }

        @Test
        @DisplayName("Token mancante → exit 2, nessun client creato")
        void missingToken() {
            System.setProperty(Constants.FlexService.KEY_TOKEN, "");
            assertEquals(FlexCli.EXIT_USAGE, run("fetch", "--query", "1"));
            assertNull(usedConfig.get());
        }

        @Test
        @DisplayName("Errore del servizio → exit 1 con il codice su stderr")
        void serviceError() {
            when(client.fetchRaw()).thenThrow(FlexRetrievalException.serviceError(1012, "Token has expired."));

            assertEquals(FlexCli.EXIT_ERROR, run("fetch", "--token", "tok", "--query", "1"));
            assertTrue(stderr().contains("Error [RETRIEVAL]"));
            assertTrue(stderr().contains("1012"));
        }
    }
}
