package io.github.cepeppe.flex.cli;

import io.github.cepeppe.flex.Constants;
import io.github.cepeppe.flex.Env;
import io.github.cepeppe.flex.FlexParser;
import io.github.cepeppe.flex.assembler.FlexParseResult;
import io.github.cepeppe.flex.assembler.ParseOptions;
import io.github.cepeppe.flex.client.FlexClient;
import io.github.cepeppe.flex.client.FlexClientConfig;
import io.github.cepeppe.flex.coercion.CoercionOptions;
import io.github.cepeppe.flex.coercion.DateMode;
import io.github.cepeppe.flex.exception.FlexException;
import io.github.cepeppe.flex.json.JsonCodec;
import io.github.cepeppe.flex.logging.FlexLogger;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.Locale;
import java.util.function.Function;

/**
 * Riga di comando.
 *
 * <pre>
 * flex-statement fetch  --token T --query Q [--raw|--json] [--out FILE]
 * flex-statement parse  FILE [--date-mode ISO|LEGACY|DAY_FIRST|AUTO] [--strict] [--permissive]
 * </pre>
 *
 * Exit code: {@code 0} successo, {@code 1} errore di download, di parsing o di scrittura,
 * {@code 2} uso errato o configurazione non valida.
 * Token e query id, se non passati, sono letti da {@code FLEX_TOKEN} e {@code FLEX_QUERY_ID};
 * URL e parametri di polling dalle altre chiavi {@code FLEX_*} (vedi {@link FlexClientConfig#builderFromEnv()}).
 */
public final class FlexCli {

    private static final FlexLogger LOG = FlexLogger.getLogger(FlexCli.class);

    public static final int EXIT_OK = 0;
    public static final int EXIT_ERROR = 1;
    public static final int EXIT_USAGE = 2;

    static final String USAGE = String.join(System.lineSeparator(),
            "Usage:",
            "  flex-statement fetch  --token T --query Q [--raw|--json] [--out FILE]",
            "  flex-statement parse  FILE [--date-mode ISO|LEGACY|DAY_FIRST|AUTO] [--strict] [--permissive]");

    private final Function<FlexClientConfig, FlexClient> clientFactory;

    public FlexCli() {
        this(FlexClient::new);
    }

    FlexCli(Function<FlexClientConfig, FlexClient> clientFactory) {
        this.clientFactory = clientFactory;
    }

    public static void main(String[] args) {
        int code = new FlexCli().run(args, System.out, System.err);
        System.exit(code);
    }

    /**
     * Esegue un comando.
     *
     * @return exit code del processo
     */
    public int run(String[] args, PrintStream out, PrintStream err) {
        if (args == null || args.length == 0) {
            err.println(USAGE);
            return EXIT_USAGE;
        }
        try {
            switch (args[0]) {
                case "fetch":
                    return fetch(tail(args), out);
                case "parse":
                    return parse(tail(args), out);
                case "-h":
                case "--help":
                    out.println(USAGE);
                    return EXIT_OK;
                default:
                    throw new UsageException("Unknown command '" + args[0] + "'");
            }
        } catch (UsageException e) {
            err.println(e.getMessage());
            err.println(USAGE);
            return EXIT_USAGE;
        } catch (FlexException e) {
            err.println("Error [" + e.getCode() + "]: " + e.getMessage());
            return EXIT_ERROR;
        } catch (IllegalArgumentException e) {
            // configurazione non valida o path di output non utilizzabile
            LOG.debug("Invalid CLI input", e);
            err.println("Invalid configuration: " + e.getMessage());
            return EXIT_USAGE;
        }
    }

    /* =======================
       fetch
       ======================= */

    private int fetch(String[] args, PrintStream out) {
        String token = null;
        String query = null;
        String outFile = null;
        boolean json = false;

        for (int i = 0; i < args.length; i++) {
            switch (args[i]) {
                case "--token":
                    token = value(args, ++i, "--token");
                    break;
                case "--query":
                    query = value(args, ++i, "--query");
                    break;
                case "--out":
                    outFile = value(args, ++i, "--out");
                    break;
                case "--raw":
                    json = false;
                    break;
                case "--json":
                    json = true;
                    break;
                default:
                    throw new UsageException("Unknown option '" + args[i] + "' for fetch");
            }
        }
        if (token == null) token = Env.get(Constants.FlexService.KEY_TOKEN);
        if (query == null) query = Env.get(Constants.FlexService.KEY_QUERY_ID);
        if (token == null || token.isBlank() || query == null || query.isBlank()) {
            throw new UsageException("fetch requires --token and --query");
        }

        Path target = outFile == null ? null : Path.of(outFile);
        FlexClientConfig config = FlexClientConfig.builderFromEnv()
                .token(token)
                .queryId(query)
                .build()
                .validate();
        LOG.debug("fetch with {}", config);
        FlexClient client = clientFactory.apply(config);

        byte[] xml = client.fetchRaw();
        byte[] rendered = json
                ? JsonCodec.toPrettyJson(FlexParser.parse(xml, ParseOptions.fromEnvOrDefault()))
                        .getBytes(StandardCharsets.UTF_8)
                : xml;
        write(rendered, target, out);
        return EXIT_OK;
    }

    /* =======================
       parse
       ======================= */

    private int parse(String[] args, PrintStream out) {
        String file = null;
        ParseOptions base = ParseOptions.fromEnvOrDefault();
        ParseOptions.ParseOptionsBuilder options = base.toBuilder();
        CoercionOptions.CoercionOptionsBuilder coercion = base.getCoercion().toBuilder();

        for (int i = 0; i < args.length; i++) {
            String a = args[i];
            switch (a) {
                case "--date-mode":
                    coercion.dateMode(dateMode(value(args, ++i, "--date-mode")));
                    break;
                case "--strict":
                    options.strict(true);
                    break;
                case "--permissive":
                    options.permissive(true);
                    break;
                default:
                    if (a.startsWith("--")) {
                        throw new UsageException("Unknown option '" + a + "' for parse");
                    }
                    if (file != null) {
                        throw new UsageException("parse accepts a single FILE");
                    }
                    file = a;
            }
        }
        if (file == null) {
            throw new UsageException("parse requires a FILE");
        }

        FlexParseResult result = FlexParser.parse(Path.of(file), options.coercion(coercion.build()).build());
        out.println(JsonCodec.toPrettyJson(result));
        return EXIT_OK;
    }

    /* =======================
       Helper
       ======================= */

    private static DateMode dateMode(String raw) {
        try {
            return DateMode.valueOf(raw.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new UsageException("Invalid --date-mode '" + raw + "'");
        }
    }

    private static String value(String[] args, int i, String option) {
        if (i >= args.length || args[i].startsWith("--")) {
            throw new UsageException(option + " requires a value");
        }
        return args[i];
    }

    private static String[] tail(String[] args) {
        return Arrays.copyOfRange(args, 1, args.length);
    }

    private static void write(byte[] content, Path target, PrintStream out) {
        if (target == null) {
            out.write(content, 0, content.length);
            out.println();
            return;
        }
        try {
            Files.write(target, content);
            LOG.info("Written {} bytes to {}", content.length, target.toAbsolutePath());
        } catch (IOException e) {
            throw FlexException.wrap(e, FlexException.Code.IO, "Cannot write " + target, "file", target.toString());
        }
    }

    /** Errore di sintassi della riga di comando (exit code 2). */
    static final class UsageException extends RuntimeException {
        private static final long serialVersionUID = 1L;

        UsageException(String message) {
            super(message);
        }
    }
}
