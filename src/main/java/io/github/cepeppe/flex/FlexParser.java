package io.github.cepeppe.flex;

import io.github.cepeppe.flex.assembler.FlexAssembler;
import io.github.cepeppe.flex.assembler.FlexParseResult;
import io.github.cepeppe.flex.assembler.ParseOptions;
import io.github.cepeppe.flex.exception.FlexException;
import io.github.cepeppe.flex.logging.FlexLogger;
import io.github.cepeppe.flex.schema.SchemaRegistry;
import io.github.cepeppe.flex.xml.XmlNode;
import io.github.cepeppe.flex.xml.XmlTreeReader;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.StringReader;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;
import java.util.function.Supplier;

/**
 * Punto d'ingresso del parsing di uno statement Flex.
 *
 * <pre>{@code
 * FlexParseResult result = FlexParser.parse(Path.of("statement.xml"));
 * for (Trade t : result.response().statements().get(0).trades()) { ... }
 * }</pre>
 *
 * Ogni chiamata è indipendente e sincrona; chiamate concorrenti su documenti diversi sono sicure
 * (registry e tabelle di codici sono immutabili e condivisi).
 */
public final class FlexParser {

    private static final FlexLogger LOG = FlexLogger.getLogger(FlexParser.class);

    private FlexParser() {
    }

    public static FlexParseResult parse(Path file) {
        return parse(file, ParseOptions.defaults());
    }

    public static FlexParseResult parse(Path file, ParseOptions options) {
        Objects.requireNonNull(file, "file");
        try (InputStream in = Files.newInputStream(file)) {
            return parse(in, options);
        } catch (IOException e) {
            LOG.error("Cannot read {}: {}", file, e.getMessage());
            throw FlexException.wrap(e, FlexException.Code.IO, "Cannot read " + file, "file", file.toString());
        }
    }

    public static FlexParseResult parse(String xml) {
        return parse(xml, ParseOptions.defaults());
    }

    /**
     * Parsing di un documento già decodificato in caratteri: l'{@code encoding} dichiarato nel prolog
     * non si applica. Per byte grezzi usare {@link #parse(byte[], ParseOptions)}.
     */
    public static FlexParseResult parse(String xml, ParseOptions options) {
        Objects.requireNonNull(xml, "xml");
        Objects.requireNonNull(options, "options");
        return run(() -> new XmlTreeReader().read(new StringReader(xml)), options);
    }

    public static FlexParseResult parse(byte[] xml) {
        return parse(xml, ParseOptions.defaults());
    }

    public static FlexParseResult parse(byte[] xml, ParseOptions options) {
        Objects.requireNonNull(xml, "xml");
        return parse(new ByteArrayInputStream(xml), options);
    }

    public static FlexParseResult parse(InputStream in) {
        return parse(in, ParseOptions.defaults());
    }

    /**
     * Parsing completo di un documento: tutto o niente.
     *
     * @param in      stream del documento (non viene chiuso)
     * @param options opzioni del parsing
     * @return grafo tipizzato con le diagnostiche non fatali
     * @throws FlexException (sottoclassi di {@code FlexParseException}) alla prima condizione fatale
     */
    public static FlexParseResult parse(InputStream in, ParseOptions options) {
        Objects.requireNonNull(in, "in");
        Objects.requireNonNull(options, "options");
        return run(() -> new XmlTreeReader().read(in), options);
    }

    private static FlexParseResult run(Supplier<XmlNode> tree, ParseOptions options) {
        long t0 = System.nanoTime();
        try {
            XmlNode root = tree.get();
            FlexParseResult result = FlexAssembler.assemble(root, SchemaRegistry.getInstance(), options);
            LOG.info("Flex statement parsed: query={}, statements={}, diagnostics={}, elapsedMs={}",
                    result.response().queryName(),
                    result.response().statements().size(),
                    result.diagnostics().size(),
                    (System.nanoTime() - t0) / 1_000_000);
            return result;
        } catch (FlexException e) {
            LOG.error("Flex statement parse failed [{}]: {}", e.getCode(), e.getMessage());
            throw e;
        }
    }
}
