package io.github.cepeppe.flex.coercion;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.AppenderBase;
import io.github.cepeppe.flex.codes.BuySell;
import io.github.cepeppe.flex.codes.Code;
import io.github.cepeppe.flex.codes.FlexCode;
import io.github.cepeppe.flex.exception.AmbiguousDateException;
import io.github.cepeppe.flex.exception.CoercionException;
import io.github.cepeppe.flex.exception.FlexException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Test del motore di coercion.
 *
 * Copre:
 * - scalari: decimali esatti (scala conservata, separatore migliaia), interi, booleani Y/N, testo;
 * - date nelle quattro modalità (ISO, LEGACY, DAY_FIRST, AUTO) e la gestione delle date ambigue;
 * - ore e date-ora con i separatori standard e quello configurato;
 * - codici singoli e liste di codici, incluse le "code run" legacy.
 */
class FlexCoercerTest {

    private static final String PATH = "FlexQueryResponse/FlexStatements/FlexStatement[0]/Trades/Trade[0]@x";

    private static FlexCoercer coercer(DateMode mode) {
        return new FlexCoercer(CoercionOptions.builder().dateMode(mode).build());
    }

    private final FlexCoercer defaults = new FlexCoercer(CoercionOptions.defaults());

    // -----------------------------------------------------------------------------------------------------------------
    // Scalari
    // -----------------------------------------------------------------------------------------------------------------
    @Nested
    @DisplayName("Scalari")
    class Scalars {

        @Test
        @DisplayName("Decimale: valore esatto con scala del sorgente conservata")
        void decimal_keepsScale() {
            BigDecimal v = defaults.decimal("368.80", PATH);
            assertEquals(new BigDecimal("368.80"), v);
            assertEquals(2, v.scale());
            assertEquals(0, new BigDecimal("368.8").compareTo(v));
        }

        @Test
        @DisplayName("Decimale: 0.1 resta esattamente 0.1 (nessun passaggio da double)")
        void decimal_noBinaryRounding() {
            assertEquals("0.1", defaults.decimal("0.1", PATH).toPlainString());
            assertEquals("-0.00001", defaults.decimal("-0.00001", PATH).toPlainString());
        }

        @Test
        @DisplayName("Decimale: separatore delle migliaia rimosso")
        void decimal_thousandsSeparator() {
            assertEquals(new BigDecimal("1234567.89"), defaults.decimal("1,234,567.89", PATH));
        }

        @Test
        @DisplayName("Decimale: vuoto o solo spazi → null")
        void decimal_emptyIsNull() {
            assertNull(defaults.decimal("", PATH));
            assertNull(defaults.decimal("   ", PATH));
            assertNull(defaults.decimal(null, PATH));
        }

        @Test
        @DisplayName("Decimale: testo non numerico → CoercionException con valore grezzo e tipo")
        void decimal_invalid() {
            CoercionException ex = assertThrows(CoercionException.class, () -> defaults.decimal("abc", PATH));
            assertEquals("abc", ex.getRawValue());
            assertEquals(FieldType.DECIMAL, ex.getTargetType());
            assertEquals(PATH, ex.getPath());
            assertEquals(FlexException.Code.COERCION, ex.getCode());
        }

        @Test
        @DisplayName("Decimale: sole virgole → CoercionException")
        void decimal_onlyCommas() {
            assertThrows(CoercionException.class, () -> defaults.decimal(",,", PATH));
        }

        @Test
        @DisplayName("Intero: base 10, spazi esterni ignorati, decimali rifiutati")
        void integer_rules() {
            assertEquals(42, defaults.integer("42", PATH));
            assertEquals(-7, defaults.integer(" -7 ", PATH));
            assertNull(defaults.integer("", PATH));
            assertThrows(CoercionException.class, () -> defaults.integer("4.2", PATH));
        }

        @Test
        @DisplayName("Booleano: solo Y/N")
        void bool_rules() {
            assertEquals(Boolean.TRUE, defaults.bool("Y", PATH));
            assertEquals(Boolean.FALSE, defaults.bool("N", PATH));
            assertNull(defaults.bool("", PATH));
            CoercionException ex = assertThrows(CoercionException.class, () -> defaults.bool("y", PATH));
            assertEquals(FieldType.BOOLEAN, ex.getTargetType());
        }

        @Test
        @DisplayName("Testo: trim di default, vuoto → null")
        void text_trimmed() {
            assertEquals("Jane Doe", defaults.text("  Jane Doe "));
            assertNull(defaults.text(""));
            assertNull(defaults.text("   "));
        }

        @Test
        @DisplayName("Testo: con trimText=false gli spazi sono conservati")
        void text_untrimmed() {
            FlexCoercer raw = new FlexCoercer(CoercionOptions.builder().trimText(false).build());
            assertEquals(" VXX ", raw.text(" VXX "));
            assertEquals("  ", raw.text("  "));
            assertNull(raw.text(""));
        }
    }

    // -----------------------------------------------------------------------------------------------------------------
    // Date
    // -----------------------------------------------------------------------------------------------------------------
    @Nested
    @DisplayName("Date")
    class Dates {

        @Test
        @DisplayName("yyyy-MM-dd e yyyyMMdd accettate in ogni modalità")
        void unambiguousFormats() {
            for (DateMode mode : DateMode.values()) {
                assertEquals(LocalDate.of(2017, 6, 5), coercer(mode).date("2017-06-05", PATH), mode.name());
                assertEquals(LocalDate.of(2017, 6, 5), coercer(mode).date("20170605", PATH), mode.name());
            }
        }

        @Test
        @DisplayName("dd-MMM-yy: anni > 68 nel 1900, altrimenti nel 2000")
        void monthNameFormat() {
            assertEquals(LocalDate.of(1997, 7, 13), defaults.date("13-JUL-97", PATH));
            assertEquals(LocalDate.of(2015, 1, 1), defaults.date("01-Jan-15", PATH));
            assertThrows(CoercionException.class, () -> defaults.date("01-XYZ-15", PATH));
        }

        @Test
        @DisplayName("AUTO: 05/06/2017 è ambigua → AmbiguousDateException")
        void auto_ambiguous() {
            AmbiguousDateException ex = assertThrows(AmbiguousDateException.class,
                    () -> coercer(DateMode.AUTO).date("05/06/2017", PATH));
            assertEquals(DateMode.AUTO, ex.getMode());
            assertEquals(FlexException.Code.AMBIGUOUS_DATE, ex.getCode());
            assertEquals("05/06/2017", ex.getRawValue());
        }

        @Test
        @DisplayName("AUTO: un gruppo > 12 rende l'ordine deducibile")
        void auto_deducible() {
            FlexCoercer auto = coercer(DateMode.AUTO);
            assertEquals(LocalDate.of(2017, 6, 25), auto.date("25/06/2017", PATH));
            assertEquals(LocalDate.of(2017, 6, 25), auto.date("06/25/2017", PATH));
            assertEquals(LocalDate.of(2017, 6, 6), auto.date("06/06/2017", PATH));
        }

        @Test
        @DisplayName("AUTO: nessun gruppo valido come mese → CoercionException (non ambigua)")
        void auto_noValidMonth() {
            CoercionException ex = assertThrows(CoercionException.class,
                    () -> coercer(DateMode.AUTO).date("13/14/2017", PATH));
            assertFalse(ex instanceof AmbiguousDateException);
        }

        @Test
        @DisplayName("LEGACY: sempre MM/dd, 25/06/2017 rifiutata")
        void legacy() {
            FlexCoercer legacy = coercer(DateMode.LEGACY);
            assertEquals(LocalDate.of(2017, 5, 6), legacy.date("05/06/2017", PATH));
            assertEquals(LocalDate.of(2017, 5, 6), legacy.date("05/06/17", PATH));
            assertThrows(CoercionException.class, () -> legacy.date("25/06/2017", PATH));
        }

        @Test
        @DisplayName("DAY_FIRST: sempre dd/MM, 25/06/2017 accettata")
        void dayFirst() {
            FlexCoercer dayFirst = coercer(DateMode.DAY_FIRST);
            assertEquals(LocalDate.of(2017, 6, 25), dayFirst.date("25/06/2017", PATH));
            assertEquals(LocalDate.of(2017, 6, 5), dayFirst.date("05/06/2017", PATH));
        }

        @Test
        @DisplayName("ISO: le date con slash sono rifiutate")
        void iso_rejectsSlash() {
            CoercionException ex = assertThrows(CoercionException.class,
                    () -> coercer(DateMode.ISO).date("25/06/2017", PATH));
            assertFalse(ex instanceof AmbiguousDateException);
        }

        @Test
        @DisplayName("Date di calendario impossibili → CoercionException")
        void impossibleDate() {
            assertThrows(CoercionException.class, () -> defaults.date("2017-02-30", PATH));
            assertThrows(CoercionException.class, () -> defaults.date("2017/06/05", PATH));
        }
    }

    // -----------------------------------------------------------------------------------------------------------------
    // Fallback su date ambigue (strictAmbiguity=false)
    // -----------------------------------------------------------------------------------------------------------------
    @Nested
    @DisplayName("Date ambigue con strictAmbiguity disabilitato")
    class AmbiguityFallback {

        private Logger grammarLogger;
        private CapturingAppender appender;

        @BeforeEach
        void attachAppender() {
            LoggerContext ctx = (LoggerContext) LoggerFactory.getILoggerFactory();
            grammarLogger = (Logger) LoggerFactory.getLogger(DateGrammar.class);
            appender = new CapturingAppender();
            appender.setContext(ctx);
            appender.start();
            grammarLogger.addAppender(appender);
        }

        @AfterEach
        void detachAppender() {
            grammarLogger.detachAppender(appender);
            appender.stop();
        }

        @Test
        @DisplayName("Letta MM/dd con un WARN")
        void fallbackMonthFirstWithWarning() {
            FlexCoercer lenient = new FlexCoercer(CoercionOptions.builder()
                    .dateMode(DateMode.AUTO)
                    .strictAmbiguity(false)
                    .build());

            assertEquals(LocalDate.of(2017, 5, 6), lenient.date("05/06/2017", PATH));

            assertEquals(1, appender.events.size());
            ILoggingEvent event = appender.events.get(0);
            assertEquals(Level.WARN, event.getLevel());
            assertTrue(event.getFormattedMessage().contains("05/06/2017"));
        }
    }

    /** Appender che memorizza gli eventi ricevuti. */
    private static class CapturingAppender extends AppenderBase<ILoggingEvent> {
        private final List<ILoggingEvent> events = new ArrayList<>();

        @Override
        protected void append(ILoggingEvent event) {
            events.add(event);
        }
    }

    // -----------------------------------------------------------------------------------------------------------------
    // Ore e date-ora
    // -----------------------------------------------------------------------------------------------------------------
    @Nested
    @DisplayName("Ore e date-ora")
    class Times {

        @Test
        @DisplayName("Ora: HH:mm:ss e HHmmss")
        void time_formats() {
            assertEquals(LocalTime.of(16, 20, 0), defaults.time("16:20:00", PATH));
            assertEquals(LocalTime.of(15, 1, 13), defaults.time("150113", PATH));
            assertThrows(CoercionException.class, () -> defaults.time("25:00:00", PATH));
            assertThrows(CoercionException.class, () -> defaults.time("16:20", PATH));
        }

        @Test
        @DisplayName("Date-ora: separatori ';', ',', spazio e nessun separatore")
        void dateTime_standardSeparators() {
            LocalDateTime expected = LocalDateTime.of(2017, 6, 5, 16, 20, 0);
            assertEquals(expected, defaults.dateTime("20170605;162000", PATH));
            assertEquals(expected, defaults.dateTime("2017-06-05, 16:20:00", PATH));
            assertEquals(expected, defaults.dateTime("2017-06-05 16:20:00", PATH));
            assertEquals(expected, defaults.dateTime("20170605162000", PATH));
            assertEquals(expected, defaults.dateTime("2017-06-0516:20:00", PATH));
        }

        @Test
        @DisplayName("Date-ora: separatore configurato provato per primo")
        void dateTime_configuredSeparator() {
            FlexCoercer pipe = new FlexCoercer(CoercionOptions.builder().dateTimeSeparator('|').build());
            assertEquals(LocalDateTime.of(2017, 6, 5, 16, 20, 0), pipe.dateTime("20170605|162000", PATH));
            assertEquals(LocalDateTime.of(2017, 6, 5, 16, 20, 0), pipe.dateTime("20170605;162000", PATH));
        }

        @Test
        @DisplayName("Date-ora: valore corto è solo data (mezzanotte)")
        void dateTime_dateOnly() {
            assertEquals(LocalDateTime.of(2017, 5, 5, 0, 0), defaults.dateTime("20170505", PATH));
            assertEquals(LocalDateTime.of(2017, 5, 5, 0, 0), defaults.dateTime("2017-05-05", PATH));
        }

        @Test
        @DisplayName("Date-ora: formato non riconosciuto → CoercionException")
        void dateTime_invalid() {
            CoercionException ex = assertThrows(CoercionException.class,
                    () -> defaults.dateTime("2017-06-05T16:20:00", PATH));
            assertEquals(FieldType.DATE_TIME, ex.getTargetType());
        }

        @Test
        @DisplayName("Date-ora: data ambigua propagata come AmbiguousDateException")
        void dateTime_ambiguousDate() {
            assertThrows(AmbiguousDateException.class, () -> defaults.dateTime("05/06/2017;16:20:00", PATH));
        }
    }

    // -----------------------------------------------------------------------------------------------------------------
    // Codici
    // -----------------------------------------------------------------------------------------------------------------
    @Nested
    @DisplayName("Codici")
    class Codes {

        @Test
        @DisplayName("Codice noto: confronto esatto sul testo del documento")
        void code_known() {
            FlexCode<BuySell> buy = defaults.code(BuySell.class, "BUY");
            assertTrue(buy.is(BuySell.BUY));
            assertEquals(BuySell.CANCEL_BUY, defaults.code(BuySell.class, "BUY (Ca.)").known().orElseThrow());
        }

        @Test
        @DisplayName("Codice sconosciuto: variante Unrecognized con il testo grezzo")
        void code_unknown() {
            FlexCode<BuySell> code = defaults.code(BuySell.class, "buy");
            assertFalse(code.isKnown());
            assertEquals("buy", code.raw());
            assertEquals(BuySell.SELL, code.orElse(BuySell.SELL));
        }

        @Test
        @DisplayName("Codice vuoto → null")
        void code_empty() {
            assertNull(defaults.code(BuySell.class, " "));
        }

        @Test
        @DisplayName("Lista: token trimmati, vuoti scartati, ordine e duplicati conservati")
        void codeList_tokens() {
            List<FlexCode<Code>> codes = defaults.codeList(Code.class, " P ;; ML ;P");
            assertEquals(3, codes.size());
            assertTrue(codes.get(0).is(Code.PARTIAL));
            assertTrue(codes.get(1).is(Code.MAX_LOSS));
            assertTrue(codes.get(2).is(Code.PARTIAL));
        }

        @Test
        @DisplayName("Lista: vuota → lista vuota immutabile")
        void codeList_empty() {
            List<FlexCode<Code>> codes = defaults.codeList(Code.class, "");
            assertTrue(codes.isEmpty());
            assertThrows(UnsupportedOperationException.class, () -> codes.add(FlexCode.of(Code.OPENING)));
        }

        @Test
        @DisplayName("Lista: un token sconosciuto non invalida gli altri")
        void codeList_unknownToken() {
            List<FlexCode<Code>> codes = defaults.codeList(Code.class, "O;ZZ");
            assertTrue(codes.get(0).is(Code.OPENING));
            assertFalse(codes.get(1).isKnown());
            assertEquals("ZZ", codes.get(1).raw());
        }

        @Test
        @DisplayName("Lista: code run legacy spezzata carattere per carattere solo se abilitata")
        void codeList_legacyRuns() {
            FlexCoercer legacy = new FlexCoercer(CoercionOptions.builder().legacyCodeRuns(true).build());

            List<FlexCode<Code>> split = legacy.codeList(Code.class, "OP");
            assertEquals(2, split.size());
            assertTrue(split.get(0).is(Code.OPENING));
            assertTrue(split.get(1).is(Code.PARTIAL));

            // un codice noto di più caratteri non viene spezzato
            List<FlexCode<Code>> whole = legacy.codeList(Code.class, "Ca");
            assertEquals(1, whole.size());
            assertTrue(whole.get(0).is(Code.CANCEL));

            // un carattere non noto: nessuno split
            assertEquals(1, legacy.codeList(Code.class, "OX").size());

            // disabilitata: "OP" è un unico codice sconosciuto
            List<FlexCode<Code>> off = defaults.codeList(Code.class, "OP");
            assertEquals(1, off.size());
            assertFalse(off.get(0).isKnown());
        }

        @Test
        @DisplayName("coerce(): lista di codici con separatore dichiarato nel Target")
        void coerce_customSeparator() {
            Object value = defaults.coerce("P,ML", Target.codeList(Code.class, ","), PATH);
            assertEquals(List.of(FlexCode.of(Code.PARTIAL), FlexCode.of(Code.MAX_LOSS)), value);
        }

        @Test
        @DisplayName("Target: CODE senza tabella rifiutato")
        void target_validation() {
            assertThrows(IllegalArgumentException.class, () -> new Target(FieldType.CODE, null, null));
            assertThrows(IllegalArgumentException.class, () -> Target.codeList(Code.class, ""));
        }
    }
}
